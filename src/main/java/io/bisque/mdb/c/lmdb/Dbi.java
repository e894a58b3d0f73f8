package io.bisque.mdb.c.lmdb;

import io.bisque.mdb.c.IntRef;
import io.bisque.mdb.c.Memory;
import java.util.Objects;
import org.agrona.MutableDirectBuffer;

/// A named keyspace within an [Env].
///
/// The handle is a small integer owned by the environment; it stays valid across transactions
/// once the transaction that opened it has committed. Closing it is optional.
public final class Dbi {
  final Env env;
  final String name;
  final int handle;
  final int flags;

  Dbi(Env env, String name, int handle, int flags) {
    this.env = env;
    this.name = name;
    this.handle = handle;
    this.flags = flags;
  }

  /// The unnamed main database.
  public static Dbi open(Txn txn) {
    return open(txn, null, 0);
  }

  public static Dbi open(Txn txn, String name) {
    return open(txn, name, 0);
  }

  /// Open a database in the environment.
  ///
  /// A database handle denotes the name and parameters of a database, independently of
  /// whether such a database exists. The handle may be discarded by calling [#close(Env)].
  /// The old database handle is returned if the database was already open.
  ///
  /// @param name The name of the database to open, or `null` for the main database.
  /// @param flags see [DbiFlags]
  /// @throws LMDBError Some possible errors are:
  ///
  ///   - #MDB_NOTFOUND - the specified database doesn't exist in the environment and
  ///     #MDB_CREATE was not specified.
  ///   - #MDB_DBS_FULL - too many databases have been opened. See #mdb_env_set_maxdbs().
  ///
  public static Dbi open(Txn txn, String name, int flags) {
    Objects.requireNonNull(txn);
    final var lib = txn.lib;
    final var txnHandle = txn.handle("mdb_dbi_open");
    try (final var ref = IntRef.allocate()) {
      Errors.check(lib, "mdb_dbi_open", lib.mdb_dbi_open(txnHandle, name, flags, ref.address()));
      return new Dbi(txn.env, name, ref.value(), flags);
    }
  }

  /// Raw `MDB_dbi`.
  public int handle() {
    return handle;
  }

  /// `null` for the main database.
  public String name() {
    return name;
  }

  public Env env() {
    return env;
  }

  /// Retrieve statistics for this database.
  public Stat stat(Txn txn) {
    final var lib = txn.lib;
    final var txnHandle = txn.handle("mdb_stat");
    final var ptr = Memory.allocZeroed(Stat.SIZE);
    try {
      Errors.check(lib, "mdb_stat", lib.mdb_stat(txnHandle, handle, ptr));
      return Stat.read(ptr);
    } finally {
      Memory.dealloc(ptr);
    }
  }

  /// Flags the database was created with, as persisted by the engine.
  public int flags(Txn txn) {
    final var lib = txn.lib;
    final var txnHandle = txn.handle("mdb_dbi_flags");
    try (final var ref = IntRef.allocate()) {
      Errors.check(lib, "mdb_dbi_flags", lib.mdb_dbi_flags(txnHandle, handle, ref.address()));
      return ref.value();
    }
  }

  /// Number of entries, counting every duplicate.
  public long size(Txn txn) {
    return stat(txn).ms_entries();
  }

  /// Looks `key` up, leaving the result in the transaction's scratch descriptor.
  ///
  /// @return `false` if the key is absent
  public boolean get(Txn txn, Val key) {
    txn.handle("mdb_get");
    return get(txn, key, txn.value());
  }

  /// Get items from a database.
  ///
  /// The address and length of the data associated with `key` are written to `data`. If the
  /// database supports duplicate keys (#MDB_DUPSORT) the first data item for the key is
  /// returned.
  ///
  /// @return `false` if the key is absent
  /// @apiNote The memory pointed to by the returned values is owned by the database. The caller
  ///     may not modify it in any way. Values returned from the database are valid only until a
  ///     subsequent update operation, or the end of the transaction.
  public boolean get(Txn txn, Val key, Val.Struct data) {
    final var lib = txn.lib;
    final var txnHandle = txn.handle("mdb_get");
    final var k = txn.key().set(key);
    return Errors.found(
        lib, "mdb_get", lib.mdb_get(txnHandle, handle, k.address(), data.address()));
  }

  /// Copies the value for `key` into `out`, which must be exactly as large as the value.
  ///
  /// @return `false` if the key is absent, leaving `out` untouched
  /// @throws LMDBLogicError with [Code#MDB_BAD_VALSIZE] if the stored value is not
  ///     `out.capacity()` bytes long
  public boolean get(Txn txn, Val key, MutableDirectBuffer out) {
    txn.handle("mdb_get");
    final var data = txn.value();
    if (!get(txn, key, data)) {
      return false;
    }
    final var size = data.mv_size();
    if (size != out.capacity()) {
      throw new LMDBLogicError(
          "mdb_get",
          Code.MDB_BAD_VALSIZE,
          "value is " + size + " bytes but the buffer holds " + out.capacity());
    }
    if (size > 0) {
      out.putBytes(0, data.buffer(), 0, (int) size);
    }
    return true;
  }

  public void put(Txn txn, Val key, Val data) {
    put(txn, key, data, PutFlags.NONE);
  }

  /// Store items into a database.
  ///
  /// The default behavior is to enter the new key/data pair, replacing any previously existing
  /// key if duplicates are disallowed, or adding a duplicate data item if duplicates are
  /// allowed (#MDB_DUPSORT).
  ///
  /// @param flags see [PutFlags]
  /// @throws KeyExistError if #MDB_NOOVERWRITE or #MDB_NODUPDATA refused the write
  /// @throws LMDBError Some other possible errors are:
  ///
  ///   - #MDB_MAP_FULL - the database is full, see #mdb_env_set_mapsize().
  ///   - #MDB_TXN_FULL - the transaction has too many dirty pages.
  ///   - EACCES - an attempt was made to write in a read-only transaction.
  ///   - EINVAL - an invalid parameter was specified.
  ///
  public void put(Txn txn, Val key, Val data, int flags) {
    final var lib = txn.lib;
    final var txnHandle = txn.handle("mdb_put");
    final var k = txn.key().set(key);
    final var v = txn.value().set(data);
    Errors.check(lib, "mdb_put", lib.mdb_put(txnHandle, handle, k.address(), v.address(), flags));
  }

  /// Removes `key` and, in a #MDB_DUPSORT database, every duplicate under it.
  ///
  /// @return `false` if the key is absent
  public boolean del(Txn txn, Val key) {
    return del(txn, key, null);
  }

  /// Delete items from a database.
  ///
  /// If the database supports sorted duplicates and `data` is non-null, only the matching
  /// data item is deleted. Otherwise `data` is ignored.
  ///
  /// @return `false` if the key, or the key/data pair, is absent
  public boolean del(Txn txn, Val key, Val data) {
    final var lib = txn.lib;
    final var txnHandle = txn.handle("mdb_del");
    final var k = txn.key().set(key);
    final long v = data == null ? 0L : txn.value().set(data).address();
    return Errors.found(lib, "mdb_del", lib.mdb_del(txnHandle, handle, k.address(), v));
  }

  /// Empty or delete the database.
  ///
  /// @param delete `false` to empty the database, `true` to delete it from the environment and
  ///     close the handle
  public void drop(Txn txn, boolean delete) {
    final var lib = txn.lib;
    final var txnHandle = txn.handle("mdb_drop");
    Errors.check(lib, "mdb_drop", lib.mdb_drop(txnHandle, handle, delete ? 1 : 0));
  }

  /// Close a database handle. Normally unnecessary.
  ///
  /// This call is not mutex protected. Handles should only be closed by a single thread, and
  /// only if no other threads are going to reference the database handle or one of its
  /// cursors any further. Does nothing once the environment is closed.
  public void close(Env env) {
    final var envHandle = env.handle();
    if (envHandle != 0L) {
      env.lib.mdb_dbi_close(envHandle, handle);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Dbi other)) return false;
    return handle == other.handle && env == other.env;
  }

  @Override
  public int hashCode() {
    return 31 * System.identityHashCode(env) + handle;
  }

  @Override
  public String toString() {
    return "Dbi{name="
        + name
        + ", handle="
        + handle
        + ", flags=0x"
        + Integer.toHexString(flags)
        + '}';
  }
}
