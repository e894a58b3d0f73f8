package io.bisque.mdb.c.lmdb;

import io.bisque.mdb.c.LongRef;
import io.bisque.mdb.c.PointerRef;
import java.util.Objects;

/// A position within a [Dbi], bound to one [Txn].
///
/// A cursor of a read-write transaction is freed by the engine when that transaction ends; the
/// cursor is then marked released and [#close()] does nothing. A cursor of a read-only
/// transaction outlives it and may be rebound with [#renew(Txn)] or closed explicitly.
///
/// Results of [#get(int)] and its variants are read through [#key()] and [#value()], which
/// alias database memory and follow the same validity rules as any value returned by the
/// engine.
public final class Cursor implements AutoCloseable {
  final Library lib;
  final Dbi dbi;
  Txn txn;
  private long handle;
  private final Val.Struct key;
  private final Val.Struct value;

  private Cursor(Txn txn, Dbi dbi, long handle) {
    this.lib = txn.lib;
    this.txn = txn;
    this.dbi = dbi;
    this.handle = handle;
    this.key = Val.Struct.allocate();
    this.value = Val.Struct.allocate();
  }

  /// Create a cursor handle.
  ///
  /// @throws LMDBError Some possible errors are:
  ///
  ///   - EINVAL - an invalid parameter was specified.
  ///
  public static Cursor open(Txn txn, Dbi dbi) {
    Objects.requireNonNull(txn);
    Objects.requireNonNull(dbi);
    final var lib = txn.lib;
    final var txnHandle = txn.handle("mdb_cursor_open");
    final long handle;
    try (final var ref = PointerRef.allocate()) {
      Errors.check(
          lib, "mdb_cursor_open", lib.mdb_cursor_open(txnHandle, dbi.handle, ref.address()));
      handle = ref.value();
    }
    final var cursor = new Cursor(txn, dbi, handle);
    txn.track(cursor);
    return cursor;
  }

  /// Raw `MDB_cursor*`, `0L` once released.
  public long handle() {
    return handle;
  }

  public boolean isOpen() {
    return handle != 0L;
  }

  /// The transaction this cursor is currently bound to, `null` after a read-only transaction
  /// ended and before [#renew(Txn)].
  public Txn txn() {
    return txn;
  }

  public Dbi dbi() {
    return dbi;
  }

  /// Key at the current position, as left by the last successful positioning call.
  public Val.Struct key() {
    return key;
  }

  /// Data at the current position, as left by the last successful positioning call.
  public Val.Struct value() {
    return value;
  }

  private long handle(String origin) {
    final var handle = this.handle;
    if (handle == 0L) {
      throw Errors.misuse(origin, "cursor is closed");
    }
    if (txn == null) {
      throw Errors.misuse(origin, "cursor is not bound to a transaction");
    }
    if (!txn.isActive()) {
      throw Errors.misuse(origin, "cursor transaction is " + txn.state());
    }
    return handle;
  }

  /// Raw `MDB_txn*` the engine associates with this cursor.
  public long txnHandle() {
    return lib.mdb_cursor_txn(handle("mdb_cursor_txn"));
  }

  /// Raw `MDB_dbi` the engine associates with this cursor.
  public int dbiHandle() {
    return lib.mdb_cursor_dbi(handle("mdb_cursor_dbi"));
  }

  /// Renew a cursor handle.
  ///
  /// A cursor is associated with a specific transaction and database. Cursors that are only
  /// used in read-only transactions may be re-used, to avoid unnecessary malloc/free overhead.
  /// The cursor may be associated with a new read-only transaction, referencing the same
  /// database handle as it was created with. This may be done whether the previous
  /// transaction is live or dead.
  public void renew(Txn txn) {
    Objects.requireNonNull(txn);
    final var handle = this.handle;
    if (handle == 0L) {
      throw Errors.misuse("mdb_cursor_renew", "cursor is closed");
    }
    final var txnHandle = txn.handle("mdb_cursor_renew");
    Errors.check(lib, "mdb_cursor_renew", lib.mdb_cursor_renew(txnHandle, handle));
    if (this.txn != null) {
      this.txn.untrack(this);
    }
    this.txn = txn;
    txn.track(this);
  }

  /// Retrieve by cursor.
  ///
  /// Retrieves key/data pairs from the database. `key` is both input, for the operations that
  /// take one, and output. `data` may be `null` when the data item is not wanted.
  ///
  /// @param op see [CursorOp]
  /// @return `false` if there is no matching entry
  public boolean get(Val.Struct key, Val.Struct data, int op) {
    final var handle = handle("mdb_cursor_get");
    final long dataAddress = data == null ? 0L : data.address();
    return Errors.found(
        lib, "mdb_cursor_get", lib.mdb_cursor_get(handle, key.address(), dataAddress, op));
  }

  /// Moves with an operation that takes no input, such as [CursorOp#MDB_NEXT].
  public boolean get(int op) {
    return get(key, value, op);
  }

  /// Moves with an operation that takes a key, such as [CursorOp#MDB_SET_RANGE].
  public boolean get(Val key, int op) {
    handle("mdb_cursor_get");
    this.key.set(key);
    return get(this.key, value, op);
  }

  /// Moves with an operation that takes a key and data, such as [CursorOp#MDB_GET_BOTH].
  public boolean get(Val key, Val data, int op) {
    handle("mdb_cursor_get");
    bind(key, data);
    return get(this.key, value, op);
  }

  /// Positions at `key` exactly.
  public boolean find(Val key) {
    return get(key, CursorOp.MDB_SET);
  }

  public void put(Val key, Val data) {
    put(key, data, PutFlags.NONE);
  }

  /// Store by cursor.
  ///
  /// The cursor is positioned at the new item, or on failure usually near it.
  ///
  /// @param flags see [PutFlags]
  /// @throws KeyExistError if #MDB_NOOVERWRITE or #MDB_NODUPDATA refused the write
  public void put(Val key, Val data, int flags) {
    final var handle = handle("mdb_cursor_put");
    bind(key, data);
    Errors.check(
        lib,
        "mdb_cursor_put",
        lib.mdb_cursor_put(handle, this.key.address(), this.value.address(), flags));
  }

  /// Loads both descriptors. Either argument may be this cursor's own [#key()] or [#value()].
  private void bind(Val key, Val data) {
    final var k = new Val.Rec(key.mv_size(), key.mv_data());
    final var d = new Val.Rec(data.mv_size(), data.mv_data());
    this.key.set(k);
    this.value.set(d);
  }

  public void del() {
    del(PutFlags.NONE);
  }

  /// Delete current key/data pair.
  ///
  /// @param flags #MDB_NODUPDATA deletes all of the data items for the current key, in a
  ///     #MDB_DUPSORT database
  public void del(int flags) {
    final var handle = handle("mdb_cursor_del");
    Errors.check(lib, "mdb_cursor_del", lib.mdb_cursor_del(handle, flags));
  }

  /// Return count of duplicates for current key.
  ///
  /// This call is only valid on databases that support sorted duplicate data items
  /// (#MDB_DUPSORT).
  public long count() {
    final var handle = handle("mdb_cursor_count");
    try (final var ref = LongRef.allocate()) {
      Errors.check(lib, "mdb_cursor_count", lib.mdb_cursor_count(handle, ref.address()));
      return ref.value();
    }
  }

  /// The read-only transaction ended; the engine handle survives.
  void unbind() {
    txn = null;
  }

  /// The read-write transaction ended and the engine already freed the handle.
  void detach() {
    handle = 0L;
    txn = null;
    key.close();
    value.close();
  }

  /// Close a cursor handle. Does nothing if already closed or released with its transaction.
  @Override
  public void close() {
    final var handle = this.handle;
    if (handle != 0L) {
      this.handle = 0L;
      lib.mdb_cursor_close(handle);
      if (txn != null) {
        txn.untrack(this);
        txn = null;
      }
    }
    key.close();
    value.close();
  }

  @Override
  public String toString() {
    return "Cursor{dbi=" + dbi + ", open=" + isOpen() + '}';
  }
}
