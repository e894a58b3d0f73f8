package io.bisque.mdb.c.lmdb;

import io.bisque.mdb.c.PointerRef;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/// A transaction within an [Env].
///
/// A transaction and its cursors must only be used by a single thread, and a thread may only
/// have a single transaction at a time. If #MDB_NOTLS is in use this does not apply to
/// read-only transactions.
///
/// A transaction is resolved exactly once, by [#commit()] or [#abort()]; the handle is gone
/// afterwards either way. [#close()] aborts an unresolved transaction so that
/// try-with-resources gives scope-bound release.
@Slf4j
public final class Txn implements AutoCloseable {
  public enum State {
    ACTIVE,
    /// Read-only transaction whose snapshot was released by [#reset()].
    RESET,
    COMMITTED,
    ABORTED
  }

  final Env env;
  final Library lib;
  final Txn parent;
  final boolean readOnly;
  final HashSet<Cursor> cursors = new HashSet<>();
  Txn child;
  private long handle;
  private State state = State.ACTIVE;
  private Val.Struct key;
  private Val.Struct value;

  private Txn(Env env, Txn parent, int flags, long handle) {
    this.env = env;
    this.lib = env.lib;
    this.parent = parent;
    this.readOnly = (flags & TxnFlags.MDB_RDONLY) != 0;
    this.handle = handle;
  }

  public static Txn begin(Env env) {
    return begin(env, null, TxnFlags.NONE);
  }

  public static Txn begin(Env env, int flags) {
    return begin(env, null, flags);
  }

  /// Create a transaction for use with the environment.
  ///
  /// @param parent If this parameter is non-null, the new transaction will be a nested
  ///     transaction, with the transaction indicated by `parent` as its parent. Transactions may
  ///     be nested to any level. A parent transaction and its cursors may not issue any other
  ///     operations than commit and abort while it has active child transactions.
  /// @param flags see [TxnFlags]
  /// @throws LMDBError Some possible errors are:
  ///
  ///   - #MDB_PANIC - a fatal error occurred earlier and the environment must be shut down.
  ///   - #MDB_MAP_RESIZED - another process wrote data beyond this MDB_env's mapsize and this
  ///     environment's map must be resized as well.
  ///   - #MDB_READERS_FULL - a read-only transaction was requested and the reader lock table is
  ///     full.
  ///   - ENOMEM - out of memory.
  ///
  public static Txn begin(Env env, Txn parent, int flags) {
    Objects.requireNonNull(env);
    final var lib = env.lib;
    final var envHandle = env.handle("mdb_txn_begin");
    final var parentHandle = parent == null ? 0L : parent.handle("mdb_txn_begin");
    final long handle;
    try (final var ref = PointerRef.allocate()) {
      Errors.check(
          lib, "mdb_txn_begin", lib.mdb_txn_begin(envHandle, parentHandle, flags, ref.address()));
      handle = ref.value();
    }
    final var txn = new Txn(env, parent, flags, handle);
    if (parent != null) {
      parent.child = txn;
    } else {
      env.register(txn);
    }
    return txn;
  }

  /// Raw `MDB_txn*`, `0L` once resolved.
  public long handle() {
    return handle;
  }

  public Env env() {
    return env;
  }

  public Txn parent() {
    return parent;
  }

  public boolean isReadOnly() {
    return readOnly;
  }

  public State state() {
    return state;
  }

  public boolean isActive() {
    return state == State.ACTIVE;
  }

  long handle(String origin) {
    if (state != State.ACTIVE) {
      throw Errors.misuse(origin, "transaction is " + state);
    }
    return handle;
  }

  /// Scratch key descriptor for calls that take a [Val] by value.
  Val.Struct key() {
    if (key == null) {
      key = Val.Struct.allocate();
    }
    return key;
  }

  Val.Struct value() {
    if (value == null) {
      value = Val.Struct.allocate();
    }
    return value;
  }

  void track(Cursor cursor) {
    cursors.add(cursor);
  }

  void untrack(Cursor cursor) {
    cursors.remove(cursor);
  }

  /// Return the transaction's ID.
  ///
  /// For a read-only transaction this corresponds to the snapshot being read; concurrent
  /// readers will frequently have the same transaction ID.
  public long id() {
    return lib.mdb_txn_id(handle("mdb_txn_id"));
  }

  /// Raw `MDB_env*` the engine associates with this transaction.
  public long envHandle() {
    return lib.mdb_txn_env(handle("mdb_txn_env"));
  }

  /// Commit all the operations of a transaction into the database.
  ///
  /// An active child is committed first. The handle is released whether or not the commit
  /// succeeds; on failure the transaction ends up [State#ABORTED] and the failure is raised.
  ///
  /// @throws LMDBError Some possible errors are:
  ///
  ///   - EINVAL - an invalid parameter was specified.
  ///   - ENOSPC - no more disk space.
  ///   - EIO - a low-level I/O error occurred while writing.
  ///   - ENOMEM - out of memory.
  ///
  public void commit() {
    final var handle = handle("mdb_txn_commit");
    final var child = this.child;
    if (child != null) {
      try {
        child.commit();
      } catch (LMDBError e) {
        abort();
        throw e;
      }
    }
    final int rc = lib.mdb_txn_commit(handle);
    if (rc == Code.MDB_SUCCESS) {
      release(State.COMMITTED);
      return;
    }
    release(State.ABORTED);
    log.debug("commit of transaction failed: {}", Code.message(rc));
    LMDBError.raise("mdb_txn_commit", rc, lib.mdb_strerror(rc));
  }

  /// Abandon all the operations of the transaction instead of saving them.
  ///
  /// An active child is aborted first. Does nothing once the transaction is resolved.
  ///
  /// @apiNote Only write-transactions free cursors. Cursors of a read-only transaction stay
  ///     open and may be renewed.
  public void abort() {
    final var handle = this.handle;
    if (handle == 0L) {
      return;
    }
    final var child = this.child;
    if (child != null) {
      child.abort();
    }
    lib.mdb_txn_abort(handle);
    release(State.ABORTED);
  }

  /// Reset a read-only transaction.
  ///
  /// Abort the transaction like [#abort()], but keep the transaction handle. [#renew()] may
  /// reuse the handle. The reader table lock is released, but the table slot stays tied to its
  /// thread or transaction. Cursors opened within the transaction must not be used again after
  /// this call, except with [Cursor#renew(Txn)].
  public void reset() {
    if (!readOnly) {
      throw Errors.misuse("mdb_txn_reset", "only read-only transactions can be reset");
    }
    if (state == State.RESET) {
      return;
    }
    lib.mdb_txn_reset(handle("mdb_txn_reset"));
    state = State.RESET;
    unbindCursors();
  }

  /// Renew a read-only transaction.
  ///
  /// This acquires a new reader lock for a transaction handle that had been released by
  /// [#reset()]. It must be called before a reset transaction may be used again.
  ///
  /// @throws LMDBError Some possible errors are:
  ///
  ///   - #MDB_PANIC - a fatal error occurred earlier and the environment must be shut down.
  ///   - EINVAL - an invalid parameter was specified.
  ///
  public void renew() {
    if (!readOnly) {
      throw Errors.misuse("mdb_txn_renew", "only read-only transactions can be renewed");
    }
    if (state != State.RESET) {
      throw Errors.misuse("mdb_txn_renew", "transaction is " + state);
    }
    Errors.check(lib, "mdb_txn_renew", lib.mdb_txn_renew(handle));
    state = State.ACTIVE;
  }

  @Override
  public void close() {
    abort();
  }

  /// Cursors of a read-only transaction need [Cursor#renew(Txn)] before they are used again.
  private void unbindCursors() {
    if (cursors.isEmpty()) {
      return;
    }
    for (final var cursor : new ArrayList<>(cursors)) {
      cursor.unbind();
    }
    cursors.clear();
  }

  private void release(State terminal) {
    if (readOnly) {
      unbindCursors();
    } else if (!cursors.isEmpty()) {
      for (final var cursor : new ArrayList<>(cursors)) {
        cursor.detach();
      }
      cursors.clear();
    }
    handle = 0L;
    state = terminal;
    if (parent != null) {
      if (parent.child == this) {
        parent.child = null;
      }
    } else {
      env.unregister(this);
    }
    if (key != null) {
      key.close();
      key = null;
    }
    if (value != null) {
      value.close();
      value = null;
    }
  }

  @Override
  public String toString() {
    return "Txn{readOnly=" + readOnly + ", state=" + state + ", nested=" + (parent != null) + '}';
  }
}
