package io.bisque.mdb.c.lmdb;

/// Flags for `mdb_txn_begin`.
public interface TxnFlags {
  /// read-write transaction
  int NONE = 0;
  /// read-only transaction
  int MDB_RDONLY = EnvFlags.MDB_RDONLY;
  /// don't flush system buffers to disk when committing this transaction
  int MDB_NOSYNC = EnvFlags.MDB_NOSYNC;
  /// flush system buffers but omit the metadata flush for this transaction
  int MDB_NOMETASYNC = EnvFlags.MDB_NOMETASYNC;
}
