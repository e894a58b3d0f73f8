package io.bisque.mdb.c.lmdb;

/// [Code#MDB_KEYEXIST]: a put with `MDB_NOOVERWRITE` or `MDB_NODUPDATA` hit an existing entry.
public final class KeyExistError extends LMDBRuntimeError {
  public KeyExistError(String origin, int code, String description) {
    super(origin, code, description);
  }
}
