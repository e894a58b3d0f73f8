package io.bisque.mdb.c.lmdb;

/// [Code#MDB_NOTFOUND] from an operation where absence is not an expected answer, such as
/// opening a named database that does not exist without `MDB_CREATE`.
public final class NotFoundError extends LMDBRuntimeError {
  public NotFoundError(String origin, int code, String description) {
    super(origin, code, description);
  }
}
