package io.bisque.mdb.c.lmdb;

/// The two ways a status code is consumed.
final class Errors {
  private Errors() {}

  /// Raises unless `rc` is [Code#MDB_SUCCESS].
  static void check(Library lib, String origin, int rc) {
    if (rc != Code.MDB_SUCCESS) {
      LMDBError.raise(origin, rc, lib.mdb_strerror(rc));
    }
  }

  /// For lookups: `true` on success, `false` on [Code#MDB_NOTFOUND], raises otherwise.
  static boolean found(Library lib, String origin, int rc) {
    if (rc != Code.MDB_SUCCESS && rc != Code.MDB_NOTFOUND) {
      LMDBError.raise(origin, rc, lib.mdb_strerror(rc));
    }
    return rc == Code.MDB_SUCCESS;
  }

  static LMDBLogicError misuse(String origin, String description) {
    return new LMDBLogicError(origin, Code.EINVAL, description);
  }
}
