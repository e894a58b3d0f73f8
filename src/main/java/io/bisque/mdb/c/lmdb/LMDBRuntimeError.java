package io.bisque.mdb.c.lmdb;

public class LMDBRuntimeError extends LMDBError {
  public LMDBRuntimeError(String origin, int code, String description) {
    super(origin, code, description);
  }

  @Override
  public Kind kind() {
    return Kind.RUNTIME;
  }
}
