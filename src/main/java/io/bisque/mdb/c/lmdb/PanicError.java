package io.bisque.mdb.c.lmdb;

public final class PanicError extends LMDBFatalError {
  public PanicError(String origin, int code, String description) {
    super(origin, code, description);
  }
}
