package io.bisque.mdb.c.lmdb;

public final class CorruptedError extends LMDBFatalError {
  public CorruptedError(String origin, int code, String description) {
    super(origin, code, description);
  }
}
