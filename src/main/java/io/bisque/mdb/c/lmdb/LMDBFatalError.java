package io.bisque.mdb.c.lmdb;

/// The environment hit an unrecoverable condition. Close it and reopen only after repair.
public class LMDBFatalError extends LMDBError {
  public LMDBFatalError(String origin, int code, String description) {
    super(origin, code, description);
  }

  @Override
  public Kind kind() {
    return Kind.FATAL;
  }
}
