package io.bisque.mdb.c.lmdb;

/// Misuse of the API detected before or after an engine call: a released handle, an operation
/// the handle's mode does not allow, or a value that does not fit its receptacle.
public class LMDBLogicError extends LMDBError {
  public LMDBLogicError(String origin, int code, String description) {
    super(origin, code, description);
  }

  @Override
  public Kind kind() {
    return Kind.LOGIC;
  }
}
