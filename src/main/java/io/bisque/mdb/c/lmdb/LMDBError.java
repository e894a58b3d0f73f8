package io.bisque.mdb.c.lmdb;

/// Base of every failure raised by this layer.
///
/// A failure names the engine function that produced it (`origin`), the raw status code, and
/// the engine's own description of that code. Callers branch on the subtype or on [#kind()];
/// the message is for humans only.
public abstract class LMDBError extends RuntimeException {
  /// Coarse classification of a failure.
  public enum Kind {
    /// Caller misuse; retrying the same call will fail the same way.
    LOGIC,
    /// Transient or environmental; the environment is still usable.
    RUNTIME,
    /// The environment must not be used any further.
    FATAL
  }

  private final String origin;
  private final int code;

  protected LMDBError(String origin, int code, String description) {
    super(origin + ": " + description);
    this.origin = origin;
    this.code = code;
  }

  /// Name of the engine function that failed, e.g. `mdb_txn_commit`.
  public String origin() {
    return origin;
  }

  public int code() {
    return code;
  }

  public abstract Kind kind();

  /// Builds the failure matching `code`. `code` must not be [Code#MDB_SUCCESS].
  public static LMDBError of(String origin, int code, String description) {
    return switch (code) {
      case Code.MDB_KEYEXIST -> new KeyExistError(origin, code, description);
      case Code.MDB_NOTFOUND -> new NotFoundError(origin, code, description);
      case Code.MDB_CORRUPTED -> new CorruptedError(origin, code, description);
      case Code.MDB_PANIC -> new PanicError(origin, code, description);
      default -> new LMDBRuntimeError(origin, code, description);
    };
  }

  /// Throws the failure matching `code`. Never returns normally.
  public static void raise(String origin, int code, String description) {
    throw of(origin, code, description);
  }
}
