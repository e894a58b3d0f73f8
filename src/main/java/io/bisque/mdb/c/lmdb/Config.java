package io.bisque.mdb.c.lmdb;

import java.util.Properties;

/// Settings applied by [Env#open(String, Config)] between `mdb_env_create` and `mdb_env_open`.
///
/// A value of `0` for [#maxReaders], [#maxDbs] or [#mapSize] leaves the engine default in place.
public class Config {
  public static final String FLAGS = "mdb.flags";
  public static final String MAP_SIZE = "mdb.mapSize";
  public static final String MAX_READERS = "mdb.maxReaders";
  public static final String MAX_DBS = "mdb.maxDbs";
  public static final String MODE = "mdb.mode";

  /// Flags passed to `mdb_env_open`, see [EnvFlags].
  ///
  ///   - #MDB_NOSUBDIR By default, LMDB creates its environment in a directory whose pathname is
  ///     given in \b path, and creates its data and lock files under that directory. With this
  ///     option, \b path is used as-is for the database main data file. The database lock file
  ///     is the \b path with "-lock" appended.
  ///   - #MDB_RDONLY Open the environment in read-only mode. No write operations will be
  ///     allowed. LMDB will still modify the lock file - except on read-only filesystems, where
  ///     LMDB does not use locks.
  ///   - #MDB_WRITEMAP Use a writeable memory map unless MDB_RDONLY is set. This uses fewer
  ///     mallocs but loses protection from application bugs like wild pointer writes and other
  ///     bad updates into the database. Incompatible with nested transactions.
  ///   - #MDB_NOMETASYNC Flush system buffers to disk only once per transaction, omit the
  ///     metadata flush.
  ///   - #MDB_NOSYNC Don't flush system buffers to disk when committing a transaction.
  ///   - #MDB_NOTLS Don't use Thread-Local Storage. Tie reader locktable slots to #MDB_txn
  ///     objects instead of to threads.
  public int flags;

  /// Set the maximum number of threads/reader slots for the environment.
  ///
  /// The default is 126. This may only be set after #mdb_env_create() and before
  /// #mdb_env_open().
  public int maxReaders;

  /// Set the maximum number of named databases for the environment.
  ///
  /// Only needed if multiple databases will be used in the environment. Currently, a moderate
  /// number of slots are cheap but a huge value gets expensive: 7-120 words per transaction,
  /// and every #mdb_dbi_open() does a linear search of the opened slots.
  public int maxDbs = 4;

  /// Set the size of the memory map to use for this environment in bytes.
  ///
  /// The size should be a multiple of the OS page size. The size of the memory map is also the
  /// maximum size of the database.
  public long mapSize = 1024 * 1024 * 32;

  /// File permissions for newly created files. Ignored on Windows.
  public int mode = Env.DEFAULT_MODE;

  public Config flags(int flags) {
    this.flags = flags;
    return this;
  }

  public Config maxReaders(int maxReaders) {
    this.maxReaders = maxReaders;
    return this;
  }

  public Config maxDbs(int maxDbs) {
    this.maxDbs = maxDbs;
    return this;
  }

  public Config mapSize(long mapSize) {
    this.mapSize = mapSize;
    return this;
  }

  public Config mode(int mode) {
    this.mode = mode;
    return this;
  }

  /// Reads a config from `mdb.*` keys; absent keys keep their defaults. `mdb.flags` accepts
  /// decimal or `0x` hex, `mdb.mode` is octal.
  public static Config fromProperties(Properties properties) {
    final var config = new Config();
    final var flags = properties.getProperty(FLAGS);
    if (flags != null) {
      config.flags(Integer.decode(flags.trim()));
    }
    final var mapSize = properties.getProperty(MAP_SIZE);
    if (mapSize != null) {
      config.mapSize(Long.parseLong(mapSize.trim()));
    }
    final var maxReaders = properties.getProperty(MAX_READERS);
    if (maxReaders != null) {
      config.maxReaders(Integer.parseInt(maxReaders.trim()));
    }
    final var maxDbs = properties.getProperty(MAX_DBS);
    if (maxDbs != null) {
      config.maxDbs(Integer.parseInt(maxDbs.trim()));
    }
    final var mode = properties.getProperty(MODE);
    if (mode != null) {
      config.mode(Integer.parseInt(mode.trim(), 8));
    }
    return config;
  }

  @Override
  public String toString() {
    return "Config{flags=0x"
        + Integer.toHexString(flags)
        + ", maxReaders="
        + maxReaders
        + ", maxDbs="
        + maxDbs
        + ", mapSize="
        + mapSize
        + ", mode=0"
        + Integer.toOctalString(mode)
        + '}';
  }
}
