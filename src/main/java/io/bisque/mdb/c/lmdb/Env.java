package io.bisque.mdb.c.lmdb;

import io.bisque.mdb.c.IntRef;
import io.bisque.mdb.c.Memory;
import io.bisque.mdb.c.PointerRef;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/// An LMDB environment: one set of data and lock files plus its memory map.
///
/// Lifecycle is `UNOPENED -> OPENED -> CLOSED`. Sizing and most flags must be set while
/// unopened; the engine decides which settings it still accepts afterwards and this class only
/// forwards its answer.
///
/// An environment may be shared between threads. Transactions and cursors may not.
///
/// Closing is idempotent and never throws. Transactions still active at close time are aborted
/// first, children before parents.
@Slf4j
public final class Env implements AutoCloseable {
  public static final int DEFAULT_FLAGS = 0;

  /// -rw-r--r--
  public static final int DEFAULT_MODE = 0644;

  public enum State {
    UNOPENED,
    OPENED,
    CLOSED
  }

  final Library lib;
  final ReentrantLock lock = new ReentrantLock();
  final HashSet<Txn> txns = new HashSet<>();
  private volatile long handle;
  private volatile State state = State.UNOPENED;
  private String path;

  private Env(Library lib, long handle) {
    this.lib = lib;
    this.handle = handle;
  }

  public static Env create() {
    return create(MDB.library(), DEFAULT_FLAGS);
  }

  public static Env create(int flags) {
    return create(MDB.library(), flags);
  }

  public static Env create(Library lib) {
    return create(lib, DEFAULT_FLAGS);
  }

  /// Create an LMDB environment handle.
  ///
  /// Allocates the `MDB_env` structure. If `flags` is non-zero they are applied with
  /// `mdb_env_set_flags`; should that fail the handle is closed before the failure propagates.
  public static Env create(Library lib, int flags) {
    Objects.requireNonNull(lib);
    final long handle;
    try (final var ref = PointerRef.allocate()) {
      Errors.check(lib, "mdb_env_create", lib.mdb_env_create(ref.address()));
      handle = ref.value();
    }
    if (handle == 0L) {
      throw new IllegalStateException("mdb_env_create returned a NULL handle");
    }
    if (flags != 0) {
      try {
        Errors.check(lib, "mdb_env_set_flags", lib.mdb_env_set_flags(handle, flags, 1));
      } catch (LMDBError e) {
        lib.mdb_env_close(handle);
        throw e;
      }
    }
    return new Env(lib, handle);
  }

  /// Creates, configures and opens an environment in one step, closing it again if any step
  /// fails.
  public static Env open(String path, Config config) {
    return open(MDB.library(), path, config);
  }

  public static Env open(Library lib, String path, Config config) {
    Objects.requireNonNull(path);
    if (config == null) {
      config = MDB.config();
    }
    final var env = create(lib);
    try {
      if (config.mapSize > 0) {
        env.setMapSize(config.mapSize);
      }
      if (config.maxReaders > 0) {
        env.setMaxReaders(config.maxReaders);
      }
      if (config.maxDbs > 0) {
        env.setMaxDbs(config.maxDbs);
      }
      return env.open(path, config.flags, config.mode);
    } catch (RuntimeException e) {
      env.close();
      throw e;
    }
  }

  /// Raw `MDB_env*`, `0L` once closed.
  public long handle() {
    return handle;
  }

  public State state() {
    return state;
  }

  public boolean isOpen() {
    return state == State.OPENED;
  }

  public Library library() {
    return lib;
  }

  long handle(String origin) {
    final var handle = this.handle;
    if (handle == 0L) {
      throw Errors.misuse(origin, "environment is closed");
    }
    return handle;
  }

  public Env open(String path) {
    return open(path, DEFAULT_FLAGS, DEFAULT_MODE);
  }

  public Env open(String path, int flags) {
    return open(path, flags, DEFAULT_MODE);
  }

  /// Open an environment handle.
  ///
  /// If this function fails the handle stays unopened and should be closed.
  ///
  ///   - #MDB_VERSION_MISMATCH - the version of the LMDB library doesn't match the version that
  ///     created the database environment.
  ///   - #MDB_INVALID - the environment file headers are corrupted.
  ///   - ENOENT - the directory specified by the path parameter doesn't exist.
  ///   - EACCES - the user didn't have permission to access the environment files.
  ///   - EAGAIN - the environment was locked by another process.
  ///
  /// @param flags see [EnvFlags]
  /// @param mode UNIX permissions for created files
  public Env open(String path, int flags, int mode) {
    Objects.requireNonNull(path);
    final var handle = handle("mdb_env_open");
    Errors.check(lib, "mdb_env_open", lib.mdb_env_open(handle, path, flags, mode));
    this.path = path;
    this.state = State.OPENED;
    log.debug("opened environment {} flags=0x{}", path, Integer.toHexString(flags));
    return this;
  }

  public void sync() {
    sync(true);
  }

  /// Flush the data buffers to disk.
  ///
  /// Data is always written to disk when #mdb_txn_commit() is called, but the operating system
  /// may keep it buffered. This call is not valid if the environment was opened with
  /// #MDB_RDONLY.
  ///
  /// @param force force a synchronous flush even with #MDB_NOSYNC / #MDB_MAPASYNC set
  public void sync(boolean force) {
    lock.lock();
    try {
      final var handle = handle("mdb_env_sync");
      Errors.check(lib, "mdb_env_sync", lib.mdb_env_sync(handle, force ? 1 : 0));
    } finally {
      lock.unlock();
    }
  }

  public Env setFlags(int flags) {
    return setFlags(flags, true);
  }

  public Env setFlags(int flags, boolean onoff) {
    final var handle = handle("mdb_env_set_flags");
    Errors.check(lib, "mdb_env_set_flags", lib.mdb_env_set_flags(handle, flags, onoff ? 1 : 0));
    return this;
  }

  /// Set the size of the memory map to use for this environment.
  ///
  /// May be called after open only while no transactions are active in this process.
  public Env setMapSize(long size) {
    final var handle = handle("mdb_env_set_mapsize");
    Errors.check(lib, "mdb_env_set_mapsize", lib.mdb_env_set_mapsize(handle, size));
    return this;
  }

  public Env setMaxReaders(int count) {
    final var handle = handle("mdb_env_set_maxreaders");
    Errors.check(lib, "mdb_env_set_maxreaders", lib.mdb_env_set_maxreaders(handle, count));
    return this;
  }

  public Env setMaxDbs(int count) {
    final var handle = handle("mdb_env_set_maxdbs");
    Errors.check(lib, "mdb_env_set_maxdbs", lib.mdb_env_set_maxdbs(handle, count));
    return this;
  }

  public int flags() {
    final var handle = handle("mdb_env_get_flags");
    try (final var ref = IntRef.allocate()) {
      Errors.check(lib, "mdb_env_get_flags", lib.mdb_env_get_flags(handle, ref.address()));
      return ref.value();
    }
  }

  /// The path passed to [#open(String, int, int)], as the engine reports it.
  public String path() {
    final var handle = handle("mdb_env_get_path");
    try (final var ref = PointerRef.allocate()) {
      Errors.check(lib, "mdb_env_get_path", lib.mdb_env_get_path(handle, ref.address()));
      return Memory.readCString(ref.value());
    }
  }

  public int maxReaders() {
    final var handle = handle("mdb_env_get_maxreaders");
    try (final var ref = IntRef.allocate()) {
      Errors.check(
          lib, "mdb_env_get_maxreaders", lib.mdb_env_get_maxreaders(handle, ref.address()));
      return ref.value();
    }
  }

  /// Largest key the engine accepts; also the limit for data in #MDB_DUPSORT databases.
  public int maxKeySize() {
    return lib.mdb_env_get_maxkeysize(handle("mdb_env_get_maxkeysize"));
  }

  /// Return statistics about the main database of the environment.
  public Stat stat() {
    final var handle = handle("mdb_env_stat");
    final var ptr = Memory.allocZeroed(Stat.SIZE);
    try {
      Errors.check(lib, "mdb_env_stat", lib.mdb_env_stat(handle, ptr));
      return Stat.read(ptr);
    } finally {
      Memory.dealloc(ptr);
    }
  }

  public EnvInfo info() {
    final var handle = handle("mdb_env_info");
    final var ptr = Memory.allocZeroed(EnvInfo.SIZE);
    try {
      Errors.check(lib, "mdb_env_info", lib.mdb_env_info(handle, ptr));
      return EnvInfo.read(ptr);
    } finally {
      Memory.dealloc(ptr);
    }
  }

  /// Clears reader slots left behind by dead processes or threads.
  ///
  /// @return the number of stale slots that were cleared
  public int readerCheck() {
    final var handle = handle("mdb_reader_check");
    try (final var ref = IntRef.allocate()) {
      Errors.check(lib, "mdb_reader_check", lib.mdb_reader_check(handle, ref.address()));
      return ref.value();
    }
  }

  public Txn begin() {
    return Txn.begin(this, null, TxnFlags.NONE);
  }

  public Txn begin(int flags) {
    return Txn.begin(this, null, flags);
  }

  public Txn begin(Txn parent, int flags) {
    return Txn.begin(this, parent, flags);
  }

  /// Number of top-level transactions begun here and not yet resolved.
  public int activeTransactions() {
    lock.lock();
    try {
      return txns.size();
    } finally {
      lock.unlock();
    }
  }

  void register(Txn txn) {
    lock.lock();
    try {
      txns.add(txn);
    } finally {
      lock.unlock();
    }
  }

  void unregister(Txn txn) {
    lock.lock();
    try {
      txns.remove(txn);
    } finally {
      lock.unlock();
    }
  }

  /// Close the environment and release the memory map.
  ///
  /// Only a single thread may call this function. The environment handle is freed and must not
  /// be used again; calling `close` again does nothing.
  @Override
  public void close() {
    lock.lock();
    try {
      final var handle = this.handle;
      if (handle == 0L) {
        return;
      }
      if (!txns.isEmpty()) {
        log.warn(
            "closing environment {} with {} unresolved transaction(s), aborting them",
            path,
            txns.size());
        for (final var txn : new ArrayList<>(txns)) {
          try {
            txn.abort();
          } catch (RuntimeException e) {
            log.warn("abort of transaction {} failed during close", txn, e);
          }
        }
        txns.clear();
      }
      lib.mdb_env_close(handle);
      this.handle = 0L;
      this.state = State.CLOSED;
      log.debug("closed environment {}", path);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public String toString() {
    return "Env{path=" + path + ", state=" + state + '}';
  }
}
