package io.bisque.mdb.c.lmdb;

import lombok.extern.slf4j.Slf4j;

/// Lightning Memory-Mapped Database Manager (LMDB)
///
/// LMDB is a Btree-based database management library modeled loosely on the BerkeleyDB API, but
/// much simplified. The entire database is exposed in a memory map, and all data fetches return
/// data directly from the mapped memory, so no malloc's or memcpy's occur during data fetches.
/// It is fully transactional with full ACID semantics. Writes are fully serialized; only one
/// write transaction may be active at a time. Readers run with no locks; writers cannot block
/// readers, and readers don't block writers.
///
/// This class is the entry point of the Java layer: it owns the process-wide native binding and
/// hands out [Config] instances. Handles are created through [Env], [Txn], [Dbi] and [Cursor].
///
/// Restrictions worth repeating from the LMDB documentation:
///
/// - A thread can only use one transaction at a time, plus any child transactions. Each
///     transaction belongs to one thread. The #MDB_NOTLS flag changes this for read-only
///     transactions.
/// - Do not have open an LMDB database twice in the same process at the same time.
/// - Avoid long-lived transactions. Read transactions prevent reuse of pages freed by newer
///     write transactions, thus the database can grow quickly.
/// - Do not use LMDB databases on remote filesystems.
@Slf4j
public final class MDB {
  private MDB() {}

  private static final class Holder {
    static final NativeLibrary LIBRARY = NativeLibrary.load();
  }

  /// The native binding, loaded on first use.
  ///
  /// @throws UnsatisfiedLinkError when no `liblmdb` can be found
  public static Library library() {
    return Holder.LIBRARY;
  }

  /// Whether a native `liblmdb` can be loaded in this process.
  public static boolean isAvailable() {
    try {
      return library() != null;
    } catch (LinkageError e) {
      log.debug("liblmdb not available: {}", e.getMessage());
      return false;
    }
  }

  /// Version string of the loaded `liblmdb`, e.g. `LMDB 0.9.31: (July 10, 2023)`.
  public static String version() {
    return library().mdb_version(0L, 0L, 0L);
  }

  public static Config config() {
    return new Config();
  }
}
