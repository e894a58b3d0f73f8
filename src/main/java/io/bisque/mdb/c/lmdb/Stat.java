package io.bisque.mdb.c.lmdb;

import io.bisque.mdb.c.Memory;

/** Statistics for a database in the environment */
public interface Stat {
  /// sizeof(MDB_stat)
  long SIZE = 40L;

  long MS_PSIZE = 0L;
  long MS_DEPTH = 4L;
  long MS_BRANCH_PAGES = 8L;
  long MS_LEAF_PAGES = 16L;
  long MS_OVERFLOW_PAGES = 24L;
  long MS_ENTRIES = 32L;

  Rec EMPTY = new Rec(0, 0, 0L, 0L, 0L, 0L);

  /// Reads an `MDB_stat` filled in by the engine at `address`.
  static Rec read(long address) {
    return new Rec(
        Memory.getInt(address + MS_PSIZE),
        Memory.getInt(address + MS_DEPTH),
        Memory.getLong(address + MS_BRANCH_PAGES),
        Memory.getLong(address + MS_LEAF_PAGES),
        Memory.getLong(address + MS_OVERFLOW_PAGES),
        Memory.getLong(address + MS_ENTRIES));
  }

  /// Writes `stat` as an `MDB_stat` at `address`.
  static void write(long address, Stat stat) {
    Memory.putInt(address + MS_PSIZE, stat.ms_psize());
    Memory.putInt(address + MS_DEPTH, stat.ms_depth());
    Memory.putLong(address + MS_BRANCH_PAGES, stat.ms_branch_pages());
    Memory.putLong(address + MS_LEAF_PAGES, stat.ms_leaf_pages());
    Memory.putLong(address + MS_OVERFLOW_PAGES, stat.ms_overflow_pages());
    Memory.putLong(address + MS_ENTRIES, stat.ms_entries());
  }

  /// Size of a database page. This is currently the same for all databases.
  int ms_psize();

  /// Depth (height) of the B-tree
  int ms_depth();

  /// Number of internal (non-leaf) pages
  long ms_branch_pages();

  /// Number of leaf pages
  long ms_leaf_pages();

  /// Number of overflow pages
  long ms_overflow_pages();

  /// Number of data items
  long ms_entries();

  record Rec(
      int ms_psize,
      int ms_depth,
      long ms_branch_pages,
      long ms_leaf_pages,
      long ms_overflow_pages,
      long ms_entries)
      implements Stat {}
}
