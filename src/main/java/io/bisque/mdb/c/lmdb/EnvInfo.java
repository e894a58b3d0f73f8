package io.bisque.mdb.c.lmdb;

import io.bisque.mdb.c.Memory;

/// @brief Information about the environment
public interface EnvInfo {
  /// sizeof(MDB_envinfo)
  long SIZE = 40L;

  long ME_MAPADDR = 0L;
  long ME_MAPSIZE = 8L;
  long ME_LAST_PGNO = 16L;
  long ME_LAST_TXNID = 24L;
  long ME_MAXREADERS = 32L;
  long ME_NUMREADERS = 36L;

  static Rec read(long address) {
    return new Rec(
        Memory.getLong(address + ME_MAPADDR),
        Memory.getLong(address + ME_MAPSIZE),
        Memory.getLong(address + ME_LAST_PGNO),
        Memory.getLong(address + ME_LAST_TXNID),
        Memory.getInt(address + ME_MAXREADERS),
        Memory.getInt(address + ME_NUMREADERS));
  }

  static void write(long address, EnvInfo info) {
    Memory.putLong(address + ME_MAPADDR, info.me_mapaddr());
    Memory.putLong(address + ME_MAPSIZE, info.me_mapsize());
    Memory.putLong(address + ME_LAST_PGNO, info.me_last_pgno());
    Memory.putLong(address + ME_LAST_TXNID, info.me_last_txnid());
    Memory.putInt(address + ME_MAXREADERS, info.me_maxreaders());
    Memory.putInt(address + ME_NUMREADERS, info.me_numreaders());
  }

  /// Address of map, if fixed
  long me_mapaddr();

  /// Size of the data memory map
  long me_mapsize();

  /// ID of the last used page
  long me_last_pgno();

  /// ID of the last committed transaction
  long me_last_txnid();

  /// max reader slots in the environment
  int me_maxreaders();

  /// max reader slots used in the environment
  int me_numreaders();

  record Rec(
      long me_mapaddr,
      long me_mapsize,
      long me_last_pgno,
      long me_last_txnid,
      int me_maxreaders,
      int me_numreaders)
      implements EnvInfo {}
}
