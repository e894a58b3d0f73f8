package io.bisque.mdb.c.lmdb;

import io.bisque.mdb.c.lmdb.testing.MemoryLibrary;
import io.bisque.mdb.c.lmdb.testing.Scratch;
import java.nio.file.Path;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class EnvTest {
  final MemoryLibrary lib = new MemoryLibrary();

  @TempDir
  Path dir;

  @Test
  public void lifecycle() {
    final var env = Env.create(lib);
    Assertions.assertEquals(Env.State.UNOPENED, env.state());
    Assertions.assertNotEquals(0L, env.handle());
    Assertions.assertSame(env, env.open(dir.toString()));
    Assertions.assertTrue(env.isOpen());
    Assertions.assertEquals(dir.toString(), env.path());
    env.close();
    Assertions.assertEquals(Env.State.CLOSED, env.state());
    Assertions.assertEquals(0L, env.handle());
    Assertions.assertEquals(0, lib.liveEnvs());
  }

  @Test
  public void closeIsIdempotent() {
    final var env = Env.create(lib).open(dir.toString());
    env.close();
    env.close();
    Assertions.assertEquals(0, lib.invalidReleases());
  }

  @Test
  public void tryWithResourcesCloses() {
    try (final var env = Env.create(lib)) {
      env.open(dir.toString());
      Assertions.assertEquals(1, lib.liveEnvs());
    }
    Assertions.assertEquals(0, lib.liveEnvs());
  }

  @Test
  public void createAppliesFlags() {
    try (final var env = Env.create(lib, EnvFlags.MDB_NOSYNC)) {
      Assertions.assertEquals(EnvFlags.MDB_NOSYNC, env.flags() & EnvFlags.MDB_NOSYNC);
      env.setFlags(EnvFlags.MDB_NOSYNC, false);
      Assertions.assertEquals(0, env.flags() & EnvFlags.MDB_NOSYNC);
    }
  }

  @Test
  public void createWithRejectedFlagsClosesHandle() {
    final var e = Assertions.assertThrows(
        LMDBRuntimeError.class, () -> Env.create(lib, EnvFlags.MDB_RDONLY));
    Assertions.assertEquals("mdb_env_set_flags", e.origin());
    Assertions.assertEquals(Code.EINVAL, e.code());
    Assertions.assertEquals(0, lib.liveEnvs());
  }

  @Test
  public void createFailure() {
    lib.failNext("mdb_env_create", Code.ENOMEM);
    final var e = Assertions.assertThrows(LMDBRuntimeError.class, () -> Env.create(lib));
    Assertions.assertEquals("mdb_env_create", e.origin());
    Assertions.assertEquals(Code.ENOMEM, e.code());
  }

  @Test
  public void openMissingDirectory() {
    try (final var env = Env.create(lib)) {
      final var e = Assertions.assertThrows(
          LMDBRuntimeError.class, () -> env.open(dir.resolve("missing").toString()));
      Assertions.assertEquals(Code.ENOENT, e.code());
      Assertions.assertEquals("mdb_env_open", e.origin());
      Assertions.assertEquals(Env.State.UNOPENED, env.state());
    }
    Assertions.assertEquals(0, lib.liveEnvs());
  }

  @Test
  public void openNoSubdir() {
    final var file = dir.resolve("data.mdb").toString();
    try (final var env = Env.create(lib).open(file, EnvFlags.MDB_NOSUBDIR)) {
      Assertions.assertTrue(env.isOpen());
      Assertions.assertEquals(EnvFlags.MDB_NOSUBDIR, env.flags() & EnvFlags.MDB_NOSUBDIR);
    }
  }

  @Test
  public void sizingBeforeOpen() {
    try (final var env = Env.create(lib)) {
      env.setMapSize(1L << 24).setMaxReaders(8).setMaxDbs(2).open(dir.toString());
      Assertions.assertEquals(8, env.maxReaders());
      Assertions.assertEquals(1L << 24, env.info().me_mapsize());
      Assertions.assertEquals(MemoryLibrary.MAX_KEY_SIZE, env.maxKeySize());
    }
  }

  @Test
  public void engineRejectsLateSizing() {
    try (final var env = Env.create(lib).open(dir.toString())) {
      final var e = Assertions.assertThrows(LMDBRuntimeError.class, () -> env.setMaxReaders(10));
      Assertions.assertEquals(Code.EINVAL, e.code());
      Assertions.assertEquals("mdb_env_set_maxreaders", e.origin());
      Assertions.assertThrows(LMDBRuntimeError.class, () -> env.setMaxDbs(10));
      env.setMapSize(1L << 22);
      Assertions.assertEquals(1L << 22, env.info().me_mapsize());
    }
  }

  @Test
  public void statAndInfo() {
    try (final var env = Env.create(lib).open(dir.toString());
        final var s = new Scratch()) {
      Assertions.assertEquals(0L, env.stat().ms_entries());
      try (final var txn = env.begin()) {
        final var dbi = Dbi.open(txn);
        dbi.put(txn, s.str("a"), s.str("1"));
        dbi.put(txn, s.str("b"), s.str("2"));
        txn.commit();
      }
      Assertions.assertEquals(2L, env.stat().ms_entries());
      final var info = env.info();
      Assertions.assertEquals(1L, info.me_last_txnid());
      Assertions.assertEquals(MemoryLibrary.DEFAULT_MAX_READERS, info.me_maxreaders());
      Assertions.assertEquals(0, info.me_numreaders());
      Assertions.assertEquals(0, env.readerCheck());
    }
  }

  @Test
  public void sync() {
    try (final var env = Env.create(lib).open(dir.toString())) {
      env.sync();
      env.sync(false);
      lib.failNext("mdb_env_sync", Code.EIO);
      final var e = Assertions.assertThrows(LMDBRuntimeError.class, env::sync);
      Assertions.assertEquals(Code.EIO, e.code());
    }
  }

  @Test
  public void syncReadOnlyEnvironment() {
    Env.create(lib).open(dir.toString()).close();
    try (final var env = Env.create(lib).open(dir.toString(), EnvFlags.MDB_RDONLY)) {
      final var e = Assertions.assertThrows(LMDBRuntimeError.class, env::sync);
      Assertions.assertEquals(Code.EACCES, e.code());
      final var begin = Assertions.assertThrows(LMDBRuntimeError.class, env::begin);
      Assertions.assertEquals(Code.EACCES, begin.code());
      Assertions.assertEquals("mdb_txn_begin", begin.origin());
    }
  }

  @Test
  public void useAfterCloseIsLogicError() {
    final var env = Env.create(lib).open(dir.toString());
    env.close();
    final var e = Assertions.assertThrows(LMDBLogicError.class, env::sync);
    Assertions.assertEquals(LMDBError.Kind.LOGIC, e.kind());
    Assertions.assertEquals(Code.EINVAL, e.code());
    Assertions.assertThrows(LMDBLogicError.class, env::begin);
    Assertions.assertThrows(LMDBLogicError.class, () -> env.setMapSize(1L << 20));
    Assertions.assertThrows(LMDBLogicError.class, env::stat);
  }

  @Test
  public void closeAbortsActiveTransactions() {
    final var env = Env.create(lib).open(dir.toString());
    final var writer = env.begin();
    final var child = env.begin(writer, TxnFlags.NONE);
    final var reader = env.begin(TxnFlags.MDB_RDONLY);
    Assertions.assertEquals(2, env.activeTransactions());
    Assertions.assertEquals(3, lib.liveTxns());

    env.close();

    Assertions.assertEquals(0, lib.liveTxns());
    Assertions.assertEquals(0, lib.invalidReleases());
    Assertions.assertEquals(Txn.State.ABORTED, writer.state());
    Assertions.assertEquals(Txn.State.ABORTED, child.state());
    Assertions.assertEquals(Txn.State.ABORTED, reader.state());
    writer.close();
    reader.close();
    Assertions.assertEquals(0, lib.invalidReleases());
  }

  @Test
  public void openWithConfig() {
    final var config = MDB.config().maxDbs(3).maxReaders(16).mapSize(1L << 21);
    try (final var env = Env.open(lib, dir.toString(), config)) {
      Assertions.assertTrue(env.isOpen());
      Assertions.assertEquals(16, env.maxReaders());
      Assertions.assertEquals(1L << 21, env.info().me_mapsize());
    }
  }

  @Test
  public void openWithConfigClosesOnFailure() {
    final var missing = dir.resolve("nope").toString();
    Assertions.assertThrows(
        LMDBRuntimeError.class, () -> Env.open(lib, missing, MDB.config()));
    Assertions.assertEquals(0, lib.liveEnvs());
  }
}
