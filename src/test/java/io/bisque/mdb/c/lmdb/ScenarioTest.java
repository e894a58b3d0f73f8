package io.bisque.mdb.c.lmdb;

import io.bisque.mdb.c.lmdb.testing.MemoryLibrary;
import io.bisque.mdb.c.lmdb.testing.Scratch;
import java.nio.file.Path;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class ScenarioTest {
  final MemoryLibrary lib = new MemoryLibrary();

  @TempDir
  Path dir;

  @Test
  public void cursorPutThenReadBack() {
    try (final var s = new Scratch();
        final var env = Env.create(lib)) {
      env.open(dir.toString());
      final Dbi dbi;
      try (final var txn = Txn.begin(env)) {
        dbi = Dbi.open(txn);
        try (final var cursor = Cursor.open(txn, dbi)) {
          cursor.put(s.str("k"), s.str("v"));
        }
        txn.commit();
      }
      try (final var txn2 = Txn.begin(env, TxnFlags.MDB_RDONLY)) {
        final var value = s.struct();
        Assertions.assertTrue(dbi.get(txn2, s.str("k"), value));
        Assertions.assertEquals("v", value.asString());
      }
    }
    Assertions.assertEquals(0, lib.liveEnvs());
    Assertions.assertEquals(0, lib.liveTxns());
    Assertions.assertEquals(0, lib.liveCursors());
    Assertions.assertEquals(0, lib.invalidReleases());
  }

  @Test
  public void bytesSurviveReopen() {
    final var payload = new byte[256];
    for (int i = 0; i < payload.length; i++) {
      payload[i] = (byte) i;
    }
    try (final var s = new Scratch()) {
      try (final var env = Env.open(lib, dir.toString(), MDB.config())) {
        try (final var txn = env.begin()) {
          final var dbi = Dbi.open(txn, "blobs", DbiFlags.MDB_CREATE);
          dbi.put(txn, s.str("blob"), s.bytes(payload));
          txn.commit();
        }
      }
      try (final var env = Env.open(lib, dir.toString(), MDB.config().flags(EnvFlags.MDB_RDONLY));
          final var txn = env.begin(TxnFlags.MDB_RDONLY)) {
        final var dbi = Dbi.open(txn, "blobs");
        final var value = s.struct();
        Assertions.assertTrue(dbi.get(txn, s.str("blob"), value));
        Assertions.assertArrayEquals(payload, value.toBytes());
      }
    }
  }

  @Test
  public void isolationBetweenConcurrentTransactions() {
    try (final var s = new Scratch();
        final var env = Env.create(lib).open(dir.toString())) {
      final Dbi dbi;
      try (final var txn = env.begin()) {
        dbi = Dbi.open(txn);
        txn.commit();
      }
      final var b = env.begin(TxnFlags.MDB_RDONLY);
      final var a = env.begin();
      dbi.put(a, s.str("k"), s.str("v"));
      Assertions.assertFalse(dbi.get(b, s.str("k")));
      a.commit();
      Assertions.assertFalse(dbi.get(b, s.str("k")));
      b.abort();
      try (final var c = env.begin(TxnFlags.MDB_RDONLY)) {
        Assertions.assertTrue(dbi.get(c, s.str("k")));
      }
    }
  }

  @Test
  public void counterWorkload() {
    try (final var s = new Scratch();
        final var env = Env.create(lib).open(dir.toString())) {
      for (long i = 1; i <= 10; i++) {
        try (final var txn = env.begin()) {
          final var dbi = Dbi.open(txn);
          final var current = s.struct();
          final long next = dbi.get(txn, s.str("counter"), current) ? current.asLong() + i : i;
          dbi.put(txn, s.str("counter"), s.i64(next));
          txn.commit();
        }
      }
      try (final var txn = env.begin(TxnFlags.MDB_RDONLY)) {
        final var value = s.struct();
        Assertions.assertTrue(Dbi.open(txn).get(txn, s.str("counter"), value));
        Assertions.assertEquals(55L, value.asLong());
        Assertions.assertEquals(10L, txn.id());
      }
    }
    Assertions.assertEquals(1L, MemoryLibrary.committedEntries(dir.toString()));
  }
}
