package io.bisque.mdb.c.lmdb;

/// The engine's procedural contract.
///
/// One method per LMDB function, named after it. Pointers are raw addresses (`0L` is `NULL`),
/// `MDB_dbi` and flag words are `int`, sizes are `long`. Every `int` result is an LMDB status
/// code. Nothing here throws for an engine-reported failure; turning codes into exceptions is
/// the job of [Env], [Txn], [Dbi] and [Cursor].
///
/// [NativeLibrary] binds this to `liblmdb`.
public interface Library {
  // char *mdb_version(int *major, int *minor, int *patch);
  String mdb_version(long major, long minor, long patch);

  // char *mdb_strerror(int err);
  String mdb_strerror(int err);

  /////////////////////////////////////////////////////////////////////////////
  // Environment
  /////////////////////////////////////////////////////////////////////////////

  // int mdb_env_create(MDB_env **env);
  int mdb_env_create(long env);

  // int mdb_env_open(MDB_env *env, const char *path, unsigned int flags, mdb_mode_t mode);
  int mdb_env_open(long env, String path, int flags, int mode);

  // int mdb_env_stat(MDB_env *env, MDB_stat *stat);
  int mdb_env_stat(long env, long stat);

  // int mdb_env_info(MDB_env *env, MDB_envinfo *stat);
  int mdb_env_info(long env, long info);

  // int mdb_env_sync(MDB_env *env, int force);
  int mdb_env_sync(long env, int force);

  // void mdb_env_close(MDB_env *env);
  void mdb_env_close(long env);

  // int mdb_env_set_flags(MDB_env *env, unsigned int flags, int onoff);
  int mdb_env_set_flags(long env, int flags, int onoff);

  // int mdb_env_get_flags(MDB_env *env, unsigned int *flags);
  int mdb_env_get_flags(long env, long flags);

  // int mdb_env_get_path(MDB_env *env, const char **path);
  int mdb_env_get_path(long env, long path);

  // int mdb_env_set_mapsize(MDB_env *env, mdb_size_t size);
  int mdb_env_set_mapsize(long env, long size);

  // int mdb_env_set_maxreaders(MDB_env *env, unsigned int readers);
  int mdb_env_set_maxreaders(long env, int readers);

  // int mdb_env_get_maxreaders(MDB_env *env, unsigned int *readers);
  int mdb_env_get_maxreaders(long env, long readers);

  // int mdb_env_set_maxdbs(MDB_env *env, MDB_dbi dbs);
  int mdb_env_set_maxdbs(long env, int dbs);

  // int mdb_env_get_maxkeysize(MDB_env *env);
  int mdb_env_get_maxkeysize(long env);

  // int mdb_reader_check(MDB_env *env, int *dead);
  int mdb_reader_check(long env, long dead);

  /////////////////////////////////////////////////////////////////////////////
  // Transaction
  /////////////////////////////////////////////////////////////////////////////

  // int mdb_txn_begin(MDB_env *env, MDB_txn *parent, unsigned int flags, MDB_txn **txn);
  int mdb_txn_begin(long env, long parent, int flags, long txn);

  // MDB_env *mdb_txn_env(MDB_txn *txn);
  long mdb_txn_env(long txn);

  // mdb_size_t mdb_txn_id(MDB_txn *txn);
  long mdb_txn_id(long txn);

  // int mdb_txn_commit(MDB_txn *txn);
  int mdb_txn_commit(long txn);

  // void mdb_txn_abort(MDB_txn *txn);
  void mdb_txn_abort(long txn);

  // void mdb_txn_reset(MDB_txn *txn);
  void mdb_txn_reset(long txn);

  // int mdb_txn_renew(MDB_txn *txn);
  int mdb_txn_renew(long txn);

  /////////////////////////////////////////////////////////////////////////////
  // Database
  /////////////////////////////////////////////////////////////////////////////

  // int mdb_dbi_open(MDB_txn *txn, const char *name, unsigned int flags, MDB_dbi *dbi);
  int mdb_dbi_open(long txn, String name, int flags, long dbi);

  // int mdb_stat(MDB_txn *txn, MDB_dbi dbi, MDB_stat *stat);
  int mdb_stat(long txn, int dbi, long stat);

  // int mdb_dbi_flags(MDB_txn *txn, MDB_dbi dbi, unsigned int *flags);
  int mdb_dbi_flags(long txn, int dbi, long flags);

  // void mdb_dbi_close(MDB_env *env, MDB_dbi dbi);
  void mdb_dbi_close(long env, int dbi);

  // int mdb_drop(MDB_txn *txn, MDB_dbi dbi, int del);
  int mdb_drop(long txn, int dbi, int del);

  // int mdb_get(MDB_txn *txn, MDB_dbi dbi, MDB_val *key, MDB_val *data);
  int mdb_get(long txn, int dbi, long key, long data);

  // int mdb_put(MDB_txn *txn, MDB_dbi dbi, MDB_val *key, MDB_val *data, unsigned int flags);
  int mdb_put(long txn, int dbi, long key, long data, int flags);

  // int mdb_del(MDB_txn *txn, MDB_dbi dbi, MDB_val *key, MDB_val *data);
  int mdb_del(long txn, int dbi, long key, long data);

  /////////////////////////////////////////////////////////////////////////////
  // Cursor
  /////////////////////////////////////////////////////////////////////////////

  // int mdb_cursor_open(MDB_txn *txn, MDB_dbi dbi, MDB_cursor **cursor);
  int mdb_cursor_open(long txn, int dbi, long cursor);

  // void mdb_cursor_close(MDB_cursor *cursor);
  void mdb_cursor_close(long cursor);

  // int mdb_cursor_renew(MDB_txn *txn, MDB_cursor *cursor);
  int mdb_cursor_renew(long txn, long cursor);

  // MDB_txn *mdb_cursor_txn(MDB_cursor *cursor);
  long mdb_cursor_txn(long cursor);

  // MDB_dbi mdb_cursor_dbi(MDB_cursor *cursor);
  int mdb_cursor_dbi(long cursor);

  // int mdb_cursor_get(MDB_cursor *cursor, MDB_val *key, MDB_val *data, MDB_cursor_op op);
  int mdb_cursor_get(long cursor, long key, long data, int op);

  // int mdb_cursor_put(MDB_cursor *cursor, MDB_val *key, MDB_val *data, unsigned int flags);
  int mdb_cursor_put(long cursor, long key, long data, int flags);

  // int mdb_cursor_del(MDB_cursor *cursor, unsigned int flags);
  int mdb_cursor_del(long cursor, int flags);

  // int mdb_cursor_count(MDB_cursor *cursor, mdb_size_t *countp);
  int mdb_cursor_count(long cursor, long countp);
}
