package io.bisque.mdb.c;

/// A native `void*` cell, used for `T**` out-parameters such as `MDB_env **env`.
public final class PointerRef implements AutoCloseable {
  public static final long SIZE = 8L;
  private long ptr;

  private PointerRef(long ptr) {
    this.ptr = ptr;
  }

  public static PointerRef allocate() {
    return new PointerRef(Memory.allocZeroed(SIZE));
  }

  public long address() {
    return ptr;
  }

  public long value() {
    return ptr == 0L ? 0L : Memory.getLong(ptr);
  }

  public void clear() {
    if (ptr != 0L) {
      Memory.putLong(ptr, 0L);
    }
  }

  @Override
  public void close() {
    final var ptr = this.ptr;
    if (ptr != 0L) {
      Memory.dealloc(ptr);
      this.ptr = 0L;
    }
  }
}
