package io.bisque.mdb.c;

/// A native `size_t` / `mdb_size_t` cell.
public final class LongRef implements AutoCloseable {
  public static final long SIZE = 8L;
  private long ptr;

  private LongRef(long ptr) {
    this.ptr = ptr;
  }

  public static LongRef allocate() {
    return new LongRef(Memory.allocZeroed(SIZE));
  }

  public long address() {
    return ptr;
  }

  public long value() {
    return ptr == 0L ? 0L : Memory.getLong(ptr);
  }

  public void value(long value) {
    if (ptr != 0L) {
      Memory.putLong(ptr, value);
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
