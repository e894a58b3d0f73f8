package io.bisque.mdb.c;

/// A native `unsigned int` / `int` cell for out-parameters such as `MDB_dbi *dbi`.
public final class IntRef implements AutoCloseable {
  public static final long SIZE = 4L;
  private long ptr;

  private IntRef(long ptr) {
    this.ptr = ptr;
  }

  public static IntRef allocate() {
    return new IntRef(Memory.allocZeroed(SIZE));
  }

  public long address() {
    return ptr;
  }

  public int value() {
    return ptr == 0L ? 0 : Memory.getInt(ptr);
  }

  public void value(int value) {
    if (ptr != 0L) {
      Memory.putInt(ptr, value);
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
