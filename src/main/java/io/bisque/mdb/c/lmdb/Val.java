package io.bisque.mdb.c.lmdb;

import io.bisque.mdb.c.Memory;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import org.agrona.DirectBuffer;
import org.agrona.concurrent.UnsafeBuffer;

/// Generic structure used for passing keys and data in and out of the database.
///
/// A `Val` is a view: a length and an address. It never owns or copies the bytes it points
/// at; whoever produced those bytes must keep them alive for as long as the view is used.
///
/// Values returned from the database are valid only until a subsequent update operation, or the
/// end of the transaction. Do not modify or free them, they commonly point into the database
/// itself.
///
/// Key sizes must be between 1 and #mdb_env_get_maxkeysize() inclusive. The same applies to
/// data sizes in databases with the #MDB_DUPSORT flag. Other data items can in theory be from 0
/// to 0xffffffff bytes long.
public interface Val {
  /// sizeof(MDB_val)
  long SIZE = 16L;
  /// offsetof(MDB_val, mv_size)
  long MV_SIZE_OFFSET = 0L;
  /// offsetof(MDB_val, mv_data)
  long MV_DATA_OFFSET = 8L;

  Rec EMPTY = new Rec(0L, 0L);

  /// size of the data item
  long mv_size();

  /// address of the data item
  long mv_data();

  static Rec of(long address, long size) {
    if (size < 0L) {
      throw new IllegalArgumentException("negative size: " + size);
    }
    if (address == 0L && size != 0L) {
      throw new IllegalArgumentException("null address with size " + size);
    }
    return new Rec(size, address);
  }

  /// View of the whole of an off-heap buffer.
  static Rec of(DirectBuffer buffer) {
    return of(buffer, 0, buffer.capacity());
  }

  /// View of `length` bytes of an off-heap buffer starting at `offset`.
  static Rec of(DirectBuffer buffer, int offset, int length) {
    if (buffer.byteArray() != null) {
      throw new IllegalArgumentException("buffer is on-heap and has no stable address");
    }
    buffer.boundsCheck(offset, length);
    return new Rec(length, buffer.addressOffset() + offset);
  }

  /// View of a NUL-terminated string; the terminator is not part of the view.
  static Rec ofCString(long address) {
    return new Rec(Memory.strlen(address), address);
  }

  /// Zero-copy buffer over the viewed bytes.
  default UnsafeBuffer buffer() {
    final var size = mv_size();
    if (size > Integer.MAX_VALUE) {
      throw new IllegalStateException("value too large for a buffer: " + size);
    }
    if (mv_data() == 0L || size == 0L) {
      return new UnsafeBuffer(new byte[0]);
    }
    return new UnsafeBuffer(mv_data(), (int) size);
  }

  default byte[] toBytes() {
    final var size = mv_size();
    if (mv_data() == 0L || size <= 0L) {
      return new byte[0];
    }
    final var b = new byte[Math.toIntExact(size)];
    Memory.copy(mv_data(), b, 0, size);
    return b;
  }

  default String asString() {
    return new String(toBytes(), StandardCharsets.UTF_8);
  }

  /// The value as a native-order `long`; the view must be exactly 8 bytes.
  default long asLong() {
    if (mv_size() != Long.BYTES) {
      throw new IllegalStateException("expected 8 bytes but value has " + mv_size());
    }
    return buffer().getLong(0, ByteOrder.nativeOrder());
  }

  /// The value as a native-order `int`; the view must be exactly 4 bytes.
  default int asInt() {
    if (mv_size() != Integer.BYTES) {
      throw new IllegalStateException("expected 4 bytes but value has " + mv_size());
    }
    return buffer().getInt(0, ByteOrder.nativeOrder());
  }

  /// The plain view. Trivially copyable; holds no native resources.
  record Rec(long mv_size, long mv_data) implements Val {}

  /// A native `MDB_val` laid out exactly as the engine expects, so its address can be passed
  /// directly as `MDB_val*` in either direction.
  ///
  /// The struct owns its 16 bytes of descriptor memory, never the data it points at.
  final class Struct implements Val, AutoCloseable {
    private long ptr;

    private Struct(long ptr) {
      this.ptr = ptr;
    }

    public static Struct allocate() {
      return new Struct(Memory.allocZeroed(SIZE));
    }

    /// Address of the descriptor, i.e. the `MDB_val*`.
    public long address() {
      return ptr;
    }

    @Override
    public long mv_size() {
      return ptr == 0L ? 0L : Memory.getLong(ptr + MV_SIZE_OFFSET);
    }

    @Override
    public long mv_data() {
      return ptr == 0L ? 0L : Memory.getLong(ptr + MV_DATA_OFFSET);
    }

    public Struct set(Val val) {
      return set(val.mv_data(), val.mv_size());
    }

    public Struct set(long address, long size) {
      checkOpen();
      Memory.putLong(ptr + MV_SIZE_OFFSET, size);
      Memory.putLong(ptr + MV_DATA_OFFSET, address);
      return this;
    }

    public Struct clear() {
      return set(0L, 0L);
    }

    /// Copies the current descriptor out, so it survives the struct being reused.
    public Rec snapshot() {
      return new Rec(mv_size(), mv_data());
    }

    public boolean isOpen() {
      return ptr != 0L;
    }

    private void checkOpen() {
      if (ptr == 0L) {
        throw new IllegalStateException("MDB_val descriptor already released");
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

    @Override
    public String toString() {
      return "Val.Struct[mv_size=" + mv_size() + ", mv_data=" + mv_data() + "]";
    }
  }
}
