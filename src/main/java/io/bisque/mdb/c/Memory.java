package io.bisque.mdb.c;

import java.nio.charset.StandardCharsets;
import org.agrona.UnsafeAccess;
import sun.misc.Unsafe;

/// Raw native memory used for descriptors and out-parameters handed to the engine.
///
/// Addresses are plain `long` values. Every successful `alloc` must be paired with exactly one
/// `dealloc`; `dealloc(0L)` is a no-op.
public final class Memory {
  static final Unsafe UNSAFE = UnsafeAccess.UNSAFE;

  private Memory() {}

  public static long alloc(long size) {
    if (size <= 0L) {
      throw new IllegalArgumentException("size must be positive: " + size);
    }
    final var ptr = UNSAFE.allocateMemory(size);
    if (ptr == 0L) throw new OutOfMemoryError();
    return ptr;
  }

  public static long allocZeroed(long size) {
    final var ptr = alloc(size);
    UNSAFE.setMemory(ptr, size, (byte) 0);
    return ptr;
  }

  public static long realloc(long address, long size) {
    final var ptr = UNSAFE.reallocateMemory(address, size);
    if (ptr == 0L) throw new OutOfMemoryError();
    return ptr;
  }

  public static void dealloc(long ptr) {
    if (ptr == 0L) return;
    UNSAFE.freeMemory(ptr);
  }

  /// Copies `value` into a freshly allocated NUL-terminated UTF-8 string.
  public static long allocCString(String value) {
    final var b = value.getBytes(StandardCharsets.UTF_8);
    final var p = alloc(b.length + 1L);
    copy(b, 0, p, b.length);
    UNSAFE.putByte(p + b.length, (byte) 0);
    return p;
  }

  /// Length of the NUL-terminated string at `address`, terminator excluded.
  public static long strlen(long address) {
    if (address == 0L) return 0L;
    long len = 0L;
    while (UNSAFE.getByte(address + len) != 0) {
      len++;
    }
    return len;
  }

  public static String readCString(long address) {
    if (address == 0L) return null;
    final var len = (int) strlen(address);
    final var b = new byte[len];
    copy(address, b, 0, len);
    return new String(b, StandardCharsets.UTF_8);
  }

  public static void copy(byte[] src, int srcOffset, long dst, long length) {
    UNSAFE.copyMemory(src, Unsafe.ARRAY_BYTE_BASE_OFFSET + srcOffset, null, dst, length);
  }

  public static void copy(long src, byte[] dst, int dstOffset, long length) {
    UNSAFE.copyMemory(null, src, dst, Unsafe.ARRAY_BYTE_BASE_OFFSET + dstOffset, length);
  }

  public static long getLong(long address) {
    return UNSAFE.getLong(address);
  }

  public static void putLong(long address, long value) {
    UNSAFE.putLong(address, value);
  }

  public static int getInt(long address) {
    return UNSAFE.getInt(address);
  }

  public static void putInt(long address, int value) {
    UNSAFE.putInt(address, value);
  }
}
