package io.bisque.mdb.c.lmdb;

import com.sun.jna.Native;
import io.bisque.mdb.c.Loader;
import java.util.Map;

/// [Library] bound to the system `liblmdb` through JNA interface mapping.
///
/// JNA passes Java `long` as a 64-bit integer, which matches pointer and `size_t` arguments on
/// the 64-bit platforms LMDB is built for. Strings cross as NUL-terminated UTF-8.
public interface NativeLibrary extends Library, com.sun.jna.Library {
  String NAME = "lmdb";

  static NativeLibrary load() {
    return Native.load(
        Loader.resolve(NAME),
        NativeLibrary.class,
        Map.of(com.sun.jna.Library.OPTION_STRING_ENCODING, "UTF-8"));
  }
}
