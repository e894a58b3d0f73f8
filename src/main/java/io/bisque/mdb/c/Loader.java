package io.bisque.mdb.c;

import static java.lang.System.getProperty;
import static java.lang.Thread.currentThread;
import static java.util.Locale.ENGLISH;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import lombok.extern.slf4j.Slf4j;

/// Locates native libraries for JNA.
///
/// Resolution order for a library `name`:
///
///   1. the system property `mdb.library.path`, used as-is;
///   2. a classpath resource `io/bisque/mdb/c/lib<name>-<os>-<arch>.<ext>`, extracted to a
///      temporary file;
///   3. the bare `name`, left to JNA's own search (`jna.library.path`, system paths).
@Slf4j
public final class Loader {
  public static final String LIBRARY_PATH_PROPERTY = "mdb.library.path";

  private Loader() {}

  public static String resolve(String name) {
    final var explicit = getProperty(LIBRARY_PATH_PROPERTY);
    if (explicit != null && !explicit.isBlank()) {
      log.info("using {} from {}={}", name, LIBRARY_PATH_PROPERTY, explicit);
      return explicit;
    }
    final var resource =
        TargetName.resolveFilename(name, getProperty("os.arch"), getProperty("os.name"));
    final ClassLoader cl = currentThread().getContextClassLoader();
    if (resource != null && cl != null && cl.getResource(resource) != null) {
      final var extracted = extract(resource, cl);
      log.info("using bundled {} extracted to {}", name, extracted);
      return extracted;
    }
    log.info("using system library {}", name);
    return name;
  }

  private static String extract(final String name, final ClassLoader cl) {
    final var lastSlash = name.lastIndexOf('/');
    final var fileName = lastSlash > -1 ? name.substring(lastSlash + 1) : name;
    final var dot = fileName.lastIndexOf('.');
    final var prefix = dot > 0 ? fileName.substring(0, dot) : fileName;
    final var suffix = dot > 0 ? fileName.substring(dot) : ".so";
    try {
      final File file = File.createTempFile(prefix, suffix);
      file.deleteOnExit();
      try (InputStream in = cl.getResourceAsStream(name);
          OutputStream out = Files.newOutputStream(file.toPath())) {
        if (in == null) {
          throw new IllegalStateException("Classpath resource not found: " + name);
        }
        int bytes;
        final byte[] buffer = new byte[8192];
        while (-1 != (bytes = in.read(buffer))) {
          out.write(buffer, 0, bytes);
        }
      }
      return file.getAbsolutePath();
    } catch (final IOException e) {
      throw new IllegalStateException("Failed to extract " + name, e);
    }
  }

  /// Determines the classpath name of a bundled native library.
  public static final class TargetName {
    private TargetName() {}

    public static String resolveExtension(final String os) {
      if (check(os, "Windows", "windows", "win")) {
        return "dll";
      }
      if (check(os, "mac os x", "mac os", "ios", "macos", "macosx", "mac")) {
        return "dylib";
      }
      return "so";
    }

    /// @return the resource path, or `null` when the platform is not one we bundle for
    static String resolveFilename(final String name, final String arch, final String os) {
      final var resolvedArch = resolveArch(arch);
      final var resolvedOs = resolveOs(os);
      if (resolvedArch == null || resolvedOs == null) {
        return null;
      }
      final String pkg = TargetName.class.getPackage().getName().replace('.', '/');
      final var resolvedExtension = resolveExtension(os);
      if (resolvedOs.equals("windows")) {
        return pkg + "/" + name + "-windows-" + resolvedArch + "." + resolvedExtension;
      } else {
        return pkg + "/lib" + name + "-" + resolvedOs + "-" + resolvedArch + "."
            + resolvedExtension;
      }
    }

    /// Case insensitively checks whether the passed string starts with any of the candidate
    /// strings.
    private static boolean check(final String string, final String... candidates) {
      if (string == null) {
        return false;
      }

      final String strLower = string.toLowerCase(ENGLISH);
      for (final String c : candidates) {
        if (strLower.startsWith(c.toLowerCase(ENGLISH))) {
          return true;
        }
      }
      return false;
    }

    static String resolveArch(final String arch) {
      if (check(arch, "aarch64", "arm64")) {
        return "arm64";
      } else if (check(arch, "x86_64", "amd64", "x64")) {
        return "x86_64";
      } else if (check(arch, "riscv64", "riscv")) {
        return "riscv64";
      }
      return null;
    }

    static String resolveOs(final String os) {
      if (check(os, "linux")) {
        return "linux";
      } else if (check(os, "macos", "mac os", "darwin")) {
        return "macos";
      } else if (check(os, "win", "windows", "windows nt")) {
        return "windows";
      }
      return null;
    }
  }
}
