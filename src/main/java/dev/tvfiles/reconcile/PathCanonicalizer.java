package dev.tvfiles.reconcile;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Utility that turns filesystem-style paths into the canonical absolute form used in keys.
 *
 * <p>Canonicalization is purely lexical: relative paths are resolved against the working
 * directory, {@code .} and {@code ..} segments and redundant separators are removed. Symbolic
 * links are not followed because the paths reported by remote catalogs do not exist on this host.
 */
public final class PathCanonicalizer {

  private PathCanonicalizer() {
    // utility class
  }

  /**
   * Canonicalize a path.
   *
   * @param path the raw path, absolute or relative
   * @return the absolute, normalized path string
   * @throws IllegalArgumentException if the path is blank or not a valid path string
   */
  public static String canonicalize(String path) {
    if (path == null || path.isBlank()) {
      throw new IllegalArgumentException("Path must not be blank");
    }
    try {
      return Path.of(path).toAbsolutePath().normalize().toString();
    } catch (InvalidPathException e) {
      throw new IllegalArgumentException("Invalid path: " + path, e);
    }
  }
}
