package ca.gc.cra.veil.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for VEIL CLI flows.
 * <p><strong>Why:</strong> Carriers and secrets must be readable before decoding starts, and stego
 * images or recovered files must never silently replace an existing file.
 * <p><strong>Role:</strong> Support utilities executed before adapters open images or payload files.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Normalize user-provided paths to real, canonical locations.</li>
 *   <li>Reject missing, unreadable or non-regular input files.</li>
 *   <li>Guard against overwriting output files unless explicitly approved.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless methods; concurrency limited by underlying filesystem semantics.</p>
 * <p><strong>Observability:</strong> Emits no logs; callers surface validation exceptions.</p>
 *
 * @implNote Existence checks use {@link LinkOption#NOFOLLOW_LINKS} so a symlink at the output location
 * is treated as an existing file.
 * @since 0.1.0
 * @see Strings
 * @see Numbers
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates that a path names an existing, readable regular file.
   *
   * @param name logical parameter name for diagnostics
   * @param path candidate file; must not be {@code null}
   * @return canonical file path
   * @throws IllegalArgumentException if the file is missing, unreadable or not a regular file
   */
  public static Path validateReadableFile(String name, Path path) {
    Path normalized = normalize(name, path);
    try {
      Path real = normalized.toRealPath();
      if (!Files.isRegularFile(real)) {
        throw new IllegalArgumentException(name + " must be a regular file: " + path);
      }
      if (!Files.isReadable(real)) {
        throw new IllegalArgumentException(name + " is not readable: " + path);
      }
      return real;
    } catch (IOException ex) {
      throw new IllegalArgumentException(name + " does not exist: " + path, ex);
    }
  }

  /**
   * Validates an output file location.
   *
   * @param name logical parameter name for diagnostics
   * @param path candidate output file; must not be {@code null}
   * @param allowOverwrite when {@code false}, an existing file at {@code path} is rejected
   * @param createParents whether to create missing parent directories
   * @return absolute normalized output path
   * @throws IllegalArgumentException if the file exists without permission to overwrite, the target
   *     is a directory, or the parent directory is not writable
   */
  public static Path validateOutputFile(String name, Path path, boolean allowOverwrite, boolean createParents) {
    Path normalized = normalize(name, path);
    if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
      if (Files.isDirectory(normalized, LinkOption.NOFOLLOW_LINKS)) {
        throw new IllegalArgumentException(name + " is a directory: " + normalized);
      }
      if (!allowOverwrite) {
        throw new IllegalArgumentException(
            name + " " + normalized + " already exists; re-run with --allow-overwrite to replace it");
      }
    }
    Path parent = normalized.getParent();
    if (parent == null) {
      throw new IllegalArgumentException(name + " has no parent directory: " + normalized);
    }
    validateWritableDir(parent, createParents);
    return normalized;
  }

  /**
   * Validates a writable directory, optionally creating it.
   *
   * @param path candidate directory; must not be {@code null}
   * @param createIfMissing whether to create the directory (and parents) when absent
   * @return canonical directory path when it exists, otherwise the absolute normalized path
   * @throws IllegalArgumentException if the path is not a writable directory or creation fails
   */
  public static Path validateWritableDir(Path path, boolean createIfMissing) {
    Path normalized = normalize("directory", path);
    try {
      if (!Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        if (!createIfMissing) {
          Path ancestor = nearestExistingAncestor(normalized);
          if (!Files.isWritable(ancestor)) {
            throw new IllegalArgumentException("directory is not writable: " + ancestor);
          }
          return normalized;
        }
        Files.createDirectories(normalized);
      }
      Path real = normalized.toRealPath();
      if (!Files.isDirectory(real)) {
        throw new IllegalArgumentException("path is not a directory: " + real);
      }
      if (!Files.isWritable(real)) {
        throw new IllegalArgumentException("directory is not writable: " + real);
      }
      return real;
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to validate directory " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  private static Path normalize(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException((name == null ? "path" : name) + " must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("path must not contain null bytes");
    }
    if (containsControl(raw)) {
      throw new IllegalArgumentException("path must not contain control characters");
    }
    return path.toAbsolutePath().normalize();
  }

  private static Path nearestExistingAncestor(Path start) throws IOException {
    Path current = start;
    while (current != null && !Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
      current = current.getParent();
    }
    if (current == null) {
      throw new IllegalArgumentException("no existing ancestor for " + start);
    }
    return current.toRealPath();
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }
}
