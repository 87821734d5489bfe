package ca.gc.cra.veil.util;

import java.nio.file.Path;
import java.util.Optional;

/** Utility helpers for working with {@link Path} instances. */
public final class PathUtils {
  private PathUtils() {}

  /**
   * Returns the file name for the supplied path when available.
   *
   * @param path source path; may be {@code null}
   * @return optional file name string
   */
  public static Optional<String> fileName(Path path) {
    if (path == null) {
      return Optional.empty();
    }
    Path name = path.getFileName();
    return name == null ? Optional.empty() : Optional.of(name.toString());
  }

  /**
   * Returns the file name without its last extension, e.g. {@code cover} for {@code cover.png}.
   *
   * @param path source path; may be {@code null}
   * @return stem of the file name, or {@code "output"} when the path has no file name
   */
  public static String stem(Path path) {
    String name = fileName(path).orElse("output");
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }

  /**
   * Builds a sibling path named {@code <stem><suffix>} next to {@code source}.
   *
   * @param source reference file
   * @param suffix appended to the stem, including any extension
   * @return sibling path
   */
  public static Path siblingWithSuffix(Path source, String suffix) {
    Path absolute = source.toAbsolutePath();
    Path parent = absolute.getParent();
    String name = stem(absolute) + suffix;
    return parent == null ? Path.of(name) : parent.resolve(name);
  }
}
