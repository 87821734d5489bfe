package ca.gc.cra.veil.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for strings used by VEIL headers, configuration and CLI layers.
 * <p><strong>Why:</strong> Header fields are comma-joined, so a stray delimiter or control character
 * would make a carrier unreadable after the fact.
 * <p><strong>Role:</strong> Domain support utilities invoked before a header is serialized or a file is named.
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 * <p><strong>Performance:</strong> O(n) character scans with minimal allocations.</p>
 *
 * @implNote Control characters are detected via {@link Character#isISOControl(char)}.
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input with leading/trailing whitespace removed
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Ensures a value does not contain the given delimiter character.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate text; must not be {@code null}
   * @param delimiter forbidden character
   * @return the unchanged value
   * @throws IllegalArgumentException if {@code value} contains {@code delimiter}
   */
  public static String requireNoDelimiter(String name, String value, char delimiter) {
    Objects.requireNonNull(value, name == null ? "value" : name);
    if (value.indexOf(delimiter) >= 0) {
      throw new IllegalArgumentException(message(name, "must not contain '" + delimiter + "'"));
    }
    return value;
  }

  /**
   * Reduces a name to characters that are safe in a file name.
   *
   * <p>Letters, digits, {@code '-'}, {@code '_'} and {@code '.'} are kept; everything else becomes
   * {@code '_'}. Leading dots are replaced so the result is never hidden or a parent reference.</p>
   *
   * @param value candidate name; {@code null} or blank yields {@code "payload"}
   * @return sanitized file name
   */
  public static String sanitizeFileName(String value) {
    if (value == null || value.isBlank()) {
      return "payload";
    }
    StringBuilder sb = new StringBuilder(value.length());
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (Character.isLetterOrDigit(c) || c == '-' || c == '_' || c == '.') {
        sb.append(c);
      } else {
        sb.append('_');
      }
    }
    for (int i = 0; i < sb.length() && sb.charAt(i) == '.'; i++) {
      sb.setCharAt(i, '_');
    }
    return sb.toString();
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
