package ca.gc.cra.veil.api;

import ca.gc.cra.veil.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parses {@code key=value} arguments into an ordered map.
 *
 * <p>Keys are restricted to {@code [A-Za-z0-9._-]}. Values are trimmed and must not contain NUL or
 * control characters, except {@code message}, which is kept verbatim and may contain tabs and line
 * breaks. A repeated key keeps its last value.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");
  private static final Set<String> VERBATIM_KEYS = Set.of("message");

  private CliArgsParser() {}

  /**
   * Converts arguments to a map.
   *
   * @param args {@code key=value} arguments; may be {@code null}
   * @return mutable map in argument order
   * @throws IllegalArgumentException if an argument is malformed
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.stripLeading();
      int idx = arg.indexOf('=');
      if (idx <= 0 || idx == arg.length() - 1) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw.strip() + "')");
      }
      String key = arg.substring(0, idx).trim();
      validateKey(key);
      String value = arg.substring(idx + 1);
      if (VERBATIM_KEYS.contains(key)) {
        validateVerbatimValue(key, value);
      } else {
        value = value.trim();
        validateValue(key, value);
      }
      map.put(key, value);
    }
    return map;
  }

  private static void validateKey(String key) {
    if (!KEY_PATTERN.matcher(key).matches()) {
      throw new IllegalArgumentException("invalid argument name: " + key);
    }
  }

  private static void validateValue(String key, String value) {
    if (value.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("argument " + key + " must not contain null bytes");
    }
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        throw new IllegalArgumentException("argument " + key + " must not contain control characters");
      }
    }
    if (!value.isEmpty()) {
      Strings.requireNonBlank(key, value);
    }
  }

  private static void validateVerbatimValue(String key, String value) {
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (Character.isISOControl(c) && c != '\n' && c != '\r' && c != '\t') {
        throw new IllegalArgumentException("argument " + key + " must not contain control characters");
      }
    }
  }
}
