package ca.gc.cra.veil.config;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Parsing helpers shared by the configuration records.
 */
final class ConfigValues {
  private ConfigValues() {}

  static Optional<String> optionalString(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
  }

  static String firstNonBlank(Map<String, String> options, String... keys) {
    for (String key : keys) {
      String value = options.get(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  static Path parsePath(String name, String raw) {
    try {
      return Path.of(raw.trim()).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + raw, ex);
    }
  }

  static Optional<Path> optionalPath(String name, String raw) {
    return optionalString(raw).map(value -> parsePath(name, value));
  }

  static OptionalInt optionalInt(String name, String raw) {
    Optional<String> value = optionalString(raw);
    if (value.isEmpty()) {
      return OptionalInt.empty();
    }
    try {
      return OptionalInt.of(Integer.parseInt(value.get()));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be an integer (was " + raw + ")", ex);
    }
  }

  static OptionalDouble optionalDouble(String name, String raw) {
    Optional<String> value = optionalString(raw);
    if (value.isEmpty()) {
      return OptionalDouble.empty();
    }
    try {
      return OptionalDouble.of(Double.parseDouble(value.get()));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be a number (was " + raw + ")", ex);
    }
  }

  static int intOrDefault(String name, String raw, int defaultValue) {
    OptionalInt value = optionalInt(name, raw);
    return value.isPresent() ? value.getAsInt() : defaultValue;
  }

  static double doubleOrDefault(String name, String raw, double defaultValue) {
    OptionalDouble value = optionalDouble(name, raw);
    return value.isPresent() ? value.getAsDouble() : defaultValue;
  }

  static boolean parseBoolean(String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }
}
