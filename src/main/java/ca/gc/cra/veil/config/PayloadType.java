package ca.gc.cra.veil.config;

import java.util.Locale;

/**
 * <strong>What:</strong> Kinds of payload VEIL can hide.
 * <p><strong>Role:</strong> Configuration enum selecting the embedding engine for hide and extract.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum PayloadType {
  /** UTF-8 message terminated by zero bytes. */
  TEXT("_steg.png"),
  /** Arbitrary file with a {@code name,size} header. */
  FILE("_steg_file.png"),
  /** Second image embedded by the adaptive engine. */
  IMAGE("_steg_img.png");

  private final String outputSuffix;

  PayloadType(String outputSuffix) {
    this.outputSuffix = outputSuffix;
  }

  /**
   * Suffix appended to the carrier stem when no output path is given.
   *
   * @return suffix including the {@code .png} extension
   */
  public String outputSuffix() {
    return outputSuffix;
  }

  /**
   * Parses a payload type such as {@code "text"}, {@code "file"} or {@code "image"}.
   *
   * @param value textual representation, case-insensitive
   * @return parsed type
   * @throws IllegalArgumentException if the value is blank or unknown
   */
  public static PayloadType fromString(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("type is required (text, file or image)");
    }
    try {
      return PayloadType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown type: " + value + " (expected text, file or image)", ex);
    }
  }
}
