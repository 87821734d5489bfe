package ca.gc.cra.veil.config;

import ca.gc.cra.veil.domain.bits.BitPlanes;
import ca.gc.cra.veil.domain.codec.AdaptiveImageEmbedder;
import ca.gc.cra.veil.domain.codec.BlobEmbedder;
import ca.gc.cra.veil.domain.codec.TextEmbedder;
import ca.gc.cra.veil.validation.Numbers;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Frozen codec constants shared by every command.
 * <p><strong>Why:</strong> Header region sizes and the text terminator decide where bits live in a
 * carrier; hide and extract must agree on them, so they are fixed once per run and handed to every
 * engine by {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param blobHeaderBits reserved header region of the file variant, in slots
 * @param imageHeaderBits reserved header region of the image variant, in slots
 * @param textTerminatorBits terminator length of the text variant
 * @param safeUsageFraction advisory fraction of capacity reported as safe
 * @param defaultLsb lsb used when only {@code msb} is given for an image payload
 * @param defaultMsb msb used when only {@code lsb} is given for an image payload
 * @since 0.1.0
 */
public record CodecConfig(
    int blobHeaderBits,
    int imageHeaderBits,
    int textTerminatorBits,
    double safeUsageFraction,
    int defaultLsb,
    int defaultMsb) {

  /** Default advisory safe-usage fraction. */
  public static final double DEFAULT_SAFE_USAGE_FRACTION = 0.10;

  /**
   * Validates codec constants.
   *
   * @throws IllegalArgumentException if a value is out of range
   */
  public CodecConfig {
    Numbers.requireRange("blobHeaderBits", blobHeaderBits, 24, 16 + 8L * 0xFFFF);
    Numbers.requireRange("imageHeaderBits", imageHeaderBits, 24, 16 + 8L * 0xFFFF);
    Numbers.requireRange("textTerminatorBits", textTerminatorBits, 8, 64);
    if (textTerminatorBits % 8 != 0) {
      throw new IllegalArgumentException("textTerminatorBits must be a multiple of 8 (was " + textTerminatorBits + ")");
    }
    Numbers.requireFraction("safeUsageFraction", safeUsageFraction);
    BitPlanes.requireDepth(defaultLsb);
    BitPlanes.requireDepth(defaultMsb);
  }

  /**
   * Returns the built-in constants.
   *
   * @return default codec configuration
   */
  public static CodecConfig defaults() {
    return new CodecConfig(
        BlobEmbedder.DEFAULT_HEADER_SLOTS,
        AdaptiveImageEmbedder.DEFAULT_HEADER_SLOTS,
        TextEmbedder.DEFAULT_TERMINATOR_BITS,
        DEFAULT_SAFE_USAGE_FRACTION,
        4,
        4);
  }

  /**
   * Reads codec constants from a flat configuration map, falling back to {@link #defaults()}.
   *
   * @param options merged configuration
   * @return codec configuration
   * @throws IllegalArgumentException if a value is malformed or out of range
   */
  public static CodecConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    CodecConfig defaults = defaults();
    return new CodecConfig(
        ConfigValues.intOrDefault("blobHeaderBits", options.get("blobHeaderBits"), defaults.blobHeaderBits()),
        ConfigValues.intOrDefault("imageHeaderBits", options.get("imageHeaderBits"), defaults.imageHeaderBits()),
        ConfigValues.intOrDefault(
            "textTerminatorBits", options.get("textTerminatorBits"), defaults.textTerminatorBits()),
        ConfigValues.doubleOrDefault(
            "safeUsageFraction", options.get("safeUsageFraction"), defaults.safeUsageFraction()),
        ConfigValues.intOrDefault("defaultLsb", options.get("defaultLsb"), defaults.defaultLsb()),
        ConfigValues.intOrDefault("defaultMsb", options.get("defaultMsb"), defaults.defaultMsb()));
  }
}
