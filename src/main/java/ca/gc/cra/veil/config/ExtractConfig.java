package ca.gc.cra.veil.config;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Configuration for one extract run.
 *
 * @param type payload kind expected in the carrier
 * @param carrier stego image
 * @param output recovered image path for {@link PayloadType#IMAGE}; defaults to
 *     {@code recovered_image.png} next to the carrier
 * @param outputDirectory directory for recovered files of {@link PayloadType#FILE}; defaults to
 *     the carrier's directory
 * @since 0.1.0
 */
public record ExtractConfig(
    PayloadType type, Path carrier, Optional<Path> output, Optional<Path> outputDirectory) {
  /** File name of a recovered image when no output is given. */
  public static final String DEFAULT_IMAGE_NAME = "recovered_image.png";

  public ExtractConfig {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(carrier, "carrier");
    output = Objects.requireNonNullElse(output, Optional.empty());
    outputDirectory = Objects.requireNonNullElse(outputDirectory, Optional.empty());
    if (output.isPresent() && type != PayloadType.IMAGE) {
      throw new IllegalArgumentException("out only applies to type=image; use outDir for type=file");
    }
    if (outputDirectory.isPresent() && type != PayloadType.FILE) {
      throw new IllegalArgumentException("outDir only applies to type=file");
    }
  }

  /**
   * Creates a configuration from CLI-style key/value pairs.
   *
   * @param options keys {@code type}, {@code in}, {@code out}, {@code outDir}
   * @return populated configuration
   * @throws IllegalArgumentException when values are invalid or required settings are missing
   */
  public static ExtractConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    PayloadType type = PayloadType.fromString(options.get("type"));
    String in = ConfigValues.firstNonBlank(options, "in", "carrier");
    if (in == null) {
      throw new IllegalArgumentException("in (stego image) is required");
    }
    return new ExtractConfig(
        type,
        ConfigValues.parsePath("in", in),
        ConfigValues.optionalPath("out", options.get("out")),
        ConfigValues.optionalPath("outDir", options.get("outDir")));
  }

  /** Directory holding the carrier. */
  private Path carrierDirectory() {
    Path parent = carrier.toAbsolutePath().getParent();
    return parent == null ? Path.of(".").toAbsolutePath().normalize() : parent;
  }

  public Path effectiveImageOutput() {
    return output.orElseGet(() -> carrierDirectory().resolve(DEFAULT_IMAGE_NAME));
  }

  public Path effectiveOutputDirectory() {
    return outputDirectory.orElseGet(this::carrierDirectory);
  }
}
