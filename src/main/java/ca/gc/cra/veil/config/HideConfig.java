package ca.gc.cra.veil.config;

import ca.gc.cra.veil.domain.bits.BitPlanes;
import ca.gc.cra.veil.util.PathUtils;
import ca.gc.cra.veil.validation.Numbers;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * <strong>What:</strong> Configuration for one hide run.
 * <p><strong>Role:</strong> Adapter configuration aggregate for the hide CLI.</p>
 * <p><strong>Rules:</strong> text payloads need {@code message}; file and image payloads need
 * {@code secret}; {@code lsb}, {@code msb} and {@code stride} apply to image payloads only. When
 * neither depth is given the image engine picks them automatically.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param type payload kind
 * @param carrier carrier image
 * @param output optional stego image path; defaults next to the carrier
 * @param message text to hide for {@link PayloadType#TEXT}
 * @param secret file or image to hide for {@link PayloadType#FILE} and {@link PayloadType#IMAGE}
 * @param lsb optional bits written per carrier channel
 * @param msb optional bits sampled per payload channel
 * @param stride optional caller-chosen stride
 * @since 0.1.0
 */
public record HideConfig(
    PayloadType type,
    Path carrier,
    Optional<Path> output,
    Optional<String> message,
    Optional<Path> secret,
    OptionalInt lsb,
    OptionalInt msb,
    OptionalDouble stride) {

  /**
   * Validates the combination of settings.
   *
   * @throws IllegalArgumentException if a required setting is missing or does not apply to the type
   */
  public HideConfig {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(carrier, "carrier");
    output = Objects.requireNonNullElse(output, Optional.empty());
    message = Objects.requireNonNullElse(message, Optional.empty());
    secret = Objects.requireNonNullElse(secret, Optional.empty());
    lsb = Objects.requireNonNullElse(lsb, OptionalInt.empty());
    msb = Objects.requireNonNullElse(msb, OptionalInt.empty());
    stride = Objects.requireNonNullElse(stride, OptionalDouble.empty());

    switch (type) {
      case TEXT -> {
        if (message.isEmpty() || message.get().isEmpty()) {
          throw new IllegalArgumentException("message is required for type=text");
        }
      }
      case FILE, IMAGE -> {
        if (secret.isEmpty()) {
          throw new IllegalArgumentException("secret is required for type=" + type.name().toLowerCase(Locale.ROOT));
        }
      }
    }
    if (type != PayloadType.IMAGE && (lsb.isPresent() || msb.isPresent() || stride.isPresent())) {
      throw new IllegalArgumentException("lsb, msb and stride only apply to type=image");
    }
    if (lsb.isPresent()) {
      BitPlanes.requireDepth(lsb.getAsInt());
    }
    if (msb.isPresent()) {
      BitPlanes.requireDepth(msb.getAsInt());
    }
    if (stride.isPresent()) {
      Numbers.requireFiniteAtLeast("stride", stride.getAsDouble(), 1.0);
    }
  }

  /**
   * Creates a configuration from CLI-style key/value pairs.
   *
   * @param options keys {@code type}, {@code in}, {@code out}, {@code message}, {@code secret},
   *     {@code lsb}, {@code msb}, {@code stride}
   * @return populated configuration
   * @throws IllegalArgumentException when values are invalid or required settings are missing
   */
  public static HideConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    PayloadType type = PayloadType.fromString(options.get("type"));
    String in = ConfigValues.firstNonBlank(options, "in", "carrier");
    if (in == null) {
      throw new IllegalArgumentException("in (carrier image) is required");
    }
    Optional<String> message = Optional.ofNullable(options.get("message")).filter(value -> !value.isEmpty());
    return new HideConfig(
        type,
        ConfigValues.parsePath("in", in),
        ConfigValues.optionalPath("out", options.get("out")),
        message,
        ConfigValues.optionalPath("secret", options.get("secret")),
        ConfigValues.optionalInt("lsb", options.get("lsb")),
        ConfigValues.optionalInt("msb", options.get("msb")),
        ConfigValues.optionalDouble("stride", options.get("stride")));
  }

  /**
   * Resolves the stego image path, defaulting to {@code <carrier stem><suffix>} next to the carrier.
   *
   * @return output path
   */
  public Path effectiveOutput() {
    return output.orElseGet(() -> PathUtils.siblingWithSuffix(carrier, type.outputSuffix()));
  }

  /** Whether the image engine should choose depths itself. */
  public boolean automaticDepths() {
    return lsb.isEmpty() && msb.isEmpty();
  }
}
