package ca.gc.cra.veil.config;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Configuration for a capacity report.
 *
 * @param carrier carrier image to inspect
 * @param type payload kind to report on; empty reports every kind
 * @param json whether to render the report as JSON
 * @since 0.1.0
 */
public record CapacityConfig(Path carrier, Optional<PayloadType> type, boolean json) {
  public CapacityConfig {
    Objects.requireNonNull(carrier, "carrier");
    type = Objects.requireNonNullElse(type, Optional.empty());
  }

  /**
   * Creates a configuration from CLI-style key/value pairs.
   *
   * @param options keys {@code in}, {@code type}, {@code json}
   * @return populated configuration
   * @throws IllegalArgumentException when values are invalid or {@code in} is missing
   */
  public static CapacityConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String in = ConfigValues.firstNonBlank(options, "in", "carrier");
    if (in == null) {
      throw new IllegalArgumentException("in (carrier image) is required");
    }
    Optional<PayloadType> type = ConfigValues.optionalString(options.get("type")).map(PayloadType::fromString);
    return new CapacityConfig(
        ConfigValues.parsePath("in", in), type, ConfigValues.parseBoolean(options.get("json"), false));
  }
}
