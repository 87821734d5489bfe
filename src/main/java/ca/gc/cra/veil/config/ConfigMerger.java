package ca.gc.cra.veil.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and invariants.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI > YAML > defaults.
   *
   * @param mode active CLI mode
   * @param yaml optional YAML-derived settings for the mode
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the mode
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);

    if (cliCopy.containsKey("carrier") && !cliCopy.containsKey("in")) {
      merged.remove("in");
    }
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      String value = entry.getValue();
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (value != null) {
        merged.put(key, value);
      }
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    String type = trim(effective.get("type")).toLowerCase(Locale.ROOT);
    if ("hide".equals(normalized) && !type.isEmpty() && !"image".equals(type)) {
      for (String key : new String[] {"lsb", "msb", "stride"}) {
        if (!trim(effective.get(key)).isEmpty()) {
          throw new IllegalArgumentException(key + " requires type=image (was type=" + type + ")");
        }
      }
    }
    if ("hide".equals(normalized) && !trim(effective.get("stride")).isEmpty()
        && trim(effective.get("lsb")).isEmpty() && trim(effective.get("msb")).isEmpty()) {
      throw new IllegalArgumentException("stride requires explicit lsb and msb");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
