package ca.gc.cra.veil.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each VEIL CLI mode.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode target CLI mode (hide, extract, capacity)
   * @return unmodifiable map of default key/value pairs as strings
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "hide" -> buildHideDefaults();
      case "extract" -> buildExtractDefaults();
      case "capacity" -> buildCapacityDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    CodecConfig codec = CodecConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("blobHeaderBits", Integer.toString(codec.blobHeaderBits()));
    map.put("imageHeaderBits", Integer.toString(codec.imageHeaderBits()));
    map.put("textTerminatorBits", Integer.toString(codec.textTerminatorBits()));
    map.put("safeUsageFraction", Double.toString(codec.safeUsageFraction()));
    map.put("defaultLsb", Integer.toString(codec.defaultLsb()));
    map.put("defaultMsb", Integer.toString(codec.defaultMsb()));
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildHideDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("allowOverwrite", "false");
    map.put("dryRun", "false");
    return map;
  }

  private static Map<String, String> buildExtractDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("allowOverwrite", "false");
    map.put("dryRun", "false");
    return map;
  }

  private static Map<String, String> buildCapacityDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("json", "false");
    return map;
  }
}
