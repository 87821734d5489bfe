package ca.gc.cra.veil.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads VEIL configuration from a YAML document and flattens sections into simple key/value maps.
 *
 * <p>The document may hold a {@code common} section plus one section per CLI mode
 * ({@code hide}, {@code extract}, {@code capacity}). Keys of the mode section win over
 * {@code common}. Nested maps flatten to dotted keys. Any other top-level section is rejected so
 * that a misspelt mode does not silently fall back to defaults.</p>
 */
public final class YamlConfigLoader {
  private static final String COMMON = "common";
  private static final Set<String> SECTIONS = Set.of(COMMON, "hide", "extract", "capacity");

  private YamlConfigLoader() {}

  /**
   * Loads YAML from {@code path} and merges the {@code common} section with the requested {@code mode} section.
   *
   * @param path location of the YAML configuration
   * @param mode CLI mode (hide, extract, capacity)
   * @return optional flat map containing merged configuration; empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(mode, "mode");
    String normalizedMode = mode.trim().toLowerCase(Locale.ROOT);
    if (!SECTIONS.contains(normalizedMode) || COMMON.equals(normalizedMode)) {
      throw new IllegalArgumentException("Unsupported mode: " + mode);
    }
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }

    Map<String, Object> sections = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : asMap(document, "root").entrySet()) {
      String section = entry.getKey().trim().toLowerCase(Locale.ROOT);
      if (!SECTIONS.contains(section)) {
        throw new IllegalArgumentException(
            "Unknown section '" + entry.getKey() + "' in " + path + " (expected one of " + SECTIONS + ")");
      }
      sections.put(section, entry.getValue());
    }

    Map<String, String> flattened = new LinkedHashMap<>();
    for (String section : new String[] {COMMON, normalizedMode}) {
      Object node = sections.get(section);
      if (node != null) {
        flatten(asMap(node, section), "", flattened);
      }
    }
    return Optional.of(Map.copyOf(flattened));
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key) || key.isBlank()) {
        throw new IllegalArgumentException(context + " section contains a blank or non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = prefix.isEmpty() ? entry.getKey() : prefix + '.' + entry.getKey();
      Object value = entry.getValue();
      if (value == null) {
        target.put(key, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, key), key, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML lists are not supported for key " + key);
      } else {
        target.put(key, value.toString());
      }
    }
  }
}
