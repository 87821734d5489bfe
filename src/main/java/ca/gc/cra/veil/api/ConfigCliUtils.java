package ca.gc.cra.veil.api;

import ca.gc.cra.veil.config.ConfigMerger;
import ca.gc.cra.veil.config.DefaultsForMode;
import ca.gc.cra.veil.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Shared configuration plumbing for the VEIL commands: {@code config=FILE.yaml} handling, the
 * defaults/YAML/CLI merge and boolean parsing.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Outcome of {@link #resolve}: either an effective configuration or the exit code to return.
   *
   * @param effective merged configuration, empty on failure
   * @param failure exit code when resolution failed
   */
  record Resolution(Map<String, String> effective, Optional<ExitCode> failure) {
    static Resolution failed(ExitCode code) {
      return new Resolution(Map.of(), Optional.of(code));
    }

    boolean isFailure() {
      return failure.isPresent();
    }
  }

  /**
   * Parses key/value arguments, loads the optional YAML file and merges both over the mode defaults.
   * Errors are logged and the usage line is printed before a failed resolution is returned.
   *
   * @param mode CLI mode
   * @param input parsed CLI input
   * @param usage one-line usage printed on argument errors
   * @param log logger of the calling command
   * @return resolution holding the effective configuration or the failure exit code
   */
  static Resolution resolve(String mode, CliInput input, String usage, Logger log) {
    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      return Resolution.failed(ExitCode.INVALID_ARGS);
    }

    String configPath = extractConfigPath(kv);
    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(usage);
        return Resolution.failed(ExitCode.INVALID_ARGS);
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, mode);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        return Resolution.failed(ExitCode.CONFIG_ERROR);
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return Resolution.failed(ExitCode.IO_ERROR);
      }
    }

    try {
      Map<String, String> effective =
          ConfigMerger.buildEffectiveConfig(mode, yamlConfig, kv, DefaultsForMode.asFlatMap(mode), log::warn);
      return new Resolution(effective, Optional.empty());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}", mode, ex.getMessage());
      CliPrinter.println(usage);
      return Resolution.failed(ExitCode.INVALID_ARGS);
    }
  }

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    return value != null && Boolean.parseBoolean(value.trim());
  }
}
