package ca.gc.cra.veil.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("hide");
    Map<String, String> yaml = Map.of("type", "file", "safeUsageFraction", "0.2");
    Map<String, String> cli = Map.of("type", "text", "message", "hi");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged =
        ConfigMerger.buildEffectiveConfig("hide", Optional.of(yaml), cli, defaults, warnings::add);

    assertEquals("text", merged.get("type"));
    assertEquals("0.2", merged.get("safeUsageFraction"));
    assertEquals("8192", merged.get("blobHeaderBits"));
    assertEquals(List.of("CLI overrides YAML for key: type"), warnings);
  }

  @Test
  void depthsRequireImageType() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "hide", Optional.empty(), Map.of("type", "text", "lsb", "2"), Map.of(), msg -> {}));

    assertTrue(ex.getMessage().contains("lsb requires type=image"));
  }

  @Test
  void strideRequiresExplicitDepth() {
    assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "hide", Optional.empty(), Map.of("type", "image", "stride", "3.5"), Map.of(), msg -> {}));

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "hide", Optional.empty(), Map.of("type", "image", "stride", "3.5", "msb", "6"), Map.of(), msg -> {});
    assertEquals("3.5", merged.get("stride"));
  }

  @Test
  void carrierAliasOnCliReplacesYamlInput() {
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "capacity", Optional.of(Map.of("in", "/yaml.png")), Map.of("carrier", "/cli.png"), Map.of(), msg -> {});

    assertEquals("/cli.png", merged.get("carrier"));
    assertTrue(!merged.containsKey("in"));
  }
}
