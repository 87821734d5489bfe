package ca.gc.cra.veil.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;

class HideConfigTest {

  @Test
  void textConfigDefaultsOutputNextToCarrier() {
    HideConfig config = HideConfig.fromMap(Map.of("type", "text", "in", "/data/cover.png", "message", " hi "));

    assertEquals(PayloadType.TEXT, config.type());
    assertEquals(" hi ", config.message().orElseThrow());
    assertEquals(Path.of("/data/cover_steg.png").toAbsolutePath(), config.effectiveOutput());
  }

  @Test
  void imageConfigParsesDepthsAndStride() {
    HideConfig config = HideConfig.fromMap(Map.of(
        "type", "image", "in", "/data/cover.bmp", "secret", "/data/s.png", "lsb", "2", "msb", "7", "stride", "4.25"));

    assertEquals(2, config.lsb().getAsInt());
    assertEquals(7, config.msb().getAsInt());
    assertEquals(4.25, config.stride().getAsDouble());
    assertFalse(config.automaticDepths());
    assertEquals("cover_steg_img.png", config.effectiveOutput().getFileName().toString());
  }

  @Test
  void imageWithoutDepthsIsAutomatic() {
    HideConfig config = HideConfig.fromMap(Map.of("type", "image", "in", "c.png", "secret", "s.png"));

    assertTrue(config.automaticDepths());
  }

  @Test
  void missingOrMisplacedSettingsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> HideConfig.fromMap(Map.of("type", "text", "in", "c.png")));
    assertThrows(IllegalArgumentException.class, () -> HideConfig.fromMap(Map.of("type", "file", "in", "c.png")));
    assertThrows(IllegalArgumentException.class, () -> HideConfig.fromMap(Map.of("type", "text", "message", "x")));
    assertThrows(IllegalArgumentException.class,
        () -> HideConfig.fromMap(Map.of("type", "file", "in", "c.png", "secret", "s", "lsb", "1")));
    assertThrows(IllegalArgumentException.class,
        () -> HideConfig.fromMap(Map.of("type", "image", "in", "c.png", "secret", "s", "lsb", "9")));
    assertThrows(IllegalArgumentException.class,
        () -> HideConfig.fromMap(Map.of("type", "image", "in", "c.png", "secret", "s", "lsb", "1", "stride", "0.5")));
    assertThrows(IllegalArgumentException.class, () -> HideConfig.fromMap(Map.of("type", "audio", "in", "c.png")));
  }
}
