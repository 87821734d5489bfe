package ca.gc.cra.veil.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void modesShareCodecDefaults() {
    Map<String, String> hide = DefaultsForMode.asFlatMap("hide");
    Map<String, String> capacity = DefaultsForMode.asFlatMap("CAPACITY");

    assertEquals(hide.get("imageHeaderBits"), capacity.get("imageHeaderBits"));
    assertEquals("false", hide.get("allowOverwrite"));
    assertEquals("false", capacity.get("json"));
    assertFalse(capacity.containsKey("dryRun"));
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("assemble"));
  }
}
