package ca.gc.cra.veil.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.veil.config.CodecConfig;
import ca.gc.cra.veil.config.CompositionRoot;
import ca.gc.cra.veil.config.ExtractConfig;
import ca.gc.cra.veil.config.HideConfig;
import ca.gc.cra.veil.config.PayloadType;
import ca.gc.cra.veil.domain.error.CapacityExceededException;
import ca.gc.cra.veil.domain.header.ImageHeader;
import ca.gc.cra.veil.domain.image.RgbImage;
import ca.gc.cra.veil.infrastructure.image.ImageIoCodecAdapter;
import ca.gc.cra.veil.testutil.TestImages;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class HideExtractUseCaseTest {
  private final ImageIoCodecAdapter images = new ImageIoCodecAdapter();
  private final CompositionRoot root = new CompositionRoot(CodecConfig.defaults());

  @TempDir Path tempDir;
  private Path carrier;

  @BeforeEach
  void writeCarrier() throws Exception {
    carrier = tempDir.resolve("cover.png");
    images.write(TestImages.random(64, 64, 11L), carrier);
  }

  @Test
  void textSurvivesPngRoundTrip() throws Exception {
    String message = "café at noon\nbring the map";
    HideResult hidden = root.hideUseCase().run(HideConfig.fromMap(
        Map.of("type", "text", "in", carrier.toString(), "message", message)));

    assertEquals(tempDir.resolve("cover_steg.png"), hidden.output());
    assertTrue(Files.isRegularFile(hidden.output()));

    ExtractResult extracted = root.extractUseCase().run(
        ExtractConfig.fromMap(Map.of("type", "text", "in", hidden.output().toString())), false);

    assertEquals(message, extracted.message().orElseThrow());
    assertEquals(hidden.payloadBytes(), extracted.payloadBytes());
  }

  @Test
  void fileIsRecoveredUnderPrefixedName() throws Exception {
    byte[] data = new byte[300];
    for (int i = 0; i < data.length; i++) {
      data[i] = (byte) (i * 7);
    }
    Path secret = Files.write(tempDir.resolve("notes.bin"), data);
    HideResult hidden = root.hideUseCase().run(HideConfig.fromMap(
        Map.of("type", "file", "in", carrier.toString(), "secret", secret.toString())));
    Path outDir = tempDir.resolve("recovered");

    ExtractResult extracted = root.extractUseCase().run(
        new ExtractConfig(PayloadType.FILE, hidden.output(), Optional.empty(), Optional.of(outDir)), false);

    Path written = extracted.output().orElseThrow();
    assertEquals("recovered_notes.bin", written.getFileName().toString());
    assertTrue(Files.isSameFile(outDir, written.getParent()));
    assertArrayEquals(data, Files.readAllBytes(written));
  }

  @Test
  void imageWithAutomaticParametersRoundTrips() throws Exception {
    RgbImage payload = TestImages.random(8, 8, 12L);
    Path secret = tempDir.resolve("secret.png");
    images.write(payload, secret);

    HideResult hidden = root.hideUseCase().run(HideConfig.fromMap(
        Map.of("type", "image", "in", carrier.toString(), "secret", secret.toString())));
    ImageHeader header = hidden.imageHeader().orElseThrow();
    Path out = tempDir.resolve("restored.png");
    ExtractResult extracted = root.extractUseCase().run(
        new ExtractConfig(PayloadType.IMAGE, hidden.output(), Optional.of(out), Optional.empty()), false);

    assertEquals(header, extracted.imageHeader().orElseThrow());
    assertEquals(TestImages.quantized(payload, header.msb()), images.read(out));
  }

  @Test
  void manualDepthFallsBackToConfiguredDefault() throws Exception {
    RgbImage payload = TestImages.random(4, 4, 13L);
    Path secret = tempDir.resolve("small.png");
    images.write(payload, secret);
    HideConfig config = new HideConfig(PayloadType.IMAGE, carrier, Optional.empty(), Optional.empty(),
        Optional.of(secret), OptionalInt.of(2), OptionalInt.empty(), OptionalDouble.empty());

    HideResult hidden = root.hideUseCase().run(config);

    assertEquals(2, hidden.imageHeader().orElseThrow().lsb());
    assertEquals(CodecConfig.defaults().defaultMsb(), hidden.imageHeader().orElseThrow().msb());
  }

  @Test
  void oversizedImagePayloadIsRejectedBeforeWriting() throws Exception {
    Path secret = tempDir.resolve("huge.png");
    images.write(TestImages.random(160, 160, 14L), secret);
    HideConfig config = HideConfig.fromMap(
        Map.of("type", "image", "in", carrier.toString(), "secret", secret.toString()));

    assertThrows(CapacityExceededException.class, () -> root.hideUseCase().run(config));
    assertTrue(Files.notExists(config.effectiveOutput()));
  }

  @Test
  void existingRecoveredImageNeedsOverwritePermission() throws Exception {
    Path secret = tempDir.resolve("secret.png");
    images.write(TestImages.random(2, 2, 15L), secret);
    HideResult hidden = root.hideUseCase().run(HideConfig.fromMap(
        Map.of("type", "image", "in", carrier.toString(), "secret", secret.toString())));
    Path out = Files.writeString(tempDir.resolve("taken.png"), "occupied");
    ExtractConfig config =
        new ExtractConfig(PayloadType.IMAGE, hidden.output(), Optional.of(out), Optional.empty());

    assertThrows(IllegalArgumentException.class, () -> root.extractUseCase().run(config, false));
    root.extractUseCase().run(config, true);
    assertEquals(2, images.read(out).width());
  }
}
