package ca.gc.cra.veil.infrastructure.image;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.veil.domain.image.RgbImage;
import ca.gc.cra.veil.testutil.TestImages;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ImageIoCodecAdapterTest {
  private final ImageIoCodecAdapter adapter = new ImageIoCodecAdapter();

  @TempDir Path tempDir;

  @Test
  void pngRoundTripPreservesEveryChannel() throws IOException {
    RgbImage image = TestImages.random(13, 7, 42L);
    Path file = tempDir.resolve("nested").resolve("out.png");

    adapter.write(image, file);

    assertTrue(Files.isRegularFile(file));
    assertEquals(image, adapter.read(file));
  }

  @Test
  void readDropsAlphaAndKeepsColour() throws IOException {
    BufferedImage argb = new BufferedImage(2, 1, BufferedImage.TYPE_INT_ARGB);
    argb.setRGB(0, 0, 0x80112233);
    argb.setRGB(1, 0, 0xFFAABBCC);
    Path file = tempDir.resolve("alpha.png");
    ImageIO.write(argb, "png", file.toFile());

    RgbImage image = adapter.read(file);

    assertEquals(2, image.width());
    assertEquals(0xAA, image.channel(3));
    assertEquals(0xBB, image.channel(4));
    assertEquals(0xCC, image.channel(5));
  }

  @Test
  void missingAndUnreadableFilesFail() throws IOException {
    Path garbage = Files.writeString(tempDir.resolve("garbage.png"), "not an image");

    assertThrows(IOException.class, () -> adapter.read(tempDir.resolve("absent.png")));
    assertThrows(IOException.class, () -> adapter.read(garbage));
  }
}
