package ca.gc.cra.veil.infrastructure.image;

import ca.gc.cra.veil.application.port.ImageCodecPort;
import ca.gc.cra.veil.domain.image.RgbImage;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import javax.imageio.ImageIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ImageCodecPort} backed by {@link ImageIO}.
 * <p><strong>Role:</strong> Infrastructure adapter for carrier, stego and payload images.</p>
 * <p><strong>Formats:</strong> reads anything ImageIO decodes (PNG, BMP, GIF, JPEG); alpha is
 * dropped and indexed or grayscale rasters are expanded to RGB. Always writes PNG.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class ImageIoCodecAdapter implements ImageCodecPort {
  private static final Logger log = LoggerFactory.getLogger(ImageIoCodecAdapter.class);
  private static final String FORMAT = "png";

  @Override
  public RgbImage read(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.isRegularFile(path)) {
      throw new IOException("image not found: " + path);
    }
    BufferedImage buffered = ImageIO.read(path.toFile());
    if (buffered == null) {
      throw new IOException("unsupported or unreadable image: " + path);
    }
    if (buffered.getColorModel().hasAlpha()) {
      log.warn("Alpha channel of {} is ignored", path);
    }
    int width = buffered.getWidth();
    int height = buffered.getHeight();
    byte[] channels = new byte[Math.multiplyExact(Math.multiplyExact(width, height), RgbImage.CHANNELS_PER_PIXEL)];
    int[] row = new int[width];
    int pos = 0;
    for (int y = 0; y < height; y++) {
      buffered.getRGB(0, y, width, 1, row, 0, width);
      for (int x = 0; x < width; x++) {
        int rgb = row[x];
        channels[pos++] = (byte) (rgb >>> 16);
        channels[pos++] = (byte) (rgb >>> 8);
        channels[pos++] = (byte) rgb;
      }
    }
    log.debug("Read {}x{} image from {}", width, height, path);
    return new RgbImage(width, height, channels);
  }

  @Override
  public void write(RgbImage image, Path path) throws IOException {
    Objects.requireNonNull(image, "image");
    Objects.requireNonNull(path, "path");
    BufferedImage buffered = new BufferedImage(image.width(), image.height(), BufferedImage.TYPE_INT_RGB);
    int[] row = new int[image.width()];
    for (int y = 0; y < image.height(); y++) {
      for (int x = 0; x < image.width(); x++) {
        int base = image.indexOf(x, y, 0);
        row[x] = (image.channel(base) << 16) | (image.channel(base + 1) << 8) | image.channel(base + 2);
      }
      buffered.setRGB(0, y, image.width(), 1, row, 0, image.width());
    }
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    if (!ImageIO.write(buffered, FORMAT, path.toFile())) {
      throw new IOException("no PNG writer available for " + path);
    }
    log.debug("Wrote {}x{} PNG to {}", image.width(), image.height(), path);
  }
}
