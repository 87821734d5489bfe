package ca.gc.cra.veil.application.port;

import ca.gc.cra.veil.domain.image.RgbImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Port for turning image files into channel buffers and back.
 * <p><strong>Why:</strong> Keeps raster formats out of the codecs, which only see {@link RgbImage}.</p>
 * <p><strong>Role:</strong> Domain port implemented by infrastructure adapters.</p>
 * <p><strong>Contract:</strong> {@link #read} drops alpha and converts palette or grayscale images
 * to 8-bit RGB; {@link #write} must be lossless, otherwise hidden bits are destroyed.</p>
 *
 * @since 0.1.0
 */
public interface ImageCodecPort {
  /**
   * Decodes an image file.
   *
   * @param path image file
   * @return decoded RGB raster
   * @throws IOException if the file cannot be read or is not a supported image
   */
  RgbImage read(Path path) throws IOException;

  /**
   * Encodes an image losslessly.
   *
   * @param image raster to write
   * @param path destination file; replaced when it exists
   * @throws IOException if the file cannot be written
   */
  void write(RgbImage image, Path path) throws IOException;
}
