package ca.gc.cra.veil.domain.image;

import java.util.Arrays;

/**
 * <strong>What:</strong> Immutable 8-bit RGB raster stored as a flat channel sequence.
 * <p><strong>Why:</strong> Codecs address carriers strictly by channel index, so the raster is
 * modelled as one row-major array rather than a 2D structure.</p>
 * <p><strong>Role:</strong> Domain value shared by carriers, image payloads and recovered images.</p>
 * <p><strong>Layout:</strong> pixel {@code (x, y)} channel {@code c} lives at
 * {@code (y * width + x) * 3 + c} with {@code c} = 0 (red), 1 (green), 2 (blue).</p>
 * <p><strong>Thread-safety:</strong> Immutable; the channel array is copied on the way in and out.</p>
 * <p><strong>Performance:</strong> {@link #channel(int)} reads without copying; prefer it in loops.</p>
 *
 * @since 0.1.0
 */
public final class RgbImage {
  /** Channels per pixel. */
  public static final int CHANNELS_PER_PIXEL = 3;

  private final int width;
  private final int height;
  private final byte[] channels;

  /**
   * Creates an image from a channel sequence.
   *
   * @param width width in pixels; must be positive
   * @param height height in pixels; must be positive
   * @param channels row-major RGB channel values, length {@code width * height * 3}
   * @throws IllegalArgumentException if the dimensions are not positive or the array length is wrong
   */
  public RgbImage(int width, int height, byte[] channels) {
    if (width <= 0 || height <= 0) {
      throw new IllegalArgumentException("image dimensions must be positive (was " + width + "x" + height + ")");
    }
    if (channels == null) {
      throw new IllegalArgumentException("channels must not be null");
    }
    long expected = (long) width * height * CHANNELS_PER_PIXEL;
    if (expected > Integer.MAX_VALUE) {
      throw new IllegalArgumentException("image " + width + "x" + height + " is too large");
    }
    if (channels.length != expected) {
      throw new IllegalArgumentException(
          "expected " + expected + " channel values for " + width + "x" + height + " but got " + channels.length);
    }
    this.width = width;
    this.height = height;
    this.channels = channels.clone();
  }

  /**
   * Creates an all-black image.
   *
   * @param width width in pixels
   * @param height height in pixels
   * @return new image whose channels are all zero
   */
  public static RgbImage blank(int width, int height) {
    return new RgbImage(width, height, new byte[Math.multiplyExact(Math.multiplyExact(width, height), CHANNELS_PER_PIXEL)]);
  }

  public int width() {
    return width;
  }

  public int height() {
    return height;
  }

  /** Number of pixels, {@code width * height}. */
  public int pixelCount() {
    return width * height;
  }

  /** Number of channel slots, {@code width * height * 3}. */
  public int channelCount() {
    return channels.length;
  }

  /**
   * Returns the unsigned value of one channel slot.
   *
   * @param index flat channel index
   * @return value in {@code [0, 255]}
   */
  public int channel(int index) {
    return channels[index] & 0xFF;
  }

  /**
   * Returns the flat channel index of a pixel component.
   *
   * @param x column
   * @param y row
   * @param component 0 for red, 1 for green, 2 for blue
   * @return flat index into the channel sequence
   */
  public int indexOf(int x, int y, int component) {
    if (x < 0 || x >= width || y < 0 || y >= height || component < 0 || component >= CHANNELS_PER_PIXEL) {
      throw new IndexOutOfBoundsException("(" + x + "," + y + "," + component + ") outside " + width + "x" + height);
    }
    return (y * width + x) * CHANNELS_PER_PIXEL + component;
  }

  /**
   * Returns a copy of the channel sequence that the caller may modify.
   *
   * @return copied channel values
   */
  public byte[] channels() {
    return channels.clone();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof RgbImage that)) {
      return false;
    }
    return width == that.width && height == that.height && Arrays.equals(channels, that.channels);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * width + height) + Arrays.hashCode(channels);
  }

  @Override
  public String toString() {
    return "RgbImage[" + width + "x" + height + "]";
  }
}
