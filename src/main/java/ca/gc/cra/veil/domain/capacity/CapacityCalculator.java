package ca.gc.cra.veil.domain.capacity;

import ca.gc.cra.veil.domain.bits.BitPlanes;
import ca.gc.cra.veil.domain.error.CapacityExceededException;
import ca.gc.cra.veil.domain.image.RgbImage;
import ca.gc.cra.veil.validation.Numbers;
import java.util.ArrayList;
import java.util.List;

/**
 * <strong>What:</strong> Capacity arithmetic shared by every embedding variant.
 * <p><strong>Why:</strong> Capacity must be known before the first carrier write so that a
 * payload that does not fit is rejected without touching the carrier.</p>
 * <p><strong>Role:</strong> Pure domain service used for pre-flight validation and capacity reports.</p>
 * <p><strong>Units:</strong> all results are bits unless the name says otherwise. The image
 * variant writes whole groups of three channels, so its capacity is rounded down to whole groups.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class CapacityCalculator {
  /** Bits the image variant consumes per payload pixel at full precision. */
  public static final int FULL_PRECISION_PIXEL_BITS = RgbImage.CHANNELS_PER_PIXEL * BitPlanes.CHANNEL_BITS;

  private CapacityCalculator() {}

  /**
   * Total embeddable bits of a carrier.
   *
   * @param width carrier width in pixels
   * @param height carrier height in pixels
   * @param channelsPerPixel channels used per pixel
   * @param bitDepth bits written per channel, {@code [1, 8]}
   * @return {@code width * height * channelsPerPixel * bitDepth}
   */
  public static long totalCapacityBits(int width, int height, int channelsPerPixel, int bitDepth) {
    BitPlanes.requireDepth(bitDepth);
    Numbers.requireRange("width", width, 0, Integer.MAX_VALUE);
    Numbers.requireRange("height", height, 0, Integer.MAX_VALUE);
    Numbers.requireRange("channelsPerPixel", channelsPerPixel, 1, 4);
    return (long) width * height * channelsPerPixel * bitDepth;
  }

  /**
   * Total embeddable bits of an RGB carrier.
   *
   * @param width carrier width in pixels
   * @param height carrier height in pixels
   * @param bitDepth bits written per channel
   * @return {@code width * height * 3 * bitDepth}
   */
  public static long totalCapacityBits(int width, int height, int bitDepth) {
    return totalCapacityBits(width, height, RgbImage.CHANNELS_PER_PIXEL, bitDepth);
  }

  /**
   * Bits left once the reserved region is taken out.
   *
   * @param totalBits total capacity
   * @param reservedBits reserved header or terminator bits
   * @return {@code max(0, totalBits - reservedBits)}
   */
  public static long availableCapacityBits(long totalBits, long reservedBits) {
    return Math.max(0L, totalBits - reservedBits);
  }

  /**
   * Fails when a payload needs more bits than are available.
   *
   * @param requiredBits bits the payload needs
   * @param availableBits bits the carrier offers
   * @throws CapacityExceededException if {@code requiredBits > availableBits}
   */
  public static void requireFits(long requiredBits, long availableBits) throws CapacityExceededException {
    if (requiredBits > availableBits) {
      throw new CapacityExceededException(requiredBits, availableBits);
    }
  }

  /**
   * Bits a text message needs including its terminator.
   *
   * @param messageBytes UTF-8 length of the message
   * @param terminatorBits terminator length
   * @return {@code messageBytes * 8 + terminatorBits}
   */
  public static long textRequiredBits(long messageBytes, int terminatorBits) {
    return messageBytes * Byte.SIZE + terminatorBits;
  }

  /**
   * Bits an image payload needs at a given sampling depth.
   *
   * @param payloadPixels payload pixel count
   * @param msb bits sampled per payload channel
   * @return {@code payloadPixels * 3 * msb}
   */
  public static long imageRequiredBits(long payloadPixels, int msb) {
    BitPlanes.requireDepth(msb);
    return payloadPixels * RgbImage.CHANNELS_PER_PIXEL * msb;
  }

  /**
   * Payload bits the image variant can place after the reserved slots.
   *
   * @param carrierSlots carrier channel count
   * @param reservedSlots slots reserved for the header
   * @param lsb bits written per carrier channel
   * @return {@code floor((carrierSlots - reservedSlots) / 3) * 3 * lsb}, never negative
   */
  public static long imageAvailableBits(long carrierSlots, long reservedSlots, int lsb) {
    BitPlanes.requireDepth(lsb);
    long slots = Math.max(0L, carrierSlots - reservedSlots);
    long groups = slots / RgbImage.CHANNELS_PER_PIXEL;
    return groups * RgbImage.CHANNELS_PER_PIXEL * lsb;
  }

  /**
   * Builds a capacity report.
   *
   * @param width carrier width in pixels
   * @param height carrier height in pixels
   * @param bitDepth bits written per channel
   * @param reservedBits bits reserved for header or terminator
   * @param safeUsageFraction advisory fraction of available bytes, {@code (0, 1]}
   * @return report with totals, availability and the advisory threshold
   */
  public static CapacityReport report(
      int width, int height, int bitDepth, long reservedBits, double safeUsageFraction) {
    Numbers.requireFraction("safeUsageFraction", safeUsageFraction);
    long total = totalCapacityBits(width, height, bitDepth);
    long available = availableCapacityBits(total, reservedBits);
    long availableBytes = available / Byte.SIZE;
    long safe = (long) Math.floor(availableBytes * safeUsageFraction);
    return new CapacityReport(width, height, bitDepth, total, reservedBits, available, availableBytes, safe);
  }

  /**
   * Lists image-payload capacity for every LSB depth from 1 to 8.
   *
   * @param width carrier width in pixels
   * @param height carrier height in pixels
   * @param reservedSlots slots reserved for the image header
   * @return eight estimates ordered by ascending LSB depth
   */
  public static List<ImageCapacityEstimate> imageCapacityTable(int width, int height, int reservedSlots) {
    long slots = (long) width * height * RgbImage.CHANNELS_PER_PIXEL;
    List<ImageCapacityEstimate> table = new ArrayList<>(BitPlanes.CHANNEL_BITS);
    for (int lsb = 1; lsb <= BitPlanes.CHANNEL_BITS; lsb++) {
      long bits = imageAvailableBits(slots, reservedSlots, lsb);
      long pixels = bits / FULL_PRECISION_PIXEL_BITS;
      long side = (long) Math.floor(Math.sqrt((double) pixels));
      table.add(new ImageCapacityEstimate(lsb, bits, bits / 8.0 / 1024.0, pixels, side));
    }
    return List.copyOf(table);
  }
}
