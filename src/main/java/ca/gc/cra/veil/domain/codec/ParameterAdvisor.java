package ca.gc.cra.veil.domain.codec;

import ca.gc.cra.veil.domain.bits.BitPlanes;
import ca.gc.cra.veil.domain.capacity.CapacityCalculator;
import ca.gc.cra.veil.domain.image.RgbImage;
import java.util.Optional;

/**
 * <strong>What:</strong> Chooses image-in-image parameters for a carrier and payload pair.
 * <p><strong>Policy:</strong> the lowest {@code lsb} wins because it disturbs the carrier least;
 * for that {@code lsb} the highest {@code msb} that fits wins because it keeps the most payload
 * precision.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class ParameterAdvisor {
  /** Lower bound of the recommended stride range, as a fraction of the optimal stride. */
  public static final double RANGE_LOW_FACTOR = 0.1;
  /** Upper bound of the recommended stride range, as a multiple of the optimal stride. */
  public static final double RANGE_HIGH_FACTOR = 2.0;

  private final int headerSlots;

  /**
   * Creates an advisor for carriers that reserve {@code headerSlots} slots for the header.
   *
   * @param headerSlots reserved header region in slots
   */
  public ParameterAdvisor(int headerSlots) {
    if (headerSlots < 0) {
      throw new IllegalArgumentException("headerSlots must not be negative (was " + headerSlots + ")");
    }
    this.headerSlots = headerSlots;
  }

  /**
   * Finds the first {@code (lsb, msb)} pair, lsb ascending then msb descending, that fits.
   *
   * @param carrier carrier image
   * @param payload image to hide
   * @return parameters with a computed stride, or empty when nothing fits even at lsb=8, msb=1
   */
  public Optional<ImageEmbedParameters> findOptimal(RgbImage carrier, RgbImage payload) {
    return findOptimal(carrier.channelCount(), payload.pixelCount());
  }

  /**
   * Finds the first {@code (lsb, msb)} pair that fits.
   *
   * @param carrierSlots carrier channel count
   * @param payloadPixels payload pixel count
   * @return parameters with a computed stride, or empty when nothing fits
   */
  public Optional<ImageEmbedParameters> findOptimal(long carrierSlots, long payloadPixels) {
    for (int lsb = 1; lsb <= BitPlanes.CHANNEL_BITS; lsb++) {
      long available = CapacityCalculator.imageAvailableBits(carrierSlots, headerSlots, lsb);
      for (int msb = BitPlanes.CHANNEL_BITS; msb >= 1; msb--) {
        if (CapacityCalculator.imageRequiredBits(payloadPixels, msb) <= available) {
          return Optional.of(ImageEmbedParameters.of(lsb, msb));
        }
      }
    }
    return Optional.empty();
  }

  /**
   * Stride the embedder would compute for these depths.
   *
   * @param carrier carrier image
   * @param payload image to hide
   * @param lsb bits written per carrier channel
   * @param msb bits sampled per payload channel
   * @return optimal stride
   */
  public double optimalStride(RgbImage carrier, RgbImage payload, int lsb, int msb) {
    return AdaptiveImageEmbedder.optimalStride(
        carrier.channelCount(), headerSlots, payload.pixelCount(), lsb, msb);
  }

  /**
   * Advisory stride range around the optimum. Values outside may still work; values below 1 never do.
   *
   * @param optimalStride stride returned by {@link #optimalStride}
   * @return range {@code [0.1 * optimal, 2 * optimal]}; advisory only, strides below 1 are still
   *     rejected by the engine
   */
  public StrideRange recommendedStrideRange(double optimalStride) {
    return new StrideRange(optimalStride * RANGE_LOW_FACTOR, optimalStride * RANGE_HIGH_FACTOR);
  }

  /**
   * Inclusive stride range.
   *
   * @param min lowest recommended stride
   * @param max highest recommended stride
   */
  public record StrideRange(double min, double max) {
    /**
     * Tells whether a stride lies within the range.
     *
     * @param stride candidate stride
     * @return {@code true} when {@code min <= stride <= max}
     */
    public boolean contains(double stride) {
      return stride >= min && stride <= max;
    }
  }
}
