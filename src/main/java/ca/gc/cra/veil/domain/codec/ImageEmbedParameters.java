package ca.gc.cra.veil.domain.codec;

import ca.gc.cra.veil.domain.bits.BitPlanes;
import ca.gc.cra.veil.validation.Numbers;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Bit depths and optional stride for one image-in-image embedding.
 *
 * <p>An empty stride means the embedder computes the one that spreads the payload evenly across
 * the whole carrier.</p>
 *
 * @param lsb bits written per carrier channel, {@code [1, 8]}
 * @param msb bits sampled per payload channel, {@code [1, 8]}
 * @param stride caller-chosen stride, finite and {@code >= 1} when present
 * @since 0.1.0
 */
public record ImageEmbedParameters(int lsb, int msb, OptionalDouble stride) {
  /**
   * Validates the parameters.
   *
   * @throws IllegalArgumentException if a depth is outside {@code [1, 8]} or the stride is not a
   *     finite number {@code >= 1}
   */
  public ImageEmbedParameters {
    BitPlanes.requireDepth(lsb);
    BitPlanes.requireDepth(msb);
    Objects.requireNonNull(stride, "stride");
    if (stride.isPresent()) {
      Numbers.requireFiniteAtLeast("stride", stride.getAsDouble(), 1.0);
    }
  }

  /**
   * Parameters with a computed stride.
   *
   * @param lsb bits written per carrier channel
   * @param msb bits sampled per payload channel
   * @return parameters
   */
  public static ImageEmbedParameters of(int lsb, int msb) {
    return new ImageEmbedParameters(lsb, msb, OptionalDouble.empty());
  }

  /**
   * Parameters with a caller-chosen stride.
   *
   * @param lsb bits written per carrier channel
   * @param msb bits sampled per payload channel
   * @param stride carrier slots advanced per payload slot
   * @return parameters
   */
  public static ImageEmbedParameters withStride(int lsb, int msb, double stride) {
    return new ImageEmbedParameters(lsb, msb, OptionalDouble.of(stride));
  }
}
