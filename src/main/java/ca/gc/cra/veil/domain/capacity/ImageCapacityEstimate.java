package ca.gc.cra.veil.domain.capacity;

/**
 * How large an image payload a carrier can take at one LSB depth, assuming full 8-bit payload
 * precision.
 *
 * @param lsb bits written per carrier channel
 * @param availableBits payload bits the carrier offers at this depth
 * @param availableKib {@code availableBits} expressed in KiB
 * @param maxHiddenPixels payload pixels that fit at msb=8
 * @param maxSquareSide side of the largest square payload that fits at msb=8
 * @since 0.1.0
 */
public record ImageCapacityEstimate(
    int lsb, long availableBits, double availableKib, long maxHiddenPixels, long maxSquareSide) {}
