package ca.gc.cra.veil.domain.capacity;

/**
 * Capacity of one carrier for one embedding variant.
 *
 * <p>{@code safeUsageBytes} is an advisory threshold below which visual distortion is considered
 * negligible. Codecs never enforce it.</p>
 *
 * @param width carrier width in pixels
 * @param height carrier height in pixels
 * @param bitDepth bits written per channel
 * @param totalBits {@code width * height * 3 * bitDepth}
 * @param reservedBits bits set aside for the header or terminator
 * @param availableBits bits left for the payload, never negative
 * @param availableBytes {@code availableBits / 8}
 * @param safeUsageBytes advisory payload size in bytes
 * @since 0.1.0
 */
public record CapacityReport(
    int width,
    int height,
    int bitDepth,
    long totalBits,
    long reservedBits,
    long availableBits,
    long availableBytes,
    long safeUsageBytes) {}
