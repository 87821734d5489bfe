package ca.gc.cra.veil.domain.header;

import ca.gc.cra.veil.domain.error.CorruptHeaderException;
import java.util.List;

/**
 * Header written by the image-in-image embedder: {@code "W,H,lsb,msb,stride"}.
 *
 * <p>The stride travels as {@link Double#toString(double)} text and is read back with
 * {@link Double#parseDouble(String)}, which reproduces the same {@code double} bit for bit. The
 * extractor uses the stored value instead of recomputing it.</p>
 *
 * @param width payload width in pixels
 * @param height payload height in pixels
 * @param lsb bits written per carrier channel
 * @param msb bits sampled per payload channel
 * @param stride carrier slots advanced per payload slot group
 * @since 0.1.0
 */
public record ImageHeader(int width, int height, int lsb, int msb, double stride) {
  private static final int FIELD_COUNT = 5;

  /**
   * Validates header values.
   *
   * @throws IllegalArgumentException if a dimension is not positive, a depth is outside
   *     {@code [1, 8]} or the stride is not a finite number {@code >= 1}
   */
  public ImageHeader {
    if (width <= 0 || height <= 0) {
      throw new IllegalArgumentException("payload dimensions must be positive (was " + width + "x" + height + ")");
    }
    if (lsb < 1 || lsb > 8 || msb < 1 || msb > 8) {
      throw new IllegalArgumentException("lsb and msb must be between 1 and 8 (was " + lsb + "/" + msb + ")");
    }
    if (!Double.isFinite(stride) || stride < 1.0) {
      throw new IllegalArgumentException("stride must be a finite number >= 1 (was " + stride + ")");
    }
  }

  /**
   * Returns the fields in wire order.
   *
   * @return {@code [width, height, lsb, msb, stride]} as text
   */
  public List<String> toFields() {
    return List.of(
        Integer.toString(width),
        Integer.toString(height),
        Integer.toString(lsb),
        Integer.toString(msb),
        Double.toString(stride));
  }

  /**
   * Parses a field list read from a carrier.
   *
   * @param fields header fields
   * @return parsed header
   * @throws CorruptHeaderException if the field count or any field value is invalid
   */
  public static ImageHeader fromFields(List<String> fields) throws CorruptHeaderException {
    if (fields == null || fields.size() != FIELD_COUNT) {
      throw new CorruptHeaderException(
          "image header needs " + FIELD_COUNT + " fields (found " + (fields == null ? 0 : fields.size()) + ")");
    }
    try {
      return new ImageHeader(
          Integer.parseInt(fields.get(0).trim()),
          Integer.parseInt(fields.get(1).trim()),
          Integer.parseInt(fields.get(2).trim()),
          Integer.parseInt(fields.get(3).trim()),
          Double.parseDouble(fields.get(4).trim()));
    } catch (IllegalArgumentException ex) {
      throw new CorruptHeaderException("invalid image header " + fields + ": " + ex.getMessage(), ex);
    }
  }

  /** Number of payload channel slots, {@code width * height * 3}. */
  public long payloadSlots() {
    return (long) width * height * 3;
  }
}
