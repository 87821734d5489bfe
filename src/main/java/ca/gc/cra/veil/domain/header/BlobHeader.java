package ca.gc.cra.veil.domain.header;

import ca.gc.cra.veil.domain.error.CorruptHeaderException;
import ca.gc.cra.veil.validation.Strings;
import java.util.List;

/**
 * Header written by the file embedder: {@code "name,size"}.
 *
 * @param name original file name, without commas
 * @param size payload length in bytes
 * @since 0.1.0
 */
public record BlobHeader(String name, long size) {
  private static final int FIELD_COUNT = 2;

  /**
   * Validates header values.
   *
   * @throws IllegalArgumentException if the name is blank or contains a comma, or the size is negative
   */
  public BlobHeader {
    name = Strings.requireNonBlank("name", name);
    Strings.requireNoDelimiter("name", name, MetadataHeaderCodec.FIELD_SEPARATOR);
    if (size < 0) {
      throw new IllegalArgumentException("size must not be negative (was " + size + ")");
    }
  }

  /**
   * Creates a header for a file name that may contain commas; commas become {@code '_'}.
   *
   * @param fileName original file name
   * @param size payload length in bytes
   * @return header safe to serialize
   */
  public static BlobHeader forFile(String fileName, long size) {
    String safe = fileName == null ? null : fileName.replace(MetadataHeaderCodec.FIELD_SEPARATOR, '_');
    return new BlobHeader(safe, size);
  }

  /**
   * Returns the fields in wire order.
   *
   * @return {@code [name, size]}
   */
  public List<String> toFields() {
    return List.of(name, Long.toString(size));
  }

  /**
   * Parses a field list read from a carrier.
   *
   * @param fields header fields
   * @return parsed header
   * @throws CorruptHeaderException if the field count or any field value is invalid
   */
  public static BlobHeader fromFields(List<String> fields) throws CorruptHeaderException {
    if (fields == null || fields.size() != FIELD_COUNT) {
      throw new CorruptHeaderException(
          "file header needs " + FIELD_COUNT + " fields (found " + (fields == null ? 0 : fields.size()) + ")");
    }
    try {
      return new BlobHeader(fields.get(0), Long.parseLong(fields.get(1).trim()));
    } catch (IllegalArgumentException | NullPointerException ex) {
      throw new CorruptHeaderException("invalid file header " + fields + ": " + ex.getMessage(), ex);
    }
  }
}
