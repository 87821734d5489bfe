package ca.gc.cra.veil.domain.header;

import ca.gc.cra.veil.domain.bits.LowBitChannels;
import ca.gc.cra.veil.domain.error.CapacityExceededException;
import ca.gc.cra.veil.domain.error.CorruptHeaderException;
import ca.gc.cra.veil.domain.error.HeaderTooLargeException;
import ca.gc.cra.veil.domain.image.RgbImage;
import ca.gc.cra.veil.domain.util.Utf8;
import ca.gc.cra.veil.validation.Strings;
import java.nio.charset.CharacterCodingException;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Serializes a field list into the reserved header region of a carrier.
 * <p><strong>Wire format:</strong> {@code [16-bit big-endian byte length L][L bytes of UTF-8 text]}
 * where the text is the fields joined by {@code ','}. Each bit is stored in the lowest bit of one
 * channel slot, starting at slot 0, most significant bit first.</p>
 * <p><strong>Role:</strong> Domain codec used by the blob and image embedders; each instance is
 * frozen to the reserved region size of its variant.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent use.</p>
 *
 * @since 0.1.0
 * @see ImageHeader
 * @see BlobHeader
 */
public final class MetadataHeaderCodec {
  /** Bits used by the big-endian length prefix. */
  public static final int LENGTH_PREFIX_BITS = 16;
  /** Separator between header fields. */
  public static final char FIELD_SEPARATOR = ',';

  private static final int MAX_TEXT_BYTES = 0xFFFF;

  private final int reservedBits;

  /**
   * Creates a codec for a reserved region of the given size.
   *
   * @param reservedBits slots reserved for the header, at least {@link #LENGTH_PREFIX_BITS} + 8
   * @throws IllegalArgumentException if the region cannot hold a one-byte header
   */
  public MetadataHeaderCodec(int reservedBits) {
    if (reservedBits < LENGTH_PREFIX_BITS + Byte.SIZE) {
      throw new IllegalArgumentException(
          "reserved header region must be at least " + (LENGTH_PREFIX_BITS + Byte.SIZE) + " bits (was " + reservedBits + ")");
    }
    this.reservedBits = reservedBits;
  }

  public int reservedBits() {
    return reservedBits;
  }

  /**
   * Serializes fields to the length-prefixed byte form written into the carrier.
   *
   * @param fields header fields; none may be {@code null} or contain {@code ','}
   * @return length prefix followed by the UTF-8 text
   * @throws HeaderTooLargeException if the encoded header exceeds the reserved region
   * @throws IllegalArgumentException if the fields are empty or contain the separator
   */
  public byte[] encode(List<String> fields) throws HeaderTooLargeException {
    byte[] text = Utf8.encode(join(fields));
    long headerBits = LENGTH_PREFIX_BITS + (long) text.length * Byte.SIZE;
    if (text.length > MAX_TEXT_BYTES || headerBits > reservedBits) {
      throw new HeaderTooLargeException(headerBits, reservedBits);
    }
    byte[] out = new byte[2 + text.length];
    out[0] = (byte) (text.length >>> 8);
    out[1] = (byte) text.length;
    System.arraycopy(text, 0, out, 2, text.length);
    return out;
  }

  /**
   * Writes a header into a copy of the carrier.
   *
   * @param carrier source carrier, left untouched
   * @param fields header fields
   * @return new carrier holding the header
   * @throws HeaderTooLargeException if the encoded header exceeds the reserved region
   * @throws CapacityExceededException if the carrier has fewer slots than the header needs
   */
  public RgbImage writeHeader(RgbImage carrier, List<String> fields)
      throws HeaderTooLargeException, CapacityExceededException {
    Objects.requireNonNull(carrier, "carrier");
    byte[] channels = carrier.channels();
    write(channels, fields);
    return new RgbImage(carrier.width(), carrier.height(), channels);
  }

  /**
   * Writes a header into a working channel buffer. Nothing is written when validation fails.
   *
   * @param channels mutable channel buffer
   * @param fields header fields
   * @throws HeaderTooLargeException if the encoded header exceeds the reserved region
   * @throws CapacityExceededException if the buffer has fewer slots than the header needs
   */
  public void write(byte[] channels, List<String> fields)
      throws HeaderTooLargeException, CapacityExceededException {
    Objects.requireNonNull(channels, "channels");
    byte[] encoded = encode(fields);
    long headerBits = (long) encoded.length * Byte.SIZE;
    if (headerBits > channels.length) {
      throw new CapacityExceededException(headerBits, channels.length);
    }
    LowBitChannels.writeBytes(channels, 0, encoded);
  }

  /**
   * Reads the header fields from a carrier.
   *
   * @param carrier carrier to read
   * @return header fields in their written order
   * @throws CorruptHeaderException if the length prefix is zero or exceeds the reserved region or
   *     the carrier, or the text is not valid UTF-8
   */
  public List<String> readHeader(RgbImage carrier) throws CorruptHeaderException {
    Objects.requireNonNull(carrier, "carrier");
    if (carrier.channelCount() < LENGTH_PREFIX_BITS) {
      throw new CorruptHeaderException("carrier too small for a header length prefix");
    }
    byte[] prefix = LowBitChannels.readBytes(carrier, 0, 2);
    int length = ((prefix[0] & 0xFF) << 8) | (prefix[1] & 0xFF);
    if (length == 0) {
      throw new CorruptHeaderException("header length is zero");
    }
    long headerBits = LENGTH_PREFIX_BITS + (long) length * Byte.SIZE;
    if (headerBits > reservedBits) {
      throw new CorruptHeaderException(
          "header length " + length + " bytes exceeds reserved region of " + reservedBits + " bits");
    }
    if (headerBits > carrier.channelCount()) {
      throw new CorruptHeaderException(
          "header length " + length + " bytes exceeds carrier of " + carrier.channelCount() + " slots");
    }
    byte[] text = LowBitChannels.readBytes(carrier, LENGTH_PREFIX_BITS, length);
    try {
      return List.of(Utf8.decodeStrict(text).split(String.valueOf(FIELD_SEPARATOR), -1));
    } catch (CharacterCodingException ex) {
      throw new CorruptHeaderException("header is not valid UTF-8", ex);
    }
  }

  private static String join(List<String> fields) {
    Objects.requireNonNull(fields, "fields");
    if (fields.isEmpty()) {
      throw new IllegalArgumentException("header needs at least one field");
    }
    for (String field : fields) {
      if (field == null) {
        throw new IllegalArgumentException("header fields must not be null");
      }
      Strings.requireNoDelimiter("header field", field, FIELD_SEPARATOR);
    }
    String text = String.join(String.valueOf(FIELD_SEPARATOR), fields);
    if (text.isEmpty()) {
      throw new IllegalArgumentException("header text must not be empty");
    }
    return text;
  }
}
