package ca.gc.cra.veil.domain.codec;

import ca.gc.cra.veil.domain.bits.LowBitChannels;
import ca.gc.cra.veil.domain.capacity.CapacityCalculator;
import ca.gc.cra.veil.domain.capacity.CapacityReport;
import ca.gc.cra.veil.domain.error.CapacityExceededException;
import ca.gc.cra.veil.domain.error.CorruptPayloadException;
import ca.gc.cra.veil.domain.error.TerminatorNotFoundException;
import ca.gc.cra.veil.domain.image.RgbImage;
import ca.gc.cra.veil.domain.util.Utf8;
import java.io.ByteArrayOutputStream;
import java.nio.charset.CharacterCodingException;
import java.util.Objects;

/**
 * Hides a UTF-8 message in the lowest bit of the carrier, starting at slot 0, followed by an
 * all-zero terminator. There is no header.
 *
 * <p>Extraction stops at the first run of zero bytes as long as the terminator, scanned on byte
 * boundaries. A message containing that many consecutive NUL characters is therefore recovered
 * truncated; such messages are accepted on hide and not detected.</p>
 *
 * <p>Immutable and thread-safe.</p>
 */
public final class TextEmbedder {
  /** Default terminator length in bits. */
  public static final int DEFAULT_TERMINATOR_BITS = 16;

  private final int terminatorBits;

  public TextEmbedder() {
    this(DEFAULT_TERMINATOR_BITS);
  }

  /**
   * Creates an embedder with a custom terminator length.
   *
   * @param terminatorBits terminator length, a whole number of bytes between 8 and 64 bits
   */
  public TextEmbedder(int terminatorBits) {
    if (terminatorBits < Byte.SIZE || terminatorBits > 64 || terminatorBits % Byte.SIZE != 0) {
      throw new IllegalArgumentException(
          "terminatorBits must be a multiple of 8 between 8 and 64 (was " + terminatorBits + ")");
    }
    this.terminatorBits = terminatorBits;
  }

  public int terminatorBits() {
    return terminatorBits;
  }

  /**
   * Hides a message in a copy of the carrier.
   *
   * @param carrier carrier image, left untouched
   * @param message non-empty message
   * @return new carrier holding the message
   * @throws CapacityExceededException if message and terminator exceed one bit per channel
   * @throws IllegalArgumentException if the message is empty
   */
  public RgbImage hide(RgbImage carrier, String message) throws CapacityExceededException {
    Objects.requireNonNull(carrier, "carrier");
    if (message == null || message.isEmpty()) {
      throw new IllegalArgumentException("message must not be empty");
    }
    byte[] text = Utf8.encode(message);
    CapacityCalculator.requireFits(
        CapacityCalculator.textRequiredBits(text.length, terminatorBits),
        CapacityCalculator.totalCapacityBits(carrier.width(), carrier.height(), 1));

    byte[] framed = new byte[text.length + terminatorBits / Byte.SIZE];
    System.arraycopy(text, 0, framed, 0, text.length);
    byte[] channels = carrier.channels();
    LowBitChannels.writeBytes(channels, 0, framed);
    return new RgbImage(carrier.width(), carrier.height(), channels);
  }

  /**
   * Recovers a message.
   *
   * @param carrier carrier produced by {@link #hide}
   * @return recovered message
   * @throws TerminatorNotFoundException if the whole carrier holds no terminator
   * @throws CorruptPayloadException if the bytes before the terminator are not valid UTF-8
   */
  public String extract(RgbImage carrier) throws TerminatorNotFoundException, CorruptPayloadException {
    Objects.requireNonNull(carrier, "carrier");
    int terminatorBytes = terminatorBits / Byte.SIZE;
    int readable = carrier.channelCount() / Byte.SIZE;
    ByteArrayOutputStream message = new ByteArrayOutputStream();
    int zeroRun = 0;
    for (int i = 0; i < readable; i++) {
      int value = LowBitChannels.readByte(carrier, i * Byte.SIZE);
      if (value == 0) {
        zeroRun++;
        if (zeroRun == terminatorBytes) {
          byte[] bytes = message.toByteArray();
          int length = bytes.length - (terminatorBytes - 1);
          try {
            return Utf8.decodeStrict(bytes, 0, length);
          } catch (CharacterCodingException ex) {
            throw new CorruptPayloadException("recovered message is not valid UTF-8", length, length, ex);
          }
        }
      } else {
        zeroRun = 0;
      }
      message.write(value);
    }
    throw new TerminatorNotFoundException((long) readable * Byte.SIZE);
  }

  /**
   * Capacity of a carrier for text messages.
   *
   * @param carrier carrier image
   * @param safeUsageFraction advisory fraction of available bytes
   * @return report with the terminator as reserved bits
   */
  public CapacityReport capacity(RgbImage carrier, double safeUsageFraction) {
    return CapacityCalculator.report(carrier.width(), carrier.height(), 1, terminatorBits, safeUsageFraction);
  }
}
