package ca.gc.cra.veil.domain.codec;

import ca.gc.cra.veil.domain.bits.LowBitChannels;
import ca.gc.cra.veil.domain.capacity.CapacityCalculator;
import ca.gc.cra.veil.domain.capacity.CapacityReport;
import ca.gc.cra.veil.domain.error.CapacityExceededException;
import ca.gc.cra.veil.domain.error.CorruptHeaderException;
import ca.gc.cra.veil.domain.error.CorruptPayloadException;
import ca.gc.cra.veil.domain.error.HeaderTooLargeException;
import ca.gc.cra.veil.domain.header.BlobHeader;
import ca.gc.cra.veil.domain.header.MetadataHeaderCodec;
import ca.gc.cra.veil.domain.image.RgbImage;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Hides an arbitrary file at one bit per channel.
 * <p><strong>Layout:</strong> the header {@code name,size} occupies the reserved region from slot 0;
 * the file bytes follow from the first slot after the region, most significant bit first.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class BlobEmbedder {
  /** Default size of the reserved header region, in slots. */
  public static final int DEFAULT_HEADER_SLOTS = 8192;

  private final MetadataHeaderCodec headerCodec;

  /** Creates an embedder with the default reserved header region. */
  public BlobEmbedder() {
    this(DEFAULT_HEADER_SLOTS);
  }

  /**
   * Creates an embedder with a custom reserved header region.
   *
   * @param headerSlots slots reserved for the header
   */
  public BlobEmbedder(int headerSlots) {
    this.headerCodec = new MetadataHeaderCodec(headerSlots);
  }

  public int headerSlots() {
    return headerCodec.reservedBits();
  }

  /**
   * Payload bits available after the header region.
   *
   * @param carrier carrier image
   * @return available bits, never negative
   */
  public long availableBits(RgbImage carrier) {
    return CapacityCalculator.availableCapacityBits(
        CapacityCalculator.totalCapacityBits(carrier.width(), carrier.height(), 1), headerSlots());
  }

  /**
   * Hides a file in a copy of the carrier.
   *
   * @param carrier carrier image, left untouched
   * @param fileName original file name; commas are replaced by {@code '_'}
   * @param data file contents
   * @return new carrier holding header and contents
   * @throws CapacityExceededException if the contents exceed the region after the header
   * @throws HeaderTooLargeException if the header does not fit the reserved region
   */
  public RgbImage hide(RgbImage carrier, String fileName, byte[] data)
      throws CapacityExceededException, HeaderTooLargeException {
    Objects.requireNonNull(carrier, "carrier");
    Objects.requireNonNull(data, "data");
    BlobHeader header = BlobHeader.forFile(fileName, data.length);
    CapacityCalculator.requireFits((long) data.length * Byte.SIZE, availableBits(carrier));
    List<String> fields = header.toFields();
    headerCodec.encode(fields);

    byte[] channels = carrier.channels();
    headerCodec.write(channels, fields);
    LowBitChannels.writeBytes(channels, headerSlots(), data);
    return new RgbImage(carrier.width(), carrier.height(), channels);
  }

  /**
   * Recovers a file.
   *
   * @param carrier carrier produced by {@link #hide}
   * @return recovered name and contents
   * @throws CorruptHeaderException if no valid file header is present
   * @throws CorruptPayloadException if the declared size exceeds what the carrier holds
   */
  public RecoveredBlob extract(RgbImage carrier) throws CorruptHeaderException, CorruptPayloadException {
    Objects.requireNonNull(carrier, "carrier");
    BlobHeader header = BlobHeader.fromFields(headerCodec.readHeader(carrier));
    long availableBytes = availableBits(carrier) / Byte.SIZE;
    if (header.size() > availableBytes) {
      throw new CorruptPayloadException(header.size(), availableBytes);
    }
    byte[] data = LowBitChannels.readBytes(carrier, headerSlots(), (int) header.size());
    return new RecoveredBlob(header.name(), data);
  }

  /**
   * Capacity of a carrier for files.
   *
   * @param carrier carrier image
   * @param safeUsageFraction advisory fraction of available bytes
   * @return report with the header region as reserved bits
   */
  public CapacityReport capacity(RgbImage carrier, double safeUsageFraction) {
    return CapacityCalculator.report(carrier.width(), carrier.height(), 1, headerSlots(), safeUsageFraction);
  }
}
