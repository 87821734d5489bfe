package ca.gc.cra.veil.domain.codec;

import ca.gc.cra.veil.domain.bits.BitPlanes;
import ca.gc.cra.veil.domain.bits.BitQueue;
import ca.gc.cra.veil.domain.capacity.CapacityCalculator;
import ca.gc.cra.veil.domain.error.CapacityExceededException;
import ca.gc.cra.veil.domain.error.CorruptHeaderException;
import ca.gc.cra.veil.domain.error.CorruptPayloadException;
import ca.gc.cra.veil.domain.error.HeaderTooLargeException;
import ca.gc.cra.veil.domain.header.ImageHeader;
import ca.gc.cra.veil.domain.header.MetadataHeaderCodec;
import ca.gc.cra.veil.domain.image.RgbImage;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Hides one image inside another with independent bit depths and a real-valued stride.
 * <p><strong>Hide:</strong> the top {@code msb} bits of every payload channel are queued in row-major
 * order. Each time the queue holds {@code 3 * lsb} bits they are written as three {@code lsb}-bit
 * groups into the carrier slots returned by a {@link StrideWalk} that starts after the reserved
 * header region. A final partial group is zero-padded. The header {@code W,H,lsb,msb,stride} is
 * written last, into the low bit of the reserved slots.</p>
 * <p><strong>Extract:</strong> the header is read, the same walk is replayed, and every {@code msb}
 * bits become one byte, left-aligned with zero padding.</p>
 * <p><strong>Capacity:</strong> the payload needs {@code W2 * H2 * 3 * msb} bits; the carrier offers
 * {@code floor((W1 * H1 * 3 - reserved) / 3) * 3 * lsb}. Everything is validated before the first
 * write, and the caller's carrier is never modified.</p>
 * <p><strong>Thread-safety:</strong> Immutable; each call owns its buffers.</p>
 *
 * @since 0.1.0
 * @see ParameterAdvisor
 */
public final class AdaptiveImageEmbedder {
  /** Default size of the reserved header region, in slots. */
  public static final int DEFAULT_HEADER_SLOTS = 4096;

  private final MetadataHeaderCodec headerCodec;

  /** Creates an embedder with the default reserved header region. */
  public AdaptiveImageEmbedder() {
    this(DEFAULT_HEADER_SLOTS);
  }

  /**
   * Creates an embedder with a custom reserved header region.
   *
   * @param headerSlots slots reserved for the header
   */
  public AdaptiveImageEmbedder(int headerSlots) {
    this.headerCodec = new MetadataHeaderCodec(headerSlots);
  }

  /** Slots reserved for the header; the payload walk starts here. */
  public int headerSlots() {
    return headerCodec.reservedBits();
  }

  /**
   * Hides {@code payload} in a copy of {@code carrier}.
   *
   * @param carrier carrier image, left untouched
   * @param payload image to hide
   * @param params bit depths and optional stride
   * @return new carrier holding payload and header
   * @throws CapacityExceededException if the payload or a caller-chosen stride does not fit
   * @throws HeaderTooLargeException if the header does not fit the reserved region
   */
  public RgbImage hide(RgbImage carrier, RgbImage payload, ImageEmbedParameters params)
      throws CapacityExceededException, HeaderTooLargeException {
    Objects.requireNonNull(carrier, "carrier");
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(params, "params");
    int regionStart = headerSlots();
    requireCapacity(carrier.channelCount(), regionStart, payload.pixelCount(), params.lsb(), params.msb());

    double stride = params.stride().isPresent()
        ? params.stride().getAsDouble()
        : optimalStride(carrier.channelCount(), regionStart, payload.pixelCount(), params.lsb(), params.msb());
    ImageHeader header = new ImageHeader(payload.width(), payload.height(), params.lsb(), params.msb(), stride);
    List<String> fields = header.toFields();
    headerCodec.encode(fields);

    byte[] channels = embedInto(carrier, regionStart, payload, params.lsb(), params.msb(), stride);
    headerCodec.write(channels, fields);
    return new RgbImage(carrier.width(), carrier.height(), channels);
  }

  /**
   * Recovers the hidden image.
   *
   * @param carrier carrier produced by {@link #hide}
   * @return header and recovered image
   * @throws CorruptHeaderException if no valid image header is present
   * @throws CorruptPayloadException if the carrier cannot hold what the header declares
   */
  public RecoveredImage extract(RgbImage carrier) throws CorruptHeaderException, CorruptPayloadException {
    Objects.requireNonNull(carrier, "carrier");
    ImageHeader header = ImageHeader.fromFields(headerCodec.readHeader(carrier));
    RgbImage image = recoverPayload(
        carrier, headerSlots(), header.width(), header.height(), header.lsb(), header.msb(), header.stride());
    return new RecoveredImage(header, image);
  }

  /**
   * Stride that spreads the payload groups evenly across the carrier region.
   *
   * <p>Equals {@code (availableSlots * lsb) / (payloadSlots * msb)} whenever the payload bits form
   * whole groups; otherwise the bit count is first rounded up to whole groups so the padded last
   * group also fits.</p>
   *
   * @param carrierSlots carrier channel count
   * @param regionStart slots reserved before the payload region
   * @param payloadPixels payload pixel count
   * @param lsb bits written per carrier channel
   * @param msb bits sampled per payload channel
   * @return stride, below 1 when the payload does not fit
   */
  public static double optimalStride(int carrierSlots, int regionStart, long payloadPixels, int lsb, int msb) {
    long groups = groupCount(payloadPixels, lsb, msb);
    long availableSlots = Math.max(0L, (long) carrierSlots - regionStart);
    if (groups == 0) {
      return 1.0;
    }
    return (double) availableSlots / (double) (groups * StrideWalk.GROUP_SLOTS);
  }

  /**
   * Writes the payload walk into a copy of the carrier without touching the header region.
   *
   * @param carrier carrier image, left untouched
   * @param regionStart first slot of the payload region
   * @param payload image to hide
   * @param lsb bits written per carrier channel
   * @param msb bits sampled per payload channel
   * @param stride carrier slots advanced per payload slot, finite and {@code >= 1}
   * @return new carrier holding the payload bits
   * @throws CapacityExceededException if the payload or the walk does not fit the region
   */
  public static RgbImage embedPayload(
      RgbImage carrier, int regionStart, RgbImage payload, int lsb, int msb, double stride)
      throws CapacityExceededException {
    requireCapacity(carrier.channelCount(), regionStart, payload.pixelCount(), lsb, msb);
    byte[] channels = embedInto(carrier, regionStart, payload, lsb, msb, stride);
    return new RgbImage(carrier.width(), carrier.height(), channels);
  }

  /**
   * Replays the payload walk and rebuilds the payload image.
   *
   * @param carrier carrier to read
   * @param regionStart first slot of the payload region
   * @param width payload width in pixels
   * @param height payload height in pixels
   * @param lsb bits written per carrier channel
   * @param msb bits sampled per payload channel
   * @param stride carrier slots advanced per payload slot
   * @return recovered image
   * @throws CorruptPayloadException if the carrier runs out before every channel is recovered
   */
  public static RgbImage recoverPayload(
      RgbImage carrier, int regionStart, int width, int height, int lsb, int msb, double stride)
      throws CorruptPayloadException {
    BitPlanes.requireDepth(lsb);
    BitPlanes.requireDepth(msb);
    long expected = (long) width * height * RgbImage.CHANNELS_PER_PIXEL;
    long needed = CapacityCalculator.imageRequiredBits((long) width * height, msb);
    long available = CapacityCalculator.imageAvailableBits(carrier.channelCount(), regionStart, lsb);
    if (needed > available || expected > Integer.MAX_VALUE) {
      throw new CorruptPayloadException(expected, 0);
    }

    byte[] out = new byte[(int) expected];
    BitQueue queue = new BitQueue();
    StrideWalk walk = new StrideWalk(regionStart, carrier.channelCount(), stride);
    int produced = 0;
    while (produced < out.length) {
      long index = walk.nextIndex();
      if (!walk.groupFits(index)) {
        throw new CorruptPayloadException(expected, produced);
      }
      int base = (int) index;
      for (int c = 0; c < StrideWalk.GROUP_SLOTS; c++) {
        queue.push(BitPlanes.lowBits(carrier.channel(base + c), lsb), lsb);
      }
      while (queue.size() >= msb && produced < out.length) {
        out[produced++] = (byte) (queue.pop(msb) << (BitPlanes.CHANNEL_BITS - msb));
      }
    }
    return new RgbImage(width, height, out);
  }

  private static void requireCapacity(int carrierSlots, int regionStart, long payloadPixels, int lsb, int msb)
      throws CapacityExceededException {
    CapacityCalculator.requireFits(
        CapacityCalculator.imageRequiredBits(payloadPixels, msb),
        CapacityCalculator.imageAvailableBits(carrierSlots, regionStart, lsb));
  }

  private static byte[] embedInto(
      RgbImage carrier, int regionStart, RgbImage payload, int lsb, int msb, double stride)
      throws CapacityExceededException {
    if (!Double.isFinite(stride) || stride < 1.0) {
      throw new IllegalArgumentException("stride must be a finite number >= 1 (was " + stride + ")");
    }
    long groups = groupCount(payload.pixelCount(), lsb, msb);
    long last = StrideWalk.lastIndex(regionStart, carrier.channelCount(), stride, groups);
    if (!new StrideWalk(regionStart, carrier.channelCount(), stride).groupFits(last)) {
      long regionSlots = Math.max(0L, (long) carrier.channelCount() - regionStart);
      long spanned = last >= Integer.MAX_VALUE
          ? Integer.MAX_VALUE
          : last + StrideWalk.GROUP_SLOTS - regionStart;
      throw new CapacityExceededException(spanned * lsb, regionSlots * lsb);
    }

    byte[] channels = carrier.channels();
    BitQueue queue = new BitQueue();
    StrideWalk walk = new StrideWalk(regionStart, channels.length, stride);
    int groupBits = StrideWalk.GROUP_SLOTS * lsb;
    int slots = payload.channelCount();
    for (int i = 0; i < slots; i += RgbImage.CHANNELS_PER_PIXEL) {
      for (int c = 0; c < RgbImage.CHANNELS_PER_PIXEL; c++) {
        queue.push(BitPlanes.highBits(payload.channel(i + c), msb), msb);
      }
      while (queue.size() >= groupBits) {
        writeGroup(channels, walk, queue, lsb);
      }
    }
    if (!queue.isEmpty()) {
      queue.push(0, groupBits - queue.size());
      writeGroup(channels, walk, queue, lsb);
    }
    return channels;
  }

  private static void writeGroup(byte[] channels, StrideWalk walk, BitQueue queue, int lsb) {
    long index = walk.nextIndex();
    if (!walk.groupFits(index)) {
      throw new IllegalStateException("payload walk left the carrier at slot " + index + " of " + channels.length);
    }
    int base = (int) index;
    for (int c = 0; c < StrideWalk.GROUP_SLOTS; c++) {
      channels[base + c] = (byte) BitPlanes.setLowBits(channels[base + c] & 0xFF, queue.pop(lsb), lsb);
    }
  }

  private static long groupCount(long payloadPixels, int lsb, int msb) {
    long bits = CapacityCalculator.imageRequiredBits(payloadPixels, msb);
    long groupBits = (long) StrideWalk.GROUP_SLOTS * BitPlanes.requireDepth(lsb);
    return (bits + groupBits - 1) / groupBits;
  }
}
