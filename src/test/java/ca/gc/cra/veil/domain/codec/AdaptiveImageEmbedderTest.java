package ca.gc.cra.veil.domain.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.veil.domain.error.CapacityExceededException;
import ca.gc.cra.veil.domain.error.CorruptHeaderException;
import ca.gc.cra.veil.domain.error.CorruptPayloadException;
import ca.gc.cra.veil.domain.error.HeaderTooLargeException;
import ca.gc.cra.veil.domain.header.ImageHeader;
import ca.gc.cra.veil.domain.header.MetadataHeaderCodec;
import ca.gc.cra.veil.domain.image.RgbImage;
import ca.gc.cra.veil.testutil.TestImages;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class AdaptiveImageEmbedderTest {

  @Test
  void singlePixelInFourByFourCarrierUsesOneGroup() throws Exception {
    RgbImage carrier = TestImages.random(4, 4, 1);
    RgbImage payload = new RgbImage(1, 1, new byte[] {(byte) 0xFF, 0x00, (byte) 0x80});

    double stride = AdaptiveImageEmbedder.optimalStride(carrier.channelCount(), 0, 1, 1, 1);
    RgbImage stego = AdaptiveImageEmbedder.embedPayload(carrier, 0, payload, 1, 1, stride);

    assertEquals(16.0, stride);
    assertEquals(1, stego.channel(0) & 1);
    assertEquals(0, stego.channel(1) & 1);
    assertEquals(1, stego.channel(2) & 1);
    for (int i = 0; i < carrier.channelCount(); i++) {
      assertEquals(carrier.channel(i) >>> 1, stego.channel(i) >>> 1);
      if (i >= 3) {
        assertEquals(carrier.channel(i), stego.channel(i));
      }
    }

    RgbImage recovered = AdaptiveImageEmbedder.recoverPayload(stego, 0, 1, 1, 1, 1, stride);
    assertEquals(new RgbImage(1, 1, new byte[] {(byte) 0x80, 0x00, (byte) 0x80}), recovered);
  }

  @Test
  void densePackingFillsEveryCarrierSlot() throws Exception {
    RgbImage carrier = TestImages.random(4, 4, 2);
    RgbImage payload = TestImages.random(8, 8, 3);

    double stride = AdaptiveImageEmbedder.optimalStride(carrier.channelCount(), 0, payload.pixelCount(), 8, 2);
    RgbImage stego = AdaptiveImageEmbedder.embedPayload(carrier, 0, payload, 8, 2, stride);
    RgbImage recovered = AdaptiveImageEmbedder.recoverPayload(stego, 0, 8, 8, 8, 2, stride);

    assertEquals(1.0, stride);
    assertEquals(TestImages.quantized(payload, 2), recovered);
  }

  @Test
  void fractionalStrideWithPaddedLastGroupRoundTrips() throws Exception {
    RgbImage carrier = TestImages.random(10, 10, 4);
    RgbImage payload = TestImages.random(7, 5, 5);

    double stride = AdaptiveImageEmbedder.optimalStride(carrier.channelCount(), 0, payload.pixelCount(), 2, 3);
    RgbImage stego = AdaptiveImageEmbedder.embedPayload(carrier, 0, payload, 2, 3, stride);

    assertTrue(stride > 1.0 && stride < 2.0, "stride " + stride);
    assertEquals(TestImages.quantized(payload, 3),
        AdaptiveImageEmbedder.recoverPayload(stego, 0, 7, 5, 2, 3, stride));
  }

  @Test
  void sparsePayloadRoundTripsThroughHeader() throws Exception {
    AdaptiveImageEmbedder embedder = new AdaptiveImageEmbedder();
    RgbImage carrier = TestImages.random(64, 64, 6);
    RgbImage payload = TestImages.random(2, 2, 7);

    RgbImage stego = embedder.hide(carrier, payload, ImageEmbedParameters.of(1, 8));
    RecoveredImage recovered = new AdaptiveImageEmbedder().extract(stego);

    assertEquals(new ImageHeader(2, 2, 1, 8, 8192.0 / 96.0), recovered.header());
    assertEquals(payload, recovered.image());
  }

  @Test
  void callerStrideIsStoredAndHonoured() throws Exception {
    AdaptiveImageEmbedder embedder = new AdaptiveImageEmbedder(256);
    RgbImage carrier = TestImages.random(16, 16, 8);
    RgbImage payload = TestImages.random(2, 2, 9);

    RgbImage stego = embedder.hide(carrier, payload, ImageEmbedParameters.withStride(1, 8, 2.5));
    RecoveredImage recovered = embedder.extract(stego);

    assertEquals(2.5, recovered.header().stride());
    assertEquals(payload, recovered.image());
  }

  @Test
  void payloadRegionNeverTouchesHeaderRegion() throws Exception {
    AdaptiveImageEmbedder embedder = new AdaptiveImageEmbedder(256);
    RgbImage carrier = TestImages.random(16, 16, 10);
    RgbImage payload = TestImages.random(3, 3, 11);

    RgbImage stego = embedder.hide(carrier, payload, ImageEmbedParameters.of(4, 4));

    for (int i = 0; i < 256; i++) {
      assertEquals(carrier.channel(i) >>> 1, stego.channel(i) >>> 1, "slot " + i);
    }
  }

  @Test
  void oversizedPayloadFailsWithoutChangingCarrier() {
    AdaptiveImageEmbedder embedder = new AdaptiveImageEmbedder(256);
    RgbImage carrier = TestImages.random(16, 16, 12);
    RgbImage snapshot = new RgbImage(16, 16, carrier.channels());
    RgbImage payload = TestImages.random(16, 16, 13);

    CapacityExceededException ex = assertThrows(CapacityExceededException.class,
        () -> embedder.hide(carrier, payload, ImageEmbedParameters.of(1, 8)));

    assertEquals(256L * 3 * 8, ex.requiredBits());
    assertEquals(510, ex.availableBits());
    assertEquals(snapshot, carrier);
  }

  @Test
  void strideThatRunsPastCarrierIsRejected() {
    AdaptiveImageEmbedder embedder = new AdaptiveImageEmbedder(256);
    RgbImage carrier = TestImages.random(16, 16, 14);
    RgbImage payload = TestImages.random(2, 2, 15);

    assertThrows(CapacityExceededException.class,
        () -> embedder.hide(carrier, payload, ImageEmbedParameters.withStride(1, 8, 100.0)));
    assertThrows(IllegalArgumentException.class, () -> ImageEmbedParameters.withStride(1, 8, 0.5));
  }

  @Test
  void headerLargerThanRegionIsRejected() {
    AdaptiveImageEmbedder embedder = new AdaptiveImageEmbedder(24);
    RgbImage carrier = TestImages.random(16, 16, 16);
    RgbImage payload = TestImages.random(2, 2, 17);

    assertThrows(HeaderTooLargeException.class,
        () -> embedder.hide(carrier, payload, ImageEmbedParameters.of(1, 8)));
  }

  @Test
  void extractWithoutHeaderFails() {
    assertThrows(CorruptHeaderException.class,
        () -> new AdaptiveImageEmbedder(256).extract(RgbImage.blank(16, 16)));
  }

  @Test
  void headerDeclaringMoreThanCarrierHoldsIsCorrupt() throws Exception {
    MetadataHeaderCodec codec = new MetadataHeaderCodec(256);
    RgbImage declaredTooLarge =
        codec.writeHeader(RgbImage.blank(16, 16), new ImageHeader(50, 50, 1, 8, 1.0).toFields());

    CorruptPayloadException ex = assertThrows(CorruptPayloadException.class,
        () -> new AdaptiveImageEmbedder(256).extract(declaredTooLarge));
    assertEquals(50L * 50 * 3, ex.expectedBytes());
    assertEquals(0, ex.recoveredBytes());
  }

  @Test
  void walkThatLeavesCarrierDuringExtractIsCorrupt() throws Exception {
    MetadataHeaderCodec codec = new MetadataHeaderCodec(256);
    RgbImage carrier =
        codec.writeHeader(RgbImage.blank(16, 16), new ImageHeader(2, 2, 1, 8, 1000.0).toFields());

    CorruptPayloadException ex = assertThrows(CorruptPayloadException.class,
        () -> new AdaptiveImageEmbedder(256).extract(carrier));
    assertEquals(12, ex.expectedBytes());
    assertTrue(ex.recoveredBytes() < ex.expectedBytes());
  }

  static Stream<Arguments> everyDepthPair() {
    return IntStream.rangeClosed(1, 8).boxed()
        .flatMap(lsb -> IntStream.rangeClosed(1, 8).mapToObj(msb -> Arguments.of(lsb, msb)));
  }

  @ParameterizedTest(name = "lsb={0}, msb={1}")
  @MethodSource("everyDepthPair")
  void hideAndExtractRoundTripForEveryDepthPair(int lsb, int msb) throws Exception {
    AdaptiveImageEmbedder embedder = new AdaptiveImageEmbedder(512);
    RgbImage carrier = TestImages.random(32, 32, 100 + lsb);
    RgbImage payload = TestImages.random(6, 6, 200 + msb);

    RecoveredImage recovered = embedder.extract(embedder.hide(carrier, payload, ImageEmbedParameters.of(lsb, msb)));

    assertEquals(lsb, recovered.header().lsb());
    assertEquals(msb, recovered.header().msb());
    assertEquals(TestImages.quantized(payload, msb), recovered.image());
  }

  @Test
  void fullDepthExactFitSucceedsAndOneGroupMoreFails() throws Exception {
    AdaptiveImageEmbedder embedder = new AdaptiveImageEmbedder(258);
    RgbImage carrier = TestImages.random(10, 10, 30);
    RgbImage exact = TestImages.random(14, 1, 31);
    RgbImage oneMore = TestImages.random(15, 1, 32);

    RgbImage stego = embedder.hide(carrier, exact, ImageEmbedParameters.of(8, 8));
    RecoveredImage recovered = embedder.extract(stego);

    assertEquals(1.0, recovered.header().stride());
    assertEquals(exact, recovered.image());

    CapacityExceededException ex = assertThrows(CapacityExceededException.class,
        () -> embedder.hide(carrier, oneMore, ImageEmbedParameters.of(8, 8)));
    assertEquals(360, ex.requiredBits());
    assertEquals(336, ex.availableBits());
    assertEquals(24, ex.deficitBits());
  }
}
