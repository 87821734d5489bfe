package ca.gc.cra.veil.domain.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.veil.domain.bits.LowBitChannels;
import ca.gc.cra.veil.domain.capacity.CapacityReport;
import ca.gc.cra.veil.domain.error.CapacityExceededException;
import ca.gc.cra.veil.domain.error.CorruptPayloadException;
import ca.gc.cra.veil.domain.error.TerminatorNotFoundException;
import ca.gc.cra.veil.domain.image.RgbImage;
import ca.gc.cra.veil.testutil.TestImages;
import org.junit.jupiter.api.Test;

class TextEmbedderTest {
  private final TextEmbedder embedder = new TextEmbedder();

  @Test
  void messageRoundTrips() throws Exception {
    RgbImage carrier = TestImages.random(20, 20, 21);

    RgbImage stego = embedder.hide(carrier, "meet at noon, bring the map");

    assertEquals("meet at noon, bring the map", embedder.extract(stego));
  }

  @Test
  void multiByteTextRoundTrips() throws Exception {
    String message = "naïve café ☃ 😀";

    assertEquals(message, embedder.extract(embedder.hide(TestImages.random(30, 30, 22), message)));
  }

  @Test
  void singleZeroByteInsideMessageIsNotATerminator() throws Exception {
    String message = "a\u0000b";

    assertEquals(message, embedder.extract(embedder.hide(TestImages.filled(10, 10, 0xFF), message)));
  }

  @Test
  void exactFitSucceedsAndOneMoreByteFails() throws Exception {
    RgbImage carrier = TestImages.random(4, 4, 23);
    // 48 slots hold six bytes: four of message, two of terminator.
    assertEquals("hell", embedder.extract(embedder.hide(carrier, "hell")));

    CapacityExceededException ex =
        assertThrows(CapacityExceededException.class, () -> embedder.hide(carrier, "hello"));
    assertEquals(7 * 8, ex.requiredBits());
    assertEquals(48, ex.availableBits());
  }

  @Test
  void emptyMessageIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> embedder.hide(RgbImage.blank(4, 4), ""));
  }

  @Test
  void blankCarrierYieldsEmptyMessage() throws Exception {
    assertEquals("", embedder.extract(RgbImage.blank(4, 4)));
  }

  @Test
  void missingTerminatorIsReported() {
    TerminatorNotFoundException ex = assertThrows(TerminatorNotFoundException.class,
        () -> embedder.extract(TestImages.filled(2, 2, 0xFF)));

    assertEquals(8, ex.scannedBits());
  }

  @Test
  void invalidUtf8BeforeTerminatorIsCorrupt() {
    byte[] channels = new byte[8 * 8 * 3];
    LowBitChannels.writeBytes(channels, 0, new byte[] {(byte) 0xC3, 0x28, 0, 0});

    CorruptPayloadException ex = assertThrows(
        CorruptPayloadException.class, () -> embedder.extract(new RgbImage(8, 8, channels)));
    assertEquals(2, ex.expectedBytes());
    assertEquals(2, ex.recoveredBytes());
  }

  @Test
  void longerTerminatorIsHonoured() throws Exception {
    TextEmbedder wide = new TextEmbedder(32);
    String message = "x\u0000\u0000y";

    assertEquals(message, wide.extract(wide.hide(TestImages.random(10, 10, 24), message)));
    assertThrows(IllegalArgumentException.class, () -> new TextEmbedder(12));
  }

  @Test
  void capacityReservesTerminator() {
    CapacityReport report = embedder.capacity(RgbImage.blank(10, 10), 0.5);

    assertEquals(300, report.totalBits());
    assertEquals(16, report.reservedBits());
    assertEquals(35, report.availableBytes());
    assertEquals(17, report.safeUsageBytes());
  }
}
