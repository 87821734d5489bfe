package ca.gc.cra.veil.domain.codec;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.veil.domain.error.CapacityExceededException;
import ca.gc.cra.veil.domain.error.CorruptHeaderException;
import ca.gc.cra.veil.domain.error.CorruptPayloadException;
import ca.gc.cra.veil.domain.header.BlobHeader;
import ca.gc.cra.veil.domain.header.MetadataHeaderCodec;
import ca.gc.cra.veil.domain.image.RgbImage;
import ca.gc.cra.veil.testutil.TestImages;
import java.nio.charset.StandardCharsets;
import java.util.Random;
import org.junit.jupiter.api.Test;

class BlobEmbedderTest {

  @Test
  void fileRoundTripsWithName() throws Exception {
    BlobEmbedder embedder = new BlobEmbedder();
    byte[] data = new byte[500];
    new Random(31).nextBytes(data);

    RgbImage stego = embedder.hide(TestImages.random(64, 64, 32), "notes.bin", data);
    RecoveredBlob recovered = embedder.extract(stego);

    assertEquals("notes.bin", recovered.name());
    assertArrayEquals(data, recovered.data());
  }

  @Test
  void commaInNameIsReplaced() throws Exception {
    BlobEmbedder embedder = new BlobEmbedder(256);
    byte[] data = "x".getBytes(StandardCharsets.UTF_8);

    RecoveredBlob recovered = embedder.extract(embedder.hide(TestImages.random(16, 16, 33), "a,b.txt", data));

    assertEquals("a_b.txt", recovered.name());
  }

  @Test
  void emptyFileRoundTrips() throws Exception {
    BlobEmbedder embedder = new BlobEmbedder(256);

    RecoveredBlob recovered = embedder.extract(embedder.hide(TestImages.random(16, 16, 34), "empty", new byte[0]));

    assertEquals(0, recovered.size());
  }

  @Test
  void exactFitSucceedsAndOneBitShortFails() throws Exception {
    RgbImage carrier = TestImages.random(4, 4, 35);
    byte[] data = {0x5C};
    // 48 slots: "a,1" needs 40 header slots, leaving exactly 8 for the byte.
    RecoveredBlob recovered = new BlobEmbedder(40).extract(new BlobEmbedder(40).hide(carrier, "a", data));
    assertArrayEquals(data, recovered.data());

    CapacityExceededException ex =
        assertThrows(CapacityExceededException.class, () -> new BlobEmbedder(41).hide(carrier, "a", data));
    assertEquals(8, ex.requiredBits());
    assertEquals(7, ex.availableBits());
    assertEquals(1, ex.deficitBits());
  }

  @Test
  void declaredSizeBeyondCarrierIsCorrupt() throws Exception {
    RgbImage carrier = new MetadataHeaderCodec(256)
        .writeHeader(RgbImage.blank(16, 16), new BlobHeader("big", 10_000).toFields());

    CorruptPayloadException ex =
        assertThrows(CorruptPayloadException.class, () -> new BlobEmbedder(256).extract(carrier));
    assertEquals(10_000, ex.expectedBytes());
    assertEquals(64, ex.recoveredBytes());
  }

  @Test
  void textHeaderIsNotAFileHeader() throws Exception {
    RgbImage carrier = new MetadataHeaderCodec(256).writeHeader(RgbImage.blank(16, 16), java.util.List.of("only"));

    assertThrows(CorruptHeaderException.class, () -> new BlobEmbedder(256).extract(carrier));
  }

  @Test
  void availableBitsExcludeHeaderRegion() {
    BlobEmbedder embedder = new BlobEmbedder();

    assertEquals(64 * 64 * 3 - 8192, embedder.availableBits(RgbImage.blank(64, 64)));
    assertEquals(0, embedder.availableBits(RgbImage.blank(4, 4)));
    assertEquals(8192, embedder.capacity(RgbImage.blank(64, 64), 0.1).reservedBits());
  }
}
