package ca.gc.cra.veil.domain.header;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.veil.domain.bits.LowBitChannels;
import ca.gc.cra.veil.domain.error.CapacityExceededException;
import ca.gc.cra.veil.domain.error.CorruptHeaderException;
import ca.gc.cra.veil.domain.error.HeaderTooLargeException;
import ca.gc.cra.veil.domain.image.RgbImage;
import java.util.List;
import org.junit.jupiter.api.Test;

class MetadataHeaderCodecTest {

  @Test
  void encodesLengthPrefixFollowedByUtf8Text() throws Exception {
    MetadataHeaderCodec codec = new MetadataHeaderCodec(256);

    byte[] encoded = codec.encode(List.of("ab", "7"));

    assertArrayEquals(new byte[] {0, 4, 'a', 'b', ',', '7'}, encoded);
  }

  @Test
  void writesAndReadsFieldsIncludingEmptyOnes() throws Exception {
    MetadataHeaderCodec codec = new MetadataHeaderCodec(512);
    RgbImage carrier = RgbImage.blank(16, 16);

    RgbImage written = codec.writeHeader(carrier, List.of("", "déjà vu", ""));

    assertEquals(List.of("", "déjà vu", ""), codec.readHeader(written));
  }

  @Test
  void headerOnlyTouchesLowestBitOfItsRegion() throws Exception {
    byte[] channels = new byte[16 * 16 * 3];
    java.util.Arrays.fill(channels, (byte) 0xAA);
    MetadataHeaderCodec codec = new MetadataHeaderCodec(256);

    codec.write(channels, List.of("x"));

    int used = 16 + 8;
    for (int i = 0; i < channels.length; i++) {
      if (i < used) {
        assertEquals(0xAA & 0xFE, channels[i] & 0xFE);
      } else {
        assertEquals((byte) 0xAA, channels[i]);
      }
    }
  }

  @Test
  void tooLargeHeaderIsRejectedBeforeWriting() {
    MetadataHeaderCodec codec = new MetadataHeaderCodec(32);
    byte[] channels = new byte[300];

    HeaderTooLargeException ex =
        assertThrows(HeaderTooLargeException.class, () -> codec.write(channels, List.of("abc")));

    assertEquals(40, ex.headerBits());
    assertEquals(32, ex.reservedBits());
    assertArrayEquals(new byte[300], channels);
  }

  @Test
  void carrierShorterThanHeaderIsCapacityError() {
    MetadataHeaderCodec codec = new MetadataHeaderCodec(1024);

    assertThrows(CapacityExceededException.class, () -> codec.write(new byte[30], List.of("abc")));
  }

  @Test
  void fieldsWithSeparatorAreRejected() {
    MetadataHeaderCodec codec = new MetadataHeaderCodec(256);

    assertThrows(IllegalArgumentException.class, () -> codec.encode(List.of("a,b")));
    assertThrows(IllegalArgumentException.class, () -> codec.encode(List.of()));
  }

  @Test
  void readRejectsZeroAndOversizedLengths() {
    MetadataHeaderCodec codec = new MetadataHeaderCodec(64);
    assertThrows(CorruptHeaderException.class, () -> codec.readHeader(RgbImage.blank(4, 4)));

    byte[] channels = new byte[16 * 16 * 3];
    LowBitChannels.writeBytes(channels, 0, new byte[] {0, 10});
    assertThrows(CorruptHeaderException.class, () -> codec.readHeader(new RgbImage(16, 16, channels)));

    assertThrows(CorruptHeaderException.class, () -> codec.readHeader(RgbImage.blank(2, 2)));
  }

  @Test
  void readRejectsInvalidUtf8() {
    MetadataHeaderCodec codec = new MetadataHeaderCodec(256);
    byte[] channels = new byte[16 * 16 * 3];
    LowBitChannels.writeBytes(channels, 0, new byte[] {0, 2, (byte) 0xC3, (byte) 0x28});

    assertThrows(CorruptHeaderException.class, () -> codec.readHeader(new RgbImage(16, 16, channels)));
  }

  @Test
  void regionSmallerThanOneCharacterIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new MetadataHeaderCodec(23));
  }
}
