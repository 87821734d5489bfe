package ca.gc.cra.veil.domain.bits;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.veil.domain.image.RgbImage;
import org.junit.jupiter.api.Test;

class LowBitChannelsTest {

  @Test
  void writesOneBitPerChannelMostSignificantFirst() {
    byte[] channels = new byte[12];
    java.util.Arrays.fill(channels, (byte) 0xF0);

    LowBitChannels.writeBytes(channels, 2, new byte[] {(byte) 0b1000_0001});

    assertEquals((byte) 0xF0, channels[0]);
    assertEquals((byte) 0xF0, channels[1]);
    assertEquals((byte) 0xF1, channels[2]);
    for (int i = 3; i < 9; i++) {
      assertEquals((byte) 0xF0, channels[i]);
    }
    assertEquals((byte) 0xF1, channels[9]);
  }

  @Test
  void readsBackWhatWasWritten() {
    byte[] channels = new byte[4 * 4 * 3];
    byte[] data = {0x12, (byte) 0xAB, 0x7F};
    LowBitChannels.writeBytes(channels, 8, data);
    RgbImage image = new RgbImage(4, 4, channels);

    assertArrayEquals(data, LowBitChannels.readBytes(image, 8, 3));
    assertEquals(0xAB, LowBitChannels.readByte(image, 16));
  }

  @Test
  void outOfRangeAccessIsRejected() {
    byte[] channels = new byte[12];
    assertThrows(IndexOutOfBoundsException.class, () -> LowBitChannels.writeBytes(channels, 5, new byte[1]));
    RgbImage image = new RgbImage(2, 2, channels);
    assertThrows(IndexOutOfBoundsException.class, () -> LowBitChannels.readBytes(image, 0, 2));
  }

  @Test
  void emptyDataTouchesNothing() {
    byte[] channels = new byte[3];
    LowBitChannels.writeBytes(channels, 100, new byte[0]);

    assertArrayEquals(new byte[3], channels);
    assertEquals(0, LowBitChannels.readBytes(new RgbImage(1, 1, channels), 100, 0).length);
  }
}
