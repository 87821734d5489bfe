package ca.gc.cra.veil.domain.bits;

import ca.gc.cra.veil.domain.image.RgbImage;

/**
 * Byte streams carried in the lowest bit of consecutive channel slots.
 *
 * <p>Each byte occupies eight slots, most significant bit first. Used for headers and for the
 * depth-1 text and blob payloads.</p>
 */
public final class LowBitChannels {
  private LowBitChannels() {}

  /**
   * Writes {@code data} into the low bit of {@code channels} starting at {@code startSlot}.
   *
   * @param channels mutable channel buffer
   * @param startSlot first slot to write
   * @param data bytes to write
   * @throws IndexOutOfBoundsException if the bytes do not fit the buffer
   */
  public static void writeBytes(byte[] channels, int startSlot, byte[] data) {
    if (data.length == 0) {
      return;
    }
    long end = (long) startSlot + (long) data.length * Byte.SIZE;
    if (startSlot < 0 || end > channels.length) {
      throw new IndexOutOfBoundsException(
          "slots " + startSlot + ".." + end + " exceed carrier of " + channels.length);
    }
    int slot = startSlot;
    for (byte b : data) {
      for (int bit = Byte.SIZE - 1; bit >= 0; bit--) {
        channels[slot] = (byte) BitPlanes.setLowBits(channels[slot] & 0xFF, (b >>> bit) & 1, 1);
        slot++;
      }
    }
  }

  /**
   * Reads {@code count} bytes from the low bit of the carrier starting at {@code startSlot}.
   *
   * @param carrier source image
   * @param startSlot first slot to read
   * @param count number of bytes
   * @return recovered bytes
   * @throws IndexOutOfBoundsException if the range exceeds the carrier
   */
  public static byte[] readBytes(RgbImage carrier, int startSlot, int count) {
    if (count == 0) {
      return new byte[0];
    }
    long end = (long) startSlot + (long) count * Byte.SIZE;
    if (startSlot < 0 || count < 0 || end > carrier.channelCount()) {
      throw new IndexOutOfBoundsException(
          "slots " + startSlot + ".." + end + " exceed carrier of " + carrier.channelCount());
    }
    byte[] out = new byte[count];
    int slot = startSlot;
    for (int i = 0; i < count; i++) {
      out[i] = (byte) readByte(carrier, slot);
      slot += Byte.SIZE;
    }
    return out;
  }

  /**
   * Reads one byte from eight consecutive low bits.
   *
   * @param carrier source image
   * @param startSlot first of the eight slots
   * @return unsigned byte value
   */
  public static int readByte(RgbImage carrier, int startSlot) {
    int value = 0;
    for (int i = 0; i < Byte.SIZE; i++) {
      value = (value << 1) | BitPlanes.lowBits(carrier.channel(startSlot + i), 1);
    }
    return value;
  }
}
