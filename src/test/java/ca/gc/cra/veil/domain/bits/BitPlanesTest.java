package ca.gc.cra.veil.domain.bits;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class BitPlanesTest {

  @Test
  void setLowBitsReplacesOnlyTheLowPlanes() {
    assertEquals(0b1011_0110, BitPlanes.setLowBits(0b1011_0101, 0b10, 2));
    assertEquals(0b1111_1110, BitPlanes.setLowBits(0xFF, 0, 1));
    assertEquals(0x5A, BitPlanes.setLowBits(0x00, 0x5A, 8));
  }

  @Test
  void setLowBitsIgnoresBitsAboveDepth() {
    assertEquals(0b0000_0011, BitPlanes.setLowBits(0, 0b1111, 2));
  }

  @Test
  void setLowBitsFromStringLeftPadsShortInput() {
    assertEquals(0b1111_0001, BitPlanes.setLowBits(0xFF, "1", 4));
    assertEquals(0b1111_1010, BitPlanes.setLowBits(0xFF, "1010", 4));
  }

  @Test
  void setLowBitsFromStringRejectsMalformedInput() {
    assertThrows(IllegalArgumentException.class, () -> BitPlanes.setLowBits(0, "10101", 4));
    assertThrows(IllegalArgumentException.class, () -> BitPlanes.setLowBits(0, "12", 4));
    assertThrows(IllegalArgumentException.class, () -> BitPlanes.setLowBits(0, (String) null, 4));
  }

  @Test
  void readersReturnLowAndHighPlanesAsPaddedStrings() {
    assertEquals("01", BitPlanes.getLowBits(0b1010_1001, 2));
    assertEquals("101", BitPlanes.getHighBits(0b1010_1001, 3));
    assertEquals("00000101", BitPlanes.getLowBits(5, 8));
    assertEquals(0b101, BitPlanes.highBits(0b1010_1001, 3));
    assertEquals(0b1001, BitPlanes.lowBits(0b1010_1001, 4));
  }

  @Test
  void depthOutsideOneToEightIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> BitPlanes.setLowBits(0, 0, 0));
    assertThrows(IllegalArgumentException.class, () -> BitPlanes.lowBits(0, 9));
    assertThrows(IllegalArgumentException.class, () -> BitPlanes.getHighBits(0, -1));
  }

  @Test
  void resultStaysWithinChannelRange() {
    for (int value = 0; value < 256; value += 17) {
      for (int n = 1; n <= 8; n++) {
        int written = BitPlanes.setLowBits(value, -1, n);
        assertEquals(written & 0xFF, written);
        assertEquals((1 << n) - 1, BitPlanes.lowBits(written, n));
      }
    }
  }
}
