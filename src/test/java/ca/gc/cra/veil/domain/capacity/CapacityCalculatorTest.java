package ca.gc.cra.veil.domain.capacity;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.veil.domain.error.CapacityExceededException;
import java.util.List;
import org.junit.jupiter.api.Test;

class CapacityCalculatorTest {

  @Test
  void totalCapacityIsPixelsTimesChannelsTimesDepth() {
    assertEquals(48, CapacityCalculator.totalCapacityBits(4, 4, 1));
    assertEquals(192, CapacityCalculator.totalCapacityBits(4, 4, 4));
    assertEquals(64, CapacityCalculator.totalCapacityBits(4, 4, 4, 1));
  }

  @Test
  void availableCapacityNeverGoesNegative() {
    assertEquals(8, CapacityCalculator.availableCapacityBits(48, 40));
    assertEquals(0, CapacityCalculator.availableCapacityBits(48, 8192));
  }

  @Test
  void capacityGrowsWithDimensionsAndDepth() {
    long previous = -1;
    for (int side = 1; side <= 32; side++) {
      long bits = CapacityCalculator.totalCapacityBits(side, side, 1);
      assertTrue(bits > previous);
      previous = bits;
    }
    for (int depth = 1; depth < 8; depth++) {
      assertTrue(CapacityCalculator.totalCapacityBits(10, 7, depth + 1)
          > CapacityCalculator.totalCapacityBits(10, 7, depth));
      assertTrue(CapacityCalculator.imageAvailableBits(300, 12, depth + 1)
          > CapacityCalculator.imageAvailableBits(300, 12, depth));
    }
  }

  @Test
  void requireFitsReportsExactDeficit() throws CapacityExceededException {
    CapacityCalculator.requireFits(100, 100);

    CapacityExceededException ex =
        assertThrows(CapacityExceededException.class, () -> CapacityCalculator.requireFits(101, 100));
    assertEquals(101, ex.requiredBits());
    assertEquals(100, ex.availableBits());
    assertEquals(1, ex.deficitBits());
  }

  @Test
  void imageAvailableBitsCountsWholeGroupsOnly() {
    assertEquals(48, CapacityCalculator.imageAvailableBits(48, 0, 1));
    assertEquals(45, CapacityCalculator.imageAvailableBits(48, 2, 1));
    assertEquals(0, CapacityCalculator.imageAvailableBits(10, 24, 8));
  }

  @Test
  void requiredBitsFormulas() {
    assertEquals(5 * 8 + 16, CapacityCalculator.textRequiredBits(5, 16));
    assertEquals(64L * 3 * 2, CapacityCalculator.imageRequiredBits(64, 2));
  }

  @Test
  void reportAppliesSafeUsageFraction() {
    CapacityReport report = CapacityCalculator.report(100, 100, 1, 16, 0.10);

    assertEquals(30_000, report.totalBits());
    assertEquals(29_984, report.availableBits());
    assertEquals(3_748, report.availableBytes());
    assertEquals(374, report.safeUsageBytes());
    assertThrows(IllegalArgumentException.class, () -> CapacityCalculator.report(1, 1, 1, 0, 0.0));
  }

  @Test
  void imageTableListsEveryDepth() {
    List<ImageCapacityEstimate> table = CapacityCalculator.imageCapacityTable(64, 64, 4096);

    assertEquals(8, table.size());
    ImageCapacityEstimate first = table.get(0);
    assertEquals(1, first.lsb());
    assertEquals(8190, first.availableBits());
    assertEquals(341, first.maxHiddenPixels());
    assertEquals(18, first.maxSquareSide());
    assertEquals(8 * 8190, table.get(7).availableBits());
  }
}
