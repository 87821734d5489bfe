package ca.gc.cra.veil.domain.codec;

import ca.gc.cra.veil.domain.image.RgbImage;

/**
 * Position accumulator that yields the carrier index of each payload group.
 *
 * <p>The walk starts at {@code regionStart}, returns {@code regionStart + rint(pos)} for each group
 * and then advances {@code pos += stride * 3}. The step is computed once and added repeatedly, so
 * hide and extract produce the same index sequence as long as both start from the same stride.
 * {@link Math#rint(double)} rounds half to even.</p>
 *
 * <p>Not thread-safe; create one walk per pass.</p>
 */
public final class StrideWalk {
  /** Carrier slots written per group. */
  public static final int GROUP_SLOTS = RgbImage.CHANNELS_PER_PIXEL;

  private final int regionStart;
  private final int carrierSlots;
  private final double step;
  private double pos;

  /**
   * Creates a walk over a carrier region.
   *
   * @param regionStart first slot after the reserved header region
   * @param carrierSlots total carrier slots
   * @param stride carrier slots advanced per payload slot
   */
  public StrideWalk(int regionStart, int carrierSlots, double stride) {
    this.regionStart = regionStart;
    this.carrierSlots = carrierSlots;
    this.step = stride * GROUP_SLOTS;
  }

  /**
   * Returns the index of the next group and advances the accumulator.
   *
   * @return carrier index of the first of three slots, or {@link Long#MAX_VALUE} when the position
   *     has run far beyond any addressable slot
   */
  public long nextIndex() {
    double rounded = Math.rint(pos);
    pos += step;
    if (rounded >= Integer.MAX_VALUE) {
      return Long.MAX_VALUE;
    }
    return regionStart + (long) rounded;
  }

  /**
   * Tells whether a group starting at {@code index} lies inside the carrier.
   *
   * @param index value returned by {@link #nextIndex()}
   * @return {@code true} when all three slots exist
   */
  public boolean groupFits(long index) {
    return index >= 0 && index <= (long) carrierSlots - GROUP_SLOTS;
  }

  /**
   * Runs a fresh walk for {@code groups} steps and returns the index of the last group.
   *
   * @param regionStart first slot after the reserved header region
   * @param carrierSlots total carrier slots
   * @param stride carrier slots advanced per payload slot
   * @param groups number of groups, at least one
   * @return index of the last group
   */
  public static long lastIndex(int regionStart, int carrierSlots, double stride, long groups) {
    StrideWalk walk = new StrideWalk(regionStart, carrierSlots, stride);
    long index = regionStart;
    for (long i = 0; i < groups; i++) {
      index = walk.nextIndex();
    }
    return index;
  }
}
