package ca.gc.cra.veil.domain.bits;

/**
 * First-in first-out bit queue, most significant bit first.
 *
 * <p>Bits live in a single {@code long} accumulator, so at most {@link #MAX_BITS} bits can be
 * pending. The embedding walks never hold more than 47 bits at once.</p>
 *
 * <p>Not thread-safe; each walk owns its own queue.</p>
 */
public final class BitQueue {
  /** Maximum number of pending bits. */
  public static final int MAX_BITS = 63;

  private long bits;
  private int size;

  /**
   * Appends the lowest {@code count} bits of {@code value}.
   *
   * @param value bits to append, right-aligned
   * @param count number of bits, {@code 0..32}
   * @throws IllegalStateException if the queue would exceed {@link #MAX_BITS}
   */
  public void push(int value, int count) {
    if (count < 0 || count > 32) {
      throw new IllegalArgumentException("count must be between 0 and 32 (was " + count + ")");
    }
    if (size + count > MAX_BITS) {
      throw new IllegalStateException("bit queue overflow: " + size + " + " + count);
    }
    long mask = count == 32 ? 0xFFFF_FFFFL : (1L << count) - 1;
    bits = (bits << count) | (value & mask);
    size += count;
  }

  /**
   * Removes the oldest {@code count} bits.
   *
   * @param count number of bits, {@code 0..32}
   * @return removed bits, right-aligned
   * @throws IllegalStateException if fewer than {@code count} bits are pending
   */
  public int pop(int count) {
    if (count < 0 || count > 32) {
      throw new IllegalArgumentException("count must be between 0 and 32 (was " + count + ")");
    }
    if (count > size) {
      throw new IllegalStateException("bit queue underflow: need " + count + ", have " + size);
    }
    int remaining = size - count;
    long mask = count == 32 ? 0xFFFF_FFFFL : (1L << count) - 1;
    int value = (int) ((bits >>> remaining) & mask);
    bits &= remaining == 0 ? 0L : (1L << remaining) - 1;
    size = remaining;
    return value;
  }

  /** Number of pending bits. */
  public int size() {
    return size;
  }

  public boolean isEmpty() {
    return size == 0;
  }
}
