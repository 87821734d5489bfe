package ca.gc.cra.veil.domain.bits;

import ca.gc.cra.veil.validation.Numbers;

/**
 * <strong>What:</strong> Reads and writes bit-planes of a single 8-bit channel value.
 * <p><strong>Why:</strong> Every embedding variant substitutes the low bits of carrier channels and
 * the image variant samples the high bits of payload channels; both go through this primitive.</p>
 * <p><strong>Role:</strong> Pure, stateless domain primitive.</p>
 * <p><strong>Contract:</strong> depths are in {@code [1, 8]}; channel values are taken as unsigned
 * 8-bit and only their lowest byte is considered.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> The {@code int} overloads are allocation-free and used on hot
 * paths; the bit-string overloads exist for diagnostics and tests.</p>
 *
 * @since 0.1.0
 */
public final class BitPlanes {
  /** Bits in one channel value. */
  public static final int CHANNEL_BITS = 8;

  private BitPlanes() {}

  /**
   * Replaces the lowest {@code n} bits of a channel value.
   *
   * @param channelValue unsigned channel value
   * @param bits replacement bits; only the lowest {@code n} bits are used
   * @param n bit depth in {@code [1, 8]}
   * @return new channel value clamped to {@code [0, 255]}
   * @throws IllegalArgumentException if {@code n} is out of range
   */
  public static int setLowBits(int channelValue, int bits, int n) {
    requireDepth(n);
    int mask = mask(n);
    int value = ((channelValue & 0xFF) & ~mask) | (bits & mask);
    return clamp(value);
  }

  /**
   * Replaces the lowest {@code n} bits of a channel value with a {@code '0'/'1'} string.
   *
   * <p>Strings shorter than {@code n} are left-padded with zeros.</p>
   *
   * @param channelValue unsigned channel value
   * @param bits replacement bits, most significant first, at most {@code n} characters
   * @param n bit depth in {@code [1, 8]}
   * @return new channel value clamped to {@code [0, 255]}
   * @throws IllegalArgumentException if {@code n} is out of range, {@code bits} is longer than
   *     {@code n} or contains characters other than {@code '0'} and {@code '1'}
   */
  public static int setLowBits(int channelValue, String bits, int n) {
    requireDepth(n);
    if (bits == null) {
      throw new IllegalArgumentException("bits must not be null");
    }
    if (bits.length() > n) {
      throw new IllegalArgumentException("bits '" + bits + "' longer than depth " + n);
    }
    int value = 0;
    for (int i = 0; i < bits.length(); i++) {
      char c = bits.charAt(i);
      if (c != '0' && c != '1') {
        throw new IllegalArgumentException("bits must contain only '0' and '1' (was '" + bits + "')");
      }
      value = (value << 1) | (c - '0');
    }
    return setLowBits(channelValue, value, n);
  }

  /**
   * Returns the lowest {@code n} bits of a channel value.
   *
   * @param channelValue unsigned channel value
   * @param n bit depth in {@code [1, 8]}
   * @return low bits as an integer in {@code [0, 2^n)}
   */
  public static int lowBits(int channelValue, int n) {
    requireDepth(n);
    return channelValue & mask(n);
  }

  /**
   * Returns the highest {@code n} bits of a channel value, shifted down.
   *
   * @param channelValue unsigned channel value
   * @param n bit depth in {@code [1, 8]}
   * @return high bits as an integer in {@code [0, 2^n)}
   */
  public static int highBits(int channelValue, int n) {
    requireDepth(n);
    return (channelValue & 0xFF) >>> (CHANNEL_BITS - n);
  }

  /**
   * Returns the lowest {@code n} bits as a {@code '0'/'1'} string of length {@code n}.
   *
   * @param channelValue unsigned channel value
   * @param n bit depth in {@code [1, 8]}
   * @return bit string, most significant first
   */
  public static String getLowBits(int channelValue, int n) {
    return toBitString(lowBits(channelValue, n), n);
  }

  /**
   * Returns the highest {@code n} bits as a {@code '0'/'1'} string of length {@code n}.
   *
   * @param channelValue unsigned channel value
   * @param n bit depth in {@code [1, 8]}
   * @return bit string, most significant first
   */
  public static String getHighBits(int channelValue, int n) {
    return toBitString(highBits(channelValue, n), n);
  }

  /**
   * Validates a bit depth.
   *
   * @param n candidate depth
   * @return {@code n}
   * @throws IllegalArgumentException if {@code n} is outside {@code [1, 8]}
   */
  public static int requireDepth(int n) {
    Numbers.requireRange("bit depth", n, 1, CHANNEL_BITS);
    return n;
  }

  private static int mask(int n) {
    return (1 << n) - 1;
  }

  private static int clamp(int value) {
    return Math.max(0, Math.min(255, value));
  }

  private static String toBitString(int value, int n) {
    char[] out = new char[n];
    for (int i = 0; i < n; i++) {
      out[i] = ((value >>> (n - 1 - i)) & 1) == 1 ? '1' : '0';
    }
    return new String(out);
  }
}
