package ca.gc.cra.veil.domain.error;

/**
 * Raised before any carrier mutation when the payload does not fit the available capacity.
 *
 * @since 0.1.0
 */
public final class CapacityExceededException extends StegoException {
  private final long requiredBits;
  private final long availableBits;

  /**
   * Creates an exception describing the capacity shortfall.
   *
   * @param requiredBits bits the payload needs
   * @param availableBits bits the carrier region offers
   */
  public CapacityExceededException(long requiredBits, long availableBits) {
    super("payload needs " + requiredBits + " bits but only " + availableBits
        + " are available (short by " + (requiredBits - availableBits) + ")");
    this.requiredBits = requiredBits;
    this.availableBits = availableBits;
  }

  public long requiredBits() {
    return requiredBits;
  }

  public long availableBits() {
    return availableBits;
  }

  /**
   * Returns how many bits are missing.
   *
   * @return {@code requiredBits - availableBits}
   */
  public long deficitBits() {
    return requiredBits - availableBits;
  }
}
