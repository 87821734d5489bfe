package ca.gc.cra.veil.domain.error;

/**
 * Raised when a serialized header does not fit the reserved header region.
 *
 * @since 0.1.0
 */
public final class HeaderTooLargeException extends StegoException {
  private final long headerBits;
  private final long reservedBits;

  /**
   * Creates an exception describing the oversized header.
   *
   * @param headerBits bits the length prefix plus header text would occupy
   * @param reservedBits size of the reserved header region
   */
  public HeaderTooLargeException(long headerBits, long reservedBits) {
    super("header needs " + headerBits + " bits but the reserved region holds " + reservedBits);
    this.headerBits = headerBits;
    this.reservedBits = reservedBits;
  }

  public long headerBits() {
    return headerBits;
  }

  public long reservedBits() {
    return reservedBits;
  }
}
