package ca.gc.cra.veil.domain.error;

/**
 * Raised when a text extraction scans the whole carrier without meeting the end-of-message marker.
 *
 * @since 0.1.0
 */
public final class TerminatorNotFoundException extends StegoException {
  private final long scannedBits;

  /**
   * Creates an exception for a missing terminator.
   *
   * @param scannedBits number of low bits inspected
   */
  public TerminatorNotFoundException(long scannedBits) {
    super("no end-of-message marker found in " + scannedBits + " scanned bits");
    this.scannedBits = scannedBits;
  }

  public long scannedBits() {
    return scannedBits;
  }
}
