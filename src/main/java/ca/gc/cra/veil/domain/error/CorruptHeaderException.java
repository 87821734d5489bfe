package ca.gc.cra.veil.domain.error;

/**
 * Raised when the header region does not hold a readable header.
 *
 * <p>Typical causes are a zero or oversized length prefix, bytes that are not UTF-8, or a field
 * list that does not match the expected schema. A carrier that never had anything hidden in it
 * usually fails here.</p>
 *
 * @since 0.1.0
 */
public final class CorruptHeaderException extends StegoException {
  /**
   * Creates an exception describing the header problem.
   *
   * @param message human-readable reason
   */
  public CorruptHeaderException(String message) {
    super(message);
  }

  /**
   * Creates an exception describing the header problem with a cause.
   *
   * @param message human-readable reason
   * @param cause underlying parse or decode failure
   */
  public CorruptHeaderException(String message, Throwable cause) {
    super(message, cause);
  }
}
