package ca.gc.cra.veil.domain.error;

/**
 * Checked base type for codec failures that callers are expected to handle.
 *
 * <p>Subclasses carry the sizes that explain the failure so CLI layers can report them without
 * parsing messages.</p>
 *
 * @since 0.1.0
 */
public class StegoException extends Exception {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public StegoException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error
   * @param cause root cause
   */
  public StegoException(String message, Throwable cause) {
    super(message, cause);
  }
}
