package ca.gc.cra.veil.domain.error;

/**
 * Raised when the payload region cannot deliver what the header declared.
 *
 * @since 0.1.0
 */
public final class CorruptPayloadException extends StegoException {
  private final long expectedBytes;
  private final long recoveredBytes;

  /**
   * Creates an exception for a payload that ran out before completion.
   *
   * @param expectedBytes bytes the header declared
   * @param recoveredBytes bytes recovered before the carrier was exhausted
   */
  public CorruptPayloadException(long expectedBytes, long recoveredBytes) {
    super("carrier exhausted after " + recoveredBytes + " of " + expectedBytes + " payload bytes");
    this.expectedBytes = expectedBytes;
    this.recoveredBytes = recoveredBytes;
  }

  /**
   * Creates an exception for a payload that was recovered but is not decodable.
   *
   * <p>Variants without a size field, such as terminated text, pass the length delimited by
   * their sentinel as {@code expectedBytes}.</p>
   *
   * @param message human-readable reason
   * @param expectedBytes bytes the carrier delimited for the payload
   * @param recoveredBytes bytes recovered before decoding failed
   * @param cause decode failure
   */
  public CorruptPayloadException(String message, long expectedBytes, long recoveredBytes, Throwable cause) {
    super(message, cause);
    this.expectedBytes = expectedBytes;
    this.recoveredBytes = recoveredBytes;
  }

  public long expectedBytes() {
    return expectedBytes;
  }

  public long recoveredBytes() {
    return recoveredBytes;
  }
}
