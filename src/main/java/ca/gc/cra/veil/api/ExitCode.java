package ca.gc.cra.veil.api;

/**
 * <strong>What:</strong> Process exit codes shared by the VEIL commands.
 * <p><strong>Role:</strong> Returned by every CLI entry point and passed to {@link System#exit}.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** Reading the carrier or payload, or writing an output, failed. */
  IO_ERROR(3),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure. */
  RUNTIME_FAILURE(5),
  /** The payload did not fit, or the carrier held no valid payload. */
  CODEC_FAILURE(6),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value handed to the operating system.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
