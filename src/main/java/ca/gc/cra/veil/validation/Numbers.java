package ca.gc.cra.veil.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by VEIL codecs, CLI and configuration parsing.
 * <p><strong>Why:</strong> Rejects bit depths, strides and fractions that would make an embedding
 * walk ill-defined before any carrier channel is touched.
 * <p><strong>Role:</strong> Domain support utilities invoked by codecs and configuration loaders.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Enforce inclusive integer bounds such as bit depths in {@code [1, 8]}.</li>
 *   <li>Enforce finite lower bounds on real-valued parameters such as strides.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.
 * <p><strong>Performance:</strong> Constant-time range checks.
 * <p><strong>Observability:</strong> Emits no logs; throws {@link IllegalArgumentException} when
 * validation fails.
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value expressed in the caller's units (e.g., bits, slots)
   * @param min minimum inclusive value in the same units as {@code value}
   * @param max maximum inclusive value in the same units as {@code value}
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a real value is finite and not below {@code min}.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value
   * @param min minimum inclusive value
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} is NaN, infinite or below {@code min}
   */
  public static double requireFiniteAtLeast(String name, double value, double min) {
    if (!Double.isFinite(value)) {
      throw new IllegalArgumentException(label(name) + " must be a finite number (was " + value + ")");
    }
    if (value < min) {
      throw new IllegalArgumentException(label(name) + " must be >= " + min + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a fraction lies in {@code (0, 1]}.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate fraction
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} is not a finite number in {@code (0, 1]}
   */
  public static double requireFraction(String name, double value) {
    if (!Double.isFinite(value) || value <= 0.0 || value > 1.0) {
      throw new IllegalArgumentException(label(name) + " must be in (0, 1] (was " + value + ")");
    }
    return value;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
