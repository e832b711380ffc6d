package ca.gc.cra.stowage.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by Stowage configuration parsing.
 * <p><strong>Why:</strong> Item weights and the default weight must be non-negative integers before a
 * {@code StackSizePolicy} is built from them.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.</p>
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
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
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
   * Parses a decimal integer and validates it against an inclusive range.
   *
   * @param name logical parameter name included in diagnostics
   * @param raw candidate text; surrounding whitespace is ignored
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   * @throws IllegalArgumentException if {@code raw} is not an integer or lies outside {@code [min, max]}
   */
  public static int parseIntInRange(String name, String raw, int min, int max) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException(label(name) + " must be an integer (was blank)");
    }
    int value;
    try {
      value = Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be an integer (was '" + raw.trim() + "')", ex);
    }
    return (int) requireRange(name, value, min, max);
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
