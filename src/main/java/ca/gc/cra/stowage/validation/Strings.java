package ca.gc.cra.stowage.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for strings used by Stowage configuration and CLI layers.
 * <p><strong>Why:</strong> Keys such as {@code items} or {@code sizePolicy} arrive as free text from the command
 * line or YAML; rejecting blanks and control characters early keeps later error messages meaningful.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent access.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    if (containsControl(trimmed)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    return trimmed;
  }

  /**
   * Ensures a string only contains printable ASCII and does not exceed {@code maxLength}.
   *
   * @param name logical parameter name used in diagnostics
   * @param value candidate string; must not be {@code null}
   * @param maxLength maximum permitted length; must be positive
   * @return trimmed string
   * @throws IllegalArgumentException if the value is blank, too long, or contains non-printable characters
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    if (maxLength <= 0) {
      throw new IllegalArgumentException("maxLength must be positive");
    }
    String trimmed = requireNonBlank(name, value);
    if (trimmed.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "must be at most " + maxLength + " characters"));
    }
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters only"));
      }
    }
    return trimmed;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    return (name == null || name.isBlank() ? "value" : name) + " " + suffix;
  }
}
