package ca.gc.cra.stowage.config;

import java.util.Locale;

/**
 * Selects how stack sizes are computed for capacity checks.
 *
 * @since 0.1.0
 */
public enum SizePolicyMode {
  /** One capacity unit per item counted in the request. */
  QUANTITY,
  /** Quantity multiplied by a configured per-item weight. */
  WEIGHTED;

  /**
   * Parses a mode name case-insensitively.
   *
   * @param raw textual value; blank falls back to {@code defaultValue}
   * @param defaultValue mode used when {@code raw} is {@code null} or blank
   * @return parsed mode
   * @throws IllegalArgumentException when {@code raw} names no mode
   */
  public static SizePolicyMode fromString(String raw, SizePolicyMode defaultValue) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return SizePolicyMode.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("sizePolicy must be QUANTITY or WEIGHTED (was '" + raw.trim() + "')", ex);
    }
  }
}
