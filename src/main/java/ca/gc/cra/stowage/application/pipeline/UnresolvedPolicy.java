package ca.gc.cra.stowage.application.pipeline;

import java.util.Locale;

/**
 * Treatment of stack requests whose item identifier is not in the catalog.
 *
 * @since 0.1.0
 */
public enum UnresolvedPolicy {
  /** Omit the request from the audit log; occupancy is unaffected. */
  DROP,
  /** Write an {@code Unknown} audit entry; occupancy is unaffected. */
  REPORT;

  /**
   * Parses a policy name, defaulting when the value is blank.
   *
   * @param raw configured value (case-insensitive); may be {@code null}
   * @param defaultValue policy returned for blank input
   * @return parsed policy
   * @throws IllegalArgumentException if the value names no policy
   */
  public static UnresolvedPolicy fromString(String raw, UnresolvedPolicy defaultValue) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return UnresolvedPolicy.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("unresolved must be DROP or REPORT (was '" + raw + "')", ex);
    }
  }
}
