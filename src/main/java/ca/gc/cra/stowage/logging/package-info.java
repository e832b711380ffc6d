/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and bound echoed input.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; logs go to stderr so the report on stdout stays
 * machine-comparable.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.stowage.logging;
