/**
 * Infrastructure adapters: text-file input, text report rendering, and OpenTelemetry metrics.
 * <p><strong>Role:</strong> Driven side of the hexagon; implements application ports.</p>
 */
package ca.gc.cra.stowage.infrastructure;
