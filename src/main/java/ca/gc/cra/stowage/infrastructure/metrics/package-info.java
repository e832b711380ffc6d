/**
 * OpenTelemetry-backed implementation of {@link ca.gc.cra.stowage.application.port.MetricsPort}.
 * <p><strong>Configuration:</strong> {@code metricsExporter=otlp|none} and {@code otelEndpoint} are applied as
 * {@code otel.*} system properties by the CLI before the adapter is created.</p>
 */
package ca.gc.cra.stowage.infrastructure.metrics;
