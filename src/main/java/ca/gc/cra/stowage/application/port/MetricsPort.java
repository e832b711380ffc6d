package ca.gc.cra.stowage.application.port;

/**
 * <strong>What:</strong> Port abstracting Stowage metrics emission.
 * <p><strong>Why:</strong> Lets the fill pipeline count decisions without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Application port implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose counter increments for events like stored or discarded stacks.</li>
 *   <li>Record numeric observations such as final inventory occupancy.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate calls from any thread.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code fill.stack.stored}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key metric identifier using dotted naming (e.g., {@code fill.stack.discarded}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key metric identifier using dotted naming; must not be {@code null}
   * @param value observed value; semantics defined by the caller
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   *
   * <p>Useful for tests and for runs with {@code metricsExporter=none}.</p>
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
