package ca.gc.cra.stowage.infrastructure.metrics;

import ca.gc.cra.stowage.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter that forwards Stowage counters and histograms to OpenTelemetry.
 *
 * <p>Instruments are created lazily per key. Closing the adapter flushes and shuts down the meter provider so a
 * short-lived CLI run still exports its final values.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("stowage.metric.key");
  private static final String FALLBACK_METRIC_NAME = "stowage.metric";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final Map<String, LongCounter> counters = new ConcurrentHashMap<>();
  private final Map<String, LongHistogram> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter wired to the exporter configured through system properties or the environment.
   */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
  }

  /**
   * Indicates whether metrics are discarded because no exporter is configured.
   *
   * @return {@code true} when running against the noop meter
   */
  public boolean isNoop() {
    return bootstrap.isNoop();
  }

  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
    counters.computeIfAbsent(key, this::createCounter).add(1, attributes(key));
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    histograms.computeIfAbsent(key, this::createHistogram).record(value, attributes(key));
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.forceFlush();
    bootstrap.close();
  }

  private LongCounter createCounter(String key) {
    String name = sanitizeName(key);
    if (!name.equals(key)) {
      log.debug("Sanitized counter name '{}' -> '{}'", key, name);
    }
    return meter.counterBuilder(name)
        .setUnit("1")
        .setDescription("Stowage counter for " + key)
        .build();
  }

  private LongHistogram createHistogram(String key) {
    String name = sanitizeName(key);
    if (!name.equals(key)) {
      log.debug("Sanitized histogram name '{}' -> '{}'", key, name);
    }
    return meter.histogramBuilder(name)
        .ofLongs()
        .setDescription("Stowage observation for " + key)
        .build();
  }

  private static Attributes attributes(String key) {
    return Attributes.of(METRIC_KEY_ATTRIBUTE, key);
  }

  static String sanitizeName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      result.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    return result.toString();
  }
}
