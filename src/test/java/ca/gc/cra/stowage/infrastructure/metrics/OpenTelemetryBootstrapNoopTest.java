package ca.gc.cra.stowage.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapNoopTest {
  private String previousExporter;

  @BeforeEach
  void rememberProperty() {
    previousExporter = System.getProperty("otel.metrics.exporter");
  }

  @AfterEach
  void resetProperties() {
    if (previousExporter == null) {
      System.clearProperty("otel.metrics.exporter");
    } else {
      System.setProperty("otel.metrics.exporter", previousExporter);
    }
  }

  @Test
  void exporterNoneFallsBackToNoop() {
    System.setProperty("otel.metrics.exporter", "none");

    try (OpenTelemetryMetricsAdapter adapter = new OpenTelemetryMetricsAdapter()) {
      assertTrue(adapter.isNoop(), "Expected noop metrics when exporter=none");
      adapter.increment("fill.stack.stored");
    }
  }

  @Test
  void unknownExporterFallsBackToNoop() {
    System.setProperty("otel.metrics.exporter", "prometheus");

    OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize();
    assertTrue(result.isNoop());
    result.close();
  }
}
