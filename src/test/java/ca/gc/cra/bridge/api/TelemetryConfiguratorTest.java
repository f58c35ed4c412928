package ca.gc.cra.bridge.api;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TelemetryConfiguratorTest {

  @AfterEach
  void clear() {
    System.clearProperty("otel.metrics.exporter");
    System.clearProperty("otel.exporter.otlp.endpoint");
    System.clearProperty("otel.resource.attributes");
  }

  @Test
  void exporterSettingsBecomeSystemProperties() {
    TelemetryConfigurator.configureMetrics(Map.of(
        "metricsExporter", "OTLP",
        "otelEndpoint", "http://collector:4317",
        "otelResourceAttributes", "deployment.environment=prod"));

    assertEquals("otlp", System.getProperty("otel.metrics.exporter"));
    assertEquals("http://collector:4317", System.getProperty("otel.exporter.otlp.endpoint"));
    assertEquals("deployment.environment=prod", System.getProperty("otel.resource.attributes"));
  }

  @Test
  void endpointNeedsHttpSchemeAndHost() {
    assertDoesNotThrow(() -> TelemetryConfigurator.validateEndpoint("https://collector.example:4317"));
    assertThrows(IllegalArgumentException.class, () -> TelemetryConfigurator.validateEndpoint("grpc://collector:4317"));
    assertThrows(IllegalArgumentException.class, () -> TelemetryConfigurator.validateEndpoint("http:///path"));
  }

  @Test
  void unknownExporterIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(Map.of("metricsExporter", "prometheus")));
  }
}
