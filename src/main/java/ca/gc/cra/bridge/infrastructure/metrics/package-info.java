/**
 * OpenTelemetry implementation of the metrics port.
 *
 * <p>Export is disabled by default; {@code metricsExporter=otlp} on the command line (or
 * {@code OTEL_METRICS_EXPORTER=otlp}) enables the OTLP gRPC exporter.</p>
 */
package ca.gc.cra.bridge.infrastructure.metrics;
