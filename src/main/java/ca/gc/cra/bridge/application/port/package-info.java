/**
 * Ports between the replication engine and its adapters.
 * <p><strong>Role:</strong> Application boundary; adapters under {@code ca.gc.cra.bridge.adapter}
 * implement the broker ports, {@code ca.gc.cra.bridge.infrastructure.metrics} the metrics port.</p>
 * <p><strong>Errors:</strong> {@link ca.gc.cra.bridge.application.port.ConnectionException} is fatal,
 * {@link ca.gc.cra.bridge.application.port.DeliveryException} is recovered per message.</p>
 */
package ca.gc.cra.bridge.application.port;
