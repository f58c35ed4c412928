/**
 * Command-line entry point of the replication bridge.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, configures logging and
 * telemetry, and runs the composed bridge.</p>
 * <p><strong>Security:</strong> The RabbitMQ password is never printed in the dry-run plan or logs.</p>
 */
package ca.gc.cra.bridge.api;
