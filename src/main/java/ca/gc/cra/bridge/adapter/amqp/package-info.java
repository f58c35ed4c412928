/**
 * RabbitMQ adapters on the AMQP 0-9-1 Java client: connection management with flow-control
 * tracking, topology provisioning, a manual-ack queue consumer and a confirming publisher.
 *
 * <p>Client-side automatic recovery is off; the replication supervisor reconnects and each
 * adapter repeats its setup.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.bridge.adapter.amqp;
