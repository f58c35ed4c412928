/**
 * Kafka adapters: a group-less (or optionally grouped) byte-array consumer and an idempotent
 * producer, both speaking the bridge's source and destination ports.
 *
 * @since 0.1.0
 */
package ca.gc.cra.bridge.adapter.kafka;
