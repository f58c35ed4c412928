/**
 * Message value objects that flow through the replication pipeline.
 * <p>All types are immutable. Payload bytes are never transformed; text views exist for logging only.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.bridge.domain.message;
