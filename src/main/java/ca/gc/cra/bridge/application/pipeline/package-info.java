/**
 * The replication engine: per-message pipeline, deduplication window, counters and the supervisor loop.
 * <p>Everything in this package runs on the supervisor thread except {@link
 * ca.gc.cra.bridge.application.pipeline.ReplicationStats#snapshot()}, which the health endpoint
 * calls from its own thread.</p>
 * <p>Ordering per partition or queue is preserved by dispatching one message at a time and retrying
 * failed publishes in place.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.bridge.application.pipeline;
