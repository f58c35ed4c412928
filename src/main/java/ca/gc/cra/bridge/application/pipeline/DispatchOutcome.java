package ca.gc.cra.bridge.application.pipeline;

/**
 * Result of running one message through the replication pipeline.
 *
 * @since 0.1.0
 */
public enum DispatchOutcome {
  /** Published, confirmed and acknowledged on the source. */
  REPLICATED,
  /** Already replicated within the deduplication window; acknowledged without publishing. */
  DUPLICATE,
  /** No route for the message's source; rejected without requeue. */
  ROUTE_MISS,
  /** Publication failed; the source message is still unresolved. */
  FAILED
}
