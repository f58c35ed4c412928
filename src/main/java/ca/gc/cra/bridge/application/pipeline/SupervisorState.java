package ca.gc.cra.bridge.application.pipeline;

/**
 * Lifecycle of the replication supervisor.
 *
 * <p>Transitions: {@code STARTING -> RUNNING -> DRAINING -> STOPPED}; a connection failure while
 * starting goes straight to {@code STOPPED}.</p>
 *
 * @since 0.1.0
 */
public enum SupervisorState {
  STARTING,
  RUNNING,
  DRAINING,
  STOPPED
}
