package ca.gc.cra.bridge.api;

/**
 * <strong>What:</strong> Canonical exit codes of the bridge process.
 * <p><strong>Why:</strong> Container orchestrators only distinguish success from failure, so every
 * failure maps to {@code 1}; the constants keep the cause readable in code and logs.</p>
 * <p><strong>Role:</strong> Adapter-facing enum returned by {@link Main#run(String[])}.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Graceful shutdown, help or dry-run. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(1),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(1),
  /** A broker could not be reached at startup or after a lost connection. */
  CONNECTION_FAILURE(1),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(1);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
