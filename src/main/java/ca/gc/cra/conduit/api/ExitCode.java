package ca.gc.cra.conduit.api;

/**
 * <strong>What:</strong> Process exit codes shared by every conduit command.
 * <p><strong>Why:</strong> Lets wrapper scripts tell a bad link apart from an unreachable server.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Command completed; for {@code probe} the server answered. */
  SUCCESS(0),
  /** Arguments or the share link were malformed. */
  INVALID_ARGS(2),
  /** Local IO failed (config file, stdin or stdout). */
  IO_ERROR(3),
  /** Merged configuration failed validation. */
  CONFIG_ERROR(4),
  /** Tunnel could not be established or failed unexpectedly. */
  RUNTIME_FAILURE(5),
  /** Interrupted, typically by SIGINT. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric process status.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
