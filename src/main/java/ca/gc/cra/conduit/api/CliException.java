package ca.gc.cra.conduit.api;

import ca.gc.cra.conduit.logging.Logs;
import java.util.Objects;

/**
 * Command setup failure carrying the exit code the command should return.
 */
final class CliException extends Exception {
  private static final long serialVersionUID = 1L;

  private final ExitCode exitCode;
  private final boolean showUsage;

  CliException(ExitCode exitCode, String message, boolean showUsage, Throwable cause) {
    super(Logs.redactCredentials(message), cause);
    this.exitCode = Objects.requireNonNull(exitCode, "exitCode");
    this.showUsage = showUsage;
  }

  ExitCode exitCode() {
    return exitCode;
  }

  /** Whether the command's one-line usage should follow the error. */
  boolean showUsage() {
    return showUsage;
  }
}
