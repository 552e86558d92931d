package ca.gc.cra.conduit.application.connection;

import ca.gc.cra.conduit.domain.connection.ConnectionFailure;
import ca.gc.cra.conduit.logging.Logs;
import java.util.Objects;

/**
 * Checked exception raised by {@link ConnectionManager} data-path and blocking lifecycle calls.
 *
 * @since 0.1.0
 */
public final class ConnectionException extends Exception {
  private static final long serialVersionUID = 1L;

  private final ConnectionFailure failure;

  public ConnectionException(ConnectionFailure failure, String msg) {
    this(failure, msg, null);
  }

  public ConnectionException(ConnectionFailure failure, String msg, Throwable cause) {
    super(Logs.redactCredentials(msg), cause);
    this.failure = Objects.requireNonNull(failure, "failure");
  }

  public ConnectionFailure failure() {
    return failure;
  }
}
