package ca.gc.cra.conduit.application.port;

import ca.gc.cra.conduit.domain.connection.ConnectionFailure;
import ca.gc.cra.conduit.logging.Logs;
import java.util.Objects;

/**
 * Checked exception raised by {@link ProtocolSession} operations.
 *
 * <p>The message is redacted on construction; it is safe to publish as an error reason.</p>
 *
 * @since 0.1.0
 */
public final class SessionException extends Exception {
  private static final long serialVersionUID = 1L;

  private final ConnectionFailure failure;

  /**
   * Creates an exception.
   *
   * @param failure failure class
   * @param msg human-readable error
   * @param cause transport or protocol exception, may be {@code null}
   */
  public SessionException(ConnectionFailure failure, String msg, Throwable cause) {
    super(Logs.redactCredentials(msg), cause);
    this.failure = Objects.requireNonNull(failure, "failure");
  }

  /**
   * Returns the failure class.
   *
   * @return failure
   */
  public ConnectionFailure failure() {
    return failure;
  }
}
