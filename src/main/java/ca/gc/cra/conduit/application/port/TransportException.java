package ca.gc.cra.conduit.application.port;

import java.io.IOException;
import java.util.Objects;

/**
 * Checked exception raised by {@link Transport} operations, tagged with a {@link TransportError}.
 *
 * @since 0.1.0
 */
public final class TransportException extends IOException {
  private static final long serialVersionUID = 1L;

  private final TransportError error;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param error failure kind
   * @param msg human-readable error
   */
  public TransportException(TransportError error, String msg) {
    super(msg);
    this.error = Objects.requireNonNull(error, "error");
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param error failure kind
   * @param msg human-readable error
   * @param cause socket or TLS exception
   */
  public TransportException(TransportError error, String msg, Throwable cause) {
    super(msg, cause);
    this.error = Objects.requireNonNull(error, "error");
  }

  /**
   * Returns the failure kind.
   *
   * @return transport error
   */
  public TransportError error() {
    return error;
  }
}
