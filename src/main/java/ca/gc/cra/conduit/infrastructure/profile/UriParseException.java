package ca.gc.cra.conduit.infrastructure.profile;

import ca.gc.cra.conduit.logging.Logs;

/**
 * Signals that a share URI could not be turned into a profile. Messages are redacted and never echo the UUID.
 *
 * @since 0.1.0
 */
public final class UriParseException extends Exception {
  private static final long serialVersionUID = 1L;

  public UriParseException(String message) {
    super(Logs.redactCredentials(message));
  }

  public UriParseException(String message, Throwable cause) {
    super(Logs.redactCredentials(message), cause);
  }
}
