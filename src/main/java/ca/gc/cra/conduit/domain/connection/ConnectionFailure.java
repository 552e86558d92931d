package ca.gc.cra.conduit.domain.connection;

/**
 * Classifies why a connection ended in {@code Error}.
 *
 * @since 0.1.0
 */
public enum ConnectionFailure {
  /** Socket or TLS level failure; a fresh connection may succeed. */
  TRANSPORT(true),
  /** Malformed or unsupported response header; fatal for the session, not for the profile. */
  PROTOCOL(true),
  /** Profile id unknown to the profile store. */
  PROFILE(false),
  /** Credential missing or unreadable in the vault. */
  CREDENTIAL(false),
  /** Unexpected local failure. */
  INTERNAL(false);

  private final boolean retryable;

  ConnectionFailure(boolean retryable) {
    this.retryable = retryable;
  }

  /**
   * Whether automatic reconnection is worthwhile for this failure.
   *
   * @return {@code true} when a retry can succeed without user action
   */
  public boolean retryable() {
    return retryable;
  }
}
