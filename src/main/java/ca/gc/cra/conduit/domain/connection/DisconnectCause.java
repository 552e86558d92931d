package ca.gc.cra.conduit.domain.connection;

/**
 * Why the connection manager is in {@code Disconnected}.
 *
 * @since 0.1.0
 */
public enum DisconnectCause {
  /** Initial state; nothing has been connected yet. */
  INITIAL,
  /** The user asked to disconnect; automatic retries are suppressed. */
  USER,
  /** Torn down to rebind after the host network changed; a reconnect follows. */
  NETWORK_CHANGE
}
