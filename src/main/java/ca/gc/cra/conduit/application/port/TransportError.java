package ca.gc.cra.conduit.application.port;

/**
 * Failure kinds reported by {@link Transport} operations.
 *
 * <p>Every kind is locally recoverable by opening a new connection; none is fatal to the process.</p>
 *
 * @since 0.1.0
 */
public enum TransportError {
  /** TCP connect failed or was refused, or the requested transport is unavailable. */
  CONNECT_FAILED,
  /** Operation attempted before {@code connect} succeeded or after {@code close}. */
  NOT_CONNECTED,
  /** Remote end closed the stream or reset the connection. */
  PEER_CLOSED,
  /** Connect or read exceeded its configured timeout. */
  TIMEOUT,
  /** TLS negotiation failed, including certificate validation. */
  TLS_HANDSHAKE_FAILED
}
