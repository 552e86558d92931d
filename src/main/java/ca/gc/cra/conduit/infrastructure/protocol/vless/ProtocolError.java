package ca.gc.cra.conduit.infrastructure.protocol.vless;

/**
 * Header decoding failures. All of them end the current session.
 *
 * @since 0.1.0
 */
public enum ProtocolError {
  /** Response header truncated or malformed. */
  BAD_RESPONSE_HEADER,
  /** Response carried a protocol version this client does not speak. */
  UNSUPPORTED_VERSION,
  /** Request header could not be decoded (diagnostics and test servers only). */
  BAD_REQUEST_HEADER
}
