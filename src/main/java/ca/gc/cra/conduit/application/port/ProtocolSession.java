package ca.gc.cra.conduit.application.port;

import ca.gc.cra.conduit.domain.net.ServerEndpoint;
import ca.gc.cra.conduit.domain.profile.Credential;
import ca.gc.cra.conduit.domain.profile.TransportConfig;
import java.util.OptionalLong;

/**
 * <strong>What:</strong> One logical tunnel connection: a transport plus the protocol handshake on top of it.
 * <p><strong>Why:</strong> The connection manager drives any backend through this contract; a VLESS session and an
 * alternative VPN backend are interchangeable implementations selected by {@link SessionFactory}.</p>
 * <p><strong>Role:</strong> Exclusively owned by the connection manager for the lifetime of one connection attempt.</p>
 * <p><strong>Thread-safety:</strong> {@link #forward} and {@link #pull} may run on separate threads after connect.
 * {@link #close()} may be called from any thread, including while {@link #connect} is blocked.</p>
 * <p><strong>Observability:</strong> Byte counters feed the manager's statistics sampler.</p>
 *
 * @since 0.1.0
 */
public interface ProtocolSession extends AutoCloseable {
  /**
   * Opens the transport and completes the request/response handshake.
   *
   * <p>The credential is used for the request header only and is not retained.</p>
   *
   * @param endpoint server to dial
   * @param credential authenticating credential
   * @param transport transport variant
   * @throws SessionException when the transport cannot connect or the handshake fails
   */
  void connect(ServerEndpoint endpoint, Credential credential, TransportConfig transport)
      throws SessionException;

  /**
   * Sends payload bytes through the tunnel.
   *
   * @param data source buffer
   * @param offset first byte
   * @param length byte count
   * @throws SessionException when the session is not connected or the transport fails
   */
  void forward(byte[] data, int offset, int length) throws SessionException;

  /**
   * Receives payload bytes from the tunnel.
   *
   * @param buffer destination
   * @return bytes read; {@code 0} when nothing arrived within the read timeout
   * @throws SessionException when the peer closed the stream or the transport failed
   */
  int pull(byte[] buffer) throws SessionException;

  /**
   * Total payload bytes sent.
   *
   * @return monotonic counter
   */
  long bytesSent();

  /**
   * Total payload bytes received.
   *
   * @return monotonic counter
   */
  long bytesReceived();

  /**
   * Handshake round trip, once connected.
   *
   * @return milliseconds, or empty before the handshake completes
   */
  OptionalLong roundtripMs();

  /**
   * Whether the handshake completed and the session has not been closed.
   *
   * @return session open flag
   */
  boolean isOpen();

  /**
   * Closes the transport. Idempotent and never throws.
   */
  @Override
  void close();
}
