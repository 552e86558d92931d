package ca.gc.cra.conduit.application.port;

/**
 * <strong>What:</strong> Port for a raw bidirectional byte stream to a tunnel server.
 * <p><strong>Why:</strong> Lets the protocol codec run unchanged over plain TCP, TLS, or framed transports such as
 * WebSocket, gRPC and HTTP/2.</p>
 * <p><strong>Role:</strong> Implemented by infrastructure adapters; owned by exactly one protocol session.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Open the stream and negotiate any outer framing inside {@link #connect(String, int)}.</li>
 *   <li>Behave as a plain byte pipe once connected.</li>
 *   <li>Report every failure as a {@link TransportException} with a {@link TransportError} kind.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> One sender thread and one receiver thread may use a connected transport
 * concurrently. {@link #close()} may be called from any thread and must unblock a pending {@code connect} or
 * {@code receive}.</p>
 * <p><strong>Performance:</strong> Blocking I/O; callers run it on dedicated worker threads.</p>
 *
 * @implNote Timeouts come from {@link TransportSettings}, not from global state.
 * @since 0.1.0
 */
public interface Transport extends AutoCloseable {
  /**
   * Opens the stream to {@code host:port}.
   *
   * @param host server hostname or IP literal
   * @param port server port
   * @throws TransportException with {@link TransportError#CONNECT_FAILED}, {@link TransportError#TIMEOUT} or
   *     {@link TransportError#TLS_HANDSHAKE_FAILED}
   */
  void connect(String host, int port) throws TransportException;

  /**
   * Writes {@code length} bytes starting at {@code offset}.
   *
   * @param data source buffer
   * @param offset first byte to send
   * @param length number of bytes
   * @throws TransportException {@link TransportError#NOT_CONNECTED} or {@link TransportError#PEER_CLOSED}
   */
  void send(byte[] data, int offset, int length) throws TransportException;

  /**
   * Writes the whole array.
   *
   * @param data bytes to send
   * @throws TransportException as for {@link #send(byte[], int, int)}
   */
  default void send(byte[] data) throws TransportException {
    send(data, 0, data.length);
  }

  /**
   * Reads available bytes into {@code buffer}, blocking until at least one byte arrives.
   *
   * @param buffer destination buffer
   * @return number of bytes read, always positive
   * @throws TransportException {@link TransportError#PEER_CLOSED} at end of stream, {@link TransportError#TIMEOUT}
   *     when the read timeout elapses, {@link TransportError#NOT_CONNECTED} before connect
   */
  int receive(byte[] buffer) throws TransportException;

  /**
   * Whether the stream is open.
   *
   * @return {@code true} after a successful connect and before close or peer shutdown
   */
  boolean isConnected();

  /**
   * Releases the stream. Idempotent and never throws.
   */
  @Override
  void close();
}
