package ca.gc.cra.conduit.infrastructure.transport;

import ca.gc.cra.conduit.application.port.Transport;
import ca.gc.cra.conduit.application.port.TransportError;
import ca.gc.cra.conduit.application.port.TransportException;
import ca.gc.cra.conduit.application.port.TransportSettings;
import ca.gc.cra.conduit.domain.net.NetworkHandle;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Socket-backed {@link Transport} skeleton shared by the TCP and TLS variants.
 *
 * <p>The raw socket is published before it connects so that {@link #close()} from another thread aborts a blocked
 * connect or handshake. Subclasses layer extra negotiation through {@link #upgrade(Socket, String, int)}.</p>
 */
abstract class AbstractSocketTransport implements Transport {
  private static final Logger log = LoggerFactory.getLogger(AbstractSocketTransport.class);

  protected final TransportSettings settings;

  private volatile Socket socket;
  private volatile InputStream in;
  private volatile OutputStream out;
  private volatile boolean closed;

  protected AbstractSocketTransport(TransportSettings settings) {
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  @Override
  public final void connect(String host, int port) throws TransportException {
    if (closed) {
      throw new TransportException(TransportError.NOT_CONNECTED, "Transport already closed");
    }
    if (socket != null) {
      throw new TransportException(TransportError.CONNECT_FAILED, "Transport already connected");
    }
    Socket raw = new Socket();
    socket = raw;
    try {
      raw.setTcpNoDelay(true);
      raw.setKeepAlive(true);
      InetSocketAddress target = new InetSocketAddress(host, port);
      if (target.isUnresolved()) {
        throw new UnknownHostException(host);
      }
      bindLocal(raw, target.getAddress());
      if (closed) {
        throw new TransportException(TransportError.CONNECT_FAILED, "Connect cancelled");
      }
      raw.connect(target, settings.connectTimeoutMillis());
      raw.setSoTimeout(settings.readTimeoutMillis());
      Socket stream = upgrade(raw, host, port);
      socket = stream;
      if (closed) {
        throw new TransportException(TransportError.CONNECT_FAILED, "Connect cancelled");
      }
      in = stream.getInputStream();
      out = stream.getOutputStream();
      log.debug("Connected {} transport to {}:{}", name(), host, port);
    } catch (TransportException ex) {
      closeSocket();
      throw ex;
    } catch (SocketTimeoutException ex) {
      closeSocket();
      throw new TransportException(TransportError.TIMEOUT,
          "Connect to " + host + ":" + port + " timed out after " + settings.connectTimeoutMillis() + " ms", ex);
    } catch (UnknownHostException ex) {
      closeSocket();
      throw new TransportException(TransportError.CONNECT_FAILED, "Unknown host " + host, ex);
    } catch (IOException ex) {
      closeSocket();
      String reason = closed ? "Connect cancelled" : "Connect to " + host + ":" + port + " failed: " + ex.getMessage();
      throw new TransportException(TransportError.CONNECT_FAILED, reason, ex);
    }
  }

  private void bindLocal(Socket raw, InetAddress remote) throws IOException {
    Optional<NetworkHandle> binding = settings.binding();
    if (binding.isEmpty()) {
      return;
    }
    NetworkHandle network = binding.get();
    Optional<InetAddress> local = network.localAddressFor(remote);
    if (local.isEmpty()) {
      log.debug("Network {} has no address in the family of {}; leaving the socket unbound",
          network.name(), remote.getHostAddress());
      return;
    }
    raw.bind(new InetSocketAddress(local.get(), 0));
    log.debug("Bound socket to network {} ({})", network.name(), local.get().getHostAddress());
  }

  /**
   * Negotiates any layer above TCP on a connected socket.
   *
   * @param raw connected TCP socket
   * @param host host passed to {@link #connect(String, int)}
   * @param port port passed to {@link #connect(String, int)}
   * @return socket the byte stream should use
   * @throws IOException on socket failures
   */
  protected Socket upgrade(Socket raw, String host, int port) throws IOException {
    return raw;
  }

  /**
   * Short label used in log lines.
   *
   * @return transport name
   */
  protected abstract String name();

  @Override
  public void send(byte[] data, int offset, int length) throws TransportException {
    Objects.checkFromIndexSize(offset, length, data.length);
    OutputStream stream = out;
    if (stream == null || closed) {
      throw new TransportException(TransportError.NOT_CONNECTED, "Transport not connected");
    }
    try {
      stream.write(data, offset, length);
      stream.flush();
    } catch (IOException ex) {
      throw failure("send", ex);
    }
  }

  @Override
  public int receive(byte[] buffer) throws TransportException {
    if (buffer.length == 0) {
      throw new IllegalArgumentException("buffer must not be empty");
    }
    InputStream stream = in;
    if (stream == null || closed) {
      throw new TransportException(TransportError.NOT_CONNECTED, "Transport not connected");
    }
    int read;
    try {
      read = stream.read(buffer);
    } catch (SocketTimeoutException ex) {
      throw new TransportException(TransportError.TIMEOUT,
          "No data within " + settings.readTimeoutMillis() + " ms", ex);
    } catch (IOException ex) {
      throw failure("receive", ex);
    }
    if (read < 0) {
      throw new TransportException(TransportError.PEER_CLOSED, "Connection closed by remote");
    }
    return read;
  }

  @Override
  public boolean isConnected() {
    Socket current = socket;
    return !closed && in != null && current != null && current.isConnected() && !current.isClosed();
  }

  @Override
  public void close() {
    closed = true;
    closeSocket();
  }

  private TransportException failure(String operation, IOException ex) {
    if (closed) {
      return new TransportException(TransportError.NOT_CONNECTED, "Transport closed during " + operation, ex);
    }
    return new TransportException(TransportError.PEER_CLOSED,
        "Connection lost during " + operation + ": " + ex.getMessage(), ex);
  }

  private void closeSocket() {
    Socket current = socket;
    if (current == null) {
      return;
    }
    try {
      current.close();
    } catch (IOException ex) {
      log.debug("Ignoring failure while closing {} socket", name(), ex);
    }
  }
}
