package ca.gc.cra.conduit.infrastructure.protocol.vless;

import ca.gc.cra.conduit.application.port.ClockPort;
import ca.gc.cra.conduit.application.port.ProtocolSession;
import ca.gc.cra.conduit.application.port.SessionException;
import ca.gc.cra.conduit.application.port.Transport;
import ca.gc.cra.conduit.application.port.TransportError;
import ca.gc.cra.conduit.application.port.TransportException;
import ca.gc.cra.conduit.application.port.TransportFactory;
import ca.gc.cra.conduit.application.port.TransportSettings;
import ca.gc.cra.conduit.domain.connection.ConnectionFailure;
import ca.gc.cra.conduit.domain.net.DestinationAddress;
import ca.gc.cra.conduit.domain.net.ServerEndpoint;
import ca.gc.cra.conduit.domain.profile.Credential;
import ca.gc.cra.conduit.domain.profile.TransportConfig;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ProtocolSession} speaking the VLESS header exchange over any {@link Transport}.
 * <p><strong>Role:</strong> Owns one transport and one {@link VlessCodec} for a single connection attempt.</p>
 * <p><strong>Thread-safety:</strong> {@link #forward} and {@link #pull} may run concurrently on different threads;
 * {@link #close()} is safe from any thread and aborts a blocked {@link #connect}.</p>
 * <p><strong>Security:</strong> The credential is encoded into the request header and not referenced afterwards.</p>
 *
 * @since 0.1.0
 */
public final class VlessSession implements ProtocolSession {
  private static final Logger log = LoggerFactory.getLogger(VlessSession.class);
  private static final int MAX_RESPONSE_HEADER = 2 + 0xFF;
  private static final int RECEIVE_CHUNK = 4096;

  private final TransportFactory transports;
  private final TransportSettings settings;
  private final DestinationAddress destination;
  private final VlessCodec codec;
  private final ClockPort clock;
  private final AtomicLong bytesSent = new AtomicLong();
  private final AtomicLong bytesReceived = new AtomicLong();

  private volatile Transport transport;
  private volatile boolean open;
  private volatile boolean closed;
  private volatile long roundtripMs = -1;
  // Payload that arrived together with the response header; read only by the pull thread.
  private byte[] pending;
  private int pendingOffset;

  public VlessSession(
      TransportFactory transports,
      TransportSettings settings,
      DestinationAddress destination,
      VlessCodec codec,
      ClockPort clock) {
    this.transports = Objects.requireNonNull(transports, "transports");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.destination = Objects.requireNonNull(destination, "destination");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public void connect(ServerEndpoint endpoint, Credential credential, TransportConfig transportConfig)
      throws SessionException {
    Objects.requireNonNull(endpoint, "endpoint");
    Objects.requireNonNull(credential, "credential");
    Objects.requireNonNull(transportConfig, "transportConfig");
    if (transport != null) {
      throw new IllegalStateException("session already used");
    }
    Transport current = transports.create(transportConfig, settings);
    transport = current;
    if (closed) {
      current.close();
      throw new SessionException(ConnectionFailure.TRANSPORT, "Session closed before connect", null);
    }
    long started = clock.monotonicNanos();
    try {
      current.connect(endpoint.hostname(), endpoint.port());
      current.send(codec.encodeRequest(credential, destination));
      ResponseHeader response = readResponse(current);
      roundtripMs = TimeUnit.NANOSECONDS.toMillis(clock.monotonicNanos() - started);
      codec.negotiateFlow();
      open = !closed;
      log.debug("Handshake with {} complete in {} ms (response addons {} bytes)",
          endpoint.authority(), roundtripMs, response.addonsLength());
    } catch (TransportException ex) {
      current.close();
      throw new SessionException(ConnectionFailure.TRANSPORT,
          "Transport " + ex.error() + " for " + endpoint.authority() + ": " + ex.getMessage(), ex);
    } catch (ProtocolException ex) {
      current.close();
      throw new SessionException(ConnectionFailure.PROTOCOL,
          "Protocol " + ex.error() + " from " + endpoint.authority() + ": " + ex.getMessage(), ex);
    }
    if (!open) {
      current.close();
      throw new SessionException(ConnectionFailure.TRANSPORT, "Session closed during handshake", null);
    }
  }

  private ResponseHeader readResponse(Transport current) throws TransportException, ProtocolException {
    byte[] buffer = new byte[MAX_RESPONSE_HEADER];
    byte[] chunk = new byte[RECEIVE_CHUNK];
    int filled = 0;
    while (true) {
      Optional<ResponseHeader> header = codec.decodeResponse(buffer, filled);
      if (header.isPresent()) {
        int headerLength = header.get().length();
        if (filled > headerLength) {
          pending = Arrays.copyOfRange(buffer, headerLength, filled);
          pendingOffset = 0;
        }
        return header.get();
      }
      int read;
      try {
        read = current.receive(chunk);
      } catch (TransportException ex) {
        if (ex.error() == TransportError.PEER_CLOSED) {
          throw new ProtocolException(ProtocolError.BAD_RESPONSE_HEADER,
              "Connection closed after " + filled + " response header bytes");
        }
        throw ex;
      }
      if (filled + read > buffer.length) {
        buffer = Arrays.copyOf(buffer, filled + read);
      }
      System.arraycopy(chunk, 0, buffer, filled, read);
      filled += read;
    }
  }

  @Override
  public void forward(byte[] data, int offset, int length) throws SessionException {
    Transport current = requireOpen();
    try {
      current.send(data, offset, length);
      bytesSent.addAndGet(length);
    } catch (TransportException ex) {
      throw new SessionException(ConnectionFailure.TRANSPORT, "Send failed: " + ex.getMessage(), ex);
    }
  }

  @Override
  public int pull(byte[] buffer) throws SessionException {
    Transport current = requireOpen();
    if (pending != null) {
      int count = Math.min(buffer.length, pending.length - pendingOffset);
      System.arraycopy(pending, pendingOffset, buffer, 0, count);
      pendingOffset += count;
      if (pendingOffset == pending.length) {
        pending = null;
      }
      bytesReceived.addAndGet(count);
      return count;
    }
    try {
      int read = current.receive(buffer);
      bytesReceived.addAndGet(read);
      return read;
    } catch (TransportException ex) {
      if (ex.error() == TransportError.TIMEOUT) {
        return 0;
      }
      throw new SessionException(ConnectionFailure.TRANSPORT, "Receive failed: " + ex.getMessage(), ex);
    }
  }

  private Transport requireOpen() throws SessionException {
    Transport current = transport;
    if (!open || current == null) {
      throw new SessionException(ConnectionFailure.TRANSPORT, "Session not connected",
          new TransportException(TransportError.NOT_CONNECTED, "Session not connected"));
    }
    return current;
  }

  @Override
  public long bytesSent() {
    return bytesSent.get();
  }

  @Override
  public long bytesReceived() {
    return bytesReceived.get();
  }

  @Override
  public OptionalLong roundtripMs() {
    long value = roundtripMs;
    return value < 0 ? OptionalLong.empty() : OptionalLong.of(value);
  }

  @Override
  public boolean isOpen() {
    Transport current = transport;
    return open && current != null && current.isConnected();
  }

  @Override
  public void close() {
    closed = true;
    open = false;
    Transport current = transport;
    if (current != null) {
      current.close();
    }
  }
}
