package ca.gc.cra.conduit.infrastructure.protocol.vless;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.conduit.application.port.ClockPort;
import ca.gc.cra.conduit.application.port.ProtocolSession;
import ca.gc.cra.conduit.application.port.SessionException;
import ca.gc.cra.conduit.application.port.Transport;
import ca.gc.cra.conduit.application.port.TransportError;
import ca.gc.cra.conduit.application.port.TransportException;
import ca.gc.cra.conduit.application.port.TransportSettings;
import ca.gc.cra.conduit.domain.connection.ConnectionFailure;
import ca.gc.cra.conduit.domain.net.DestinationAddress;
import ca.gc.cra.conduit.domain.net.ServerEndpoint;
import ca.gc.cra.conduit.domain.profile.Credential;
import ca.gc.cra.conduit.domain.profile.FlowControl;
import ca.gc.cra.conduit.domain.profile.Profile;
import ca.gc.cra.conduit.domain.profile.TransportConfig;
import java.io.ByteArrayOutputStream;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import org.junit.jupiter.api.Test;

class VlessSessionTest {
  private static final Credential CREDENTIAL = Credential.parse("b831381d-6324-4d53-ad4f-8cda48b30811");
  private static final ServerEndpoint ENDPOINT = ServerEndpoint.of("edge.example.com", 443);

  @Test
  void handshakeSendsHeaderForProfileDestination() throws Exception {
    QueuedTransport transport = new QueuedTransport();
    transport.respond(VlessCodec.encodeResponse(null));
    Profile profile = new Profile("p", null, ENDPOINT, new TransportConfig.Plain(), FlowControl.NONE,
        DestinationAddress.of("internal.example", 22));

    try (ProtocolSession session = new VlessSessionFactory((config, settings) -> transport, ClockPort.SYSTEM)
        .create(profile, TransportSettings.defaults())) {
      session.connect(ENDPOINT, CREDENTIAL, profile.transport());

      assertTrue(session.isOpen());
      assertEquals("edge.example.com:443", transport.dialed);
      RequestHeader sent = VlessCodec.decodeRequest(transport.sent(), transport.sent().length).orElseThrow();
      assertEquals(DestinationAddress.of("internal.example", 22), sent.destination());
      assertTrue(session.roundtripMs().isPresent());
    }
    assertTrue(transport.closed);
  }

  @Test
  void payloadArrivingWithResponseHeaderIsPulledFirst() throws Exception {
    QueuedTransport transport = new QueuedTransport();
    byte[] response = VlessCodec.encodeResponse(new byte[] {9});
    byte[] combined = Arrays.copyOf(response, response.length + 3);
    combined[response.length] = 'a';
    combined[response.length + 1] = 'b';
    combined[response.length + 2] = 'c';
    transport.respond(combined);
    transport.respond("de".getBytes());
    VlessSession session = session(transport, FlowControl.XTLS_RPRX_VISION);

    session.connect(ENDPOINT, CREDENTIAL, new TransportConfig.Plain());

    byte[] buffer = new byte[16];
    int first = session.pull(buffer);
    assertArrayEquals("abc".getBytes(), Arrays.copyOf(buffer, first));
    int second = session.pull(buffer);
    assertArrayEquals("de".getBytes(), Arrays.copyOf(buffer, second));
    assertEquals(5, session.bytesReceived());
  }

  @Test
  void forwardCountsBytesSent() throws Exception {
    QueuedTransport transport = new QueuedTransport();
    transport.respond(VlessCodec.encodeResponse(null));
    VlessSession session = session(transport, FlowControl.NONE);
    session.connect(ENDPOINT, CREDENTIAL, new TransportConfig.Plain());
    int headerLength = transport.sent().length;

    session.forward("hello".getBytes(), 0, 5);

    assertEquals(5, session.bytesSent());
    assertEquals(headerLength + 5, transport.sent().length);
  }

  @Test
  void pullTimeoutReturnsZero() throws Exception {
    QueuedTransport transport = new QueuedTransport();
    transport.respond(VlessCodec.encodeResponse(null));
    VlessSession session = session(transport, FlowControl.NONE);
    session.connect(ENDPOINT, CREDENTIAL, new TransportConfig.Plain());

    assertEquals(0, session.pull(new byte[8]));
  }

  @Test
  void peerClosingDuringHandshakeIsProtocolFailure() {
    QueuedTransport transport = new QueuedTransport();
    transport.closeAfterResponses = true;
    VlessSession session = session(transport, FlowControl.NONE);

    SessionException ex = assertThrows(SessionException.class,
        () -> session.connect(ENDPOINT, CREDENTIAL, new TransportConfig.Plain()));

    assertEquals(ConnectionFailure.PROTOCOL, ex.failure());
    assertTrue(transport.closed);
    assertFalse(session.isOpen());
  }

  @Test
  void unsupportedVersionIsProtocolFailure() {
    QueuedTransport transport = new QueuedTransport();
    transport.respond(new byte[] {5, 0});
    VlessSession session = session(transport, FlowControl.NONE);

    SessionException ex = assertThrows(SessionException.class,
        () -> session.connect(ENDPOINT, CREDENTIAL, new TransportConfig.Plain()));

    assertEquals(ConnectionFailure.PROTOCOL, ex.failure());
  }

  @Test
  void refusedConnectIsTransportFailure() {
    QueuedTransport transport = new QueuedTransport();
    transport.refuse = true;
    VlessSession session = session(transport, FlowControl.NONE);

    SessionException ex = assertThrows(SessionException.class,
        () -> session.connect(ENDPOINT, CREDENTIAL, new TransportConfig.Plain()));

    assertEquals(ConnectionFailure.TRANSPORT, ex.failure());
    assertTrue(ex.getMessage().contains("CONNECT_FAILED"));
  }

  @Test
  void forwardBeforeConnectFails() {
    VlessSession session = session(new QueuedTransport(), FlowControl.NONE);

    assertThrows(SessionException.class, () -> session.forward(new byte[1], 0, 1));
  }

  @Test
  void closedSessionRefusesToConnect() {
    QueuedTransport transport = new QueuedTransport();
    VlessSession session = session(transport, FlowControl.NONE);
    session.close();

    assertThrows(SessionException.class, () -> session.connect(ENDPOINT, CREDENTIAL, new TransportConfig.Plain()));
    assertTrue(transport.closed);
  }

  private static VlessSession session(QueuedTransport transport, FlowControl flow) {
    return new VlessSession((config, settings) -> transport, TransportSettings.defaults(),
        DestinationAddress.of("edge.example.com", 443), new VlessCodec(flow), ClockPort.SYSTEM);
  }

  /** Transport that replays canned reads and records writes. */
  private static final class QueuedTransport implements Transport {
    private final Deque<byte[]> responses = new ArrayDeque<>();
    private final ByteArrayOutputStream written = new ByteArrayOutputStream();
    private String dialed;
    private boolean refuse;
    private boolean closeAfterResponses;
    private volatile boolean closed;

    void respond(byte[] chunk) {
      responses.add(chunk);
    }

    byte[] sent() {
      return written.toByteArray();
    }

    @Override
    public void connect(String host, int port) throws TransportException {
      if (refuse) {
        throw new TransportException(TransportError.CONNECT_FAILED, "Connection refused");
      }
      dialed = host + ":" + port;
    }

    @Override
    public void send(byte[] data, int offset, int length) {
      written.write(data, offset, length);
    }

    @Override
    public int receive(byte[] buffer) throws TransportException {
      byte[] chunk = responses.poll();
      if (chunk == null) {
        if (closeAfterResponses) {
          throw new TransportException(TransportError.PEER_CLOSED, "Peer closed");
        }
        throw new TransportException(TransportError.TIMEOUT, "Read timed out");
      }
      System.arraycopy(chunk, 0, buffer, 0, chunk.length);
      return chunk.length;
    }

    @Override
    public boolean isConnected() {
      return dialed != null && !closed;
    }

    @Override
    public void close() {
      closed = true;
    }
  }
}
