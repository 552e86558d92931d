package ca.gc.cra.conduit.infrastructure.transport;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import ca.gc.cra.conduit.application.port.TransportError;
import ca.gc.cra.conduit.application.port.TransportException;
import ca.gc.cra.conduit.application.port.TransportSettings;
import ca.gc.cra.conduit.domain.net.NetworkHandle;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TcpTransportTest {
  private static final String HOST = InetAddress.getLoopbackAddress().getHostAddress();

  private ServerSocket server;
  private Thread serverThread;

  @BeforeEach
  void setUp() throws Exception {
    server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
  }

  @AfterEach
  void tearDown() throws Exception {
    server.close();
    if (serverThread != null) {
      serverThread.join(TimeUnit.SECONDS.toMillis(5));
    }
  }

  @Test
  void echoesBytesThroughLocalServer() throws Exception {
    serve(socket -> {
      InputStream in = socket.getInputStream();
      OutputStream out = socket.getOutputStream();
      byte[] buffer = new byte[64];
      int read = in.read(buffer);
      out.write(buffer, 0, read);
      out.flush();
    });
    try (TcpTransport transport = new TcpTransport(settings(Duration.ofSeconds(5)))) {
      transport.connect(HOST, server.getLocalPort());
      assertTrue(transport.isConnected());

      transport.send("ping".getBytes());
      byte[] buffer = new byte[64];
      int read = transport.receive(buffer);

      assertArrayEquals("ping".getBytes(), Arrays.copyOf(buffer, read));
    }
  }

  @Test
  void refusedConnectionReportsConnectFailed() throws Exception {
    int port = server.getLocalPort();
    server.close();

    TcpTransport transport = new TcpTransport(settings(Duration.ofSeconds(5)));
    TransportException ex = assertThrows(TransportException.class, () -> transport.connect(HOST, port));

    assertEquals(TransportError.CONNECT_FAILED, ex.error());
    assertFalse(transport.isConnected());
  }

  @Test
  void remoteCloseReportsPeerClosed() throws Exception {
    serve(socket -> {
      // Close immediately.
    });
    try (TcpTransport transport = new TcpTransport(settings(Duration.ofSeconds(5)))) {
      transport.connect(HOST, server.getLocalPort());

      TransportException ex = assertThrows(TransportException.class, () -> transport.receive(new byte[16]));

      assertEquals(TransportError.PEER_CLOSED, ex.error());
    }
  }

  @Test
  void silentServerReportsTimeout() throws Exception {
    CountDownLatch release = new CountDownLatch(1);
    serve(socket -> release.await(5, TimeUnit.SECONDS));
    try (TcpTransport transport = new TcpTransport(settings(Duration.ofMillis(100)))) {
      transport.connect(HOST, server.getLocalPort());

      TransportException ex = assertThrows(TransportException.class, () -> transport.receive(new byte[16]));

      assertEquals(TransportError.TIMEOUT, ex.error());
      assertTrue(transport.isConnected());
    } finally {
      release.countDown();
    }
  }

  @Test
  void closedTransportRejectsIo() throws Exception {
    TcpTransport transport = new TcpTransport(settings(Duration.ofSeconds(5)));
    transport.close();

    assertEquals(TransportError.NOT_CONNECTED,
        assertThrows(TransportException.class, () -> transport.connect(HOST, server.getLocalPort())).error());
    assertEquals(TransportError.NOT_CONNECTED,
        assertThrows(TransportException.class, () -> transport.send(new byte[1])).error());
  }

  @Test
  void boundSocketLeavesFromNetworkAddress() throws Exception {
    AtomicReference<InetAddress> peer = new AtomicReference<>();
    serve(socket -> {
      peer.set(socket.getInetAddress());
      echo(socket);
    });
    TransportSettings bound = settings(Duration.ofSeconds(5)).withNetwork(loopbackNetwork());
    try (TcpTransport transport = new TcpTransport(bound)) {
      transport.connect(HOST, server.getLocalPort());
      transport.send("ping".getBytes());
      byte[] buffer = new byte[64];
      int read = transport.receive(buffer);

      assertArrayEquals("ping".getBytes(), Arrays.copyOf(buffer, read));
    }
    serverThread.join(TimeUnit.SECONDS.toMillis(5));
    assertEquals(InetAddress.getLoopbackAddress(), peer.get());
  }

  @Test
  void networkWithoutMatchingFamilyConnectsUnbound() throws Exception {
    ServerSocket ipv6Server = new ServerSocket();
    try {
      ipv6Server.bind(new InetSocketAddress(InetAddress.getByName("::1"), 0), 1);
    } catch (IOException ex) {
      ipv6Server.close();
      assumeTrue(false, "IPv6 loopback unavailable");
    }
    try (ServerSocket v6 = ipv6Server) {
      serve(v6, TcpTransportTest::echo);
      TransportSettings bound = settings(Duration.ofSeconds(5)).withNetwork(loopbackNetwork());
      try (TcpTransport transport = new TcpTransport(bound)) {
        transport.connect("::1", v6.getLocalPort());
        transport.send("v6".getBytes());
        byte[] buffer = new byte[64];
        int read = transport.receive(buffer);

        assertArrayEquals("v6".getBytes(), Arrays.copyOf(buffer, read));
      }
    }
  }

  private static NetworkHandle loopbackNetwork() throws Exception {
    return new NetworkHandle("lo", InetAddress.getByName("127.0.0.1"), false, false);
  }

  private static void echo(Socket socket) throws Exception {
    InputStream in = socket.getInputStream();
    OutputStream out = socket.getOutputStream();
    byte[] buffer = new byte[64];
    int read = in.read(buffer);
    out.write(buffer, 0, read);
    out.flush();
  }

  private static TransportSettings settings(Duration readTimeout) {
    return new TransportSettings(Duration.ofSeconds(5), readTimeout, null);
  }

  private void serve(SocketHandler handler) {
    serve(server, handler);
  }

  private void serve(ServerSocket listener, SocketHandler handler) {
    serverThread = new Thread(() -> {
      try (Socket socket = listener.accept()) {
        handler.handle(socket);
      } catch (Exception ex) {
        // Server side ends with the test.
      }
    }, "tcp-test-server");
    serverThread.start();
  }

  @FunctionalInterface
  interface SocketHandler {
    void handle(Socket socket) throws Exception;
  }
}
