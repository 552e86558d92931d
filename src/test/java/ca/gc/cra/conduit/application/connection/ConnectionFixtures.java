package ca.gc.cra.conduit.application.connection;

import ca.gc.cra.conduit.application.port.MetricsPort;
import ca.gc.cra.conduit.application.port.Transport;
import ca.gc.cra.conduit.application.port.TransportError;
import ca.gc.cra.conduit.application.port.TransportException;
import ca.gc.cra.conduit.domain.net.ServerEndpoint;
import ca.gc.cra.conduit.domain.profile.Credential;
import ca.gc.cra.conduit.domain.profile.FlowControl;
import ca.gc.cra.conduit.domain.profile.Profile;
import ca.gc.cra.conduit.domain.profile.TransportConfig;
import java.io.ByteArrayOutputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * Shared doubles for connection lifecycle tests.
 */
final class ConnectionFixtures {
  static final String PROFILE_ID = "edge-1";
  static final Credential CREDENTIAL = Credential.parse("b831381d-6324-4d53-ad4f-8cda48b30811");

  private ConnectionFixtures() {}

  static Profile profile() {
    return new Profile(PROFILE_ID, "Edge", ServerEndpoint.of("edge.example.com", 443), new TransportConfig.Plain(),
        FlowControl.NONE, null);
  }

  static void await(BooleanSupplier condition, Duration timeout, String message) throws InterruptedException {
    long deadline = System.nanoTime() + timeout.toNanos();
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() > deadline) {
        throw new AssertionError(message);
      }
      Thread.sleep(5);
    }
  }

  /** Transport double whose connect outcome and inbound bytes are scripted by the test. */
  static final class ScriptedTransport implements Transport {
    private final TransportException connectFailure;
    private final boolean blockInConnect;
    private final BlockingQueue<byte[]> inbound = new LinkedBlockingQueue<>();
    private final ByteArrayOutputStream sent = new ByteArrayOutputStream();
    final CountDownLatch connectEntered = new CountDownLatch(1);
    private final CountDownLatch closedLatch = new CountDownLatch(1);
    private volatile boolean connected;
    private volatile boolean closed;
    private volatile TransportException nextReceiveFailure;

    private ScriptedTransport(TransportException connectFailure, boolean blockInConnect) {
      this.connectFailure = connectFailure;
      this.blockInConnect = blockInConnect;
    }

    /** Accepts the connection and answers the request header with {@code [0, 0]}. */
    static ScriptedTransport accepting() {
      ScriptedTransport transport = new ScriptedTransport(null, false);
      transport.enqueue(new byte[] {0, 0});
      return transport;
    }

    static ScriptedTransport refusing() {
      return new ScriptedTransport(new TransportException(TransportError.CONNECT_FAILED, "Connection refused"), false);
    }

    /** Blocks inside connect until closed, like a handshake stuck on an unresponsive server. */
    static ScriptedTransport hanging() {
      return new ScriptedTransport(null, true);
    }

    void enqueue(byte[] data) {
      inbound.add(data);
    }

    void failNextReceive(TransportException failure) {
      nextReceiveFailure = failure;
    }

    synchronized byte[] sentBytes() {
      return sent.toByteArray();
    }

    boolean isClosed() {
      return closed;
    }

    @Override
    public void connect(String host, int port) throws TransportException {
      connectEntered.countDown();
      if (blockInConnect) {
        try {
          closedLatch.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
        }
        throw new TransportException(TransportError.CONNECT_FAILED, "Connect cancelled");
      }
      if (connectFailure != null) {
        throw connectFailure;
      }
      connected = true;
    }

    @Override
    public synchronized void send(byte[] data, int offset, int length) throws TransportException {
      if (!connected || closed) {
        throw new TransportException(TransportError.NOT_CONNECTED, "Transport not connected");
      }
      sent.write(data, offset, length);
    }

    @Override
    public int receive(byte[] buffer) throws TransportException {
      TransportException failure = nextReceiveFailure;
      if (failure != null) {
        nextReceiveFailure = null;
        throw failure;
      }
      if (closed) {
        throw new TransportException(TransportError.NOT_CONNECTED, "Transport closed");
      }
      byte[] chunk;
      try {
        chunk = inbound.poll(20, TimeUnit.MILLISECONDS);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        throw new TransportException(TransportError.NOT_CONNECTED, "Interrupted");
      }
      if (chunk == null) {
        throw new TransportException(TransportError.TIMEOUT, "No data");
      }
      System.arraycopy(chunk, 0, buffer, 0, chunk.length);
      return chunk.length;
    }

    @Override
    public boolean isConnected() {
      return connected && !closed;
    }

    @Override
    public void close() {
      closed = true;
      closedLatch.countDown();
    }
  }

  /** Test double capturing metric usage for assertions. */
  static final class RecordingMetricsPort implements MetricsPort {
    private final Map<String, Integer> counters = new HashMap<>();
    private final Map<String, List<Long>> observations = new HashMap<>();

    @Override
    public synchronized void increment(String key) {
      counters.merge(key, 1, Integer::sum);
    }

    @Override
    public synchronized void observe(String key, long value) {
      observations.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
    }

    synchronized int count(String key) {
      return counters.getOrDefault(key, 0);
    }

    synchronized List<Long> observed(String key) {
      return new ArrayList<>(observations.getOrDefault(key, Collections.emptyList()));
    }
  }
}
