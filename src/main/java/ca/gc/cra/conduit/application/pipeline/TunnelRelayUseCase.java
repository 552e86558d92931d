package ca.gc.cra.conduit.application.pipeline;

import ca.gc.cra.conduit.application.connection.ConnectionException;
import ca.gc.cra.conduit.application.connection.ConnectionManager;
import ca.gc.cra.conduit.application.port.MetricsPort;
import ca.gc.cra.conduit.application.port.PacketChannel;
import ca.gc.cra.conduit.application.port.Subscription;
import ca.gc.cra.conduit.domain.connection.ConnectionState;
import ca.gc.cra.conduit.infrastructure.exec.ExecutorFactories;
import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pumps bytes between a local {@link PacketChannel} and the connection manager's active session.
 * <p>The uplink runs on the thread that calls {@link #run()}; the downlink runs on a daemon thread named
 * <code>conduit-relay-</code>. Uplink chunks read while the tunnel is down are dropped and counted, since the
 * packet source has no way to hold them. The downlink parks until the state is {@code Connected} again, so relaying
 * resumes on its own after a reconnect. Instances are not reusable; invoke {@link #run()} at most once.</p>
 *
 * @since 0.1.0
 */
public final class TunnelRelayUseCase implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(TunnelRelayUseCase.class);

  static final String METRIC_UPLINK_DROPPED = "relay.uplink.dropped";
  private static final int BUFFER_SIZE = 16 * 1024;
  private static final long IDLE_WAIT_MILLIS = 250L;

  private final PacketChannel channel;
  private final ConnectionManager manager;
  private final MetricsPort metrics;
  private final Object stateSignal = new Object();
  private final AtomicBoolean running = new AtomicBoolean();
  private final AtomicReference<IOException> downlinkFailure = new AtomicReference<>();
  private final AtomicLong uplinkBytes = new AtomicLong();
  private final AtomicLong downlinkBytes = new AtomicLong();
  private final AtomicLong droppedChunks = new AtomicLong();
  private volatile Thread downlink;

  public TunnelRelayUseCase(PacketChannel channel, ConnectionManager manager, MetricsPort metrics) {
    this.channel = Objects.requireNonNull(channel, "channel");
    this.manager = Objects.requireNonNull(manager, "manager");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Relays until the local channel reaches end of stream.
   *
   * @throws IOException when the local channel fails in either direction
   * @throws IllegalStateException if invoked more than once
   */
  public void run() throws IOException {
    if (!running.compareAndSet(false, true)) {
      throw new IllegalStateException("relay already started");
    }
    Subscription subscription = manager.states().subscribe(state -> {
      synchronized (stateSignal) {
        stateSignal.notifyAll();
      }
    });
    Thread thread = ExecutorFactories.threadFactory("conduit-relay", true).newThread(this::pumpDownlink);
    downlink = thread;
    thread.start();
    try {
      pumpUplink();
    } finally {
      running.set(false);
      subscription.close();
      synchronized (stateSignal) {
        stateSignal.notifyAll();
      }
      log.info("Relay finished: {} bytes up, {} bytes down, {} chunks dropped",
          uplinkBytes.get(), downlinkBytes.get(), droppedChunks.get());
    }
    IOException failure = downlinkFailure.get();
    if (failure != null) {
      throw failure;
    }
  }

  private void pumpUplink() throws IOException {
    byte[] buffer = new byte[BUFFER_SIZE];
    while (running.get()) {
      int read = channel.read(buffer);
      if (read < 0) {
        log.debug("Local channel reached end of stream");
        return;
      }
      if (read == 0) {
        continue;
      }
      if (manager.states().current().phase() != ConnectionState.Phase.CONNECTED) {
        drop(read);
        continue;
      }
      try {
        manager.forward(buffer, 0, read);
        uplinkBytes.addAndGet(read);
      } catch (ConnectionException ex) {
        log.debug("Uplink chunk of {} bytes lost: {}", read, ex.getMessage());
        drop(read);
      }
    }
  }

  private void drop(int length) {
    long dropped = droppedChunks.incrementAndGet();
    metrics.increment(METRIC_UPLINK_DROPPED);
    if (dropped == 1 || dropped % 100 == 0) {
      log.info("Tunnel not connected; dropped {} uplink chunk(s) so far (last {} bytes)", dropped, length);
    }
  }

  private void pumpDownlink() {
    byte[] buffer = new byte[BUFFER_SIZE];
    while (running.get()) {
      if (!awaitConnected()) {
        continue;
      }
      int read;
      try {
        read = manager.pull(buffer);
      } catch (ConnectionException ex) {
        log.debug("Downlink paused: {}", ex.getMessage());
        continue;
      }
      if (read <= 0) {
        continue;
      }
      try {
        channel.write(buffer, 0, read);
        downlinkBytes.addAndGet(read);
      } catch (IOException ex) {
        log.warn("Local channel write failed; stopping relay", ex);
        downlinkFailure.compareAndSet(null, ex);
        running.set(false);
        return;
      }
    }
  }

  private boolean awaitConnected() {
    synchronized (stateSignal) {
      if (manager.states().current().phase() == ConnectionState.Phase.CONNECTED) {
        return true;
      }
      try {
        stateSignal.wait(IDLE_WAIT_MILLIS);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        running.set(false);
      }
      return false;
    }
  }

  public long uplinkBytes() {
    return uplinkBytes.get();
  }

  public long downlinkBytes() {
    return downlinkBytes.get();
  }

  public long droppedChunks() {
    return droppedChunks.get();
  }

  /** Stops the downlink and waits briefly for it to exit. The local channel is left to its owner. */
  @Override
  public void close() {
    running.set(false);
    Thread thread = downlink;
    if (thread == null) {
      return;
    }
    thread.interrupt();
    try {
      thread.join(2_000L);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
    if (thread.isAlive()) {
      log.warn("Relay downlink thread did not stop within 2s");
    }
  }
}
