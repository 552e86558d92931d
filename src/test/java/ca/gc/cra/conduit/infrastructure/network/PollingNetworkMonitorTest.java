package ca.gc.cra.conduit.infrastructure.network;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.conduit.application.port.Subscription;
import ca.gc.cra.conduit.domain.net.NetworkEvent;
import ca.gc.cra.conduit.domain.net.NetworkHandle;
import java.net.InetAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class PollingNetworkMonitorTest {
  private static final NetworkHandle WIFI = new NetworkHandle("wlan0", InetAddress.getLoopbackAddress(), true, false);
  private static final NetworkHandle CELL = new NetworkHandle("rmnet0", InetAddress.getLoopbackAddress(), false, true);

  private final AtomicReference<NetworkHandle> current = new AtomicReference<>(WIFI);
  private final PollingNetworkMonitor monitor =
      new PollingNetworkMonitor(Duration.ofHours(1), () -> Optional.ofNullable(current.get()));
  private final List<NetworkEvent> events = new ArrayList<>();

  @Test
  void initialReadingWithNetworkEmitsNothing() {
    monitor.subscribe(events::add);

    monitor.poll();

    assertTrue(events.isEmpty());
    assertEquals(Optional.of(WIFI), monitor.activeNetwork());
  }

  @Test
  void initialReadingWithoutNetworkEmitsUnavailable() {
    current.set(null);
    monitor.subscribe(events::add);

    monitor.poll();

    assertEquals(1, events.size());
    assertInstanceOf(NetworkEvent.Unavailable.class, events.get(0));
  }

  @Test
  void lossAndRecoveryAreReported() {
    monitor.subscribe(events::add);
    monitor.poll();

    current.set(null);
    monitor.poll();
    current.set(WIFI);
    monitor.poll();

    assertEquals(List.of(new NetworkEvent.Lost(), new NetworkEvent.Available(WIFI)), events);
  }

  @Test
  void handoverReportsNewHandleAndCapabilityChange() {
    monitor.subscribe(events::add);
    monitor.poll();

    current.set(CELL);
    monitor.poll();

    assertEquals(List.of(new NetworkEvent.Available(CELL), new NetworkEvent.Changed(false, true)), events);
  }

  @Test
  void unchangedReadingIsQuiet() {
    monitor.subscribe(events::add);
    monitor.poll();
    monitor.poll();

    assertTrue(events.isEmpty());
  }

  @Test
  void closedSubscriptionStopsEvents() {
    Subscription subscription = monitor.subscribe(events::add);
    monitor.poll();
    subscription.close();

    current.set(null);
    monitor.poll();

    assertTrue(events.isEmpty());
  }

  @Test
  void failingListenerDoesNotBlockOthers() {
    monitor.subscribe(event -> {
      throw new IllegalStateException("boom");
    });
    monitor.subscribe(events::add);
    monitor.poll();

    current.set(null);
    monitor.poll();

    assertEquals(List.of(new NetworkEvent.Lost()), events);
  }

  @Test
  void classifiesInterfaceNames() {
    assertTrue(PollingNetworkMonitor.isWifi("wlan0"));
    assertTrue(PollingNetworkMonitor.isWifi("wlp3s0"));
    assertFalse(PollingNetworkMonitor.isWifi("eth0"));
    assertTrue(PollingNetworkMonitor.isCellular("rmnet_data0"));
    assertTrue(PollingNetworkMonitor.isCellular("wwan0"));
    assertFalse(PollingNetworkMonitor.isCellular("en0"));
  }

  @Test
  void startIsIdempotentAndCloseStopsPolling() {
    monitor.start();
    monitor.start();
    assertEquals(Optional.of(WIFI), monitor.activeNetwork());
    monitor.close();
    monitor.close();
  }
}
