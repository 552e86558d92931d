package ca.gc.cra.conduit.infrastructure.network;

import ca.gc.cra.conduit.application.port.NetworkMonitor;
import ca.gc.cra.conduit.application.port.Subscription;
import ca.gc.cra.conduit.domain.net.NetworkEvent;
import ca.gc.cra.conduit.domain.net.NetworkHandle;
import ca.gc.cra.conduit.infrastructure.exec.ExecutorFactories;
import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link NetworkMonitor} that polls {@link NetworkInterface} for the preferred usable
 * interface.
 * <p><strong>Why:</strong> The JDK has no network-change callback; a short poll is enough to notice interface loss and
 * handover between Wi-Fi and wired links.</p>
 * <p><strong>Role:</strong> Adapter publishing {@link NetworkEvent}s to the reconnect supervisor.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe. Events are delivered on the {@code conduit-netmon} thread.</p>
 *
 * @since 0.1.0
 */
public final class PollingNetworkMonitor implements NetworkMonitor, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(PollingNetworkMonitor.class);

  /** Default polling cadence. */
  public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(2);

  private final Supplier<Optional<NetworkHandle>> probe;
  private final Duration interval;
  private final List<Consumer<? super NetworkEvent>> listeners = new CopyOnWriteArrayList<>();
  private final Object pollLock = new Object();
  private volatile NetworkHandle active;
  private ScheduledExecutorService scheduler;
  private boolean initialized;

  /**
   * Creates a monitor over the host's interfaces.
   *
   * @param interval polling cadence
   * @param preferredInterface interface name to prefer when up, or {@code null} for automatic selection
   */
  public PollingNetworkMonitor(Duration interval, String preferredInterface) {
    this(interval, () -> selectInterface(preferredInterface));
  }

  PollingNetworkMonitor(Duration interval, Supplier<Optional<NetworkHandle>> probe) {
    this.interval = interval == null ? DEFAULT_INTERVAL : interval;
    this.probe = Objects.requireNonNull(probe, "probe");
  }

  /** Takes an initial reading and starts polling. Idempotent. */
  public synchronized void start() {
    if (scheduler != null) {
      return;
    }
    poll();
    scheduler = ExecutorFactories.newScheduler("conduit-netmon");
    long millis = Math.max(1, interval.toMillis());
    scheduler.scheduleWithFixedDelay(this::pollSafely, millis, millis, TimeUnit.MILLISECONDS);
  }

  @Override
  public Subscription subscribe(Consumer<? super NetworkEvent> listener) {
    Objects.requireNonNull(listener, "listener");
    listeners.add(listener);
    return () -> listeners.remove(listener);
  }

  @Override
  public Optional<NetworkHandle> activeNetwork() {
    return Optional.ofNullable(active);
  }

  @Override
  public synchronized void close() {
    if (scheduler != null) {
      scheduler.shutdownNow();
      scheduler = null;
    }
  }

  private void pollSafely() {
    try {
      poll();
    } catch (RuntimeException ex) {
      log.warn("Network poll failed", ex);
    }
  }

  /** Compares the current reading against the previous one and emits the resulting events. */
  void poll() {
    List<NetworkEvent> events = new ArrayList<>(2);
    synchronized (pollLock) {
      NetworkHandle previous = active;
      NetworkHandle current = probe.get().orElse(null);
      active = current;
      if (!initialized) {
        initialized = true;
        if (current == null) {
          events.add(new NetworkEvent.Unavailable());
        }
        log.info("Initial network: {}", current == null ? "none" : current.name());
      } else if (previous != null && current == null) {
        events.add(new NetworkEvent.Lost());
      } else if (previous == null && current != null) {
        events.add(new NetworkEvent.Available(current));
      } else if (previous != null && !previous.equals(current)) {
        events.add(new NetworkEvent.Available(current));
        if (previous.wifi() != current.wifi() || previous.cellular() != current.cellular()) {
          events.add(new NetworkEvent.Changed(current.wifi(), current.cellular()));
        }
      }
    }
    for (NetworkEvent event : events) {
      log.debug("Network event {}", event);
      for (Consumer<? super NetworkEvent> listener : listeners) {
        try {
          listener.accept(event);
        } catch (RuntimeException ex) {
          log.warn("Network listener failed for {}", event, ex);
        }
      }
    }
  }

  static Optional<NetworkHandle> selectInterface(String preferredInterface) {
    List<NetworkInterface> candidates;
    try {
      candidates = Collections.list(NetworkInterface.getNetworkInterfaces());
    } catch (SocketException ex) {
      log.debug("Unable to enumerate network interfaces: {}", ex.toString());
      return Optional.empty();
    }
    List<NetworkHandle> usable = new ArrayList<>();
    for (NetworkInterface nif : candidates) {
      usable(nif).ifPresent(usable::add);
    }
    if (preferredInterface != null && !preferredInterface.isBlank()) {
      Optional<NetworkHandle> preferred = usable.stream()
          .filter(handle -> handle.name().equals(preferredInterface))
          .findFirst();
      if (preferred.isPresent()) {
        return preferred;
      }
    }
    return usable.stream().min(Comparator.comparing(NetworkHandle::name));
  }

  private static Optional<NetworkHandle> usable(NetworkInterface nif) {
    try {
      if (!nif.isUp() || nif.isLoopback() || nif.isVirtual()) {
        return Optional.empty();
      }
    } catch (SocketException ex) {
      log.debug("Skipping interface {}: {}", nif.getName(), ex.toString());
      return Optional.empty();
    }
    List<InetAddress> addresses = new ArrayList<>();
    for (InetAddress address : Collections.list(nif.getInetAddresses())) {
      if (!address.isLoopbackAddress() && !address.isLinkLocalAddress()) {
        addresses.add(address);
      }
    }
    if (addresses.isEmpty()) {
      return Optional.empty();
    }
    // IPv4 first; the sort is stable, so interface order holds within a family.
    addresses.sort(Comparator.comparing(address -> address instanceof Inet4Address ? 0 : 1));
    String name = nif.getName();
    return Optional.of(new NetworkHandle(name, addresses, isWifi(name), isCellular(name)));
  }

  static boolean isWifi(String name) {
    String lower = name.toLowerCase(Locale.ROOT);
    return lower.startsWith("wl") || lower.startsWith("wifi");
  }

  static boolean isCellular(String name) {
    String lower = name.toLowerCase(Locale.ROOT);
    return lower.startsWith("rmnet") || lower.startsWith("wwan") || lower.startsWith("ccmni");
  }
}
