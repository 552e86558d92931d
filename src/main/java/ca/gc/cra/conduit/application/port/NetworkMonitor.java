package ca.gc.cra.conduit.application.port;

import ca.gc.cra.conduit.domain.net.NetworkEvent;
import ca.gc.cra.conduit.domain.net.NetworkHandle;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * <strong>What:</strong> Host network notifications.
 * <p><strong>Role:</strong> Consumed by the reconnect supervisor to trigger reconnects and by the connection manager to
 * obtain a socket binding hint.</p>
 * <p><strong>Thread-safety:</strong> Events may be delivered on a monitor-owned thread.</p>
 *
 * @since 0.1.0
 */
public interface NetworkMonitor {
  /**
   * Registers a listener for network events.
   *
   * @param listener callback; must not block
   * @return handle that unregisters the listener
   */
  Subscription subscribe(Consumer<? super NetworkEvent> listener);

  /**
   * Returns the currently active network, if known.
   *
   * @return active network handle
   */
  Optional<NetworkHandle> activeNetwork();

  /**
   * Monitor that never reports events; used when the host offers no network callbacks.
   */
  NetworkMonitor NONE = new NetworkMonitor() {
    @Override
    public Subscription subscribe(Consumer<? super NetworkEvent> listener) {
      return () -> { };
    }

    @Override
    public Optional<NetworkHandle> activeNetwork() {
      return Optional.empty();
    }
  };
}
