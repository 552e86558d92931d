package ca.gc.cra.conduit.domain.net;

import java.util.Objects;

/**
 * Host network notifications consumed by the reconnect supervisor.
 *
 * @since 0.1.0
 */
public sealed interface NetworkEvent
    permits NetworkEvent.Available, NetworkEvent.Lost, NetworkEvent.Changed, NetworkEvent.Unavailable {

  /**
   * A usable network became active.
   *
   * @param handle binding hint for new sockets
   */
  record Available(NetworkHandle handle) implements NetworkEvent {
    public Available {
      Objects.requireNonNull(handle, "handle");
    }
  }

  /** The previously active network went away. */
  record Lost() implements NetworkEvent {}

  /**
   * Capabilities of the active network changed.
   *
   * @param wifi active network is Wi-Fi
   * @param cellular active network is cellular
   */
  record Changed(boolean wifi, boolean cellular) implements NetworkEvent {}

  /** No network is available at all. */
  record Unavailable() implements NetworkEvent {}
}
