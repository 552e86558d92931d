package ca.gc.cra.conduit.config;

import ca.gc.cra.conduit.application.connection.ConnectionManager;
import ca.gc.cra.conduit.application.connection.ConnectionProbe;
import ca.gc.cra.conduit.application.connection.ReconnectSupervisor;
import ca.gc.cra.conduit.infrastructure.network.PollingNetworkMonitor;
import ca.gc.cra.conduit.infrastructure.store.InMemoryCredentialVault;
import ca.gc.cra.conduit.infrastructure.store.InMemoryProfileStore;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Live service graph for one profile, built by {@link CompositionRoot}.
 * <p>{@link #start()} begins network polling and, when auto-reconnect is on, arms the supervisor. {@link #close()}
 * disarms and tears everything down in reverse order.</p>
 *
 * @since 0.1.0
 */
public final class TunnelRuntime implements AutoCloseable {
  private final String profileId;
  private final boolean autoReconnect;
  private final InMemoryProfileStore profiles;
  private final InMemoryCredentialVault vault;
  private final PollingNetworkMonitor network;
  private final ConnectionManager manager;
  private final ReconnectSupervisor supervisor;
  private final ConnectionProbe probe;
  private final AtomicBoolean closed = new AtomicBoolean();

  TunnelRuntime(
      String profileId,
      boolean autoReconnect,
      InMemoryProfileStore profiles,
      InMemoryCredentialVault vault,
      PollingNetworkMonitor network,
      ConnectionManager manager,
      ReconnectSupervisor supervisor,
      ConnectionProbe probe) {
    this.profileId = Objects.requireNonNull(profileId, "profileId");
    this.autoReconnect = autoReconnect;
    this.profiles = Objects.requireNonNull(profiles, "profiles");
    this.vault = Objects.requireNonNull(vault, "vault");
    this.network = Objects.requireNonNull(network, "network");
    this.manager = Objects.requireNonNull(manager, "manager");
    this.supervisor = Objects.requireNonNull(supervisor, "supervisor");
    this.probe = Objects.requireNonNull(probe, "probe");
  }

  public void start() {
    network.start();
    supervisor.start();
    if (autoReconnect) {
      supervisor.enable(profileId);
    }
  }

  public String profileId() {
    return profileId;
  }

  public InMemoryProfileStore profiles() {
    return profiles;
  }

  public ConnectionManager manager() {
    return manager;
  }

  public ReconnectSupervisor supervisor() {
    return supervisor;
  }

  public ConnectionProbe probe() {
    return probe;
  }

  /** Idempotent; the connect command calls it from both its shutdown hook and its main thread. */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    supervisor.disable();
    manager.disconnect();
    supervisor.close();
    manager.close();
    network.close();
    vault.forget(profileId);
  }
}
