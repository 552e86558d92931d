package ca.gc.cra.conduit.config;

import ca.gc.cra.conduit.application.connection.ConnectionManager;
import ca.gc.cra.conduit.application.connection.ConnectionProbe;
import ca.gc.cra.conduit.application.connection.ExponentialBackoff;
import ca.gc.cra.conduit.application.connection.ReconnectSupervisor;
import ca.gc.cra.conduit.application.pipeline.TunnelRelayUseCase;
import ca.gc.cra.conduit.application.port.ClockPort;
import ca.gc.cra.conduit.application.port.MetricsPort;
import ca.gc.cra.conduit.application.port.PacketChannel;
import ca.gc.cra.conduit.application.port.SessionFactory;
import ca.gc.cra.conduit.application.port.TransportFactory;
import ca.gc.cra.conduit.application.port.TransportSettings;
import ca.gc.cra.conduit.infrastructure.network.PollingNetworkMonitor;
import ca.gc.cra.conduit.infrastructure.profile.ParsedUri;
import ca.gc.cra.conduit.infrastructure.protocol.vless.VlessSessionFactory;
import ca.gc.cra.conduit.infrastructure.store.InMemoryCredentialVault;
import ca.gc.cra.conduit.infrastructure.store.InMemoryProfileStore;
import ca.gc.cra.conduit.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.conduit.infrastructure.transport.DefaultTransportFactory;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires conduit services to concrete adapters from a validated {@link TunnelConfig}.
 * <p><strong>Why:</strong> Keeps adapter choice (transport factory, session backend, stores, network monitor) in one
 * place so the CLI only deals with commands.</p>
 * <p><strong>Role:</strong> Composition root for the connect and probe commands.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; build the graph on one thread and share the resulting
 * services.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final TunnelConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final TransportFactory transports;

  public CompositionRoot(TunnelConfig config, MetricsPort metrics) {
    this(config, metrics, new SystemClockAdapter(), new DefaultTransportFactory());
  }

  /**
   * Creates a root with explicit clock and transport factory, used by tests to swap in stubs.
   */
  public CompositionRoot(TunnelConfig config, MetricsPort metrics, ClockPort clock, TransportFactory transports) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.transports = Objects.requireNonNull(transports, "transports");
  }

  public TransportSettings transportSettings() {
    return new TransportSettings(config.connectTimeout(), config.readTimeout(), null);
  }

  /** Session backend selected by {@link TunnelConfig#backend()}. */
  public SessionFactory sessionFactory() {
    return switch (config.backend()) {
      case TunnelConfig.BACKEND_VLESS -> new VlessSessionFactory(transports, clock);
      default -> throw new IllegalArgumentException("Unsupported backend: " + config.backend());
    };
  }

  /**
   * Builds the full tunnel graph around one parsed profile.
   *
   * @param parsed profile and credential to register
   * @return runtime owning the manager, supervisor and monitor; close it to release threads and sockets
   */
  public TunnelRuntime tunnelRuntime(ParsedUri parsed) {
    Objects.requireNonNull(parsed, "parsed");
    InMemoryProfileStore profiles = new InMemoryProfileStore();
    InMemoryCredentialVault vault = new InMemoryCredentialVault();
    profiles.put(parsed.profile());
    vault.store(parsed.profile().id(), parsed.credential());

    PollingNetworkMonitor network = new PollingNetworkMonitor(config.networkPollInterval(), config.bindInterface());
    SessionFactory sessions = sessionFactory();
    ConnectionManager manager = new ConnectionManager(
        profiles, vault, sessions, network, metrics, clock, transportSettings(), config.statsInterval());
    ReconnectSupervisor supervisor = new ReconnectSupervisor(
        manager.states(), network, manager.commandChannel(), new ExponentialBackoff(config.backoffUnit()), metrics);
    ConnectionProbe probe = new ConnectionProbe(profiles, vault, sessions, network, clock, transportSettings());
    log.debug("Composed tunnel runtime for {} (backend {}, autoReconnect {})",
        parsed.profile().endpoint().authority(), config.backend(), config.autoReconnect());
    return new TunnelRuntime(parsed.profile().id(), config.autoReconnect(), profiles, vault, network, manager,
        supervisor, probe);
  }

  /**
   * Creates the relay between a local channel and the runtime's connection manager.
   */
  public TunnelRelayUseCase relay(TunnelRuntime runtime, PacketChannel channel) {
    return new TunnelRelayUseCase(channel, runtime.manager(), metrics);
  }
}
