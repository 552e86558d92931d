package ca.gc.cra.conduit.application.connection;

import ca.gc.cra.conduit.application.port.ClockPort;
import ca.gc.cra.conduit.application.port.CredentialVault;
import ca.gc.cra.conduit.application.port.NetworkMonitor;
import ca.gc.cra.conduit.application.port.ProfileStore;
import ca.gc.cra.conduit.application.port.ProtocolSession;
import ca.gc.cra.conduit.application.port.SessionException;
import ca.gc.cra.conduit.application.port.SessionFactory;
import ca.gc.cra.conduit.application.port.TransportSettings;
import ca.gc.cra.conduit.application.port.VaultException;
import ca.gc.cra.conduit.domain.connection.ProbeResult;
import ca.gc.cra.conduit.domain.profile.Credential;
import ca.gc.cra.conduit.domain.profile.Profile;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Measures whether a profile can complete a handshake, using a throwaway session that never touches the manager's
 * state.
 *
 * @since 0.1.0
 */
public final class ConnectionProbe {
  private static final Logger log = LoggerFactory.getLogger(ConnectionProbe.class);

  private final ProfileStore profiles;
  private final CredentialVault vault;
  private final SessionFactory sessions;
  private final NetworkMonitor network;
  private final ClockPort clock;
  private final TransportSettings settings;

  public ConnectionProbe(
      ProfileStore profiles,
      CredentialVault vault,
      SessionFactory sessions,
      NetworkMonitor network,
      ClockPort clock,
      TransportSettings settings) {
    this.profiles = Objects.requireNonNull(profiles, "profiles");
    this.vault = Objects.requireNonNull(vault, "vault");
    this.sessions = Objects.requireNonNull(sessions, "sessions");
    this.network = network == null ? NetworkMonitor.NONE : network;
    this.clock = clock == null ? ClockPort.SYSTEM : clock;
    this.settings = settings == null ? TransportSettings.defaults() : settings;
  }

  /**
   * Opens a session, completes the header exchange and closes it again.
   *
   * @param profileId profile to probe
   * @return success with handshake latency, or failure with a redacted reason
   */
  public ProbeResult testConnection(String profileId) {
    Optional<Profile> resolved = profiles.getProfile(profileId);
    if (resolved.isEmpty()) {
      return ProbeResult.failed("Profile not found: " + profileId);
    }
    Profile profile = resolved.get();
    Credential credential;
    try {
      credential = vault.getCredential(profileId);
    } catch (VaultException ex) {
      return ProbeResult.failed("Credential unavailable: " + ex.getMessage());
    }
    TransportSettings effective = settings.withNetwork(network.activeNetwork().orElse(null));
    long started = clock.monotonicNanos();
    try (ProtocolSession session = sessions.create(profile, effective)) {
      session.connect(profile.endpoint(), credential, profile.transport());
      long latency = TimeUnit.NANOSECONDS.toMillis(clock.monotonicNanos() - started);
      log.info("Probe of {} succeeded in {} ms", profile.endpoint().authority(), latency);
      return ProbeResult.ok(latency);
    } catch (SessionException ex) {
      log.info("Probe of {} failed ({}): {}", profile.endpoint().authority(), ex.failure(), ex.getMessage());
      return ProbeResult.failed(ex.getMessage());
    }
  }
}
