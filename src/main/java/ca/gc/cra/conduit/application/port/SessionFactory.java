package ca.gc.cra.conduit.application.port;

import ca.gc.cra.conduit.domain.profile.Profile;

/**
 * Builds a fresh {@link ProtocolSession} for each connection attempt.
 *
 * <p>The backend (VLESS or an alternative VPN implementation) is chosen by which factory is wired in.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface SessionFactory {
  /**
   * Creates an unconnected session.
   *
   * @param profile profile being connected; supplies destination and flow settings
   * @param settings transport timeouts and network binding for this attempt
   * @return new session
   */
  ProtocolSession create(Profile profile, TransportSettings settings);
}
