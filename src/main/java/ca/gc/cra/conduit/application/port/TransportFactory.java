package ca.gc.cra.conduit.application.port;

import ca.gc.cra.conduit.domain.profile.TransportConfig;

/**
 * Creates an unconnected {@link Transport} for a transport variant.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface TransportFactory {
  /**
   * Builds a transport for {@code config}.
   *
   * @param config transport variant from the profile
   * @param settings timeouts and network binding
   * @return a fresh, unconnected transport
   */
  Transport create(TransportConfig config, TransportSettings settings);
}
