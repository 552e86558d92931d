package ca.gc.cra.conduit.domain.profile;

import ca.gc.cra.conduit.domain.net.DestinationAddress;
import ca.gc.cra.conduit.domain.net.ServerEndpoint;
import ca.gc.cra.conduit.validation.Strings;
import java.util.Objects;

/**
 * <strong>What:</strong> A validated server profile: where to connect, how to frame the transport and which flow to
 * negotiate.
 * <p><strong>Why:</strong> The connection manager resolves a profile id into this record before any socket is opened,
 * so invalid combinations fail before the network is touched.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param id opaque profile identifier
 * @param name display label
 * @param endpoint server address and TLS presentation
 * @param transport transport variant
 * @param flow flow-control mode
 * @param destination address the server should dial; defaults to the server's own host and port
 * @since 0.1.0
 */
public record Profile(
    String id,
    String name,
    ServerEndpoint endpoint,
    TransportConfig transport,
    FlowControl flow,
    DestinationAddress destination) {

  public Profile {
    id = Strings.requireNonBlank("id", id);
    Objects.requireNonNull(endpoint, "endpoint");
    Objects.requireNonNull(transport, "transport");
    name = name == null || name.isBlank() ? endpoint.authority() : name.trim();
    flow = flow == null ? FlowControl.NONE : flow;
    destination = destination == null
        ? DestinationAddress.of(endpoint.hostname(), endpoint.port())
        : destination;
    if (transport.tls().isPresent() && endpoint.sni().isEmpty()) {
      throw new IllegalArgumentException("TLS profiles require a non-empty serverName");
    }
  }
}
