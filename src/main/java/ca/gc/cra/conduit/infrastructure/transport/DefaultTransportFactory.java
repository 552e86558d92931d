package ca.gc.cra.conduit.infrastructure.transport;

import ca.gc.cra.conduit.application.port.Transport;
import ca.gc.cra.conduit.application.port.TransportFactory;
import ca.gc.cra.conduit.application.port.TransportSettings;
import ca.gc.cra.conduit.domain.profile.TransportConfig;
import ca.gc.cra.conduit.domain.profile.TransportKind;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Chooses the transport implementation for a {@link TransportConfig}.
 * <p><strong>Role:</strong> TCP and TLS are built in. WebSocket, gRPC and HTTP/2 framing plug in as providers keyed by
 * {@link TransportKind}; a provider must return a transport whose {@code connect} completes the outer framing and whose
 * {@code send}/{@code receive} then behave as a raw byte pipe.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction.</p>
 *
 * @since 0.1.0
 */
public final class DefaultTransportFactory implements TransportFactory {
  private static final Logger log = LoggerFactory.getLogger(DefaultTransportFactory.class);

  private final Map<TransportKind, TransportFactory> framedProviders;

  /** Factory with TCP and TLS only. */
  public DefaultTransportFactory() {
    this(Map.of());
  }

  /**
   * Factory with additional framed transport providers.
   *
   * @param framedProviders providers for {@link TransportKind#WEBSOCKET}, {@link TransportKind#GRPC} or
   *     {@link TransportKind#HTTP2}
   */
  public DefaultTransportFactory(Map<TransportKind, TransportFactory> framedProviders) {
    Objects.requireNonNull(framedProviders, "framedProviders");
    if (framedProviders.containsKey(TransportKind.TCP)) {
      throw new IllegalArgumentException("TCP transport is built in and cannot be replaced");
    }
    this.framedProviders = framedProviders.isEmpty()
        ? Map.of()
        : new EnumMap<>(framedProviders);
  }

  @Override
  public Transport create(TransportConfig config, TransportSettings settings) {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(settings, "settings");
    return switch (config.kind()) {
      case TCP -> config.tls()
          .<Transport>map(tls -> new TlsTransport(settings, tls))
          .orElseGet(() -> new TcpTransport(settings));
      case WEBSOCKET, GRPC, HTTP2 -> framed(config, settings);
    };
  }

  private Transport framed(TransportConfig config, TransportSettings settings) {
    TransportFactory provider = framedProviders.get(config.kind());
    if (provider == null) {
      log.warn("No provider registered for {} transport", config.kind().uriName());
      return new UnavailableTransport(config.kind());
    }
    return provider.create(config, settings);
  }
}
