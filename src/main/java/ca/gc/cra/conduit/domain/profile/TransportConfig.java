package ca.gc.cra.conduit.domain.profile;

import ca.gc.cra.conduit.validation.Strings;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * <strong>What:</strong> Transport variant a session is opened with; exactly one variant per session.
 * <p><strong>Why:</strong> A closed set of variants lets transport factories and exporters switch exhaustively, so a
 * new variant cannot be added without updating every consumer.</p>
 * <p><strong>Thread-safety:</strong> All variants are immutable records.</p>
 *
 * @since 0.1.0
 */
public sealed interface TransportConfig
    permits TransportConfig.Plain,
        TransportConfig.Tls,
        TransportConfig.WebSocket,
        TransportConfig.Grpc,
        TransportConfig.Http2 {

  /**
   * Returns the outer framing of this variant.
   *
   * @return transport kind
   */
  TransportKind kind();

  /**
   * Returns the TLS layer wrapped around the raw socket, if any.
   *
   * @return TLS settings, empty for plaintext
   */
  Optional<Tls> tls();

  /** Plain TCP. */
  record Plain() implements TransportConfig {
    @Override
    public TransportKind kind() {
      return TransportKind.TCP;
    }

    @Override
    public Optional<Tls> tls() {
      return Optional.empty();
    }
  }

  /**
   * TLS over TCP.
   *
   * @param serverName SNI name presented during the handshake; never blank
   * @param alpn ordered ALPN list, possibly empty
   * @param allowInsecure skip certificate validation; test-only and never a default
   */
  record Tls(String serverName, List<String> alpn, boolean allowInsecure) implements TransportConfig {
    public Tls {
      serverName = Strings.requireNonBlank("serverName", serverName);
      alpn = alpn == null ? List.of() : List.copyOf(alpn);
    }

    @Override
    public TransportKind kind() {
      return TransportKind.TCP;
    }

    @Override
    public Optional<Tls> tls() {
      return Optional.of(this);
    }
  }

  /**
   * WebSocket framing.
   *
   * @param path request path, defaults to {@code /}
   * @param headers extra upgrade headers such as {@code Host}
   * @param security optional TLS layer (wss)
   */
  record WebSocket(String path, Map<String, String> headers, Tls security) implements TransportConfig {
    public WebSocket {
      path = path == null || path.isBlank() ? "/" : path.trim();
      headers = headers == null ? Map.of() : Map.copyOf(new LinkedHashMap<>(headers));
    }

    @Override
    public TransportKind kind() {
      return TransportKind.WEBSOCKET;
    }

    @Override
    public Optional<Tls> tls() {
      return Optional.ofNullable(security);
    }
  }

  /**
   * gRPC framing.
   *
   * @param serviceName gRPC service name; required
   * @param multiMode whether multi-stream mode is requested
   * @param security optional TLS layer
   */
  record Grpc(String serviceName, boolean multiMode, Tls security) implements TransportConfig {
    public Grpc {
      serviceName = Strings.requireNonBlank("serviceName", serviceName);
    }

    @Override
    public TransportKind kind() {
      return TransportKind.GRPC;
    }

    @Override
    public Optional<Tls> tls() {
      return Optional.ofNullable(security);
    }
  }

  /**
   * HTTP/2 framing.
   *
   * @param path request path, defaults to {@code /}
   * @param hosts authority values to rotate through
   * @param security optional TLS layer
   */
  record Http2(String path, List<String> hosts, Tls security) implements TransportConfig {
    public Http2 {
      path = path == null || path.isBlank() ? "/" : path.trim();
      hosts = hosts == null ? List.of() : List.copyOf(hosts);
    }

    @Override
    public TransportKind kind() {
      return TransportKind.HTTP2;
    }

    @Override
    public Optional<Tls> tls() {
      return Optional.ofNullable(security);
    }
  }
}
