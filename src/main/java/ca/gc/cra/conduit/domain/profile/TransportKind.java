package ca.gc.cra.conduit.domain.profile;

import java.util.Locale;

/**
 * Outer framing selected by the {@code type} URI parameter.
 *
 * @since 0.1.0
 */
public enum TransportKind {
  TCP("tcp"),
  WEBSOCKET("ws"),
  GRPC("grpc"),
  HTTP2("h2");

  private final String uriName;

  TransportKind(String uriName) {
    this.uriName = uriName;
  }

  /**
   * Returns the canonical {@code type} value written by exporters.
   *
   * @return URI name
   */
  public String uriName() {
    return uriName;
  }

  /**
   * Parses a {@code type} value, accepting the long aliases the clients in the wild emit.
   *
   * @param raw type parameter; {@code null} or blank means TCP
   * @return transport kind
   * @throws IllegalArgumentException for unknown types
   */
  public static TransportKind fromUriName(String raw) {
    if (raw == null || raw.isBlank()) {
      return TCP;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "tcp" -> TCP;
      case "ws", "websocket" -> WEBSOCKET;
      case "grpc" -> GRPC;
      case "http", "h2" -> HTTP2;
      default -> throw new IllegalArgumentException("Unsupported transport type: " + raw);
    };
  }
}
