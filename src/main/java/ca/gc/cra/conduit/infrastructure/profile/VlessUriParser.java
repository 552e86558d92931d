package ca.gc.cra.conduit.infrastructure.profile;

import ca.gc.cra.conduit.domain.net.ServerEndpoint;
import ca.gc.cra.conduit.domain.profile.Credential;
import ca.gc.cra.conduit.domain.profile.FlowControl;
import ca.gc.cra.conduit.domain.profile.Profile;
import ca.gc.cra.conduit.domain.profile.TransportConfig;
import ca.gc.cra.conduit.domain.profile.TransportKind;
import ca.gc.cra.conduit.logging.Logs;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses {@code vless://uuid@host:port?params#label} share links into a {@link Profile} and {@link Credential}.
 *
 * <p>Recognized parameters: {@code type} ({@code tcp}, {@code ws}, {@code websocket}, {@code grpc}, {@code http},
 * {@code h2}), {@code security} ({@code none}, {@code tls}), {@code sni}, {@code alpn}, {@code allowInsecure},
 * {@code flow}, {@code path}, {@code host}, {@code serviceName} and {@code mode}. Unknown parameters are ignored;
 * unknown values of recognized parameters are rejected.</p>
 *
 * @since 0.1.0
 */
public final class VlessUriParser {
  /** Scheme prefix, matched case-insensitively. */
  public static final String SCHEME = "vless://";

  private VlessUriParser() {
    // Utility
  }

  /**
   * Parses a URI, using {@code host:port} as the profile id.
   *
   * @param uri share link
   * @return parsed profile and credential
   * @throws UriParseException when the link is malformed; the message never contains the UUID
   */
  public static ParsedUri parse(String uri) throws UriParseException {
    return parse(uri, null);
  }

  /**
   * Parses a URI into a profile with the given id.
   *
   * @param uri share link
   * @param profileId profile id to assign, or {@code null} to derive {@code host:port}
   * @return parsed profile and credential
   * @throws UriParseException when the link is malformed; the message never contains the UUID
   */
  public static ParsedUri parse(String uri, String profileId) throws UriParseException {
    if (uri == null || uri.isBlank()) {
      throw new UriParseException("VLESS URI is empty");
    }
    String text = uri.trim();
    if (!text.regionMatches(true, 0, SCHEME, 0, SCHEME.length())) {
      throw new UriParseException("Invalid VLESS URI. Must start with vless://");
    }
    try {
      return parseComponents(text.substring(SCHEME.length()), profileId);
    } catch (IllegalArgumentException ex) {
      throw new UriParseException("Invalid VLESS URI: " + Logs.redactCredentials(ex.getMessage()), ex);
    }
  }

  private static ParsedUri parseComponents(String rest, String profileId) throws UriParseException {
    String fragment = null;
    int hash = rest.indexOf('#');
    if (hash >= 0) {
      fragment = rest.substring(hash + 1);
      rest = rest.substring(0, hash);
    }
    String query = null;
    int question = rest.indexOf('?');
    if (question >= 0) {
      query = rest.substring(question + 1);
      rest = rest.substring(0, question);
    }
    // Path component is not meaningful for VLESS; drop it.
    int slash = rest.indexOf('/');
    if (slash >= 0) {
      rest = rest.substring(0, slash);
    }

    int at = rest.lastIndexOf('@');
    if (at <= 0) {
      throw new UriParseException("Missing UUID in VLESS URI");
    }
    String userInfo = decode(rest.substring(0, at));
    if (!Credential.isCanonicalUuid(userInfo)) {
      throw new UriParseException("Invalid UUID format. Expected 36-character hyphenated hex UUID");
    }
    Credential credential = Credential.parse(userInfo);

    HostPort hostPort = splitHostPort(rest.substring(at + 1));
    Map<String, String> params = parseQuery(query);

    TransportKind kind = TransportKind.fromUriName(params.get("type"));
    FlowControl flow = FlowControl.fromWireName(params.get("flow"));

    String security = params.getOrDefault("security", "none").trim().toLowerCase(Locale.ROOT);
    TransportConfig.Tls tls;
    switch (security) {
      case "", "none" -> tls = null;
      case "tls" -> tls = new TransportConfig.Tls(
          params.getOrDefault("sni", hostPort.host()),
          splitList(params.get("alpn")),
          isTrue(params.get("allowInsecure")));
      default -> throw new UriParseException("Unsupported security type: " + security);
    }

    TransportConfig transport = switch (kind) {
      case TCP -> tls == null ? new TransportConfig.Plain() : tls;
      case WEBSOCKET -> new TransportConfig.WebSocket(params.get("path"), hostHeader(params.get("host")), tls);
      case GRPC -> {
        String serviceName = params.get("serviceName");
        if (serviceName == null || serviceName.isBlank()) {
          throw new UriParseException("Missing serviceName for gRPC transport");
        }
        yield new TransportConfig.Grpc(serviceName, "multi".equalsIgnoreCase(params.get("mode")), tls);
      }
      case HTTP2 -> new TransportConfig.Http2(params.get("path"), splitList(params.get("host")), tls);
    };

    ServerEndpoint endpoint = new ServerEndpoint(
        hostPort.host(),
        hostPort.port(),
        tls == null ? null : tls.serverName(),
        tls == null ? List.of() : tls.alpn(),
        tls != null && tls.allowInsecure());
    String name = fragment == null || fragment.isBlank() ? null : decode(fragment);
    String id = profileId == null || profileId.isBlank() ? endpoint.authority() : profileId;
    Profile profile = new Profile(id, name, endpoint, transport, flow, null);
    return new ParsedUri(profile, credential);
  }

  private static HostPort splitHostPort(String authority) throws UriParseException {
    if (authority.isEmpty()) {
      throw new UriParseException("Missing hostname in VLESS URI");
    }
    String host;
    String portText;
    if (authority.startsWith("[")) {
      int close = authority.indexOf(']');
      if (close < 0) {
        throw new UriParseException("Unterminated IPv6 literal in VLESS URI");
      }
      host = authority.substring(1, close);
      String tail = authority.substring(close + 1);
      portText = tail.startsWith(":") ? tail.substring(1) : "";
    } else {
      int colon = authority.lastIndexOf(':');
      host = colon < 0 ? authority : authority.substring(0, colon);
      portText = colon < 0 ? "" : authority.substring(colon + 1);
    }
    if (host.isBlank()) {
      throw new UriParseException("Missing hostname in VLESS URI");
    }
    int port;
    try {
      port = Integer.parseInt(portText);
    } catch (NumberFormatException ex) {
      throw new UriParseException("Invalid or missing port in VLESS URI");
    }
    if (port < 1 || port > 65_535) {
      throw new UriParseException("Invalid or missing port in VLESS URI");
    }
    return new HostPort(host, port);
  }

  private static Map<String, String> parseQuery(String query) {
    Map<String, String> params = new LinkedHashMap<>();
    if (query == null || query.isEmpty()) {
      return params;
    }
    for (String pair : query.split("&")) {
      int eq = pair.indexOf('=');
      if (eq <= 0) {
        continue;
      }
      params.put(decode(pair.substring(0, eq)), decode(pair.substring(eq + 1)));
    }
    return params;
  }

  private static Map<String, String> hostHeader(String host) {
    if (host == null || host.isBlank()) {
      return Map.of();
    }
    return Map.of("Host", host.trim());
  }

  private static List<String> splitList(String raw) {
    List<String> values = new ArrayList<>();
    if (raw == null) {
      return values;
    }
    for (String part : raw.split(",")) {
      String trimmed = part.trim();
      if (!trimmed.isEmpty()) {
        values.add(trimmed);
      }
    }
    return values;
  }

  private static boolean isTrue(String raw) {
    return raw != null && ("1".equals(raw.trim()) || "true".equalsIgnoreCase(raw.trim()));
  }

  private static String decode(String raw) {
    return URLDecoder.decode(raw, StandardCharsets.UTF_8);
  }

  private record HostPort(String host, int port) {}
}
