package ca.gc.cra.conduit.infrastructure.profile;

import ca.gc.cra.conduit.domain.profile.Credential;
import ca.gc.cra.conduit.domain.profile.FlowControl;
import ca.gc.cra.conduit.domain.profile.Profile;
import ca.gc.cra.conduit.domain.profile.TransportConfig;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * Renders a profile and its credential as a {@code vless://} share link that {@link VlessUriParser} reads back.
 *
 * <p>The output contains the credential in clear text. Callers must treat it like the credential itself.</p>
 *
 * @since 0.1.0
 */
public final class VlessUriExporter {
  private VlessUriExporter() {
    // Utility
  }

  /**
   * Builds the share link.
   *
   * @param profile profile to export
   * @param credential credential to embed
   * @return canonical URI
   */
  public static String export(Profile profile, Credential credential) {
    Objects.requireNonNull(profile, "profile");
    Objects.requireNonNull(credential, "credential");
    StringBuilder uri = new StringBuilder(128)
        .append(VlessUriParser.SCHEME)
        .append(credential.reveal())
        .append('@')
        .append(profile.endpoint().authority());

    Query query = new Query(uri);
    TransportConfig transport = profile.transport();
    query.add("type", transport.kind().uriName());
    if (profile.flow() != FlowControl.NONE) {
      query.add("flow", profile.flow().wireName());
    }
    Optional<TransportConfig.Tls> tls = transport.tls();
    if (tls.isPresent()) {
      query.add("security", "tls");
      query.add("sni", tls.get().serverName());
      if (!tls.get().alpn().isEmpty()) {
        query.add("alpn", String.join(",", tls.get().alpn()));
      }
      if (tls.get().allowInsecure()) {
        query.add("allowInsecure", "1");
      }
    } else {
      query.add("security", "none");
    }
    if (transport instanceof TransportConfig.WebSocket ws) {
      query.add("path", ws.path());
      String host = ws.headers().get("Host");
      if (host != null) {
        query.add("host", host);
      }
    } else if (transport instanceof TransportConfig.Grpc grpc) {
      query.add("serviceName", grpc.serviceName());
      if (grpc.multiMode()) {
        query.add("mode", "multi");
      }
    } else if (transport instanceof TransportConfig.Http2 h2) {
      query.add("path", h2.path());
      if (!h2.hosts().isEmpty()) {
        query.add("host", String.join(",", h2.hosts()));
      }
    }
    uri.append('#').append(encode(profile.name()));
    return uri.toString();
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
  }

  private static final class Query {
    private final StringBuilder target;
    private boolean first = true;

    Query(StringBuilder target) {
      this.target = target;
    }

    void add(String key, String value) {
      target.append(first ? '?' : '&').append(key).append('=').append(encode(value));
      first = false;
    }
  }
}
