package ca.gc.cra.conduit.domain.net;

import ca.gc.cra.conduit.validation.Net;
import ca.gc.cra.conduit.validation.Numbers;
import ca.gc.cra.conduit.validation.Strings;
import java.util.List;
import java.util.Optional;

/**
 * <strong>What:</strong> Address of a tunnel server plus the TLS presentation parameters used to reach it.
 * <p><strong>Why:</strong> The DNS target and the SNI name are independent; the server name may point at a decoy
 * domain while {@code hostname} resolves to the real server.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param hostname DNS name or IP literal dialed by the transport
 * @param port TCP port in {@code [1, 65535]}
 * @param serverName optional SNI name; required when the endpoint is reached over TLS
 * @param alpn ordered ALPN protocol list; empty when ALPN is not negotiated
 * @param allowInsecureTls whether certificate validation is skipped (test-only setting)
 * @since 0.1.0
 */
public record ServerEndpoint(
    String hostname,
    int port,
    String serverName,
    List<String> alpn,
    boolean allowInsecureTls) {

  /**
   * Validates the host and port and normalizes optional fields.
   */
  public ServerEndpoint {
    hostname = Net.requireHost("hostname", hostname);
    Numbers.requirePort("port", port);
    serverName = Strings.optional("serverName", serverName);
    alpn = alpn == null ? List.of() : List.copyOf(alpn);
  }

  /**
   * Creates a plain endpoint without TLS presentation settings.
   *
   * @param hostname server host
   * @param port server port
   * @return endpoint with no SNI or ALPN
   */
  public static ServerEndpoint of(String hostname, int port) {
    return new ServerEndpoint(hostname, port, null, List.of(), false);
  }

  /**
   * Returns the SNI name, if present.
   *
   * @return optional server name
   */
  public Optional<String> sni() {
    return Optional.ofNullable(serverName);
  }

  /**
   * Renders {@code host:port}, bracketing IPv6 literals.
   *
   * @return authority string
   */
  public String authority() {
    String host = Net.isIpv6Literal(hostname) ? '[' + hostname + ']' : hostname;
    return host + ':' + port;
  }
}
