package ca.gc.cra.conduit.config;

import ca.gc.cra.conduit.validation.Numbers;
import ca.gc.cra.conduit.validation.Strings;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Effective runtime settings for a tunnel command after defaults, YAML and CLI are merged.
 * <p><strong>Why:</strong> Centralizes range checks so the composition root only ever sees valid timeouts and
 * cadences.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param uri share link describing the server, or {@code null} when the command does not need one
 * @param profileId profile id assigned to the parsed URI, or {@code null} to derive {@code host:port}
 * @param connectTimeout socket connect and TLS handshake budget
 * @param readTimeout socket read timeout; an idle read returns without failing the session
 * @param statsInterval statistics sampling cadence
 * @param autoReconnect whether the reconnect supervisor is armed after connecting
 * @param backoffUnit backoff unit multiplied by {@code min(60, 2^(attempt-1))}
 * @param networkPollInterval polling cadence for host network changes
 * @param bindInterface network interface to prefer for socket binding, or {@code null}
 * @param backend session backend name; only {@code vless} ships in this build
 * @since 0.1.0
 */
public record TunnelConfig(
    String uri,
    String profileId,
    Duration connectTimeout,
    Duration readTimeout,
    Duration statsInterval,
    boolean autoReconnect,
    Duration backoffUnit,
    Duration networkPollInterval,
    String bindInterface,
    String backend) {

  public static final String BACKEND_VLESS = "vless";

  public TunnelConfig {
    uri = Strings.optional("uri", uri);
    profileId = Strings.optional("profileId", profileId);
    requireMillis("connectTimeoutMs", connectTimeout, 1_000, 120_000);
    requireMillis("readTimeoutMs", readTimeout, 1_000, 300_000);
    requireMillis("statsIntervalMs", statsInterval, 250, 60_000);
    requireMillis("backoffUnitMs", backoffUnit, 1, 60_000);
    requireMillis("networkPollMs", networkPollInterval, 250, 60_000);
    bindInterface = Strings.optional("bindInterface", bindInterface);
    backend = backend == null || backend.isBlank() ? BACKEND_VLESS : backend.trim().toLowerCase(Locale.ROOT);
    if (!BACKEND_VLESS.equals(backend)) {
      throw new IllegalArgumentException("Unsupported backend: " + backend);
    }
  }

  /** Production defaults: 10 s connect, 30 s read, 2 s sampling, 1 s backoff unit, no auto-reconnect. */
  public static TunnelConfig defaults() {
    return new TunnelConfig(
        null,
        null,
        Duration.ofSeconds(10),
        Duration.ofSeconds(30),
        Duration.ofSeconds(2),
        false,
        Duration.ofSeconds(1),
        Duration.ofSeconds(2),
        null,
        BACKEND_VLESS);
  }

  /**
   * Builds a config from a flattened map, falling back to {@link #defaults()} for absent keys.
   *
   * @param values merged key/value map
   * @return validated config
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static TunnelConfig fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    TunnelConfig d = defaults();
    return new TunnelConfig(
        values.get("uri"),
        values.get("profileId"),
        millis(values, "connectTimeoutMs", d.connectTimeout()),
        millis(values, "readTimeoutMs", d.readTimeout()),
        millis(values, "statsIntervalMs", d.statsInterval()),
        bool(values, "autoReconnect", d.autoReconnect()),
        millis(values, "backoffUnitMs", d.backoffUnit()),
        millis(values, "networkPollMs", d.networkPollInterval()),
        values.get("bindInterface"),
        values.getOrDefault("backend", d.backend()));
  }

  /**
   * Flattens the defaults into the key space used by YAML and CLI arguments.
   *
   * @return ordered, unmodifiable defaults map
   */
  public static Map<String, String> defaultsAsFlatMap() {
    TunnelConfig d = defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("connectTimeoutMs", Long.toString(d.connectTimeout().toMillis()));
    map.put("readTimeoutMs", Long.toString(d.readTimeout().toMillis()));
    map.put("statsIntervalMs", Long.toString(d.statsInterval().toMillis()));
    map.put("autoReconnect", Boolean.toString(d.autoReconnect()));
    map.put("backoffUnitMs", Long.toString(d.backoffUnit().toMillis()));
    map.put("networkPollMs", Long.toString(d.networkPollInterval().toMillis()));
    map.put("backend", d.backend());
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    return Collections.unmodifiableMap(map);
  }

  private static Duration millis(Map<String, String> values, String key, Duration fallback) {
    String raw = values.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return Duration.ofMillis(Numbers.parseLong(key, raw));
  }

  private static boolean bool(Map<String, String> values, String key, boolean fallback) {
    String raw = values.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "1" -> true;
      case "false", "no", "0" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false (was " + raw.trim() + ")");
    };
  }

  private static void requireMillis(String name, Duration value, long min, long max) {
    Objects.requireNonNull(value, name);
    Numbers.requireRange(name, value.toMillis(), min, max);
  }
}
