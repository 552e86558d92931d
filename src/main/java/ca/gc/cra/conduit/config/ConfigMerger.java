package ca.gc.cra.conduit.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Combines defaults, YAML and CLI settings with precedence CLI over YAML over defaults, then validates the result.
 */
public final class ConfigMerger {
  private static final Set<String> COMMANDS_REQUIRING_URI = Set.of("connect", "probe", "inspect", "export");
  private static final Set<String> METRICS_EXPORTERS = Set.of("otlp", "none");

  private ConfigMerger() {
    // Utility
  }

  /**
   * Builds the effective settings for a command.
   *
   * @param command command being run
   * @param yaml settings loaded from YAML, if a file was given
   * @param cli {@code key=value} arguments
   * @param defaults built-in defaults
   * @param warn receives a notice for every YAML key the CLI overrides; may be {@code null}
   * @return immutable effective settings
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String command,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(command, "command");
    Map<String, String> fromYaml = yaml == null ? Map.of() : yaml.orElse(Map.of());
    Map<String, String> effective = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    effective.putAll(fromYaml);
    if (cli != null) {
      cli.forEach((key, value) -> {
        if (key == null || value == null) {
          return;
        }
        if (warn != null && fromYaml.containsKey(key) && !value.equals(fromYaml.get(key))) {
          warn.accept("CLI overrides YAML for key: " + key);
        }
        effective.put(key, value);
      });
    }
    validate(command.trim().toLowerCase(Locale.ROOT), effective);
    return Map.copyOf(effective);
  }

  private static void validate(String command, Map<String, String> effective) {
    if (COMMANDS_REQUIRING_URI.contains(command) && blank(effective.get("uri"))) {
      throw new IllegalArgumentException("uri is required for " + command);
    }
    String exporter = effective.get("metricsExporter");
    if (!blank(exporter) && !METRICS_EXPORTERS.contains(exporter.trim().toLowerCase(Locale.ROOT))) {
      throw new IllegalArgumentException("metricsExporter must be otlp or none (was " + exporter.trim() + ")");
    }
    // Ranges and types.
    TunnelConfig.fromMap(effective);
  }

  private static boolean blank(String value) {
    return value == null || value.isBlank();
  }
}
