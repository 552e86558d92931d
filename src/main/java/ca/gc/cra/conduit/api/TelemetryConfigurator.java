package ca.gc.cra.conduit.api;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies {@code metricsExporter} and {@code otelEndpoint} settings into the system properties read by
 * the OpenTelemetry metrics bootstrap.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);

  static final String EXPORTER_PROPERTY = "otel.metrics.exporter";
  static final String ENDPOINT_PROPERTY = "otel.exporter.otlp.endpoint";

  private TelemetryConfigurator() {
    // Utility
  }

  /**
   * Applies telemetry settings. Must run before the metrics adapter is created.
   *
   * @param settings effective settings; read only
   * @throws IllegalArgumentException when the exporter is unknown or the endpoint is not an http(s) URL
   */
  static void configureMetrics(Map<String, String> settings) {
    if (settings == null || settings.isEmpty()) {
      return;
    }
    String exporter = trimmed(settings.get("metricsExporter"));
    if (!exporter.isEmpty()) {
      String normalized = exporter.toLowerCase(Locale.ROOT);
      if (!normalized.equals("otlp") && !normalized.equals("none")) {
        throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      }
      log.debug("Metrics exporter: {}", normalized);
      System.setProperty(EXPORTER_PROPERTY, normalized);
    }
    String endpoint = trimmed(settings.get("otelEndpoint"));
    if (!endpoint.isEmpty()) {
      validateEndpoint(endpoint);
      log.debug("OTLP endpoint: {}", endpoint);
      System.setProperty(ENDPOINT_PROPERTY, endpoint);
    }
  }

  private static void validateEndpoint(String raw) {
    URI uri;
    try {
      uri = new URI(raw);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
    String scheme = uri.getScheme();
    if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
      throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException("otelEndpoint must include a host");
    }
  }

  private static String trimmed(String value) {
    return value == null ? "" : value.trim();
  }
}
