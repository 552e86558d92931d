package ca.gc.cra.conduit.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter provider for conduit from system properties and environment variables.
 *
 * <p>{@code otel.metrics.exporter} / {@code OTEL_METRICS_EXPORTER} selects {@code otlp} (default) or {@code none};
 * {@code otel.exporter.otlp.endpoint} / {@code OTEL_EXPORTER_OTLP_ENDPOINT} sets the collector address.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  private static final String SCOPE = "ca.gc.cra.conduit";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(30);

  private OpenTelemetryBootstrap() {
    // Utility
  }

  static BootstrapResult initialize() {
    try {
      ExporterMode mode = ExporterMode.from(setting("otel.metrics.exporter", "OTEL_METRICS_EXPORTER"));
      if (mode == ExporterMode.NONE) {
        log.info("OpenTelemetry metrics exporter disabled (exporter=none)");
        return BootstrapResult.noop();
      }
      String endpoint = setting("otel.exporter.otlp.endpoint", "OTEL_EXPORTER_OTLP_ENDPOINT");
      if (endpoint == null) {
        endpoint = DEFAULT_ENDPOINT;
      }
      OtlpGrpcMetricExporter exporter = OtlpGrpcMetricExporter.builder().setEndpoint(endpoint).build();
      MetricReader reader = PeriodicMetricReader.builder(exporter).setInterval(EXPORT_INTERVAL).build();
      log.info("OpenTelemetry metrics exporting via OTLP to {}", endpoint);
      return build(reader);
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; using noop adapter", ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forTesting(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"));
  }

  private static BootstrapResult build(MetricReader reader) {
    String version = serviceVersion();
    Resource resource = Resource.getDefault().merge(Resource.create(Attributes.builder()
        .put(AttributeKey.stringKey("service.name"), "conduit")
        .put(AttributeKey.stringKey("service.namespace"), "ca.gc.cra")
        .put(AttributeKey.stringKey("service.version"), version)
        .put(AttributeKey.stringKey("service.instance.id"), instanceId())
        .build()));
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource)
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(SCOPE).setInstrumentationVersion(version).build();
    return BootstrapResult.active(provider, meter);
  }

  private static String setting(String property, String env) {
    String value = System.getProperty(property);
    if (value == null || value.isBlank()) {
      value = System.getenv(env);
    }
    return value == null || value.isBlank() ? null : value.trim();
  }

  private static String instanceId() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      log.debug("Local hostname unavailable; using pid as instance id", ex);
      return "pid-" + ProcessHandle.current().pid();
    }
  }

  private static String serviceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    String impl = pkg == null ? null : pkg.getImplementationVersion();
    return impl == null || impl.isBlank() ? "0.0.0-dev" : impl;
  }

  enum ExporterMode {
    OTLP,
    NONE;

    static ExporterMode from(String raw) {
      if (raw == null) {
        return OTLP;
      }
      return switch (raw.toLowerCase(Locale.ROOT)) {
        case "none" -> NONE;
        case "otlp" -> OTLP;
        default -> {
          log.warn("Unknown metrics exporter '{}'; defaulting to otlp", raw);
          yield OTLP;
        }
      };
    }
  }

  static final class BootstrapResult implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private BootstrapResult(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static BootstrapResult noop() {
      return new BootstrapResult(MeterProvider.noop().get(SCOPE), null);
    }

    static BootstrapResult active(SdkMeterProvider provider, Meter meter) {
      return new BootstrapResult(meter, provider);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider == null) {
        return;
      }
      CompletableResultCode result = provider.forceFlush().join(5, TimeUnit.SECONDS);
      if (!result.isSuccess()) {
        log.warn("OpenTelemetry metrics flush did not complete within timeout");
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      CompletableResultCode shutdown = provider.shutdown().join(5, TimeUnit.SECONDS);
      if (!shutdown.isSuccess()) {
        log.warn("Timed out waiting for OpenTelemetry meter provider shutdown");
      }
    }
  }
}
