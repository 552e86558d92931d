package ca.gc.cra.conduit.infrastructure.metrics;

import ca.gc.cra.conduit.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter that forwards conduit counters and histograms to OpenTelemetry.
 *
 * <p>Instruments are created lazily per key. Units are inferred from the key suffix: {@code *Ms} records
 * milliseconds, {@code connection.bytes.*} records bytes.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("conduit.metric.key");
  private static final String FALLBACK_NAME = "conduit.metric";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final boolean noop;
  private final ConcurrentMap<String, LongCounter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, LongHistogram> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter wired to the environment-configured OpenTelemetry exporter.
   */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    this.noop = bootstrap.isNoop();
    if (noop) {
      log.info("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
    if (noop) {
      return;
    }
    counters.computeIfAbsent(key, this::newCounter).add(1, Attributes.of(METRIC_KEY, key));
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    if (noop) {
      return;
    }
    histograms.computeIfAbsent(key, this::newHistogram).record(value, Attributes.of(METRIC_KEY, key));
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.close();
  }

  private LongCounter newCounter(String key) {
    String name = instrumentName(key);
    return meter.counterBuilder(name)
        .setUnit("1")
        .setDescription("conduit counter " + key)
        .build();
  }

  private LongHistogram newHistogram(String key) {
    String name = instrumentName(key);
    return meter.histogramBuilder(name)
        .ofLongs()
        .setUnit(unitFor(key))
        .setDescription("conduit observation " + key)
        .build();
  }

  static String unitFor(String key) {
    if (key.endsWith("Ms")) {
      return "ms";
    }
    if (key.startsWith("connection.bytes.")) {
      return "By";
    }
    return "1";
  }

  static String instrumentName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      result.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    String name = result.toString();
    if (!name.equals(key)) {
      log.debug("Instrument name for '{}' normalized to '{}'", key, name);
    }
    return name;
  }
}
