package ca.gc.cra.conduit.application.port;

/**
 * <strong>What:</strong> Port abstracting conduit metrics emission.
 * <p><strong>Why:</strong> Lets the connection manager and reconnect supervisor record counters and latencies
 * without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose counter increments for events like connect attempts or scheduled retries.</li>
 *   <li>Record numeric observations for handshake latency, byte counts or backoff delays.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from lifecycle, relay and
 * supervisor threads.</p>
 * <p><strong>Performance:</strong> Calls should be non-blocking and amortized O(1).</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code connection.handshake.latencyMs}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code connection.connect.attempt}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (e.g., milliseconds, bytes)
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
