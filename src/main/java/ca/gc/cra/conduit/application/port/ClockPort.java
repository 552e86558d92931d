package ca.gc.cra.conduit.application.port;

/**
 * <strong>What:</strong> Port supplying time to the connection manager and statistics sampler.
 * <p><strong>Why:</strong> Rate computation and handshake timing need a clock tests can control.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.conduit.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Returns a monotonic timestamp for measuring intervals.
   *
   * @return nanoseconds from an arbitrary origin
   */
  default long monotonicNanos() {
    return System.nanoTime();
  }

  /**
   * Default {@link ClockPort} using {@link System#currentTimeMillis()}.
   */
  ClockPort SYSTEM = System::currentTimeMillis;
}
