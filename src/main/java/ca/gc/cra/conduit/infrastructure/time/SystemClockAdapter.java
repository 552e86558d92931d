package ca.gc.cra.conduit.infrastructure.time;

import ca.gc.cra.conduit.application.port.ClockPort;

/**
 * {@link ClockPort} backed by the JVM wall clock and {@link System#nanoTime()}.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  public SystemClockAdapter() {}

  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }

  @Override
  public long monotonicNanos() {
    return System.nanoTime();
  }
}
