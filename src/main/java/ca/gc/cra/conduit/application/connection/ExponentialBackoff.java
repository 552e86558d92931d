package ca.gc.cra.conduit.application.connection;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded exponential backoff: {@code min(60, 2^(attempt-1))} units.
 *
 * <p>The unit is one second in production; tests shrink it to keep schedules fast.</p>
 *
 * @since 0.1.0
 */
public final class ExponentialBackoff {
  /** Upper bound on the multiplier, reached from attempt 7 on. */
  public static final long MAX_DELAY_UNITS = 60;

  private final Duration unit;

  public ExponentialBackoff(Duration unit) {
    Objects.requireNonNull(unit, "unit");
    if (unit.isNegative() || unit.isZero()) {
      throw new IllegalArgumentException("unit must be positive");
    }
    this.unit = unit;
  }

  public static ExponentialBackoff seconds() {
    return new ExponentialBackoff(Duration.ofSeconds(1));
  }

  /**
   * Backoff multiplier for an attempt number; non-positive attempts count as the first.
   *
   * @param attempt one-based attempt number
   * @return delay in seconds (units)
   */
  public static long backoffDelaySeconds(int attempt) {
    int effective = Math.max(1, attempt);
    if (effective > 7) {
      return MAX_DELAY_UNITS;
    }
    return Math.min(MAX_DELAY_UNITS, 1L << (effective - 1));
  }

  /**
   * Delay before the given attempt.
   *
   * @param attempt one-based attempt number
   * @return delay in this backoff's unit
   */
  public Duration delay(int attempt) {
    return unit.multipliedBy(backoffDelaySeconds(attempt));
  }

  public Duration unit() {
    return unit;
  }
}
