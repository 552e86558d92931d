package ca.gc.cra.conduit.application.connection;

import ca.gc.cra.conduit.domain.connection.ConnectionStatistics;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;

/**
 * Turns monotonically increasing byte counters into {@link ConnectionStatistics} samples.
 *
 * <p>Rates are computed over the interval since the previous sample. Not thread-safe; the manager samples from one
 * scheduler thread.</p>
 *
 * @since 0.1.0
 */
public final class TrafficMeter {
  private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

  private final Instant connectedSince;
  private final OptionalLong roundtripMs;
  private long lastReceived;
  private long lastSent;
  private long lastNanos;
  private long lastReceivedDelta;
  private long lastSentDelta;

  public TrafficMeter(Instant connectedSince, OptionalLong roundtripMs, long startNanos) {
    this.connectedSince = Objects.requireNonNull(connectedSince, "connectedSince");
    this.roundtripMs = roundtripMs == null ? OptionalLong.empty() : roundtripMs;
    this.lastNanos = startNanos;
  }

  /**
   * Records the counters at {@code nowNanos} and returns the resulting snapshot.
   *
   * @param bytesReceived total bytes received so far
   * @param bytesSent total bytes sent so far
   * @param nowNanos monotonic timestamp
   * @return statistics with rates over the elapsed interval
   */
  public ConnectionStatistics sample(long bytesReceived, long bytesSent, long nowNanos) {
    lastReceivedDelta = Math.max(0, bytesReceived - lastReceived);
    lastSentDelta = Math.max(0, bytesSent - lastSent);
    long elapsedNanos = nowNanos - lastNanos;
    long downloadRate = rate(lastReceivedDelta, elapsedNanos);
    long uploadRate = rate(lastSentDelta, elapsedNanos);
    lastReceived = bytesReceived;
    lastSent = bytesSent;
    lastNanos = nowNanos;
    return new ConnectionStatistics(
        bytesReceived, bytesSent, downloadRate, uploadRate, connectedSince, roundtripMs);
  }

  public long lastReceivedDelta() {
    return lastReceivedDelta;
  }

  public long lastSentDelta() {
    return lastSentDelta;
  }

  private static long rate(long deltaBytes, long elapsedNanos) {
    if (elapsedNanos <= 0 || deltaBytes == 0) {
      return 0;
    }
    long perSecond = TimeUnit.SECONDS.toNanos(1);
    long scaled = deltaBytes * perSecond;
    if (Math.multiplyHigh(deltaBytes, perSecond) == 0 && scaled >= 0) {
      return scaled / elapsedNanos;
    }
    // More than ~9.2 GB in one interval overflows the nanosecond product.
    BigInteger exact = BigInteger.valueOf(deltaBytes)
        .multiply(BigInteger.valueOf(perSecond))
        .divide(BigInteger.valueOf(elapsedNanos));
    return exact.min(LONG_MAX).longValue();
  }
}
