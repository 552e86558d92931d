package ca.gc.cra.conduit.application.connection;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.conduit.domain.connection.ConnectionStatistics;
import java.time.Instant;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class TrafficMeterTest {
  private static final long SECOND = TimeUnit.SECONDS.toNanos(1);
  private static final Instant SINCE = Instant.parse("2024-05-01T10:15:30Z");

  @Test
  void ratesAreBytesPerSecondSinceLastSample() {
    TrafficMeter meter = new TrafficMeter(SINCE, OptionalLong.of(42), 0);

    ConnectionStatistics first = meter.sample(4_000, 1_000, 2 * SECOND);

    assertEquals(4_000, first.bytesReceived());
    assertEquals(1_000, first.bytesSent());
    assertEquals(2_000, first.downloadRateBps());
    assertEquals(500, first.uploadRateBps());
    assertEquals(SINCE, first.connectedSince());
    assertEquals(OptionalLong.of(42), first.lastRoundtripMs());
  }

  @Test
  void largeIntervalDeltaDoesNotOverflow() {
    TrafficMeter meter = new TrafficMeter(SINCE, OptionalLong.empty(), 0);

    ConnectionStatistics burst = meter.sample(10_000_000_000L, 40_000_000_000L, 2 * SECOND);

    assertEquals(5_000_000_000L, burst.downloadRateBps());
    assertEquals(20_000_000_000L, burst.uploadRateBps());
  }

  @Test
  void idleIntervalReportsZeroRates() {
    TrafficMeter meter = new TrafficMeter(SINCE, OptionalLong.empty(), 0);
    meter.sample(500, 500, SECOND);

    ConnectionStatistics idle = meter.sample(500, 500, 2 * SECOND);

    assertEquals(0, idle.downloadRateBps());
    assertEquals(0, idle.uploadRateBps());
    assertEquals(0, meter.lastReceivedDelta());
    assertEquals(0, meter.lastSentDelta());
  }

  @Test
  void deltasTrackTheLatestInterval() {
    TrafficMeter meter = new TrafficMeter(SINCE, OptionalLong.empty(), 0);
    meter.sample(100, 10, SECOND);
    meter.sample(350, 30, 2 * SECOND);

    assertEquals(250, meter.lastReceivedDelta());
    assertEquals(20, meter.lastSentDelta());
  }

  @Test
  void zeroElapsedTimeDoesNotDivide() {
    TrafficMeter meter = new TrafficMeter(SINCE, OptionalLong.empty(), 5);
    ConnectionStatistics stats = meter.sample(100, 100, 5);
    assertEquals(0, stats.downloadRateBps());
  }
}
