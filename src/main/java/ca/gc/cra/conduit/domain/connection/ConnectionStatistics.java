package ca.gc.cra.conduit.domain.connection;

import java.time.Instant;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Snapshot of traffic counters and derived rates for the active connection.
 *
 * <p>Produced only by the connection manager's sampler; callers treat it as read-only.</p>
 *
 * @param bytesReceived total payload bytes received since connect
 * @param bytesSent total payload bytes sent since connect
 * @param downloadRateBps receive rate over the last sampling window, bytes per second
 * @param uploadRateBps send rate over the last sampling window, bytes per second
 * @param connectedSince instant the handshake completed
 * @param lastRoundtripMs handshake round trip, when measured
 * @since 0.1.0
 */
public record ConnectionStatistics(
    long bytesReceived,
    long bytesSent,
    long downloadRateBps,
    long uploadRateBps,
    Instant connectedSince,
    OptionalLong lastRoundtripMs) {

  public ConnectionStatistics {
    if (bytesReceived < 0 || bytesSent < 0 || downloadRateBps < 0 || uploadRateBps < 0) {
      throw new IllegalArgumentException("statistics counters must be non-negative");
    }
    Objects.requireNonNull(connectedSince, "connectedSince");
    lastRoundtripMs = lastRoundtripMs == null ? OptionalLong.empty() : lastRoundtripMs;
  }

  /**
   * Statistics for a connection that has just completed its handshake.
   *
   * @param connectedSince handshake completion instant
   * @param roundtripMs handshake round trip
   * @return zeroed statistics
   */
  public static ConnectionStatistics initial(Instant connectedSince, OptionalLong roundtripMs) {
    return new ConnectionStatistics(0, 0, 0, 0, connectedSince, roundtripMs);
  }
}
