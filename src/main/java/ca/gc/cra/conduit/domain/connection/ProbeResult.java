package ca.gc.cra.conduit.domain.connection;

import ca.gc.cra.conduit.logging.Logs;
import java.util.Optional;

/**
 * Outcome of a one-off connectivity probe against a profile.
 *
 * @param success whether the handshake completed
 * @param latencyMs handshake duration in milliseconds; {@code -1} on failure
 * @param errorMessage redacted failure reason, empty on success
 * @since 0.1.0
 */
public record ProbeResult(boolean success, long latencyMs, Optional<String> errorMessage) {
  public ProbeResult {
    errorMessage = errorMessage == null ? Optional.empty() : errorMessage.map(Logs::redactCredentials);
  }

  public static ProbeResult ok(long latencyMs) {
    return new ProbeResult(true, latencyMs, Optional.empty());
  }

  public static ProbeResult failed(String reason) {
    return new ProbeResult(false, -1, Optional.of(reason == null ? "unknown error" : reason));
  }
}
