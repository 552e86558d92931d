package ca.gc.cra.conduit.domain.connection;

import java.util.Optional;

/**
 * Immutable snapshot of the reconnect supervisor's bookkeeping.
 *
 * @param attemptCount retries scheduled since the supervisor was armed or last saw a successful connect
 * @param manualDisconnect whether the user disconnected explicitly
 * @param armedProfileId profile the supervisor reconnects, empty when disarmed
 * @since 0.1.0
 */
public record ReconnectContext(int attemptCount, boolean manualDisconnect, Optional<String> armedProfileId) {
  /** Attempt count at which the supervisor reports repeated failure. Retries continue regardless. */
  public static final int REPEATED_FAILURE_THRESHOLD = 5;

  public ReconnectContext {
    if (attemptCount < 0) {
      throw new IllegalArgumentException("attemptCount must be >= 0");
    }
    armedProfileId = armedProfileId == null ? Optional.empty() : armedProfileId;
  }

  /**
   * Disarmed context.
   *
   * @param manualDisconnect whether disarming was user initiated
   * @return context with no armed profile
   */
  public static ReconnectContext disarmed(boolean manualDisconnect) {
    return new ReconnectContext(0, manualDisconnect, Optional.empty());
  }

  /**
   * Whether the supervisor is armed.
   *
   * @return {@code true} when a profile is armed and the user has not disconnected
   */
  public boolean armed() {
    return armedProfileId.isPresent() && !manualDisconnect;
  }

  /**
   * Whether enough attempts have failed to warn the user. Informational only.
   *
   * @return {@code true} at or beyond {@link #REPEATED_FAILURE_THRESHOLD}
   */
  public boolean failedRepeatedly() {
    return attemptCount >= REPEATED_FAILURE_THRESHOLD;
  }
}
