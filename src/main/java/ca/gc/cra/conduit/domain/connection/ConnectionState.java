package ca.gc.cra.conduit.domain.connection;

import ca.gc.cra.conduit.logging.Logs;
import ca.gc.cra.conduit.validation.Strings;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> The single current state of the tunnel connection.
 * <p><strong>Why:</strong> One immutable value is published per transition, so observers never see a half-updated
 * state. The sealed hierarchy makes every consumer switch over the full set of variants.</p>
 * <p><strong>Role:</strong> Published by the connection manager; read by the UI collaborator and the reconnect
 * supervisor.</p>
 * <p><strong>Thread-safety:</strong> All variants are immutable records.</p>
 *
 * @since 0.1.0
 */
public sealed interface ConnectionState
    permits ConnectionState.Disconnected,
        ConnectionState.Connecting,
        ConnectionState.Connected,
        ConnectionState.Disconnecting,
        ConnectionState.Error {

  /** Enumerable tag for exhaustive switch expressions over states. */
  enum Phase {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    DISCONNECTING,
    ERROR
  }

  /**
   * Returns the variant tag.
   *
   * @return phase of this state
   */
  Phase phase();

  /**
   * Returns the profile the state refers to, if any.
   *
   * @return profile id
   */
  Optional<String> profileId();

  /**
   * Initial state and the end of every cycle.
   *
   * @param cause why the connection is down
   */
  record Disconnected(DisconnectCause cause) implements ConnectionState {
    public Disconnected {
      Objects.requireNonNull(cause, "cause");
    }

    @Override
    public Phase phase() {
      return Phase.DISCONNECTED;
    }

    @Override
    public Optional<String> profileId() {
      return Optional.empty();
    }
  }

  /**
   * Handshake in progress.
   *
   * @param id profile being connected
   */
  record Connecting(String id) implements ConnectionState {
    public Connecting {
      id = Strings.requireNonBlank("profileId", id);
    }

    @Override
    public Phase phase() {
      return Phase.CONNECTING;
    }

    @Override
    public Optional<String> profileId() {
      return Optional.of(id);
    }
  }

  /**
   * Tunnel established.
   *
   * @param id connected profile
   * @param statistics most recent statistics sample
   */
  record Connected(String id, ConnectionStatistics statistics) implements ConnectionState {
    public Connected {
      id = Strings.requireNonBlank("profileId", id);
      Objects.requireNonNull(statistics, "statistics");
    }

    @Override
    public Phase phase() {
      return Phase.CONNECTED;
    }

    @Override
    public Optional<String> profileId() {
      return Optional.of(id);
    }
  }

  /**
   * Local teardown in progress.
   *
   * @param id profile being torn down
   */
  record Disconnecting(String id) implements ConnectionState {
    public Disconnecting {
      id = Strings.requireNonBlank("profileId", id);
    }

    @Override
    public Phase phase() {
      return Phase.DISCONNECTING;
    }

    @Override
    public Optional<String> profileId() {
      return Optional.of(id);
    }
  }

  /**
   * Connection failed or dropped.
   *
   * <p>The reason is redacted when the state is built so a credential can never reach an observer.</p>
   *
   * @param id profile that failed, {@code null} when the failure preceded profile resolution
   * @param reason human-readable reason
   * @param failure failure class driving retry decisions
   */
  record Error(String id, String reason, ConnectionFailure failure) implements ConnectionState {
    public Error {
      reason = Logs.redactCredentials(reason == null || reason.isBlank() ? "unknown error" : reason);
      Objects.requireNonNull(failure, "failure");
    }

    @Override
    public Phase phase() {
      return Phase.ERROR;
    }

    @Override
    public Optional<String> profileId() {
      return Optional.ofNullable(id);
    }
  }
}
