package ca.gc.cra.conduit.application.connection;

import ca.gc.cra.conduit.application.port.ClockPort;
import ca.gc.cra.conduit.application.port.CredentialVault;
import ca.gc.cra.conduit.application.port.MetricsPort;
import ca.gc.cra.conduit.application.port.NetworkMonitor;
import ca.gc.cra.conduit.application.port.Observable;
import ca.gc.cra.conduit.application.port.ProfileStore;
import ca.gc.cra.conduit.application.port.ProtocolSession;
import ca.gc.cra.conduit.application.port.SessionException;
import ca.gc.cra.conduit.application.port.SessionFactory;
import ca.gc.cra.conduit.application.port.TransportSettings;
import ca.gc.cra.conduit.application.port.VaultException;
import ca.gc.cra.conduit.domain.connection.ConnectionFailure;
import ca.gc.cra.conduit.domain.connection.ConnectionState;
import ca.gc.cra.conduit.domain.connection.ConnectionStatistics;
import ca.gc.cra.conduit.domain.connection.DisconnectCause;
import ca.gc.cra.conduit.domain.profile.Credential;
import ca.gc.cra.conduit.domain.profile.Profile;
import ca.gc.cra.conduit.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.conduit.logging.Logs;
import ca.gc.cra.conduit.validation.Strings;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Owns the single active {@link ProtocolSession} and the current {@link ConnectionState}.
 * <p><strong>Why:</strong> Callers, the tunnel relay and the reconnect supervisor all need one serialized view of the
 * connection lifecycle, with statistics sampled off the data path.</p>
 * <p><strong>Role:</strong> Application service driving session ports and publishing state to observers.</p>
 * <p><strong>Thread-safety:</strong> All public methods are thread-safe. Connect attempts run on a dedicated
 * lifecycle thread; {@link #disconnect()} runs on the caller thread so it can abort a blocked handshake. Every state
 * publication happens under {@code sessionLock} after a generation check, so a superseded attempt can never publish.
 * State listeners run on the publishing thread and must not block.</p>
 *
 * @since 0.1.0
 */
public final class ConnectionManager implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

  /** MDC key carrying the profile id around lifecycle work. */
  public static final String MDC_PROFILE_ID = "profileId";
  /** Default statistics sampling cadence. */
  public static final Duration DEFAULT_STATS_INTERVAL = Duration.ofSeconds(2);

  static final String METRIC_CONNECT_ATTEMPT = "connection.connect.attempt";
  static final String METRIC_CONNECT_SUCCESS = "connection.connect.success";
  static final String METRIC_CONNECT_FAILURE = "connection.connect.failure";
  static final String METRIC_HANDSHAKE_LATENCY = "connection.handshake.latencyMs";
  static final String METRIC_BYTES_SENT = "connection.bytes.sent";
  static final String METRIC_BYTES_RECEIVED = "connection.bytes.received";

  private final ProfileStore profiles;
  private final CredentialVault vault;
  private final SessionFactory sessions;
  private final NetworkMonitor network;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final TransportSettings settings;
  private final Duration statsInterval;
  private final StateObservable<ConnectionState> state =
      new StateObservable<>(new ConnectionState.Disconnected(DisconnectCause.INITIAL));
  private final ExecutorService lifecycle;
  private final ScheduledExecutorService sampler;
  private final ReconnectCommands commands = new CommandChannel();

  private final Object sessionLock = new Object();
  // Guarded by sessionLock.
  private ProtocolSession session;
  private long generation;
  private ScheduledFuture<?> samplingTask;
  private boolean closed;

  public ConnectionManager(
      ProfileStore profiles,
      CredentialVault vault,
      SessionFactory sessions,
      NetworkMonitor network,
      MetricsPort metrics,
      ClockPort clock,
      TransportSettings settings,
      Duration statsInterval) {
    this.profiles = Objects.requireNonNull(profiles, "profiles");
    this.vault = Objects.requireNonNull(vault, "vault");
    this.sessions = Objects.requireNonNull(sessions, "sessions");
    this.network = network == null ? NetworkMonitor.NONE : network;
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.clock = clock == null ? ClockPort.SYSTEM : clock;
    this.settings = settings == null ? TransportSettings.defaults() : settings;
    this.statsInterval = statsInterval == null ? DEFAULT_STATS_INTERVAL : statsInterval;
    if (this.statsInterval.isNegative() || this.statsInterval.isZero()) {
      throw new IllegalArgumentException("statsInterval must be positive");
    }
    this.lifecycle = ExecutorFactories.newSerialExecutor("conduit-lifecycle");
    this.sampler = ExecutorFactories.newScheduler("conduit-stats");
  }

  /** Always-current view of the connection state. */
  public Observable<ConnectionState> states() {
    return state;
  }

  /** Command sink handed to the reconnect supervisor. */
  public ReconnectCommands commandChannel() {
    return commands;
  }

  /**
   * Latest statistics sample; empty unless connected. Never blocks.
   *
   * @return statistics of the current connection
   */
  public Optional<ConnectionStatistics> getStatistics() {
    ConnectionState current = state.current();
    if (current instanceof ConnectionState.Connected connected) {
      return Optional.of(connected.statistics());
    }
    return Optional.empty();
  }

  /**
   * Starts connecting to a profile on the lifecycle thread.
   *
   * <p>The returned future completes normally once {@code Connected} is published, exceptionally with a
   * {@link ConnectionException} when the attempt ends in {@code Error}, exceptionally with
   * {@link IllegalStateException} when the manager is busy, and is cancelled when {@link #disconnect()} supersedes
   * the attempt.</p>
   *
   * @param profileId profile to connect
   * @return completion of this attempt
   */
  public CompletableFuture<Void> connectAsync(String profileId) {
    String id;
    try {
      id = Strings.requireNonBlank("profileId", profileId);
    } catch (IllegalArgumentException ex) {
      return CompletableFuture.failedFuture(ex);
    }
    CompletableFuture<Void> result = new CompletableFuture<>();
    long attempt;
    synchronized (sessionLock) {
      if (closed) {
        return CompletableFuture.failedFuture(new IllegalStateException("Connection manager is closed"));
      }
      ConnectionState current = state.current();
      if (isBusy(current)) {
        return CompletableFuture.failedFuture(new IllegalStateException(
            "Cannot connect " + id + " while " + current.phase()
                + current.profileId().map(p -> " (" + p + ")").orElse("")));
      }
      attempt = ++generation;
      state.publish(new ConnectionState.Connecting(id));
    }
    try {
      lifecycle.execute(() -> runConnect(id, attempt, result));
    } catch (RejectedExecutionException ex) {
      fail(id, attempt, result, ConnectionFailure.INTERNAL, "Lifecycle executor rejected connect", ex);
    }
    return result;
  }

  /**
   * Connects and waits for the outcome.
   *
   * @param profileId profile to connect
   * @throws ConnectionException when the attempt ends in {@code Error} or is superseded by a disconnect
   * @throws IllegalStateException when a connection is already active or in progress
   */
  public void connect(String profileId) throws ConnectionException {
    try {
      connectAsync(profileId).join();
    } catch (CancellationException ex) {
      throw new ConnectionException(ConnectionFailure.INTERNAL, "Connect to " + profileId + " was cancelled", ex);
    } catch (CompletionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof ConnectionException connectionException) {
        throw connectionException;
      }
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new ConnectionException(ConnectionFailure.INTERNAL, "Connect failed: " + cause, cause);
    }
  }

  /**
   * Tears down the active or in-flight session and publishes {@code Disconnected(USER)}.
   *
   * <p>Always succeeds. An in-flight handshake is aborted by closing its session from this thread.</p>
   */
  public void disconnect() {
    teardown(DisconnectCause.USER, null);
  }

  /**
   * Sends payload bytes through the active session.
   *
   * @throws ConnectionException when not connected or when the session fails; a session failure moves the state to
   *     {@code Error}
   */
  public void forward(byte[] data, int offset, int length) throws ConnectionException {
    Active active = requireActive();
    try {
      active.session().forward(data, offset, length);
    } catch (SessionException ex) {
      dropSession(active, ex);
      throw new ConnectionException(ex.failure(), ex.getMessage(), ex);
    }
  }

  /**
   * Receives payload bytes from the active session.
   *
   * @return bytes read; {@code 0} when the read timed out with the session still healthy
   * @throws ConnectionException when not connected or when the session fails
   */
  public int pull(byte[] buffer) throws ConnectionException {
    Active active = requireActive();
    try {
      return active.session().pull(buffer);
    } catch (SessionException ex) {
      dropSession(active, ex);
      throw new ConnectionException(ex.failure(), ex.getMessage(), ex);
    }
  }

  @Override
  public void close() {
    teardown(DisconnectCause.USER, null);
    synchronized (sessionLock) {
      closed = true;
    }
    lifecycle.shutdownNow();
    sampler.shutdownNow();
    try {
      if (!lifecycle.awaitTermination(2, TimeUnit.SECONDS)) {
        log.warn("Lifecycle executor did not terminate within 2s");
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }

  private void runConnect(String id, long attempt, CompletableFuture<Void> result) {
    String previous = MDC.get(MDC_PROFILE_ID);
    MDC.put(MDC_PROFILE_ID, id);
    try {
      metrics.increment(METRIC_CONNECT_ATTEMPT);
      Optional<Profile> resolved = profiles.getProfile(id);
      if (resolved.isEmpty()) {
        fail(id, attempt, result, ConnectionFailure.PROFILE, "Profile not found: " + id, null);
        return;
      }
      Profile profile = resolved.get();
      Credential credential;
      try {
        credential = vault.getCredential(id);
      } catch (VaultException ex) {
        fail(id, attempt, result, ConnectionFailure.CREDENTIAL,
            "Credential unavailable for " + id + ": " + ex.getMessage(), ex);
        return;
      }
      TransportSettings effective = settings.withNetwork(network.activeNetwork().orElse(null));
      ProtocolSession candidate = sessions.create(profile, effective);
      synchronized (sessionLock) {
        if (generation != attempt) {
          candidate.close();
          result.cancel(false);
          return;
        }
        session = candidate;
      }
      log.info("Connecting to {} via {}", profile.endpoint().authority(), profile.transport().kind());
      long started = clock.monotonicNanos();
      candidate.connect(profile.endpoint(), credential, profile.transport());
      long handshakeMs = TimeUnit.NANOSECONDS.toMillis(clock.monotonicNanos() - started);
      synchronized (sessionLock) {
        if (generation != attempt || session != candidate) {
          candidate.close();
          result.cancel(false);
          return;
        }
        Instant since = Instant.ofEpochMilli(clock.nowMillis());
        startSampling(id, candidate, since, attempt);
        state.publish(new ConnectionState.Connected(id, ConnectionStatistics.initial(since, candidate.roundtripMs())));
      }
      metrics.increment(METRIC_CONNECT_SUCCESS);
      metrics.observe(METRIC_HANDSHAKE_LATENCY, handshakeMs);
      log.info("Connected to {} in {} ms", profile.endpoint().authority(), handshakeMs);
      result.complete(null);
    } catch (SessionException ex) {
      fail(id, attempt, result, ex.failure(), ex.getMessage(), ex);
    } catch (RuntimeException ex) {
      fail(id, attempt, result, ConnectionFailure.INTERNAL, "Unexpected connect failure: " + ex.getMessage(), ex);
    } finally {
      if (previous == null) {
        MDC.remove(MDC_PROFILE_ID);
      } else {
        MDC.put(MDC_PROFILE_ID, previous);
      }
    }
  }

  private void fail(
      String id,
      long attempt,
      CompletableFuture<Void> result,
      ConnectionFailure failure,
      String reason,
      Throwable cause) {
    ProtocolSession stale = null;
    boolean current;
    synchronized (sessionLock) {
      current = generation == attempt;
      if (current) {
        stale = session;
        session = null;
        stopSampling();
        state.publish(new ConnectionState.Error(id, reason, failure));
      }
    }
    if (stale != null) {
      stale.close();
    }
    if (!current) {
      log.debug("Connect attempt for {} superseded: {}", id, Logs.redactCredentials(reason));
      result.cancel(false);
      return;
    }
    metrics.increment(METRIC_CONNECT_FAILURE);
    log.warn("Connect to {} failed ({}): {}", id, failure, Logs.redactCredentials(reason));
    result.completeExceptionally(new ConnectionException(failure, reason, cause));
  }

  /**
   * Closes the current session and publishes {@code Disconnecting} then {@code Disconnected(cause)}.
   *
   * @param requiredProfileId when non-null, only tear down if connected to this profile
   * @return whether a teardown happened
   */
  private boolean teardown(DisconnectCause cause, String requiredProfileId) {
    ProtocolSession toClose;
    long attempt;
    synchronized (sessionLock) {
      ConnectionState current = state.current();
      if (requiredProfileId != null
          && !(current instanceof ConnectionState.Connected connected && connected.id().equals(requiredProfileId))) {
        return false;
      }
      attempt = ++generation;
      toClose = session;
      session = null;
      stopSampling();
      if (current.phase() == ConnectionState.Phase.CONNECTING || current.phase() == ConnectionState.Phase.CONNECTED) {
        state.publish(new ConnectionState.Disconnecting(current.profileId().orElseThrow()));
      }
    }
    if (toClose != null) {
      toClose.close();
    }
    synchronized (sessionLock) {
      if (generation == attempt) {
        state.publish(new ConnectionState.Disconnected(cause));
      }
    }
    log.info("Disconnected ({})", cause);
    return true;
  }

  private Active requireActive() throws ConnectionException {
    synchronized (sessionLock) {
      ConnectionState current = state.current();
      if (session == null || !(current instanceof ConnectionState.Connected connected)) {
        throw new ConnectionException(ConnectionFailure.TRANSPORT, "Not connected");
      }
      return new Active(session, connected.id(), generation);
    }
  }

  private void dropSession(Active active, SessionException ex) {
    boolean dropped = false;
    synchronized (sessionLock) {
      if (generation == active.generation() && session == active.session()) {
        session = null;
        stopSampling();
        state.publish(new ConnectionState.Error(active.profileId(), ex.getMessage(), ex.failure()));
        dropped = true;
      }
    }
    if (dropped) {
      active.session().close();
      log.warn("Session for {} failed ({}): {}", active.profileId(), ex.failure(), ex.getMessage());
    }
  }

  // Requires sessionLock.
  private void startSampling(String id, ProtocolSession sampled, Instant since, long attempt) {
    stopSampling();
    TrafficMeter meter = new TrafficMeter(since, sampled.roundtripMs(), clock.monotonicNanos());
    long periodMillis = statsInterval.toMillis();
    samplingTask = sampler.scheduleAtFixedRate(
        () -> sample(id, sampled, meter, attempt), periodMillis, periodMillis, TimeUnit.MILLISECONDS);
  }

  // Requires sessionLock.
  private void stopSampling() {
    if (samplingTask != null) {
      samplingTask.cancel(false);
      samplingTask = null;
    }
  }

  private void sample(String id, ProtocolSession sampled, TrafficMeter meter, long attempt) {
    ConnectionStatistics statistics =
        meter.sample(sampled.bytesReceived(), sampled.bytesSent(), clock.monotonicNanos());
    synchronized (sessionLock) {
      if (generation != attempt || session != sampled) {
        return;
      }
      state.publish(new ConnectionState.Connected(id, statistics));
    }
    if (meter.lastSentDelta() > 0) {
      metrics.observe(METRIC_BYTES_SENT, meter.lastSentDelta());
    }
    if (meter.lastReceivedDelta() > 0) {
      metrics.observe(METRIC_BYTES_RECEIVED, meter.lastReceivedDelta());
    }
  }

  private static boolean isBusy(ConnectionState current) {
    return switch (current.phase()) {
      case CONNECTING, CONNECTED, DISCONNECTING -> true;
      case DISCONNECTED, ERROR -> false;
    };
  }

  private record Active(ProtocolSession session, String profileId, long generation) {}

  private final class CommandChannel implements ReconnectCommands {
    @Override
    public void reconnect(String profileId) {
      ConnectionState current = state.current();
      if (current instanceof ConnectionState.Disconnected disconnected
          && disconnected.cause() == DisconnectCause.USER) {
        log.debug("Ignoring reconnect for {} after user disconnect", profileId);
        return;
      }
      connectAsync(profileId).whenComplete((ignored, ex) -> {
        if (ex != null) {
          log.debug("Reconnect for {} did not connect: {}", profileId, ex.toString());
        }
      });
    }

    @Override
    public void restart(String profileId) {
      try {
        lifecycle.execute(() -> {
          if (teardown(DisconnectCause.NETWORK_CHANGE, profileId)) {
            reconnect(profileId);
          } else {
            log.debug("Skipping restart for {}; not connected to it", profileId);
          }
        });
      } catch (RejectedExecutionException ex) {
        log.debug("Restart for {} rejected; manager closed", profileId);
      }
    }
  }
}
