package ca.gc.cra.conduit.application.connection;

import ca.gc.cra.conduit.application.port.MetricsPort;
import ca.gc.cra.conduit.application.port.NetworkMonitor;
import ca.gc.cra.conduit.application.port.Observable;
import ca.gc.cra.conduit.application.port.Subscription;
import ca.gc.cra.conduit.domain.connection.ConnectionState;
import ca.gc.cra.conduit.domain.connection.DisconnectCause;
import ca.gc.cra.conduit.domain.connection.ReconnectContext;
import ca.gc.cra.conduit.domain.net.NetworkEvent;
import ca.gc.cra.conduit.domain.net.NetworkHandle;
import ca.gc.cra.conduit.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Schedules reconnect attempts after retryable failures and reacts to host network changes.
 * <p><strong>Why:</strong> Mobile and laptop hosts lose networks routinely; the tunnel should come back on its own
 * until the user explicitly disconnects.</p>
 * <p><strong>Role:</strong> Observer of connection state and network events that talks to the connection manager
 * only through {@link ReconnectCommands}; it never owns a session.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe. Callbacks may arrive on any thread; context updates are guarded by
 * the instance monitor and retries run on a dedicated scheduler thread.</p>
 *
 * @since 0.1.0
 */
public final class ReconnectSupervisor implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ReconnectSupervisor.class);

  static final String METRIC_SCHEDULED = "reconnect.scheduled";
  static final String METRIC_DELAY = "reconnect.delayMs";
  static final String METRIC_NETWORK_TRIGGER = "reconnect.network.trigger";

  private final Observable<ConnectionState> states;
  private final NetworkMonitor network;
  private final ReconnectCommands commands;
  private final ExponentialBackoff backoff;
  private final MetricsPort metrics;
  private final ScheduledExecutorService scheduler;

  // Guarded by this.
  private ReconnectContext context = ReconnectContext.disarmed(false);
  private ScheduledFuture<?> pendingRetry;
  private ConnectionState lastState;
  private boolean networkDown;
  private NetworkHandle lastNetwork;
  private Subscription stateSubscription;
  private Subscription networkSubscription;

  public ReconnectSupervisor(
      Observable<ConnectionState> states,
      NetworkMonitor network,
      ReconnectCommands commands,
      ExponentialBackoff backoff,
      MetricsPort metrics) {
    this.states = Objects.requireNonNull(states, "states");
    this.network = network == null ? NetworkMonitor.NONE : network;
    this.commands = Objects.requireNonNull(commands, "commands");
    this.backoff = backoff == null ? ExponentialBackoff.seconds() : backoff;
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.scheduler = ExecutorFactories.newScheduler("conduit-reconnect");
  }

  /** Subscribes to state and network events. Idempotent. */
  public void start() {
    synchronized (this) {
      if (stateSubscription != null) {
        return;
      }
      lastNetwork = network.activeNetwork().orElse(null);
    }
    Subscription stateSub = states.subscribe(this::onState);
    Subscription networkSub = network.subscribe(this::onNetwork);
    synchronized (this) {
      stateSubscription = stateSub;
      networkSubscription = networkSub;
    }
  }

  /**
   * Arms the supervisor for a profile and resets the attempt counter.
   *
   * @param profileId profile to keep connected
   */
  public synchronized void enable(String profileId) {
    Objects.requireNonNull(profileId, "profileId");
    cancelPendingRetry();
    context = new ReconnectContext(0, false, Optional.of(profileId));
    log.info("Auto-reconnect armed for {}", profileId);
  }

  /** Disarms the supervisor; no retry is scheduled until {@link #enable(String)} is called again. */
  public synchronized void disable() {
    cancelPendingRetry();
    boolean wasArmed = context.armed();
    context = ReconnectContext.disarmed(true);
    if (wasArmed) {
      log.info("Auto-reconnect disarmed");
    }
  }

  public synchronized int attemptCount() {
    return context.attemptCount();
  }

  public synchronized ReconnectContext snapshot() {
    return context;
  }

  /** Whether a backoff retry is currently waiting to fire. */
  public synchronized boolean retryPending() {
    return pendingRetry != null && !pendingRetry.isDone();
  }

  @Override
  public void close() {
    Subscription stateSub;
    Subscription networkSub;
    synchronized (this) {
      cancelPendingRetry();
      stateSub = stateSubscription;
      networkSub = networkSubscription;
      stateSubscription = null;
      networkSubscription = null;
    }
    if (stateSub != null) {
      stateSub.close();
    }
    if (networkSub != null) {
      networkSub.close();
    }
    scheduler.shutdownNow();
  }

  void onState(ConnectionState state) {
    synchronized (this) {
      lastState = state;
      if (state instanceof ConnectionState.Error error) {
        onError(error);
      } else if (state instanceof ConnectionState.Connected) {
        if (context.attemptCount() > 0) {
          log.info("Reconnected after {} attempt(s)", context.attemptCount());
        }
        cancelPendingRetry();
        context = new ReconnectContext(0, context.manualDisconnect(), context.armedProfileId());
      } else if (state instanceof ConnectionState.Disconnected disconnected
          && disconnected.cause() == DisconnectCause.USER) {
        disable();
      }
    }
  }

  // Requires this.
  private void onError(ConnectionState.Error error) {
    if (!context.armed()) {
      log.debug("Not retrying {}: supervisor disarmed", error.failure());
      return;
    }
    String armedId = context.armedProfileId().orElseThrow();
    if (error.profileId().isPresent() && !error.profileId().get().equals(armedId)) {
      log.debug("Ignoring failure for {}; armed for {}", error.profileId().get(), armedId);
      return;
    }
    if (!error.failure().retryable()) {
      log.warn("Not retrying {}: {} failures are not retryable", armedId, error.failure());
      return;
    }
    int attempt = context.attemptCount() + 1;
    context = new ReconnectContext(attempt, false, context.armedProfileId());
    Duration delay = backoff.delay(attempt);
    cancelPendingRetry();
    try {
      pendingRetry = scheduler.schedule(() -> fireRetry(armedId), delay.toMillis(), TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException ex) {
      log.debug("Retry for {} rejected; supervisor closed", armedId);
      return;
    }
    metrics.increment(METRIC_SCHEDULED);
    metrics.observe(METRIC_DELAY, delay.toMillis());
    if (context.failedRepeatedly()) {
      log.warn("Connection to {} failed {} times; retrying in {} ms", armedId, attempt, delay.toMillis());
    } else {
      log.info("Reconnect attempt {} for {} in {} ms", attempt, armedId, delay.toMillis());
    }
  }

  private void fireRetry(String profileId) {
    synchronized (this) {
      pendingRetry = null;
      if (!context.armed() || !context.armedProfileId().orElse("").equals(profileId)) {
        return;
      }
    }
    commands.reconnect(profileId);
  }

  void onNetwork(NetworkEvent event) {
    String reconnectNow = null;
    String restart = null;
    synchronized (this) {
      if (event instanceof NetworkEvent.Lost || event instanceof NetworkEvent.Unavailable) {
        networkDown = true;
        log.info("Network unavailable");
      } else if (event instanceof NetworkEvent.Available available) {
        NetworkHandle previous = lastNetwork;
        lastNetwork = available.handle();
        boolean recovered = networkDown;
        networkDown = false;
        if (context.armed()) {
          String armedId = context.armedProfileId().orElseThrow();
          if (recovered && !(lastState instanceof ConnectionState.Connected)) {
            cancelPendingRetry();
            reconnectNow = armedId;
          } else if (lastState instanceof ConnectionState.Connected
              && previous != null
              && !previous.equals(available.handle())) {
            restart = armedId;
          }
        }
      } else if (event instanceof NetworkEvent.Changed changed) {
        log.debug("Network capabilities changed (wifi={}, cellular={})", changed.wifi(), changed.cellular());
      }
    }
    if (reconnectNow != null) {
      log.info("Network available again; reconnecting {} now", reconnectNow);
      metrics.increment(METRIC_NETWORK_TRIGGER);
      commands.reconnect(reconnectNow);
    } else if (restart != null) {
      String id = restart;
      log.info("Active network changed; restarting {}", id);
      metrics.increment(METRIC_NETWORK_TRIGGER);
      try {
        scheduler.schedule(() -> commands.restart(id), backoff.unit().toMillis(), TimeUnit.MILLISECONDS);
      } catch (RejectedExecutionException ex) {
        log.debug("Restart for {} rejected; supervisor closed", id);
      }
    }
  }

  // Requires this.
  private void cancelPendingRetry() {
    if (pendingRetry != null) {
      pendingRetry.cancel(false);
      pendingRetry = null;
    }
  }
}
