package ca.gc.cra.conduit.application.connection;

import ca.gc.cra.conduit.application.port.Observable;
import ca.gc.cra.conduit.application.port.Subscription;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Always-current value holder with ordered fan-out to subscribers.
 *
 * <p>Publication and subscription share one monitor so a new subscriber sees the current value first and then every
 * later value in order. Equal consecutive values are not republished.</p>
 *
 * @param <T> value type
 */
final class StateObservable<T> implements Observable<T> {
  private static final Logger log = LoggerFactory.getLogger(StateObservable.class);

  private final List<Consumer<? super T>> listeners = new CopyOnWriteArrayList<>();
  private final AtomicReference<T> current;

  StateObservable(T initial) {
    this.current = new AtomicReference<>(Objects.requireNonNull(initial, "initial"));
  }

  @Override
  public T current() {
    return current.get();
  }

  @Override
  public Subscription subscribe(Consumer<? super T> listener) {
    Objects.requireNonNull(listener, "listener");
    synchronized (this) {
      listeners.add(listener);
      deliver(listener, current.get());
    }
    return () -> listeners.remove(listener);
  }

  /**
   * Replaces the current value and notifies subscribers on the calling thread.
   *
   * @param value new value
   * @return {@code true} when the value changed
   */
  synchronized boolean publish(T value) {
    Objects.requireNonNull(value, "value");
    if (value.equals(current.getAndSet(value))) {
      return false;
    }
    for (Consumer<? super T> listener : listeners) {
      deliver(listener, value);
    }
    return true;
  }

  private void deliver(Consumer<? super T> listener, T value) {
    try {
      listener.accept(value);
    } catch (RuntimeException ex) {
      log.warn("State listener {} failed for {}", listener, value, ex);
    }
  }
}
