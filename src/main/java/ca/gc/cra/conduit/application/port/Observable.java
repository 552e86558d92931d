package ca.gc.cra.conduit.application.port;

import java.util.function.Consumer;

/**
 * Single-value, always-current subscription.
 *
 * <p>Subscribers receive the current value immediately on subscription and every subsequent value in publication
 * order.</p>
 *
 * @param <T> value type
 * @since 0.1.0
 */
public interface Observable<T> {
  /**
   * Returns the current value without blocking.
   *
   * @return current value, never {@code null}
   */
  T current();

  /**
   * Registers a listener.
   *
   * @param listener callback invoked on the publishing thread; must not block
   * @return handle that unregisters the listener
   */
  Subscription subscribe(Consumer<? super T> listener);
}
