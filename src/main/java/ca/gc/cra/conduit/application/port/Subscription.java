package ca.gc.cra.conduit.application.port;

/**
 * Handle returned by subscriptions; closing it stops delivery. Idempotent.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {
  @Override
  void close();
}
