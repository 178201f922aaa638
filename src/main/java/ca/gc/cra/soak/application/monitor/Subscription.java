package ca.gc.cra.soak.application.monitor;

/**
 * Handle returned by a subscribe call; {@link #unsubscribe()} removes the callback. Idempotent.
 *
 * @since SOAK 0.1
 */
@FunctionalInterface
public interface Subscription {
  void unsubscribe();
}
