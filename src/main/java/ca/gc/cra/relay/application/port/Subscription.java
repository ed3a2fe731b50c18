package ca.gc.cra.relay.application.port;

/**
 * Handle for an active subscription. Closing stops intake, waits briefly for in-flight
 * handlers, and releases transport resources.
 *
 * @since 0.1.0
 */
public interface Subscription extends AutoCloseable {
  /** Source destination this subscription consumes. */
  String source();

  /** Number of delivered but not yet acknowledged messages. */
  int inFlight();

  /** {@code true} until {@link #close()} is called. */
  boolean isActive();

  @Override
  void close();
}
