package ca.gc.cra.relay.application.port;

import ca.gc.cra.relay.domain.envelope.Envelope;

/**
 * <strong>What:</strong> Publish/subscribe primitives over the durable message bus.
 * <p><strong>Why:</strong> Isolates the invocation protocol from the concrete broker.</p>
 * <p><strong>Role:</strong> Port implemented by {@code KafkaTransportAdapter} and
 * {@code InMemoryTransportAdapter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>At-least-once publishing with bounded, backed-off retries of transient failures.</li>
 *   <li>Concurrent delivery to a bounded worker pool, acknowledging only after successful handling.</li>
 *   <li>Flow-control credits bounding unacknowledged in-flight messages.</li>
 *   <li>Isolating malformed messages so a subscription loop never stops on one.</li>
 * </ul>
 * <p><strong>Ordering:</strong> None guaranteed across workers or redeliveries.</p>
 *
 * @since 0.1.0
 */
public interface TransportPort extends AutoCloseable {
  /**
   * Publishes an envelope, returning once the bus has durably accepted it.
   *
   * @param destination destination name
   * @param envelope envelope to publish
   * @throws ca.gc.cra.relay.domain.error.TransportException when retries are exhausted
   */
  void publish(String destination, Envelope envelope);

  /**
   * Starts consuming a source.
   *
   * @param source destination to consume
   * @param handler callback invoked for each decoded envelope
   * @param concurrency number of handler workers; must be positive
   * @return handle used to stop consuming
   */
  Subscription subscribe(String source, EnvelopeHandler handler, int concurrency);

  @Override
  void close();
}
