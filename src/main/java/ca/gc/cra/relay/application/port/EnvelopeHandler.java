package ca.gc.cra.relay.application.port;

import ca.gc.cra.relay.domain.envelope.Envelope;
import java.util.concurrent.CompletionStage;

/**
 * Consumer callback registered with {@link TransportPort#subscribe}.
 *
 * <p>The transport acknowledges the underlying message only once the returned stage completes
 * normally. A stage completing exceptionally, or an exception thrown from {@link #handle}, leaves
 * the message unacknowledged so the bus redelivers it; handlers must therefore be idempotent.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface EnvelopeHandler {
  /**
   * Handles one decoded envelope.
   *
   * @param envelope decoded envelope
   * @return stage completing when the message may be acknowledged
   */
  CompletionStage<Void> handle(Envelope envelope);
}
