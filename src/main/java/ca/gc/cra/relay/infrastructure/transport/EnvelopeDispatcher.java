package ca.gc.cra.relay.infrastructure.transport;

import ca.gc.cra.relay.application.port.EnvelopeCodec;
import ca.gc.cra.relay.application.port.EnvelopeHandler;
import ca.gc.cra.relay.application.port.MetricsPort;
import ca.gc.cra.relay.domain.envelope.Envelope;
import ca.gc.cra.relay.domain.error.MalformedMessageException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.BiConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Decodes raw message bodies and hands them to an {@link EnvelopeHandler}.
 *
 * <p>Malformed bodies are logged, counted, passed to the dead-letter sink, and reported as
 * handled so the transport acknowledges them. Handler exceptions become a failed stage so the
 * message stays unacknowledged.</p>
 */
public final class EnvelopeDispatcher {
  private static final Logger log = LoggerFactory.getLogger(EnvelopeDispatcher.class);
  static final String MDC_CORRELATION_ID = "correlationId";

  private final String source;
  private final EnvelopeCodec codec;
  private final EnvelopeHandler handler;
  private final MetricsPort metrics;
  private final BiConsumer<String, byte[]> deadLetterSink;

  /**
   * @param source subscribed destination
   * @param codec envelope codec
   * @param handler subscriber callback
   * @param metrics metrics sink
   * @param deadLetterSink receives {@code (source, body)} for malformed messages; may be {@code null}
   */
  public EnvelopeDispatcher(
      String source,
      EnvelopeCodec codec,
      EnvelopeHandler handler,
      MetricsPort metrics,
      BiConsumer<String, byte[]> deadLetterSink) {
    this.source = Objects.requireNonNull(source, "source");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.handler = Objects.requireNonNull(handler, "handler");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.deadLetterSink = deadLetterSink;
  }

  /**
   * Decodes and delivers one message body.
   *
   * @param body raw message body
   * @return stage completing normally when the message may be acknowledged
   */
  public CompletionStage<Void> dispatch(byte[] body) {
    Envelope envelope;
    try {
      envelope = codec.decode(body);
    } catch (MalformedMessageException ex) {
      metrics.increment("transport.malformed");
      log.warn("Dropping malformed message on {}: {}", source, ex.getMessage());
      deadLetter(body);
      return CompletableFuture.completedFuture(null);
    }
    metrics.increment("transport.delivered");
    MDC.put(MDC_CORRELATION_ID, envelope.correlationId());
    try {
      CompletionStage<Void> stage = handler.handle(envelope);
      return stage == null ? CompletableFuture.completedFuture(null) : stage;
    } catch (RuntimeException ex) {
      metrics.increment("transport.handler.error");
      log.error("Handler failed for {} #{} on {}", envelope.type().wireName(), envelope.orderingNumber(), source, ex);
      return CompletableFuture.failedFuture(ex);
    } finally {
      MDC.remove(MDC_CORRELATION_ID);
    }
  }

  private void deadLetter(byte[] body) {
    if (deadLetterSink == null) {
      return;
    }
    try {
      deadLetterSink.accept(source, body);
      metrics.increment("transport.deadLettered");
    } catch (RuntimeException ex) {
      metrics.increment("transport.deadLetter.error");
      log.error("Failed to dead-letter malformed message from {}", source, ex);
    }
  }
}
