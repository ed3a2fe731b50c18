package ca.gc.cra.relay.application.responder;

import ca.gc.cra.relay.application.port.EnvelopeCodec;
import ca.gc.cra.relay.application.port.MetricsPort;
import ca.gc.cra.relay.application.port.TransportPort;
import ca.gc.cra.relay.domain.envelope.Envelope;
import ca.gc.cra.relay.domain.envelope.EnvelopePayload;
import ca.gc.cra.relay.domain.envelope.ExceptionPayload;
import ca.gc.cra.relay.domain.envelope.SenderRole;
import ca.gc.cra.relay.domain.error.PayloadTooLargeException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered outbound channel for one question. Producers enqueue payloads from any thread; at most
 * one drain task publishes at a time and stamps strictly increasing ordering numbers.
 *
 * <p>A streamed message that cannot be published is counted and dropped, which the asker sees as
 * a gap. A terminal payload too large for one message is replaced by a {@code PayloadTooLarge}
 * exception so the asker still gets an outcome. Any other terminal publish failure fails the
 * future returned by {@link #finish}.</p>
 */
final class AnswerChannel {
  private static final Logger log = LoggerFactory.getLogger(AnswerChannel.class);

  private record Pending(EnvelopePayload payload, CompletableFuture<Void> done) {}

  private final String correlationId;
  private final String replyTo;
  private final TransportPort transport;
  private final EnvelopeCodec codec;
  private final Executor publisher;
  private final MetricsPort metrics;
  private final Queue<Pending> queue = new ConcurrentLinkedQueue<>();
  private final AtomicBoolean draining = new AtomicBoolean();
  private final AtomicBoolean finished = new AtomicBoolean();
  private volatile boolean terminalSent;
  private final AtomicLong nextOrdering = new AtomicLong();

  AnswerChannel(
      String correlationId,
      String replyTo,
      TransportPort transport,
      EnvelopeCodec codec,
      Executor publisher,
      MetricsPort metrics) {
    this.correlationId = correlationId;
    this.replyTo = replyTo;
    this.transport = transport;
    this.codec = codec;
    this.publisher = publisher;
    this.metrics = metrics;
  }

  /** Enqueues a streamed or heartbeat payload. Ignored once the channel is finished. */
  void emit(EnvelopePayload payload) {
    if (finished.get()) {
      metrics.increment("responder.emit.afterFinish");
      return;
    }
    queue.add(new Pending(payload, null));
    schedule();
  }

  /**
   * Enqueues the terminal payload and closes the channel to further messages.
   *
   * @return future completing once the terminal envelope is published
   */
  CompletableFuture<Void> finish(EnvelopePayload terminal) {
    CompletableFuture<Void> done = new CompletableFuture<>();
    if (!finished.compareAndSet(false, true)) {
      done.completeExceptionally(new IllegalStateException("Answer channel already finished"));
      return done;
    }
    queue.add(new Pending(terminal, done));
    schedule();
    return done;
  }

  long published() {
    return nextOrdering.get();
  }

  private void schedule() {
    if (!draining.compareAndSet(false, true)) {
      return;
    }
    try {
      publisher.execute(this::drain);
    } catch (RejectedExecutionException ex) {
      draining.set(false);
      failAll(ex);
    }
  }

  private void drain() {
    try {
      Pending pending;
      while ((pending = queue.poll()) != null) {
        publish(pending);
      }
    } finally {
      draining.set(false);
    }
    if (!queue.isEmpty()) {
      schedule();
    }
  }

  private void publish(Pending pending) {
    try {
      publishOnce(pending);
    } catch (PayloadTooLargeException ex) {
      if (pending.payload() instanceof ExceptionPayload replaced
          && PayloadTooLargeException.KIND.equals(replaced.kind())) {
        pending.done().completeExceptionally(ex);
        return;
      }
      metrics.increment("responder.terminal.tooLarge");
      log.warn("{} for {} does not fit in one message: {}",
          pending.payload().type().wireName(), correlationId, ex.getMessage());
      publish(new Pending(tooLarge(ex), pending.done()));
    }
  }

  private static ExceptionPayload tooLarge(PayloadTooLargeException ex) {
    Map<String, Object> detail = new LinkedHashMap<>();
    detail.put("size", ex.size());
    detail.put("limit", ex.limit());
    return new ExceptionPayload(PayloadTooLargeException.KIND, ex.getMessage(), detail);
  }

  private void publishOnce(Pending pending) {
    if (terminalSent) {
      // emitted concurrently with finish(); nothing may follow the terminal envelope
      metrics.increment("responder.emit.afterFinish");
      return;
    }
    Envelope envelope = Envelope.of(correlationId, 0L, SenderRole.CHILD, pending.payload());
    try {
      for (Envelope part : codec.fragment(envelope, nextOrdering::getAndIncrement)) {
        transport.publish(replyTo, part);
      }
      metrics.increment("responder.published." + pending.payload().type().wireName());
      if (pending.done() != null) {
        terminalSent = true;
        pending.done().complete(null);
      }
    } catch (PayloadTooLargeException ex) {
      if (pending.done() != null) {
        throw ex;
      }
      metrics.increment("responder.stream.dropped");
      log.warn("Dropped {} for {}: {}", pending.payload().type().wireName(), correlationId, ex.getMessage());
    } catch (RuntimeException ex) {
      if (pending.done() != null) {
        pending.done().completeExceptionally(ex);
      } else {
        metrics.increment("responder.stream.dropped");
        log.warn("Dropped {} for {}: {}", pending.payload().type().wireName(), correlationId, ex.getMessage());
      }
    }
  }

  private void failAll(RuntimeException cause) {
    Pending pending;
    while ((pending = queue.poll()) != null) {
      if (pending.done() != null) {
        pending.done().completeExceptionally(cause);
      }
    }
  }
}
