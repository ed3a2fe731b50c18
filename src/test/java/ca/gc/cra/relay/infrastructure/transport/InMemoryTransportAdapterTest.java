package ca.gc.cra.relay.infrastructure.transport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.relay.application.port.Subscription;
import ca.gc.cra.relay.application.retry.RetryPolicy;
import ca.gc.cra.relay.domain.contract.Destinations;
import ca.gc.cra.relay.domain.envelope.Envelope;
import ca.gc.cra.relay.domain.envelope.HeartbeatPayload;
import ca.gc.cra.relay.domain.envelope.SenderRole;
import ca.gc.cra.relay.domain.error.TransportException;
import ca.gc.cra.relay.infrastructure.codec.JsonEnvelopeCodec;
import ca.gc.cra.relay.testing.Await;
import ca.gc.cra.relay.testing.RecordingMetricsPort;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class InMemoryTransportAdapterTest {
  private static final Duration WAIT = Duration.ofSeconds(5);

  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final JsonEnvelopeCodec codec = new JsonEnvelopeCodec();
  private final InMemoryTransportAdapter transport = new InMemoryTransportAdapter(
      codec, metrics, new PublishRetrier(RetryPolicy.withRetries(2), metrics, millis -> { }),
      4, Duration.ofMillis(10), true);

  @AfterEach
  void closeTransport() {
    transport.close();
  }

  @Test
  void deliversPublishedEnvelopes() {
    List<Long> received = new CopyOnWriteArrayList<>();
    transport.subscribe("dest", envelope -> {
      received.add(envelope.orderingNumber());
      return CompletableFuture.completedFuture(null);
    }, 1);

    for (long i = 0; i < 5; i++) {
      transport.publish("dest", heartbeat(i));
    }

    Await.until(() -> received.size() == 5, WAIT, "all envelopes delivered");
    assertEquals(List.of(0L, 1L, 2L, 3L, 4L), received);
  }

  @Test
  void failedHandlingIsRedelivered() {
    AtomicInteger attempts = new AtomicInteger();
    transport.subscribe("dest", envelope -> attempts.incrementAndGet() < 3
        ? CompletableFuture.failedFuture(new IllegalStateException("not yet"))
        : CompletableFuture.completedFuture(null), 1);

    transport.publish("dest", heartbeat(0));

    Await.until(() -> attempts.get() == 3, WAIT, "third delivery");
    assertTrue(metrics.count("transport.redelivered") >= 2);
  }

  @Test
  void malformedMessagesGoToDeadLetterQueue() {
    transport.subscribe("dest", envelope -> null, 1);

    transport.publishRaw("dest", "garbage".getBytes(StandardCharsets.UTF_8));

    String dlq = Destinations.deadLetter("dest");
    Await.until(() -> transport.pending(dlq) == 1, WAIT, "dead-lettered copy");
    assertEquals("garbage", new String(transport.drain(dlq).get(0), StandardCharsets.UTF_8));
  }

  @Test
  void publishRetriesInjectedFailures() {
    transport.injectPublishFailures(2);

    transport.publish("dest", heartbeat(0));

    assertEquals(1, transport.pending("dest"));
    assertEquals(2, metrics.count("transport.publish.retry"));
  }

  @Test
  void publishFailsWhenRetriesAreExhausted() {
    transport.injectPublishFailures(5);

    assertThrows(TransportException.class, () -> transport.publish("dest", heartbeat(0)));
    assertEquals(0, transport.pending("dest"));
  }

  @Test
  void inFlightIsBoundedByCredits() {
    CompletableFuture<Void> gate = new CompletableFuture<>();
    AtomicInteger started = new AtomicInteger();
    Subscription subscription = transport.subscribe("dest", envelope -> {
      started.incrementAndGet();
      return gate;
    }, 8);

    for (long i = 0; i < 10; i++) {
      transport.publish("dest", heartbeat(i));
    }

    Await.until(() -> started.get() == 4, WAIT, "credits exhausted");
    assertEquals(4, subscription.inFlight());
    assertEquals(6, transport.pending("dest"));
    gate.complete(null);
    Await.until(() -> started.get() == 10, WAIT, "remaining deliveries");
  }

  @Test
  void closedSubscriptionStopsDelivery() {
    Subscription subscription = transport.subscribe("dest", envelope -> null, 1);
    subscription.close();

    transport.publish("dest", heartbeat(0));

    assertTrue(!subscription.isActive());
    assertEquals(1, transport.pending("dest"));
  }

  private static Envelope heartbeat(long orderingNumber) {
    return Envelope.of("cid", orderingNumber, SenderRole.CHILD, new HeartbeatPayload(Instant.EPOCH));
  }
}
