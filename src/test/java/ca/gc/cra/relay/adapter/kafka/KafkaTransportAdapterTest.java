package ca.gc.cra.relay.adapter.kafka;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.relay.application.port.Subscription;
import ca.gc.cra.relay.application.retry.RetryPolicy;
import ca.gc.cra.relay.domain.envelope.Envelope;
import ca.gc.cra.relay.domain.envelope.HeartbeatPayload;
import ca.gc.cra.relay.domain.envelope.SenderRole;
import ca.gc.cra.relay.domain.error.TransportException;
import ca.gc.cra.relay.infrastructure.codec.JsonEnvelopeCodec;
import ca.gc.cra.relay.infrastructure.transport.PublishRetrier;
import ca.gc.cra.relay.testing.Await;
import ca.gc.cra.relay.testing.RecordingMetricsPort;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class KafkaTransportAdapterTest {
  private static final String TOPIC = "relay.answers.parent";
  private static final TopicPartition PARTITION = new TopicPartition(TOPIC, 0);
  private static final Duration WAIT = Duration.ofSeconds(5);

  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final JsonEnvelopeCodec codec = new JsonEnvelopeCodec();
  private final MockConsumer<String, byte[]> consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
  private KafkaTransportAdapter adapter;

  @AfterEach
  void closeAdapter() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void publishKeysRecordByCorrelationId() {
    MockProducer<String, byte[]> producer = MockProducerFactory.byteArrayProducer();
    adapter = adapter(producer);
    Envelope envelope = heartbeat("cid-1", 0);

    adapter.publish("relay.questions.square", envelope);

    List<ProducerRecord<String, byte[]>> history = producer.history();
    assertEquals(1, history.size());
    ProducerRecord<String, byte[]> record = history.get(0);
    assertEquals("relay.questions.square", record.topic());
    assertEquals("cid-1", record.key());
    assertEquals(envelope, codec.decode(record.value()));
    assertArrayEquals("heartbeat".getBytes(StandardCharsets.UTF_8), record.headers().lastHeader("relay-type").value());
    assertEquals(1, metrics.count("transport.publish.ok"));
  }

  @Test
  void publishRetriesTransientBrokerErrors() {
    MockProducer<String, byte[]> producer = MockProducerFactory.failingProducer(2);
    adapter = adapter(producer);

    adapter.publish(TOPIC, heartbeat("cid-2", 0));

    assertEquals(1, producer.history().size());
    assertEquals(2, metrics.count("transport.publish.retry"));
  }

  @Test
  void publishGivesUpAfterRetries() {
    adapter = adapter(MockProducerFactory.failingProducer(10));

    TransportException ex = assertThrows(TransportException.class, () -> adapter.publish(TOPIC, heartbeat("cid-3", 0)));

    assertEquals(3, ex.attempts());
  }

  @Test
  void handledRecordsAreCommitted() {
    adapter = adapter(MockProducerFactory.byteArrayProducer());
    List<String> received = new CopyOnWriteArrayList<>();
    assign(List.of(record(0, codec.encode(heartbeat("a", 0))), record(1, codec.encode(heartbeat("b", 0)))));

    adapter.subscribe(TOPIC, envelope -> {
      received.add(envelope.correlationId());
      return CompletableFuture.completedFuture(null);
    }, 2);

    Await.until(() -> committedOffset() == 2L, WAIT, "offset 2 committed");
    assertEquals(Set.of("a", "b"), Set.copyOf(received));
  }

  @Test
  void failedRecordHoldsBackTheCommit() {
    adapter = adapter(MockProducerFactory.byteArrayProducer());
    assign(List.of(record(0, codec.encode(heartbeat("fails", 0))), record(1, codec.encode(heartbeat("ok", 0)))));

    adapter.subscribe(TOPIC, envelope -> "fails".equals(envelope.correlationId())
        ? CompletableFuture.failedFuture(new IllegalStateException("not yet"))
        : CompletableFuture.completedFuture(null), 1);

    Await.until(() -> metrics.count("transport.redelivered") >= 1, WAIT, "rewind after failure");
    Await.until(() -> metrics.count("transport.delivered") >= 2, WAIT, "both records handled");
    assertEquals(-1L, committedOffset());
  }

  @Test
  void malformedRecordIsDeadLetteredAndCommitted() {
    MockProducer<String, byte[]> producer = MockProducerFactory.byteArrayProducer();
    adapter = adapter(producer);
    assign(List.of(record(0, "not json".getBytes(StandardCharsets.UTF_8))));

    adapter.subscribe(TOPIC, envelope -> CompletableFuture.completedFuture(null), 1);

    Await.until(() -> committedOffset() == 1L, WAIT, "malformed record committed");
    ProducerRecord<String, byte[]> dead = producer.history().get(0);
    assertEquals(TOPIC + ".dlq", dead.topic());
    assertNull(dead.key());
    assertEquals("not json", new String(dead.value(), StandardCharsets.UTF_8));
  }

  @Test
  void closingSubscriptionClosesConsumer() {
    adapter = adapter(MockProducerFactory.byteArrayProducer());
    assign(List.of());

    Subscription subscription = adapter.subscribe(TOPIC, envelope -> null, 1);
    subscription.close();

    assertTrue(!subscription.isActive());
    assertTrue(consumer.closed());
  }

  private KafkaTransportAdapter adapter(MockProducer<String, byte[]> producer) {
    PublishRetrier retrier = new PublishRetrier(RetryPolicy.withRetries(2), metrics, millis -> { });
    return new KafkaTransportAdapter(producer, () -> consumer, codec, metrics, retrier, 4, true);
  }

  private void assign(List<ConsumerRecord<String, byte[]>> records) {
    consumer.updateBeginningOffsets(Map.of(PARTITION, 0L));
    consumer.schedulePollTask(() -> {
      consumer.rebalance(List.of(PARTITION));
      records.forEach(consumer::addRecord);
    });
  }

  private long committedOffset() {
    synchronized (consumer) {
      if (consumer.closed()) {
        return -2L;
      }
      OffsetAndMetadata committed = consumer.committed(Set.of(PARTITION)).get(PARTITION);
      return committed == null ? -1L : committed.offset();
    }
  }

  private static ConsumerRecord<String, byte[]> record(long offset, byte[] body) {
    return new ConsumerRecord<>(TOPIC, 0, offset, "key", body);
  }

  private static Envelope heartbeat(String correlationId, long orderingNumber) {
    return Envelope.of(correlationId, orderingNumber, SenderRole.CHILD, new HeartbeatPayload(Instant.EPOCH));
  }
}
