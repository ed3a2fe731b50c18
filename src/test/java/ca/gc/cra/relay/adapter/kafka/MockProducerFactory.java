package ca.gc.cra.relay.adapter.kafka;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.kafka.clients.producer.Callback;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.Partitioner;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.Cluster;
import org.apache.kafka.common.errors.TimeoutException;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;

/**
 * Test helper for constructing Kafka {@link MockProducer} instances with deterministic partitioning.
 */
final class MockProducerFactory {
  private static final Partitioner SINGLE_PARTITION = new Partitioner() {
    @Override
    public void configure(Map<String, ?> configs) {
      // nothing to configure
    }

    @Override
    public int partition(
        String topic,
        Object key,
        byte[] keyBytes,
        Object value,
        byte[] valueBytes,
        Cluster cluster) {
      return 0;
    }

    @Override
    public void close() {
      // nothing to release
    }
  };

  private MockProducerFactory() {}

  static MockProducer<String, byte[]> byteArrayProducer() {
    return new MockProducer<>(true, SINGLE_PARTITION, new StringSerializer(), new ByteArraySerializer());
  }

  /** Producer whose first {@code failures} sends complete with a broker timeout. */
  static MockProducer<String, byte[]> failingProducer(int failures) {
    AtomicInteger remaining = new AtomicInteger(failures);
    return new MockProducer<>(true, SINGLE_PARTITION, new StringSerializer(), new ByteArraySerializer()) {
      @Override
      public synchronized Future<RecordMetadata> send(ProducerRecord<String, byte[]> record, Callback callback) {
        if (remaining.getAndDecrement() > 0) {
          return CompletableFuture.failedFuture(new TimeoutException("broker unavailable"));
        }
        return super.send(record, callback);
      }
    };
  }
}
