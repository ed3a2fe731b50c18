package ca.gc.cra.relay.adapter.kafka;

import ca.gc.cra.relay.application.port.EnvelopeCodec;
import ca.gc.cra.relay.application.port.EnvelopeHandler;
import ca.gc.cra.relay.application.port.MetricsPort;
import ca.gc.cra.relay.application.port.Subscription;
import ca.gc.cra.relay.application.port.TransportPort;
import ca.gc.cra.relay.application.retry.RetryPolicy;
import ca.gc.cra.relay.domain.contract.Destinations;
import ca.gc.cra.relay.domain.envelope.Envelope;
import ca.gc.cra.relay.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.relay.infrastructure.transport.EnvelopeDispatcher;
import ca.gc.cra.relay.infrastructure.transport.PublishRetrier;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Kafka implementation of {@link TransportPort}.
 * <p><strong>Why:</strong> Kafka supplies the durable, at-least-once bus between services.</p>
 * <p><strong>Role:</strong> Adapter implementing {@link TransportPort} on both the publishing and
 * consuming side.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Publish envelopes keyed by correlation id with {@code acks=all}, retrying transient failures.</li>
 *   <li>Consume on one poll thread and hand records to a bounded worker pool.</li>
 *   <li>Commit only the highest contiguously handled offset per partition.</li>
 *   <li>Rewind a partition to a failed record so it is redelivered.</li>
 *   <li>Pause fetching while {@code maxInFlight} records are unacknowledged.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Publishing is thread-safe through the shared
 * {@link KafkaProducer}; each subscription owns its consumer on a dedicated thread.</p>
 * <p><strong>Observability:</strong> Emits {@code transport.*} counters and logs commit failures.</p>
 *
 * @since 0.1.0
 */
public final class KafkaTransportAdapter implements TransportPort {
  private static final Logger log = LoggerFactory.getLogger(KafkaTransportAdapter.class);
  private static final Duration POLL_INTERVAL = Duration.ofMillis(100);
  private static final String TYPE_HEADER = "relay-type";

  private final Producer<String, byte[]> producer;
  private final Supplier<Consumer<String, byte[]>> consumerFactory;
  private final EnvelopeCodec codec;
  private final MetricsPort metrics;
  private final PublishRetrier retrier;
  private final int maxInFlight;
  private final Duration sendTimeout;
  private final boolean deadLetterEnabled;
  private final List<KafkaSubscription> subscriptions = new CopyOnWriteArrayList<>();
  private final AtomicBoolean closed = new AtomicBoolean();

  /**
   * Builds an adapter backed by new Kafka clients.
   *
   * @param bootstrapServers comma-separated Kafka bootstrap servers; must be non-blank
   * @param groupId consumer group shared by replicas of this service
   * @param codec envelope codec
   * @param metrics metrics sink
   * @param publishPolicy retry policy for publishes
   * @param maxInFlight credits per subscription
   * @param deadLetterEnabled whether malformed records are copied to {@code <source>.dlq}
   */
  public KafkaTransportAdapter(
      String bootstrapServers,
      String groupId,
      EnvelopeCodec codec,
      MetricsPort metrics,
      RetryPolicy publishPolicy,
      int maxInFlight,
      boolean deadLetterEnabled) {
    this(
        createProducer(bootstrapServers),
        () -> createConsumer(bootstrapServers, groupId, maxInFlight),
        codec,
        metrics,
        new PublishRetrier(publishPolicy, metrics),
        maxInFlight,
        deadLetterEnabled);
  }

  KafkaTransportAdapter(
      Producer<String, byte[]> producer,
      Supplier<Consumer<String, byte[]>> consumerFactory,
      EnvelopeCodec codec,
      MetricsPort metrics,
      PublishRetrier retrier,
      int maxInFlight,
      boolean deadLetterEnabled) {
    if (maxInFlight <= 0) {
      throw new IllegalArgumentException("maxInFlight must be positive");
    }
    this.producer = Objects.requireNonNull(producer, "producer");
    this.consumerFactory = Objects.requireNonNull(consumerFactory, "consumerFactory");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.retrier = Objects.requireNonNull(retrier, "retrier");
    this.maxInFlight = maxInFlight;
    this.sendTimeout = Duration.ofSeconds(10);
    this.deadLetterEnabled = deadLetterEnabled;
  }

  @Override
  public void publish(String destination, Envelope envelope) {
    Objects.requireNonNull(destination, "destination");
    Objects.requireNonNull(envelope, "envelope");
    ensureOpen();
    ProducerRecord<String, byte[]> record =
        new ProducerRecord<>(destination, envelope.correlationId(), codec.encode(envelope));
    record.headers().add(TYPE_HEADER, envelope.type().wireName().getBytes(StandardCharsets.UTF_8));
    send(destination, record);
  }

  private void send(String destination, ProducerRecord<String, byte[]> record) {
    retrier.publish(destination, () -> producer.send(record).get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS));
  }

  @Override
  public Subscription subscribe(String source, EnvelopeHandler handler, int concurrency) {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(handler, "handler");
    if (concurrency <= 0) {
      throw new IllegalArgumentException("concurrency must be positive");
    }
    ensureOpen();
    EnvelopeDispatcher dispatcher = new EnvelopeDispatcher(
        source, codec, handler, metrics, deadLetterEnabled ? this::deadLetter : null);
    KafkaSubscription subscription = new KafkaSubscription(source, consumerFactory.get(), dispatcher, concurrency);
    subscriptions.add(subscription);
    subscription.start();
    log.info("Subscribed to Kafka topic {} with {} worker(s) and {} credit(s)", source, concurrency, maxInFlight);
    return subscription;
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    subscriptions.forEach(KafkaSubscription::close);
    subscriptions.clear();
    try {
      producer.flush();
    } finally {
      producer.close(Duration.ofSeconds(5));
    }
  }

  private void deadLetter(String source, byte[] body) {
    String topic = Destinations.deadLetter(source);
    send(topic, new ProducerRecord<>(topic, body));
  }

  private void ensureOpen() {
    if (closed.get()) {
      throw new IllegalStateException("Transport is closed");
    }
  }

  private static Producer<String, byte[]> createProducer(String bootstrapServers) {
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, requireBootstrap(bootstrapServers));
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
    props.put(ProducerConfig.LINGER_MS_CONFIG, 5);
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
    return new KafkaProducer<>(props);
  }

  private static Consumer<String, byte[]> createConsumer(String bootstrapServers, String groupId, int maxInFlight) {
    if (groupId == null || groupId.isBlank()) {
      throw new IllegalArgumentException("groupId must not be blank");
    }
    Properties props = new Properties();
    props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, requireBootstrap(bootstrapServers));
    props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId.trim());
    props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
    props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
    props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, maxInFlight);
    props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
    props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
    return new KafkaConsumer<>(props);
  }

  private static String requireBootstrap(String bootstrapServers) {
    Objects.requireNonNull(bootstrapServers, "bootstrapServers");
    String trimmed = bootstrapServers.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("bootstrapServers must not be blank");
    }
    return trimmed;
  }

  private record Completion(TopicPartition partition, long offset, long epoch, Throwable error) {}

  private final class KafkaSubscription implements Subscription, ConsumerRebalanceListener {
    private final String source;
    private final Consumer<String, byte[]> consumer;
    private final EnvelopeDispatcher dispatcher;
    private final ExecutorService workers;
    private final PartitionOffsetTracker tracker = new PartitionOffsetTracker();
    private final Queue<Completion> completions = new ConcurrentLinkedQueue<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicBoolean active = new AtomicBoolean(true);
    private final Thread pollThread;

    KafkaSubscription(String source, Consumer<String, byte[]> consumer, EnvelopeDispatcher dispatcher, int concurrency) {
      this.source = source;
      this.consumer = consumer;
      this.dispatcher = dispatcher;
      this.workers = ExecutorFactories.newWorkerPool(concurrency, "relay-kafka-" + source, null);
      this.consumer.subscribe(List.of(source), this);
      this.pollThread = new Thread(this::pollLoop, "relay-kafka-poll-" + source);
      this.pollThread.setDaemon(true);
    }

    void start() {
      pollThread.start();
    }

    private void pollLoop() {
      try {
        while (active.get()) {
          applyCompletions();
          commit();
          applyBackpressure();
          ConsumerRecords<String, byte[]> records = consumer.poll(POLL_INTERVAL);
          if (!records.isEmpty()) {
            dispatch(records);
          }
        }
      } catch (WakeupException ex) {
        if (active.get()) {
          throw ex;
        }
      } catch (RuntimeException ex) {
        log.error("Kafka poll loop for {} failed", source, ex);
        metrics.increment("transport.poll.error");
      } finally {
        shutdown();
      }
    }

    private void dispatch(ConsumerRecords<String, byte[]> records) {
      for (TopicPartition partition : records.partitions()) {
        for (ConsumerRecord<String, byte[]> record : records.records(partition)) {
          if (inFlight.get() >= maxInFlight) {
            // out of credits: rewind so the rest of this batch is fetched again later
            consumer.seek(partition, record.offset());
            break;
          }
          long epoch = tracker.dispatched(partition, record.offset());
          inFlight.incrementAndGet();
          submit(partition, record, epoch);
        }
      }
    }

    private void submit(TopicPartition partition, ConsumerRecord<String, byte[]> record, long epoch) {
      try {
        workers.execute(() -> dispatcher.dispatch(record.value()).whenComplete(
            (ignored, error) -> completions.add(new Completion(partition, record.offset(), epoch, error))));
      } catch (RejectedExecutionException ex) {
        completions.add(new Completion(partition, record.offset(), epoch, ex));
      }
    }

    private void applyCompletions() {
      Completion completion;
      while ((completion = completions.poll()) != null) {
        inFlight.decrementAndGet();
        if (completion.error() == null) {
          tracker.completed(completion.partition(), completion.offset(), completion.epoch());
        } else if (tracker.failed(completion.partition(), completion.offset(), completion.epoch())) {
          metrics.increment("transport.redelivered");
          log.debug("Rewinding {} to offset {} after handler failure", completion.partition(), completion.offset());
          if (active.get()) {
            consumer.seek(completion.partition(), completion.offset());
          }
        }
      }
    }

    private void commit() {
      Map<TopicPartition, OffsetAndMetadata> offsets = tracker.drainCommittable();
      if (offsets.isEmpty()) {
        return;
      }
      try {
        consumer.commitSync(offsets);
        metrics.increment("transport.commit");
      } catch (KafkaException ex) {
        metrics.increment("transport.commit.error");
        log.warn("Offset commit for {} failed; records may be redelivered", source, ex);
      }
    }

    private void applyBackpressure() {
      if (inFlight.get() >= maxInFlight) {
        consumer.pause(consumer.assignment());
      } else if (!consumer.paused().isEmpty()) {
        consumer.resume(consumer.paused());
      }
    }

    private void shutdown() {
      ExecutorFactories.shutdownGracefully(workers, 5_000L);
      try {
        applyCompletions();
        commit();
      } finally {
        consumer.close(Duration.ofSeconds(5));
        log.info("Kafka subscription to {} closed", source);
      }
    }

    @Override
    public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
      applyCompletions();
      commit();
      partitions.forEach(tracker::revoke);
    }

    @Override
    public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
      log.debug("Assigned {} partition(s) of {}", partitions.size(), source);
    }

    @Override
    public String source() {
      return source;
    }

    @Override
    public int inFlight() {
      return inFlight.get();
    }

    @Override
    public boolean isActive() {
      return active.get();
    }

    @Override
    public void close() {
      if (!active.compareAndSet(true, false)) {
        return;
      }
      consumer.wakeup();
      try {
        pollThread.join(10_000L);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
      subscriptions.remove(this);
    }
  }
}
