package ca.gc.cra.relay.infrastructure.transport;

import ca.gc.cra.relay.application.port.EnvelopeCodec;
import ca.gc.cra.relay.application.port.EnvelopeHandler;
import ca.gc.cra.relay.application.port.MetricsPort;
import ca.gc.cra.relay.application.port.Subscription;
import ca.gc.cra.relay.application.port.TransportPort;
import ca.gc.cra.relay.application.retry.RetryPolicy;
import ca.gc.cra.relay.domain.contract.Destinations;
import ca.gc.cra.relay.domain.envelope.Envelope;
import ca.gc.cra.relay.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> In-process {@link TransportPort} backed by named queues.
 * <p><strong>Why:</strong> Runs several services in one JVM (embedded mode and tests) with the
 * same acknowledgement, redelivery, and credit semantics as the broker-backed transport.</p>
 * <p><strong>Role:</strong> Adapter implementing {@link TransportPort}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Encode every published envelope through the codec, so wire compatibility is exercised.</li>
 *   <li>Retain messages published before a subscriber exists.</li>
 *   <li>Redeliver a message after a short delay when its handler fails.</li>
 *   <li>Route malformed bodies to {@code <source>.dlq}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Thread-safe. Several subscriptions on one source compete for
 * its messages.</p>
 *
 * @since 0.1.0
 */
public final class InMemoryTransportAdapter implements TransportPort {
  private static final Logger log = LoggerFactory.getLogger(InMemoryTransportAdapter.class);
  private static final long POLL_MILLIS = 50L;

  private final EnvelopeCodec codec;
  private final MetricsPort metrics;
  private final PublishRetrier retrier;
  private final int maxInFlight;
  private final Duration redeliveryDelay;
  private final boolean deadLetterEnabled;
  private final ConcurrentMap<String, BlockingQueue<byte[]>> queues = new ConcurrentHashMap<>();
  private final List<QueueSubscription> subscriptions = new CopyOnWriteArrayList<>();
  private final ScheduledExecutorService redeliveryScheduler = ExecutorFactories.newScheduler("relay-mem-redeliver");
  private final AtomicInteger injectedPublishFailures = new AtomicInteger();
  private final AtomicBoolean closed = new AtomicBoolean();

  /**
   * Creates an adapter with retrying publishes, 16 credits per subscription, 100 ms redelivery
   * delay, and dead-lettering enabled.
   *
   * @param codec envelope codec
   * @param metrics metrics sink
   */
  public InMemoryTransportAdapter(EnvelopeCodec codec, MetricsPort metrics) {
    this(codec, metrics, RetryPolicy.withRetries(3), 16, Duration.ofMillis(100), true);
  }

  /**
   * Creates an adapter.
   *
   * @param codec envelope codec
   * @param metrics metrics sink
   * @param publishPolicy retry policy for publishes
   * @param maxInFlight credits per subscription
   * @param redeliveryDelay delay before a failed message is redelivered
   * @param deadLetterEnabled whether malformed messages are copied to {@code <source>.dlq}
   */
  public InMemoryTransportAdapter(
      EnvelopeCodec codec,
      MetricsPort metrics,
      RetryPolicy publishPolicy,
      int maxInFlight,
      Duration redeliveryDelay,
      boolean deadLetterEnabled) {
    this(codec, metrics, new PublishRetrier(publishPolicy, metrics), maxInFlight, redeliveryDelay, deadLetterEnabled);
  }

  InMemoryTransportAdapter(
      EnvelopeCodec codec,
      MetricsPort metrics,
      PublishRetrier retrier,
      int maxInFlight,
      Duration redeliveryDelay,
      boolean deadLetterEnabled) {
    if (maxInFlight <= 0) {
      throw new IllegalArgumentException("maxInFlight must be positive");
    }
    this.codec = Objects.requireNonNull(codec, "codec");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.retrier = Objects.requireNonNull(retrier, "retrier");
    this.maxInFlight = maxInFlight;
    this.redeliveryDelay = Objects.requireNonNull(redeliveryDelay, "redeliveryDelay");
    this.deadLetterEnabled = deadLetterEnabled;
  }

  @Override
  public void publish(String destination, Envelope envelope) {
    Objects.requireNonNull(destination, "destination");
    Objects.requireNonNull(envelope, "envelope");
    ensureOpen();
    byte[] body = codec.encode(envelope);
    retrier.publish(destination, () -> {
      if (injectedPublishFailures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
        throw new IllegalStateException("Injected publish failure");
      }
      queue(destination).add(body);
    });
  }

  /**
   * Publishes a raw body without encoding; used to inject malformed or replayed messages.
   *
   * @param destination destination name
   * @param body raw message body
   */
  public void publishRaw(String destination, byte[] body) {
    ensureOpen();
    queue(destination).add(Objects.requireNonNull(body, "body").clone());
  }

  /**
   * Makes the next {@code count} publish attempts fail with a transient error.
   *
   * @param count number of attempts to fail
   */
  public void injectPublishFailures(int count) {
    injectedPublishFailures.set(Math.max(0, count));
  }

  /**
   * Number of undelivered messages waiting on a destination.
   *
   * @param destination destination name
   * @return queue depth
   */
  public int pending(String destination) {
    BlockingQueue<byte[]> queue = queues.get(destination);
    return queue == null ? 0 : queue.size();
  }

  /**
   * Removes and returns every undelivered message on a destination.
   *
   * @param destination destination name
   * @return raw bodies in arrival order
   */
  public List<byte[]> drain(String destination) {
    List<byte[]> out = new ArrayList<>();
    BlockingQueue<byte[]> queue = queues.get(destination);
    if (queue != null) {
      queue.drainTo(out);
    }
    return out;
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
    QueueSubscription subscription = new QueueSubscription(source, queue(source), dispatcher, concurrency);
    subscriptions.add(subscription);
    subscription.start();
    log.info("Subscribed to {} with {} worker(s) and {} credit(s)", source, concurrency, maxInFlight);
    return subscription;
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    subscriptions.forEach(QueueSubscription::close);
    subscriptions.clear();
    ExecutorFactories.shutdownGracefully(redeliveryScheduler, 1_000L);
  }

  private void deadLetter(String source, byte[] body) {
    queue(Destinations.deadLetter(source)).add(body);
  }

  private BlockingQueue<byte[]> queue(String destination) {
    return queues.computeIfAbsent(destination, d -> new LinkedBlockingQueue<>());
  }

  private void ensureOpen() {
    if (closed.get()) {
      throw new IllegalStateException("Transport is closed");
    }
  }

  private final class QueueSubscription implements Subscription {
    private final String source;
    private final BlockingQueue<byte[]> queue;
    private final EnvelopeDispatcher dispatcher;
    private final ExecutorService workers;
    private final Semaphore credits = new Semaphore(maxInFlight);
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicBoolean active = new AtomicBoolean(true);
    private final Thread pump;

    QueueSubscription(String source, BlockingQueue<byte[]> queue, EnvelopeDispatcher dispatcher, int concurrency) {
      this.source = source;
      this.queue = queue;
      this.dispatcher = dispatcher;
      this.workers = ExecutorFactories.newWorkerPool(concurrency, "relay-mem-" + source, null);
      this.pump = new Thread(this::pumpLoop, "relay-mem-pump-" + source);
      this.pump.setDaemon(true);
    }

    void start() {
      pump.start();
    }

    private void pumpLoop() {
      while (active.get()) {
        try {
          if (!credits.tryAcquire(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
            continue;
          }
          byte[] body = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
          if (body == null) {
            credits.release();
            continue;
          }
          deliver(body);
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          return;
        }
      }
    }

    private void deliver(byte[] body) {
      inFlight.incrementAndGet();
      try {
        workers.execute(() -> {
          CompletionStage<Void> stage = dispatcher.dispatch(body);
          stage.whenComplete((ignored, error) -> settle(body, error));
        });
      } catch (RejectedExecutionException ex) {
        settle(body, ex);
      }
    }

    private void settle(byte[] body, Throwable error) {
      inFlight.decrementAndGet();
      credits.release();
      if (error == null) {
        return;
      }
      metrics.increment("transport.redelivered");
      log.debug("Redelivering message on {} after handler failure: {}", source, error.toString());
      if (closed.get()) {
        queue.add(body);
        return;
      }
      try {
        redeliveryScheduler.schedule(() -> queue.add(body), redeliveryDelay.toMillis(), TimeUnit.MILLISECONDS);
      } catch (RejectedExecutionException ex) {
        queue.add(body);
      }
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
      pump.interrupt();
      try {
        pump.join(1_000L);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
      ExecutorFactories.shutdownGracefully(workers, 2_000L);
      subscriptions.remove(this);
      log.info("Subscription to {} closed", source);
    }
  }
}
