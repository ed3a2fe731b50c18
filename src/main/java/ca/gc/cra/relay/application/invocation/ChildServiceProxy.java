package ca.gc.cra.relay.application.invocation;

import ca.gc.cra.relay.application.content.ManifestValidator;
import ca.gc.cra.relay.application.port.ClockPort;
import ca.gc.cra.relay.application.port.EnvelopeCodec;
import ca.gc.cra.relay.application.port.MetricsPort;
import ca.gc.cra.relay.application.port.SchemaValidator;
import ca.gc.cra.relay.application.port.Subscription;
import ca.gc.cra.relay.application.port.TransportPort;
import ca.gc.cra.relay.domain.content.Manifest;
import ca.gc.cra.relay.domain.contract.ChildService;
import ca.gc.cra.relay.domain.contract.Destinations;
import ca.gc.cra.relay.domain.contract.ServiceContract;
import ca.gc.cra.relay.domain.envelope.CorrelationIds;
import ca.gc.cra.relay.domain.envelope.Envelope;
import ca.gc.cra.relay.domain.envelope.EnvelopePayload;
import ca.gc.cra.relay.domain.envelope.ExceptionPayload;
import ca.gc.cra.relay.domain.envelope.LogRecordPayload;
import ca.gc.cra.relay.domain.envelope.MessageType;
import ca.gc.cra.relay.domain.envelope.MonitorPayload;
import ca.gc.cra.relay.domain.envelope.QuestionPayload;
import ca.gc.cra.relay.domain.envelope.ResultPayload;
import ca.gc.cra.relay.domain.envelope.SenderRole;
import ca.gc.cra.relay.domain.error.InvocationTimeoutException;
import ca.gc.cra.relay.domain.error.RemoteAnalysisException;
import ca.gc.cra.relay.domain.error.TransportException;
import ca.gc.cra.relay.domain.invocation.InvocationState;
import ca.gc.cra.relay.domain.invocation.Outcome;
import ca.gc.cra.relay.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Asks child services questions and tracks each call to a terminal outcome.
 * <p><strong>Why:</strong> Hides correlation, ordering, deduplication, timeouts, and retries from
 * callers, who only send a question and then poll, register a callback, or block.</p>
 * <p><strong>Role:</strong> Application service on the asking side. Answers for every call arrive
 * on this service's shared answer destination and are matched by correlation id.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Validate inputs locally against the child's contract before anything is published.</li>
 *   <li>Move attempts through {@code PENDING → RUNNING → COMPLETED | FAILED | TIMED_OUT}.</li>
 *   <li>Forward logs and monitor values in ordering-number order, reporting gaps.</li>
 *   <li>Retry timed-out attempts with a new correlation id after exponential backoff.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Thread-safe. Envelopes for one invocation are serialized by
 * its lock; a single scheduler thread runs deadline, reorder, and retention sweeps.</p>
 * <p><strong>Observability:</strong> Emits {@code invoker.*} counters and puts the correlation id
 * in the {@code correlationId} MDC key while handling envelopes.</p>
 *
 * @since 0.1.0
 */
public final class ChildServiceProxy implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ChildServiceProxy.class);
  private static final String MDC_CORRELATION_ID = "correlationId";
  private static final CompletableFuture<Void> DONE = CompletableFuture.completedFuture(null);

  /**
   * Proxy-wide settings.
   *
   * @param sweepInterval period of the deadline, reorder, and retention sweep
   * @param retention how long resolved invocations stay queryable
   * @param intakeConcurrency workers consuming the answer destination
   */
  public record Settings(Duration sweepInterval, Duration retention, int intakeConcurrency) {
    public Settings {
      Objects.requireNonNull(sweepInterval, "sweepInterval");
      Objects.requireNonNull(retention, "retention");
      if (sweepInterval.isZero() || sweepInterval.isNegative()) {
        throw new IllegalArgumentException("sweepInterval must be positive");
      }
      if (intakeConcurrency <= 0) {
        throw new IllegalArgumentException("intakeConcurrency must be positive");
      }
    }

    /** 200 ms sweeps, 5 minute retention, 4 intake workers. */
    public static Settings defaults() {
      return new Settings(Duration.ofMillis(200), Duration.ofMinutes(5), 4);
    }
  }

  private final String invokerId;
  private final String answerDestination;
  private final TransportPort transport;
  private final EnvelopeCodec codec;
  private final CorrelationRegistry registry;
  private final SchemaValidator schemaValidator;
  private final ManifestValidator manifestValidator;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final Settings settings;
  private final ConcurrentMap<String, PendingCall> calls = new ConcurrentHashMap<>();
  private final ScheduledExecutorService scheduler;
  private final Subscription subscription;
  private final AtomicBoolean closed = new AtomicBoolean();

  /**
   * Creates a proxy and starts consuming {@code relay.answers.<invokerId>}.
   *
   * @param invokerId identity of the asking service
   * @param transport message bus
   * @param codec codec used to reassemble fragmented monitor values
   * @param registry invocation table
   * @param schemaValidator validator for input values and manifests
   * @param clock time source
   * @param metrics metrics sink
   * @param settings sweep and intake settings
   */
  public ChildServiceProxy(
      String invokerId,
      TransportPort transport,
      EnvelopeCodec codec,
      CorrelationRegistry registry,
      SchemaValidator schemaValidator,
      ClockPort clock,
      MetricsPort metrics,
      Settings settings) {
    this.invokerId = Objects.requireNonNull(invokerId, "invokerId");
    this.answerDestination = Destinations.answers(invokerId);
    this.transport = Objects.requireNonNull(transport, "transport");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.schemaValidator = Objects.requireNonNull(schemaValidator, "schemaValidator");
    this.manifestValidator = new ManifestValidator(schemaValidator);
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.scheduler = ExecutorFactories.newScheduler("relay-invoker-" + invokerId);
    long period = settings.sweepInterval().toMillis();
    this.scheduler.scheduleWithFixedDelay(this::sweepSafely, period, period, TimeUnit.MILLISECONDS);
    this.subscription = transport.subscribe(answerDestination, this::handle, settings.intakeConcurrency());
    log.info("Invoker {} listening for answers on {}", invokerId, answerDestination);
  }

  /** Destination on which this proxy receives answers. */
  public String answerDestination() {
    return answerDestination;
  }

  /**
   * Sends a question with default options.
   *
   * @param child child service to ask
   * @param inputValues JSON-compatible input values
   * @return correlation id of the first attempt
   */
  public String sendQuestion(ChildService child, Object inputValues) {
    return sendQuestion(child, inputValues, null, InvocationOptions.defaults());
  }

  /**
   * Validates and sends a question.
   *
   * @param child child service to ask
   * @param inputValues JSON-compatible input values
   * @param inputManifest input manifest; {@code null} when the child requires no datasets
   * @param options per-call options
   * @return correlation id of the first attempt
   * @throws ca.gc.cra.relay.domain.error.ValidationException when inputs violate the child's contract;
   *     nothing is published
   * @throws TransportException when the question cannot be published
   */
  public String sendQuestion(
      ChildService child, Object inputValues, Manifest inputManifest, InvocationOptions options) {
    Objects.requireNonNull(child, "child");
    Objects.requireNonNull(options, "options");
    ensureOpen();
    ServiceContract contract = child.contract();
    try {
      schemaValidator.validate("input_values", inputValues, contract.inputValuesSchema());
      manifestValidator.validate(inputManifest, contract);
    } catch (RuntimeException ex) {
      metrics.increment("invoker.question.invalid");
      throw ex;
    }
    PendingCall call = new PendingCall(child, inputValues, inputManifest, options);
    return startAttempt(call);
  }

  /**
   * Sends a question and blocks for its answer.
   *
   * @param child child service to ask
   * @param inputValues JSON-compatible input values
   * @param inputManifest input manifest; may be {@code null}
   * @param options per-call options
   * @return the child's answer
   * @throws InterruptedException when interrupted while waiting
   */
  public Answer ask(ChildService child, Object inputValues, Manifest inputManifest, InvocationOptions options)
      throws InterruptedException {
    return awaitAnswer(sendQuestion(child, inputValues, inputManifest, options));
  }

  /**
   * Returns the outcome of the call if it has finished.
   *
   * @param correlationId correlation id of any attempt of the call
   * @return outcome, or empty while the call is in progress
   * @throws IllegalArgumentException when the id is unknown or has been evicted
   */
  public Optional<Outcome> poll(String correlationId) {
    CompletableFuture<Outcome> future = requireCall(correlationId).future();
    return future.isDone() ? Optional.of(future.join()) : Optional.empty();
  }

  /**
   * Current state of the logical call.
   *
   * @param correlationId correlation id of any attempt of the call
   * @return terminal state once resolved, otherwise the state of the current attempt
   */
  public InvocationState state(String correlationId) {
    PendingCall call = requireCall(correlationId);
    if (call.isDone()) {
      return call.future().join().state();
    }
    return registry.get(call.currentCorrelationId())
        .map(Invocation::state)
        .filter(state -> !state.isTerminal())
        .orElse(InvocationState.PENDING);
  }

  /**
   * Registers a callback run once when the call resolves.
   *
   * @param correlationId correlation id of any attempt of the call
   * @param callback receives the terminal outcome
   */
  public void onOutcome(String correlationId, Consumer<Outcome> callback) {
    Objects.requireNonNull(callback, "callback");
    requireCall(correlationId).future().thenAccept(outcome -> {
      try {
        callback.accept(outcome);
      } catch (RuntimeException ex) {
        log.warn("Outcome callback for {} failed", correlationId, ex);
      }
    });
  }

  /**
   * Blocks until the call resolves.
   *
   * @param correlationId correlation id of any attempt of the call
   * @return terminal outcome
   * @throws InterruptedException when interrupted while waiting
   */
  public Outcome await(String correlationId) throws InterruptedException {
    try {
      return requireCall(correlationId).future().get();
    } catch (ExecutionException ex) {
      throw new IllegalStateException("Call " + correlationId + " completed exceptionally", ex.getCause());
    }
  }

  /**
   * Blocks until the call resolves or {@code maxWait} elapses.
   *
   * @param correlationId correlation id of any attempt of the call
   * @param maxWait longest time to wait
   * @return terminal outcome
   * @throws InterruptedException when interrupted while waiting
   * @throws TimeoutException when the call is still running after {@code maxWait}
   */
  public Outcome await(String correlationId, Duration maxWait) throws InterruptedException, TimeoutException {
    try {
      return requireCall(correlationId).future().get(maxWait.toMillis(), TimeUnit.MILLISECONDS);
    } catch (ExecutionException ex) {
      throw new IllegalStateException("Call " + correlationId + " completed exceptionally", ex.getCause());
    }
  }

  /**
   * Blocks until the call resolves and converts failures to exceptions.
   *
   * @param correlationId correlation id of any attempt of the call
   * @return the child's answer
   * @throws RemoteAnalysisException when the child reported an error
   * @throws InvocationTimeoutException when every attempt timed out
   * @throws CancellationException when the call was cancelled
   * @throws InterruptedException when interrupted while waiting
   */
  public Answer awaitAnswer(String correlationId) throws InterruptedException {
    PendingCall call = requireCall(correlationId);
    Outcome outcome = await(correlationId);
    String childId = call.child().id();
    return switch (outcome.state()) {
      case COMPLETED -> new Answer(outcome.outputValues(), outcome.outputManifest(), outcome.lastCorrelationId());
      case FAILED -> {
        ExceptionPayload error = outcome.error();
        throw new RemoteAnalysisException(childId, error.kind(), error.message(), error.detail());
      }
      case TIMED_OUT -> throw new InvocationTimeoutException(childId, outcome.correlationIds());
      case CANCELLED -> throw new CancellationException("Call " + correlationId + " was cancelled");
      default -> throw new IllegalStateException("Unexpected terminal state " + outcome.state());
    };
  }

  /**
   * Abandons a call locally. Later envelopes for it are dropped. The child is not told.
   *
   * @param correlationId correlation id of any attempt of the call
   * @return {@code true} when the call was still running and is now cancelled
   */
  public boolean cancel(String correlationId) {
    PendingCall call = calls.get(correlationId);
    if (call == null || call.isDone()) {
      return false;
    }
    call.markCancelled();
    Outcome cancelled = Outcome.cancelled(call.correlationIds());
    String current = call.currentCorrelationId();
    if (current != null) {
      registry.resolve(current, cancelled);
    }
    boolean completed = complete(call, cancelled);
    if (completed) {
      log.info("Cancelled call {} to {}", correlationId, call.child().id());
    }
    return completed;
  }

  /** Number of logical calls not yet resolved. */
  public int pendingCalls() {
    Set<PendingCall> distinct = Collections.newSetFromMap(new IdentityHashMap<>());
    for (PendingCall call : calls.values()) {
      if (!call.isDone()) {
        distinct.add(call);
      }
    }
    return distinct.size();
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    subscription.close();
    ExecutorFactories.shutdownGracefully(scheduler, 1_000L);
    for (PendingCall call : new ArrayList<>(calls.values())) {
      if (!call.isDone()) {
        call.markCancelled();
        complete(call, Outcome.cancelled(call.correlationIds()));
      }
    }
    log.info("Invoker {} closed", invokerId);
  }

  private String startAttempt(PendingCall call) {
    long now = clock.nowMillis();
    String correlationId = CorrelationIds.newId(now);
    InvocationOptions options = call.options();
    registry.create(correlationId, call.child(), now + options.idleTimeout().toMillis(), call.retriesRemaining());
    call.beginAttempt(correlationId, new FragmentAssembler(codec));
    calls.put(correlationId, call);
    Envelope question = Envelope.of(correlationId, 0L, SenderRole.PARENT, new QuestionPayload(
        call.inputValues(), call.inputManifest(), options.childIdentitiesAllowed(), answerDestination));
    MDC.put(MDC_CORRELATION_ID, correlationId);
    try {
      transport.publish(call.child().questionDestination(), question);
      metrics.increment("invoker.question.sent");
      log.info("Asked {} (attempt {})", call.child().id(), call.correlationIds().size());
      return correlationId;
    } catch (RuntimeException ex) {
      registry.evict(correlationId);
      calls.remove(correlationId);
      call.abandonAttempt(correlationId);
      metrics.increment("invoker.question.publishFailed");
      throw ex;
    } finally {
      MDC.remove(MDC_CORRELATION_ID);
    }
  }

  CompletionStage<Void> handle(Envelope envelope) {
    String correlationId = envelope.correlationId();
    if (envelope.senderRole() != SenderRole.CHILD || envelope.type() == MessageType.QUESTION) {
      metrics.increment("invoker.envelope.misrouted");
      log.debug("Dropping {} from {} on answer channel", envelope.type().wireName(), envelope.senderRole());
      return DONE;
    }
    PendingCall call = calls.get(correlationId);
    Optional<Invocation> found = registry.get(correlationId);
    if (call == null || found.isEmpty()) {
      metrics.increment("invoker.envelope.unknown");
      log.debug("Dropping {} for unknown correlation id", envelope.type().wireName());
      return DONE;
    }
    Invocation invocation = found.get();
    Outcome resolved = null;
    invocation.lock().lock();
    try {
      ReorderBuffer buffer = invocation.reorderBuffer();
      if (call.isCancelled() || (invocation.state().isTerminal() && !isTrailing(invocation, envelope))) {
        metrics.increment("invoker.envelope.late");
        return DONE;
      }
      long now = clock.nowMillis();
      if (invocation.state().isTerminal()) {
        // stream envelope numbered below the terminal, still inside its reorder window
        metrics.increment("invoker.envelope.trailing");
        deliver(call, correlationId, buffer.offer(envelope, now));
        return DONE;
      }
      registry.touch(correlationId, now + call.options().idleTimeout().toMillis());
      if (invocation.markRunning()) {
        log.debug("Call to {} is running", call.child().id());
      }
      if (envelope.type().isTerminal()) {
        Optional<List<ReorderBuffer.Release>> released = buffer.end(envelope.orderingNumber(), now);
        if (released.isEmpty()) {
          return DONE;
        }
        deliver(call, correlationId, released.get());
        Outcome outcome = toOutcome(envelope, call);
        if (registry.resolve(correlationId, outcome)) {
          resolved = outcome;
        }
      } else {
        deliver(call, correlationId, buffer.offer(envelope, now));
      }
    } finally {
      invocation.lock().unlock();
    }
    if (resolved != null) {
      complete(call, resolved);
    }
    return DONE;
  }

  private static boolean isTrailing(Invocation invocation, Envelope envelope) {
    ReorderBuffer buffer = invocation.reorderBuffer();
    return !envelope.type().isTerminal()
        && buffer.isEnded()
        && !buffer.isComplete()
        && buffer.accepts(envelope.orderingNumber());
  }

  private void deliver(PendingCall call, String correlationId, List<ReorderBuffer.Release> releases) {
    InvocationListener listener = call.options().listener();
    for (ReorderBuffer.Release release : releases) {
      try {
        if (release instanceof ReorderBuffer.Gap gap) {
          metrics.increment("invoker.gap");
          if (call.assembler().reset()) {
            metrics.increment("invoker.fragment.discarded");
          }
          log.warn("Messages {}..{} never arrived", gap.fromInclusive(), gap.toInclusive());
          listener.onGap(correlationId, gap.fromInclusive(), gap.toInclusive());
        } else if (release instanceof ReorderBuffer.Delivered delivered) {
          EnvelopePayload payload = delivered.envelope().payload();
          if (payload.type() == MessageType.HEARTBEAT) {
            continue;
          }
          Optional<EnvelopePayload> complete = call.assembler().accept(payload);
          if (complete.isPresent()) {
            forward(listener, correlationId, complete.get());
          }
        }
      } catch (RuntimeException ex) {
        metrics.increment("invoker.listener.error");
        log.warn("Listener failed while forwarding stream of {}", correlationId, ex);
      }
    }
  }

  private void forward(InvocationListener listener, String correlationId, EnvelopePayload payload) {
    if (payload instanceof LogRecordPayload logRecord) {
      metrics.increment("invoker.log.forwarded");
      listener.onLog(correlationId, logRecord);
    } else if (payload instanceof MonitorPayload monitor) {
      metrics.increment("invoker.monitor.forwarded");
      listener.onMonitor(correlationId, monitor.data());
    }
  }

  private static Outcome toOutcome(Envelope envelope, PendingCall call) {
    if (envelope.payload() instanceof ResultPayload result) {
      return Outcome.completed(result.outputValues(), result.outputManifest(), call.correlationIds());
    }
    return Outcome.failed(envelope.payloadAs(ExceptionPayload.class), call.correlationIds());
  }

  private boolean complete(PendingCall call, Outcome outcome) {
    if (!call.future().complete(outcome)) {
      return false;
    }
    metrics.increment("invoker.call." + outcome.state().name().toLowerCase(Locale.ROOT));
    metrics.observe("invoker.call.attempts", outcome.correlationIds().size());
    log.info("Call to {} resolved {} after {} attempt(s)",
        call.child().id(), outcome.state(), outcome.correlationIds().size());
    return true;
  }

  private void sweepSafely() {
    try {
      sweep();
    } catch (RuntimeException ex) {
      metrics.increment("invoker.sweep.error");
      log.error("Invoker sweep failed", ex);
    }
  }

  void sweep() {
    long now = clock.nowMillis();
    for (Invocation expired : registry.sweepExpired(now)) {
      PendingCall call = calls.get(expired.correlationId());
      if (call == null || call.isDone()) {
        continue;
      }
      metrics.increment("invoker.attempt.timedOut");
      if (!call.isCancelled() && expired.retriesRemaining() > 0) {
        int retry = call.nextRetry();
        Duration delay = call.options().retryPolicy().delayBefore(retry);
        metrics.increment("invoker.retry");
        log.warn("Attempt {} to {} timed out; retrying in {} ms",
            expired.correlationId(), call.child().id(), delay.toMillis());
        scheduleRetry(call, delay);
      } else {
        complete(call, Outcome.timedOut(call.correlationIds()));
      }
    }
    for (Invocation invocation : registry.all()) {
      PendingCall call = calls.get(invocation.correlationId());
      if (call == null || call.isCancelled()) {
        continue;
      }
      invocation.lock().lock();
      try {
        ReorderBuffer buffer = invocation.reorderBuffer();
        if (!invocation.state().isTerminal() || (buffer.isEnded() && !buffer.isComplete())) {
          long timeout = call.options().reorderTimeout().toMillis();
          deliver(call, invocation.correlationId(), buffer.expire(now, timeout));
        }
      } finally {
        invocation.lock().unlock();
      }
    }
    for (String evicted : registry.evictResolvedBefore(now - settings.retention().toMillis())) {
      calls.remove(evicted);
    }
  }

  private void scheduleRetry(PendingCall call, Duration delay) {
    try {
      scheduler.schedule(() -> retry(call), delay.toMillis(), TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException ex) {
      complete(call, Outcome.timedOut(call.correlationIds()));
    }
  }

  private void retry(PendingCall call) {
    if (call.isDone() || call.isCancelled() || closed.get()) {
      return;
    }
    try {
      startAttempt(call);
    } catch (TransportException ex) {
      log.error("Retry of call to {} could not be published", call.child().id(), ex);
      complete(call, Outcome.failed(
          new ExceptionPayload(ex.kind(), ex.getMessage(), Map.of("attempts", ex.attempts())),
          call.correlationIds()));
    }
  }

  private PendingCall requireCall(String correlationId) {
    PendingCall call = calls.get(Objects.requireNonNull(correlationId, "correlationId"));
    if (call == null) {
      throw new IllegalArgumentException("Unknown correlation id: " + correlationId);
    }
    return call;
  }

  private void ensureOpen() {
    if (closed.get()) {
      throw new IllegalStateException("Invoker " + invokerId + " is closed");
    }
  }
}
