package ca.gc.cra.relay.application.responder;

import ca.gc.cra.relay.application.content.ManifestValidator;
import ca.gc.cra.relay.application.port.ClockPort;
import ca.gc.cra.relay.application.port.EnvelopeCodec;
import ca.gc.cra.relay.application.port.MetricsPort;
import ca.gc.cra.relay.application.port.SchemaValidator;
import ca.gc.cra.relay.application.port.Subscription;
import ca.gc.cra.relay.application.port.TransportPort;
import ca.gc.cra.relay.domain.contract.Destinations;
import ca.gc.cra.relay.domain.contract.ServiceContract;
import ca.gc.cra.relay.domain.envelope.Envelope;
import ca.gc.cra.relay.domain.envelope.EnvelopePayload;
import ca.gc.cra.relay.domain.envelope.ExceptionPayload;
import ca.gc.cra.relay.domain.envelope.HeartbeatPayload;
import ca.gc.cra.relay.domain.envelope.MessageType;
import ca.gc.cra.relay.domain.envelope.QuestionPayload;
import ca.gc.cra.relay.domain.envelope.ResultPayload;
import ca.gc.cra.relay.domain.envelope.SenderRole;
import ca.gc.cra.relay.domain.error.AnalysisException;
import ca.gc.cra.relay.domain.error.RelayException;
import ca.gc.cra.relay.domain.error.ValidationException;
import ca.gc.cra.relay.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Answers questions addressed to this service by running its {@link Analysis}.
 * <p><strong>Why:</strong> Gives every service the same validate, run, stream, and answer
 * behaviour on top of an at-least-once transport.</p>
 * <p><strong>Role:</strong> Application service on the answering side, consuming
 * {@code relay.services.<serviceId>}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Validate inputs against the local contract and answer {@code ValidationError} without running.</li>
 *   <li>Run analyses on a pool separate from intake so slow work never starves intake.</li>
 *   <li>Publish logs, monitor values, and heartbeats with increasing ordering numbers.</li>
 *   <li>Validate outputs and publish exactly one {@code result} or {@code exception}.</li>
 *   <li>Acknowledge a question only after its terminal envelope is published.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Thread-safe. A redelivered question joins the run already in
 * progress, and a recently answered question is acknowledged without running again.</p>
 * <p><strong>Observability:</strong> Emits {@code responder.*} counters.</p>
 *
 * @since 0.1.0
 */
public final class ParentServiceResponder implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ParentServiceResponder.class);
  private static final String MDC_CORRELATION_ID = "correlationId";
  private static final int MAX_STACK_FRAMES = 50;

  /**
   * Responder settings.
   *
   * @param intakeConcurrency workers consuming the question destination
   * @param analysisConcurrency workers running analyses
   * @param heartbeatInterval period between heartbeats while an analysis runs
   * @param answeredCacheSize number of answered correlation ids remembered for deduplication
   */
  public record Settings(int intakeConcurrency, int analysisConcurrency, Duration heartbeatInterval, int answeredCacheSize) {
    public Settings {
      if (intakeConcurrency <= 0 || analysisConcurrency <= 0) {
        throw new IllegalArgumentException("concurrency must be positive");
      }
      Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
      if (heartbeatInterval.isZero() || heartbeatInterval.isNegative()) {
        throw new IllegalArgumentException("heartbeatInterval must be positive");
      }
      if (answeredCacheSize < 0) {
        throw new IllegalArgumentException("answeredCacheSize must be >= 0");
      }
    }

    /** 4 intake workers, 4 analysis workers, 10 s heartbeats, 10 000 remembered answers. */
    public static Settings defaults() {
      return new Settings(4, 4, Duration.ofSeconds(10), 10_000);
    }
  }

  private final String serviceId;
  private final ServiceContract contract;
  private final Analysis analysis;
  private final TransportPort transport;
  private final EnvelopeCodec codec;
  private final SchemaValidator schemaValidator;
  private final ManifestValidator manifestValidator;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final Settings settings;
  private final ExecutorService analysisPool;
  private final ExecutorService publisherPool;
  private final ScheduledExecutorService heartbeats;
  private final ConcurrentMap<String, CompletableFuture<Void>> inProgress = new ConcurrentHashMap<>();
  private final Set<String> answered;
  private final AtomicBoolean closed = new AtomicBoolean();
  private volatile Subscription subscription;

  public ParentServiceResponder(
      String serviceId,
      ServiceContract contract,
      Analysis analysis,
      TransportPort transport,
      EnvelopeCodec codec,
      SchemaValidator schemaValidator,
      ClockPort clock,
      MetricsPort metrics,
      Settings settings) {
    this.serviceId = Objects.requireNonNull(serviceId, "serviceId");
    this.contract = Objects.requireNonNull(contract, "contract");
    this.analysis = Objects.requireNonNull(analysis, "analysis");
    this.transport = Objects.requireNonNull(transport, "transport");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.schemaValidator = Objects.requireNonNull(schemaValidator, "schemaValidator");
    this.manifestValidator = new ManifestValidator(schemaValidator);
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.analysisPool = ExecutorFactories.newWorkerPool(settings.analysisConcurrency(), "relay-analysis-" + serviceId, null);
    this.publisherPool = ExecutorFactories.newWorkerPool(settings.intakeConcurrency(), "relay-answer-" + serviceId, null);
    this.heartbeats = ExecutorFactories.newScheduler("relay-heartbeat-" + serviceId);
    int cacheSize = settings.answeredCacheSize();
    this.answered = Collections.synchronizedSet(Collections.newSetFromMap(new LinkedHashMap<>(16, 0.75f, false) {
      @Override
      protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
        return size() > cacheSize;
      }
    }));
  }

  /**
   * Starts consuming questions.
   *
   * @return this responder
   */
  public ParentServiceResponder start() {
    if (closed.get()) {
      throw new IllegalStateException("Responder " + serviceId + " is closed");
    }
    if (subscription == null) {
      subscription = transport.subscribe(Destinations.questions(serviceId), this::handle, settings.intakeConcurrency());
      log.info("Service {} answering questions on {}", serviceId, Destinations.questions(serviceId));
    }
    return this;
  }

  /** Questions currently being answered. */
  public int inProgress() {
    return inProgress.size();
  }

  CompletionStage<Void> handle(Envelope envelope) {
    if (envelope.type() != MessageType.QUESTION || envelope.senderRole() != SenderRole.PARENT) {
      metrics.increment("responder.envelope.misrouted");
      log.debug("Ignoring {} from {} on question channel", envelope.type().wireName(), envelope.senderRole());
      return CompletableFuture.completedFuture(null);
    }
    String correlationId = envelope.correlationId();
    if (answered.contains(correlationId)) {
      metrics.increment("responder.question.duplicate");
      log.debug("Question already answered; acknowledging redelivery");
      return CompletableFuture.completedFuture(null);
    }
    QuestionPayload question = envelope.payloadAs(QuestionPayload.class);
    CompletableFuture<Void> fresh = new CompletableFuture<>();
    CompletableFuture<Void> running = inProgress.putIfAbsent(correlationId, fresh);
    if (running != null) {
      metrics.increment("responder.question.joined");
      return running;
    }
    metrics.increment("responder.question.received");
    answer(correlationId, question).whenComplete((ignored, error) -> {
      inProgress.remove(correlationId, fresh);
      if (error == null) {
        answered.add(correlationId);
        fresh.complete(null);
      } else {
        metrics.increment("responder.answer.publishFailed");
        log.error("Could not publish answer for {}; question will be redelivered", correlationId, error);
        fresh.completeExceptionally(error);
      }
    });
    return fresh;
  }

  private CompletableFuture<Void> answer(String correlationId, QuestionPayload question) {
    AnswerChannel channel = new AnswerChannel(
        correlationId, question.replyTo(), transport, codec, publisherPool, metrics);
    try {
      schemaValidator.validate("input_values", question.inputValues(), contract.inputValuesSchema());
      manifestValidator.validate(question.inputManifest(), contract);
    } catch (ValidationException ex) {
      metrics.increment("responder.question.invalid");
      log.warn("Rejecting question {}: {}", correlationId, ex.getMessage());
      return channel.finish(validationError(ex));
    }
    AnalysisContext context = new AnalysisContext(correlationId, question, channel, clock);
    long period = settings.heartbeatInterval().toMillis();
    ScheduledFuture<?> heartbeat = heartbeats.scheduleAtFixedRate(
        () -> channel.emit(new HeartbeatPayload(Instant.ofEpochMilli(clock.nowMillis()))),
        period, period, TimeUnit.MILLISECONDS);
    CompletableFuture<EnvelopePayload> terminal;
    try {
      terminal = CompletableFuture.supplyAsync(() -> run(context), analysisPool);
    } catch (RejectedExecutionException ex) {
      heartbeat.cancel(false);
      return CompletableFuture.failedFuture(ex);
    }
    return terminal
        .whenComplete((payload, error) -> heartbeat.cancel(false))
        .thenCompose(channel::finish);
  }

  private EnvelopePayload run(AnalysisContext context) {
    MDC.put(MDC_CORRELATION_ID, context.correlationId());
    long started = System.nanoTime();
    try {
      AnalysisResult result = analysis.run(context);
      if (result == null) {
        result = AnalysisResult.of(null);
      }
      schemaValidator.validate("output_values", result.outputValues(), contract.outputValuesSchema());
      metrics.increment("responder.analysis.succeeded");
      return new ResultPayload(result.outputValues(), result.outputManifest());
    } catch (ValidationException ex) {
      metrics.increment("responder.analysis.invalidOutput");
      log.warn("Analysis output rejected: {}", ex.getMessage());
      return validationError(ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      metrics.increment("responder.analysis.failed");
      return errorPayload(ex);
    } catch (Exception ex) {
      metrics.increment("responder.analysis.failed");
      log.info("Analysis failed with {}: {}", ex.getClass().getSimpleName(), ex.getMessage());
      return errorPayload(ex);
    } catch (VirtualMachineError ex) {
      throw ex;
    } catch (Error ex) {
      // assertion and linkage errors still end the question with an exception envelope
      metrics.increment("responder.analysis.failed");
      log.error("Analysis raised {}", ex.getClass().getName(), ex);
      return errorPayload(ex);
    } finally {
      metrics.observe("responder.analysis.nanos", System.nanoTime() - started);
      MDC.remove(MDC_CORRELATION_ID);
    }
  }

  private static ExceptionPayload validationError(ValidationException ex) {
    Map<String, Object> detail = new LinkedHashMap<>();
    detail.put("violations", ex.violations());
    return new ExceptionPayload(ValidationException.KIND, ex.getMessage(), detail);
  }

  static ExceptionPayload errorPayload(Throwable error) {
    Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    String kind = cause instanceof RelayException relay ? relay.kind() : cause.getClass().getSimpleName();
    Map<String, Object> detail = new LinkedHashMap<>();
    if (cause instanceof AnalysisException analysisError) {
      detail.putAll(analysisError.detail());
    }
    detail.put("exception_class", cause.getClass().getName());
    List<String> frames = new ArrayList<>();
    StackTraceElement[] trace = cause.getStackTrace();
    for (int i = 0; i < Math.min(trace.length, MAX_STACK_FRAMES); i++) {
      frames.add(trace[i].toString());
    }
    detail.put("stack", frames);
    return new ExceptionPayload(kind, cause.getMessage(), detail);
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    if (subscription != null) {
      subscription.close();
    }
    ExecutorFactories.shutdownGracefully(analysisPool, 5_000L);
    ExecutorFactories.shutdownGracefully(heartbeats, 1_000L);
    ExecutorFactories.shutdownGracefully(publisherPool, 5_000L);
    log.info("Service {} stopped answering", serviceId);
  }
}
