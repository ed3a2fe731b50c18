package ca.gc.cra.relay.application.responder;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.relay.domain.contract.Destinations;
import ca.gc.cra.relay.domain.contract.ServiceContract;
import ca.gc.cra.relay.domain.envelope.Envelope;
import ca.gc.cra.relay.domain.envelope.ExceptionPayload;
import ca.gc.cra.relay.domain.envelope.HeartbeatPayload;
import ca.gc.cra.relay.domain.envelope.LogRecordPayload;
import ca.gc.cra.relay.domain.envelope.MessageType;
import ca.gc.cra.relay.domain.envelope.MonitorPayload;
import ca.gc.cra.relay.domain.envelope.QuestionPayload;
import ca.gc.cra.relay.domain.envelope.ResultPayload;
import ca.gc.cra.relay.domain.envelope.SenderRole;
import ca.gc.cra.relay.domain.error.AnalysisException;
import ca.gc.cra.relay.domain.error.PayloadTooLargeException;
import ca.gc.cra.relay.domain.error.ValidationException;
import ca.gc.cra.relay.infrastructure.codec.JsonEnvelopeCodec;
import ca.gc.cra.relay.infrastructure.schema.NetworkntSchemaValidator;
import ca.gc.cra.relay.infrastructure.schema.ServiceContractLoader;
import ca.gc.cra.relay.testing.Await;
import ca.gc.cra.relay.testing.ManualClock;
import ca.gc.cra.relay.testing.RecordingMetricsPort;
import ca.gc.cra.relay.testing.RecordingTransport;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ParentServiceResponderTest {
  private static final String REPLY_TO = Destinations.answers("parent");

  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final RecordingTransport transport = new RecordingTransport();
  private final ManualClock clock = new ManualClock(1_700_000_000_000L);
  private final AtomicInteger runs = new AtomicInteger();
  private ServiceContract contract;
  private ParentServiceResponder responder;

  @BeforeEach
  void loadContract() throws IOException {
    contract = new ServiceContractLoader().loadResource("contracts/square.json");
  }

  @AfterEach
  void closeResponder() {
    if (responder != null) {
      responder.close();
    }
  }

  @Test
  void answersWithOrderedStreamAndSingleResult() throws Exception {
    responder = responder(context -> {
      int n = inputN(context);
      context.info("squaring " + n);
      context.monitor(Map.of("progress", 1.0));
      return AnalysisResult.of(Map.of("result", n * n));
    }, Duration.ofMinutes(1)).start();

    join(responder.handle(question("cid-1", Map.of("n", 5))));

    List<Envelope> answers = transport.publishedTo(REPLY_TO);
    assertEquals(3, answers.size());
    for (int i = 0; i < answers.size(); i++) {
      assertEquals(i, answers.get(i).orderingNumber());
      assertEquals("cid-1", answers.get(i).correlationId());
      assertEquals(SenderRole.CHILD, answers.get(i).senderRole());
    }
    assertEquals("squaring 5", answers.get(0).payloadAs(LogRecordPayload.class).message());
    assertEquals(Map.of("progress", 1.0), answers.get(1).payloadAs(MonitorPayload.class).data());
    assertEquals(Map.of("result", 25), answers.get(2).payloadAs(ResultPayload.class).outputValues());
    assertEquals(1, metrics.count("responder.analysis.succeeded"));
    assertTrue(transport.handler(Destinations.questions("square")) != null);
  }

  @Test
  void invalidInputIsAnsweredWithoutRunning() throws Exception {
    responder = responder(squaring(), Duration.ofMinutes(1));

    join(responder.handle(question("cid-2", Map.of("n", "five"))));

    assertEquals(0, runs.get());
    ExceptionPayload error = singleAnswer().payloadAs(ExceptionPayload.class);
    assertEquals(ValidationException.KIND, error.kind());
    assertFalse(((List<?>) error.detail().get("violations")).isEmpty());
    assertEquals(1, metrics.count("responder.question.invalid"));
  }

  @Test
  void analysisErrorBecomesStructuredException() throws Exception {
    responder = responder(context -> {
      throw new AnalysisException("ValueError", "n must be positive", Map.of("n", -1));
    }, Duration.ofMinutes(1));

    join(responder.handle(question("cid-3", Map.of("n", -1))));

    ExceptionPayload error = singleAnswer().payloadAs(ExceptionPayload.class);
    assertEquals("ValueError", error.kind());
    assertEquals("n must be positive", error.message());
    assertEquals(-1, error.detail().get("n"));
    assertEquals(AnalysisException.class.getName(), error.detail().get("exception_class"));
    assertFalse(((List<?>) error.detail().get("stack")).isEmpty());
    assertEquals(1, metrics.count("responder.analysis.failed"));
  }

  @Test
  void assertionErrorInAnalysisStillEndsWithException() throws Exception {
    responder = responder(context -> {
      throw new AssertionError("bad state");
    }, Duration.ofMinutes(1));

    join(responder.handle(question("cid-3b", Map.of("n", 1))));

    ExceptionPayload error = singleAnswer().payloadAs(ExceptionPayload.class);
    assertEquals("AssertionError", error.kind());
    assertEquals("bad state", error.message());
    assertEquals(1, metrics.count("responder.analysis.failed"));
  }

  @Test
  void resultTooLargeForOneMessageIsAnsweredWithPayloadTooLarge() throws Exception {
    String padding = "x".repeat(4_096);
    responder = responder(context -> AnalysisResult.of(Map.of("result", 1, "padding", padding)),
        Duration.ofMinutes(1), new JsonEnvelopeCodec(1_024, metrics));

    join(responder.handle(question("cid-big", Map.of("n", 1))));

    ExceptionPayload error = singleAnswer().payloadAs(ExceptionPayload.class);
    assertEquals(PayloadTooLargeException.KIND, error.kind());
    assertEquals(1_024, error.detail().get("limit"));
    assertTrue((Integer) error.detail().get("size") > 4_096);
    assertEquals(0, singleAnswer().orderingNumber());
    assertEquals(1, metrics.count("responder.terminal.tooLarge"));
    assertEquals(0, metrics.count("responder.answer.publishFailed"));
  }

  @Test
  void invalidOutputIsReportedAsValidationError() throws Exception {
    responder = responder(context -> AnalysisResult.of(Map.of("result", "twenty-five")), Duration.ofMinutes(1));

    join(responder.handle(question("cid-4", Map.of("n", 5))));

    assertEquals(ValidationException.KIND, singleAnswer().payloadAs(ExceptionPayload.class).kind());
    assertEquals(1, metrics.count("responder.analysis.invalidOutput"));
  }

  @Test
  void answeredQuestionIsNotRunTwice() throws Exception {
    responder = responder(squaring(), Duration.ofMinutes(1));
    Envelope question = question("cid-5", Map.of("n", 3));

    join(responder.handle(question));
    join(responder.handle(question));

    assertEquals(1, runs.get());
    assertEquals(1, transport.publishedTo(REPLY_TO).size());
    assertEquals(1, metrics.count("responder.question.duplicate"));
  }

  @Test
  void redeliveryWhileRunningJoinsTheRun() throws Exception {
    CountDownLatch release = new CountDownLatch(1);
    responder = responder(context -> {
      runs.incrementAndGet();
      release.await(5, TimeUnit.SECONDS);
      return AnalysisResult.of(Map.of("result", 9));
    }, Duration.ofMinutes(1));
    Envelope question = question("cid-6", Map.of("n", 3));

    CompletableFuture<Void> first = responder.handle(question).toCompletableFuture();
    CompletableFuture<Void> second = responder.handle(question).toCompletableFuture();

    assertSame(first, second);
    assertEquals(1, responder.inProgress());
    release.countDown();
    join(first);
    assertEquals(1, runs.get());
    assertEquals(0, responder.inProgress());
    assertEquals(1, metrics.count("responder.question.joined"));
  }

  @Test
  void heartbeatsAreSentWhileAnalysisRuns() throws Exception {
    CountDownLatch release = new CountDownLatch(1);
    responder = responder(context -> {
      release.await(5, TimeUnit.SECONDS);
      return AnalysisResult.of(Map.of("result", 1));
    }, Duration.ofMillis(20));

    CompletableFuture<Void> done = responder.handle(question("cid-7", Map.of("n", 1))).toCompletableFuture();
    Await.until(() -> transport.publishedTo(REPLY_TO).size() >= 2, Duration.ofSeconds(5), "two heartbeats");
    release.countDown();
    join(done);

    List<Envelope> answers = transport.publishedTo(REPLY_TO);
    assertTrue(answers.get(0).payload() instanceof HeartbeatPayload);
    Envelope last = answers.get(answers.size() - 1);
    assertEquals(MessageType.RESULT, last.type());
    assertEquals(answers.size() - 1L, last.orderingNumber());
  }

  @Test
  void failedTerminalPublishLeavesQuestionForRedelivery() throws Exception {
    responder = responder(squaring(), Duration.ofMinutes(1));
    Envelope question = question("cid-8", Map.of("n", 4));
    transport.failNextPublishes(1);

    CompletableFuture<Void> attempt = responder.handle(question).toCompletableFuture();
    assertThrows(ExecutionException.class, () -> attempt.get(5, TimeUnit.SECONDS));
    assertEquals(1, metrics.count("responder.answer.publishFailed"));

    join(responder.handle(question));
    assertEquals(2, runs.get());
    assertEquals(Map.of("result", 16), singleAnswer().payloadAs(ResultPayload.class).outputValues());
  }

  @Test
  void ignoresEnvelopesThatAreNotQuestions() throws Exception {
    responder = responder(squaring(), Duration.ofMinutes(1));

    join(responder.handle(Envelope.of("cid-9", 0, SenderRole.CHILD,
        new ResultPayload(Map.of("result", 1), null))));

    assertEquals(0, runs.get());
    assertEquals(1, metrics.count("responder.envelope.misrouted"));
  }

  @Test
  void errorPayloadUsesSimpleClassNameForPlainExceptions() {
    ExceptionPayload payload = ParentServiceResponder.errorPayload(new IllegalStateException("boom"));

    assertEquals("IllegalStateException", payload.kind());
    assertEquals("boom", payload.message());
    assertEquals(IllegalStateException.class.getName(), payload.detail().get("exception_class"));
  }

  private ParentServiceResponder responder(Analysis analysis, Duration heartbeat) {
    return responder(analysis, heartbeat, new JsonEnvelopeCodec());
  }

  private ParentServiceResponder responder(Analysis analysis, Duration heartbeat, JsonEnvelopeCodec codec) {
    return new ParentServiceResponder(
        "square",
        contract,
        analysis,
        transport,
        codec,
        new NetworkntSchemaValidator(),
        clock,
        metrics,
        new ParentServiceResponder.Settings(2, 2, heartbeat, 100));
  }

  private Analysis squaring() {
    return context -> {
      runs.incrementAndGet();
      int n = inputN(context);
      return AnalysisResult.of(Map.of("result", n * n));
    };
  }

  private static int inputN(AnalysisContext context) {
    return ((Number) ((Map<?, ?>) context.inputValues()).get("n")).intValue();
  }

  private Envelope singleAnswer() {
    List<Envelope> answers = transport.publishedTo(REPLY_TO);
    assertEquals(1, answers.size());
    return answers.get(0);
  }

  private static Envelope question(String correlationId, Map<String, Object> inputValues) {
    return Envelope.of(correlationId, 0, SenderRole.PARENT,
        new QuestionPayload(inputValues, null, List.of(), REPLY_TO));
  }

  private static void join(CompletionStage<Void> stage)
      throws InterruptedException, ExecutionException, TimeoutException {
    stage.toCompletableFuture().get(5, TimeUnit.SECONDS);
  }
}
