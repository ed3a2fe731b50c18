package ca.gc.cra.relay.application.responder;

import ca.gc.cra.relay.application.port.ClockPort;
import ca.gc.cra.relay.domain.content.Manifest;
import ca.gc.cra.relay.domain.envelope.LogRecordPayload;
import ca.gc.cra.relay.domain.envelope.MonitorPayload;
import ca.gc.cra.relay.domain.envelope.QuestionPayload;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * What an {@link Analysis} sees of the question it answers, plus the channel it uses to stream
 * log records and monitor values back to the asker. Safe to use from several threads; messages
 * are published in the order they are emitted.
 */
public final class AnalysisContext {
  private final String correlationId;
  private final QuestionPayload question;
  private final AnswerChannel channel;
  private final ClockPort clock;

  AnalysisContext(String correlationId, QuestionPayload question, AnswerChannel channel, ClockPort clock) {
    this.correlationId = correlationId;
    this.question = question;
    this.channel = channel;
    this.clock = clock;
  }

  public String correlationId() {
    return correlationId;
  }

  public Object inputValues() {
    return question.inputValues();
  }

  public Manifest inputManifest() {
    return question.inputManifest();
  }

  /** Services this analysis may ask in turn; empty means unrestricted. */
  public List<String> allowedChildren() {
    return question.childIdentitiesAllowed();
  }

  /**
   * Streams a log record to the asker.
   *
   * @param level log level name, e.g. {@code INFO}
   * @param message log message
   */
  public void log(String level, String message) {
    Objects.requireNonNull(level, "level");
    channel.emit(new LogRecordPayload(level, message, Instant.ofEpochMilli(clock.nowMillis()), false));
  }

  public void info(String message) {
    log("INFO", message);
  }

  /**
   * Streams a monitor value (progress, partial results) to the asker.
   *
   * @param data JSON-compatible value
   */
  public void monitor(Object data) {
    channel.emit(MonitorPayload.of(data));
  }
}
