package ca.gc.cra.relay.domain.envelope;

import java.time.Instant;
import java.util.Objects;

/**
 * Body of a {@code log_record} envelope.
 *
 * @param level log level name such as {@code INFO}
 * @param message log text, or one fragment of it when {@code continuation} is set
 * @param timestamp time the record was produced
 * @param continuation {@code true} when further fragments of the same record follow
 */
public record LogRecordPayload(String level, String message, Instant timestamp, boolean continuation)
    implements EnvelopePayload {

  public LogRecordPayload {
    Objects.requireNonNull(level, "level");
    Objects.requireNonNull(timestamp, "timestamp");
    message = message == null ? "" : message;
  }

  @Override
  public MessageType type() {
    return MessageType.LOG_RECORD;
  }
}
