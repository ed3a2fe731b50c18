package ca.gc.cra.relay.domain.envelope;

import java.util.Locale;
import java.util.Optional;

/**
 * Variant tags of protocol envelopes, with their wire names.
 *
 * @since 0.1.0
 */
public enum MessageType {
  QUESTION("question"),
  LOG_RECORD("log_record"),
  MONITOR_MESSAGE("monitor_message"),
  RESULT("result"),
  EXCEPTION("exception"),
  HEARTBEAT("heartbeat");

  private final String wireName;

  MessageType(String wireName) {
    this.wireName = wireName;
  }

  /** Name used in the {@code type} field of the wire format. */
  public String wireName() {
    return wireName;
  }

  /** {@code true} for {@code result} and {@code exception}. */
  public boolean isTerminal() {
    return this == RESULT || this == EXCEPTION;
  }

  /** {@code true} for messages forwarded to the caller's log/monitor stream. */
  public boolean isStreamed() {
    return this == LOG_RECORD || this == MONITOR_MESSAGE;
  }

  /**
   * Resolves a wire name.
   *
   * @param wireName value of the {@code type} field
   * @return matching type, or empty when unknown
   */
  public static Optional<MessageType> fromWireName(String wireName) {
    if (wireName == null) {
      return Optional.empty();
    }
    String normalized = wireName.trim().toLowerCase(Locale.ROOT);
    for (MessageType type : values()) {
      if (type.wireName.equals(normalized)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
