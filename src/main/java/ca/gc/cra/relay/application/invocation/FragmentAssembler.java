package ca.gc.cra.relay.application.invocation;

import ca.gc.cra.relay.application.port.EnvelopeCodec;
import ca.gc.cra.relay.domain.envelope.EnvelopePayload;
import ca.gc.cra.relay.domain.envelope.LogRecordPayload;
import ca.gc.cra.relay.domain.envelope.MonitorPayload;
import java.util.Objects;
import java.util.Optional;

/**
 * Joins in-order {@code continuation} fragments of log records and monitor messages.
 *
 * <p>Fragments must be fed in ordering-number order. A gap in the stream discards any partial
 * message. Not thread-safe.</p>
 */
public final class FragmentAssembler {
  private final EnvelopeCodec codec;
  private StringBuilder logText;
  private LogRecordPayload logHead;
  private StringBuilder monitorText;

  public FragmentAssembler(EnvelopeCodec codec) {
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  /**
   * Accepts one streamed payload.
   *
   * @param payload log or monitor payload
   * @return the complete payload once its final fragment arrives
   */
  public Optional<EnvelopePayload> accept(EnvelopePayload payload) {
    if (payload instanceof LogRecordPayload logRecord) {
      return acceptLog(logRecord);
    }
    if (payload instanceof MonitorPayload monitor) {
      return acceptMonitor(monitor);
    }
    return Optional.of(payload);
  }

  /**
   * Discards partially assembled messages.
   *
   * @return {@code true} when something was discarded
   */
  public boolean reset() {
    boolean discarded = logText != null || monitorText != null;
    logText = null;
    logHead = null;
    monitorText = null;
    return discarded;
  }

  private Optional<EnvelopePayload> acceptLog(LogRecordPayload logRecord) {
    if (logText == null && !logRecord.continuation()) {
      return Optional.of(logRecord);
    }
    if (logText == null) {
      logText = new StringBuilder();
      logHead = logRecord;
    }
    logText.append(logRecord.message());
    if (logRecord.continuation()) {
      return Optional.empty();
    }
    LogRecordPayload joined =
        new LogRecordPayload(logHead.level(), logText.toString(), logHead.timestamp(), false);
    logText = null;
    logHead = null;
    return Optional.of(joined);
  }

  private Optional<EnvelopePayload> acceptMonitor(MonitorPayload monitor) {
    if (!monitor.fragment()) {
      return Optional.of(monitor);
    }
    if (monitorText == null) {
      monitorText = new StringBuilder();
    }
    monitorText.append(monitor.data() == null ? "" : monitor.data().toString());
    if (monitor.continuation()) {
      return Optional.empty();
    }
    String text = monitorText.toString();
    monitorText = null;
    return Optional.of(MonitorPayload.of(codec.parseValue(text)));
  }
}
