package ca.gc.cra.relay.application.invocation;

import ca.gc.cra.relay.domain.envelope.LogRecordPayload;

/**
 * Receives the streamed side channel of an invocation, in ordering-number order.
 *
 * <p>Callbacks for one invocation are never concurrent; callbacks for different invocations may
 * be. Implementations should return quickly.</p>
 */
public interface InvocationListener {

  /** Listener that ignores everything. */
  InvocationListener NONE = new InvocationListener() {};

  /**
   * A log record forwarded by the child.
   *
   * @param correlationId attempt the record belongs to
   * @param record reassembled log record
   */
  default void onLog(String correlationId, LogRecordPayload record) {}

  /**
   * A monitor value forwarded by the child.
   *
   * @param correlationId attempt the value belongs to
   * @param data reassembled monitor value
   */
  default void onMonitor(String correlationId, Object data) {}

  /**
   * Messages that never arrived within the reorder timeout.
   *
   * @param correlationId attempt with the hole
   * @param fromInclusive first missing ordering number
   * @param toInclusive last missing ordering number
   */
  default void onGap(String correlationId, long fromInclusive, long toInclusive) {}
}
