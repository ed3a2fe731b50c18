package ca.gc.cra.relay.domain.envelope;

/**
 * Body of a {@code monitor_message} envelope.
 *
 * <p>When a monitor value is too large for one envelope, each fragment carries a slice of the
 * value's JSON text in {@code data} with {@code fragment} set; the receiver concatenates and
 * parses the slices once the final fragment ({@code continuation == false}) arrives.</p>
 *
 * @param data opaque monitor value, or a JSON text slice when {@code fragment} is set
 * @param continuation {@code true} when further fragments follow
 * @param fragment {@code true} when {@code data} is a JSON text slice
 */
public record MonitorPayload(Object data, boolean continuation, boolean fragment) implements EnvelopePayload {

  /**
   * Creates an unfragmented monitor message.
   *
   * @param data opaque monitor value
   * @return complete monitor payload
   */
  public static MonitorPayload of(Object data) {
    return new MonitorPayload(data, false, false);
  }

  @Override
  public MessageType type() {
    return MessageType.MONITOR_MESSAGE;
  }
}
