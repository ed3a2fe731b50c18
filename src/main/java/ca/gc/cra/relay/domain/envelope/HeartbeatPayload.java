package ca.gc.cra.relay.domain.envelope;

import java.time.Instant;
import java.util.Objects;

/**
 * Body of a {@code heartbeat} envelope. Signals liveness during long analyses; it resets the
 * asker's idle timeout and is neither terminal nor forwarded to log listeners.
 *
 * @param timestamp time the heartbeat was produced
 */
public record HeartbeatPayload(Instant timestamp) implements EnvelopePayload {

  public HeartbeatPayload {
    Objects.requireNonNull(timestamp, "timestamp");
  }

  @Override
  public MessageType type() {
    return MessageType.HEARTBEAT;
  }
}
