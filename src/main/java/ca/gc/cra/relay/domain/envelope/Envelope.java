package ca.gc.cra.relay.domain.envelope;

import java.util.Objects;

/**
 * <strong>What:</strong> One typed protocol message exchanged over the bus.
 * <p><strong>Why:</strong> Carries the correlation and ordering metadata that lets the protocol
 * reorder, deduplicate, and resolve invocations on top of an unordered at-least-once transport.</p>
 * <p><strong>Role:</strong> Domain value produced by the invoker and responder, serialized by the
 * envelope codec.</p>
 * <p><strong>Thread-safety:</strong> Immutable; envelopes are created once and never mutated.</p>
 *
 * @param correlationId opaque token tying a question to all of its responses
 * @param orderingNumber per-sender, per-correlation sequence number; non-negative
 * @param senderRole role of the producing service
 * @param protocolVersion protocol version of the producer, e.g. {@code 1.0}
 * @param payload type-specific body
 * @since 0.1.0
 */
public record Envelope(
    String correlationId,
    long orderingNumber,
    SenderRole senderRole,
    String protocolVersion,
    EnvelopePayload payload) {

  /** Protocol version spoken by this implementation. */
  public static final String PROTOCOL_VERSION = "1.0";

  public Envelope {
    Objects.requireNonNull(correlationId, "correlationId");
    Objects.requireNonNull(senderRole, "senderRole");
    Objects.requireNonNull(protocolVersion, "protocolVersion");
    Objects.requireNonNull(payload, "payload");
    if (correlationId.isBlank()) {
      throw new IllegalArgumentException("correlationId must not be blank");
    }
    if (orderingNumber < 0) {
      throw new IllegalArgumentException("orderingNumber must be non-negative");
    }
  }

  /**
   * Creates an envelope stamped with the current protocol version.
   *
   * @param correlationId correlation token
   * @param orderingNumber sender sequence number
   * @param senderRole producing role
   * @param payload body
   * @return new envelope
   */
  public static Envelope of(
      String correlationId, long orderingNumber, SenderRole senderRole, EnvelopePayload payload) {
    return new Envelope(correlationId, orderingNumber, senderRole, PROTOCOL_VERSION, payload);
  }

  /** Variant tag of the payload. */
  public MessageType type() {
    return payload.type();
  }

  /**
   * Returns the payload cast to the expected variant.
   *
   * @param type expected payload class
   * @param <T> payload type
   * @return typed payload
   * @throws IllegalStateException when the payload is of another variant
   */
  public <T extends EnvelopePayload> T payloadAs(Class<T> type) {
    if (!type.isInstance(payload)) {
      throw new IllegalStateException(
          "Envelope " + correlationId + "#" + orderingNumber + " carries " + payload.type().wireName()
              + ", not " + type.getSimpleName());
    }
    return type.cast(payload);
  }
}
