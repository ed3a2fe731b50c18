package ca.gc.cra.relay.domain.envelope;

/**
 * Type-specific body of an {@link Envelope}. Input, output, and monitor values stay opaque
 * JSON-compatible objects ({@code Map}, {@code List}, strings, numbers, booleans, {@code null})
 * and are validated at the boundary against externally supplied schemas.
 *
 * @since 0.1.0
 */
public sealed interface EnvelopePayload
    permits QuestionPayload,
        LogRecordPayload,
        MonitorPayload,
        ResultPayload,
        ExceptionPayload,
        HeartbeatPayload {

  /** Variant tag for this payload. */
  MessageType type();
}
