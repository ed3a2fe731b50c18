package ca.gc.cra.relay.application.port;

import ca.gc.cra.relay.domain.envelope.Envelope;
import java.util.List;
import java.util.function.LongSupplier;

/**
 * Serializes protocol envelopes and splits oversized streamed payloads.
 *
 * @since 0.1.0
 */
public interface EnvelopeCodec {
  /**
   * Encodes an envelope to its wire representation.
   *
   * @param envelope envelope to encode
   * @return encoded bytes
   */
  byte[] encode(Envelope envelope);

  /**
   * Decodes wire bytes.
   *
   * @param bytes encoded envelope
   * @return decoded envelope
   * @throws ca.gc.cra.relay.domain.error.MalformedMessageException when the type is unknown or
   *     required fields are absent or ill-typed
   */
  Envelope decode(byte[] bytes);

  /**
   * Splits a {@code log_record} or {@code monitor_message} whose payload exceeds the maximum
   * payload size into consecutive fragments. Other envelopes, and small ones, are returned as a
   * single-element list.
   *
   * @param envelope envelope whose ordering number is ignored
   * @param orderingNumbers supplies consecutive ordering numbers, one per returned envelope
   * @return envelopes to publish in order
   */
  List<Envelope> fragment(Envelope envelope, LongSupplier orderingNumbers);

  /**
   * Parses JSON text into maps, lists, and primitives.
   *
   * @param json JSON text
   * @return parsed value
   * @throws ca.gc.cra.relay.domain.error.MalformedMessageException when the text is not JSON
   */
  Object parseValue(String json);

  /** Maximum payload size in bytes enforced by {@link #fragment}. */
  int maxPayloadBytes();
}
