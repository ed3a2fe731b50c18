package ca.gc.cra.relay.domain.envelope;

import ca.gc.cra.relay.domain.content.Manifest;

/**
 * Body of a {@code result} envelope.
 *
 * @param outputValues opaque output values; may be {@code null}
 * @param outputManifest output manifest; may be {@code null}
 */
public record ResultPayload(Object outputValues, Manifest outputManifest) implements EnvelopePayload {

  @Override
  public MessageType type() {
    return MessageType.RESULT;
  }
}
