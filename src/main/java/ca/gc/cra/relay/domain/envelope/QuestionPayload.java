package ca.gc.cra.relay.domain.envelope;

import ca.gc.cra.relay.domain.content.Manifest;
import java.util.List;

/**
 * Body of a {@code question} envelope.
 *
 * @param inputValues opaque input values; may be {@code null}
 * @param inputManifest input manifest; may be {@code null}
 * @param childIdentitiesAllowed services the child may itself invoke while answering
 * @param replyTo destination on which the asker consumes answers
 */
public record QuestionPayload(
    Object inputValues,
    Manifest inputManifest,
    List<String> childIdentitiesAllowed,
    String replyTo) implements EnvelopePayload {

  public QuestionPayload {
    childIdentitiesAllowed = childIdentitiesAllowed == null ? List.of() : List.copyOf(childIdentitiesAllowed);
    if (replyTo == null || replyTo.isBlank()) {
      throw new IllegalArgumentException("replyTo must not be blank");
    }
  }

  @Override
  public MessageType type() {
    return MessageType.QUESTION;
  }
}
