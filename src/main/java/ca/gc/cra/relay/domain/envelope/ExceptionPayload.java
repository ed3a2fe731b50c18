package ca.gc.cra.relay.domain.envelope;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Body of an {@code exception} envelope: the structured error a child reports.
 *
 * @param kind error kind, e.g. {@code ValidationError} or the failing exception's class name
 * @param message human-readable message
 * @param detail structured detail (exception class, stack frames, violations); never {@code null}
 */
public record ExceptionPayload(String kind, String message, Map<String, Object> detail)
    implements EnvelopePayload {

  public ExceptionPayload {
    Objects.requireNonNull(kind, "kind");
    message = message == null ? "" : message;
    detail = detail == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(detail));
  }

  @Override
  public MessageType type() {
    return MessageType.EXCEPTION;
  }
}
