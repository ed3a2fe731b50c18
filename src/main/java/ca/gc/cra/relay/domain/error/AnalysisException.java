package ca.gc.cra.relay.domain.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Thrown by an analysis to report a failure with an explicit error kind, for example
 * {@code ValueError}, and optional structured detail. The responder publishes the kind, message,
 * and detail unchanged in the {@code exception} envelope.
 *
 * @since 0.1.0
 */
public class AnalysisException extends RelayException {
  private static final long serialVersionUID = 1L;

  private final String kind;
  private final transient Map<String, Object> detail;

  public AnalysisException(String kind, String message) {
    this(kind, message, Map.of(), null);
  }

  public AnalysisException(String kind, String message, Map<String, Object> detail) {
    this(kind, message, detail, null);
  }

  public AnalysisException(String kind, String message, Map<String, Object> detail, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
    this.detail = detail == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(detail));
  }

  @Override
  public String kind() {
    return kind;
  }

  /** Structured detail published alongside the message. */
  public Map<String, Object> detail() {
    return detail;
  }
}
