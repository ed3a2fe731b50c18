package ca.gc.cra.relay.domain.error;

import java.util.Map;

/**
 * Wraps the structured error a child published in its {@code exception} envelope.
 *
 * @since 0.1.0
 */
public final class RemoteAnalysisException extends RelayException {
  private static final long serialVersionUID = 1L;

  private final String remoteKind;
  private final String remoteMessage;
  private final transient Map<String, Object> detail;

  /**
   * Creates the local representation of a remote analysis failure.
   *
   * @param childId child service that reported the failure
   * @param remoteKind error kind reported by the child
   * @param remoteMessage error message reported by the child
   * @param detail structured detail such as stack frames; may be empty
   */
  public RemoteAnalysisException(
      String childId, String remoteKind, String remoteMessage, Map<String, Object> detail) {
    super("Error in service '" + childId + "': " + remoteKind + ": " + remoteMessage);
    this.remoteKind = remoteKind;
    this.remoteMessage = remoteMessage;
    this.detail = detail == null ? Map.of() : detail;
  }

  /** Error kind published by the child (for example {@code ValueError}). */
  public String remoteKind() {
    return remoteKind;
  }

  /** Error message published by the child. */
  public String remoteMessage() {
    return remoteMessage;
  }

  /** Structured detail published by the child. */
  public Map<String, Object> detail() {
    return detail;
  }

  @Override
  public String kind() {
    return "RemoteAnalysisError";
  }
}
