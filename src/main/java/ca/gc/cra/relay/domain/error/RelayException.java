package ca.gc.cra.relay.domain.error;

/**
 * Root of the unchecked exceptions raised by the RELAY invocation protocol.
 *
 * <p>Subclasses map one-to-one onto the protocol error kinds so callers can branch on type while
 * {@link #kind()} exposes the wire name used in {@code exception} envelopes.</p>
 *
 * @since 0.1.0
 */
public class RelayException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public RelayException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error
   * @param cause root cause
   */
  public RelayException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Returns the protocol error kind carried in {@code exception} envelopes.
   *
   * @return error kind such as {@code ValidationError}
   */
  public String kind() {
    return "RelayError";
  }

  /**
   * Indicates whether the protocol retries this error automatically.
   *
   * @return {@code true} when bounded automatic retries apply
   */
  public boolean retryable() {
    return false;
  }
}
