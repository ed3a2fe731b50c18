package ca.gc.cra.relay.domain.error;

/**
 * Raised by a transport adapter once bounded publish retries are exhausted.
 *
 * @since 0.1.0
 */
public final class TransportException extends RelayException {
  private static final long serialVersionUID = 1L;

  private final int attempts;

  public TransportException(String message, int attempts, Throwable cause) {
    super(message, cause);
    this.attempts = attempts;
  }

  /** Number of publish attempts made before giving up. */
  public int attempts() {
    return attempts;
  }

  @Override
  public String kind() {
    return "TransportError";
  }

  @Override
  public boolean retryable() {
    return true;
  }
}
