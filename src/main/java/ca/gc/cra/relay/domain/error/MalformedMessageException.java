package ca.gc.cra.relay.domain.error;

/**
 * Raised by the envelope codec when bytes cannot be decoded into a well-formed envelope.
 *
 * <p>Subscription loops log, dead-letter, and acknowledge malformed messages; they never stop on
 * this error.</p>
 *
 * @since 0.1.0
 */
public final class MalformedMessageException extends RelayException {
  private static final long serialVersionUID = 1L;

  public MalformedMessageException(String message) {
    super(message);
  }

  public MalformedMessageException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public String kind() {
    return "MalformedMessageError";
  }
}
