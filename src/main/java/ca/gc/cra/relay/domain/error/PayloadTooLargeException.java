package ca.gc.cra.relay.domain.error;

/**
 * Raised when a payload that cannot be fragmented encodes larger than the configured limit.
 *
 * <p>Only {@code log_record} and {@code monitor_message} payloads are split into fragments; a
 * question, result or exception has to fit in a single message.</p>
 *
 * @since 0.1.0
 */
public final class PayloadTooLargeException extends RelayException {
  private static final long serialVersionUID = 1L;

  /** Wire name of this error kind. */
  public static final String KIND = "PayloadTooLarge";

  private final int size;
  private final int limit;

  public PayloadTooLargeException(String messageType, int size, int limit) {
    super(messageType + " payload is " + size + " bytes, above the " + limit + " byte limit");
    this.size = size;
    this.limit = limit;
  }

  /** Encoded payload size in bytes. */
  public int size() {
    return size;
  }

  /** Configured payload limit in bytes. */
  public int limit() {
    return limit;
  }

  @Override
  public String kind() {
    return KIND;
  }
}
