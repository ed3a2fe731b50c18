package ca.gc.cra.relay.domain.error;

import java.util.List;

/**
 * Raised to a blocked caller when a child never answered within the idle timeout and every
 * retry attempt was exhausted.
 *
 * @since 0.1.0
 */
public final class InvocationTimeoutException extends RelayException {
  private static final long serialVersionUID = 1L;

  private final List<String> correlationIds;

  /**
   * Creates a timeout failure.
   *
   * @param childId child service that failed to answer
   * @param correlationIds every correlation id used for the logical call, oldest first
   */
  public InvocationTimeoutException(String childId, List<String> correlationIds) {
    super("No answer from service '" + childId + "' after " + correlationIds.size() + " attempt(s)");
    this.correlationIds = List.copyOf(correlationIds);
  }

  public List<String> correlationIds() {
    return correlationIds;
  }

  @Override
  public String kind() {
    return "TimeoutError";
  }

  @Override
  public boolean retryable() {
    return true;
  }
}
