package ca.gc.cra.relay.domain.invocation;

/**
 * Lifecycle of one invocation attempt: {@code PENDING -> RUNNING -> {COMPLETED, FAILED, TIMED_OUT}}.
 * {@code CANCELLED} marks a locally abandoned call. Terminal states are absorbing.
 *
 * @since 0.1.0
 */
public enum InvocationState {
  PENDING,
  RUNNING,
  COMPLETED,
  FAILED,
  TIMED_OUT,
  CANCELLED;

  public boolean isTerminal() {
    return this != PENDING && this != RUNNING;
  }
}
