package ca.gc.cra.relay.application.invocation;

import ca.gc.cra.relay.application.retry.RetryPolicy;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Per-call options for {@link ChildServiceProxy#sendQuestion}.
 *
 * @param idleTimeout time without any envelope from the child before an attempt times out
 * @param retryPolicy retries of timed-out attempts, each with a new correlation id
 * @param reorderTimeout how long a hole in the streamed messages is waited on before a gap is reported
 * @param childIdentitiesAllowed services the child may itself ask; empty means unrestricted
 * @param listener receiver for logs, monitor values, and gaps
 * @since 0.1.0
 */
public record InvocationOptions(
    Duration idleTimeout,
    RetryPolicy retryPolicy,
    Duration reorderTimeout,
    List<String> childIdentitiesAllowed,
    InvocationListener listener) {

  public InvocationOptions {
    Objects.requireNonNull(idleTimeout, "idleTimeout");
    Objects.requireNonNull(retryPolicy, "retryPolicy");
    Objects.requireNonNull(reorderTimeout, "reorderTimeout");
    if (idleTimeout.isZero() || idleTimeout.isNegative()) {
      throw new IllegalArgumentException("idleTimeout must be positive");
    }
    if (reorderTimeout.isNegative()) {
      throw new IllegalArgumentException("reorderTimeout must not be negative");
    }
    childIdentitiesAllowed = childIdentitiesAllowed == null ? List.of() : List.copyOf(childIdentitiesAllowed);
    listener = listener == null ? InvocationListener.NONE : listener;
  }

  /** 60 s idle timeout, no retries, 2 s reorder timeout. */
  public static InvocationOptions defaults() {
    return new InvocationOptions(
        Duration.ofSeconds(60), RetryPolicy.NONE, Duration.ofSeconds(2), List.of(), InvocationListener.NONE);
  }

  public InvocationOptions withIdleTimeout(Duration value) {
    return new InvocationOptions(value, retryPolicy, reorderTimeout, childIdentitiesAllowed, listener);
  }

  public InvocationOptions withRetryPolicy(RetryPolicy value) {
    return new InvocationOptions(idleTimeout, value, reorderTimeout, childIdentitiesAllowed, listener);
  }

  public InvocationOptions withReorderTimeout(Duration value) {
    return new InvocationOptions(idleTimeout, retryPolicy, value, childIdentitiesAllowed, listener);
  }

  public InvocationOptions withChildIdentitiesAllowed(List<String> value) {
    return new InvocationOptions(idleTimeout, retryPolicy, reorderTimeout, value, listener);
  }

  public InvocationOptions withListener(InvocationListener value) {
    return new InvocationOptions(idleTimeout, retryPolicy, reorderTimeout, childIdentitiesAllowed, value);
  }
}
