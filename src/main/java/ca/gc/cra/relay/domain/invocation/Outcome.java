package ca.gc.cra.relay.domain.invocation;

import ca.gc.cra.relay.domain.content.Manifest;
import ca.gc.cra.relay.domain.envelope.ExceptionPayload;
import java.util.List;
import java.util.Objects;

/**
 * Terminal outcome of a logical call, as seen by the asking service.
 *
 * @param state terminal state
 * @param outputValues output values when {@link InvocationState#COMPLETED}; otherwise {@code null}
 * @param outputManifest output manifest when completed; may be {@code null}
 * @param error structured remote error when {@link InvocationState#FAILED}; otherwise {@code null}
 * @param correlationIds correlation ids used by the call's attempts, oldest first
 * @since 0.1.0
 */
public record Outcome(
    InvocationState state,
    Object outputValues,
    Manifest outputManifest,
    ExceptionPayload error,
    List<String> correlationIds) {

  public Outcome {
    Objects.requireNonNull(state, "state");
    if (!state.isTerminal()) {
      throw new IllegalArgumentException("Outcome state must be terminal: " + state);
    }
    correlationIds = correlationIds == null ? List.of() : List.copyOf(correlationIds);
  }

  public static Outcome completed(Object outputValues, Manifest outputManifest, List<String> correlationIds) {
    return new Outcome(InvocationState.COMPLETED, outputValues, outputManifest, null, correlationIds);
  }

  public static Outcome failed(ExceptionPayload error, List<String> correlationIds) {
    return new Outcome(InvocationState.FAILED, null, null, Objects.requireNonNull(error, "error"), correlationIds);
  }

  public static Outcome timedOut(List<String> correlationIds) {
    return new Outcome(InvocationState.TIMED_OUT, null, null, null, correlationIds);
  }

  public static Outcome cancelled(List<String> correlationIds) {
    return new Outcome(InvocationState.CANCELLED, null, null, null, correlationIds);
  }

  public boolean isSuccess() {
    return state == InvocationState.COMPLETED;
  }

  /** Correlation id of the attempt that produced this outcome. */
  public String lastCorrelationId() {
    return correlationIds.isEmpty() ? null : correlationIds.get(correlationIds.size() - 1);
  }
}
