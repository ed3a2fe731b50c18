package ca.gc.cra.relay.application.invocation;

import ca.gc.cra.relay.domain.contract.ChildService;
import ca.gc.cra.relay.domain.invocation.InvocationState;
import ca.gc.cra.relay.domain.invocation.Outcome;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One attempt at asking a child service a question, identified by its correlation id.
 *
 * <p>State, deadline, and the reorder buffer are mutated only while holding {@link #lock()}; the
 * state and deadline are additionally readable without it.</p>
 *
 * @since 0.1.0
 */
public final class Invocation {
  private final String correlationId;
  private final ChildService target;
  private final int retriesRemaining;
  private final ReentrantLock lock = new ReentrantLock();
  private final ReorderBuffer reorderBuffer;
  private volatile InvocationState state = InvocationState.PENDING;
  private volatile long deadlineMillis;
  private volatile Outcome outcome;
  private volatile long resolvedAtMillis = -1L;

  Invocation(
      String correlationId,
      ChildService target,
      long deadlineMillis,
      int retriesRemaining,
      ReorderBuffer reorderBuffer) {
    this.correlationId = correlationId;
    this.target = target;
    this.deadlineMillis = deadlineMillis;
    this.retriesRemaining = retriesRemaining;
    this.reorderBuffer = reorderBuffer;
  }

  public String correlationId() {
    return correlationId;
  }

  public ChildService target() {
    return target;
  }

  public InvocationState state() {
    return state;
  }

  public long deadlineMillis() {
    return deadlineMillis;
  }

  /** Retries left for the logical call after this attempt. */
  public int retriesRemaining() {
    return retriesRemaining;
  }

  /** Highest ordering number delivered without holes, or {@code -1}. */
  public long highestContiguous() {
    lock.lock();
    try {
      return reorderBuffer.highestContiguous();
    } finally {
      lock.unlock();
    }
  }

  /** Number of envelopes buffered out of order. */
  public int bufferedCount() {
    lock.lock();
    try {
      return reorderBuffer.buffered();
    } finally {
      lock.unlock();
    }
  }

  /** Terminal outcome of this attempt, once resolved. */
  public Optional<Outcome> outcome() {
    return Optional.ofNullable(outcome);
  }

  long resolvedAtMillis() {
    return resolvedAtMillis;
  }

  ReentrantLock lock() {
    return lock;
  }

  ReorderBuffer reorderBuffer() {
    return reorderBuffer;
  }

  boolean markRunning() {
    if (state != InvocationState.PENDING) {
      return false;
    }
    state = InvocationState.RUNNING;
    return true;
  }

  void extendDeadline(long newDeadlineMillis) {
    deadlineMillis = newDeadlineMillis;
  }

  boolean resolve(Outcome terminal, long nowMillis) {
    if (state.isTerminal()) {
      return false;
    }
    outcome = terminal;
    resolvedAtMillis = nowMillis;
    state = terminal.state();
    return true;
  }
}
