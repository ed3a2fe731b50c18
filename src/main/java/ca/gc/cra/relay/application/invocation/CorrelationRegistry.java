package ca.gc.cra.relay.application.invocation;

import ca.gc.cra.relay.application.port.ClockPort;
import ca.gc.cra.relay.application.port.MetricsPort;
import ca.gc.cra.relay.domain.contract.ChildService;
import ca.gc.cra.relay.domain.invocation.Outcome;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * <strong>What:</strong> In-memory table of invocations keyed by correlation id.
 * <p><strong>Why:</strong> Lets answers arriving on a shared channel be matched to the attempt
 * that asked, and lets the sweeper find attempts whose deadline has passed.</p>
 * <p><strong>Role:</strong> Explicitly constructed state owned by one {@link ChildServiceProxy}.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe. Resolution is first-writer-wins under the
 * invocation's lock.</p>
 *
 * @since 0.1.0
 */
public final class CorrelationRegistry {
  private final Map<String, Invocation> invocations = new ConcurrentHashMap<>();
  private final ClockPort clock;
  private final MetricsPort metrics;

  public CorrelationRegistry(ClockPort clock, MetricsPort metrics) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Registers a new PENDING invocation without retries.
   *
   * @param correlationId unique correlation id
   * @param target child service asked
   * @param deadlineMillis epoch millis after which the invocation times out
   * @return the new invocation
   * @throws IllegalStateException when the id is already registered
   */
  public Invocation create(String correlationId, ChildService target, long deadlineMillis) {
    return create(correlationId, target, deadlineMillis, 0);
  }

  /**
   * Registers a new PENDING invocation.
   *
   * @param correlationId unique correlation id
   * @param target child service asked
   * @param deadlineMillis epoch millis after which the invocation times out
   * @param retriesRemaining retries the logical call has left after this attempt
   * @return the new invocation
   * @throws IllegalStateException when the id is already registered
   */
  public Invocation create(String correlationId, ChildService target, long deadlineMillis, int retriesRemaining) {
    Objects.requireNonNull(correlationId, "correlationId");
    Objects.requireNonNull(target, "target");
    Invocation invocation = new Invocation(
        correlationId, target, deadlineMillis, retriesRemaining, new ReorderBuffer(metrics, "invoker.reorder"));
    if (invocations.putIfAbsent(correlationId, invocation) != null) {
      throw new IllegalStateException("Correlation id already registered: " + correlationId);
    }
    return invocation;
  }

  public Optional<Invocation> get(String correlationId) {
    return Optional.ofNullable(invocations.get(correlationId));
  }

  /**
   * Resolves an invocation. Only the first resolution takes effect.
   *
   * @param correlationId correlation id
   * @param outcome terminal outcome
   * @return {@code true} when this call resolved the invocation
   */
  public boolean resolve(String correlationId, Outcome outcome) {
    Objects.requireNonNull(outcome, "outcome");
    Invocation invocation = invocations.get(correlationId);
    if (invocation == null) {
      return false;
    }
    invocation.lock().lock();
    try {
      boolean resolved = invocation.resolve(outcome, clock.nowMillis());
      if (!resolved) {
        metrics.increment("invoker.resolve.ignored");
      }
      return resolved;
    } finally {
      invocation.lock().unlock();
    }
  }

  /**
   * Moves every non-terminal invocation whose deadline is at or before {@code nowMillis} to
   * TIMED_OUT.
   *
   * @param nowMillis current time
   * @return invocations timed out by this sweep
   */
  public List<Invocation> sweepExpired(long nowMillis) {
    List<Invocation> expired = new ArrayList<>();
    for (Invocation invocation : invocations.values()) {
      if (invocation.state().isTerminal() || invocation.deadlineMillis() > nowMillis) {
        continue;
      }
      invocation.lock().lock();
      try {
        if (invocation.deadlineMillis() <= nowMillis
            && invocation.resolve(Outcome.timedOut(List.of(invocation.correlationId())), nowMillis)) {
          expired.add(invocation);
        }
      } finally {
        invocation.lock().unlock();
      }
    }
    return expired;
  }

  /**
   * Pushes the deadline of a live invocation out to {@code newDeadlineMillis}.
   *
   * @param correlationId correlation id
   * @param newDeadlineMillis new deadline
   * @return {@code false} when unknown or already terminal
   */
  public boolean touch(String correlationId, long newDeadlineMillis) {
    Invocation invocation = invocations.get(correlationId);
    if (invocation == null) {
      return false;
    }
    invocation.lock().lock();
    try {
      if (invocation.state().isTerminal()) {
        return false;
      }
      invocation.extendDeadline(Math.max(invocation.deadlineMillis(), newDeadlineMillis));
      return true;
    } finally {
      invocation.lock().unlock();
    }
  }

  public Optional<Invocation> evict(String correlationId) {
    return Optional.ofNullable(invocations.remove(correlationId));
  }

  /**
   * Evicts invocations resolved before {@code cutoffMillis}.
   *
   * @param cutoffMillis retention cutoff
   * @return evicted correlation ids
   */
  public List<String> evictResolvedBefore(long cutoffMillis) {
    List<String> evicted = new ArrayList<>();
    invocations.entrySet().removeIf(entry -> {
      Invocation invocation = entry.getValue();
      boolean stale = invocation.state().isTerminal()
          && invocation.resolvedAtMillis() >= 0
          && invocation.resolvedAtMillis() < cutoffMillis;
      if (stale) {
        evicted.add(entry.getKey());
      }
      return stale;
    });
    return evicted;
  }

  /** Invocations not yet terminal. */
  public List<Invocation> active() {
    List<Invocation> out = new ArrayList<>();
    for (Invocation invocation : invocations.values()) {
      if (!invocation.state().isTerminal()) {
        out.add(invocation);
      }
    }
    return out;
  }

  /** Every registered invocation, resolved or not. */
  public List<Invocation> all() {
    return new ArrayList<>(invocations.values());
  }

  public int size() {
    return invocations.size();
  }
}
