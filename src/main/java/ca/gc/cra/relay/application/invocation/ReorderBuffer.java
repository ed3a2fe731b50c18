package ca.gc.cra.relay.application.invocation;

import ca.gc.cra.relay.application.port.MetricsPort;
import ca.gc.cra.relay.domain.envelope.Envelope;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Per-invocation buffer that releases child envelopes in ordering-number order.
 *
 * <p>Envelopes behind the next expected number, or already buffered, are duplicates and are
 * dropped. When a hole stays open longer than the reorder timeout, a {@link Gap} is released for
 * it and delivery resumes from the lowest buffered number.</p>
 *
 * <p>The terminal envelope ends the stream: its number occupies a slot, numbers above it are
 * refused, and numbers below it are still released in order until every hole under the terminal
 * has closed or expired.</p>
 *
 * <p>Not thread-safe; callers hold the owning invocation's lock.</p>
 *
 * @since 0.1.0
 */
public final class ReorderBuffer {

  /** Item released by the buffer. */
  public sealed interface Release permits Delivered, Gap {}

  /** An envelope released in order. */
  public record Delivered(Envelope envelope) implements Release {}

  /**
   * Ordering numbers that never arrived.
   *
   * @param fromInclusive first missing number
   * @param toInclusive last missing number
   */
  public record Gap(long fromInclusive, long toInclusive) implements Release {}

  private final MetricsPort metrics;
  private final String metricsPrefix;
  private final NavigableMap<Long, Envelope> buffer = new TreeMap<>();
  private long nextExpected;
  private long endNumber = -1L;
  private long holeOpenedAtMillis = -1L;
  private long duplicates;

  public ReorderBuffer(MetricsPort metrics, String metricsPrefix) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.metricsPrefix = (metricsPrefix == null || metricsPrefix.isBlank()) ? "invoker.reorder" : metricsPrefix;
  }

  /**
   * Accepts an envelope and releases whatever has become contiguous.
   *
   * @param envelope child envelope
   * @param nowMillis arrival time used to age holes
   * @return released items in order; empty when the envelope was buffered or was a duplicate
   */
  public List<Release> offer(Envelope envelope, long nowMillis) {
    long number = envelope.orderingNumber();
    if (isAfterEnd(number)) {
      metrics.increment(metricsPrefix + ".afterEnd");
      return List.of();
    }
    if (isDuplicate(number)) {
      duplicates++;
      metrics.increment(metricsPrefix + ".duplicate");
      return List.of();
    }
    buffer.put(number, envelope);
    return flush(nowMillis, true);
  }

  /**
   * Records the terminal envelope's ordering number and releases whatever becomes contiguous.
   *
   * @param number ordering number of the terminal envelope
   * @param nowMillis arrival time used to age holes still open below the terminal
   * @return released items, or empty when the number was already seen or the stream has already
   *     ended
   */
  public Optional<List<Release>> end(long number, long nowMillis) {
    if (endNumber >= 0 || isDuplicate(number)) {
      duplicates++;
      metrics.increment(metricsPrefix + ".duplicate");
      return Optional.empty();
    }
    endNumber = number;
    buffer.put(number, null);
    return Optional.of(flush(nowMillis, false));
  }

  /** Whether the terminal envelope has been seen. */
  public boolean isEnded() {
    return endNumber >= 0;
  }

  /** Whether the terminal has been seen and every number below it was released or declared a gap. */
  public boolean isComplete() {
    return endNumber >= 0 && nextExpected > endNumber;
  }

  /**
   * Whether an envelope numbered {@code number} can still be released: the stream has not ended,
   * or it has ended above {@code number} and that slot is still open.
   */
  public boolean accepts(long number) {
    return !isDuplicate(number) && !isAfterEnd(number);
  }

  /**
   * Releases a gap for the current hole when it has been open for at least {@code timeoutMillis}.
   *
   * @param nowMillis current time
   * @param timeoutMillis reorder timeout
   * @return released items; empty when no hole has expired
   */
  public List<Release> expire(long nowMillis, long timeoutMillis) {
    if (buffer.isEmpty() || holeOpenedAtMillis < 0 || nowMillis - holeOpenedAtMillis < timeoutMillis) {
      return List.of();
    }
    List<Release> released = new ArrayList<>();
    skipToFirstBuffered(released);
    releaseContiguous(released);
    holeOpenedAtMillis = buffer.isEmpty() ? -1L : nowMillis;
    return released;
  }

  /** Next ordering number the buffer will release. */
  public long nextExpected() {
    return nextExpected;
  }

  /** Highest contiguous ordering number delivered so far, or {@code -1}. */
  public long highestContiguous() {
    return nextExpected - 1;
  }

  /** Number of envelopes held back waiting for a hole to close. */
  public int buffered() {
    return buffer.size();
  }

  /** Duplicates dropped so far. */
  public long duplicates() {
    return duplicates;
  }

  private boolean isDuplicate(long number) {
    return number < nextExpected || buffer.containsKey(number);
  }

  private boolean isAfterEnd(long number) {
    return endNumber >= 0 && number > endNumber;
  }

  private List<Release> flush(long nowMillis, boolean countBuffered) {
    List<Release> released = new ArrayList<>();
    releaseContiguous(released);
    if (buffer.isEmpty()) {
      holeOpenedAtMillis = -1L;
    } else {
      if (holeOpenedAtMillis < 0) {
        holeOpenedAtMillis = nowMillis;
      }
      if (countBuffered && released.isEmpty()) {
        metrics.increment(metricsPrefix + ".buffered");
      }
    }
    return released;
  }

  private void skipToFirstBuffered(List<Release> released) {
    long first = buffer.firstKey();
    if (first > nextExpected) {
      released.add(new Gap(nextExpected, first - 1));
      metrics.increment(metricsPrefix + ".gap");
      nextExpected = first;
    }
  }

  private void releaseContiguous(List<Release> released) {
    while (!buffer.isEmpty() && buffer.firstKey() == nextExpected) {
      Map.Entry<Long, Envelope> entry = buffer.pollFirstEntry();
      if (entry.getValue() != null) {
        released.add(new Delivered(entry.getValue()));
      }
      nextExpected++;
    }
  }
}
