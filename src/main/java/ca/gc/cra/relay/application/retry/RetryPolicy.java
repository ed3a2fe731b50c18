package ca.gc.cra.relay.application.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded exponential backoff shared by transport publishing and invocation retries.
 *
 * @param maxRetries retries after the first attempt; zero disables retrying
 * @param initialBackoff delay before the first retry
 * @param multiplier growth factor applied per retry; at least {@code 1.0}
 * @param maxBackoff upper bound on any single delay
 * @since 0.1.0
 */
public record RetryPolicy(int maxRetries, Duration initialBackoff, double multiplier, Duration maxBackoff) {

  /** No retries. */
  public static final RetryPolicy NONE =
      new RetryPolicy(0, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(30));

  public RetryPolicy {
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0");
    }
    Objects.requireNonNull(initialBackoff, "initialBackoff");
    Objects.requireNonNull(maxBackoff, "maxBackoff");
    if (initialBackoff.isNegative() || maxBackoff.isNegative()) {
      throw new IllegalArgumentException("backoff durations must not be negative");
    }
    if (multiplier < 1.0 || Double.isNaN(multiplier)) {
      throw new IllegalArgumentException("multiplier must be >= 1.0");
    }
    if (maxBackoff.compareTo(initialBackoff) < 0) {
      throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
    }
  }

  /**
   * Default policy with {@code maxRetries} retries, 1 s initial delay doubling up to 30 s.
   *
   * @param maxRetries retries after the first attempt
   * @return policy
   */
  public static RetryPolicy withRetries(int maxRetries) {
    return new RetryPolicy(maxRetries, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(30));
  }

  /**
   * Delay before retry number {@code retry} (1-based).
   *
   * @param retry retry ordinal, starting at 1
   * @return capped delay
   */
  public Duration delayBefore(int retry) {
    if (retry <= 0) {
      return Duration.ZERO;
    }
    double millis = initialBackoff.toMillis() * Math.pow(multiplier, retry - 1);
    long capped = (long) Math.min(millis, (double) maxBackoff.toMillis());
    return Duration.ofMillis(capped);
  }

  /** Total attempts including the first. */
  public int maxAttempts() {
    return maxRetries + 1;
  }
}
