package ca.gc.cra.relay.infrastructure.transport;

import ca.gc.cra.relay.application.port.MetricsPort;
import ca.gc.cra.relay.application.retry.RetryPolicy;
import ca.gc.cra.relay.domain.error.TransportException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a publish attempt with bounded, exponentially backed-off retries.
 *
 * <p>Shared by every {@link ca.gc.cra.relay.application.port.TransportPort} implementation so the
 * retry and metric behaviour is identical across brokers.</p>
 */
public final class PublishRetrier {
  private static final Logger log = LoggerFactory.getLogger(PublishRetrier.class);

  /** One publish attempt; throws on transient failure. */
  @FunctionalInterface
  public interface Attempt {
    void run() throws Exception;
  }

  /** Blocks the publishing thread between attempts. */
  @FunctionalInterface
  public interface Sleeper {
    void sleep(long millis) throws InterruptedException;
  }

  private final RetryPolicy policy;
  private final MetricsPort metrics;
  private final Sleeper sleeper;

  public PublishRetrier(RetryPolicy policy, MetricsPort metrics) {
    this(policy, metrics, Thread::sleep);
  }

  public PublishRetrier(RetryPolicy policy, MetricsPort metrics, Sleeper sleeper) {
    this.policy = Objects.requireNonNull(policy, "policy");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  /**
   * Executes {@code attempt} until it succeeds or the policy is exhausted.
   *
   * @param destination destination name used in logs and errors
   * @param attempt publish attempt
   * @throws TransportException after the last failed attempt, or when interrupted while backing off
   */
  public void publish(String destination, Attempt attempt) {
    Exception last = null;
    for (int attemptNo = 1; attemptNo <= policy.maxAttempts(); attemptNo++) {
      if (attemptNo > 1) {
        long delay = policy.delayBefore(attemptNo - 1).toMillis();
        metrics.increment("transport.publish.retry");
        log.warn("Retrying publish to {} in {} ms (attempt {}/{})",
            destination, delay, attemptNo, policy.maxAttempts());
        try {
          sleeper.sleep(delay);
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          metrics.increment("transport.publish.failed");
          throw new TransportException("Interrupted while retrying publish to " + destination, attemptNo - 1, ex);
        }
      }
      try {
        attempt.run();
        metrics.increment("transport.publish.ok");
        return;
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        metrics.increment("transport.publish.failed");
        throw new TransportException("Interrupted while publishing to " + destination, attemptNo, ex);
      } catch (Exception ex) {
        last = ex;
        log.debug("Publish attempt {} to {} failed", attemptNo, destination, ex);
      }
    }
    metrics.increment("transport.publish.failed");
    throw new TransportException(
        "Publish to " + destination + " failed after " + policy.maxAttempts() + " attempt(s)",
        policy.maxAttempts(),
        last);
  }
}
