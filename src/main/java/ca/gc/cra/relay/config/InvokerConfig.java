package ca.gc.cra.relay.config;

import ca.gc.cra.relay.application.invocation.ChildServiceProxy;
import ca.gc.cra.relay.application.invocation.InvocationOptions;
import ca.gc.cra.relay.application.retry.RetryPolicy;
import ca.gc.cra.relay.validation.Strings;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Configuration of a service that invokes children.
 * <p><strong>Why:</strong> Collects the invocation defaults (timeouts, retries, reorder window) and
 * the answer-channel plumbing in one immutable value.</p>
 * <p><strong>Role:</strong> Bound from flattened options by {@link #fromMap(Map)} and consumed by
 * {@link CompositionRoot#invoker(InvokerConfig)}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param invokerId identity of this service; names its answer channel {@code relay.answers.<invokerId>}
 * @param transport message bus settings
 * @param intakeConcurrency workers consuming the answer channel
 * @param idleTimeout default time allowed without a message before an attempt times out
 * @param retryPolicy default retry policy for timed-out attempts
 * @param reorderTimeout how long an ordering gap is waited on before it is skipped
 * @param sweepInterval period of the deadline and retention sweep
 * @param retention how long resolved invocations stay queryable
 * @param verbose whether DEBUG logging is enabled at startup
 * @since 0.1.0
 */
public record InvokerConfig(
    String invokerId,
    TransportConfig transport,
    int intakeConcurrency,
    Duration idleTimeout,
    RetryPolicy retryPolicy,
    Duration reorderTimeout,
    Duration sweepInterval,
    Duration retention,
    boolean verbose) {

  public InvokerConfig {
    invokerId = Strings.sanitizeIdentifier("invokerId", invokerId);
    Objects.requireNonNull(transport, "transport");
    Objects.requireNonNull(idleTimeout, "idleTimeout");
    Objects.requireNonNull(retryPolicy, "retryPolicy");
    Objects.requireNonNull(reorderTimeout, "reorderTimeout");
    Objects.requireNonNull(sweepInterval, "sweepInterval");
    Objects.requireNonNull(retention, "retention");
    if (intakeConcurrency <= 0) {
      throw new IllegalArgumentException("intakeConcurrency must be positive");
    }
    if (sweepInterval.isZero() || sweepInterval.isNegative()) {
      throw new IllegalArgumentException("sweepInterval must be positive");
    }
  }

  /**
   * Binds invoker keys from flattened options.
   *
   * @param options flattened configuration, usually the output of {@link ConfigMerger}
   * @return invoker configuration
   * @throws IllegalArgumentException when a value is missing or invalid
   */
  public static InvokerConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String invokerId = OptionValues.string(options, "invokerId", "");
    RetryPolicy retryPolicy = new RetryPolicy(
        OptionValues.integer(options, "maxRetries", 0, 0, 1_000),
        OptionValues.millis(options, "initialBackoffMs", Duration.ofSeconds(1), 0),
        OptionValues.decimal(options, "backoffMultiplier", 2.0, 1.0),
        OptionValues.millis(options, "maxBackoffMs", Duration.ofSeconds(30), 0));
    return new InvokerConfig(
        invokerId,
        TransportConfig.fromMap(options, "relay-invoker-" + invokerId),
        OptionValues.integer(options, "intakeConcurrency", 4, 1, 1_024),
        OptionValues.millis(options, "idleTimeoutMs", Duration.ofSeconds(60), 1),
        retryPolicy,
        OptionValues.millis(options, "reorderTimeoutMs", Duration.ofSeconds(2), 0),
        OptionValues.millis(options, "sweepIntervalMs", Duration.ofMillis(200), 1),
        OptionValues.millis(options, "retentionMs", Duration.ofMinutes(5), 0),
        OptionValues.bool(options, "verbose", false));
  }

  /** Invocation options carrying the configured defaults. */
  public InvocationOptions invocationOptions() {
    return InvocationOptions.defaults()
        .withIdleTimeout(idleTimeout)
        .withRetryPolicy(retryPolicy)
        .withReorderTimeout(reorderTimeout);
  }

  /** Proxy settings carrying the configured sweep and intake values. */
  public ChildServiceProxy.Settings proxySettings() {
    return new ChildServiceProxy.Settings(sweepInterval, retention, intakeConcurrency);
  }
}
