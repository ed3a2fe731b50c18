package ca.gc.cra.relay.application.port;

/**
 * <strong>What:</strong> Domain port abstracting RELAY metrics emission.
 * <p><strong>Why:</strong> Lets the invoker, responder, and transports record counters and
 * observations without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from
 * intake, analysis, and sweeper threads.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g. {@code invoker.envelope.duplicate}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key metric identifier using dotted naming (e.g. {@code transport.publish.retry}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram-style metric.
   *
   * @param key metric identifier using dotted naming; must not be {@code null}
   * @param value observed value (e.g. nanoseconds, bytes); semantics defined by the caller
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
