package ca.gc.cra.relay.config;

import ca.gc.cra.relay.application.responder.ParentServiceResponder;
import ca.gc.cra.relay.validation.Strings;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Configuration of a service that answers questions.
 * <p><strong>Role:</strong> Bound from flattened options by {@link #fromMap(Map)} and consumed by
 * {@link CompositionRoot#responder(ResponderConfig, ca.gc.cra.relay.application.responder.Analysis)}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param serviceId identity of this service; questions arrive on {@code relay.services.<serviceId>}
 * @param transport message bus settings
 * @param intakeConcurrency workers consuming questions
 * @param analysisConcurrency workers running analyses
 * @param heartbeatInterval period between heartbeats while an analysis runs
 * @param answeredCacheSize answered correlation ids remembered for deduplication
 * @param contractPath optional JSON contract; absent means inputs and outputs are not validated
 * @param verbose whether DEBUG logging is enabled at startup
 * @since 0.1.0
 */
public record ResponderConfig(
    String serviceId,
    TransportConfig transport,
    int intakeConcurrency,
    int analysisConcurrency,
    Duration heartbeatInterval,
    int answeredCacheSize,
    Optional<Path> contractPath,
    boolean verbose) {

  public ResponderConfig {
    serviceId = Strings.sanitizeIdentifier("serviceId", serviceId);
    Objects.requireNonNull(transport, "transport");
    Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
    contractPath = Objects.requireNonNullElse(contractPath, Optional.<Path>empty());
    if (intakeConcurrency <= 0 || analysisConcurrency <= 0) {
      throw new IllegalArgumentException("concurrency must be positive");
    }
  }

  /**
   * Binds responder keys from flattened options.
   *
   * @param options flattened configuration, usually the output of {@link ConfigMerger}
   * @return responder configuration
   * @throws IllegalArgumentException when a value is missing or invalid
   */
  public static ResponderConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String serviceId = OptionValues.string(options, "serviceId", "");
    return new ResponderConfig(
        serviceId,
        TransportConfig.fromMap(options, "relay-service-" + serviceId),
        OptionValues.integer(options, "intakeConcurrency", 4, 1, 1_024),
        OptionValues.integer(options, "analysisConcurrency", 4, 1, 1_024),
        OptionValues.millis(options, "heartbeatIntervalMs", Duration.ofSeconds(10), 1),
        OptionValues.integer(options, "answeredCacheSize", 10_000, 0, 10_000_000),
        OptionValues.optionalPath(options, "contract"),
        OptionValues.bool(options, "verbose", false));
  }

  /** Responder settings carrying the configured values. */
  public ParentServiceResponder.Settings responderSettings() {
    return new ParentServiceResponder.Settings(
        intakeConcurrency, analysisConcurrency, heartbeatInterval, answeredCacheSize);
  }
}
