package ca.gc.cra.relay.config;

import ca.gc.cra.relay.application.retry.RetryPolicy;
import ca.gc.cra.relay.infrastructure.codec.JsonEnvelopeCodec;
import ca.gc.cra.relay.validation.Net;
import ca.gc.cra.relay.validation.Strings;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Message bus settings shared by invoking and answering services.
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param mode transport implementation
 * @param kafkaBootstrap Kafka bootstrap servers; required when {@code mode} is {@link TransportMode#KAFKA}
 * @param groupId consumer group shared by replicas of the service
 * @param maxInFlight delivered but unacknowledged messages allowed per subscription
 * @param publishRetries retries after a failed publish before giving up
 * @param maxPayloadBytes encoded payload size above which streamed messages are fragmented
 * @param deadLetterEnabled whether malformed messages are copied to {@code <source>.dlq}
 * @param redeliveryDelay delay before the in-memory transport redelivers a failed message
 * @since 0.1.0
 */
public record TransportConfig(
    TransportMode mode,
    Optional<String> kafkaBootstrap,
    String groupId,
    int maxInFlight,
    int publishRetries,
    int maxPayloadBytes,
    boolean deadLetterEnabled,
    Duration redeliveryDelay) {

  public TransportConfig {
    mode = Objects.requireNonNullElse(mode, TransportMode.MEMORY);
    kafkaBootstrap = Objects.requireNonNullElse(kafkaBootstrap, Optional.<String>empty()).map(Net::validateBootstrap);
    groupId = Strings.sanitizeIdentifier("groupId", groupId);
    if (maxInFlight <= 0) {
      throw new IllegalArgumentException("maxInFlight must be positive");
    }
    if (publishRetries < 0) {
      throw new IllegalArgumentException("publishRetries must be >= 0");
    }
    if (maxPayloadBytes < JsonEnvelopeCodec.MIN_PAYLOAD_BYTES) {
      throw new IllegalArgumentException("maxPayloadBytes must be >= " + JsonEnvelopeCodec.MIN_PAYLOAD_BYTES);
    }
    Objects.requireNonNull(redeliveryDelay, "redeliveryDelay");
    if (mode == TransportMode.KAFKA && kafkaBootstrap.isEmpty()) {
      throw new IllegalArgumentException("kafkaBootstrap is required when transport=KAFKA");
    }
  }

  /** Retry policy applied to publishes. */
  public RetryPolicy publishPolicy() {
    return RetryPolicy.withRetries(publishRetries);
  }

  /**
   * Binds transport keys from flattened options.
   *
   * @param options flattened configuration
   * @param defaultGroupId group used when {@code groupId} is absent
   * @return transport settings
   */
  public static TransportConfig fromMap(Map<String, String> options, String defaultGroupId) {
    Objects.requireNonNull(options, "options");
    return new TransportConfig(
        TransportMode.fromString(options.get("transport")),
        OptionValues.optionalString(options, "kafkaBootstrap"),
        OptionValues.string(options, "groupId", defaultGroupId),
        OptionValues.integer(options, "maxInFlight", 16, 1, 100_000),
        OptionValues.integer(options, "publishRetries", 3, 0, 100),
        OptionValues.integer(options, "maxPayloadBytes", JsonEnvelopeCodec.DEFAULT_MAX_PAYLOAD_BYTES,
            JsonEnvelopeCodec.MIN_PAYLOAD_BYTES, Integer.MAX_VALUE),
        OptionValues.bool(options, "deadLetter", true),
        OptionValues.millis(options, "redeliveryDelayMs", Duration.ofMillis(100), 0));
  }
}
