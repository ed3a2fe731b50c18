package ca.gc.cra.relay.config;

import ca.gc.cra.relay.infrastructure.codec.JsonEnvelopeCodec;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for the {@code invoker} and {@code responder} roles.
 *
 * <p>The defaults are the single source of truth for optional YAML keys.</p>
 */
public final class DefaultsForMode {
  /** Role name of services that invoke children. */
  public static final String INVOKER = "invoker";
  /** Role name of services that answer questions. */
  public static final String RESPONDER = "responder";

  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns the defaults for {@code mode} merged with the common defaults.
   *
   * @param mode {@code invoker} or {@code responder}
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException for any other mode
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case INVOKER -> buildInvokerDefaults();
      case RESPONDER -> buildResponderDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("transport", TransportMode.MEMORY.name());
    map.put("kafkaBootstrap", "");
    map.put("maxInFlight", "16");
    map.put("publishRetries", "3");
    map.put("maxPayloadBytes", Integer.toString(JsonEnvelopeCodec.DEFAULT_MAX_PAYLOAD_BYTES));
    map.put("deadLetter", "true");
    map.put("redeliveryDelayMs", "100");
    map.put("intakeConcurrency", "4");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildInvokerDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("invokerId", "");
    map.put("idleTimeoutMs", "60000");
    map.put("maxRetries", "0");
    map.put("initialBackoffMs", "1000");
    map.put("backoffMultiplier", "2.0");
    map.put("maxBackoffMs", "30000");
    map.put("reorderTimeoutMs", "2000");
    map.put("sweepIntervalMs", "200");
    map.put("retentionMs", "300000");
    return map;
  }

  private static Map<String, String> buildResponderDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("serviceId", "");
    map.put("analysisConcurrency", "4");
    map.put("heartbeatIntervalMs", "10000");
    map.put("answeredCacheSize", "10000");
    map.put("contract", "");
    return map;
  }
}
