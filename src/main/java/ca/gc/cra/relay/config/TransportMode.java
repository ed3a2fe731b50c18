package ca.gc.cra.relay.config;

import java.util.Locale;

/**
 * <strong>What:</strong> Message bus implementations a service can run on.
 * <p><strong>Role:</strong> Configuration enum consumed by {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum TransportMode {
  /** In-process queues; invoker and responders must share one {@link CompositionRoot}. */
  MEMORY,
  /** Apache Kafka topics. */
  KAFKA;

  /**
   * Parses a string into a {@link TransportMode}, defaulting to {@link #MEMORY} when blank.
   *
   * @param value textual representation such as {@code "memory"} or {@code "kafka"}
   * @return parsed mode
   * @throws IllegalArgumentException if the string does not match a known mode
   */
  public static TransportMode fromString(String value) {
    if (value == null || value.isBlank()) {
      return MEMORY;
    }
    try {
      return TransportMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown transport: " + value, ex);
    }
  }
}
