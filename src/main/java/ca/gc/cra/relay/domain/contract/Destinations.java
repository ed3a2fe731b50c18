package ca.gc.cra.relay.domain.contract;

/**
 * Naming convention for bus destinations.
 * <ul>
 *   <li>{@code relay.services.<serviceId>} carries questions for a service.</li>
 *   <li>{@code relay.answers.<serviceId>} carries all answers for questions a service asked.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class Destinations {
  /** Namespace shared by all RELAY destinations. */
  public static final String NAMESPACE = "relay";
  /** Suffix appended to a source to form its dead-letter destination. */
  public static final String DEAD_LETTER_SUFFIX = ".dlq";

  private Destinations() {}

  public static String questions(String serviceId) {
    return NAMESPACE + ".services." + serviceId;
  }

  public static String answers(String serviceId) {
    return NAMESPACE + ".answers." + serviceId;
  }

  public static String deadLetter(String source) {
    return source + DEAD_LETTER_SUFFIX;
  }
}
