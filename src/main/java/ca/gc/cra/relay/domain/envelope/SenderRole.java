package ca.gc.cra.relay.domain.envelope;

import java.util.Locale;
import java.util.Optional;

/**
 * Role of the service that produced an envelope. The parent asks questions; the child answers.
 *
 * @since 0.1.0
 */
public enum SenderRole {
  PARENT,
  CHILD;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Optional<SenderRole> fromWireName(String value) {
    if (value == null) {
      return Optional.empty();
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "parent" -> Optional.of(PARENT);
      case "child" -> Optional.of(CHILD);
      default -> Optional.empty();
    };
  }
}
