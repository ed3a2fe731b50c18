package ca.gc.cra.relay.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> String checks for service identities and configuration values.
 * <p><strong>Why:</strong> Service identities become part of destination names, so they must be safe
 * for every broker the transport may use.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities.</p>
 *
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");
  private static final int MAX_IDENTIFIER_LENGTH = 200;

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank and free of control characters.
   *
   * @param name parameter name used in diagnostics
   * @param value candidate text
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or contains control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates a service identity or consumer group name.
   *
   * @param name parameter name used in diagnostics
   * @param identifier candidate identity
   * @return trimmed identity matching {@code [A-Za-z0-9._-]+}
   * @throws IllegalArgumentException if the identity is blank, too long, or uses other characters
   */
  public static String sanitizeIdentifier(String name, String identifier) {
    String sanitized = requireNonBlank(name, identifier);
    if (sanitized.length() > MAX_IDENTIFIER_LENGTH) {
      throw new IllegalArgumentException(message(name, "length must be <= " + MAX_IDENTIFIER_LENGTH));
    }
    if (!IDENTIFIER_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must only contain letters, digits, dot, underscore, or hyphen"));
    }
    return sanitized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
