package ca.gc.cra.relay.domain.error;

import java.util.List;

/**
 * Raised when input values, a manifest, or output values fail validation against a service
 * contract. Questions failing validation are never published.
 *
 * @since 0.1.0
 */
public final class ValidationException extends RelayException {
  private static final long serialVersionUID = 1L;

  /** Wire name of this error kind. */
  public static final String KIND = "ValidationError";

  private final List<String> violations;

  /**
   * Creates a validation failure with a single message.
   *
   * @param message description of the failure
   */
  public ValidationException(String message) {
    this(message, List.of());
  }

  /**
   * Creates a validation failure listing individual schema violations.
   *
   * @param message summary of the failure
   * @param violations individual violations reported by the validator
   */
  public ValidationException(String message, List<String> violations) {
    super(message);
    this.violations = violations == null ? List.of() : List.copyOf(violations);
  }

  /**
   * Returns the individual violations reported by the validator.
   *
   * @return immutable list, possibly empty
   */
  public List<String> violations() {
    return violations;
  }

  @Override
  public String kind() {
    return KIND;
  }
}
