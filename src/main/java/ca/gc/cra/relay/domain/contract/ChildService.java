package ca.gc.cra.relay.domain.contract;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A child service that can be asked questions: its identity and advertised contract.
 *
 * @param id service identity; forms part of bus destination names
 * @param name human-readable name used in logs
 * @param contract schemas advertised by the child
 * @since 0.1.0
 */
public record ChildService(String id, String name, ServiceContract contract) {
  private static final Pattern ID_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");

  public ChildService {
    Objects.requireNonNull(id, "id");
    if (!ID_PATTERN.matcher(id).matches()) {
      throw new IllegalArgumentException("Service id must match [A-Za-z0-9._-]+: " + id);
    }
    name = (name == null || name.isBlank()) ? id : name;
    contract = contract == null ? ServiceContract.permissive() : contract;
  }

  /**
   * Creates a child with a permissive contract.
   *
   * @param id service identity
   * @return child reference
   */
  public static ChildService of(String id) {
    return new ChildService(id, id, ServiceContract.permissive());
  }

  /**
   * Returns the destination on which the child consumes questions.
   *
   * @return question destination name
   */
  public String questionDestination() {
    return Destinations.questions(id);
  }
}
