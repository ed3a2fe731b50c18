package ca.gc.cra.relay.infrastructure.schema;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.relay.domain.error.ValidationException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class NetworkntSchemaValidatorTest {
  private static final Map<String, Object> SCHEMA = Map.of(
      "type", "object",
      "properties", Map.of("n", Map.of("type", "integer", "minimum", 0)),
      "required", List.of("n"));

  private final NetworkntSchemaValidator validator = new NetworkntSchemaValidator();

  @Test
  void acceptsConformingDocument() {
    assertDoesNotThrow(() -> validator.validate("input_values", Map.of("n", 5), SCHEMA));
  }

  @Test
  void reportsEveryViolation() {
    ValidationException ex = assertThrows(ValidationException.class,
        () -> validator.validate("input_values", Map.of("n", "five"), SCHEMA));

    assertEquals("ValidationError", ex.kind());
    assertFalse(ex.violations().isEmpty());
    assertTrue(ex.getMessage().startsWith("input_values failed schema validation"));
  }

  @Test
  void missingRequiredPropertyFails() {
    assertThrows(ValidationException.class, () -> validator.validate("input_values", Map.of(), SCHEMA));
  }

  @Test
  void nullSchemaAcceptsAnything() {
    assertDoesNotThrow(() -> validator.validate("input_values", "whatever", null));
  }
}
