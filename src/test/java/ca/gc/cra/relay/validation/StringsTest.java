package ca.gc.cra.relay.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("value", Strings.requireNonBlank("name", "  value "));
  }

  @Test
  void requireNonBlankRejectsBlankAndControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "   "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "a\u0007b"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("name", null));
  }

  @Test
  void sanitizeIdentifierAcceptsDestinationSafeNames() {
    assertEquals("square-v2.1_beta", Strings.sanitizeIdentifier("serviceId", " square-v2.1_beta "));
  }

  @Test
  void sanitizeIdentifierRejectsUnsafeNames() {
    assertThrows(IllegalArgumentException.class, () -> Strings.sanitizeIdentifier("serviceId", "square/v2"));
    assertThrows(IllegalArgumentException.class, () -> Strings.sanitizeIdentifier("serviceId", "two words"));
    assertThrows(IllegalArgumentException.class,
        () -> Strings.sanitizeIdentifier("serviceId", "x".repeat(201)));
  }
}
