package ca.gc.cra.relay.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class TransportModeTest {

  @Test
  void parsesCaseInsensitively() {
    assertEquals(TransportMode.KAFKA, TransportMode.fromString(" kafka "));
    assertEquals(TransportMode.MEMORY, TransportMode.fromString("Memory"));
    assertEquals(TransportMode.MEMORY, TransportMode.fromString(null));
  }

  @Test
  void rejectsUnknownTransport() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> TransportMode.fromString("rabbit"));
    assertEquals("Unknown transport: rabbit", ex.getMessage());
  }
}
