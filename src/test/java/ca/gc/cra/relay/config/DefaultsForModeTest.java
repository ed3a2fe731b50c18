package ca.gc.cra.relay.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void invokerDefaultsIncludeCommonAndRetrySettings() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("invoker");

    assertEquals("MEMORY", defaults.get("transport"));
    assertEquals("16", defaults.get("maxInFlight"));
    assertEquals("60000", defaults.get("idleTimeoutMs"));
    assertEquals("0", defaults.get("maxRetries"));
    assertEquals("2.0", defaults.get("backoffMultiplier"));
    assertFalse(defaults.containsKey("heartbeatIntervalMs"));
  }

  @Test
  void responderDefaultsIncludeHeartbeatAndCache() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap(" Responder ");

    assertEquals("10000", defaults.get("heartbeatIntervalMs"));
    assertEquals("10000", defaults.get("answeredCacheSize"));
    assertEquals("4", defaults.get("analysisConcurrency"));
    assertFalse(defaults.containsKey("idleTimeoutMs"));
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }
}
