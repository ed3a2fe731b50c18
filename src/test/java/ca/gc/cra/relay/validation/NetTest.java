package ca.gc.cra.relay.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NetTest {

  @Test
  void validateHostPortHandlesHostname() {
    assertEquals("broker.internal:9092", Net.validateHostPort(" broker.internal:9092 "));
  }

  @Test
  void validateHostPortHandlesIpv4() {
    assertEquals("10.0.0.1:9092", Net.validateHostPort("10.0.0.1:9092"));
  }

  @Test
  void validateHostPortHandlesIpv6() {
    assertEquals("[2001:db8::1]:9093", Net.validateHostPort("[2001:db8::1]:9093"));
  }

  @Test
  void validateHostPortRejectsMalformedEndpoints() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("localhost"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("localhost:70000"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("localhost:http"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("2001:db8::1:443"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("[2001:db8::1]9093"));
  }

  @Test
  void validateBootstrapNormalizesList() {
    assertEquals("a:1,b:2", Net.validateBootstrap("a:1, b:2"));
  }

  @Test
  void validateBootstrapRejectsEmptyEndpoint() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Net.validateBootstrap("a:1,,b:2"));
    assertEquals("kafkaBootstrap contains an empty endpoint", ex.getMessage());
  }
}
