package ca.gc.cra.relay.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void invokerCombinesYamlDefaultsAndOverrides() throws IOException {
    Path yaml = tempDir.resolve("relay.yaml");
    Files.writeString(yaml, """
        common:
          maxInFlight: 8
        invoker:
          invokerId: parent
          idleTimeoutMs: 5000
        """);

    InvokerConfig config = ConfigLoader.loadInvoker(yaml, Map.of("idleTimeoutMs", "7000"));

    assertEquals("parent", config.invokerId());
    assertEquals(8, config.transport().maxInFlight());
    assertEquals(Duration.ofMillis(7000), config.idleTimeout());
    assertEquals(3, config.transport().publishRetries());
  }

  @Test
  void missingYamlFallsBackToOverrides() throws IOException {
    ResponderConfig config = ConfigLoader.loadResponder(
        tempDir.resolve("absent.yaml"), Map.of("serviceId", "square", "analysisConcurrency", "2"));

    assertEquals("square", config.serviceId());
    assertEquals(2, config.analysisConcurrency());
  }

  @Test
  void responderWithoutIdentityIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> ConfigLoader.loadResponder(null, Map.of()));
  }
}
