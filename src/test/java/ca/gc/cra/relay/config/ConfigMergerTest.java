package ca.gc.cra.relay.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void overridesBeatYamlAndEmitWarnings() {
    Map<String, String> defaults = Map.of("invokerId", "", "maxRetries", "0", "transport", "MEMORY");
    Map<String, String> yaml = Map.of("invokerId", "parent", "maxRetries", "2");
    Map<String, String> overrides = Map.of("maxRetries", "5");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "invoker",
        Optional.of(yaml),
        overrides,
        defaults,
        warnings::add);

    assertEquals("parent", merged.get("invokerId"));
    assertEquals("5", merged.get("maxRetries"));
    assertEquals("MEMORY", merged.get("transport"));
    assertEquals(List.of("Override replaces YAML value for key: maxRetries"), warnings);
  }

  @Test
  void nullOverrideValuesKeepEarlierLayer() {
    Map<String, String> overrides = new HashMap<>();
    overrides.put("serviceId", null);

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "responder",
        Optional.of(Map.of("serviceId", "square")),
        overrides,
        Map.of(),
        msg -> {});

    assertEquals("square", merged.get("serviceId"));
  }

  @Test
  void kafkaTransportRequiresBootstrap() {
    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "invoker",
            Optional.empty(),
            Map.of("transport", "kafka"),
            Map.of("kafkaBootstrap", ""),
            msg -> {}));

    assertTrue(ex.getMessage().contains("kafkaBootstrap"));
  }

  @Test
  void kafkaTransportWithBootstrapIsAccepted() {
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "invoker",
        Optional.of(Map.of("kafkaBootstrap", "broker:9092")),
        Map.of("transport", "KAFKA"),
        Map.of(),
        null);

    assertEquals("broker:9092", merged.get("kafkaBootstrap"));
  }
}
