package ca.gc.cra.relay.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and caller overrides while enforcing precedence and invariants.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence overrides &gt; YAML &gt; defaults.
   *
   * @param mode active role ({@code invoker} or {@code responder})
   * @param yaml optional YAML-derived settings for the mode
   * @param overrides caller key/value overrides (may be empty)
   * @param defaults embedded defaults for the mode
   * @param warn consumer invoked when an override replaces a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> overrides,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> overridesCopy = overrides == null ? Map.of() : overrides;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : overridesCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      String value = entry.getValue();
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("Override replaces YAML value for key: " + key);
      }
      if (value != null) {
        merged.put(key, value);
      }
    }

    validate(merged);
    return Map.copyOf(merged);
  }

  private static void validate(Map<String, String> effective) {
    String transport = trim(effective.get("transport"));
    if (transport.equalsIgnoreCase(TransportMode.KAFKA.name())
        && trim(effective.get("kafkaBootstrap")).isEmpty()) {
      throw new IllegalArgumentException("kafkaBootstrap is required when transport=KAFKA");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
