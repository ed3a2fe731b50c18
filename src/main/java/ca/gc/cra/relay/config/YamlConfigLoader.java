package ca.gc.cra.relay.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads the RELAY YAML file, which holds one section shared by both roles and one per role.
 *
 * <pre>
 * common:
 *   transport: KAFKA
 *   kafkaBootstrap: kafka:9092
 * invoker:
 *   invokerId: orchestrator
 *   maxRetries: 2
 * responder:
 *   serviceId: square
 *   contract: /etc/relay/square.json
 * </pre>
 *
 * <p>Section names are matched case-insensitively. The role section is laid over {@code common};
 * the other role's section is ignored. Nested mappings become dotted keys
 * ({@code limits: {heartbeat: {ms: 500}}} yields {@code limits.heartbeat.ms}) and a null value
 * becomes the empty string. Top-level sections other than these three are logged and skipped.</p>
 */
public final class YamlConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(YamlConfigLoader.class);

  private static final String COMMON = "common";
  private static final List<String> SECTIONS =
      List.of(COMMON, DefaultsForMode.INVOKER, DefaultsForMode.RESPONDER);

  private YamlConfigLoader() {}

  /**
   * Reads {@code path} and returns the flat settings for one role.
   *
   * @param path location of the YAML configuration
   * @param mode {@code invoker} or {@code responder}
   * @return {@code common} settings overlaid with the role's settings, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException for an unknown role or a document that is not a mapping of sections
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    String role = role(mode);
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }
    Map<String, Object> sections = sections(document, path);
    Map<String, String> settings = new LinkedHashMap<>();
    putFlattened(sections.get(COMMON), COMMON, "", settings);
    putFlattened(sections.get(role), role, "", settings);
    return Optional.of(Map.copyOf(settings));
  }

  private static String role(String mode) {
    Objects.requireNonNull(mode, "mode");
    String role = mode.trim().toLowerCase(Locale.ROOT);
    if (!DefaultsForMode.INVOKER.equals(role) && !DefaultsForMode.RESPONDER.equals(role)) {
      throw new IllegalArgumentException("Unknown RELAY role '" + mode + "'; expected invoker or responder");
    }
    return role;
  }

  /** Indexes the top-level sections by lower-cased name. */
  private static Map<String, Object> sections(Object document, Path path) {
    if (!(document instanceof Map<?, ?> root)) {
      throw new IllegalArgumentException("Config at " + path + " must be a mapping of sections");
    }
    Map<String, Object> sections = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : root.entrySet()) {
      String name = String.valueOf(entry.getKey()).trim().toLowerCase(Locale.ROOT);
      if (!SECTIONS.contains(name)) {
        log.warn("Ignoring unknown section '{}' in {}; expected one of {}", entry.getKey(), path, SECTIONS);
        continue;
      }
      if (sections.containsKey(name)) {
        throw new IllegalArgumentException("Section '" + name + "' appears more than once in " + path);
      }
      sections.put(name, entry.getValue());
    }
    return sections;
  }

  private static void putFlattened(Object node, String where, String prefix, Map<String, String> settings) {
    if (node == null) {
      return;
    }
    if (!(node instanceof Map<?, ?> mapping)) {
      throw new IllegalArgumentException("'" + where + "' must be a mapping");
    }
    for (Map.Entry<?, ?> entry : mapping.entrySet()) {
      if (!(entry.getKey() instanceof String name) || name.isBlank()) {
        throw new IllegalArgumentException("'" + where + "' has a blank or non-string key");
      }
      String key = prefix.isEmpty() ? name : prefix + '.' + name;
      Object value = entry.getValue();
      if (value instanceof Map<?, ?>) {
        putFlattened(value, key, key, settings);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("Lists are not supported for setting '" + key + "'");
      } else {
        settings.put(key, value == null ? "" : value.toString());
      }
    }
  }
}
