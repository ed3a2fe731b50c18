package ca.gc.cra.relay.config;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Resolves {@link InvokerConfig} and {@link ResponderConfig} from YAML and overrides.
 * <p><strong>Role:</strong> Entry point used by service bootstraps; combines {@link YamlConfigLoader},
 * {@link DefaultsForMode} and {@link ConfigMerger}.</p>
 * <p><strong>Thread-safety:</strong> Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class ConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

  private ConfigLoader() {}

  /**
   * Loads invoker configuration.
   *
   * @param yaml optional YAML file; a missing file means defaults and overrides only
   * @param overrides highest-precedence values
   * @return bound configuration
   * @throws IOException if the YAML file exists but cannot be read
   */
  public static InvokerConfig loadInvoker(Path yaml, Map<String, String> overrides) throws IOException {
    return InvokerConfig.fromMap(effective(DefaultsForMode.INVOKER, yaml, overrides));
  }

  /**
   * Loads responder configuration.
   *
   * @param yaml optional YAML file; a missing file means defaults and overrides only
   * @param overrides highest-precedence values
   * @return bound configuration
   * @throws IOException if the YAML file exists but cannot be read
   */
  public static ResponderConfig loadResponder(Path yaml, Map<String, String> overrides) throws IOException {
    return ResponderConfig.fromMap(effective(DefaultsForMode.RESPONDER, yaml, overrides));
  }

  private static Map<String, String> effective(String mode, Path yaml, Map<String, String> overrides)
      throws IOException {
    Optional<Map<String, String>> fromYaml = yaml == null ? Optional.empty() : YamlConfigLoader.load(yaml, mode);
    if (yaml != null && fromYaml.isEmpty()) {
      log.info("Config file {} not found; using defaults and overrides", yaml);
    }
    return ConfigMerger.buildEffectiveConfig(
        mode, fromYaml, overrides, DefaultsForMode.asFlatMap(mode), log::warn);
  }
}
