package ca.gc.cra.relay.infrastructure.schema;

import ca.gc.cra.relay.domain.contract.ServiceContract;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads a {@link ServiceContract} from a JSON contract document.
 *
 * <p>Recognised keys:</p>
 * <pre>
 * {
 *   "input_values_schema":  { ...draft-7 schema... },
 *   "output_values_schema": { ...draft-7 schema... },
 *   "input_manifest": {
 *     "datasets": { "input": { "purpose": "..." } },
 *     "schema":   { ...draft-7 schema applied to the serialized manifest... }
 *   }
 * }
 * </pre>
 */
public final class ServiceContractLoader {
  private static final Logger log = LoggerFactory.getLogger(ServiceContractLoader.class);
  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private final ObjectMapper mapper = new ObjectMapper();

  /**
   * Loads a contract from a file.
   *
   * @param path contract document
   * @return parsed contract
   * @throws IOException when the file cannot be read or parsed
   */
  public ServiceContract load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    try (InputStream in = Files.newInputStream(path)) {
      ServiceContract contract = parse(mapper.readValue(in, MAP_TYPE));
      log.info("Loaded service contract from {}", path);
      return contract;
    }
  }

  /**
   * Loads a contract from the classpath.
   *
   * @param resource classpath resource name, e.g. {@code contracts/square.json}
   * @return parsed contract
   * @throws IOException when the resource is missing or invalid
   */
  public ServiceContract loadResource(String resource) throws IOException {
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    try (InputStream in = loader.getResourceAsStream(resource)) {
      if (in == null) {
        throw new IOException("Contract resource not found: " + resource);
      }
      return parse(mapper.readValue(in, MAP_TYPE));
    }
  }

  /**
   * Builds a contract from an already parsed document.
   *
   * @param document contract document
   * @return contract
   */
  public ServiceContract parse(Map<String, Object> document) {
    Objects.requireNonNull(document, "document");
    Map<String, Object> manifestSection = section(document, "input_manifest");
    Set<String> datasets = new LinkedHashSet<>();
    Map<String, Object> manifestSchema = null;
    if (manifestSection != null) {
      Object declared = manifestSection.get("datasets");
      if (declared instanceof Map<?, ?> map) {
        map.keySet().forEach(key -> datasets.add(String.valueOf(key)));
      } else if (declared instanceof Collection<?> list) {
        list.forEach(key -> datasets.add(String.valueOf(key)));
      } else if (declared != null) {
        throw new IllegalArgumentException("input_manifest.datasets must be an object or list");
      }
      manifestSchema = section(manifestSection, "schema");
    }
    return new ServiceContract(
        section(document, "input_values_schema"),
        section(document, "output_values_schema"),
        manifestSchema,
        datasets);
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> section(Map<String, Object> parent, String key) {
    Object value = parent.get(key);
    if (value == null) {
      return null;
    }
    if (!(value instanceof Map<?, ?>)) {
      throw new IllegalArgumentException(key + " must be a JSON object");
    }
    return (Map<String, Object>) value;
  }
}
