package ca.gc.cra.relay.domain.contract;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * <strong>What:</strong> Schemas a service advertises for its questions and answers.
 * <p><strong>Why:</strong> The asker validates inputs locally before publishing; the responder
 * validates them again on receipt and checks its own outputs before answering.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param inputValuesSchema JSON schema (as a parsed map) for input values; {@code null} accepts anything
 * @param outputValuesSchema JSON schema for output values; {@code null} accepts anything
 * @param inputManifestSchema JSON schema applied to the serialized input manifest; may be {@code null}
 * @param requiredInputDatasets dataset keys that must be present in the input manifest
 * @since 0.1.0
 */
public record ServiceContract(
    Map<String, Object> inputValuesSchema,
    Map<String, Object> outputValuesSchema,
    Map<String, Object> inputManifestSchema,
    Set<String> requiredInputDatasets) {

  public ServiceContract {
    inputValuesSchema = freeze(inputValuesSchema);
    outputValuesSchema = freeze(outputValuesSchema);
    inputManifestSchema = freeze(inputManifestSchema);
    requiredInputDatasets = requiredInputDatasets == null ? Set.of() : Set.copyOf(requiredInputDatasets);
  }

  private static Map<String, Object> freeze(Map<String, Object> schema) {
    return schema == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(schema));
  }

  /**
   * Contract that accepts any values and manifest.
   *
   * @return permissive contract
   */
  public static ServiceContract permissive() {
    return new ServiceContract(null, null, null, Set.of());
  }

  /** {@code true} when a manifest is required because datasets are declared. */
  public boolean requiresManifest() {
    return !requiredInputDatasets.isEmpty();
  }
}
