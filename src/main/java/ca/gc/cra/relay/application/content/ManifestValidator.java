package ca.gc.cra.relay.application.content;

import ca.gc.cra.relay.application.port.SchemaValidator;
import ca.gc.cra.relay.domain.content.Datafile;
import ca.gc.cra.relay.domain.content.Dataset;
import ca.gc.cra.relay.domain.content.Manifest;
import ca.gc.cra.relay.domain.contract.ServiceContract;
import ca.gc.cra.relay.domain.error.ValidationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Checks that a manifest may be sent to, or accepted from, a service with a given contract.
 *
 * @since 0.1.0
 */
public final class ManifestValidator {
  private final SchemaValidator schemaValidator;

  public ManifestValidator(SchemaValidator schemaValidator) {
    this.schemaValidator = Objects.requireNonNull(schemaValidator, "schemaValidator");
  }

  /**
   * Validates a manifest against a contract.
   *
   * @param manifest manifest to check; {@code null} passes only when the contract requires no datasets
   * @param contract service contract
   * @throws ValidationException listing every violation found
   */
  public void validate(Manifest manifest, ServiceContract contract) {
    Objects.requireNonNull(contract, "contract");
    if (manifest == null) {
      if (contract.requiresManifest()) {
        throw new ValidationException(
            "input_manifest is required; expected datasets " + contract.requiredInputDatasets());
      }
      return;
    }
    List<String> violations = new ArrayList<>();
    for (String key : contract.requiredInputDatasets()) {
      if (!manifest.datasets().containsKey(key)) {
        violations.add("missing dataset '" + key + "'");
      }
    }
    for (Map.Entry<String, Dataset> entry : manifest.datasets().entrySet()) {
      Dataset dataset = entry.getValue();
      if (dataset == null) {
        violations.add("dataset '" + entry.getKey() + "' is referenced but does not exist");
        continue;
      }
      for (Datafile file : dataset.files()) {
        if (!file.location().isAbsolute()) {
          violations.add("datafile '" + file.name() + "' in dataset '" + entry.getKey()
              + "' has a relative location");
        }
      }
    }
    if (!violations.isEmpty()) {
      throw new ValidationException("input_manifest is invalid: " + String.join("; ", violations), violations);
    }
    if (contract.inputManifestSchema() != null) {
      schemaValidator.validate("input_manifest", ManifestSerializer.serialize(manifest), contract.inputManifestSchema());
    }
  }
}
