package ca.gc.cra.relay.application.content;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.relay.application.port.SchemaValidator;
import ca.gc.cra.relay.domain.content.Dataset;
import ca.gc.cra.relay.domain.content.Manifest;
import ca.gc.cra.relay.domain.contract.ServiceContract;
import ca.gc.cra.relay.domain.error.ValidationException;
import ca.gc.cra.relay.infrastructure.schema.NetworkntSchemaValidator;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ManifestValidatorTest {
  private static final ServiceContract NEEDS_INPUT =
      new ServiceContract(null, null, null, Set.of("input"));

  private final ManifestValidator validator = new ManifestValidator(SchemaValidator.ACCEPT_ALL);

  @Test
  void missingManifestAllowedWhenNoDatasetsDeclared() {
    assertDoesNotThrow(() -> validator.validate(null, ServiceContract.permissive()));
  }

  @Test
  void missingManifestRejectedWhenDatasetsDeclared() {
    ValidationException ex = assertThrows(ValidationException.class, () -> validator.validate(null, NEEDS_INPUT));
    assertEquals("ValidationError", ex.kind());
  }

  @Test
  void reportsMissingAndUnresolvedDatasets() {
    Map<String, Dataset> datasets = new HashMap<>();
    datasets.put("other", null);
    Manifest manifest = new Manifest("m1", Instant.EPOCH, datasets);

    ValidationException ex = assertThrows(ValidationException.class, () -> validator.validate(manifest, NEEDS_INPUT));

    assertEquals(2, ex.violations().size());
    assertTrue(ex.violations().contains("missing dataset 'input'"));
  }

  @Test
  void appliesManifestSchemaToSerializedForm() {
    Map<String, Object> schema = Map.of(
        "type", "object",
        "required", List.of("datasets"),
        "properties", Map.of("datasets", Map.of("type", "object", "required", List.of("input"))));
    ServiceContract contract = new ServiceContract(null, null, schema, Set.of());
    ManifestValidator strict = new ManifestValidator(new NetworkntSchemaValidator());
    Manifest empty = new Manifest("m1", Instant.EPOCH, Map.of());
    Manifest withInput = new Manifest("m2", Instant.EPOCH,
        Map.of("input", new Dataset("d1", "input", Set.of(), Set.of())));

    assertThrows(ValidationException.class, () -> strict.validate(empty, contract));
    assertDoesNotThrow(() -> strict.validate(withInput, contract));
  }

  @Test
  void acceptsManifestWithRequiredDataset() {
    Manifest manifest = new Manifest("m1", Instant.EPOCH,
        Map.of("input", new Dataset("d1", "input", Set.of(), Set.of())));
    List<String> seen = new ArrayList<>();
    ManifestValidator recording = new ManifestValidator((label, document, schema) -> seen.add(label));

    assertDoesNotThrow(() -> recording.validate(manifest, NEEDS_INPUT));
    assertTrue(seen.isEmpty(), "No manifest schema declared so the schema validator is not consulted");
  }
}
