package ca.gc.cra.relay.infrastructure.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.relay.domain.contract.ServiceContract;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ServiceContractLoaderTest {
  @TempDir Path tempDir;

  private final ServiceContractLoader loader = new ServiceContractLoader();

  @Test
  void loadsSchemasFromClasspath() throws IOException {
    ServiceContract contract = loader.loadResource("contracts/square.json");

    assertNotNull(contract.inputValuesSchema());
    assertNotNull(contract.outputValuesSchema());
    assertNull(contract.inputManifestSchema());
    assertFalse(contract.requiresManifest());
  }

  @Test
  void readsDeclaredDatasetsFromObjectForm() throws IOException {
    ServiceContract contract = loader.loadResource("contracts/with-manifest.json");

    assertEquals(Set.of("input"), contract.requiredInputDatasets());
    assertTrue(contract.requiresManifest());
  }

  @Test
  void readsDeclaredDatasetsFromListForm() {
    ServiceContract contract = loader.parse(Map.of("input_manifest", Map.of("datasets", List.of("a", "b"))));

    assertEquals(Set.of("a", "b"), contract.requiredInputDatasets());
  }

  @Test
  void loadsFromFile() throws IOException {
    Path file = tempDir.resolve("contract.json");
    Files.writeString(file, "{\"output_values_schema\": {\"type\": \"object\"}}");

    ServiceContract contract = loader.load(file);

    assertEquals(Map.of("type", "object"), contract.outputValuesSchema());
    assertNull(contract.inputValuesSchema());
  }

  @Test
  void rejectsNonObjectSections() {
    assertThrows(IllegalArgumentException.class, () -> loader.parse(Map.of("input_values_schema", "string")));
    assertThrows(IOException.class, () -> loader.loadResource("contracts/missing.json"));
  }
}
