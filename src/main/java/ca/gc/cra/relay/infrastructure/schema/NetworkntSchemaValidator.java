package ca.gc.cra.relay.infrastructure.schema;

import ca.gc.cra.relay.application.port.SchemaValidator;
import ca.gc.cra.relay.domain.error.ValidationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SchemaValidator} backed by the NetworkNT JSON Schema validator (draft 7).
 *
 * <p>Compiled schemas are cached per schema document; a contract's schemas are compiled once and
 * reused for every question.</p>
 */
public final class NetworkntSchemaValidator implements SchemaValidator {
  private static final Logger log = LoggerFactory.getLogger(NetworkntSchemaValidator.class);

  private final ObjectMapper mapper = new ObjectMapper();
  private final JsonSchemaFactory schemaFactory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
  private final ConcurrentMap<Map<String, Object>, JsonSchema> compiled = new ConcurrentHashMap<>();

  @Override
  public void validate(String label, Object document, Map<String, Object> schema) {
    if (schema == null) {
      return;
    }
    JsonSchema jsonSchema = compiled.computeIfAbsent(schema, this::compile);
    JsonNode node = mapper.valueToTree(document);
    Set<ValidationMessage> errors = jsonSchema.validate(node);
    if (errors.isEmpty()) {
      return;
    }
    List<String> violations = errors.stream()
        .map(ValidationMessage::getMessage)
        .sorted()
        .collect(Collectors.toList());
    log.debug("{} failed schema validation: {}", label, violations);
    throw new ValidationException(label + " failed schema validation: " + String.join("; ", violations), violations);
  }

  private JsonSchema compile(Map<String, Object> schema) {
    try {
      return schemaFactory.getSchema(mapper.valueToTree(schema));
    } catch (RuntimeException ex) {
      throw new IllegalArgumentException("Schema cannot be compiled: " + ex.getMessage(), ex);
    }
  }
}
