package ca.gc.cra.relay.application.port;

import java.util.Map;

/**
 * Black-box {@code validate(document, schema)} capability consumed by the protocol.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface SchemaValidator {
  /**
   * Validates a JSON-compatible document against a JSON schema.
   *
   * @param label name of the validated document used in error messages, e.g. {@code input_values}
   * @param document document made of maps, lists, and primitives
   * @param schema parsed JSON schema; {@code null} accepts any document
   * @throws ca.gc.cra.relay.domain.error.ValidationException when the document does not conform
   */
  void validate(String label, Object document, Map<String, Object> schema);

  /** Validator accepting every document. */
  SchemaValidator ACCEPT_ALL = (label, document, schema) -> {};
}
