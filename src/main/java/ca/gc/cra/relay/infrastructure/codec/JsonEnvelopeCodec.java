package ca.gc.cra.relay.infrastructure.codec;

import ca.gc.cra.relay.application.content.ManifestSerializer;
import ca.gc.cra.relay.application.port.EnvelopeCodec;
import ca.gc.cra.relay.application.port.MetricsPort;
import ca.gc.cra.relay.domain.content.Manifest;
import ca.gc.cra.relay.domain.envelope.Envelope;
import ca.gc.cra.relay.domain.envelope.EnvelopePayload;
import ca.gc.cra.relay.domain.envelope.ExceptionPayload;
import ca.gc.cra.relay.domain.envelope.HeartbeatPayload;
import ca.gc.cra.relay.domain.envelope.LogRecordPayload;
import ca.gc.cra.relay.domain.envelope.MessageType;
import ca.gc.cra.relay.domain.envelope.MonitorPayload;
import ca.gc.cra.relay.domain.envelope.QuestionPayload;
import ca.gc.cra.relay.domain.envelope.ResultPayload;
import ca.gc.cra.relay.domain.envelope.SenderRole;
import ca.gc.cra.relay.domain.error.MalformedMessageException;
import ca.gc.cra.relay.domain.error.PayloadTooLargeException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * <strong>What:</strong> JSON implementation of {@link EnvelopeCodec} backed by Jackson.
 * <p><strong>Why:</strong> Gives every service on the bus the same
 * {@code {type, correlation_id, ordering_number, sender_role, protocol_version, payload}} shape.</p>
 * <p><strong>Role:</strong> Infrastructure adapter used by every transport.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe; the underlying {@link ObjectMapper} is shared.</p>
 * <p><strong>Observability:</strong> Emits {@code codec.decode.malformed} and
 * {@code codec.fragmented}.</p>
 *
 * @since 0.1.0
 */
public final class JsonEnvelopeCodec implements EnvelopeCodec {
  /** Default maximum encoded payload size. */
  public static final int DEFAULT_MAX_PAYLOAD_BYTES = 64 * 1024;
  /** Smallest accepted fragmentation threshold. */
  public static final int MIN_PAYLOAD_BYTES = 512;

  private final ObjectMapper mapper;
  private final int maxPayloadBytes;
  private final MetricsPort metrics;

  /** Creates a codec with the default 64 KiB payload limit and no metrics. */
  public JsonEnvelopeCodec() {
    this(DEFAULT_MAX_PAYLOAD_BYTES, MetricsPort.NO_OP);
  }

  /**
   * Creates a codec.
   *
   * @param maxPayloadBytes largest encoded payload before streamed messages are fragmented
   * @param metrics metrics sink
   */
  public JsonEnvelopeCodec(int maxPayloadBytes, MetricsPort metrics) {
    if (maxPayloadBytes < MIN_PAYLOAD_BYTES) {
      throw new IllegalArgumentException("maxPayloadBytes must be >= " + MIN_PAYLOAD_BYTES);
    }
    this.maxPayloadBytes = maxPayloadBytes;
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.mapper = JsonMapper.builder()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
        .build();
  }

  @Override
  public int maxPayloadBytes() {
    return maxPayloadBytes;
  }

  @Override
  public byte[] encode(Envelope envelope) {
    Objects.requireNonNull(envelope, "envelope");
    ObjectNode root = mapper.createObjectNode();
    root.put("type", envelope.type().wireName());
    root.put("correlation_id", envelope.correlationId());
    root.put("ordering_number", envelope.orderingNumber());
    root.put("sender_role", envelope.senderRole().wireName());
    root.put("protocol_version", envelope.protocolVersion());
    ObjectNode payload = payloadNode(envelope.payload());
    root.set("payload", payload);
    try {
      if (!envelope.type().isStreamed()) {
        requireFits(envelope.type().wireName(), mapper.writeValueAsBytes(payload).length);
      }
      return mapper.writeValueAsBytes(root);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("Envelope " + envelope.correlationId() + " is not JSON-encodable", ex);
    }
  }

  @Override
  public Envelope decode(byte[] bytes) {
    if (bytes == null || bytes.length == 0) {
      metrics.increment("codec.decode.malformed");
      throw new MalformedMessageException("Empty message body");
    }
    try {
      return decodeTree(mapper.readTree(bytes));
    } catch (IOException ex) {
      metrics.increment("codec.decode.malformed");
      throw new MalformedMessageException("Message body is not valid JSON", ex);
    } catch (MalformedMessageException ex) {
      metrics.increment("codec.decode.malformed");
      throw ex;
    } catch (IllegalArgumentException ex) {
      metrics.increment("codec.decode.malformed");
      throw new MalformedMessageException("Envelope violates protocol constraints: " + ex.getMessage(), ex);
    }
  }

  @Override
  public Object parseValue(String json) {
    Objects.requireNonNull(json, "json");
    try {
      return mapper.readValue(json, Object.class);
    } catch (JsonProcessingException ex) {
      throw new MalformedMessageException("Reassembled value is not valid JSON", ex);
    }
  }

  @Override
  public List<Envelope> fragment(Envelope envelope, LongSupplier orderingNumbers) {
    Objects.requireNonNull(envelope, "envelope");
    Objects.requireNonNull(orderingNumbers, "orderingNumbers");
    EnvelopePayload payload = envelope.payload();
    if (!envelope.type().isStreamed()) {
      requireFits(envelope.type().wireName(), payloadSize(payload));
      return List.of(renumber(envelope, payload, orderingNumbers.getAsLong()));
    }
    if (payloadSize(payload) <= maxPayloadBytes) {
      return List.of(renumber(envelope, payload, orderingNumbers.getAsLong()));
    }
    List<EnvelopePayload> parts = new ArrayList<>();
    if (payload instanceof LogRecordPayload logRecord) {
      LogRecordPayload empty = new LogRecordPayload(logRecord.level(), "", logRecord.timestamp(), true);
      List<String> chunks = split(logRecord.message(), maxPayloadBytes - payloadSize(empty));
      for (int i = 0; i < chunks.size(); i++) {
        boolean more = i < chunks.size() - 1 || logRecord.continuation();
        parts.add(new LogRecordPayload(logRecord.level(), chunks.get(i), logRecord.timestamp(), more));
      }
    } else if (payload instanceof MonitorPayload monitor) {
      String text = writeJson(monitor.data());
      List<String> chunks = split(text, maxPayloadBytes - payloadSize(new MonitorPayload("", true, true)));
      for (int i = 0; i < chunks.size(); i++) {
        parts.add(new MonitorPayload(chunks.get(i), i < chunks.size() - 1, true));
      }
    }
    metrics.increment("codec.fragmented");
    List<Envelope> out = new ArrayList<>(parts.size());
    for (EnvelopePayload part : parts) {
      out.add(renumber(envelope, part, orderingNumbers.getAsLong()));
    }
    return out;
  }

  private static Envelope renumber(Envelope source, EnvelopePayload payload, long orderingNumber) {
    return new Envelope(
        source.correlationId(), orderingNumber, source.senderRole(), source.protocolVersion(), payload);
  }

  private void requireFits(String type, int size) {
    if (size > maxPayloadBytes) {
      metrics.increment("codec.encode.tooLarge");
      throw new PayloadTooLargeException(type, size, maxPayloadBytes);
    }
  }

  private int payloadSize(EnvelopePayload payload) {
    try {
      return mapper.writeValueAsBytes(payloadNode(payload)).length;
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("Payload is not JSON-encodable", ex);
    }
  }

  /** Splits text so each slice, once JSON-escaped, fits within {@code budget} bytes. */
  private static List<String> split(String text, int budget) {
    if (budget <= 0) {
      throw new IllegalStateException("maxPayloadBytes leaves no room for fragment content");
    }
    List<String> chunks = new ArrayList<>();
    int start = 0;
    int used = 0;
    int i = 0;
    while (i < text.length()) {
      int codePoint = text.codePointAt(i);
      int cost = escapedLength(codePoint);
      if (used + cost > budget && i > start) {
        chunks.add(text.substring(start, i));
        start = i;
        used = 0;
      }
      used += cost;
      i += Character.charCount(codePoint);
    }
    chunks.add(text.substring(start));
    return chunks;
  }

  private static int escapedLength(int codePoint) {
    if (codePoint == '"' || codePoint == '\\') {
      return 2;
    }
    if (codePoint < 0x20) {
      return 6;
    }
    if (codePoint < 0x80) {
      return 1;
    }
    if (codePoint < 0x800) {
      return 2;
    }
    return codePoint < 0x10000 ? 3 : 4;
  }

  private String writeJson(Object value) {
    try {
      return mapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("Monitor data is not JSON-encodable", ex);
    }
  }

  private ObjectNode payloadNode(EnvelopePayload payload) {
    ObjectNode node = mapper.createObjectNode();
    if (payload instanceof QuestionPayload question) {
      node.set("input_values", valueNode(question.inputValues()));
      node.set("input_manifest", manifestNode(question.inputManifest()));
      node.set("child_identities_allowed", mapper.valueToTree(question.childIdentitiesAllowed()));
      node.put("reply_to", question.replyTo());
    } else if (payload instanceof LogRecordPayload logRecord) {
      node.put("level", logRecord.level());
      node.put("message", logRecord.message());
      node.put("timestamp", logRecord.timestamp().toString());
      node.put("continuation", logRecord.continuation());
    } else if (payload instanceof MonitorPayload monitor) {
      node.set("data", valueNode(monitor.data()));
      node.put("continuation", monitor.continuation());
      if (monitor.fragment()) {
        node.put("fragment", true);
      }
    } else if (payload instanceof ResultPayload result) {
      node.set("output_values", valueNode(result.outputValues()));
      node.set("output_manifest", manifestNode(result.outputManifest()));
    } else if (payload instanceof ExceptionPayload exception) {
      node.put("kind", exception.kind());
      node.put("message", exception.message());
      node.set("detail", valueNode(exception.detail()));
    } else if (payload instanceof HeartbeatPayload heartbeat) {
      node.put("timestamp", heartbeat.timestamp().toString());
    }
    return node;
  }

  private JsonNode valueNode(Object value) {
    try {
      return mapper.valueToTree(value);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Value of type " + value.getClass().getName() + " is not JSON-compatible", ex);
    }
  }

  private JsonNode manifestNode(Manifest manifest) {
    return manifest == null ? mapper.nullNode() : mapper.valueToTree(ManifestSerializer.serialize(manifest));
  }

  private Envelope decodeTree(JsonNode root) {
    if (root == null || !root.isObject()) {
      throw new MalformedMessageException("Envelope must be a JSON object");
    }
    String typeName = text(root, "type", "envelope");
    MessageType type = MessageType.fromWireName(typeName)
        .orElseThrow(() -> new MalformedMessageException("Unknown envelope type '" + typeName + "'"));
    String correlationId = text(root, "correlation_id", "envelope");
    if (correlationId.isBlank()) {
      throw new MalformedMessageException("correlation_id must not be blank");
    }
    JsonNode ordering = root.get("ordering_number");
    if (ordering == null || !ordering.isIntegralNumber() || !ordering.canConvertToLong() || ordering.asLong() < 0) {
      throw new MalformedMessageException("ordering_number must be a non-negative integer");
    }
    String roleName = text(root, "sender_role", "envelope");
    SenderRole role = SenderRole.fromWireName(roleName)
        .orElseThrow(() -> new MalformedMessageException("Unknown sender_role '" + roleName + "'"));
    String version = text(root, "protocol_version", "envelope");
    if (!majorVersion(version).equals(majorVersion(Envelope.PROTOCOL_VERSION))) {
      throw new MalformedMessageException(
          "Unsupported protocol_version " + version + "; expected " + Envelope.PROTOCOL_VERSION);
    }
    JsonNode payload = root.get("payload");
    if (payload == null || !payload.isObject()) {
      throw new MalformedMessageException("payload must be a JSON object");
    }
    EnvelopePayload body = decodePayload(type, payload);
    return new Envelope(correlationId, ordering.asLong(), role, version, body);
  }

  private EnvelopePayload decodePayload(MessageType type, JsonNode node) {
    String context = type.wireName();
    return switch (type) {
      case QUESTION -> new QuestionPayload(
          value(node.get("input_values")),
          manifest(node.get("input_manifest"), context),
          stringList(node.get("child_identities_allowed"), context),
          text(node, "reply_to", context));
      case LOG_RECORD -> new LogRecordPayload(
          text(node, "level", context),
          text(node, "message", context),
          instant(node, "timestamp", context),
          bool(node, "continuation", context));
      case MONITOR_MESSAGE -> {
        if (!node.has("data")) {
          throw new MalformedMessageException("monitor_message.data is required");
        }
        boolean fragment = bool(node, "fragment", context);
        if (fragment && !node.get("data").isTextual()) {
          throw new MalformedMessageException("monitor_message fragment data must be a string");
        }
        yield new MonitorPayload(value(node.get("data")), bool(node, "continuation", context), fragment);
      }
      case RESULT -> {
        if (!node.has("output_values")) {
          throw new MalformedMessageException("result.output_values is required");
        }
        yield new ResultPayload(value(node.get("output_values")), manifest(node.get("output_manifest"), context));
      }
      case EXCEPTION -> new ExceptionPayload(
          text(node, "kind", context),
          text(node, "message", context),
          detail(node.get("detail"), context));
      case HEARTBEAT -> new HeartbeatPayload(instant(node, "timestamp", context));
    };
  }

  private Object value(JsonNode node) {
    if (node == null || node.isNull()) {
      return null;
    }
    try {
      return mapper.treeToValue(node, Object.class);
    } catch (JsonProcessingException ex) {
      throw new MalformedMessageException("Value cannot be converted", ex);
    }
  }

  private Manifest manifest(JsonNode node, String context) {
    if (node == null || node.isNull()) {
      return null;
    }
    try {
      return ManifestSerializer.deserialize(value(node));
    } catch (IllegalArgumentException ex) {
      throw new MalformedMessageException(context + " carries an invalid manifest: " + ex.getMessage(), ex);
    }
  }

  private Map<String, Object> detail(JsonNode node, String context) {
    if (node == null || node.isNull()) {
      return Map.of();
    }
    if (!node.isObject()) {
      throw new MalformedMessageException(context + ".detail must be an object");
    }
    Map<String, Object> out = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      out.put(field.getKey(), value(field.getValue()));
    }
    return out;
  }

  private static List<String> stringList(JsonNode node, String context) {
    if (node == null || node.isNull()) {
      return List.of();
    }
    if (!node.isArray()) {
      throw new MalformedMessageException(context + ".child_identities_allowed must be an array");
    }
    List<String> out = new ArrayList<>();
    for (JsonNode item : node) {
      if (!item.isTextual()) {
        throw new MalformedMessageException(context + ".child_identities_allowed must contain strings");
      }
      out.add(item.asText());
    }
    return out;
  }

  private static String text(JsonNode node, String field, String context) {
    JsonNode value = node.get(field);
    if (value == null || !value.isTextual()) {
      throw new MalformedMessageException(context + "." + field + " must be a string");
    }
    return value.asText();
  }

  private static boolean bool(JsonNode node, String field, String context) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return false;
    }
    if (!value.isBoolean()) {
      throw new MalformedMessageException(context + "." + field + " must be a boolean");
    }
    return value.asBoolean();
  }

  private static Instant instant(JsonNode node, String field, String context) {
    String raw = text(node, field, context);
    try {
      return Instant.parse(raw);
    } catch (DateTimeParseException ex) {
      throw new MalformedMessageException(context + "." + field + " is not an ISO-8601 instant", ex);
    }
  }

  private static String majorVersion(String version) {
    int dot = version.indexOf('.');
    return dot < 0 ? version.trim() : version.substring(0, dot).trim();
  }
}
