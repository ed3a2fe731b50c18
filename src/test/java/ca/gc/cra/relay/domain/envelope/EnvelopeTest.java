package ca.gc.cra.relay.domain.envelope;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EnvelopeTest {

  @Test
  void ofStampsCurrentProtocolVersion() {
    Envelope envelope = Envelope.of("cid", 0, SenderRole.CHILD, new HeartbeatPayload(Instant.EPOCH));

    assertEquals(Envelope.PROTOCOL_VERSION, envelope.protocolVersion());
    assertEquals(MessageType.HEARTBEAT, envelope.type());
  }

  @Test
  void rejectsBlankCorrelationAndNegativeOrdering() {
    ResultPayload result = new ResultPayload(Map.of(), null);
    assertThrows(IllegalArgumentException.class, () -> Envelope.of(" ", 0, SenderRole.CHILD, result));
    assertThrows(IllegalArgumentException.class, () -> Envelope.of("cid", -1, SenderRole.CHILD, result));
  }

  @Test
  void payloadAsRejectsWrongVariant() {
    Envelope envelope = Envelope.of("cid", 3, SenderRole.CHILD, new ResultPayload(Map.of("result", 25), null));

    assertEquals(Map.of("result", 25), envelope.payloadAs(ResultPayload.class).outputValues());
    assertThrows(IllegalStateException.class, () -> envelope.payloadAs(ExceptionPayload.class));
  }

  @Test
  void questionRequiresReplyTo() {
    assertThrows(IllegalArgumentException.class, () -> new QuestionPayload(Map.of(), null, null, ""));
  }

  @Test
  void messageTypeClassification() {
    assertTrue(MessageType.RESULT.isTerminal());
    assertTrue(MessageType.EXCEPTION.isTerminal());
    assertFalse(MessageType.HEARTBEAT.isTerminal());
    assertTrue(MessageType.LOG_RECORD.isStreamed());
    assertFalse(MessageType.QUESTION.isStreamed());
    assertEquals(MessageType.MONITOR_MESSAGE, MessageType.fromWireName("Monitor_Message").orElseThrow());
    assertTrue(MessageType.fromWireName("bogus").isEmpty());
    assertEquals(SenderRole.PARENT, SenderRole.fromWireName("parent").orElseThrow());
  }

  @Test
  void correlationIdsAreSortableAndUnique() {
    String earlier = CorrelationIds.newId(1_000L);
    String later = CorrelationIds.newId(2_000L);

    assertEquals(26, earlier.length());
    assertTrue(earlier.compareTo(later) < 0);
    assertNotEquals(CorrelationIds.newId(5_000L), CorrelationIds.newId(5_000L));
  }
}
