package ca.gc.cra.relay.application.invocation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.relay.application.invocation.ReorderBuffer.Delivered;
import ca.gc.cra.relay.application.invocation.ReorderBuffer.Gap;
import ca.gc.cra.relay.application.invocation.ReorderBuffer.Release;
import ca.gc.cra.relay.domain.envelope.Envelope;
import ca.gc.cra.relay.domain.envelope.HeartbeatPayload;
import ca.gc.cra.relay.domain.envelope.SenderRole;
import ca.gc.cra.relay.testing.RecordingMetricsPort;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ReorderBufferTest {
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final ReorderBuffer buffer = new ReorderBuffer(metrics, "test.reorder");

  @Test
  void inOrderEnvelopesAreReleasedImmediately() {
    assertEquals(List.of(0L), numbers(buffer.offer(envelope(0), 0)));
    assertEquals(List.of(1L), numbers(buffer.offer(envelope(1), 0)));
    assertEquals(1L, buffer.highestContiguous());
  }

  @Test
  void outOfOrderEnvelopesWaitForTheHole() {
    assertTrue(buffer.offer(envelope(2), 0).isEmpty());
    assertTrue(buffer.offer(envelope(1), 0).isEmpty());
    assertEquals(2, buffer.buffered());

    assertEquals(List.of(0L, 1L, 2L), numbers(buffer.offer(envelope(0), 5)));
    assertEquals(0, buffer.buffered());
    assertEquals(2, metrics.count("test.reorder.buffered"));
  }

  @Test
  void duplicatesAreDropped() {
    buffer.offer(envelope(0), 0);
    buffer.offer(envelope(2), 0);

    assertTrue(buffer.offer(envelope(0), 0).isEmpty());
    assertTrue(buffer.offer(envelope(2), 0).isEmpty());
    assertEquals(2, buffer.duplicates());
    assertEquals(2, metrics.count("test.reorder.duplicate"));
  }

  @Test
  void holeExpiresIntoGap() {
    buffer.offer(envelope(0), 0);
    buffer.offer(envelope(3), 100);
    buffer.offer(envelope(4), 150);

    assertTrue(buffer.expire(1_000, 2_000).isEmpty());
    List<Release> released = buffer.expire(2_100, 2_000);

    assertEquals(3, released.size());
    assertEquals(new Gap(1, 2), released.get(0));
    assertEquals(List.of(3L, 4L), numbers(released));
    assertEquals(5L, buffer.nextExpected());
    assertEquals(1, metrics.count("test.reorder.gap"));
  }

  @Test
  void lateArrivalAfterGapIsDuplicate() {
    buffer.offer(envelope(0), 0);
    buffer.offer(envelope(2), 0);
    buffer.expire(5_000, 1_000);

    assertTrue(buffer.offer(envelope(1), 6_000).isEmpty());
    assertEquals(1, buffer.duplicates());
  }

  @Test
  void endKeepsLowerSlotsOpenUntilTheyArrive() {
    buffer.offer(envelope(0), 0);

    assertEquals(List.of(), buffer.end(2, 10).orElseThrow());
    assertTrue(buffer.isEnded());
    assertFalse(buffer.isComplete());
    assertTrue(buffer.accepts(1));
    assertFalse(buffer.accepts(3));

    assertEquals(List.of(1L), numbers(buffer.offer(envelope(1), 20)));
    assertTrue(buffer.isComplete());
    assertEquals(0, buffer.buffered());
  }

  @Test
  void holesUnderTheEndExpireIntoGaps() {
    buffer.offer(envelope(0), 0);
    buffer.offer(envelope(3), 0);
    buffer.end(5, 0).orElseThrow();

    assertTrue(buffer.expire(100, 200).isEmpty());
    assertEquals(List.of(new Gap(1, 2), new Delivered(envelope(3))), buffer.expire(200, 200));
    assertFalse(buffer.isComplete());
    assertEquals(List.of(new Gap(4, 4)), buffer.expire(400, 200));
    assertTrue(buffer.isComplete());
    assertEquals(6L, buffer.nextExpected());
  }

  @Test
  void secondEndAndNumbersAfterTheEndAreRefused() {
    buffer.end(1, 0).orElseThrow();

    assertTrue(buffer.end(1, 0).isEmpty());
    assertTrue(buffer.end(4, 0).isEmpty());
    assertTrue(buffer.offer(envelope(2), 0).isEmpty());
    assertEquals(1, metrics.count("test.reorder.afterEnd"));
    assertEquals(1, buffer.buffered());
  }

  private static Envelope envelope(long number) {
    return Envelope.of("cid", number, SenderRole.CHILD, new HeartbeatPayload(Instant.EPOCH));
  }

  private static List<Long> numbers(List<Release> releases) {
    List<Long> out = new ArrayList<>();
    for (Release release : releases) {
      if (release instanceof Delivered delivered) {
        out.add(delivered.envelope().orderingNumber());
      }
    }
    return out;
  }
}
