package ca.gc.cra.relay.adapter.kafka;

import java.util.HashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;

/**
 * Tracks dispatched and completed offsets per partition and computes the highest contiguously
 * completed position that is safe to commit.
 *
 * <p>Not thread-safe; owned by the consumer poll thread.</p>
 */
final class PartitionOffsetTracker {
  private final Map<TopicPartition, PartitionState> partitions = new HashMap<>();

  /** Records that {@code offset} was handed to a worker. Returns the epoch of that dispatch. */
  long dispatched(TopicPartition partition, long offset) {
    PartitionState state = partitions.computeIfAbsent(partition, p -> new PartitionState());
    state.outstanding.put(offset, new Slot(state.epoch));
    if (state.committed < 0) {
      state.committed = offset;
    }
    return state.epoch;
  }

  /**
   * Marks an offset as handled. A completion counts only for the dispatch that produced it; once
   * a failure rewinds the partition, completions of the discarded dispatches at or after the
   * rewind point are ignored while earlier offsets keep their original dispatch.
   */
  void completed(TopicPartition partition, long offset, long epoch) {
    Slot slot = current(partition, offset, epoch);
    if (slot != null) {
      slot.done = true;
    }
  }

  /**
   * Forgets every outstanding offset at or after {@code offset} and starts a new epoch.
   *
   * @return {@code true} when the partition must be rewound to {@code offset}
   */
  boolean failed(TopicPartition partition, long offset, long epoch) {
    if (current(partition, offset, epoch) == null) {
      return false;
    }
    PartitionState state = partitions.get(partition);
    state.outstanding.tailMap(offset, true).clear();
    state.epoch++;
    return true;
  }

  private Slot current(TopicPartition partition, long offset, long epoch) {
    PartitionState state = partitions.get(partition);
    if (state == null) {
      return null;
    }
    Slot slot = state.outstanding.get(offset);
    return slot != null && slot.epoch == epoch ? slot : null;
  }

  /** Advances past contiguous completed offsets and returns positions that moved. */
  Map<TopicPartition, OffsetAndMetadata> drainCommittable() {
    Map<TopicPartition, OffsetAndMetadata> out = new HashMap<>();
    for (Map.Entry<TopicPartition, PartitionState> entry : partitions.entrySet()) {
      PartitionState state = entry.getValue();
      long before = state.committed;
      while (!state.outstanding.isEmpty() && state.outstanding.firstEntry().getValue().done) {
        long done = state.outstanding.pollFirstEntry().getKey();
        state.committed = done + 1;
      }
      if (state.committed > before && state.committed > state.lastCommitted) {
        state.lastCommitted = state.committed;
        out.put(entry.getKey(), new OffsetAndMetadata(state.committed));
      }
    }
    return out;
  }

  /** Drops state for partitions no longer assigned. */
  void revoke(TopicPartition partition) {
    partitions.remove(partition);
  }

  int outstanding() {
    int total = 0;
    for (PartitionState state : partitions.values()) {
      total += state.outstanding.size();
    }
    return total;
  }

  private static final class Slot {
    private final long epoch;
    private boolean done;

    private Slot(long epoch) {
      this.epoch = epoch;
    }
  }

  private static final class PartitionState {
    private final NavigableMap<Long, Slot> outstanding = new TreeMap<>();
    private long committed = -1L;
    private long lastCommitted = -1L;
    private long epoch;
  }
}
