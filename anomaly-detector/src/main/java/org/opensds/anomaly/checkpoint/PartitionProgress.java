package org.opensds.anomaly.checkpoint;

import java.util.PriorityQueue;
import java.util.TreeMap;

/**
 * Offset bookkeeping for one partition. Not thread-safe; {@link CheckpointManager} guards each instance.
 *
 * <p>{@code mark} is the highest offset such that no outstanding offset is lower. Completed offsets that
 * still have an outstanding predecessor wait in a min-heap.</p>
 */
final class PartitionProgress {
    // offset -> number of in-flight copies (a redelivered offset can be in flight twice)
    private final TreeMap<Long, Integer> outstanding = new TreeMap<>();
    private final PriorityQueue<Long> completed = new PriorityQueue<>();
    private long mark;
    private long persisted;
    private boolean halted;

    PartitionProgress(long restored) {
        this.mark = restored;
        this.persisted = restored;
    }

    void begin(long offset) {
        outstanding.merge(offset, 1, Integer::sum);
    }

    /**
     * @return true when the mark moved
     */
    boolean complete(long offset) {
        Integer copies = outstanding.get(offset);
        if (copies == null) {
            throw new IllegalStateException("Offset " + offset + " completed but never begun");
        }
        if (copies == 1) {
            outstanding.remove(offset);
        } else {
            outstanding.put(offset, copies - 1);
        }
        completed.add(offset);

        long before = mark;
        while (!completed.isEmpty() && (outstanding.isEmpty() || completed.peek() < outstanding.firstKey())) {
            long done = completed.poll();
            if (done > mark) {
                mark = done;
            }
        }
        return mark != before;
    }

    long mark() {
        return mark;
    }

    long persisted() {
        return persisted;
    }

    void markPersisted(long offset) {
        this.persisted = offset;
    }

    boolean dirty() {
        return !halted && mark > persisted;
    }

    int outstandingCount() {
        int count = 0;
        for (int copies : outstanding.values()) {
            count += copies;
        }
        return count;
    }

    boolean halted() {
        return halted;
    }

    void halt() {
        this.halted = true;
    }
}
