package org.opensds.anomaly.checkpoint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks outstanding offsets per source partition and advances checkpoints without passing in-flight work.
 *
 * <p>Every polled message is {@link #begin begun} in partition order before it is dispatched and
 * {@link #complete completed} once it reaches a terminal stage (checkpointed or discarded). The in-memory
 * mark of a partition only moves to an offset once all lower offsets have completed. {@link #flush} persists
 * moved marks; it is called from a single thread (the poll loop and the final shutdown flush).</p>
 *
 * <p>Lanes only contend on the monitor of the partition they complete.</p>
 */
public class CheckpointManager {
    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(CheckpointManager.class);
    static final long NONE = -1L;

    private final CheckpointStore store;
    private final ConcurrentHashMap<String, PartitionProgress> partitions = new ConcurrentHashMap<>();

    public CheckpointManager(CheckpointStore store) {
        this.store = store;
    }

    private PartitionProgress progress(String partitionId) {
        return partitions.computeIfAbsent(partitionId, id -> {
            Long restored = store.load(id);
            if (restored != null) {
                LOG.info("Restored checkpoint {} for partition {}", restored, id);
            }
            return new PartitionProgress(restored == null ? NONE : restored);
        });
    }

    /**
     * Offset the channel should resume from, or {@code null} when the partition has no checkpoint.
     */
    public Long resumePosition(String partitionId) {
        long mark = committed(partitionId);
        return mark == NONE ? null : mark + 1;
    }

    public void begin(String partitionId, long offset) {
        PartitionProgress progress = progress(partitionId);
        synchronized (progress) {
            progress.begin(offset);
        }
    }

    /**
     * Marks an offset terminal (checkpointed or discarded).
     *
     * @return true when the partition's pending checkpoint moved forward
     */
    public boolean complete(String partitionId, long offset) {
        PartitionProgress progress = partitions.get(partitionId);
        if (progress == null) {
            throw new IllegalStateException("Partition " + partitionId + " completed offset " + offset + " but never began");
        }
        synchronized (progress) {
            return progress.complete(offset);
        }
    }

    /**
     * Persists every moved mark. Failing partitions are halted: they keep tracking offsets but are never
     * persisted again, so the durable checkpoint cannot pass unconfirmed work.
     */
    public synchronized FlushOutcome flush() {
        Map<String, Long> advanced = new LinkedHashMap<>();
        List<CheckpointStoreException> failures = new ArrayList<>();
        for (Map.Entry<String, PartitionProgress> entry : partitions.entrySet()) {
            PartitionProgress progress = entry.getValue();
            long mark;
            synchronized (progress) {
                if (!progress.dirty()) {
                    continue;
                }
                mark = progress.mark();
            }
            try {
                store.store(entry.getKey(), mark);
            } catch (CheckpointStoreException ex) {
                synchronized (progress) {
                    progress.halt();
                }
                LOG.error("Checkpoint store failed for partition {} at offset {}; partition halted",
                        entry.getKey(), mark, ex);
                failures.add(ex.partitionId() == null
                        ? new CheckpointStoreException(entry.getKey(), ex.getMessage(), ex)
                        : ex);
                continue;
            }
            synchronized (progress) {
                progress.markPersisted(mark);
            }
            advanced.put(entry.getKey(), mark);
        }
        if (!advanced.isEmpty()) {
            LOG.debug("Checkpoints advanced: {}", advanced);
        }
        return new FlushOutcome(advanced, failures);
    }

    public long committed(String partitionId) {
        PartitionProgress progress = progress(partitionId);
        synchronized (progress) {
            return progress.persisted();
        }
    }

    public long pendingMark(String partitionId) {
        PartitionProgress progress = progress(partitionId);
        synchronized (progress) {
            return progress.mark();
        }
    }

    public int outstanding(String partitionId) {
        PartitionProgress progress = partitions.get(partitionId);
        if (progress == null) {
            return 0;
        }
        synchronized (progress) {
            return progress.outstandingCount();
        }
    }

    public int totalOutstanding() {
        int total = 0;
        for (String partitionId : partitions.keySet()) {
            total += outstanding(partitionId);
        }
        return total;
    }

    public boolean isHalted(String partitionId) {
        PartitionProgress progress = partitions.get(partitionId);
        if (progress == null) {
            return false;
        }
        synchronized (progress) {
            return progress.halted();
        }
    }

    public void close() {
        store.close();
    }

    public static final class FlushOutcome {
        public final Map<String, Long> advanced;
        public final List<CheckpointStoreException> failures;

        FlushOutcome(Map<String, Long> advanced, List<CheckpointStoreException> failures) {
            this.advanced = Collections.unmodifiableMap(advanced);
            this.failures = Collections.unmodifiableList(failures);
        }

        public boolean failed() {
            return !failures.isEmpty();
        }
    }
}
