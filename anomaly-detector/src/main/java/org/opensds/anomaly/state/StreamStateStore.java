package org.opensds.anomaly.state;

import org.opensds.anomaly.detect.Detector;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;
import java.util.function.ToLongFunction;

/**
 * Keyed per-metric state for stateful detectors.
 *
 * <p>Entries are created lazily with the detector's initial state and evicted by the maintenance task when
 * idle too long or when the store grows past its capacity (least recently used first). Access to different
 * keys never contends; per-key ordering is the engine's job, since all records of a metric run on one lane.</p>
 */
public class StreamStateStore {
    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(StreamStateStore.class);

    private final ConcurrentHashMap<String, StreamState> entries = new ConcurrentHashMap<>();
    private final int maxEntries;
    private final LongSupplier clock;
    private volatile ToLongFunction<String> persistedOffsets;

    public StreamStateStore(int maxEntries) {
        this(maxEntries, System::currentTimeMillis);
    }

    public StreamStateStore(int maxEntries, LongSupplier clock) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive");
        }
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    /**
     * Returns the entry for {@code metricId}, creating it from {@code detector.initialState()} on first access.
     * An entry written by a different detector (after a registry change) is reset, since its history has
     * another shape.
     */
    public StreamState getOrCreate(String metricId, Detector detector) {
        long now = clock.getAsLong();
        StreamState state = entries.computeIfAbsent(metricId,
                id -> new StreamState(id, detector.name(), detector.initialState(), now));
        if (!detector.name().equals(state.detectorName())) {
            LOG.info("Resetting state for metric {} (detector changed from {} to {})",
                    metricId, state.detectorName(), detector.name());
            state.reset(detector.name(), detector.initialState(), now);
        }
        state.touch(now);
        return state;
    }

    public StreamState get(String metricId) {
        return entries.get(metricId);
    }

    public void touch(String metricId) {
        StreamState state = entries.get(metricId);
        if (state != null) {
            state.touch(clock.getAsLong());
        }
    }

    /**
     * Replaces the stored state after an evaluation. If the entry was evicted while the evaluation ran, it is
     * re-inserted so the update is not lost.
     */
    public void replace(String metricId, String detectorName, DetectorState updated) {
        long now = clock.getAsLong();
        entries.compute(metricId, (id, existing) -> {
            StreamState target = existing == null ? new StreamState(id, detectorName, updated, now) : existing;
            target.replace(detectorName, updated, now);
            return target;
        });
    }

    /**
     * Replaces the stored state after evaluating the record at {@code offset} of {@code partitionId}. With
     * confirmation tracking on, the new state only reaches snapshots once that offset is checkpointed.
     */
    public void replace(String metricId, String detectorName, DetectorState updated, String partitionId, long offset) {
        ToLongFunction<String> tracking = persistedOffsets;
        if (tracking == null) {
            replace(metricId, detectorName, updated);
            return;
        }
        long now = clock.getAsLong();
        entries.compute(metricId, (id, existing) -> {
            StreamState target = existing == null ? new StreamState(id, detectorName, updated, now) : existing;
            target.replace(detectorName, updated, now, partitionId, offset, tracking);
            return target;
        });
    }

    /**
     * Ties snapshots to checkpoint progress. {@code persistedOffsets} maps a partition id to its highest
     * persisted offset; evaluations of later records are left out of {@link #confirmedEntries()}.
     */
    public void trackConfirmation(ToLongFunction<String> persistedOffsets) {
        this.persistedOffsets = persistedOffsets;
    }

    /**
     * State of every entry as of its last confirmed evaluation. Entries without one are left out.
     */
    List<ConfirmedState> confirmedEntries() {
        ToLongFunction<String> tracking = persistedOffsets;
        List<ConfirmedState> confirmed = new ArrayList<>();
        for (StreamState state : entries.values()) {
            ConfirmedState snapshot = state.confirmed(tracking);
            if (snapshot != null) {
                confirmed.add(snapshot);
            }
        }
        return confirmed;
    }

    /**
     * Removes entries not accessed within {@code maxIdle}.
     *
     * @return number of evicted entries
     */
    public int evictIdle(Duration maxIdle) {
        long cutoff = clock.getAsLong() - maxIdle.toMillis();
        int evicted = 0;
        for (Map.Entry<String, StreamState> entry : entries.entrySet()) {
            StreamState state = entry.getValue();
            if (state.lastAccessMs() < cutoff && entries.remove(entry.getKey(), state)) {
                evicted++;
            }
        }
        if (evicted > 0) {
            LOG.debug("Evicted {} idle stream states (maxIdle={}s)", evicted, maxIdle.getSeconds());
        }
        return evicted;
    }

    /**
     * Trims the store back to capacity, least recently accessed first.
     *
     * @return number of evicted entries
     */
    public int evictOverCapacity() {
        int excess = entries.size() - maxEntries;
        if (excess <= 0) {
            return 0;
        }
        List<StreamState> byAge = new ArrayList<>(entries.values());
        byAge.sort(Comparator.comparingLong(StreamState::lastAccessMs));
        int evicted = 0;
        for (StreamState state : byAge) {
            if (evicted >= excess) {
                break;
            }
            if (entries.remove(state.metricId(), state)) {
                evicted++;
            }
        }
        LOG.debug("Evicted {} stream states over capacity {}", evicted, maxEntries);
        return evicted;
    }

    public int size() {
        return entries.size();
    }

    public List<StreamState> entries() {
        return new ArrayList<>(entries.values());
    }

    /**
     * Loads a previously saved entry. Restored entries count as freshly accessed.
     */
    public void restore(String metricId, String detectorName, DetectorState value, long evaluations) {
        StreamState state = new StreamState(metricId, detectorName, value, clock.getAsLong());
        state.restore(evaluations);
        entries.put(metricId, state);
    }
}
