package org.opensds.anomaly.state;

import java.util.ArrayDeque;
import java.util.function.ToLongFunction;

/**
 * Store entry for one metric identity: the current detector state plus the bookkeeping used for eviction.
 *
 * <p>Only the lane owning the metric mutates {@link #value}; the maintenance task reads the access time.</p>
 *
 * <p>Evaluations whose source offset is not yet covered by a persisted checkpoint are kept, oldest first,
 * until the checkpoint reaches them. The confirmed state is the state after the longest such prefix; it is
 * what a snapshot may persist, because every later record is redelivered after a restart.</p>
 */
public final class StreamState {
    private final String metricId;
    private volatile String detectorName;
    private volatile DetectorState value;
    private volatile long lastAccessMs;
    private volatile long evaluations;

    // guarded by this
    private final ArrayDeque<Unconfirmed> unconfirmed = new ArrayDeque<>();
    private ConfirmedState confirmed;

    StreamState(String metricId, String detectorName, DetectorState value, long nowMs) {
        this.metricId = metricId;
        this.detectorName = detectorName;
        this.value = value;
        this.lastAccessMs = nowMs;
    }

    public String metricId() {
        return metricId;
    }

    public String detectorName() {
        return detectorName;
    }

    public DetectorState value() {
        return value;
    }

    public long lastAccessMs() {
        return lastAccessMs;
    }

    public long evaluations() {
        return evaluations;
    }

    void touch(long nowMs) {
        this.lastAccessMs = nowMs;
    }

    /**
     * Applies an evaluation that counts as confirmed right away.
     */
    synchronized void replace(String detectorName, DetectorState value, long nowMs) {
        apply(detectorName, value, nowMs);
        unconfirmed.clear();
        confirmed = new ConfirmedState(metricId, detectorName, value, evaluations);
    }

    /**
     * Applies the evaluation of the record at {@code offset} of {@code partitionId}; it stays unconfirmed until
     * {@code persistedOffsets} reports a checkpoint at or past that offset.
     */
    synchronized void replace(String detectorName, DetectorState value, long nowMs,
                              String partitionId, long offset, ToLongFunction<String> persistedOffsets) {
        apply(detectorName, value, nowMs);
        unconfirmed.addLast(new Unconfirmed(partitionId, offset,
                new ConfirmedState(metricId, detectorName, value, evaluations)));
        confirm(persistedOffsets);
    }

    /**
     * Starts over with a fresh detector history. The old history is not worth keeping in a snapshot either.
     */
    synchronized void reset(String detectorName, DetectorState value, long nowMs) {
        this.detectorName = detectorName;
        this.value = value;
        this.lastAccessMs = nowMs;
        this.evaluations = 0;
        unconfirmed.clear();
        confirmed = new ConfirmedState(metricId, detectorName, value, 0);
    }

    synchronized void restore(long evaluations) {
        this.evaluations = evaluations;
        unconfirmed.clear();
        confirmed = new ConfirmedState(metricId, detectorName, value, evaluations);
    }

    /**
     * @return the confirmed state, or {@code null} when no evaluation of this metric is confirmed yet
     */
    synchronized ConfirmedState confirmed(ToLongFunction<String> persistedOffsets) {
        if (persistedOffsets != null) {
            confirm(persistedOffsets);
        }
        return confirmed;
    }

    synchronized int unconfirmedCount() {
        return unconfirmed.size();
    }

    private void apply(String detectorName, DetectorState value, long nowMs) {
        this.detectorName = detectorName;
        this.value = value;
        this.lastAccessMs = nowMs;
        this.evaluations++;
    }

    private void confirm(ToLongFunction<String> persistedOffsets) {
        while (!unconfirmed.isEmpty()) {
            Unconfirmed oldest = unconfirmed.peekFirst();
            if (oldest.offset > persistedOffsets.applyAsLong(oldest.partitionId)) {
                return;
            }
            confirmed = oldest.state;
            unconfirmed.pollFirst();
        }
    }

    private static final class Unconfirmed {
        final String partitionId;
        final long offset;
        final ConfirmedState state;

        Unconfirmed(String partitionId, long offset, ConfirmedState state) {
            this.partitionId = partitionId;
            this.offset = offset;
            this.state = state;
        }
    }
}
