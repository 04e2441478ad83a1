package org.opensds.anomaly.channel;

import org.opensds.anomaly.model.InboundMessage;

import java.time.Duration;
import java.util.List;

/**
 * At-least-once, partitioned source of opaque payloads. Messages of one partition are returned in offset
 * order. All methods except {@link #wakeup()} are called from the engine's poll thread only.
 */
public interface IngestionChannel extends AutoCloseable {

    /**
     * Blocks up to {@code timeout} for new messages; returns an empty list on timeout or after
     * {@link #wakeup()}.
     *
     * @throws ChannelException when the source is unavailable
     */
    List<InboundMessage> poll(Duration timeout);

    /**
     * Records that every message of {@code partitionId} below {@code offset} is fully processed, so
     * consumption may resume from {@code offset} after a restart.
     */
    void ackSafeToResumeFrom(String partitionId, long offset);

    /**
     * Stops fetching from a partition whose checkpoint can no longer be persisted.
     */
    void pause(String partitionId);

    /**
     * Interrupts a blocked {@link #poll}. Safe to call from any thread.
     */
    void wakeup();

    /**
     * True for finite sources that have returned their last message.
     */
    default boolean isExhausted() {
        return false;
    }

    @Override
    void close();
}
