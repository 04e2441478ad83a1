package org.opensds.anomaly.checkpoint;

import java.io.Closeable;

/**
 * Durable per-partition checkpoint: the highest source offset whose effects are confirmed complete.
 */
public interface CheckpointStore extends Closeable {

    /**
     * @return the stored offset, or {@code null} when the partition has never been checkpointed
     * @throws CheckpointStoreException when the store cannot be read
     */
    Long load(String partitionId);

    /**
     * Durably records {@code offset} for the partition. Returns only once the value would survive a restart.
     *
     * @throws CheckpointStoreException when the write is not confirmed
     */
    void store(String partitionId, long offset);

    @Override
    default void close() {}
}
