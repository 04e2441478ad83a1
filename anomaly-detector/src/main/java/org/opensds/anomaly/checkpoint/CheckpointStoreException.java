package org.opensds.anomaly.checkpoint;

/**
 * Checkpoint durability is at risk. Fatal for the affected partition.
 */
public class CheckpointStoreException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String partitionId;

    public CheckpointStoreException(String partitionId, String message, Throwable cause) {
        super(message, cause);
        this.partitionId = partitionId;
    }

    public String partitionId() {
        return partitionId;
    }
}
