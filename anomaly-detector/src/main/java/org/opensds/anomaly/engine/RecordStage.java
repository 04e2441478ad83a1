package org.opensds.anomaly.engine;

/**
 * Lifecycle of one in-flight record. {@link #CHECKPOINTED} and {@link #DISCARDED} are terminal; only terminal
 * records release their offset to the checkpoint manager.
 */
public enum RecordStage {
    RECEIVED,
    NORMALIZED,
    STATE_LOADED,
    EVALUATED,
    EMITTED,
    CHECKPOINTED,
    DISCARDED;

    public boolean terminal() {
        return this == CHECKPOINTED || this == DISCARDED;
    }
}
