package org.opensds.anomaly.engine;

/**
 * Why a record ended in {@link RecordStage#DISCARDED}. Each cause has its own counter.
 */
public enum DiscardCause {
    MALFORMED,
    SINK_EXHAUSTED,
    DETECTOR_FAILURE,
    INTERNAL_ERROR
}
