package org.opensds.anomaly.model;

/**
 * Dead-letter envelope for a record the pipeline gave up on, with failure metadata and the original payload.
 */
public class DiscardedRecordEnvelope {
    public String schemaVersion;
    public SourcePointer source;
    public FailureDetails failure;
    public String metricId;
    public Long eventTimestamp;
    public Payload payload;
    public DetectionEvent detection;
    public long discardedAt;

    public DiscardedRecordEnvelope() {}

    public static class SourcePointer {
        public String partitionId;
        public long offset;
        public long recordTimestamp;

        public SourcePointer() {}
    }

    public static class FailureDetails {
        public String stage;
        public String cause;
        public String reason;
        public String details;
        public int attempts;

        public FailureDetails() {}
    }

    public static class Payload {
        public String encoding;
        public String body;

        public Payload() {}
    }
}
