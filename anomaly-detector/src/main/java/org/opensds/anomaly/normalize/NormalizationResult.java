package org.opensds.anomaly.normalize;

import org.opensds.anomaly.model.MetricRecord;

/**
 * Outcome of normalizing one inbound message: either a record or a failure reason.
 */
public class NormalizationResult {
    public final boolean valid;
    public final MetricRecord record;
    public final String schema;
    public final String reason;
    public final String details;

    private NormalizationResult(boolean valid, MetricRecord record, String schema, String reason, String details) {
        this.valid = valid;
        this.record = record;
        this.schema = schema;
        this.reason = reason;
        this.details = details;
    }

    public static NormalizationResult valid(MetricRecord record, String schema) {
        return new NormalizationResult(true, record, schema, null, null);
    }

    public static NormalizationResult invalid(String schema, String reason, String details) {
        return new NormalizationResult(false, null, schema, reason, details);
    }
}
