package org.opensds.anomaly.normalize;

import com.fasterxml.jackson.databind.JsonNode;

import org.opensds.anomaly.model.InboundMessage;
import org.opensds.anomaly.model.MetricRecord;

/**
 * Canonical schema for producers that already know the metric identity:
 * {@code {"schema":"metric_v1","metric_id":"...","timestamp":...,"value":...,"tags":{...}}}.
 */
public class MetricV1Adapter implements SchemaAdapter {
    public static final String SCHEMA = "metric_v1";

    @Override
    public String schema() {
        return SCHEMA;
    }

    @Override
    public MetricRecord adapt(InboundMessage message, String text, JsonNode root) throws NormalizationException {
        if (root == null || !root.isObject()) {
            throw new NormalizationException("not_json_object", "metric_v1 payload must be a JSON object");
        }
        String metricId = PayloadFields.requireText(root, "metric_id");
        double value = PayloadFields.requireValue(root, "value");
        long timestamp = PayloadFields.requireTimestamp(root, "timestamp");
        return new MetricRecord(metricId, timestamp, value, PayloadFields.tags(root.get("tags")),
                message.partitionId(), message.offset);
    }
}
