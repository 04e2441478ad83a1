package org.opensds.anomaly.normalize;

import com.fasterxml.jackson.databind.JsonNode;

import org.opensds.anomaly.model.InboundMessage;
import org.opensds.anomaly.model.MetricRecord;

import java.util.Map;

/**
 * Storage performance samples as published by the telemetry data generator:
 *
 * <pre>
 * {"schema":"opensds_perf","resource_id":"vol-01","resource_type":"volume","metric":"iops",
 *  "value":1520.5,"unit":"ops/s","timestamp":1710000000000,"tags":{"backend":"lvm"}}
 * </pre>
 *
 * The metric identity is {@code resource_id/metric}.
 */
public class OpenSdsPerfAdapter implements SchemaAdapter {
    public static final String SCHEMA = "opensds_perf";

    @Override
    public String schema() {
        return SCHEMA;
    }

    @Override
    public MetricRecord adapt(InboundMessage message, String text, JsonNode root) throws NormalizationException {
        if (root == null || !root.isObject()) {
            throw new NormalizationException("not_json_object", "opensds_perf payload must be a JSON object");
        }
        String resourceId = PayloadFields.requireText(root, "resource_id");
        String metric = PayloadFields.requireText(root, "metric");
        double value = PayloadFields.requireValue(root, "value");
        long timestamp = PayloadFields.requireTimestamp(root, "timestamp");

        Map<String, String> tags = PayloadFields.tags(root.get("tags"));
        tags.put("resource", resourceId);
        tags.put("metric", metric);
        putIfPresent(tags, "resource_type", root.get("resource_type"));
        putIfPresent(tags, "unit", root.get("unit"));

        return new MetricRecord(resourceId + "/" + metric, timestamp, value, tags,
                message.partitionId(), message.offset);
    }

    private static void putIfPresent(Map<String, String> tags, String key, JsonNode node) {
        if (node != null && node.isValueNode() && !node.isNull() && !node.asText().isEmpty()) {
            tags.put(key, node.asText());
        }
    }
}
