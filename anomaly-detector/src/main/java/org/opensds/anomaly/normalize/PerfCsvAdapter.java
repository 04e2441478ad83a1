package org.opensds.anomaly.normalize;

import com.fasterxml.jackson.databind.JsonNode;

import org.opensds.anomaly.model.InboundMessage;
import org.opensds.anomaly.model.MetricRecord;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Delimited performance rows replayed from CSV data sets:
 * {@code resource_id,metric_name,timestamp,value[,k=v;k=v]}.
 */
public class PerfCsvAdapter implements SchemaAdapter {
    public static final String SCHEMA = "perf_csv";

    @Override
    public String schema() {
        return SCHEMA;
    }

    @Override
    public MetricRecord adapt(InboundMessage message, String text, JsonNode root) throws NormalizationException {
        if (text == null || text.trim().isEmpty()) {
            throw new NormalizationException("empty_payload", "CSV row is empty");
        }
        String[] columns = text.trim().split(",", 5);
        if (columns.length < 4) {
            throw new NormalizationException("missing_field",
                    "Expected resource_id,metric_name,timestamp,value but got " + columns.length + " columns");
        }
        String resourceId = columns[0].trim();
        String metric = columns[1].trim();
        if (resourceId.isEmpty() || metric.isEmpty()) {
            throw new NormalizationException("missing_field", "resource_id and metric_name are required");
        }
        long timestamp = PayloadFields.parseTimestamp(columns[2]);
        double value = PayloadFields.parseValue(columns[3]);

        Map<String, String> tags = new LinkedHashMap<>();
        if (columns.length == 5) {
            for (String pair : columns[4].split(";")) {
                int eq = pair.indexOf('=');
                if (eq > 0) {
                    tags.put(pair.substring(0, eq).trim(), pair.substring(eq + 1).trim());
                }
            }
        }
        tags.put("resource", resourceId);
        tags.put("metric", metric);
        return new MetricRecord(resourceId + "/" + metric, timestamp, value, tags,
                message.partitionId(), message.offset);
    }
}
