package org.opensds.anomaly.normalize;

import com.fasterxml.jackson.databind.JsonNode;

import org.opensds.anomaly.model.InboundMessage;
import org.opensds.anomaly.util.JsonSupport;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parses raw channel payloads into {@code MetricRecord}s.
 *
 * <p>JSON payloads pick their adapter through the {@code schema} discriminator field; payloads without
 * one (including non-JSON text) fall back to the configured default schema. Failures are returned as
 * invalid results and never thrown.</p>
 */
public class MetricRecordNormalizer {
    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(MetricRecordNormalizer.class);
    public static final String DISCRIMINATOR_FIELD = "schema";

    private final Map<String, SchemaAdapter> adapters;
    private final String defaultSchema;

    public MetricRecordNormalizer(List<SchemaAdapter> adapters, String defaultSchema) {
        Map<String, SchemaAdapter> bySchema = new LinkedHashMap<>();
        for (SchemaAdapter adapter : adapters) {
            if (bySchema.putIfAbsent(adapter.schema(), adapter) != null) {
                throw new IllegalArgumentException("Duplicate schema adapter: " + adapter.schema());
            }
        }
        this.adapters = Collections.unmodifiableMap(bySchema);
        this.defaultSchema = defaultSchema;
        if (defaultSchema != null && !this.adapters.containsKey(defaultSchema)) {
            throw new IllegalArgumentException("Default schema has no adapter: " + defaultSchema);
        }
    }

    public static MetricRecordNormalizer withBuiltInAdapters(String defaultSchema) {
        return new MetricRecordNormalizer(
                List.of(new OpenSdsPerfAdapter(), new MetricV1Adapter(), new PerfCsvAdapter()),
                defaultSchema);
    }

    public Set<String> schemas() {
        return adapters.keySet();
    }

    public NormalizationResult normalize(InboundMessage message) {
        if (message == null || message.value == null || message.value.length == 0) {
            return NormalizationResult.invalid(null, "empty_payload", "Message payload is null or empty");
        }

        String text = new String(message.value, StandardCharsets.UTF_8);
        JsonNode root = null;
        if (looksLikeJson(text)) {
            try {
                root = JsonSupport.MAPPER.readTree(text);
            } catch (Exception ex) {
                return NormalizationResult.invalid(null, "json_parse_error", ex.getMessage());
            }
        }

        String schema = defaultSchema;
        if (root != null && root.isObject()) {
            JsonNode discriminator = root.get(DISCRIMINATOR_FIELD);
            if (discriminator != null && discriminator.isTextual() && !discriminator.asText().isEmpty()) {
                schema = discriminator.asText();
            }
        }
        if (schema == null) {
            return NormalizationResult.invalid(null, "missing_schema", "Payload has no schema and no default is configured");
        }

        SchemaAdapter adapter = adapters.get(schema);
        if (adapter == null) {
            return NormalizationResult.invalid(schema, "unsupported_schema", "Unsupported schema: " + schema);
        }

        try {
            return NormalizationResult.valid(adapter.adapt(message, text, root), schema);
        } catch (NormalizationException ex) {
            LOG.debug("Normalization failed (schema={}, partition={}, offset={}, reason={}): {}",
                    schema, message.partitionId(), message.offset, ex.reason(), ex.getMessage());
            return NormalizationResult.invalid(schema, ex.reason(), ex.getMessage());
        }
    }

    private static boolean looksLikeJson(String text) {
        String trimmed = text.trim();
        return trimmed.startsWith("{") || trimmed.startsWith("[");
    }
}
