package org.opensds.anomaly.normalize;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Field extraction shared by the schema adapters. Every method either returns a usable value or throws
 * a {@link NormalizationException} with a stable reason code.
 */
final class PayloadFields {
    // Epoch values below this are taken as seconds rather than millis (2001-09-09 in millis).
    private static final double SECONDS_CUTOFF = 1_000_000_000_000d;

    private PayloadFields() {}

    static String requireText(JsonNode root, String field) throws NormalizationException {
        JsonNode node = root.get(field);
        if (node == null || node.isNull() || !node.isValueNode()) {
            throw new NormalizationException("missing_field", "Missing required field: " + field);
        }
        String text = node.asText().trim();
        if (text.isEmpty()) {
            throw new NormalizationException("missing_field", "Missing required field: " + field);
        }
        return text;
    }

    static double requireValue(JsonNode root, String field) throws NormalizationException {
        JsonNode node = root.get(field);
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new NormalizationException("missing_value", "Missing required field: " + field);
        }
        double value;
        if (node.isNumber()) {
            value = node.asDouble();
        } else if (node.isTextual()) {
            value = parseValue(node.asText());
        } else {
            throw new NormalizationException("non_numeric_value", "Field " + field + " is not numeric");
        }
        return requireFinite(value);
    }

    static double parseValue(String raw) throws NormalizationException {
        if (raw == null || raw.trim().isEmpty()) {
            throw new NormalizationException("missing_value", "Value is empty");
        }
        try {
            return requireFinite(Double.parseDouble(raw.trim()));
        } catch (NumberFormatException ex) {
            throw new NormalizationException("non_numeric_value", "Value is not numeric: " + raw);
        }
    }

    static double requireFinite(double value) throws NormalizationException {
        if (!Double.isFinite(value)) {
            throw new NormalizationException("non_finite_value", "Value is not finite: " + value);
        }
        return value;
    }

    static long requireTimestamp(JsonNode root, String field) throws NormalizationException {
        JsonNode node = root.get(field);
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new NormalizationException("missing_timestamp", "Missing required field: " + field);
        }
        if (node.isNumber()) {
            return fromEpochNumber(node.asDouble());
        }
        if (node.isTextual()) {
            return parseTimestamp(node.asText());
        }
        throw new NormalizationException("invalid_timestamp", "Timestamp has unsupported type: " + node.getNodeType());
    }

    /**
     * Accepts epoch millis, epoch seconds (optionally fractional) or ISO-8601 text.
     */
    static long parseTimestamp(String raw) throws NormalizationException {
        String value = raw == null ? "" : raw.trim();
        if (value.isEmpty()) {
            throw new NormalizationException("missing_timestamp", "Timestamp is empty");
        }
        if (value.matches("\\d+(\\.\\d+)?")) {
            return fromEpochNumber(Double.parseDouble(value));
        }
        try {
            return OffsetDateTime.parse(value).toInstant().toEpochMilli();
        } catch (DateTimeParseException ignored) {
            // fall through to the zone-less instant form
        }
        try {
            return Instant.parse(value).toEpochMilli();
        } catch (DateTimeParseException ex) {
            throw new NormalizationException("invalid_timestamp", "Unparsable timestamp: " + value);
        }
    }

    private static long fromEpochNumber(double epoch) throws NormalizationException {
        if (!Double.isFinite(epoch) || epoch < 0) {
            throw new NormalizationException("invalid_timestamp", "Timestamp out of range: " + epoch);
        }
        if (epoch < SECONDS_CUTOFF) {
            return Math.round(epoch * 1000d);
        }
        return (long) epoch;
    }

    static Map<String, String> tags(JsonNode node) {
        Map<String, String> tags = new LinkedHashMap<>();
        if (node == null || !node.isObject()) {
            return tags;
        }
        node.fields().forEachRemaining(entry -> {
            JsonNode v = entry.getValue();
            if (v != null && !v.isNull() && v.isValueNode()) {
                tags.put(entry.getKey(), v.asText());
            }
        });
        return tags;
    }
}
