package org.opensds.anomaly.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical metric sample produced by the normalizer.
 *
 * <p>Invariant: {@code metricId} is non-empty and {@code value} is finite. Timestamps are epoch millis
 * and are not guaranteed to increase per metric.</p>
 */
public final class MetricRecord {
    public final String metricId;
    public final long timestamp;
    public final double value;
    public final Map<String, String> tags;
    public final String partitionId;
    public final long sourceOffset;

    public MetricRecord(
            String metricId,
            long timestamp,
            double value,
            Map<String, String> tags,
            String partitionId,
            long sourceOffset) {
        if (metricId == null || metricId.isEmpty()) {
            throw new IllegalArgumentException("metricId must be non-empty");
        }
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("value must be finite: " + value);
        }
        this.metricId = metricId;
        this.timestamp = timestamp;
        this.value = value;
        this.tags = tags == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
        this.partitionId = partitionId;
        this.sourceOffset = sourceOffset;
    }

    public String tag(String name) {
        return tags.get(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MetricRecord)) {
            return false;
        }
        MetricRecord that = (MetricRecord) o;
        return timestamp == that.timestamp
                && Double.compare(value, that.value) == 0
                && sourceOffset == that.sourceOffset
                && metricId.equals(that.metricId)
                && tags.equals(that.tags)
                && Objects.equals(partitionId, that.partitionId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricId, timestamp, value, tags, partitionId, sourceOffset);
    }

    @Override
    public String toString() {
        return "MetricRecord{metricId=" + metricId + ", timestamp=" + timestamp + ", value=" + value
                + ", partition=" + partitionId + ", offset=" + sourceOffset + "}";
    }
}
