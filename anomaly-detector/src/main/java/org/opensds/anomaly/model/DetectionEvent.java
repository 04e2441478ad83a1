package org.opensds.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import org.opensds.anomaly.util.Hashing;

import java.util.Objects;

/**
 * Detection result handed to the event sink. At most one is produced per input record.
 *
 * <p>{@link #eventId} is derived from {@code (metricId, timestamp)} only, so a redelivered record yields
 * the same identity and downstream consumers can upsert on it.</p>
 */
public final class DetectionEvent {
    @JsonProperty("event_id")
    public final String eventId;
    @JsonProperty("metric_id")
    public final String metricId;
    @JsonProperty("timestamp")
    public final long timestamp;
    @JsonProperty("value")
    public final double value;
    @JsonProperty("severity")
    public final Severity severity;
    @JsonProperty("score")
    public final double score;
    @JsonProperty("explanation")
    public final String explanation;
    @JsonProperty("detector")
    public final String detector;

    @JsonCreator
    public DetectionEvent(
            @JsonProperty("metric_id") String metricId,
            @JsonProperty("timestamp") long timestamp,
            @JsonProperty("value") double value,
            @JsonProperty("severity") Severity severity,
            @JsonProperty("score") double score,
            @JsonProperty("explanation") String explanation,
            @JsonProperty("detector") String detector) {
        this.eventId = eventIdFor(metricId, timestamp);
        this.metricId = metricId;
        this.timestamp = timestamp;
        this.value = value;
        this.severity = Objects.requireNonNull(severity, "severity");
        this.score = score;
        this.explanation = explanation == null ? "" : explanation;
        this.detector = detector;
    }

    public static String eventIdFor(String metricId, long timestamp) {
        return Hashing.sha256Hex(metricId + "|" + timestamp);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DetectionEvent)) {
            return false;
        }
        DetectionEvent that = (DetectionEvent) o;
        return timestamp == that.timestamp
                && Double.compare(value, that.value) == 0
                && Double.compare(score, that.score) == 0
                && metricId.equals(that.metricId)
                && severity == that.severity
                && explanation.equals(that.explanation)
                && Objects.equals(detector, that.detector);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricId, timestamp, value, severity, score, explanation, detector);
    }

    @Override
    public String toString() {
        return "DetectionEvent{metricId=" + metricId + ", timestamp=" + timestamp + ", value=" + value
                + ", severity=" + severity.wireName() + ", score=" + score + ", detector=" + detector + "}";
    }
}
