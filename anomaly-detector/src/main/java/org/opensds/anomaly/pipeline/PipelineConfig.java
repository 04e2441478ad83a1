package org.opensds.anomaly.pipeline;

import java.time.Duration;
import java.util.Map;
import java.util.function.Function;

/**
 * Configuration for the anomaly-detection pipeline, sourced from environment variables.
 */
public class PipelineConfig {
    public final String brokerEndpoints;
    public final String topic;
    public final String consumerGroup;
    public final int laneCount;
    public final int laneQueueCapacity;
    public final Duration idleEviction;
    public final int maxTrackedMetrics;
    public final String sinkEndpoint;
    public final String defaultDetector;
    public final int maxRetryAttempts;
    public final Duration retryBackoffBase;
    public final Duration retryBackoffMax;
    public final String defaultSchema;
    public final String checkpointPath;
    public final String stateSnapshotPath;
    public final Duration stateSnapshotInterval;
    public final String dlqTopic;
    public final Duration pollTimeout;
    public final Duration commitInterval;
    public final Duration metricsLogInterval;
    public final String detectorCatalogPath;
    public final String replayFile;

    private PipelineConfig(Function<String, String> source) {
        this.brokerEndpoints = text(source, "ANOMALY_BROKER_ENDPOINTS", "kafka:9092");
        this.topic = text(source, "ANOMALY_TOPIC", "storage_metrics");
        this.consumerGroup = text(source, "ANOMALY_CONSUMER_GROUP", "anomaly-detector-v1");
        this.laneCount = Math.max(1, integer(source, "ANOMALY_LANE_COUNT", Runtime.getRuntime().availableProcessors()));
        this.laneQueueCapacity = Math.max(1, integer(source, "ANOMALY_LANE_QUEUE_CAPACITY", 1024));
        this.idleEviction = Duration.ofSeconds(Math.max(1, integer(source, "ANOMALY_IDLE_EVICTION_SECONDS", 3600)));
        this.maxTrackedMetrics = Math.max(1, integer(source, "ANOMALY_MAX_TRACKED_METRICS", 100_000));
        this.sinkEndpoint = optionalText(source, "ANOMALY_SINK_ENDPOINT", "");
        this.defaultDetector = optionalText(source, "ANOMALY_DEFAULT_DETECTOR", "threshold");
        this.maxRetryAttempts = Math.max(1, integer(source, "ANOMALY_MAX_RETRY_ATTEMPTS", 5));
        this.retryBackoffBase = Duration.ofMillis(Math.max(0L, longValue(source, "ANOMALY_RETRY_BACKOFF_BASE_MS", 200L)));
        this.retryBackoffMax = Duration.ofMillis(Math.max(0L, longValue(source, "ANOMALY_RETRY_BACKOFF_MAX_MS", 10_000L)));
        this.defaultSchema = text(source, "ANOMALY_DEFAULT_SCHEMA", "opensds_perf");
        this.checkpointPath = text(source, "ANOMALY_CHECKPOINT_PATH", "data/checkpoints.json");
        this.stateSnapshotPath = optionalText(source, "ANOMALY_STATE_SNAPSHOT_PATH", "");
        this.stateSnapshotInterval = Duration.ofSeconds(Math.max(5, integer(source, "ANOMALY_STATE_SNAPSHOT_INTERVAL_SEC", 300)));
        this.dlqTopic = optionalText(source, "ANOMALY_DLQ_TOPIC", "");
        this.pollTimeout = Duration.ofMillis(Math.max(1L, longValue(source, "ANOMALY_POLL_TIMEOUT_MS", 500L)));
        this.commitInterval = Duration.ofMillis(Math.max(1L, longValue(source, "ANOMALY_COMMIT_INTERVAL_MS", 1000L)));
        this.metricsLogInterval = Duration.ofSeconds(Math.max(1, integer(source, "ANOMALY_METRICS_LOG_INTERVAL_SEC", 60)));
        this.detectorCatalogPath = optionalText(source, "ANOMALY_DETECTOR_CATALOG_PATH", "");
        this.replayFile = optionalText(source, "ANOMALY_REPLAY_FILE", "");
    }

    public static PipelineConfig fromEnv() {
        return new PipelineConfig(System::getenv);
    }

    public static PipelineConfig fromMap(Map<String, String> values) {
        return new PipelineConfig(values::get);
    }

    public boolean hasSinkEndpoint() {
        return !sinkEndpoint.isEmpty();
    }

    public boolean hasDefaultDetector() {
        return !defaultDetector.isEmpty();
    }

    public boolean hasStateSnapshot() {
        return !stateSnapshotPath.isEmpty();
    }

    public boolean hasDlq() {
        return !dlqTopic.isEmpty();
    }

    public boolean replaysFile() {
        return !replayFile.isEmpty();
    }

    /**
     * One-line summary for the startup log.
     */
    public String summary() {
        return "topic=" + topic
                + " brokers=" + brokerEndpoints
                + " group=" + consumerGroup
                + " lanes=" + laneCount
                + " laneQueue=" + laneQueueCapacity
                + " idleEviction=" + idleEviction.getSeconds() + "s"
                + " maxTracked=" + maxTrackedMetrics
                + " sink=" + (hasSinkEndpoint() ? sinkEndpoint : "log")
                + " defaultDetector=" + (hasDefaultDetector() ? defaultDetector : "none")
                + " retries=" + maxRetryAttempts
                + " backoff=" + retryBackoffBase.toMillis() + ".." + retryBackoffMax.toMillis() + "ms"
                + " schema=" + defaultSchema
                + " checkpoints=" + checkpointPath
                + " stateSnapshot=" + (hasStateSnapshot() ? stateSnapshotPath : "off")
                + " dlq=" + (hasDlq() ? dlqTopic : "off")
                + (replaysFile() ? " replay=" + replayFile : "");
    }

    // Empty values fall back to the default.
    private static String text(Function<String, String> source, String key, String defaultValue) {
        String value = source.apply(key);
        return value == null || value.trim().isEmpty() ? defaultValue : value.trim();
    }

    // A key set to an empty value switches the feature off.
    private static String optionalText(Function<String, String> source, String key, String defaultValue) {
        String value = source.apply(key);
        return value == null ? defaultValue : value.trim();
    }

    private static int integer(Function<String, String> source, String key, int defaultValue) {
        String value = source.apply(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            return defaultValue;
        }
    }

    private static long longValue(Function<String, String> source, String key, long defaultValue) {
        String value = source.apply(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException ex) {
            return defaultValue;
        }
    }
}
