package org.opensds.anomaly.pipeline;

import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.ByteArraySerializer;

import org.opensds.anomaly.channel.FileReplayChannel;
import org.opensds.anomaly.channel.IngestionChannel;
import org.opensds.anomaly.channel.KafkaIngestionChannel;
import org.opensds.anomaly.checkpoint.CheckpointManager;
import org.opensds.anomaly.checkpoint.FileCheckpointStore;
import org.opensds.anomaly.detect.DetectorCatalog;
import org.opensds.anomaly.detect.DetectorCatalogLoader;
import org.opensds.anomaly.detect.DetectorRegistry;
import org.opensds.anomaly.engine.DetectionEngine;
import org.opensds.anomaly.engine.MaintenanceTask;
import org.opensds.anomaly.engine.PipelineMetrics;
import org.opensds.anomaly.normalize.MetricRecordNormalizer;
import org.opensds.anomaly.sink.DeadLetterPublisher;
import org.opensds.anomaly.sink.EventSink;
import org.opensds.anomaly.sink.EventSinkFactory;
import org.opensds.anomaly.sink.KafkaDeadLetterPublisher;
import org.opensds.anomaly.state.StateSnapshotFile;
import org.opensds.anomaly.state.StreamStateStore;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

/**
 * Anomaly detection service:
 * - Consume storage metric samples from Kafka (or replay a recorded file)
 * - Normalize payloads into metric records
 * - Evaluate each record with the detector bound to its metric, in per-metric order
 * - Emit detection events to the results sink, dead-letter what cannot be processed
 * - Checkpoint partition progress only past fully processed records
 */
public final class AnomalyDetectionJob {
    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(AnomalyDetectionJob.class);
    static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(60);

    private AnomalyDetectionJob() {}

    public static void main(String[] args) throws Exception {
        PipelineConfig config = PipelineConfig.fromEnv();
        LOG.info("Starting anomaly detection: {}", config.summary());

        DetectionEngine engine = build(config);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            engine.requestStop();
            try {
                if (!engine.awaitTermination(SHUTDOWN_TIMEOUT)) {
                    LOG.error("Engine did not stop within {}s; unfinished records will be redelivered",
                            SHUTDOWN_TIMEOUT.getSeconds());
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }, "anomaly-shutdown"));

        engine.run();

        Throwable fatal = engine.fatalFailure();
        if (fatal != null) {
            LOG.error("Anomaly detection stopped on a fatal error", fatal);
            System.exit(1);
        }
        LOG.info("Anomaly detection finished");
    }

    static DetectionEngine build(PipelineConfig config) {
        PipelineMetrics metrics = new PipelineMetrics(config.metricsLogInterval);

        DetectorCatalog catalog = DetectorCatalogLoader.load(config.detectorCatalogPath);
        DetectorRegistry registry = catalog.toRegistry(config.defaultDetector);
        LOG.info("Loaded detector catalog {} ({} detectors)", catalog.version(), catalog.size());

        MetricRecordNormalizer normalizer = MetricRecordNormalizer.withBuiltInAdapters(config.defaultSchema);
        LOG.info("Accepting schemas {} (default {})", normalizer.schemas(), config.defaultSchema);
        StreamStateStore stateStore = new StreamStateStore(config.maxTrackedMetrics);
        CheckpointManager checkpoints = new CheckpointManager(new FileCheckpointStore(Path.of(config.checkpointPath)));

        IngestionChannel channel = config.replaysFile()
                ? new FileReplayChannel(Path.of(config.replayFile), checkpoints::resumePosition)
                : KafkaIngestionChannel.create(
                        config.brokerEndpoints, config.topic, config.consumerGroup, checkpoints::resumePosition);

        EventSink sink = EventSinkFactory.build(config, metrics.sinkRetries);
        DeadLetterPublisher deadLetters = config.hasDlq()
                ? new KafkaDeadLetterPublisher(new KafkaProducer<>(dlqProducerProps(config)), config.dlqTopic)
                : DeadLetterPublisher.NONE;

        StateSnapshotFile snapshotFile = config.hasStateSnapshot() ? new StateSnapshotFile(Path.of(config.stateSnapshotPath)) : null;
        if (snapshotFile != null) {
            stateStore.trackConfirmation(checkpoints::committed);
        }
        MaintenanceTask maintenance = new MaintenanceTask(
                stateStore, config.idleEviction, metrics, snapshotFile,
                config.metricsLogInterval, config.stateSnapshotInterval);

        return new DetectionEngine(
                config, channel, normalizer, registry, stateStore, checkpoints, sink, deadLetters, metrics, maintenance);
    }

    static Properties dlqProducerProps(PipelineConfig config) {
        Properties props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.brokerEndpoints);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, "true");
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
        return props;
    }
}
