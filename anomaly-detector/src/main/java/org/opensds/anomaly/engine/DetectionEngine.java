package org.opensds.anomaly.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.opensds.anomaly.channel.ChannelException;
import org.opensds.anomaly.channel.IngestionChannel;
import org.opensds.anomaly.checkpoint.CheckpointManager;
import org.opensds.anomaly.checkpoint.CheckpointStoreException;
import org.opensds.anomaly.detect.DetectionResult;
import org.opensds.anomaly.detect.Detector;
import org.opensds.anomaly.detect.DetectorRegistry;
import org.opensds.anomaly.detect.Evaluation;
import org.opensds.anomaly.detect.NoDetectorAvailableException;
import org.opensds.anomaly.model.DetectionEvent;
import org.opensds.anomaly.model.DiscardedRecordEnvelope;
import org.opensds.anomaly.model.InboundMessage;
import org.opensds.anomaly.model.MetricRecord;
import org.opensds.anomaly.normalize.MetricRecordNormalizer;
import org.opensds.anomaly.normalize.NormalizationResult;
import org.opensds.anomaly.pipeline.PipelineConfig;
import org.opensds.anomaly.sink.DeadLetterPublisher;
import org.opensds.anomaly.sink.DiscardedRecordEnvelopeFactory;
import org.opensds.anomaly.sink.EventSink;
import org.opensds.anomaly.sink.RetryingEventSink;
import org.opensds.anomaly.sink.SinkException;
import org.opensds.anomaly.state.StreamState;
import org.opensds.anomaly.state.StreamStateStore;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives records from the ingestion channel through normalization, detection and emission.
 *
 * <p>One poll thread reads the channel, registers every message with the {@link CheckpointManager},
 * normalizes it and hands the record to the lane owning its metric id. Lanes evaluate and emit; each record
 * completes its offset exactly once, on success or discard. The poll thread periodically persists checkpoint
 * progress and acknowledges it to the channel.</p>
 *
 * <p>Shutdown stops polling, lets every lane drain its queue, then flushes checkpoints and saves stream
 * state before closing the channel and sinks.</p>
 */
public class DetectionEngine implements Runnable {
    private static final Logger LOG = LoggerFactory.getLogger(DetectionEngine.class);
    static final Duration MAX_CHANNEL_BACKOFF = Duration.ofSeconds(30);

    private final PipelineConfig config;
    private final IngestionChannel channel;
    private final MetricRecordNormalizer normalizer;
    private final DetectorRegistry registry;
    private final StreamStateStore stateStore;
    private final CheckpointManager checkpoints;
    private final EventSink sink;
    private final DeadLetterPublisher deadLetters;
    private final PipelineMetrics metrics;
    private final MaintenanceTask maintenance;
    private final FatalErrorHandler fatalHandler;
    private final Lane[] lanes;
    private final int sinkAttempts;

    private final CountDownLatch terminated = new CountDownLatch(1);
    private final AtomicReference<Throwable> fatalFailure = new AtomicReference<>();
    private volatile boolean running = true;
    private Thread pollThread;

    public DetectionEngine(
            PipelineConfig config,
            IngestionChannel channel,
            MetricRecordNormalizer normalizer,
            DetectorRegistry registry,
            StreamStateStore stateStore,
            CheckpointManager checkpoints,
            EventSink sink,
            DeadLetterPublisher deadLetters,
            PipelineMetrics metrics,
            MaintenanceTask maintenance) {
        this(config, channel, normalizer, registry, stateStore, checkpoints, sink, deadLetters, metrics, maintenance, null);
    }

    /**
     * @param fatalHandler called on checkpoint durability failures; {@code null} stops the engine
     */
    public DetectionEngine(
            PipelineConfig config,
            IngestionChannel channel,
            MetricRecordNormalizer normalizer,
            DetectorRegistry registry,
            StreamStateStore stateStore,
            CheckpointManager checkpoints,
            EventSink sink,
            DeadLetterPublisher deadLetters,
            PipelineMetrics metrics,
            MaintenanceTask maintenance,
            FatalErrorHandler fatalHandler) {
        this.config = config;
        this.channel = channel;
        this.normalizer = normalizer;
        this.registry = registry;
        this.stateStore = stateStore;
        this.checkpoints = checkpoints;
        this.sink = sink;
        this.deadLetters = deadLetters == null ? DeadLetterPublisher.NONE : deadLetters;
        this.metrics = metrics;
        this.maintenance = maintenance;
        this.fatalHandler = fatalHandler == null ? (partitionId, cause) -> requestStop() : fatalHandler;
        this.sinkAttempts = sink instanceof RetryingEventSink ? ((RetryingEventSink) sink).maxAttempts() : 1;
        this.lanes = new Lane[config.laneCount];
        for (int i = 0; i < lanes.length; i++) {
            lanes[i] = new Lane(i, config.laneQueueCapacity, this::process);
        }
    }

    /**
     * Runs the poll loop on a new thread.
     */
    public synchronized void start() {
        if (pollThread != null) {
            throw new IllegalStateException("Engine already started");
        }
        pollThread = new Thread(this, "anomaly-poller");
        pollThread.start();
    }

    @Override
    public void run() {
        LOG.info("Detection engine starting ({} lanes, queue capacity {})", lanes.length, config.laneQueueCapacity);
        if (maintenance != null) {
            maintenance.restoreState();
            maintenance.start();
        }
        for (Lane lane : lanes) {
            lane.start();
        }
        try {
            pollLoop();
        } catch (RuntimeException ex) {
            LOG.error("Poll loop failed; shutting down", ex);
            fatalFailure.compareAndSet(null, ex);
        } finally {
            shutdown();
            terminated.countDown();
        }
    }

    private void pollLoop() {
        long nextFlush = System.currentTimeMillis() + config.commitInterval.toMillis();
        int consecutiveChannelFailures = 0;
        while (running) {
            List<InboundMessage> batch;
            try {
                batch = channel.poll(config.pollTimeout);
                consecutiveChannelFailures = 0;
            } catch (ChannelException ex) {
                metrics.channelFailures.inc();
                consecutiveChannelFailures++;
                Duration pause = channelBackoff(consecutiveChannelFailures);
                LOG.warn("Channel unavailable (failure {}); retrying in {} ms: {}",
                        consecutiveChannelFailures, pause.toMillis(), ex.getMessage());
                if (!sleep(pause)) {
                    break;
                }
                continue;
            }
            for (InboundMessage message : batch) {
                if (!running || !dispatch(message)) {
                    break;
                }
            }
            long now = System.currentTimeMillis();
            if (now >= nextFlush) {
                flushCheckpoints();
                nextFlush = now + config.commitInterval.toMillis();
            }
            if (channel.isExhausted()) {
                LOG.info("Channel exhausted; stopping");
                running = false;
            }
        }
    }

    /**
     * @return false when the poll thread was interrupted while waiting for lane capacity
     */
    private boolean dispatch(InboundMessage message) {
        String partitionId = message.partitionId();
        checkpoints.begin(partitionId, message.offset);
        metrics.received.inc();
        trace(partitionId, message.offset, RecordStage.RECEIVED);

        NormalizationResult result = normalizer.normalize(message);
        if (!result.valid) {
            LOG.debug("Dropping malformed record {}@{} (schema={}, reason={}): {}",
                    partitionId, message.offset, result.schema, result.reason, result.details);
            discard(DiscardCause.MALFORMED, DiscardedRecordEnvelopeFactory.forMalformed(message, result));
            finish(partitionId, message.offset, RecordStage.DISCARDED);
            return true;
        }
        metrics.normalized.inc();
        MetricRecord record = result.record;
        trace(partitionId, message.offset, RecordStage.NORMALIZED);
        try {
            laneFor(record.metricId).submit(record);
            return true;
        } catch (InterruptedException ex) {
            // The offset stays outstanding, so the checkpoint cannot pass it.
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while dispatching {}@{}; stopping", partitionId, message.offset);
            running = false;
            return false;
        }
    }

    Lane laneFor(String metricId) {
        return lanes[laneIndex(metricId, lanes.length)];
    }

    static int laneIndex(String metricId, int laneCount) {
        return Math.floorMod(metricId.hashCode(), laneCount);
    }

    /**
     * Lane body for one record. Always completes the record's offset.
     */
    void process(MetricRecord record) {
        RecordStage outcome = RecordStage.DISCARDED;
        try {
            outcome = evaluateAndEmit(record);
        } catch (RuntimeException ex) {
            LOG.error("Unexpected failure processing {}@{} (metric {})",
                    record.partitionId, record.sourceOffset, record.metricId, ex);
            discard(DiscardCause.INTERNAL_ERROR, DiscardedRecordEnvelopeFactory.forInternalError(record, ex));
        } catch (Error err) {
            // The lane survives so its queue keeps draining; the process is asked to stop.
            LOG.error("Fatal error processing {}@{} (metric {})",
                    record.partitionId, record.sourceOffset, record.metricId, err);
            discard(DiscardCause.INTERNAL_ERROR, DiscardedRecordEnvelopeFactory.forInternalError(record, err));
            fatalFailure.compareAndSet(null, err);
            fatalHandler.onFatal(record.partitionId, err);
        } finally {
            finish(record.partitionId, record.sourceOffset, outcome);
        }
    }

    private RecordStage evaluateAndEmit(MetricRecord record) {
        Detector detector;
        try {
            detector = registry.resolve(record);
        } catch (NoDetectorAvailableException ex) {
            metrics.noDetector.inc();
            LOG.debug("No detector for metric {}; skipping detection", record.metricId);
            return RecordStage.CHECKPOINTED;
        }

        StreamState state = stateStore.getOrCreate(record.metricId, detector);
        trace(record.partitionId, record.sourceOffset, RecordStage.STATE_LOADED);

        Evaluation evaluation;
        try {
            evaluation = detector.evaluate(record, state.value());
        } catch (RuntimeException ex) {
            LOG.warn("Detector {} failed on metric {} at {}; record discarded, state unchanged",
                    detector.name(), record.metricId, record.timestamp, ex);
            discard(DiscardCause.DETECTOR_FAILURE,
                    DiscardedRecordEnvelopeFactory.forDetectorFailure(record, detector.name(), ex));
            return RecordStage.DISCARDED;
        }
        stateStore.replace(record.metricId, detector.name(), evaluation.updatedState,
                record.partitionId, record.sourceOffset);
        metrics.evaluated.inc();
        trace(record.partitionId, record.sourceOffset, RecordStage.EVALUATED);

        DetectionResult result = evaluation.result;
        if (!result.anomaly) {
            return RecordStage.CHECKPOINTED;
        }
        metrics.anomalies.inc();
        DetectionEvent event = new DetectionEvent(
                record.metricId, record.timestamp, record.value,
                result.severity, result.score, result.explanation, detector.name());
        try {
            sink.submit(event);
        } catch (SinkException ex) {
            LOG.error("DATA LOSS: detection {} for metric {} at {} ({}) discarded after sink failure: {}",
                    event.eventId, event.metricId, event.timestamp, event.severity.wireName(), ex.getMessage());
            discard(DiscardCause.SINK_EXHAUSTED,
                    DiscardedRecordEnvelopeFactory.forSinkExhausted(record, event, ex, sinkAttempts));
            return RecordStage.DISCARDED;
        }
        metrics.emitted.inc();
        trace(record.partitionId, record.sourceOffset, RecordStage.EMITTED);
        return RecordStage.CHECKPOINTED;
    }

    private void discard(DiscardCause cause, DiscardedRecordEnvelope envelope) {
        metrics.discarded(cause);
        try {
            deadLetters.publish(envelope);
            metrics.deadLettered.inc();
        } catch (RuntimeException ex) {
            LOG.warn("Dead-letter publication failed for {} discard: {}", cause, ex.getMessage());
        }
    }

    private void finish(String partitionId, long offset, RecordStage stage) {
        if (!stage.terminal()) {
            throw new IllegalStateException("Record " + partitionId + "@" + offset + " finished in stage " + stage);
        }
        trace(partitionId, offset, stage);
        checkpoints.complete(partitionId, offset);
    }

    private static void trace(String partitionId, long offset, RecordStage stage) {
        if (LOG.isTraceEnabled()) {
            LOG.trace("{}@{} -> {}", partitionId, offset, stage);
        }
    }

    /**
     * Persists completed progress and acknowledges it to the channel. Called on the poll thread only.
     */
    void flushCheckpoints() {
        CheckpointManager.FlushOutcome outcome = checkpoints.flush();
        for (Map.Entry<String, Long> advanced : outcome.advanced.entrySet()) {
            metrics.checkpointsAdvanced.inc();
            try {
                channel.ackSafeToResumeFrom(advanced.getKey(), advanced.getValue() + 1);
            } catch (ChannelException ex) {
                // The local checkpoint is durable and is what the channel seeks to on assignment.
                LOG.warn("Acknowledging {}@{} to the channel failed: {}",
                        advanced.getKey(), advanced.getValue() + 1, ex.getMessage());
            }
        }
        for (CheckpointStoreException failure : outcome.failures) {
            String partitionId = failure.partitionId();
            channel.pause(partitionId);
            fatalFailure.compareAndSet(null, failure);
            LOG.error("Checkpoint durability lost for partition {}; partition paused", partitionId);
            fatalHandler.onFatal(partitionId, failure);
        }
    }

    private void shutdown() {
        running = false;
        int queued = 0;
        for (Lane lane : lanes) {
            queued += lane.backlog();
        }
        LOG.info("Detection engine draining {} lanes ({} records queued)", lanes.length, queued);
        // A pending interrupt would make every put and join below fail at once.
        boolean interrupted = Thread.interrupted();
        if (!drainLanes()) {
            interrupted = true;
            LOG.warn("Interrupted while draining lanes; {} records still in flight", checkpoints.totalOutstanding());
        }
        try {
            closeAll();
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Queues a stop marker behind the work of every lane and waits for all of them.
     *
     * @return false when interrupted; the lanes are then interrupted too, so none outlives the engine
     */
    private boolean drainLanes() {
        try {
            for (Lane lane : lanes) {
                lane.stop();
            }
            for (Lane lane : lanes) {
                lane.join();
            }
            return true;
        } catch (InterruptedException ex) {
            for (Lane lane : lanes) {
                lane.interrupt();
            }
            return false;
        }
    }

    boolean lanesStopped() {
        for (Lane lane : lanes) {
            if (lane.isAlive()) {
                return false;
            }
        }
        return true;
    }

    private void closeAll() {
        try {
            flushCheckpoints();
        } catch (RuntimeException ex) {
            LOG.error("Final checkpoint flush failed", ex);
            fatalFailure.compareAndSet(null, ex);
        }
        int outstanding = checkpoints.totalOutstanding();
        if (outstanding > 0) {
            LOG.warn("{} records did not complete and will be redelivered", outstanding);
        }
        if (maintenance != null) {
            maintenance.stop();
            maintenance.saveState();
        }
        checkpoints.close();
        channel.close();
        sink.close();
        deadLetters.close();
        LOG.info("Detection engine stopped: {}", metrics.summary());
    }

    /**
     * Asks the engine to stop. Safe to call from any thread, including a shutdown hook.
     */
    public void requestStop() {
        if (running) {
            LOG.info("Stop requested");
        }
        running = false;
        channel.wakeup();
    }

    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * First durability or loop failure seen, or {@code null}.
     */
    public Throwable fatalFailure() {
        return fatalFailure.get();
    }

    static Duration channelBackoff(int failures) {
        long millis = 100L << Math.min(failures - 1, 20);
        return Duration.ofMillis(Math.min(millis, MAX_CHANNEL_BACKOFF.toMillis()));
    }

    private boolean sleep(Duration pause) {
        long deadline = System.currentTimeMillis() + pause.toMillis();
        try {
            while (running && System.currentTimeMillis() < deadline) {
                Thread.sleep(Math.min(100L, Math.max(1L, deadline - System.currentTimeMillis())));
            }
            return running;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
