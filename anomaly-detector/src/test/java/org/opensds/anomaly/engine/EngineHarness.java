package org.opensds.anomaly.engine;

import org.opensds.anomaly.checkpoint.CheckpointManager;
import org.opensds.anomaly.detect.DetectorRegistry;
import org.opensds.anomaly.detect.algorithm.ThresholdDetector;
import org.opensds.anomaly.model.DiscardedRecordEnvelope;
import org.opensds.anomaly.normalize.MetricRecordNormalizer;
import org.opensds.anomaly.normalize.OpenSdsPerfAdapter;
import org.opensds.anomaly.pipeline.PipelineConfig;
import org.opensds.anomaly.sink.DeadLetterPublisher;
import org.opensds.anomaly.sink.EventSink;
import org.opensds.anomaly.state.StreamStateStore;
import org.opensds.anomaly.testing.InMemoryChannel;
import org.opensds.anomaly.testing.InMemoryCheckpointStore;
import org.opensds.anomaly.testing.RecordingEventSink;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Wires a detection engine over in-memory collaborators.
 */
final class EngineHarness {
    final InMemoryChannel channel;
    final InMemoryCheckpointStore checkpointStore;
    final CheckpointManager checkpoints;
    final StreamStateStore stateStore = new StreamStateStore(10_000);
    final PipelineMetrics metrics = new PipelineMetrics();
    final List<DiscardedRecordEnvelope> deadLetters = Collections.synchronizedList(new ArrayList<>());
    final List<String> fatalPartitions = Collections.synchronizedList(new ArrayList<>());
    DeadLetterPublisher deadLetterPublisher = deadLetters::add;
    DetectorRegistry registry = new DetectorRegistry(() -> ThresholdDetector.withDefaults("threshold"));
    EventSink sink = new RecordingEventSink();
    int laneCount = 4;
    boolean stopOnFatal = true;
    private DetectionEngine engine;

    EngineHarness(InMemoryChannel channel) {
        this(channel, new InMemoryCheckpointStore());
    }

    EngineHarness(InMemoryChannel channel, InMemoryCheckpointStore checkpointStore) {
        this.channel = channel;
        this.checkpointStore = checkpointStore;
        this.checkpoints = new CheckpointManager(checkpointStore);
    }

    DetectionEngine engine() {
        if (engine == null) {
            Map<String, String> env = new HashMap<>();
            env.put("ANOMALY_LANE_COUNT", String.valueOf(laneCount));
            env.put("ANOMALY_LANE_QUEUE_CAPACITY", "8");
            env.put("ANOMALY_POLL_TIMEOUT_MS", "1");
            env.put("ANOMALY_COMMIT_INTERVAL_MS", "1");
            engine = new DetectionEngine(
                    PipelineConfig.fromMap(env),
                    channel,
                    MetricRecordNormalizer.withBuiltInAdapters(OpenSdsPerfAdapter.SCHEMA),
                    registry,
                    stateStore,
                    checkpoints,
                    sink,
                    deadLetterPublisher,
                    metrics,
                    null,
                    (partitionId, cause) -> {
                        fatalPartitions.add(partitionId);
                        if (stopOnFatal) {
                            engine.requestStop();
                        }
                    });
        }
        return engine;
    }

    /**
     * Runs the engine on the calling thread until the channel is exhausted and every lane has drained.
     */
    EngineHarness runToCompletion() {
        engine().run();
        return this;
    }

    RecordingEventSink recordingSink() {
        return (RecordingEventSink) sink;
    }

    /**
     * Two metric ids that hash to different lanes.
     */
    static String[] metricsOnDistinctLanes(int laneCount) {
        String first = "m1";
        int lane = DetectionEngine.laneIndex(first, laneCount);
        for (int i = 2; ; i++) {
            String candidate = "m" + i;
            if (DetectionEngine.laneIndex(candidate, laneCount) != lane) {
                return new String[] {first, candidate};
            }
        }
    }
}
