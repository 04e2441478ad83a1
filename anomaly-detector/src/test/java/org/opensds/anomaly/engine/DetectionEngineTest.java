package org.opensds.anomaly.engine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import org.opensds.anomaly.detect.DetectorRegistry;
import org.opensds.anomaly.detect.Detector;
import org.opensds.anomaly.detect.Evaluation;
import org.opensds.anomaly.detect.algorithm.ThresholdDetector;
import org.opensds.anomaly.detect.algorithm.ThresholdState;
import org.opensds.anomaly.model.DetectionEvent;
import org.opensds.anomaly.model.InboundMessage;
import org.opensds.anomaly.model.MetricRecord;
import org.opensds.anomaly.model.Severity;
import org.opensds.anomaly.sink.EventSink;
import org.opensds.anomaly.sink.RetryingEventSink;
import org.opensds.anomaly.sink.SinkException;
import org.opensds.anomaly.state.DetectorState;
import org.opensds.anomaly.state.StateSnapshotFile;
import org.opensds.anomaly.testing.InMemoryChannel;
import org.opensds.anomaly.testing.InMemoryCheckpointStore;
import org.opensds.anomaly.testing.RecordingEventSink;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class DetectionEngineTest {

    private static final String P0 = InMemoryChannel.partitionId(0);

    @TempDir
    Path tempDir;

    /**
     * Threshold detector that records every state it produces, per metric.
     */
    private static final class RecordingDetector implements Detector {
        final Map<String, List<DetectorState>> history = new ConcurrentHashMap<>();
        private final ThresholdDetector delegate = new ThresholdDetector("recording", 1000, 3.0, 2, 1e-9);

        @Override
        public String name() {
            return delegate.name();
        }

        @Override
        public DetectorState initialState() {
            return delegate.initialState();
        }

        @Override
        public Evaluation evaluate(MetricRecord record, DetectorState state) {
            Evaluation evaluation = delegate.evaluate(record, state);
            history.computeIfAbsent(record.metricId, id -> Collections.synchronizedList(new ArrayList<>()))
                    .add(evaluation.updatedState);
            return evaluation;
        }
    }

    private static InMemoryChannel interleavedTraffic() {
        InMemoryChannel channel = new InMemoryChannel(7);
        Random random = new Random(42);
        for (int i = 0; i < 400; i++) {
            String metric = "vol-" + random.nextInt(12) + "/iops";
            channel.metric(random.nextInt(3), metric, 1_710_000_000_000L + i, 100 + random.nextGaussian() * 5);
        }
        return channel;
    }

    private static Map<String, List<DetectorState>> historyWithLanes(int laneCount) {
        RecordingDetector detector = new RecordingDetector();
        EngineHarness harness = new EngineHarness(interleavedTraffic());
        harness.laneCount = laneCount;
        harness.registry = new DetectorRegistry(() -> detector);
        harness.runToCompletion();
        return detector.history;
    }

    @Test
    void perMetricStateSequenceMatchesSingleLaneRun() {
        Map<String, List<DetectorState>> reference = historyWithLanes(1);

        for (int lanes : new int[] {2, 4, 8}) {
            assertEquals(reference, historyWithLanes(lanes), "lanes=" + lanes);
        }
        assertEquals(12, reference.size());
    }

    @Test
    void concurrentMetricsDoNotShareState() {
        String[] metrics = EngineHarness.metricsOnDistinctLanes(2);
        InMemoryChannel channel = new InMemoryChannel(4);
        for (int i = 0; i < 50; i++) {
            channel.metric(i % 2, metrics[0], 1000L * i, 10.0 + (i % 3));
            channel.metric(i % 2, metrics[1], 1000L * i, 5000.0 + (i % 7));
        }
        EngineHarness harness = new EngineHarness(channel);
        harness.laneCount = 2;

        harness.runToCompletion();

        for (double v : ((ThresholdState) harness.stateStore.get(metrics[0]).value()).window()) {
            assertTrue(v < 100, "m1 window contains foreign value " + v);
        }
        for (double v : ((ThresholdState) harness.stateStore.get(metrics[1]).value()).window()) {
            assertTrue(v >= 5000, "m2 window contains foreign value " + v);
        }
        assertEquals(50, harness.stateStore.get(metrics[0]).evaluations());
        assertEquals(50, harness.stateStore.get(metrics[1]).evaluations());
        for (DetectionEvent event : harness.recordingSink().events()) {
            double expectedRange = event.metricId.equals(metrics[0]) ? 12 : 5006;
            assertTrue(event.value <= expectedRange, event.toString());
        }
    }

    @Test
    void spikeProducesSingleCriticalEvent() {
        InMemoryChannel channel = new InMemoryChannel()
                .metric(0, "m1", 1, 10)
                .metric(0, "m1", 2, 11)
                .metric(0, "m1", 3, 95);
        EngineHarness harness = new EngineHarness(channel).runToCompletion();

        List<DetectionEvent> events = harness.recordingSink().events();
        assertEquals(1, events.size());
        DetectionEvent event = events.get(0);
        assertEquals("m1", event.metricId);
        assertEquals(3000L, event.timestamp);
        assertEquals(95.0, event.value);
        assertEquals(Severity.CRITICAL, event.severity);
        assertEquals("threshold", event.detector);
        assertEquals(DetectionEvent.eventIdFor("m1", 3000L), event.eventId);

        assertEquals(2L, harness.checkpointStore.offset(P0));
        assertEquals(3L, channel.acked(P0));
        assertEquals(3, harness.metrics.evaluated.getCount());
        assertEquals(1, harness.metrics.emitted.getCount());
    }

    @Test
    void malformedRecordIsDroppedWithoutBlockingPartition() {
        InMemoryChannel channel = new InMemoryChannel()
                .metric(0, "m1", 1, 10)
                .add(0, "{\"schema\":\"metric_v1\",\"metric_id\":\"m1\",\"timestamp\":2}")
                .metric(0, "m1", 3, 11);
        EngineHarness harness = new EngineHarness(channel).runToCompletion();

        assertEquals(1, harness.metrics.discardCount(DiscardCause.MALFORMED));
        assertEquals(2, harness.metrics.evaluated.getCount());
        assertEquals(2L, harness.checkpointStore.offset(P0));
        assertEquals(1, harness.deadLetters.size());
        assertEquals("missing_value", harness.deadLetters.get(0).failure.reason);
        assertEquals(1L, harness.deadLetters.get(0).source.offset);
    }

    @Test
    void checkpointWaitsForInFlightRecord() throws Exception {
        String[] metrics = EngineHarness.metricsOnDistinctLanes(2);
        String slow = metrics[0];
        String fast = metrics[1];
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch blocked = new CountDownLatch(1);
        ThresholdDetector threshold = ThresholdDetector.withDefaults("threshold");
        Detector latched = new Detector() {
            @Override
            public String name() {
                return "latched";
            }

            @Override
            public DetectorState initialState() {
                return threshold.initialState();
            }

            @Override
            public Evaluation evaluate(MetricRecord record, DetectorState state) {
                blocked.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                }
                return threshold.evaluate(record, state);
            }
        };

        InMemoryChannel channel = new InMemoryChannel()
                .metric(0, fast, 1, 10)
                .metric(0, slow, 2, 10)
                .metric(0, fast, 3, 10)
                .metric(0, fast, 4, 10);
        EngineHarness harness = new EngineHarness(channel);
        harness.laneCount = 2;
        harness.registry.registerMetric(slow, () -> latched);

        DetectionEngine engine = harness.engine();
        engine.start();
        assertTrue(blocked.await(10, TimeUnit.SECONDS));
        long deadline = System.currentTimeMillis() + 10_000;
        while (harness.metrics.evaluated.getCount() < 3 && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        assertEquals(3, harness.metrics.evaluated.getCount());

        assertEquals(0L, harness.checkpoints.pendingMark(P0));
        Long persisted = harness.checkpointStore.offset(P0);
        assertTrue(persisted == null || persisted == 0L, "checkpoint passed in-flight offset: " + persisted);

        release.countDown();
        assertTrue(engine.awaitTermination(Duration.ofSeconds(10)));
        assertEquals(3L, harness.checkpointStore.offset(P0));
        assertEquals(0, harness.checkpoints.totalOutstanding());
    }

    @Test
    void redeliveryAfterCrashReproducesEvent() {
        RecordingEventSink firstSink = new RecordingEventSink();
        EngineHarness first = new EngineHarness(new InMemoryChannel()
                .metric(0, "m1", 1, 10)
                .metric(0, "m1", 2, 11)
                .metric(0, "m1", 3, 95));
        first.sink = firstSink;
        first.runToCompletion();

        // Crash before any checkpoint reached the store: everything is redelivered to a fresh process.
        RecordingEventSink secondSink = new RecordingEventSink();
        EngineHarness second = new EngineHarness(new InMemoryChannel()
                .metric(0, "m1", 1, 10)
                .metric(0, "m1", 2, 11)
                .metric(0, "m1", 3, 95));
        second.sink = secondSink;
        second.runToCompletion();

        assertEquals(1, firstSink.events().size());
        assertEquals(firstSink.events(), secondSink.events());
        assertEquals(firstSink.events().get(0).eventId, secondSink.events().get(0).eventId);
    }

    @Test
    void restartResumesAfterCheckpoint() {
        InMemoryCheckpointStore store = new InMemoryCheckpointStore();
        new EngineHarness(new InMemoryChannel().metric(0, "m1", 1, 10).metric(0, "m1", 2, 11), store)
                .runToCompletion();
        assertEquals(1L, store.offset(P0));

        EngineHarness restarted = new EngineHarness(new InMemoryChannel()
                .metric(0, "m1", 1, 10)
                .metric(0, "m1", 2, 11)
                .metric(0, "m1", 3, 12), store);
        restarted.channel.resumeFrom(P0, restarted.checkpoints.resumePosition(P0));
        restarted.runToCompletion();

        assertEquals(1, restarted.metrics.received.getCount());
        assertEquals(2L, store.offset(P0));
    }

    @Test
    void sinkRecoversAfterTwoFailures() {
        RecordingEventSink target = new RecordingEventSink(2, true);
        InMemoryChannel channel = new InMemoryChannel()
                .metric(0, "m1", 1, 10)
                .metric(0, "m1", 2, 11)
                .metric(0, "m1", 3, 95);
        EngineHarness harness = new EngineHarness(channel);
        List<Long> persistedPerAttempt = Collections.synchronizedList(new ArrayList<>());
        List<Long> markPerAttempt = Collections.synchronizedList(new ArrayList<>());
        EventSink observed = event -> {
            persistedPerAttempt.add(harness.checkpointStore.offset(P0));
            markPerAttempt.add(harness.checkpoints.pendingMark(P0));
            target.submit(event);
        };
        harness.sink = new RetryingEventSink(observed, 5, Duration.ofMillis(1), Duration.ofMillis(2),
                harness.metrics.sinkRetries, d -> {});

        harness.runToCompletion();

        assertEquals(1, target.events().size());
        assertEquals(3, target.attempts());
        assertEquals(2, harness.metrics.sinkRetries.getCount());
        assertEquals(0, harness.metrics.discardedTotal.getCount());
        assertEquals(2L, harness.checkpointStore.offset(P0));

        // The spike at offset 2 is outstanding for every attempt, retries included.
        assertEquals(3, persistedPerAttempt.size());
        for (Long persisted : persistedPerAttempt) {
            assertTrue(persisted == null || persisted < 2L, "checkpoint passed retried offset: " + persisted);
        }
        assertEquals(List.of(1L, 1L, 1L), markPerAttempt);
    }

    @Test
    void snapshotTakenWhileSpikeIsInFlightReproducesEventAfterRestart() throws Exception {
        StateSnapshotFile snapshot = new StateSnapshotFile(tempDir.resolve("states.json"));
        EngineHarness first = new EngineHarness(new InMemoryChannel()
                .metric(0, "m1", 1, 10)
                .metric(0, "m1", 2, 11)
                .metric(0, "m1", 3, 95));
        first.stateStore.trackConfirmation(first.checkpoints::committed);
        List<Long> checkpointAtSnapshot = Collections.synchronizedList(new ArrayList<>());
        RecordingEventSink firstSink = new RecordingEventSink() {
            @Override
            public void submit(DetectionEvent event) throws SinkException {
                // Periodic maintenance firing while the spike waits on the sink.
                first.checkpoints.flush();
                try {
                    snapshot.save(first.stateStore);
                } catch (IOException ex) {
                    throw new UncheckedIOException(ex);
                }
                checkpointAtSnapshot.add(first.checkpointStore.offset(P0));
                super.submit(event);
            }
        };
        first.sink = firstSink;
        first.runToCompletion();
        assertEquals(List.of(1L), checkpointAtSnapshot);
        assertEquals(1, firstSink.events().size());

        // Crash right after the snapshot: the store still holds offset 1, so the spike is redelivered.
        InMemoryCheckpointStore survived = new InMemoryCheckpointStore();
        survived.store(P0, checkpointAtSnapshot.get(0));
        EngineHarness restarted = new EngineHarness(new InMemoryChannel()
                .metric(0, "m1", 1, 10)
                .metric(0, "m1", 2, 11)
                .metric(0, "m1", 3, 95), survived);
        restarted.stateStore.trackConfirmation(restarted.checkpoints::committed);
        assertEquals(1, snapshot.restoreInto(restarted.stateStore));
        assertEquals(new ThresholdState(new double[] {10, 11}), restarted.stateStore.get("m1").value());
        assertEquals(2, restarted.stateStore.get("m1").evaluations());

        restarted.channel.resumeFrom(P0, restarted.checkpoints.resumePosition(P0));
        restarted.runToCompletion();

        List<DetectionEvent> replayed = restarted.recordingSink().events();
        assertEquals(1, replayed.size());
        assertEquals(Severity.CRITICAL, replayed.get(0).severity);
        assertEquals(firstSink.events(), replayed);
        assertEquals(2L, survived.offset(P0));
    }

    @Test
    void stopRequestDrainsDispatchedRecordsBeforeClosingSink() throws Exception {
        InMemoryChannel channel = new InMemoryChannel(4);
        for (int i = 0; i < 400; i++) {
            channel.metric(0, "m" + (i % 6), 1_710_000_000_000L + i, 50);
        }
        AtomicInteger inFlight = new AtomicInteger();
        ThresholdDetector threshold = ThresholdDetector.withDefaults("threshold");
        Detector slow = new Detector() {
            @Override
            public String name() {
                return "slow";
            }

            @Override
            public DetectorState initialState() {
                return threshold.initialState();
            }

            @Override
            public Evaluation evaluate(MetricRecord record, DetectorState state) {
                inFlight.incrementAndGet();
                try {
                    Thread.sleep(2);
                    return threshold.evaluate(record, state);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("interrupted", ex);
                } finally {
                    inFlight.decrementAndGet();
                }
            }
        };
        EngineHarness harness = new EngineHarness(channel);
        harness.laneCount = 2;
        harness.registry = new DetectorRegistry(() -> slow);
        AtomicLong evaluatedAtClose = new AtomicLong(-1);
        AtomicInteger inFlightAtClose = new AtomicInteger(-1);
        harness.sink = new RecordingEventSink() {
            @Override
            public void close() {
                evaluatedAtClose.set(harness.metrics.evaluated.getCount());
                inFlightAtClose.set(inFlight.get());
                super.close();
            }
        };

        DetectionEngine engine = harness.engine();
        engine.start();
        long deadline = System.currentTimeMillis() + 10_000;
        while (harness.metrics.evaluated.getCount() < 10 && System.currentTimeMillis() < deadline) {
            Thread.sleep(1);
        }
        engine.requestStop();
        assertTrue(engine.awaitTermination(Duration.ofSeconds(30)));

        long dispatched = harness.metrics.received.getCount();
        assertTrue(dispatched >= 10 && dispatched < 400, "dispatched " + dispatched);
        assertEquals(0, harness.checkpoints.totalOutstanding());
        assertEquals(dispatched, harness.metrics.evaluated.getCount());
        assertEquals(Long.valueOf(dispatched - 1), harness.checkpointStore.offset(P0));
        assertEquals(dispatched, evaluatedAtClose.get());
        assertEquals(0, inFlightAtClose.get());
        assertTrue(harness.recordingSink().closed());
        assertTrue(channel.closed());
        assertTrue(engine.lanesStopped());
        assertNull(engine.fatalFailure());
    }

    @Test
    void interruptedPollerStillStopsLanesAndCloses() throws Exception {
        InMemoryChannel channel = new InMemoryChannel() {
            @Override
            public synchronized List<InboundMessage> poll(Duration timeout) {
                Thread.currentThread().interrupt();
                return super.poll(timeout);
            }
        };
        channel.metric(0, "m1", 1, 10).metric(0, "m1", 2, 11);
        EngineHarness harness = new EngineHarness(channel);
        DetectionEngine engine = harness.engine();
        AtomicBoolean interruptKept = new AtomicBoolean();
        Thread poller = new Thread(() -> {
            engine.run();
            interruptKept.set(Thread.currentThread().isInterrupted());
        });

        poller.start();
        poller.join(10_000);

        assertFalse(poller.isAlive());
        assertTrue(engine.lanesStopped());
        assertTrue(interruptKept.get());
        assertTrue(channel.closed());
        assertTrue(harness.recordingSink().closed());
        // Offset 0 was never handed to a lane, so nothing may be checkpointed.
        assertNull(harness.checkpointStore.offset(P0));
        assertEquals(0, harness.metrics.evaluated.getCount());
    }

    @Test
    void shutdownClosesChannelAndSink() {
        InMemoryChannel channel = new InMemoryChannel().metric(0, "m1", 1, 10);
        EngineHarness harness = new EngineHarness(channel).runToCompletion();

        assertTrue(channel.closed());
        assertTrue(harness.recordingSink().closed());
        assertFalse(harness.engine().isRunning());
        assertNull(harness.engine().fatalFailure());
    }
}
