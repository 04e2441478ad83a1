package org.opensds.anomaly.engine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import org.opensds.anomaly.detect.algorithm.ThresholdState;
import org.opensds.anomaly.state.StateSnapshotFile;
import org.opensds.anomaly.state.StreamStateStore;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class MaintenanceTaskTest {

    @TempDir
    Path tempDir;

    private final AtomicLong clock = new AtomicLong(1_000_000L);

    private MaintenanceTask task(StreamStateStore store, PipelineMetrics metrics, StateSnapshotFile snapshot) {
        return new MaintenanceTask(store, Duration.ofMinutes(10), metrics, snapshot,
                Duration.ofMinutes(1), Duration.ofMinutes(5), clock::get);
    }

    @Test
    void evictsIdleStatesAndCountsThem() {
        StreamStateStore store = new StreamStateStore(100, clock::get);
        store.restore("idle", "threshold", ThresholdState.EMPTY, 1);
        clock.addAndGet(Duration.ofMinutes(9).toMillis());
        store.restore("fresh", "threshold", ThresholdState.EMPTY, 1);
        PipelineMetrics metrics = new PipelineMetrics();

        clock.addAndGet(Duration.ofMinutes(2).toMillis());
        task(store, metrics, null).run();

        assertNull(store.get("idle"));
        assertNotNull(store.get("fresh"));
        assertEquals(1, metrics.evicted.getCount());
    }

    @Test
    void trimsStoreBackToCapacity() {
        StreamStateStore store = new StreamStateStore(2, clock::get);
        for (int i = 0; i < 4; i++) {
            clock.incrementAndGet();
            store.restore("m" + i, "threshold", ThresholdState.EMPTY, 0);
        }
        PipelineMetrics metrics = new PipelineMetrics();

        task(store, metrics, null).run();

        assertEquals(2, store.size());
        assertNotNull(store.get("m3"));
        assertEquals(2, metrics.evicted.getCount());
    }

    @Test
    void snapshotIsWrittenOnceIntervalElapses() {
        Path path = tempDir.resolve("states.json");
        StreamStateStore store = new StreamStateStore(100, clock::get);
        store.restore("m1", "threshold", new ThresholdState(new double[] {1.0, 2.0}), 2);
        MaintenanceTask task = task(store, new PipelineMetrics(), new StateSnapshotFile(path));

        clock.addAndGet(Duration.ofMinutes(1).toMillis());
        task.run();
        assertFalse(Files.exists(path));

        clock.addAndGet(Duration.ofMinutes(4).toMillis());
        task.run();
        assertTrue(Files.exists(path));
    }

    @Test
    void savedStateIsRestoredByNextTask() {
        StateSnapshotFile snapshot = new StateSnapshotFile(tempDir.resolve("states.json"));
        StreamStateStore store = new StreamStateStore(100, clock::get);
        store.restore("m1", "threshold", new ThresholdState(new double[] {1.0, 2.0}), 2);
        task(store, new PipelineMetrics(), snapshot).saveState();

        StreamStateStore restored = new StreamStateStore(100, clock::get);
        assertEquals(1, task(restored, new PipelineMetrics(), snapshot).restoreState());
        assertEquals(new ThresholdState(new double[] {1.0, 2.0}), restored.get("m1").value());
    }

    @Test
    void unreadableSnapshotStartsCold() throws Exception {
        Path path = tempDir.resolve("states.json");
        Files.writeString(path, "{ broken");
        StreamStateStore store = new StreamStateStore(100, clock::get);

        assertEquals(0, task(store, new PipelineMetrics(), new StateSnapshotFile(path)).restoreState());
        assertEquals(0, store.size());
    }

    @Test
    void withoutSnapshotFileSaveAndRestoreAreNoOps() {
        StreamStateStore store = new StreamStateStore(100, clock::get);
        MaintenanceTask task = task(store, new PipelineMetrics(), null);

        assertEquals(0, task.restoreState());
        task.saveState();
        task.stop();
    }
}
