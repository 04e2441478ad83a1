package org.opensds.anomaly.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.opensds.anomaly.state.StateSnapshotFile;
import org.opensds.anomaly.state.StreamStateStore;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Background housekeeping on its own thread, so it never blocks an evaluation lane: state eviction, rate
 * updates, the periodic metrics summary and the periodic state snapshot.
 */
public class MaintenanceTask implements Runnable {
    private static final Logger LOG = LoggerFactory.getLogger(MaintenanceTask.class);
    static final long PERIOD_SECONDS = 5;

    private final StreamStateStore stateStore;
    private final Duration idleEviction;
    private final PipelineMetrics metrics;
    private final StateSnapshotFile snapshotFile;
    private final Duration metricsLogInterval;
    private final Duration snapshotInterval;
    private final LongSupplier clock;
    private ScheduledExecutorService scheduler;
    private long lastSummaryMs;
    private long lastSnapshotMs;
    private long lastMalformed;

    public MaintenanceTask(
            StreamStateStore stateStore,
            Duration idleEviction,
            PipelineMetrics metrics,
            StateSnapshotFile snapshotFile,
            Duration metricsLogInterval,
            Duration snapshotInterval) {
        this(stateStore, idleEviction, metrics, snapshotFile, metricsLogInterval, snapshotInterval,
                System::currentTimeMillis);
    }

    MaintenanceTask(
            StreamStateStore stateStore,
            Duration idleEviction,
            PipelineMetrics metrics,
            StateSnapshotFile snapshotFile,
            Duration metricsLogInterval,
            Duration snapshotInterval,
            LongSupplier clock) {
        this.stateStore = stateStore;
        this.idleEviction = idleEviction;
        this.metrics = metrics;
        this.snapshotFile = snapshotFile;
        this.metricsLogInterval = metricsLogInterval;
        this.snapshotInterval = snapshotInterval;
        this.clock = clock;
        this.lastSummaryMs = clock.getAsLong();
        this.lastSnapshotMs = lastSummaryMs;
    }

    /**
     * Loads the saved stream states, if a snapshot is configured and present.
     */
    public int restoreState() {
        if (snapshotFile == null) {
            return 0;
        }
        try {
            return snapshotFile.restoreInto(stateStore);
        } catch (IOException ex) {
            LOG.error("Could not restore stream states from {}; starting cold", snapshotFile.path(), ex);
            return 0;
        }
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "anomaly-maintenance");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleAtFixedRate(this, PERIOD_SECONDS, PERIOD_SECONDS, TimeUnit.SECONDS);
    }

    @Override
    public void run() {
        // An exception escaping a scheduled run cancels all later runs.
        try {
            int evicted = stateStore.evictIdle(idleEviction) + stateStore.evictOverCapacity();
            metrics.evicted.inc(evicted);
            metrics.updateRates();

            long now = clock.getAsLong();
            if (now - lastSummaryMs >= metricsLogInterval.toMillis()) {
                lastSummaryMs = now;
                logSummary();
            }
            if (snapshotFile != null && now - lastSnapshotMs >= snapshotInterval.toMillis()) {
                lastSnapshotMs = now;
                saveState();
            }
        } catch (RuntimeException ex) {
            LOG.error("Maintenance run failed", ex);
        }
    }

    void logSummary() {
        LOG.info("Pipeline metrics: {} trackedMetrics={}", metrics.summary(), stateStore.size());
        long malformed = metrics.discardCount(DiscardCause.MALFORMED);
        if (malformed > lastMalformed) {
            LOG.warn("Dropped {} malformed records since the last summary ({} total)",
                    malformed - lastMalformed, malformed);
        }
        lastMalformed = malformed;
    }

    /**
     * Writes the state snapshot now; a no-op when snapshots are off.
     */
    public void saveState() {
        if (snapshotFile == null) {
            return;
        }
        try {
            snapshotFile.save(stateStore);
            LOG.debug("Saved {} stream states to {}", stateStore.size(), snapshotFile.path());
        } catch (IOException ex) {
            LOG.error("Saving stream states to {} failed", snapshotFile.path(), ex);
        }
    }

    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException ex) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        scheduler = null;
    }
}
