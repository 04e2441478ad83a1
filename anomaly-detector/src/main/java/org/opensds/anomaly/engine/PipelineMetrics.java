package org.opensds.anomaly.engine;

import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.MeterView;
import org.apache.flink.metrics.ThreadSafeSimpleCounter;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Counters and rates of the detection pipeline. Counters are safe to increment from every lane; the meters
 * are refreshed by the maintenance task via {@link #updateRates()}.
 */
public class PipelineMetrics {
    public final Counter received = new ThreadSafeSimpleCounter();
    public final Counter normalized = new ThreadSafeSimpleCounter();
    public final Counter evaluated = new ThreadSafeSimpleCounter();
    public final Counter anomalies = new ThreadSafeSimpleCounter();
    public final Counter emitted = new ThreadSafeSimpleCounter();
    public final Counter sinkRetries = new ThreadSafeSimpleCounter();
    public final Counter noDetector = new ThreadSafeSimpleCounter();
    public final Counter discardedTotal = new ThreadSafeSimpleCounter();
    public final Counter checkpointsAdvanced = new ThreadSafeSimpleCounter();
    public final Counter evicted = new ThreadSafeSimpleCounter();
    public final Counter channelFailures = new ThreadSafeSimpleCounter();
    public final Counter deadLettered = new ThreadSafeSimpleCounter();

    private final Map<DiscardCause, Counter> discarded = new EnumMap<>(DiscardCause.class);
    private final MeterView inputRate;
    private final MeterView anomalyRate;
    private final MeterView discardRate;

    public PipelineMetrics() {
        this(Duration.ofSeconds(60));
    }

    public PipelineMetrics(Duration rateWindow) {
        for (DiscardCause cause : DiscardCause.values()) {
            discarded.put(cause, new ThreadSafeSimpleCounter());
        }
        int windowSec = (int) Math.max(MeterView.UPDATE_INTERVAL_SECONDS, rateWindow.getSeconds());
        this.inputRate = new MeterView(received, windowSec);
        this.anomalyRate = new MeterView(anomalies, windowSec);
        this.discardRate = new MeterView(discardedTotal, windowSec);
    }

    public void discarded(DiscardCause cause) {
        discarded.get(cause).inc();
        discardedTotal.inc();
    }

    public long discardCount(DiscardCause cause) {
        return discarded.get(cause).getCount();
    }

    /**
     * Advances the rate windows; expected every {@link MeterView#UPDATE_INTERVAL_SECONDS} seconds.
     */
    public void updateRates() {
        inputRate.update();
        anomalyRate.update();
        discardRate.update();
    }

    public double inputRate() {
        return inputRate.getRate();
    }

    public String summary() {
        StringBuilder discards = new StringBuilder();
        for (Map.Entry<DiscardCause, Counter> entry : discarded.entrySet()) {
            if (discards.length() > 0) {
                discards.append(',');
            }
            discards.append(entry.getKey().name().toLowerCase()).append('=').append(entry.getValue().getCount());
        }
        return String.format(
                "received=%d normalized=%d evaluated=%d anomalies=%d emitted=%d noDetector=%d sinkRetries=%d "
                        + "discarded={%s} deadLettered=%d checkpoints=%d evicted=%d channelFailures=%d "
                        + "inputRate=%.2f/s anomalyRate=%.2f/s discardRate=%.2f/s",
                received.getCount(), normalized.getCount(), evaluated.getCount(), anomalies.getCount(),
                emitted.getCount(), noDetector.getCount(), sinkRetries.getCount(), discards,
                deadLettered.getCount(), checkpointsAdvanced.getCount(), evicted.getCount(),
                channelFailures.getCount(), inputRate.getRate(), anomalyRate.getRate(), discardRate.getRate());
    }
}
