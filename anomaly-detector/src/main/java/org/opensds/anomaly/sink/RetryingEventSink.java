package org.opensds.anomaly.sink;

import org.apache.flink.metrics.Counter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.opensds.anomaly.model.DetectionEvent;

import java.time.Duration;

/**
 * Retries transient sink failures with bounded exponential backoff: attempt {@code n} (1-based) failing is
 * followed by a pause of {@code base * 2^(n-1)}, capped at {@code maxBackoff}. After {@code maxAttempts}
 * attempts, or on a non-retryable failure, the last {@link SinkException} is rethrown.
 */
public class RetryingEventSink implements EventSink {
    private static final Logger LOG = LoggerFactory.getLogger(RetryingEventSink.class);

    /**
     * Pause between attempts; replaced in tests.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final EventSink delegate;
    private final int maxAttempts;
    private final Duration baseBackoff;
    private final Duration maxBackoff;
    private final Sleeper sleeper;
    private final Counter retryCounter;

    public RetryingEventSink(
            EventSink delegate,
            int maxAttempts,
            Duration baseBackoff,
            Duration maxBackoff,
            Counter retryCounter) {
        this(delegate, maxAttempts, baseBackoff, maxBackoff, retryCounter, d -> Thread.sleep(d.toMillis()));
    }

    public RetryingEventSink(
            EventSink delegate,
            int maxAttempts,
            Duration baseBackoff,
            Duration maxBackoff,
            Counter retryCounter,
            Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.delegate = delegate;
        this.maxAttempts = maxAttempts;
        this.baseBackoff = baseBackoff;
        this.maxBackoff = maxBackoff;
        this.retryCounter = retryCounter;
        this.sleeper = sleeper;
    }

    @Override
    public void submit(DetectionEvent event) throws SinkException {
        SinkException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                delegate.submit(event);
                if (attempt > 1) {
                    LOG.info("Sink accepted event {} for metric {} on attempt {}", event.eventId, event.metricId, attempt);
                }
                return;
            } catch (SinkException ex) {
                last = ex;
                if (!ex.retryable()) {
                    LOG.warn("Sink rejected event {} for metric {} (not retryable): {}",
                            event.eventId, event.metricId, ex.getMessage());
                    throw ex;
                }
                if (attempt == maxAttempts) {
                    break;
                }
                Duration pause = backoff(attempt);
                LOG.warn("Sink attempt {}/{} failed for metric {}; retrying in {} ms: {}",
                        attempt, maxAttempts, event.metricId, pause.toMillis(), ex.getMessage());
                retryCounter.inc();
                try {
                    sleeper.sleep(pause);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new SinkException("Interrupted while backing off", false, ie);
                }
            }
        }
        throw new SinkException("Gave up after " + maxAttempts + " attempts: " + last.getMessage(), false, last);
    }

    Duration backoff(int attempt) {
        long base = baseBackoff.toMillis();
        long capped = maxBackoff.toMillis();
        int shift = Math.min(attempt - 1, 30);
        long millis = base << shift;
        if (millis < 0 || millis > capped) {
            millis = capped;
        }
        return Duration.ofMillis(millis);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    @Override
    public void close() {
        delegate.close();
    }
}
