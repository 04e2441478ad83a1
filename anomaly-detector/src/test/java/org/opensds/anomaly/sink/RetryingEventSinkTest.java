package org.opensds.anomaly.sink;

import org.apache.flink.metrics.SimpleCounter;
import org.junit.jupiter.api.Test;

import org.opensds.anomaly.model.DetectionEvent;
import org.opensds.anomaly.model.Severity;
import org.opensds.anomaly.testing.RecordingEventSink;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RetryingEventSinkTest {

    private final List<Duration> pauses = new ArrayList<>();
    private final SimpleCounter retries = new SimpleCounter();

    private static DetectionEvent event() {
        return new DetectionEvent("m1", 3000L, 95.0, Severity.CRITICAL, 169.0, "spike", "threshold");
    }

    private RetryingEventSink retrying(EventSink delegate, int maxAttempts) {
        return new RetryingEventSink(delegate, maxAttempts, Duration.ofMillis(200), Duration.ofMillis(500),
                retries, pauses::add);
    }

    @Test
    void twoFailuresThenSuccessDeliversOnce() throws Exception {
        RecordingEventSink target = new RecordingEventSink(2, true);

        retrying(target, 5).submit(event());

        assertEquals(1, target.events().size());
        assertEquals(3, target.attempts());
        assertEquals(2, retries.getCount());
        assertEquals(List.of(Duration.ofMillis(200), Duration.ofMillis(400)), pauses);
    }

    @Test
    void exhaustedAttemptsRaiseNonRetryableFailure() {
        RecordingEventSink target = new RecordingEventSink(10, true);

        SinkException ex = assertThrows(SinkException.class, () -> retrying(target, 3).submit(event()));

        assertFalse(ex.retryable());
        assertTrue(ex.getMessage().startsWith("Gave up after 3 attempts"));
        assertEquals(3, target.attempts());
        assertEquals(2, pauses.size());
        assertTrue(target.events().isEmpty());
    }

    @Test
    void nonRetryableFailureIsNotRetried() {
        RecordingEventSink target = new RecordingEventSink(1, false);

        assertThrows(SinkException.class, () -> retrying(target, 5).submit(event()));

        assertEquals(1, target.attempts());
        assertTrue(pauses.isEmpty());
        assertEquals(0, retries.getCount());
    }

    @Test
    void backoffDoublesUpToCap() {
        RetryingEventSink sink = retrying(new RecordingEventSink(), 10);

        assertEquals(Duration.ofMillis(200), sink.backoff(1));
        assertEquals(Duration.ofMillis(400), sink.backoff(2));
        assertEquals(Duration.ofMillis(500), sink.backoff(3));
        assertEquals(Duration.ofMillis(500), sink.backoff(40));
    }

    @Test
    void closeReachesDelegate() {
        RecordingEventSink target = new RecordingEventSink();

        retrying(target, 2).close();

        assertTrue(target.closed());
    }

    @Test
    void zeroAttemptsIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> retrying(new RecordingEventSink(), 0));
    }
}
