package org.opensds.anomaly.testing;

import org.opensds.anomaly.model.DetectionEvent;
import org.opensds.anomaly.sink.EventSink;
import org.opensds.anomaly.sink.SinkException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Collects submitted events; the first {@code failures} submissions fail with a retryable error.
 */
public class RecordingEventSink implements EventSink {
    private final List<DetectionEvent> events = new ArrayList<>();
    private final AtomicInteger remainingFailures;
    private final AtomicInteger attempts = new AtomicInteger();
    private final boolean retryable;
    private volatile boolean closed;

    public RecordingEventSink() {
        this(0, true);
    }

    public RecordingEventSink(int failures, boolean retryable) {
        this.remainingFailures = new AtomicInteger(failures);
        this.retryable = retryable;
    }

    @Override
    public void submit(DetectionEvent event) throws SinkException {
        attempts.incrementAndGet();
        if (remainingFailures.getAndDecrement() > 0) {
            throw new SinkException("sink unavailable", retryable);
        }
        synchronized (events) {
            events.add(event);
        }
    }

    public List<DetectionEvent> events() {
        synchronized (events) {
            return new ArrayList<>(events);
        }
    }

    public int attempts() {
        return attempts.get();
    }

    public boolean closed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
    }
}
