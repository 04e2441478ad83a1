package org.opensds.anomaly.sink;

import org.opensds.anomaly.model.DetectionEvent;

/**
 * Destination of detection events. Normal return means the event was durably accepted.
 *
 * <p>Submitting the same event again must be harmless: events are redelivered after restarts and retried
 * after failures, and carry a stable {@code eventId} for deduplication.</p>
 */
public interface EventSink extends AutoCloseable {

    void submit(DetectionEvent event) throws SinkException;

    @Override
    default void close() {}
}
