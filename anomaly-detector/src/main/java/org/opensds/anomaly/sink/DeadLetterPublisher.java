package org.opensds.anomaly.sink;

import org.opensds.anomaly.model.DiscardedRecordEnvelope;

/**
 * Receives envelopes of discarded records. Publication is best effort: the discard is already counted and
 * logged, so a failing publisher must not hold up the lane.
 */
public interface DeadLetterPublisher extends AutoCloseable {
    DeadLetterPublisher NONE = envelope -> {};

    void publish(DiscardedRecordEnvelope envelope);

    @Override
    default void close() {}
}
