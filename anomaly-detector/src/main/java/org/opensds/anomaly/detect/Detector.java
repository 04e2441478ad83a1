package org.opensds.anomaly.detect;

import org.opensds.anomaly.model.MetricRecord;
import org.opensds.anomaly.state.DetectorState;

/**
 * Pluggable anomaly detection algorithm.
 *
 * <p>{@link #evaluate} must be pure with respect to external resources: all history it needs lives in the
 * state it is handed, and it returns the replacement state instead of mutating the input. Evaluating the
 * same record against the same state always yields the same result.</p>
 */
public interface Detector {

    /**
     * Stable name; stored with each stream state so a change of detector resets the history.
     */
    String name();

    DetectorState initialState();

    Evaluation evaluate(MetricRecord record, DetectorState state);
}
