package org.opensds.anomaly.detect;

import org.opensds.anomaly.state.DetectorState;

import java.util.Objects;

/**
 * Result of {@link Detector#evaluate}: the verdict plus the state that replaces the stored one.
 */
public final class Evaluation {
    public final DetectionResult result;
    public final DetectorState updatedState;

    public Evaluation(DetectionResult result, DetectorState updatedState) {
        this.result = Objects.requireNonNull(result, "result");
        this.updatedState = Objects.requireNonNull(updatedState, "updatedState");
    }
}
