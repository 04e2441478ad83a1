package org.opensds.anomaly.detect.algorithm;

import org.junit.jupiter.api.Test;

import org.opensds.anomaly.detect.Evaluation;
import org.opensds.anomaly.model.MetricRecord;
import org.opensds.anomaly.model.Severity;
import org.opensds.anomaly.state.DetectorState;

import static org.junit.jupiter.api.Assertions.*;

class GaussianDetectorTest {

    private static MetricRecord record(double value) {
        return new MetricRecord("vol-01/latency_ms", 1L, value, null, "p-0", 0L);
    }

    private static DetectorState warmed(GaussianDetector detector) {
        DetectorState state = detector.initialState();
        for (int i = 0; i < 20; i++) {
            state = detector.evaluate(record(i % 2 == 0 ? 9.0 : 11.0), state).updatedState;
        }
        return state;
    }

    @Test
    void welfordStateTracksMeanAndVariance() {
        GaussianState state = GaussianState.EMPTY.add(9.0).add(11.0).add(10.0);

        assertEquals(3, state.count);
        assertEquals(10.0, state.mean, 1e-12);
        assertEquals(2.0 / 3.0, state.variance(), 1e-12);
    }

    @Test
    void typicalValueIsNotAnomalous() {
        GaussianDetector detector = GaussianDetector.withDefaults("gaussian");

        Evaluation evaluation = detector.evaluate(record(10.5), warmed(detector));

        assertFalse(evaluation.result.anomaly);
    }

    @Test
    void farOutlierIsCritical() {
        GaussianDetector detector = GaussianDetector.withDefaults("gaussian");

        Evaluation evaluation = detector.evaluate(record(60.0), warmed(detector));

        assertTrue(evaluation.result.anomaly);
        assertEquals(Severity.CRITICAL, evaluation.result.severity);
        assertTrue(evaluation.result.score > 20.0);
    }

    @Test
    void moderateOutlierIsWarning() {
        GaussianDetector detector = GaussianDetector.withDefaults("gaussian");

        // variance 1: log density of a 5-sigma sample is about -13.4, inside the critical margin
        Evaluation evaluation = detector.evaluate(record(15.0), warmed(detector));

        assertTrue(evaluation.result.anomaly);
        assertEquals(Severity.WARNING, evaluation.result.severity);
    }

    @Test
    void noVerdictBeforeMinimumSamples() {
        GaussianDetector detector = GaussianDetector.withDefaults("gaussian");
        DetectorState state = GaussianState.EMPTY.add(10.0).add(10.0);

        assertFalse(detector.evaluate(record(1000.0), state).result.anomaly);
    }
}
