package org.opensds.anomaly.detect.algorithm;

import org.junit.jupiter.api.Test;

import org.opensds.anomaly.detect.Evaluation;
import org.opensds.anomaly.model.MetricRecord;
import org.opensds.anomaly.model.Severity;
import org.opensds.anomaly.state.DetectorState;

import static org.junit.jupiter.api.Assertions.*;

class ThresholdDetectorTest {

    private static MetricRecord record(long timestamp, double value) {
        return new MetricRecord("m1", timestamp, value, null, "p-0", timestamp);
    }

    @Test
    void spikeAfterStableSamplesIsCritical() {
        ThresholdDetector detector = ThresholdDetector.withDefaults("threshold");
        DetectorState state = detector.initialState();

        Evaluation first = detector.evaluate(record(1, 10), state);
        Evaluation second = detector.evaluate(record(2, 11), first.updatedState);
        Evaluation third = detector.evaluate(record(3, 95), second.updatedState);

        assertFalse(first.result.anomaly);
        assertFalse(second.result.anomaly);
        assertTrue(third.result.anomaly);
        assertEquals(Severity.CRITICAL, third.result.severity);
        assertTrue(third.result.score > 3.0);
        assertTrue(third.result.explanation.contains("above"));
    }

    @Test
    void moderateDeviationIsWarning() {
        ThresholdDetector detector = new ThresholdDetector("threshold", 10, 3.0, 2, 1e-9);
        DetectorState state = new ThresholdState(new double[] {9.0, 11.0});

        // mean 10, stddev 1: deviation 2.5 lies between 2 and 3 sigma
        Evaluation evaluation = detector.evaluate(record(3, 7.5), state);

        assertTrue(evaluation.result.anomaly);
        assertEquals(Severity.WARNING, evaluation.result.severity);
        assertEquals(2.5, evaluation.result.score, 1e-9);
        assertTrue(evaluation.result.explanation.contains("below"));
    }

    @Test
    void windowIsBoundedAndIncludesAnomalies() {
        ThresholdDetector detector = new ThresholdDetector("threshold", 3, 3.0, 2, 1e-9);
        DetectorState state = detector.initialState();
        for (double v : new double[] {1, 2, 3, 400}) {
            state = detector.evaluate(record(0, v), state).updatedState;
        }

        assertArrayEquals(new double[] {2, 3, 400}, ((ThresholdState) state).window());
    }

    @Test
    void evaluationDoesNotMutateInputState() {
        ThresholdDetector detector = ThresholdDetector.withDefaults("threshold");
        ThresholdState before = new ThresholdState(new double[] {1.0});

        detector.evaluate(record(1, 2.0), before);

        assertEquals(1, before.size());
    }

    @Test
    void invalidParametersAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ThresholdDetector("t", 0, 3.0, 2, 0));
        assertThrows(IllegalArgumentException.class, () -> new ThresholdDetector("t", 10, 0.0, 2, 0));
    }
}
