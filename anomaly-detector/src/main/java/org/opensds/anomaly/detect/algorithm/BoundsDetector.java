package org.opensds.anomaly.detect.algorithm;

import org.opensds.anomaly.detect.DetectionResult;
import org.opensds.anomaly.detect.Detector;
import org.opensds.anomaly.detect.Evaluation;
import org.opensds.anomaly.model.MetricRecord;
import org.opensds.anomaly.model.Severity;
import org.opensds.anomaly.state.DetectorState;

import java.util.Locale;

/**
 * Static limits, e.g. capacity percentages. Stateless; the score is the distance past the violated bound.
 */
public class BoundsDetector implements Detector {
    public static final String TYPE = "bounds";

    private final String name;
    private final double lower;
    private final double upper;
    private final Severity severity;

    public BoundsDetector(String name, double lower, double upper, Severity severity) {
        if (lower > upper) {
            throw new IllegalArgumentException("lower bound " + lower + " exceeds upper bound " + upper);
        }
        this.name = name;
        this.lower = lower;
        this.upper = upper;
        this.severity = severity;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public DetectorState initialState() {
        return EmptyState.INSTANCE;
    }

    @Override
    public Evaluation evaluate(MetricRecord record, DetectorState state) {
        DetectionResult result = DetectionResult.NO_ANOMALY;
        if (record.value > upper) {
            result = DetectionResult.anomaly(severity, record.value - upper,
                    String.format(Locale.ROOT, "value %.4f above upper bound %.4f", record.value, upper));
        } else if (record.value < lower) {
            result = DetectionResult.anomaly(severity, lower - record.value,
                    String.format(Locale.ROOT, "value %.4f below lower bound %.4f", record.value, lower));
        }
        return new Evaluation(result, EmptyState.INSTANCE);
    }
}
