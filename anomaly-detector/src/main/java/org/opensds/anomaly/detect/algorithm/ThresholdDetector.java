package org.opensds.anomaly.detect.algorithm;

import org.opensds.anomaly.detect.DetectionResult;
import org.opensds.anomaly.detect.Detector;
import org.opensds.anomaly.detect.Evaluation;
import org.opensds.anomaly.model.MetricRecord;
import org.opensds.anomaly.model.Severity;
import org.opensds.anomaly.state.DetectorState;

import java.util.Locale;

/**
 * Flags values more than {@code sigma} standard deviations away from the rolling mean of the previous
 * {@code windowSize} values. Deviations beyond two thirds of {@code sigma} are reported as warnings.
 *
 * <p>The evaluated value joins the window after the verdict, anomalous or not.</p>
 */
public class ThresholdDetector implements Detector {
    public static final String TYPE = "threshold";
    static final double WARNING_RATIO = 2.0 / 3.0;

    private final String name;
    private final int windowSize;
    private final double sigma;
    private final int minSamples;
    private final double minStdDev;

    public ThresholdDetector(String name, int windowSize, double sigma, int minSamples, double minStdDev) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be >= 1");
        }
        if (!(sigma > 0)) {
            throw new IllegalArgumentException("sigma must be > 0");
        }
        this.name = name;
        this.windowSize = windowSize;
        this.sigma = sigma;
        this.minSamples = Math.max(1, minSamples);
        this.minStdDev = Math.max(minStdDev, Double.MIN_NORMAL);
    }

    public static ThresholdDetector withDefaults(String name) {
        return new ThresholdDetector(name, 60, 3.0, 2, 1e-9);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public DetectorState initialState() {
        return ThresholdState.EMPTY;
    }

    @Override
    public Evaluation evaluate(MetricRecord record, DetectorState state) {
        ThresholdState window = state instanceof ThresholdState ? (ThresholdState) state : ThresholdState.EMPTY;
        DetectionResult result = DetectionResult.NO_ANOMALY;

        if (window.size() >= minSamples) {
            double mean = window.mean();
            double std = Math.max(window.stdDev(mean), minStdDev);
            double deviation = Math.abs(record.value - mean) / std;
            Severity severity = null;
            if (deviation > sigma) {
                severity = Severity.CRITICAL;
            } else if (deviation > sigma * WARNING_RATIO) {
                severity = Severity.WARNING;
            }
            if (severity != null) {
                String direction = record.value >= mean ? "above" : "below";
                result = DetectionResult.anomaly(severity, deviation, String.format(Locale.ROOT,
                        "value %.4f is %.2f sigma %s rolling mean %.4f (window=%d, limit=%.2f sigma)",
                        record.value, deviation, direction, mean, window.size(), sigma));
            }
        }
        return new Evaluation(result, window.append(record.value, windowSize));
    }
}
