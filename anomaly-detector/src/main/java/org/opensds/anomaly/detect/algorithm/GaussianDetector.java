package org.opensds.anomaly.detect.algorithm;

import org.opensds.anomaly.detect.DetectionResult;
import org.opensds.anomaly.detect.Detector;
import org.opensds.anomaly.detect.Evaluation;
import org.opensds.anomaly.model.MetricRecord;
import org.opensds.anomaly.model.Severity;
import org.opensds.anomaly.state.DetectorState;

import java.util.Locale;

/**
 * Density-based detector: fits a Gaussian to every value seen so far and flags samples whose log
 * probability density falls below {@code epsilon}. Samples more than {@code criticalMargin} nats below
 * epsilon are critical. The score is the negative log density.
 */
public class GaussianDetector implements Detector {
    public static final String TYPE = "gaussian";
    private static final double LOG_TWO_PI = Math.log(2.0 * Math.PI);

    private final String name;
    private final double epsilon;
    private final double criticalMargin;
    private final int minSamples;
    private final double minVariance;

    public GaussianDetector(String name, double epsilon, double criticalMargin, int minSamples, double minVariance) {
        if (criticalMargin < 0) {
            throw new IllegalArgumentException("criticalMargin must be >= 0");
        }
        this.name = name;
        this.epsilon = epsilon;
        this.criticalMargin = criticalMargin;
        this.minSamples = Math.max(2, minSamples);
        this.minVariance = Math.max(minVariance, Double.MIN_NORMAL);
    }

    public static GaussianDetector withDefaults(String name) {
        return new GaussianDetector(name, -12.0, 8.0, 10, 1e-9);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public DetectorState initialState() {
        return GaussianState.EMPTY;
    }

    @Override
    public Evaluation evaluate(MetricRecord record, DetectorState state) {
        GaussianState fit = state instanceof GaussianState ? (GaussianState) state : GaussianState.EMPTY;
        DetectionResult result = DetectionResult.NO_ANOMALY;

        if (fit.count >= minSamples) {
            double variance = Math.max(fit.variance(), minVariance);
            double delta = record.value - fit.mean;
            double logDensity = -0.5 * (LOG_TWO_PI + Math.log(variance)) - (delta * delta) / (2.0 * variance);
            if (logDensity < epsilon) {
                Severity severity = logDensity < epsilon - criticalMargin ? Severity.CRITICAL : Severity.WARNING;
                result = DetectionResult.anomaly(severity, -logDensity, String.format(Locale.ROOT,
                        "log density %.3f below epsilon %.3f (mean=%.4f, stddev=%.4f, samples=%d)",
                        logDensity, epsilon, fit.mean, Math.sqrt(variance), fit.count));
            }
        }
        return new Evaluation(result, fit.add(record.value));
    }
}
