package org.opensds.anomaly.detect;

import org.opensds.anomaly.model.Severity;

import java.util.Objects;

/**
 * Verdict of one evaluation: either no anomaly, or an anomaly with severity, score and explanation.
 */
public final class DetectionResult {
    public static final DetectionResult NO_ANOMALY = new DetectionResult(false, null, 0.0, "");

    public final boolean anomaly;
    public final Severity severity;
    public final double score;
    public final String explanation;

    private DetectionResult(boolean anomaly, Severity severity, double score, String explanation) {
        this.anomaly = anomaly;
        this.severity = severity;
        this.score = score;
        this.explanation = explanation;
    }

    public static DetectionResult anomaly(Severity severity, double score, String explanation) {
        return new DetectionResult(true, Objects.requireNonNull(severity, "severity"), score,
                explanation == null ? "" : explanation);
    }

    @Override
    public String toString() {
        return anomaly ? "Anomaly{" + severity.wireName() + ", score=" + score + ", " + explanation + "}" : "NoAnomaly";
    }
}
