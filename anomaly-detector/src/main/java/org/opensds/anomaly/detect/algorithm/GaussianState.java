package org.opensds.anomaly.detect.algorithm;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import org.opensds.anomaly.state.DetectorState;

/**
 * Running mean and sum of squared deviations (Welford), enough to fit a univariate Gaussian.
 */
public final class GaussianState implements DetectorState {
    public static final GaussianState EMPTY = new GaussianState(0L, 0.0, 0.0);

    @JsonProperty("count")
    public final long count;
    @JsonProperty("mean")
    public final double mean;
    @JsonProperty("m2")
    public final double m2;

    @JsonCreator
    public GaussianState(
            @JsonProperty("count") long count,
            @JsonProperty("mean") double mean,
            @JsonProperty("m2") double m2) {
        this.count = count;
        this.mean = mean;
        this.m2 = m2;
    }

    public double variance() {
        return count == 0 ? 0.0 : m2 / count;
    }

    GaussianState add(double value) {
        long n = count + 1;
        double delta = value - mean;
        double nextMean = mean + delta / n;
        return new GaussianState(n, nextMean, m2 + delta * (value - nextMean));
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof GaussianState)) {
            return false;
        }
        GaussianState that = (GaussianState) o;
        return count == that.count && Double.compare(mean, that.mean) == 0 && Double.compare(m2, that.m2) == 0;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(count) * 31 + Double.hashCode(mean) * 17 + Double.hashCode(m2);
    }
}
