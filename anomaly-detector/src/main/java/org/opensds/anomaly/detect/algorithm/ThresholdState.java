package org.opensds.anomaly.detect.algorithm;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import org.opensds.anomaly.state.DetectorState;

import java.util.Arrays;

/**
 * Rolling window of the most recent values, oldest first.
 */
public final class ThresholdState implements DetectorState {
    public static final ThresholdState EMPTY = new ThresholdState(new double[0]);

    private final double[] window;

    @JsonCreator
    public ThresholdState(@JsonProperty("window") double[] window) {
        this.window = window == null ? new double[0] : window.clone();
    }

    @JsonProperty("window")
    public double[] window() {
        return window.clone();
    }

    public int size() {
        return window.length;
    }

    public double mean() {
        double sum = 0.0;
        for (double v : window) {
            sum += v;
        }
        return window.length == 0 ? 0.0 : sum / window.length;
    }

    /**
     * Population standard deviation of the window.
     */
    public double stdDev(double mean) {
        if (window.length == 0) {
            return 0.0;
        }
        double sq = 0.0;
        for (double v : window) {
            double d = v - mean;
            sq += d * d;
        }
        return Math.sqrt(sq / window.length);
    }

    ThresholdState append(double value, int capacity) {
        int keep = Math.min(window.length, capacity - 1);
        double[] next = new double[keep + 1];
        System.arraycopy(window, window.length - keep, next, 0, keep);
        next[keep] = value;
        return new ThresholdState(next);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ThresholdState && Arrays.equals(window, ((ThresholdState) o).window);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(window);
    }

    @Override
    public String toString() {
        return "ThresholdState" + Arrays.toString(window);
    }
}
