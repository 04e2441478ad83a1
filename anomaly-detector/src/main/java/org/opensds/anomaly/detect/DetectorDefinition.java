package org.opensds.anomaly.detect;

import org.opensds.anomaly.detect.algorithm.BoundsDetector;
import org.opensds.anomaly.detect.algorithm.GaussianDetector;
import org.opensds.anomaly.detect.algorithm.ThresholdDetector;
import org.opensds.anomaly.model.Severity;

import java.util.Collections;
import java.util.Map;

/**
 * Named detector configuration from the catalog: an algorithm type plus its parameters.
 */
public final class DetectorDefinition {
    public final String name;
    public final String type;
    public final Map<String, String> params;

    public DetectorDefinition(String name, String type, Map<String, String> params) {
        this.name = name;
        this.type = type;
        this.params = params == null ? Collections.emptyMap() : Map.copyOf(params);
    }

    /**
     * Builds the factory for this definition, failing fast on unknown types or bad parameters.
     */
    public DetectorFactory toFactory() {
        DetectorFactory factory;
        switch (type) {
            case ThresholdDetector.TYPE:
                factory = () -> new ThresholdDetector(
                        name,
                        intParam("window_size", 60),
                        doubleParam("sigma", 3.0),
                        intParam("min_samples", 2),
                        doubleParam("min_stddev", 1e-9));
                break;
            case GaussianDetector.TYPE:
                factory = () -> new GaussianDetector(
                        name,
                        doubleParam("epsilon", -12.0),
                        doubleParam("critical_margin", 8.0),
                        intParam("min_samples", 10),
                        doubleParam("min_variance", 1e-9));
                break;
            case BoundsDetector.TYPE:
                factory = () -> new BoundsDetector(
                        name,
                        doubleParam("lower", Double.NEGATIVE_INFINITY),
                        doubleParam("upper", Double.POSITIVE_INFINITY),
                        Severity.fromWireName(params.getOrDefault("severity", "warning")));
                break;
            default:
                throw new IllegalArgumentException("Unknown detector type '" + type + "' for detector " + name);
        }
        // Surface parameter errors at load time instead of on the first record.
        factory.create();
        return factory;
    }

    private int intParam(String key, int defaultValue) {
        String raw = params.get(key);
        if (raw == null || raw.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return (int) Double.parseDouble(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Detector " + name + ": parameter " + key + " is not numeric: " + raw, ex);
        }
    }

    private double doubleParam(String key, double defaultValue) {
        String raw = params.get(key);
        if (raw == null || raw.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Detector " + name + ": parameter " + key + " is not numeric: " + raw, ex);
        }
    }
}
