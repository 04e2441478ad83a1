package org.opensds.anomaly.detect;

/**
 * No binding matched a metric and no default detector is configured.
 */
public class NoDetectorAvailableException extends Exception {
    private static final long serialVersionUID = 1L;

    private final String metricId;

    public NoDetectorAvailableException(String metricId) {
        super("No detector available for metric " + metricId);
        this.metricId = metricId;
    }

    public String metricId() {
        return metricId;
    }
}
