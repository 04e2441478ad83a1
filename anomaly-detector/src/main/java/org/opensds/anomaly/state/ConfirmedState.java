package org.opensds.anomaly.state;

/**
 * State of one metric as of its last evaluation covered by a persisted checkpoint.
 */
final class ConfirmedState {
    final String metricId;
    final String detectorName;
    final DetectorState value;
    final long evaluations;

    ConfirmedState(String metricId, String detectorName, DetectorState value, long evaluations) {
        this.metricId = metricId;
        this.detectorName = detectorName;
        this.value = value;
        this.evaluations = evaluations;
    }
}
