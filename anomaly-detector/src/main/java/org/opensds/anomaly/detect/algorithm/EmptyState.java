package org.opensds.anomaly.detect.algorithm;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import org.opensds.anomaly.state.DetectorState;

/**
 * State of detectors that keep no history.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EmptyState implements DetectorState {
    public static final EmptyState INSTANCE = new EmptyState();

    private EmptyState() {}

    @JsonCreator
    public static EmptyState instance() {
        return INSTANCE;
    }

    @Override
    public String toString() {
        return "EmptyState";
    }
}
