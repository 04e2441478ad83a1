package org.opensds.anomaly.state;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import org.opensds.anomaly.detect.algorithm.EmptyState;
import org.opensds.anomaly.detect.algorithm.GaussianState;
import org.opensds.anomaly.detect.algorithm.ThresholdState;

/**
 * Detector-owned history for one metric stream. Implementations are immutable values: a detector returns a
 * new instance from each evaluation and the engine replaces the stored one.
 *
 * <p>States written to durable snapshots need a registered type name; detectors outside this package
 * register theirs with {@code JsonSupport.MAPPER.registerSubtypes(...)}.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "@type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ThresholdState.class, name = "threshold"),
        @JsonSubTypes.Type(value = GaussianState.class, name = "gaussian"),
        @JsonSubTypes.Type(value = EmptyState.class, name = "empty")
})
public interface DetectorState {
}
