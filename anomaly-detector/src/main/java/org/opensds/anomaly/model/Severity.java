package org.opensds.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Ordered anomaly severity. Declaration order is significant: later constants are more severe.
 */
public enum Severity {
    INFO,
    WARNING,
    CRITICAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean atLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    @JsonCreator
    public static Severity fromWireName(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("severity is null");
        }
        return Severity.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
