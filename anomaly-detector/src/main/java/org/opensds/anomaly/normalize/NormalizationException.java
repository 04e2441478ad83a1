package org.opensds.anomaly.normalize;

/**
 * Raised by schema adapters when a payload cannot be turned into a {@code MetricRecord}.
 *
 * <p>{@link #reason()} is a stable snake_case code suitable for counters and dead-letter envelopes.</p>
 */
public class NormalizationException extends Exception {
    private static final long serialVersionUID = 1L;

    private final String reason;

    public NormalizationException(String reason, String details) {
        super(details);
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }
}
