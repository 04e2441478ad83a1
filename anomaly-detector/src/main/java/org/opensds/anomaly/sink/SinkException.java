package org.opensds.anomaly.sink;

/**
 * The sink did not confirm acceptance of an event.
 */
public class SinkException extends Exception {
    private static final long serialVersionUID = 1L;

    private final boolean retryable;

    public SinkException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public SinkException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }
}
