package org.opensds.anomaly.channel;

/**
 * The ingestion channel could not be read or acknowledged (broker unavailable, I/O failure). Retried by the
 * poll loop; never advances checkpoints.
 */
public class ChannelException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public ChannelException(String message, Throwable cause) {
        super(message, cause);
    }
}
