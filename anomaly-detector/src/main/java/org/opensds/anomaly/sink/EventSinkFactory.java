package org.opensds.anomaly.sink;

import org.apache.flink.metrics.Counter;

import org.opensds.anomaly.pipeline.PipelineConfig;

import java.net.URI;
import java.time.Duration;

/**
 * Builds the event sink from configuration: HTTP when an endpoint is configured, log-only otherwise, always
 * wrapped in the retrying decorator.
 */
public final class EventSinkFactory {
    static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

    private EventSinkFactory() {}

    public static RetryingEventSink build(PipelineConfig config, Counter retryCounter) {
        EventSink target = config.hasSinkEndpoint()
                ? new HttpEventSink(URI.create(config.sinkEndpoint), REQUEST_TIMEOUT)
                : new LoggingEventSink();
        return new RetryingEventSink(
                target,
                config.maxRetryAttempts,
                config.retryBackoffBase,
                config.retryBackoffMax,
                retryCounter);
    }
}
