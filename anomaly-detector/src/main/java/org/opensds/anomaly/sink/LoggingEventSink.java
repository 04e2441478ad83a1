package org.opensds.anomaly.sink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.opensds.anomaly.model.DetectionEvent;
import org.opensds.anomaly.model.Severity;
import org.opensds.anomaly.util.JsonSupport;

/**
 * Writes detection events to the log. Used when no sink endpoint is configured.
 */
public class LoggingEventSink implements EventSink {
    private static final Logger LOG = LoggerFactory.getLogger(LoggingEventSink.class);

    @Override
    public void submit(DetectionEvent event) {
        if (event.severity.atLeast(Severity.WARNING)) {
            LOG.warn("Anomaly detected: {}", JsonSupport.toJson(event));
        } else {
            LOG.info("Anomaly detected: {}", JsonSupport.toJson(event));
        }
    }
}
