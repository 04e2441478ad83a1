package org.opensds.anomaly.sink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.opensds.anomaly.model.DetectionEvent;
import org.opensds.anomaly.util.JsonSupport;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Posts each event as JSON to the results API. The event id travels as {@code Idempotency-Key} so the
 * server can collapse redeliveries.
 *
 * <p>2xx and 409 (already stored) count as accepted; 408, 429 and 5xx are retryable; other statuses are not.</p>
 */
public class HttpEventSink implements EventSink {
    private static final Logger LOG = LoggerFactory.getLogger(HttpEventSink.class);
    static final String IDEMPOTENCY_HEADER = "Idempotency-Key";

    private final HttpClient client;
    private final URI endpoint;
    private final Duration requestTimeout;

    public HttpEventSink(URI endpoint, Duration requestTimeout) {
        this(HttpClient.newBuilder().connectTimeout(requestTimeout).build(), endpoint, requestTimeout);
    }

    HttpEventSink(HttpClient client, URI endpoint, Duration requestTimeout) {
        this.client = client;
        this.endpoint = endpoint;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public void submit(DetectionEvent event) throws SinkException {
        HttpRequest request = HttpRequest.newBuilder(endpoint)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header(IDEMPOTENCY_HEADER, event.eventId)
                .POST(HttpRequest.BodyPublishers.ofString(JsonSupport.toJson(event), StandardCharsets.UTF_8))
                .build();
        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException ex) {
            throw new SinkException("POST " + endpoint + " failed: " + ex.getMessage(), true, ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new SinkException("Interrupted posting to " + endpoint, false, ex);
        }
        classify(response.statusCode(), response.body());
        LOG.trace("Sink accepted event {} (status={})", event.eventId, response.statusCode());
    }

    static void classify(int status, String body) throws SinkException {
        if ((status >= 200 && status < 300) || status == 409) {
            return;
        }
        boolean retryable = status == 408 || status == 429 || status >= 500;
        throw new SinkException("Sink responded " + status + ": " + abbreviate(body), retryable);
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= 200 ? body : body.substring(0, 200) + "...";
    }
}
