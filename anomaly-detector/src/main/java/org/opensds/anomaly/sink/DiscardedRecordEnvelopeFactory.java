package org.opensds.anomaly.sink;

import org.opensds.anomaly.model.DetectionEvent;
import org.opensds.anomaly.model.DiscardedRecordEnvelope;
import org.opensds.anomaly.model.InboundMessage;
import org.opensds.anomaly.model.MetricRecord;
import org.opensds.anomaly.normalize.NormalizationResult;

import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.ByteBuffer;
import java.util.Base64;

/**
 * Builds dead-letter envelopes for the different discard causes.
 */
public final class DiscardedRecordEnvelopeFactory {
    static final String SCHEMA_VERSION = "1";

    private DiscardedRecordEnvelopeFactory() {}

    public static DiscardedRecordEnvelope forMalformed(InboundMessage message, NormalizationResult result) {
        DiscardedRecordEnvelope envelope = base(message.partitionId(), message.offset, message.recordTimestamp);
        envelope.failure = failure("NORMALIZATION", "MALFORMED", result.reason, result.details, 1);
        envelope.payload = payload(message.value);
        return envelope;
    }

    public static DiscardedRecordEnvelope forSinkExhausted(MetricRecord record, DetectionEvent event, Exception ex, int attempts) {
        DiscardedRecordEnvelope envelope = forRecord(record);
        envelope.failure = failure("EMIT", "SINK_EXHAUSTED", "sink_failure", describe(ex), attempts);
        envelope.detection = event;
        return envelope;
    }

    public static DiscardedRecordEnvelope forDetectorFailure(MetricRecord record, String detector, Exception ex) {
        DiscardedRecordEnvelope envelope = forRecord(record);
        envelope.failure = failure("EVALUATE", "DETECTOR_FAILURE", "detector_exception",
                "detector " + detector + ": " + describe(ex), 1);
        return envelope;
    }

    public static DiscardedRecordEnvelope forInternalError(MetricRecord record, Throwable ex) {
        DiscardedRecordEnvelope envelope = forRecord(record);
        envelope.failure = failure("PIPELINE", "INTERNAL_ERROR", "unexpected_exception", describe(ex), 1);
        return envelope;
    }

    private static DiscardedRecordEnvelope forRecord(MetricRecord record) {
        DiscardedRecordEnvelope envelope = base(record.partitionId, record.sourceOffset, record.timestamp);
        envelope.metricId = record.metricId;
        envelope.eventTimestamp = record.timestamp;
        DiscardedRecordEnvelope.Payload payload = new DiscardedRecordEnvelope.Payload();
        payload.encoding = "metric";
        payload.body = record.metricId + "=" + record.value + "@" + record.timestamp;
        envelope.payload = payload;
        return envelope;
    }

    private static DiscardedRecordEnvelope base(String partitionId, long offset, long recordTimestamp) {
        DiscardedRecordEnvelope envelope = new DiscardedRecordEnvelope();
        envelope.schemaVersion = SCHEMA_VERSION;
        DiscardedRecordEnvelope.SourcePointer source = new DiscardedRecordEnvelope.SourcePointer();
        source.partitionId = partitionId;
        source.offset = offset;
        source.recordTimestamp = recordTimestamp;
        envelope.source = source;
        envelope.discardedAt = System.currentTimeMillis();
        return envelope;
    }

    private static DiscardedRecordEnvelope.FailureDetails failure(
            String stage, String cause, String reason, String details, int attempts) {
        DiscardedRecordEnvelope.FailureDetails failure = new DiscardedRecordEnvelope.FailureDetails();
        failure.stage = stage;
        failure.cause = cause;
        failure.reason = reason;
        failure.details = details;
        failure.attempts = attempts;
        return failure;
    }

    private static DiscardedRecordEnvelope.Payload payload(byte[] raw) {
        DiscardedRecordEnvelope.Payload payload = new DiscardedRecordEnvelope.Payload();
        if (raw == null) {
            payload.encoding = "none";
            return payload;
        }
        try {
            payload.body = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(raw))
                    .toString();
            payload.encoding = "utf8";
        } catch (CharacterCodingException ex) {
            payload.body = Base64.getEncoder().encodeToString(raw);
            payload.encoding = "base64";
        }
        return payload;
    }

    private static String describe(Throwable ex) {
        if (ex == null) {
            return "unknown error";
        }
        return ex.getMessage() == null || ex.getMessage().isBlank()
                ? ex.getClass().getName()
                : ex.getClass().getName() + ": " + ex.getMessage();
    }
}
