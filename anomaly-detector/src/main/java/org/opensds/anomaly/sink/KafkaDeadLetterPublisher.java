package org.opensds.anomaly.sink;

import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.opensds.anomaly.model.DiscardedRecordEnvelope;
import org.opensds.anomaly.util.JsonSupport;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Publishes discard envelopes as JSON to a dead-letter topic, keyed by metric id when known.
 */
public class KafkaDeadLetterPublisher implements DeadLetterPublisher {
    private static final Logger LOG = LoggerFactory.getLogger(KafkaDeadLetterPublisher.class);

    private final Producer<byte[], byte[]> producer;
    private final String topic;

    public KafkaDeadLetterPublisher(Producer<byte[], byte[]> producer, String topic) {
        this.producer = producer;
        this.topic = topic;
    }

    @Override
    public void publish(DiscardedRecordEnvelope envelope) {
        byte[] key = envelope.metricId == null ? null : envelope.metricId.getBytes(StandardCharsets.UTF_8);
        byte[] value = JsonSupport.toJson(envelope).getBytes(StandardCharsets.UTF_8);
        producer.send(new ProducerRecord<>(topic, key, value), (metadata, ex) -> {
            if (ex != null) {
                LOG.warn("Dead-letter publish to {} failed (cause={}, partition={}, offset={}): {}",
                        topic,
                        envelope.failure == null ? null : envelope.failure.cause,
                        envelope.source == null ? null : envelope.source.partitionId,
                        envelope.source == null ? null : envelope.source.offset,
                        ex.getMessage());
            }
        });
    }

    @Override
    public void close() {
        producer.flush();
        producer.close(Duration.ofSeconds(5));
    }
}
