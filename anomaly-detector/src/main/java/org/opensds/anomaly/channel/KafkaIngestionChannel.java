package org.opensds.anomaly.channel;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.opensds.anomaly.model.InboundMessage;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Kafka-backed ingestion channel with manual offset management.
 *
 * <p>Auto-commit is off. Offsets are committed only through {@link #ackSafeToResumeFrom}, and on every
 * partition assignment the consumer seeks to the local checkpoint when one exists, so the broker-side
 * committed offset never runs ahead of durable progress.</p>
 */
public class KafkaIngestionChannel implements IngestionChannel {
    private static final Logger LOG = LoggerFactory.getLogger(KafkaIngestionChannel.class);

    private final Consumer<byte[], byte[]> consumer;
    private final String topic;
    private final Function<String, Long> resumePositions;
    private final Map<String, TopicPartition> partitions = new ConcurrentHashMap<>();
    private boolean subscribed;

    /**
     * @param resumePositions partition id to first offset to consume, or {@code null} to use the group's
     *                        committed offset
     */
    public KafkaIngestionChannel(Consumer<byte[], byte[]> consumer, String topic, Function<String, Long> resumePositions) {
        this.consumer = consumer;
        this.topic = topic;
        this.resumePositions = resumePositions;
    }

    public static KafkaIngestionChannel create(
            String brokerEndpoints, String topic, String consumerGroup, Function<String, Long> resumePositions) {
        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, brokerEndpoints);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, consumerGroup);
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
        return new KafkaIngestionChannel(new KafkaConsumer<>(props), topic, resumePositions);
    }

    @Override
    public List<InboundMessage> poll(Duration timeout) {
        ConsumerRecords<byte[], byte[]> records;
        try {
            if (!subscribed) {
                consumer.subscribe(Collections.singletonList(topic), rebalanceListener());
                subscribed = true;
                LOG.info("Subscribed to topic {}", topic);
            }
            records = consumer.poll(timeout);
        } catch (WakeupException ex) {
            return Collections.emptyList();
        } catch (KafkaException ex) {
            throw new ChannelException("Polling topic " + topic + " failed: " + ex.getMessage(), ex);
        }
        if (records.isEmpty()) {
            return Collections.emptyList();
        }
        List<InboundMessage> messages = new ArrayList<>(records.count());
        for (ConsumerRecord<byte[], byte[]> record : records) {
            messages.add(toMessage(record));
        }
        return messages;
    }

    private InboundMessage toMessage(ConsumerRecord<byte[], byte[]> record) {
        InboundMessage message = new InboundMessage(record.topic(), record.partition(), record.offset(), record.value());
        message.recordTimestamp = record.timestamp();
        message.key = record.key() == null ? null : new String(record.key(), StandardCharsets.UTF_8);
        for (Header header : record.headers()) {
            if (header.value() != null) {
                message.headers.put(header.key(), new String(header.value(), StandardCharsets.UTF_8));
            }
        }
        partitions.putIfAbsent(message.partitionId(), new TopicPartition(record.topic(), record.partition()));
        return message;
    }

    @Override
    public void ackSafeToResumeFrom(String partitionId, long offset) {
        TopicPartition tp = partitions.get(partitionId);
        if (tp == null) {
            LOG.debug("Skipping commit for unknown partition {}", partitionId);
            return;
        }
        try {
            consumer.commitSync(Collections.singletonMap(tp, new OffsetAndMetadata(offset)));
        } catch (WakeupException ex) {
            // Shutdown interrupted the commit; the local checkpoint is already durable and wins on restart.
            LOG.debug("Commit for {} interrupted by wakeup", partitionId);
        } catch (KafkaException ex) {
            throw new ChannelException("Committing " + partitionId + "@" + offset + " failed: " + ex.getMessage(), ex);
        }
    }

    @Override
    public void pause(String partitionId) {
        TopicPartition tp = partitions.get(partitionId);
        if (tp != null && consumer.assignment().contains(tp)) {
            consumer.pause(Collections.singleton(tp));
            LOG.warn("Paused partition {}", partitionId);
        }
    }

    @Override
    public void wakeup() {
        consumer.wakeup();
    }

    @Override
    public void close() {
        try {
            consumer.close(Duration.ofSeconds(5));
        } catch (KafkaException ex) {
            LOG.warn("Closing Kafka consumer failed: {}", ex.getMessage());
        }
    }

    ConsumerRebalanceListener rebalanceListener() {
        return new ResumeFromCheckpoint();
    }

    /**
     * Seeks newly assigned partitions to the local checkpoint. Revoked partitions need no action: their
     * in-flight records are redelivered to the next owner from the last committed offset.
     */
    private final class ResumeFromCheckpoint implements ConsumerRebalanceListener {
        @Override
        public void onPartitionsAssigned(Collection<TopicPartition> assigned) {
            for (TopicPartition tp : assigned) {
                String partitionId = InboundMessage.partitionId(tp.topic(), tp.partition());
                partitions.put(partitionId, tp);
                Long position = resumePositions.apply(partitionId);
                if (position != null) {
                    consumer.seek(tp, position);
                    LOG.info("Assigned {}; resuming from checkpoint offset {}", partitionId, position);
                } else {
                    LOG.info("Assigned {}; no checkpoint, using group position", partitionId);
                }
            }
        }

        @Override
        public void onPartitionsRevoked(Collection<TopicPartition> revoked) {
            if (!revoked.isEmpty()) {
                LOG.info("Partitions revoked: {}", revoked);
            }
        }
    }
}
