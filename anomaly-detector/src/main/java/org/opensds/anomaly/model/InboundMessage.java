package org.opensds.anomaly.model;

import java.util.HashMap;
import java.util.Map;

/**
 * Raw message pulled from the ingestion channel: opaque payload plus its position in the source partition.
 */
public class InboundMessage {
    public String topic;
    public int partition;
    public long offset;
    public long recordTimestamp;
    public byte[] value;
    public String key;
    public Map<String, String> headers = new HashMap<>();

    public InboundMessage() {}

    public InboundMessage(String topic, int partition, long offset, byte[] value) {
        this.topic = topic;
        this.partition = partition;
        this.offset = offset;
        this.value = value;
    }

    /**
     * Checkpoint key for the partition this message came from.
     */
    public String partitionId() {
        return partitionId(topic, partition);
    }

    public static String partitionId(String topic, int partition) {
        return topic + "-" + partition;
    }
}
