package org.opensds.anomaly.normalize;

import com.fasterxml.jackson.databind.JsonNode;

import org.opensds.anomaly.model.InboundMessage;
import org.opensds.anomaly.model.MetricRecord;

/**
 * Converts one producer schema into the canonical record.
 */
public interface SchemaAdapter {

    /**
     * Discriminator value selecting this adapter, matched against the payload's {@code schema} field.
     */
    String schema();

    /**
     * @param message source message, used for the partition/offset of the produced record
     * @param text payload decoded as UTF-8
     * @param root parsed JSON tree, or {@code null} when the payload is not JSON
     */
    MetricRecord adapt(InboundMessage message, String text, JsonNode root) throws NormalizationException;
}
