package com.example.tradestore.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Builder;

import java.time.Instant;

/**
 * A stored trade: the document plus its version and provenance.
 * Instances handed out by the store carry their own copy of {@code data}.
 */
@Builder(toBuilder = true)
public record TradeRecord(
        String id,
        ObjectNode data,
        long version,
        Instant createdAt,
        Instant updatedAt,
        Context lastContext
) {

    public TradeRecord copy() {
        return toBuilder().data(data.deepCopy()).build();
    }
}
