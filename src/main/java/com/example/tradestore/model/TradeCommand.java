package com.example.tradestore.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;

/**
 * Inbound mutation request consumed from the commands topic.
 * {@code document} holds the full trade or the patch, depending on the operation.
 */
@Builder
public record TradeCommand(
        MutationType operation,
        String id,
        Context context,
        JsonNode document,
        Long expectedVersion
) {
}
