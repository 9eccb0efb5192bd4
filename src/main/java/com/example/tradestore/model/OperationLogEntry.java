package com.example.tradestore.model;

import lombok.Builder;

import java.time.Instant;

/**
 * One successful mutation, as kept in the store's operation log.
 * {@code tradeId} and {@code version} are null for a purge.
 */
@Builder
public record OperationLogEntry(
        Instant timestamp,
        MutationType operation,
        String tradeId,
        Long version,
        Context context
) {
}
