package com.example.tradestore.model;

import lombok.Builder;

import java.time.Instant;

/**
 * Published to the lifecycle topic after every successful mutation.
 */
@Builder
public record TradeLifecycleEvent(
        MutationType operation,
        String tradeId,
        Long version,
        TradeType tradeType,
        Context context,
        Instant timestamp
) {

    public static TradeLifecycleEvent from(OperationLogEntry entry, TradeType tradeType) {
        return TradeLifecycleEvent.builder()
                .operation(entry.operation())
                .tradeId(entry.tradeId())
                .version(entry.version())
                .tradeType(tradeType)
                .context(entry.context())
                .timestamp(entry.timestamp())
                .build();
    }
}
