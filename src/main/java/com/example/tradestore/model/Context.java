package com.example.tradestore.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;

/**
 * Audit context recorded with every mutation.
 * Not part of the trade document; kept alongside the record as provenance.
 */
@Builder
@Schema(description = "Audit context required on every mutating call")
public record Context(
        @Schema(example = "jdoe") String user,
        @Schema(example = "trade-ui") String agent,
        @Schema(example = "SAVE") String action,
        @Schema(example = "Book new IR swap") String intent
) {

    /**
     * Copy with every field trimmed; nulls stay null.
     */
    public Context normalized() {
        return new Context(trim(user), trim(agent), trim(action), trim(intent));
    }

    private static String trim(String value) {
        return value == null ? null : value.trim();
    }
}
