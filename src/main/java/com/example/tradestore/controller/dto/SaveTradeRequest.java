package com.example.tradestore.controller.dto;

import com.example.tradestore.model.Context;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Body of save-new and save-full-replace. {@code expectedVersion} is ignored by save-new.
 */
public record SaveTradeRequest(
        Context context,
        @NotBlank String id,
        @NotNull @Schema(description = "Complete trade document") JsonNode trade,
        @Schema(description = "Optimistic concurrency check against the current version") Long expectedVersion
) {
}
