package com.example.tradestore.controller.dto;

import com.example.tradestore.model.Context;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record PatchTradeRequest(
        Context context,
        @NotBlank String id,
        @NotNull @Schema(description = "Partial document; null removes an object subtree or nulls a leaf") JsonNode patch,
        Long expectedVersion
) {
}
