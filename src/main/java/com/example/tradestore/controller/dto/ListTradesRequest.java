package com.example.tradestore.controller.dto;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;

public record ListTradesRequest(
        @Schema(description = "Path to operator map, all ANDed",
                example = "{\"data.common.book\": {\"eq\": \"B1\"}, \"data.swapLegs\": {\"exists\": true}}")
        JsonNode filter,
        @Min(1) Integer limit,
        @Min(0) Integer offset,
        @Schema(description = "Dotted path to order by; insertion order when absent") String sortBy,
        Boolean descending
) {
}
