package com.example.tradestore.controller.dto;

import com.example.tradestore.model.Context;
import jakarta.validation.constraints.NotBlank;

/**
 * Single-id body for load-by-id and delete-by-id; context is only needed for the delete.
 */
public record TradeIdRequest(Context context, @NotBlank String id) {
}
