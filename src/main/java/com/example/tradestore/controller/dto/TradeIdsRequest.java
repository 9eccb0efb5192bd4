package com.example.tradestore.controller.dto;

import com.example.tradestore.model.Context;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record TradeIdsRequest(Context context, @NotEmpty List<String> ids) {
}
