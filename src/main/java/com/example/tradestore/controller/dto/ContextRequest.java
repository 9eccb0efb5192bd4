package com.example.tradestore.controller.dto;

import com.example.tradestore.model.Context;

public record ContextRequest(Context context) {
}
