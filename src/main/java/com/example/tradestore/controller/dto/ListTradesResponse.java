package com.example.tradestore.controller.dto;

import com.example.tradestore.model.TradeRecord;

import java.util.List;

public record ListTradesResponse(List<TradeRecord> trades, int count, long totalMatching) {
}
