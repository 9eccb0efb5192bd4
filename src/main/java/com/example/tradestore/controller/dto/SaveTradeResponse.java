package com.example.tradestore.controller.dto;

import com.example.tradestore.model.TradeRecord;
import com.example.tradestore.model.TradeType;
import com.example.tradestore.store.SaveResult;

import java.util.List;

public record SaveTradeResponse(
        boolean success,
        TradeRecord trade,
        TradeType tradeType,
        List<String> warnings
) {

    public static SaveTradeResponse from(SaveResult result) {
        return new SaveTradeResponse(true, result.record(), result.validation().tradeType(),
                result.validation().warnings());
    }
}
