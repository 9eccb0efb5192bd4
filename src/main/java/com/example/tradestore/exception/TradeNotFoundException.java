package com.example.tradestore.exception;

public class TradeNotFoundException extends TradeStoreException {

    private final String tradeId;

    public TradeNotFoundException(String tradeId) {
        super("Trade not found: " + tradeId, "NOT_FOUND");
        this.tradeId = tradeId;
    }

    public String getTradeId() {
        return tradeId;
    }
}
