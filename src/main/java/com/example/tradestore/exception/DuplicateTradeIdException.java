package com.example.tradestore.exception;

public class DuplicateTradeIdException extends TradeStoreException {

    private final String tradeId;

    public DuplicateTradeIdException(String tradeId) {
        super("Trade already exists: " + tradeId, "DUPLICATE_ID");
        this.tradeId = tradeId;
    }

    public String getTradeId() {
        return tradeId;
    }
}
