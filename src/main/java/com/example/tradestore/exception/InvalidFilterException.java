package com.example.tradestore.exception;

public class InvalidFilterException extends TradeStoreException {

    public InvalidFilterException(String message) {
        super(message, "INVALID_FILTER");
    }
}
