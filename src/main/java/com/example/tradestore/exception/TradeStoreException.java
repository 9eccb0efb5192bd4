package com.example.tradestore.exception;

/**
 * Base type for every rejection raised by the trade store.
 */
public class TradeStoreException extends RuntimeException {

    private final String errorCode;

    public TradeStoreException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
