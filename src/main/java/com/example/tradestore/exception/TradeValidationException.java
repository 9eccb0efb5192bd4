package com.example.tradestore.exception;

import com.example.tradestore.model.ValidationResult;

/**
 * The document failed the validator chain; nothing was written.
 */
public class TradeValidationException extends TradeStoreException {

    private final ValidationResult result;

    public TradeValidationException(ValidationResult result) {
        super("Trade validation failed with " + result.errors().size() + " error(s)", "VALIDATION_ERROR");
        this.result = result;
    }

    public ValidationResult getResult() {
        return result;
    }
}
