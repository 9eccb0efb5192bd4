package com.example.tradestore.exception;

import com.example.tradestore.model.ValidationResult;

/**
 * The audit context of a mutating call is missing or incomplete.
 */
public class InvalidContextException extends TradeStoreException {

    private final ValidationResult result;

    public InvalidContextException(ValidationResult result) {
        super("Invalid context: " + String.join("; ", result.errors()), "CONTEXT_ERROR");
        this.result = result;
    }

    public ValidationResult getResult() {
        return result;
    }
}
