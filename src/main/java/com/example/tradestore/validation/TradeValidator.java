package com.example.tradestore.validation;

import com.example.tradestore.model.ValidationResult;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One independent check over a trade document. Implementations never throw for bad data;
 * they report it in the result.
 */
public interface TradeValidator {

    ValidationResult validate(JsonNode document);

    default String name() {
        return getClass().getSimpleName();
    }
}
