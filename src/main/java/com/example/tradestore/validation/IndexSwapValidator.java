package com.example.tradestore.validation;

import com.example.tradestore.document.DocumentValues;
import com.example.tradestore.model.TradeType;
import com.example.tradestore.model.ValidationResult;
import com.fasterxml.jackson.databind.JsonNode;

public class IndexSwapValidator implements TypeSpecificValidator {

    @Override
    public TradeType tradeType() {
        return TradeType.INDEX_SWAP;
    }

    @Override
    public ValidationResult validate(JsonNode document) {
        if (!DocumentValues.hasContent(document.path("leg"))) {
            return ValidationResult.failure("Index Swap missing required field: leg");
        }
        return ValidationResult.ok();
    }
}
