package com.example.tradestore.validation;

import com.example.tradestore.document.DocumentValues;
import com.example.tradestore.model.TradeType;
import com.example.tradestore.model.ValidationResult;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

public class IrSwapValidator implements TypeSpecificValidator {

    @Override
    public TradeType tradeType() {
        return TradeType.IR_SWAP;
    }

    @Override
    public ValidationResult validate(JsonNode document) {
        List<String> errors = new ArrayList<>();

        JsonNode swapDetails = document.path("swapDetails");
        if (!DocumentValues.hasContent(swapDetails)) {
            errors.add("IR Swap missing required field: swapDetails");
        } else if (!swapDetails.isObject()) {
            errors.add("IR Swap field swapDetails must be an object");
        }

        JsonNode legs = document.path("swapLegs");
        if (!legs.isArray() || legs.isEmpty()) {
            errors.add("IR Swap must have at least one leg in swapLegs array");
        } else {
            for (int i = 0; i < legs.size(); i++) {
                JsonNode leg = legs.get(i);
                if (!DocumentValues.hasContent(leg.path("direction"))) {
                    errors.add("swapLegs[" + i + "] missing required field: direction");
                }
                if (!DocumentValues.hasContent(leg.path("currency"))) {
                    errors.add("swapLegs[" + i + "] missing required field: currency");
                }
            }
        }
        return ValidationResult.of(errors, List.of());
    }
}
