package com.example.tradestore.validation;

import com.example.tradestore.document.DocumentValues;
import com.example.tradestore.model.TradeType;
import com.example.tradestore.model.ValidationResult;
import com.fasterxml.jackson.databind.JsonNode;

public class CommodityOptionValidator implements TypeSpecificValidator {

    @Override
    public TradeType tradeType() {
        return TradeType.COMMODITY_OPTION;
    }

    @Override
    public ValidationResult validate(JsonNode document) {
        if (!DocumentValues.hasContent(document.path("commodityDetails"))) {
            return ValidationResult.failure("Commodity Option missing required field: commodityDetails");
        }
        return ValidationResult.ok();
    }
}
