package com.example.tradestore.validation;

import com.example.tradestore.document.DocumentValues;
import com.example.tradestore.model.TradeType;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

/**
 * Classifies a trade by its discriminating top-level sections. First match wins:
 * swap details or legs, then commodity details or premium, then an index leg.
 */
@Component
public class TradeTypeDetector {

    public TradeType detect(JsonNode document) {
        if (document == null || !document.isObject()) {
            return TradeType.UNKNOWN;
        }
        if (present(document, "swapDetails") || present(document, "swapLegs")) {
            return TradeType.IR_SWAP;
        }
        if (present(document, "commodityDetails") || present(document, "premium")) {
            return TradeType.COMMODITY_OPTION;
        }
        if (present(document, "leg")) {
            return TradeType.INDEX_SWAP;
        }
        return TradeType.UNKNOWN;
    }

    private boolean present(JsonNode document, String field) {
        return DocumentValues.hasContent(document.get(field));
    }
}
