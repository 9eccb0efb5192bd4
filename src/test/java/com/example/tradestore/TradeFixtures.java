package com.example.tradestore;

import com.example.tradestore.config.JacksonConfig;
import com.example.tradestore.model.Context;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Shared documents and contexts for tests.
 */
public final class TradeFixtures {

    public static final ObjectMapper MAPPER = JacksonConfig.configure(new ObjectMapper());

    private TradeFixtures() {
    }

    public static ObjectNode json(String text) {
        try {
            return (ObjectNode) MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Bad test JSON: " + text, e);
        }
    }

    public static Context context() {
        return new Context("jdoe", "trade-ui", "SAVE", "book trade");
    }

    /**
     * Core required fields only, no trade-type section.
     */
    public static ObjectNode coreTrade(String tradeId) {
        return json("""
                {
                  "general": {"tradeId": "%s", "transactionRoles": {"priceMaker": ""}},
                  "common": {"book": "B1", "tradeDate": "2026-01-20", "counterparty": "CP1", "inputDate": "2026-01-20"}
                }
                """.formatted(tradeId));
    }

    public static ObjectNode irSwap(String tradeId) {
        return json("""
                {
                  "general": {"tradeId": "%s", "transactionRoles": {"priceMaker": "PM1"}},
                  "common": {"book": "B1", "tradeDate": "2026-01-20", "counterparty": "CP1", "inputDate": "2026-01-20"},
                  "swapDetails": {"swapType": "Fixed-Float", "notional": 5000000},
                  "swapLegs": [
                    {"direction": "Pay", "currency": "USD", "rate": 0.045},
                    {"direction": "Receive", "currency": "USD", "index": "SOFR"}
                  ]
                }
                """.formatted(tradeId));
    }

    public static ObjectNode commodityOption(String tradeId) {
        return json("""
                {
                  "general": {"tradeId": "%s", "transactionRoles": {"priceMaker": "PM2"}},
                  "common": {"book": "B2", "tradeDate": "2026-02-02", "counterparty": "CP2", "inputDate": "2026-02-03"},
                  "commodityDetails": {"commodity": "WTI", "quantity": 1000},
                  "premium": {"amount": 25000, "currency": "USD"}
                }
                """.formatted(tradeId));
    }
}
