package com.example.tradestore.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum TradeType {
    IR_SWAP("ir-swap", "IRSWAP"),
    COMMODITY_OPTION("commodity-option", "COMMODITYOPTION"),
    INDEX_SWAP("index-swap", "INDEXSWAP"),
    UNKNOWN("unknown", "UNKNOWN");

    private final String code;
    private final String idCode;

    TradeType(String code, String idCode) {
        this.code = code;
        this.idCode = idCode;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Short code used inside generated trade ids.
     */
    public String idCode() {
        return idCode;
    }

    public static Optional<TradeType> fromCode(String code) {
        return Arrays.stream(values())
                .filter(type -> type != UNKNOWN)
                .filter(type -> type.code.equalsIgnoreCase(code) || type.name().equalsIgnoreCase(code))
                .findFirst();
    }
}
