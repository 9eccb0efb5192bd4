package com.example.tradestore.filter;

import java.util.Arrays;
import java.util.Optional;

/**
 * Operators accepted in a filter condition, keyed by their JSON name.
 */
public enum FilterOperator {
    EQ("eq"),
    NE("ne"),
    GT("gt"),
    GTE("gte"),
    LT("lt"),
    LTE("lte"),
    REGEX("regex"),
    IN("in"),
    NIN("nin"),
    EXISTS("exists");

    private final String key;

    FilterOperator(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Optional<FilterOperator> fromKey(String key) {
        return Arrays.stream(values())
                .filter(op -> op.key.equals(key))
                .findFirst();
    }
}
