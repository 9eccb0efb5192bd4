package com.example.tradestore.validation;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Declared shape of a required field.
 */
public enum FieldShape {
    OBJECT,
    ARRAY,
    STRING,
    NUMBER,
    BOOLEAN,
    SCALAR,
    ANY;

    public boolean accepts(JsonNode node) {
        return switch (this) {
            case OBJECT -> node.isObject();
            case ARRAY -> node.isArray();
            case STRING -> node.isTextual();
            case NUMBER -> node.isNumber();
            case BOOLEAN -> node.isBoolean();
            case SCALAR -> node.isValueNode();
            case ANY -> true;
        };
    }

    public String label() {
        return name().toLowerCase();
    }
}
