package com.example.tradestore.filter;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Comparator;
import java.util.Iterator;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Type-aware equality and ordering for JSON values.
 * Numbers compare by value regardless of representation; nothing compares across types.
 */
public final class JsonValues {

    private JsonValues() {
    }

    public static boolean isAbsent(JsonNode node) {
        return node == null || node.isMissingNode() || node.isNull();
    }

    /**
     * Structural equality; numbers nested in arrays and objects also compare by value.
     */
    public static boolean valueEquals(JsonNode left, JsonNode right) {
        if (left.isNumber() && right.isNumber()) {
            return left.decimalValue().compareTo(right.decimalValue()) == 0;
        }
        if (left.isArray() && right.isArray()) {
            if (left.size() != right.size()) {
                return false;
            }
            for (int i = 0; i < left.size(); i++) {
                if (!valueEquals(left.get(i), right.get(i))) {
                    return false;
                }
            }
            return true;
        }
        if (left.isObject() && right.isObject()) {
            if (left.size() != right.size()) {
                return false;
            }
            Iterator<Map.Entry<String, JsonNode>> fields = left.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode other = right.get(field.getKey());
                if (other == null || !valueEquals(field.getValue(), other)) {
                    return false;
                }
            }
            return true;
        }
        return left.equals(right);
    }

    /**
     * Ordering of two scalars, empty when they have no common ordering.
     */
    public static OptionalInt compare(JsonNode left, JsonNode right) {
        if (left.isNumber() && right.isNumber()) {
            return OptionalInt.of(left.decimalValue().compareTo(right.decimalValue()));
        }
        if (left.isTextual() && right.isTextual()) {
            return OptionalInt.of(left.textValue().compareTo(right.textValue()));
        }
        return OptionalInt.empty();
    }

    /**
     * Total order for sorting present values: numbers, then text, then booleans, then anything else
     * by its JSON text.
     */
    public static Comparator<JsonNode> sortOrder() {
        return Comparator.comparingInt(JsonValues::typeRank).thenComparing(JsonValues::compareSameRank);
    }

    private static int typeRank(JsonNode node) {
        if (node.isNumber()) {
            return 0;
        }
        if (node.isTextual()) {
            return 1;
        }
        if (node.isBoolean()) {
            return 2;
        }
        return 3;
    }

    private static int compareSameRank(JsonNode left, JsonNode right) {
        return switch (typeRank(left)) {
            case 0 -> left.decimalValue().compareTo(right.decimalValue());
            case 1 -> left.textValue().compareTo(right.textValue());
            case 2 -> Boolean.compare(left.booleanValue(), right.booleanValue());
            default -> left.toString().compareTo(right.toString());
        };
    }
}
