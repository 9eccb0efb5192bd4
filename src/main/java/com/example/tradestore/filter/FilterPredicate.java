package com.example.tradestore.filter;

import com.example.tradestore.document.PathAccessor;
import com.example.tradestore.exception.InvalidFilterException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A single (path, operator, value) condition. Regex predicates carry their compiled pattern.
 */
public record FilterPredicate(String path, FilterOperator operator, JsonNode value, Pattern pattern) {

    public FilterPredicate {
        Objects.requireNonNull(path, "Path cannot be null");
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(value, "Value cannot be null");
    }

    public static FilterPredicate of(String path, FilterOperator operator, JsonNode value) {
        if (path == null || path.isBlank()) {
            throw new InvalidFilterException("Filter path must not be blank");
        }
        try {
            PathAccessor.segments(path);
        } catch (IllegalArgumentException e) {
            throw new InvalidFilterException("Invalid filter path '" + path + "': " + e.getMessage());
        }
        return switch (operator) {
            case REGEX -> regex(path, value);
            case IN, NIN -> {
                if (!value.isArray()) {
                    throw new InvalidFilterException("Operator '" + operator.key() + "' on '" + path
                            + "' requires an array of candidate values");
                }
                yield new FilterPredicate(path, operator, value, null);
            }
            case EXISTS -> {
                if (!value.isBoolean()) {
                    throw new InvalidFilterException("Operator 'exists' on '" + path + "' requires true or false");
                }
                yield new FilterPredicate(path, operator, value, null);
            }
            default -> new FilterPredicate(path, operator, value, null);
        };
    }

    public static FilterPredicate eq(String path, Object value) {
        return of(path, FilterOperator.EQ, toNode(value));
    }

    public static FilterPredicate ne(String path, Object value) {
        return of(path, FilterOperator.NE, toNode(value));
    }

    public static FilterPredicate gte(String path, Object value) {
        return of(path, FilterOperator.GTE, toNode(value));
    }

    public static FilterPredicate lte(String path, Object value) {
        return of(path, FilterOperator.LTE, toNode(value));
    }

    public static FilterPredicate exists(String path, boolean expected) {
        return of(path, FilterOperator.EXISTS, BooleanNode.valueOf(expected));
    }

    private static FilterPredicate regex(String path, JsonNode value) {
        if (!value.isTextual()) {
            throw new InvalidFilterException("Operator 'regex' on '" + path + "' requires a string pattern");
        }
        try {
            return new FilterPredicate(path, FilterOperator.REGEX, value, Pattern.compile(value.textValue()));
        } catch (PatternSyntaxException e) {
            throw new InvalidFilterException("Invalid regex for '" + path + "': " + e.getDescription());
        }
    }

    private static JsonNode toNode(Object value) {
        if (value == null) {
            return JsonNodeFactory.instance.nullNode();
        }
        if (value instanceof JsonNode node) {
            return node;
        }
        if (value instanceof String text) {
            return TextNode.valueOf(text);
        }
        if (value instanceof Boolean flag) {
            return BooleanNode.valueOf(flag);
        }
        if (value instanceof Number number) {
            return JsonNodeFactory.instance.numberNode(new BigDecimal(number.toString()));
        }
        throw new IllegalArgumentException("Unsupported filter value type: " + value.getClass().getName());
    }
}
