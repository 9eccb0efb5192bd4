package com.example.tradestore.filter;

import com.example.tradestore.document.PathAccessor;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.OptionalInt;

/**
 * Evaluates AND-combined predicates against a document.
 * <p>
 * An absent (or null) field fails every operator except {@code exists}. Array-valued fields
 * never match a value operator, and operands with no common ordering simply do not match.
 * Matching has no side effects and never throws for data it cannot compare.
 */
@Component
public class FilterMatcher {

    public boolean matches(JsonNode document, TradeFilter filter) {
        return matches(path -> PathAccessor.get(document, path), filter.predicates());
    }

    public boolean matches(FieldResolver resolver, TradeFilter filter) {
        return matches(resolver, filter.predicates());
    }

    public boolean matches(FieldResolver resolver, List<FilterPredicate> predicates) {
        for (FilterPredicate predicate : predicates) {
            if (!matches(resolver.resolve(predicate.path()), predicate)) {
                return false;
            }
        }
        return true;
    }

    boolean matches(JsonNode actual, FilterPredicate predicate) {
        JsonNode expected = predicate.value();
        if (predicate.operator() == FilterOperator.EXISTS) {
            return JsonValues.isAbsent(actual) != expected.booleanValue();
        }
        if (JsonValues.isAbsent(actual) || actual.isArray()) {
            return false;
        }

        return switch (predicate.operator()) {
            case EQ -> JsonValues.valueEquals(actual, expected);
            case NE -> !JsonValues.valueEquals(actual, expected);
            case GT, GTE, LT, LTE -> ordered(actual, expected, predicate.operator());
            case REGEX -> actual.isTextual() && predicate.pattern().matcher(actual.textValue()).find();
            case IN -> contains(expected, actual);
            case NIN -> !contains(expected, actual);
            case EXISTS -> throw new IllegalStateException("exists handled above");
        };
    }

    private boolean ordered(JsonNode actual, JsonNode expected, FilterOperator operator) {
        OptionalInt comparison = JsonValues.compare(actual, expected);
        if (comparison.isEmpty()) {
            return false;
        }
        int c = comparison.getAsInt();
        return switch (operator) {
            case GT -> c > 0;
            case GTE -> c >= 0;
            case LT -> c < 0;
            case LTE -> c <= 0;
            default -> false;
        };
    }

    private boolean contains(JsonNode candidates, JsonNode actual) {
        for (JsonNode candidate : candidates) {
            if (JsonValues.valueEquals(actual, candidate)) {
                return true;
            }
        }
        return false;
    }
}
