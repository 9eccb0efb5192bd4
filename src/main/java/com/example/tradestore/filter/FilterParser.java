package com.example.tradestore.filter;

import com.example.tradestore.exception.InvalidFilterException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Parses the wire filter syntax, e.g.
 * {@code {"data.notional": {"gte": 1000000, "lte": 10000000}}}, into predicates.
 * Every path and every operator under it becomes one predicate; all of them are ANDed.
 */
@Slf4j
@Component
public class FilterParser {

    public List<FilterPredicate> parse(JsonNode filter) {
        if (filter == null || filter.isMissingNode() || filter.isNull()) {
            return List.of();
        }
        if (!filter.isObject()) {
            throw new InvalidFilterException("Filter must be a JSON object of path to conditions");
        }

        List<FilterPredicate> predicates = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = filter.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String path = field.getKey();
            JsonNode conditions = field.getValue();
            if (!conditions.isObject() || conditions.isEmpty()) {
                throw new InvalidFilterException("Filter conditions for '" + path + "' must be a non-empty object");
            }
            Iterator<Map.Entry<String, JsonNode>> operators = conditions.fields();
            while (operators.hasNext()) {
                Map.Entry<String, JsonNode> condition = operators.next();
                FilterOperator operator = FilterOperator.fromKey(condition.getKey())
                        .orElseThrow(() -> new InvalidFilterException(
                                "Unsupported filter operator '" + condition.getKey() + "' for '" + path + "'"));
                predicates.add(FilterPredicate.of(path, operator, condition.getValue()));
            }
        }
        log.debug("Parsed {} filter predicate(s)", predicates.size());
        return predicates;
    }
}
