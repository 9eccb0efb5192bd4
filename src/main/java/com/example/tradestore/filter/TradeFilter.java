package com.example.tradestore.filter;

import lombok.Builder;

import java.util.List;

/**
 * AND-combined predicates plus paging and ordering for list queries.
 * {@code count} ignores the paging fields.
 */
@Builder(toBuilder = true)
public record TradeFilter(
        List<FilterPredicate> predicates,
        Integer limit,
        int offset,
        String sortBy,
        boolean descending
) {

    public TradeFilter {
        predicates = predicates == null ? List.of() : List.copyOf(predicates);
        if (limit != null && limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
    }

    public static TradeFilter all() {
        return TradeFilter.builder().build();
    }

    public static TradeFilter of(FilterPredicate... predicates) {
        return TradeFilter.builder().predicates(List.of(predicates)).build();
    }

    public boolean isEmpty() {
        return predicates.isEmpty();
    }
}
