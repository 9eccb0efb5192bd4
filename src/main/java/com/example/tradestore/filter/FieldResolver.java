package com.example.tradestore.filter;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Resolves a dotted filter path to a value, or {@code MissingNode} when absent.
 */
@FunctionalInterface
public interface FieldResolver {

    JsonNode resolve(String path);
}
