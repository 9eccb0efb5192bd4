package com.example.tradestore.document;

import com.fasterxml.jackson.databind.JsonNode;

public final class DocumentValues {

    private DocumentValues() {
    }

    /**
     * True for a present value that carries content: non-empty text or container,
     * {@code true}, or a non-zero number.
     */
    public static boolean hasContent(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return false;
        }
        if (node.isTextual()) {
            return !node.textValue().isEmpty();
        }
        if (node.isContainerNode()) {
            return !node.isEmpty();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            return node.decimalValue().signum() != 0;
        }
        return true;
    }

    public static boolean isBlankText(JsonNode node) {
        return node != null && node.isTextual() && node.textValue().isBlank();
    }

    /**
     * Short description of a node's type for error messages.
     */
    public static String describe(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return "missing";
        }
        return switch (node.getNodeType()) {
            case OBJECT -> "object";
            case ARRAY -> "array";
            case STRING -> "string";
            case NUMBER -> "number";
            case BOOLEAN -> "boolean";
            case NULL -> "null";
            default -> node.getNodeType().name().toLowerCase();
        };
    }
}
