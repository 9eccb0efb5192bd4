package com.example.tradestore.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Dotted-path access into trade documents, e.g. {@code general.transactionRoles.priceMaker}.
 * <p>
 * Lookups never fail on a missing level: they return {@link MissingNode}. Arrays are opaque,
 * so a path that walks through an array resolves to missing. There is no index or wildcard syntax.
 */
public final class PathAccessor {

    private static final Pattern SEPARATOR = Pattern.compile("\\.");

    private PathAccessor() {
    }

    public static List<String> segments(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Path must not be blank");
        }
        List<String> segments = List.of(SEPARATOR.split(path, -1));
        if (segments.stream().anyMatch(String::isEmpty)) {
            throw new IllegalArgumentException("Path contains an empty segment: " + path);
        }
        return segments;
    }

    /**
     * Value at {@code path}, or {@link MissingNode} when any level is absent.
     * An explicit JSON null is returned as {@link NullNode}.
     */
    public static JsonNode get(JsonNode document, String path) {
        return get(document, segments(path));
    }

    public static JsonNode get(JsonNode document, List<String> segments) {
        JsonNode current = document;
        for (String segment : segments) {
            if (current == null || !current.isObject()) {
                return MissingNode.getInstance();
            }
            current = current.get(segment);
        }
        return current == null ? MissingNode.getInstance() : current;
    }

    /**
     * True when {@code path} resolves to something other than missing (JSON null counts as present).
     */
    public static boolean exists(JsonNode document, String path) {
        return !get(document, path).isMissingNode();
    }

    /**
     * Writes {@code value} at {@code path}, creating intermediate objects as needed.
     *
     * @throws IllegalArgumentException when an intermediate level exists but is not an object
     */
    public static void set(ObjectNode document, String path, JsonNode value) {
        List<String> segments = segments(path);
        ObjectNode current = document;
        for (int i = 0; i < segments.size() - 1; i++) {
            String segment = segments.get(i);
            JsonNode next = current.get(segment);
            if (next == null || next.isNull()) {
                current = current.putObject(segment);
            } else if (next.isObject()) {
                current = (ObjectNode) next;
            } else {
                throw new IllegalArgumentException("Cannot set " + path + ": '"
                        + String.join(".", segments.subList(0, i + 1)) + "' is a " + next.getNodeType());
            }
        }
        current.set(segments.get(segments.size() - 1), value == null ? NullNode.getInstance() : value);
    }
}
