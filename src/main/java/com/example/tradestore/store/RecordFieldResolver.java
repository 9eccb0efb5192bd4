package com.example.tradestore.store;

import com.example.tradestore.document.PathAccessor;
import com.example.tradestore.filter.FieldResolver;
import com.example.tradestore.model.Context;
import com.example.tradestore.model.TradeRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.time.Instant;
import java.util.List;

/**
 * Resolves filter and sort paths against a stored record.
 * <p>
 * {@code data.*} addresses the document, {@code id}, {@code version}, {@code createdAt},
 * {@code updatedAt} and {@code lastContext.*} address record metadata, and any other path
 * addresses the document directly.
 */
final class RecordFieldResolver implements FieldResolver {

    private final TradeRecord record;

    RecordFieldResolver(TradeRecord record) {
        this.record = record;
    }

    @Override
    public JsonNode resolve(String path) {
        List<String> segments = PathAccessor.segments(path);
        List<String> rest = segments.subList(1, segments.size());
        return switch (segments.get(0)) {
            case "data" -> rest.isEmpty() ? record.data() : PathAccessor.get(record.data(), rest);
            case "id" -> leaf(rest, TextNode.valueOf(record.id()));
            case "version" -> leaf(rest, LongNode.valueOf(record.version()));
            case "createdAt" -> leaf(rest, instant(record.createdAt()));
            case "updatedAt" -> leaf(rest, instant(record.updatedAt()));
            case "lastContext" -> rest.isEmpty() ? contextNode() : PathAccessor.get(contextNode(), rest);
            default -> PathAccessor.get(record.data(), segments);
        };
    }

    private static JsonNode leaf(List<String> rest, JsonNode value) {
        return rest.isEmpty() ? value : MissingNode.getInstance();
    }

    private static JsonNode instant(Instant instant) {
        return instant == null ? MissingNode.getInstance() : TextNode.valueOf(instant.toString());
    }

    private ObjectNode contextNode() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        Context context = record.lastContext();
        if (context != null) {
            node.put("user", context.user());
            node.put("agent", context.agent());
            node.put("action", context.action());
            node.put("intent", context.intent());
        }
        return node;
    }
}
