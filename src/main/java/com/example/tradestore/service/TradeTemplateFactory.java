package com.example.tradestore.service;

import com.example.tradestore.document.MergeEngine;
import com.example.tradestore.document.PathAccessor;
import com.example.tradestore.model.TradeType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Builds skeleton documents for new trades.
 * <p>
 * A skeleton is {@code templates/core.json} deep-merged with {@code templates/<type>.json},
 * then stamped with a provisional trade id, today's trade and input dates and the execution time.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TradeTemplateFactory {

    private static final String CORE_TEMPLATE = "core";

    private final ObjectMapper objectMapper;
    private final MergeEngine mergeEngine;
    private final Clock clock;

    private final Map<TradeType, ObjectNode> templates = new ConcurrentHashMap<>();

    public ObjectNode newTrade(TradeType type) {
        if (type == null || type == TradeType.UNKNOWN) {
            throw new IllegalArgumentException("A concrete trade type is required");
        }
        ObjectNode trade = templates.computeIfAbsent(type, this::assemble).deepCopy();

        LocalDate today = LocalDate.now(clock);
        String tradeId = generateTradeId(type, today);
        PathAccessor.set(trade, "general.tradeId", TextNode.valueOf(tradeId));
        PathAccessor.set(trade, "common.tradeDate", TextNode.valueOf(today.toString()));
        PathAccessor.set(trade, "common.inputDate", TextNode.valueOf(today.toString()));
        PathAccessor.set(trade, "general.executionDetails.executionDateTime",
                TextNode.valueOf(clock.instant().toString()));

        log.info("Created new {} trade skeleton {}", type.code(), tradeId);
        return trade;
    }

    /**
     * {@code NEW-<yyyyMMdd>-<type code>-<4 digits>}
     */
    String generateTradeId(TradeType type, LocalDate date) {
        int sequence = ThreadLocalRandom.current().nextInt(10_000);
        return String.format("NEW-%s-%s-%04d", date.format(DateTimeFormatter.BASIC_ISO_DATE), type.idCode(), sequence);
    }

    private ObjectNode assemble(TradeType type) {
        log.debug("Loading templates for {}", type.code());
        return mergeEngine.merge(load(CORE_TEMPLATE), load(type.code()));
    }

    private ObjectNode load(String name) {
        String location = "templates/" + name + ".json";
        try (InputStream in = new ClassPathResource(location).getInputStream()) {
            JsonNode node = objectMapper.readTree(in);
            if (!node.isObject()) {
                throw new IllegalStateException("Template " + location + " is not a JSON object");
            }
            return (ObjectNode) node;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read trade template " + location, e);
        }
    }
}
