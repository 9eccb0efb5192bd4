package com.example.tradestore.validation;

import com.example.tradestore.model.TradeType;
import com.example.tradestore.model.ValidationResult;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered, non-short-circuiting validation pipeline.
 * <p>
 * Universal validators run first in their configured order, then the trade type is detected and
 * the validators registered for that type run. Every error and warning is collected; the result
 * succeeds only when no validator reported an error.
 */
@Slf4j
public class ValidatorChain {

    static final String UNKNOWN_TYPE_MESSAGE = "Unable to detect trade type";

    private final List<TradeValidator> universalValidators;
    private final Map<TradeType, List<TypeSpecificValidator>> typeValidators;
    private final TradeTypeDetector tradeTypeDetector;
    private final boolean requireTradeType;

    public ValidatorChain(List<TradeValidator> universalValidators,
                          List<TypeSpecificValidator> typeValidators,
                          TradeTypeDetector tradeTypeDetector,
                          boolean requireTradeType) {
        this.universalValidators = List.copyOf(universalValidators);
        this.typeValidators = new EnumMap<>(TradeType.class);
        for (TypeSpecificValidator validator : typeValidators) {
            this.typeValidators.computeIfAbsent(validator.tradeType(), type -> new ArrayList<>()).add(validator);
        }
        this.tradeTypeDetector = tradeTypeDetector;
        this.requireTradeType = requireTradeType;
    }

    public ValidationResult validate(JsonNode document) {
        if (document == null || !document.isObject()) {
            return ValidationResult.failure("Trade document must be a JSON object");
        }

        ValidationResult result = ValidationResult.ok();
        for (TradeValidator validator : universalValidators) {
            result = result.merge(run(validator, document));
        }

        TradeType type = tradeTypeDetector.detect(document);
        if (type == TradeType.UNKNOWN) {
            result = result.merge(requireTradeType
                    ? ValidationResult.failure(UNKNOWN_TYPE_MESSAGE)
                    : ValidationResult.warning(UNKNOWN_TYPE_MESSAGE));
        } else {
            for (TradeValidator validator : typeValidators.getOrDefault(type, List.of())) {
                result = result.merge(run(validator, document));
            }
        }

        log.debug("Validation of {} trade finished: {} error(s), {} warning(s)",
                type.code(), result.errors().size(), result.warnings().size());
        return result.withTradeType(type);
    }

    private ValidationResult run(TradeValidator validator, JsonNode document) {
        ValidationResult result = validator.validate(document);
        if (!result.success()) {
            log.debug("{} reported {}", validator.name(), result.errors());
        }
        return result;
    }
}
