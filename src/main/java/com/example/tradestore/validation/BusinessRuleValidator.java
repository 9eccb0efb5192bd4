package com.example.tradestore.validation;

import com.example.tradestore.document.PathAccessor;
import com.example.tradestore.model.ValidationResult;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Semantic checks that apply to every trade type.
 * <ul>
 *     <li>each configured date field, when present, parses strictly under the date pattern;</li>
 *     <li>an input date earlier than the trade date draws a warning.</li>
 * </ul>
 * Missing, null or blank dates are left to {@link StructuralValidator}.
 */
public class BusinessRuleValidator implements TradeValidator {

    static final String TRADE_DATE = "common.tradeDate";
    static final String INPUT_DATE = "common.inputDate";

    private final List<String> dateFields;
    private final String datePattern;
    private final DateTimeFormatter formatter;

    public BusinessRuleValidator(List<String> dateFields, String datePattern) {
        this.dateFields = List.copyOf(dateFields);
        this.datePattern = datePattern;
        this.formatter = DateTimeFormatter.ofPattern(datePattern).withResolverStyle(ResolverStyle.STRICT);
    }

    @Override
    public ValidationResult validate(JsonNode document) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Map<String, LocalDate> parsed = new HashMap<>();

        for (String path : dateFields) {
            JsonNode value = PathAccessor.get(document, path);
            if (value.isMissingNode() || value.isNull()) {
                continue;
            }
            if (value.isTextual() && value.textValue().isBlank()) {
                continue;
            }
            if (!value.isTextual()) {
                errors.add(invalidDate(path, value.toString()));
                continue;
            }
            try {
                parsed.put(path, LocalDate.parse(value.textValue(), formatter));
            } catch (DateTimeParseException e) {
                errors.add(invalidDate(path, value.textValue()));
            }
        }

        LocalDate tradeDate = parsed.get(TRADE_DATE);
        LocalDate inputDate = parsed.get(INPUT_DATE);
        if (tradeDate != null && inputDate != null && inputDate.isBefore(tradeDate)) {
            warnings.add("Input date " + inputDate + " is before trade date " + tradeDate);
        }
        return ValidationResult.of(errors, warnings);
    }

    private String invalidDate(String path, String value) {
        return "Invalid date format for " + path + ": " + value + ". Expected " + datePattern;
    }
}
