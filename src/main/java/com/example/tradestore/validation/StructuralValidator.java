package com.example.tradestore.validation;

import com.example.tradestore.config.TradeStoreProperties.RequiredField;
import com.example.tradestore.document.DocumentValues;
import com.example.tradestore.document.PathAccessor;
import com.example.tradestore.model.ValidationResult;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks that every configured required path is present and has its declared shape.
 * A JSON null counts as missing; blank text is an error unless the field allows blanks.
 */
public class StructuralValidator implements TradeValidator {

    private final List<RequiredField> requiredFields;

    public StructuralValidator(List<RequiredField> requiredFields) {
        this.requiredFields = List.copyOf(requiredFields);
    }

    @Override
    public ValidationResult validate(JsonNode document) {
        List<String> errors = new ArrayList<>();
        for (RequiredField field : requiredFields) {
            String error = check(document, field);
            if (error != null) {
                errors.add(error);
            }
        }
        return ValidationResult.of(errors, List.of());
    }

    private String check(JsonNode document, RequiredField field) {
        String path = field.getPath();
        List<String> segments = PathAccessor.segments(path);
        JsonNode current = document;
        for (int i = 0; i < segments.size(); i++) {
            if (i > 0 && !current.isObject()) {
                String parent = String.join(".", segments.subList(0, i));
                return "Required field has wrong shape: " + parent + " is a " + DocumentValues.describe(current)
                        + " but must be an object to hold " + path;
            }
            current = current.path(segments.get(i));
            if (current.isMissingNode() || current.isNull()) {
                return "Required field missing: " + path;
            }
        }

        if (!field.getShape().accepts(current)) {
            return "Required field has wrong shape: " + path + " is a " + DocumentValues.describe(current)
                    + ", expected " + field.getShape().label();
        }
        if (DocumentValues.isBlankText(current) && !field.isAllowBlank()) {
            return "Required field empty: " + path;
        }
        return null;
    }
}
