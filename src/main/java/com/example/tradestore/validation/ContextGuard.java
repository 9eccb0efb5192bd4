package com.example.tradestore.validation;

import com.example.tradestore.exception.InvalidContextException;
import com.example.tradestore.model.Context;
import com.example.tradestore.model.ValidationResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Rejects mutating calls whose audit context is incomplete.
 * Every one of user, agent, action and intent must be non-empty after trimming.
 */
@Component
public class ContextGuard {

    public ValidationResult check(Context context) {
        Context normalized = context == null ? Context.builder().build() : context.normalized();
        List<String> errors = new ArrayList<>();
        requireField(errors, "user", normalized.user());
        requireField(errors, "agent", normalized.agent());
        requireField(errors, "action", normalized.action());
        requireField(errors, "intent", normalized.intent());
        return ValidationResult.of(errors, List.of());
    }

    /**
     * @return the trimmed context
     * @throws InvalidContextException when {@link #check(Context)} reports any error
     */
    public Context require(Context context) {
        ValidationResult result = check(context);
        if (!result.success()) {
            throw new InvalidContextException(result);
        }
        return context.normalized();
    }

    private void requireField(List<String> errors, String name, String value) {
        if (value == null || value.isEmpty()) {
            errors.add("Context field '" + name + "' is required");
        }
    }
}
