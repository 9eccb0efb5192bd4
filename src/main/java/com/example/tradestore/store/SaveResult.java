package com.example.tradestore.store;

import com.example.tradestore.model.TradeRecord;
import com.example.tradestore.model.ValidationResult;

/**
 * Stored record plus the validation outcome, whose warnings the caller may surface.
 */
public record SaveResult(TradeRecord record, ValidationResult validation) {
}
