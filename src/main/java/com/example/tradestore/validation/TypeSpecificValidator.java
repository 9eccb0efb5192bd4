package com.example.tradestore.validation;

import com.example.tradestore.model.TradeType;

/**
 * A validator that only runs for documents of one detected trade type.
 */
public interface TypeSpecificValidator extends TradeValidator {

    TradeType tradeType();
}
