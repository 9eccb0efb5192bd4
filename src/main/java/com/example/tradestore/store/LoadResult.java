package com.example.tradestore.store;

import com.example.tradestore.model.TradeRecord;

import java.util.List;

/**
 * Records found for a group of ids, in request order. Unknown ids are listed, never an error.
 */
public record LoadResult(List<TradeRecord> trades, List<String> missingIds) {

    public LoadResult {
        trades = List.copyOf(trades);
        missingIds = List.copyOf(missingIds);
    }
}
