package com.example.tradestore.store;

import com.example.tradestore.model.TradeRecord;

import java.util.List;

/**
 * A page of matching records and the number of matches before paging.
 */
public record TradePage(List<TradeRecord> trades, long totalMatching) {

    public TradePage {
        trades = List.copyOf(trades);
    }
}
