package com.example.tradestore.store;

import com.example.tradestore.model.OperationLogEntry;
import com.example.tradestore.model.TradeType;

/**
 * Notified after a mutation has been committed, outside the store lock and in commit order.
 * A failing listener never undoes the mutation.
 */
public interface TradeLifecycleListener {

    void onMutation(OperationLogEntry entry, TradeType tradeType);
}
