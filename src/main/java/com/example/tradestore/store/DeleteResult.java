package com.example.tradestore.store;

import java.util.List;

public record DeleteResult(int deletedCount, List<String> deletedIds, List<String> missingIds) {

    public DeleteResult {
        deletedIds = List.copyOf(deletedIds);
        missingIds = List.copyOf(missingIds);
    }
}
