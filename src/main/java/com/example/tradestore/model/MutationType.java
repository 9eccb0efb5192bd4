package com.example.tradestore.model;

public enum MutationType {
    SAVE_NEW,
    SAVE_UPDATE,
    SAVE_PARTIAL,
    DELETE,
    PURGE
}
