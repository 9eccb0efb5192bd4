package com.example.tradestore.exception;

/**
 * A full replace or partial update carried a stale expected version.
 */
public class VersionConflictException extends TradeStoreException {

    private final long expectedVersion;
    private final long actualVersion;

    public VersionConflictException(String tradeId, long expectedVersion, long actualVersion) {
        super("Version conflict for trade " + tradeId + ": expected " + expectedVersion
                + " but current is " + actualVersion, "VERSION_CONFLICT");
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
