package com.contactline.store;

import com.contactline.error.StoreUnavailableException;

import java.util.Optional;

/**
 * Stand-in used when no working store exists: Redis is not configured, or its
 * URL could not be turned into a client. Every call fails with the
 * reason given at construction, which reads degrade on and mutations report.
 */
public class UnavailableRecordStore implements RecordStore {

    private final String reason;

    public UnavailableRecordStore(final String reason) {
        this.reason = reason;
    }

    @Override public String storeName() { return "unavailable"; }

    public String getReason() {
        return reason;
    }

    @Override
    public Optional<String> get(final String key) {
        throw new StoreUnavailableException(reason);
    }

    @Override
    public void set(final String key, final String value) {
        throw new StoreUnavailableException(reason);
    }

    @Override
    public void close() {
        // nothing held
    }
}
