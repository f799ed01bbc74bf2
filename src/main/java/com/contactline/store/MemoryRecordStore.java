package com.contactline.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process {@link RecordStore} for local development and tests.
 *
 * <p>State lives only as long as the JVM. Select it with {@code store.type = memory}.
 */
public class MemoryRecordStore implements RecordStore {

    private static final Logger LOG = LoggerFactory.getLogger(MemoryRecordStore.class);

    private final Map<String, String> values = new ConcurrentHashMap<>();

    @Override public String storeName() { return "memory"; }

    @Override
    public Optional<String> get(final String key) {
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public void set(final String key, final String value) {
        LOG.debug("MemoryRecordStore: {} = {}", key, value);
        values.put(key, value);
    }

    @Override
    public void close() {
        values.clear();
    }
}
