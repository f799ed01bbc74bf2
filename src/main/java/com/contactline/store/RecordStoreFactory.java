package com.contactline.store;

import com.contactline.config.LineConfig;
import io.lettuce.core.RedisException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Builds the process-wide {@link RecordStore} from the application config.
 *
 * <p>Startup never fails because of the store. A missing or malformed
 * {@code REDIS_URL} yields an {@link UnavailableRecordStore}, so public reads
 * keep serving the configured defaults while mutations report why they cannot
 * persist. A well-formed URL always yields a {@link RedisRecordStore}, even
 * when the server is down, because that store reconnects on later calls.
 */
public final class RecordStoreFactory {

    private static final Logger LOG = LoggerFactory.getLogger(RecordStoreFactory.class);

    static final String NOT_CONFIGURED =
            "Redis is not configured (REDIS_URL is missing). The record cannot be changed.";
    static final String NOT_INITIALIZED =
            "Redis is configured but could not be initialized. Check that REDIS_URL has the form redis://...";

    private RecordStoreFactory() {}

    public static RecordStore build(final LineConfig config) {
        final String type = config.getStoreType();
        return switch (type.toLowerCase()) {
            case "redis" -> buildRedis(config.getRedisUrl(), config.getRedisTimeoutMs());
            case "memory" -> {
                LOG.warn("Using in-memory record store, state is lost on restart");
                yield new MemoryRecordStore();
            }
            default -> throw new IllegalArgumentException("Unknown store type: " + type);
        };
    }

    static RecordStore buildRedis(final Optional<String> url, final long timeoutMs) {
        if (url.isEmpty()) {
            LOG.warn("Redis not configured: REDIS_URL is missing");
            return new UnavailableRecordStore(NOT_CONFIGURED);
        }
        try {
            return RedisRecordStore.create(url.get(), timeoutMs);
        } catch (RedisException | IllegalArgumentException e) {
            LOG.error("Failed to initialize Redis: {}", e.getMessage());
            return new UnavailableRecordStore(NOT_INITIALIZED + " Cause: " + e.getMessage());
        }
    }
}
