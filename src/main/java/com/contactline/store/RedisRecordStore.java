package com.contactline.store;

import com.contactline.error.StoreUnavailableException;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisException;
import io.lettuce.core.RedisURI;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * {@link RecordStore} backed by Redis through a single shared Lettuce connection.
 *
 * <p>Lettuce connections are thread-safe and multiplex concurrent commands, so
 * one connection is reused by every request. It is opened on first use; if the
 * server is unreachable the call fails and the next call tries again. Once
 * open, Lettuce reconnects on its own after a dropped link. Values are plain
 * Redis strings written with {@code SET} and read with {@code GET}.
 */
public class RedisRecordStore implements RecordStore {

    private static final Logger LOG = LoggerFactory.getLogger(RedisRecordStore.class);

    private final RedisClient client;
    private final String      endpoint;

    private volatile StatefulRedisConnection<String, String> connection;

    RedisRecordStore(final RedisClient client, final String endpoint) {
        this.client   = client;
        this.endpoint = endpoint;
    }

    RedisRecordStore(final RedisClient client, final StatefulRedisConnection<String, String> connection) {
        this(client, "redis");
        this.connection = connection;
    }

    /**
     * Build a store for {@code url} and try to connect right away. An unreachable
     * server is logged, not fatal: the connection is retried on later calls.
     *
     * @param url       a {@code redis://} or {@code rediss://} URI
     * @param timeoutMs connect and command timeout
     * @throws IllegalArgumentException if the URI is malformed
     */
    public static RedisRecordStore create(final String url, final long timeoutMs) {
        final RedisURI uri = RedisURI.create(url);
        uri.setTimeout(Duration.ofMillis(timeoutMs));

        final RedisRecordStore store = new RedisRecordStore(
                RedisClient.create(uri), uri.getHost() + ":" + uri.getPort());
        try {
            store.connection();
        } catch (StoreUnavailableException e) {
            LOG.warn("Redis not reachable at startup, will retry on first use: {}", e.getMessage());
        }
        return store;
    }

    @Override public String storeName() { return "redis"; }

    @Override
    public Optional<String> get(final String key) {
        try {
            return Optional.ofNullable(commands().get(key));
        } catch (RedisException e) {
            throw new StoreUnavailableException("Redis GET failed for " + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void set(final String key, final String value) {
        try {
            commands().set(key, value);
        } catch (RedisException e) {
            throw new StoreUnavailableException("Redis SET failed for " + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        try {
            final StatefulRedisConnection<String, String> open = connection;
            if (open != null) open.close();
        } finally {
            client.shutdown();
            LOG.info("Redis connection closed");
        }
    }

    /** True once a connection has been established. */
    boolean isConnected() {
        return connection != null;
    }

    StatefulRedisConnection<String, String> connection() {
        StatefulRedisConnection<String, String> open = connection;
        if (open != null) return open;

        synchronized (this) {
            if (connection == null) {
                try {
                    connection = client.connect();
                    LOG.info("Connected to Redis at {}", endpoint);
                } catch (RedisException e) {
                    throw new StoreUnavailableException(
                            "Unable to connect to Redis at " + endpoint + ": " + e.getMessage(), e);
                }
            }
            return connection;
        }
    }

    private RedisCommands<String, String> commands() {
        return connection().sync();
    }
}
