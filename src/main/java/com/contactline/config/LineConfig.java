package com.contactline.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.util.Optional;

/**
 * Typed configuration for the Contact Line service, loaded from
 * {@code application.conf} via Typesafe Config.
 *
 * <p>The administrator password, default phone number, message and namespace
 * are read from environment variables via Typesafe Config substitution
 * (e.g. {@code ${?ADMIN_PASSWORD}}). This class never holds or logs secret
 * values beyond the lifetime of the request that loaded it.
 *
 * <p>{@link #load()} bypasses the Typesafe Config cache, so each request
 * handler that calls it sees the current values.
 */
public final class LineConfig {

    private final Config raw;

    private LineConfig(final Config config) {
        this.raw = config;
    }

    /** Load a fresh, resolved configuration; never served from the loader cache. */
    public static LineConfig load() {
        ConfigFactory.invalidateCaches();
        return new LineConfig(ConfigFactory.load().resolve());
    }

    /** Wrap an already built {@link Config}, e.g. one assembled by a test. */
    public static LineConfig from(final Config config) {
        return new LineConfig(config.resolve());
    }

    // ── Line ──────────────────────────────────────────────────────────────────

    public String getAdminPassword() {
        return raw.getString("line.admin-password");
    }

    public String getDefaultPhone() {
        return raw.getString("line.default-phone");
    }

    public String getMessage() {
        return raw.getString("line.message");
    }

    /** The explicit namespace, trimmed; empty when not configured. */
    public String getNamespace() {
        return raw.hasPath("line.namespace") ? raw.getString("line.namespace").trim() : "";
    }

    // ── Store ─────────────────────────────────────────────────────────────────

    public String getStoreType() {
        return raw.getString("store.type");
    }

    public Optional<String> getRedisUrl() {
        if (!raw.hasPath("store.redis.url")) return Optional.empty();
        final String url = raw.getString("store.redis.url").trim();
        return url.isEmpty() ? Optional.empty() : Optional.of(url);
    }

    public long getRedisTimeoutMs() {
        return raw.getLong("store.redis.timeout-ms");
    }

    // ── HTTP ──────────────────────────────────────────────────────────────────

    public int getHttpPort() {
        return raw.getInt("http.port");
    }

    public String getHttpPath() {
        return raw.getString("http.path");
    }
}
