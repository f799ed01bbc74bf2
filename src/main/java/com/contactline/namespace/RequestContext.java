package com.contactline.namespace;

import java.util.Optional;

/**
 * The parts of an inbound request the service needs beyond its body.
 *
 * <p>Only the {@code Host} header is carried; it feeds the namespace
 * fallback in {@link NamespaceResolver}.
 */
public final class RequestContext {

    private static final RequestContext EMPTY = new RequestContext(null);

    private final String host;

    private RequestContext(final String host) {
        this.host = host;
    }

    public static RequestContext ofHost(final String host) {
        return host == null ? EMPTY : new RequestContext(host);
    }

    public static RequestContext empty() {
        return EMPTY;
    }

    /** The trimmed host, or empty when absent or blank. */
    public Optional<String> getHost() {
        if (host == null || host.isBlank()) return Optional.empty();
        return Optional.of(host.trim());
    }

    @Override
    public String toString() {
        return "RequestContext{host=" + host + "}";
    }
}
