package com.contactline.namespace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives the key prefix that isolates one deployment's record from others
 * sharing the same store.
 *
 * <h2>Resolution order</h2>
 * <ol>
 *   <li>The configured namespace ({@code REDIS_NAMESPACE}), when non-blank.</li>
 *   <li>{@code "host:" + host} from the request's {@code Host} header.</li>
 *   <li>The literal {@value #DEFAULT_NAMESPACE}.</li>
 * </ol>
 *
 * <p>The host fallback is not safe when several environments (preview,
 * production, alternate domains) point at one store: each host gets its own
 * record. Configure an explicit namespace per deployment instead.
 */
public final class NamespaceResolver {

    private static final Logger LOG = LoggerFactory.getLogger(NamespaceResolver.class);

    public static final String DEFAULT_NAMESPACE = "default";
    public static final String HOST_PREFIX       = "host:";

    private NamespaceResolver() {}

    /**
     * @param configuredNamespace the explicit namespace, may be {@code null} or blank
     * @param context             the current request
     * @return a non-empty namespace
     */
    public static String resolveNamespace(final String configuredNamespace, final RequestContext context) {
        final String explicit = configuredNamespace == null ? "" : configuredNamespace.trim();
        if (!explicit.isEmpty()) return explicit;

        final String namespace = context.getHost()
                .map(host -> HOST_PREFIX + host)
                .orElse(DEFAULT_NAMESPACE);
        LOG.debug("No explicit namespace configured, falling back to {}", namespace);
        return namespace;
    }
}
