package org.tenantwarehouse.models.dto;

import java.time.Duration;

/**
 * Null {@code cacheTtl} or {@code timeout} fall back to the configured defaults.
 */
public record QueryOptions(boolean useCache, Duration cacheTtl, Duration timeout) {

    public static QueryOptions defaults() {
        return new QueryOptions(true, null, null);
    }

    public static QueryOptions uncached() {
        return new QueryOptions(false, null, null);
    }

    public static QueryOptions cached(Duration ttl) {
        return new QueryOptions(true, ttl, null);
    }

    public QueryOptions withTimeout(Duration value) {
        return new QueryOptions(useCache, cacheTtl, value);
    }
}
