package org.tenantwarehouse.models.pipeline;

import org.tenantwarehouse.models.enums.DestinationKind;

import java.time.Duration;
import java.util.List;

/**
 * Where a pipeline writes. A warehouse destination with no schema writes into the tenant's schema.
 */
public record Destination(DestinationKind kind,
                          String schema,
                          String table,
                          List<String> keyColumns,
                          String cacheKey,
                          Duration cacheTtl) {

    public static final Duration DEFAULT_CACHE_TTL = Duration.ofHours(1);

    public Destination {
        keyColumns = keyColumns == null ? List.of() : List.copyOf(keyColumns);
    }

    public static Destination warehouse(String table, List<String> keyColumns) {
        return new Destination(DestinationKind.WAREHOUSE, null, table, keyColumns, null, null);
    }

    public static Destination cache(String cacheKey, Duration ttl) {
        return new Destination(DestinationKind.CACHE, null, null, List.of(), cacheKey, ttl);
    }

    public Duration effectiveCacheTtl() {
        return cacheTtl == null ? DEFAULT_CACHE_TTL : cacheTtl;
    }
}
