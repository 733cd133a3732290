package org.tenantwarehouse.service.ingestion;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.tenantwarehouse.exceptions.LoadException;
import org.tenantwarehouse.service.cache.AnalyticsCacheService;
import org.tenantwarehouse.service.cache.CacheKeys;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Publishes a pipeline's output as one cache entry under {@code etl-output:{tenantId}:{entityId}}.
 * Unlike query caching, a cache that refuses the write fails the load.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CacheDestinationWriter {

    private final AnalyticsCacheService cacheService;

    public int write(String tenantId, String entityId, List<Map<String, Object>> records, Duration ttl) {
        String key = CacheKeys.etlOutput(tenantId, entityId);
        if (!cacheService.set(key, records, ttl)) {
            throw new LoadException("Cache destination " + key + " rejected the write");
        }
        log.info("CacheDestinationWriter: cached {} records under {} for {}s", records.size(), key, ttl.toSeconds());
        return records.size();
    }
}
