package org.tenantwarehouse.service.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.tenantwarehouse.exceptions.CacheException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * JSON view over the {@link CacheStore}. Every operation degrades instead of failing: an
 * unavailable backend reads as a miss and a failed write is logged and skipped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalyticsCacheService {

    private final CacheStore cacheStore;
    private final ObjectMapper objectMapper;

    public <T> Optional<T> get(String key, TypeReference<T> type) {
        try {
            Optional<String> cached = cacheStore.get(key);
            if (cached.isEmpty()) {
                log.debug("Cache miss for key: {}", key);
                return Optional.empty();
            }
            log.debug("Cache hit for key: {}", key);
            return Optional.of(objectMapper.readValue(cached.get(), type));
        } catch (CacheException exception) {
            log.warn("Cache unavailable, reading {} without cache: {}", key, exception.getMessage());
            return Optional.empty();
        } catch (JsonProcessingException exception) {
            log.warn("Discarding unreadable cache entry {}: {}", key, exception.getMessage());
            evict(key);
            return Optional.empty();
        }
    }

    public boolean set(String key, Object value, Duration ttl) {
        try {
            cacheStore.set(key, objectMapper.writeValueAsString(value), ttl);
            log.debug("Cached value for key: {} (TTL: {}s)", key, ttl.toSeconds());
            return true;
        } catch (CacheException exception) {
            log.warn("Cache unavailable, skipping write for {}: {}", key, exception.getMessage());
            return false;
        } catch (JsonProcessingException exception) {
            log.warn("Value for {} is not serializable, skipping cache write: {}", key, exception.getMessage());
            return false;
        }
    }

    public void evict(String key) {
        try {
            cacheStore.delete(key);
        } catch (CacheException exception) {
            log.warn("Cache unavailable, skipping eviction of {}: {}", key, exception.getMessage());
        }
    }

    public long evictTenant(String namespace, String tenantId) {
        try {
            return cacheStore.deleteByPrefix(CacheKeys.tenantPrefix(namespace, tenantId));
        } catch (CacheException exception) {
            log.warn("Cache unavailable, skipping eviction of {} entries for tenant {}: {}",
                    namespace, tenantId, exception.getMessage());
            return 0;
        }
    }
}
