package org.tenantwarehouse.service.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Shared key/value store with per-entry TTL. Implementations raise
 * {@link org.tenantwarehouse.exceptions.CacheException} when the backend is unreachable.
 */
public interface CacheStore {

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    void delete(String key);

    /**
     * Removes every key starting with {@code prefix} and returns how many were removed.
     */
    long deleteByPrefix(String prefix);
}
