package org.tenantwarehouse.service.cache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.tenantwarehouse.exceptions.CacheException;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
@RequiredArgsConstructor
public class RedisCacheStore implements CacheStore {

    private final StringRedisTemplate redisTemplate;

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(key));
        } catch (DataAccessException exception) {
            throw new CacheException("Redis read failed for key " + key, exception);
        }
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        try {
            redisTemplate.opsForValue().set(key, value, ttl);
        } catch (DataAccessException exception) {
            throw new CacheException("Redis write failed for key " + key, exception);
        }
    }

    @Override
    public void delete(String key) {
        try {
            redisTemplate.delete(key);
        } catch (DataAccessException exception) {
            throw new CacheException("Redis delete failed for key " + key, exception);
        }
    }

    @Override
    public long deleteByPrefix(String prefix) {
        List<String> keys = new ArrayList<>();
        ScanOptions options = ScanOptions.scanOptions().match(prefix + "*").count(500).build();
        try (Cursor<String> cursor = redisTemplate.scan(options)) {
            cursor.forEachRemaining(keys::add);
        } catch (DataAccessException exception) {
            throw new CacheException("Redis scan failed for prefix " + prefix, exception);
        }
        if (keys.isEmpty()) {
            return 0;
        }
        Long deleted;
        try {
            deleted = redisTemplate.delete(keys);
        } catch (DataAccessException exception) {
            throw new CacheException("Redis delete failed for " + keys.size() + " keys with prefix " + prefix, exception);
        }
        log.debug("Deleted {} redis keys with prefix {}", deleted, prefix);
        return deleted == null ? 0 : deleted;
    }
}
