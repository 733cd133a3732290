package org.tenantwarehouse.configuration;

import org.tenantwarehouse.service.cache.CacheStore;
import org.tenantwarehouse.service.cache.InMemoryCacheStore;
import org.tenantwarehouse.service.cache.RedisCacheStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

@Configuration
public class CacheConfiguration {

    @Bean
    @ConditionalOnProperty(name = "analytics.cache.store", havingValue = "redis")
    public CacheStore redisCacheStore(StringRedisTemplate redisTemplate) {
        return new RedisCacheStore(redisTemplate);
    }

    @Bean
    @ConditionalOnProperty(name = "analytics.cache.store", havingValue = "memory", matchIfMissing = true)
    public CacheStore inMemoryCacheStore(Clock clock) {
        return new InMemoryCacheStore(clock);
    }
}
