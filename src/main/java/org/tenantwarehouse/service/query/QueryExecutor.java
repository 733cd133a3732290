package org.tenantwarehouse.service.query;

import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;
import org.tenantwarehouse.configuration.AnalyticsProperties;
import org.tenantwarehouse.exceptions.AnalyticsException;
import org.tenantwarehouse.exceptions.ConfigurationException;
import org.tenantwarehouse.exceptions.QueryExecutionException;
import org.tenantwarehouse.exceptions.QueryTimeoutException;
import org.tenantwarehouse.models.dto.QueryMetadata;
import org.tenantwarehouse.models.dto.QueryOptions;
import org.tenantwarehouse.models.dto.QueryResult;
import org.tenantwarehouse.models.dto.QueryValidationResult;
import org.tenantwarehouse.service.cache.AnalyticsCacheService;
import org.tenantwarehouse.service.cache.CacheKeys;
import org.tenantwarehouse.service.warehouse.TenantSchemaNaming;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs analytical SQL against a tenant's warehouse schema with result caching and a wall-clock
 * timeout. A timed-out query never returns rows.
 */
@Slf4j
@Service
public class QueryExecutor {

    private static final TypeReference<CachedRows> CACHED_ROWS = new TypeReference<>() {
    };

    private final WarehouseQueryRunner queryRunner;
    private final AnalyticsCacheService cacheService;
    private final QueryIdGenerator queryIdGenerator;
    private final QueryPerformanceTracker performanceTracker;
    private final QueryValidator queryValidator;
    private final TenantSchemaNaming schemaNaming;
    private final AnalyticsProperties properties;
    private final AsyncTaskExecutor queryTaskExecutor;

    public QueryExecutor(WarehouseQueryRunner queryRunner,
                         AnalyticsCacheService cacheService,
                         QueryIdGenerator queryIdGenerator,
                         QueryPerformanceTracker performanceTracker,
                         QueryValidator queryValidator,
                         TenantSchemaNaming schemaNaming,
                         AnalyticsProperties properties,
                         @Qualifier("analyticsQueryExecutor") AsyncTaskExecutor queryTaskExecutor) {
        this.queryRunner = queryRunner;
        this.cacheService = cacheService;
        this.queryIdGenerator = queryIdGenerator;
        this.performanceTracker = performanceTracker;
        this.queryValidator = queryValidator;
        this.schemaNaming = schemaNaming;
        this.properties = properties;
        this.queryTaskExecutor = queryTaskExecutor;
    }

    public QueryResult execute(String tenantId, String sql, List<Object> params, QueryOptions options) {
        if (!StringUtils.hasText(sql)) {
            throw new ConfigurationException("Query SQL is required");
        }
        QueryOptions effective = options == null ? QueryOptions.defaults() : options;
        List<Object> boundParams = params == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
        rejectUnsafe(sql);

        String schema = schemaNaming.schemaFor(tenantId);
        String queryId = queryIdGenerator.generate(sql, boundParams);
        String cacheKey = CacheKeys.analyticsQuery(tenantId, queryId);
        long started = System.nanoTime();

        if (effective.useCache()) {
            Optional<List<Map<String, Object>>> cached = readCached(cacheKey);
            if (cached.isPresent()) {
                long elapsed = elapsedMillis(started);
                performanceTracker.record(tenantId, queryId, elapsed, true);
                log.debug("Query {} for tenant {} served from cache ({} rows)", queryId, tenantId, cached.get().size());
                return new QueryResult(cached.get(), new QueryMetadata(queryId, elapsed, cached.get().size(), true));
            }
        }

        Duration timeout = effective.timeout() == null ? properties.getQuery().getDefaultTimeout() : effective.timeout();
        List<Map<String, Object>> rows = runWithTimeout(schema, sql, boundParams, queryId, timeout);
        long elapsed = elapsedMillis(started);

        if (effective.useCache() && !rows.isEmpty()) {
            Duration ttl = effective.cacheTtl() == null ? properties.getQuery().getDefaultCacheTtl() : effective.cacheTtl();
            Optional<CachedRows> cacheable = CachedRows.encode(rows);
            if (cacheable.isPresent()) {
                cacheService.set(cacheKey, cacheable.get(), ttl);
            } else {
                log.debug("Query {} returned column types that cannot be cached exactly, not caching", queryId);
            }
        }
        performanceTracker.record(tenantId, queryId, elapsed, false);
        log.debug("Query {} for tenant {} executed in {} ms ({} rows)", queryId, tenantId, elapsed, rows.size());
        if (elapsed >= properties.getQuery().getSlowQueryThreshold().toMillis()) {
            log.info("Slow query {} for tenant {}: {} ms", queryId, tenantId, elapsed);
        }
        return new QueryResult(rows, new QueryMetadata(queryId, elapsed, rows.size(), false));
    }

    public QueryResult execute(String tenantId, String sql, List<Object> params) {
        return execute(tenantId, sql, params, QueryOptions.defaults());
    }

    public QueryValidationResult validate(String sql) {
        return queryValidator.validate(sql);
    }

    public long invalidateTenant(String tenantId) {
        long evicted = cacheService.evictTenant(CacheKeys.ANALYTICS_QUERY, tenantId);
        log.info("Evicted {} cached query results for tenant {}", evicted, tenantId);
        return evicted;
    }

    private Optional<List<Map<String, Object>>> readCached(String cacheKey) {
        Optional<CachedRows> cached = cacheService.get(cacheKey, CACHED_ROWS);
        if (cached.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(cached.get().restore());
        } catch (IllegalArgumentException exception) {
            log.warn("Discarding malformed cached result {}: {}", cacheKey, exception.getMessage());
            cacheService.evict(cacheKey);
            return Optional.empty();
        }
    }

    private List<Map<String, Object>> runWithTimeout(String schema,
                                                     String sql,
                                                     List<Object> params,
                                                     String queryId,
                                                     Duration timeout) {
        Future<List<Map<String, Object>>> future;
        try {
            future = queryTaskExecutor.submit(() -> queryRunner.query(schema, sql, params, timeout));
        } catch (TaskRejectedException exception) {
            log.warn("Query pool is saturated, rejecting query {} in {}", queryId, schema);
            throw new QueryExecutionException("Query " + queryId + " rejected: query pool is saturated", exception);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException exception) {
            future.cancel(true);
            log.warn("Query {} in {} exceeded {} ms and was cancelled", queryId, schema, timeout.toMillis());
            throw new QueryTimeoutException(queryId, timeout);
        } catch (InterruptedException exception) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new QueryExecutionException("Interrupted while waiting for query " + queryId, exception);
        } catch (ExecutionException exception) {
            Throwable cause = exception.getCause();
            if (cause instanceof AnalyticsException analyticsException) {
                throw analyticsException;
            }
            if (cause instanceof DataAccessException dataAccessException) {
                throw new QueryExecutionException("Query " + queryId + " failed: "
                        + dataAccessException.getMostSpecificCause().getMessage(), dataAccessException);
            }
            throw new QueryExecutionException("Query " + queryId + " failed: " + cause.getMessage(), cause);
        }
    }

    private void rejectUnsafe(String sql) {
        if (!properties.getQuery().isRejectUnsafeSql()) {
            return;
        }
        QueryValidationResult validation = queryValidator.validate(sql);
        if (!validation.securityIssues().isEmpty()) {
            throw new ConfigurationException("Query rejected: " + String.join("; ", validation.securityIssues()));
        }
    }

    private long elapsedMillis(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
