package org.tenantwarehouse.service.query;

import org.tenantwarehouse.configuration.AnalyticsProperties;
import org.tenantwarehouse.models.dto.QueryPerformanceSummary;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the most recent query executions per tenant, bounded by
 * {@code analytics.query.performance-history-size}.
 */
@Component
public class QueryPerformanceTracker {

    private static final int SLOW_QUERY_LIMIT = 10;

    private final Map<String, Deque<Execution>> history = new ConcurrentHashMap<>();
    private final int capacity;
    private final long slowThresholdMs;
    private final Clock clock;

    public QueryPerformanceTracker(AnalyticsProperties properties, Clock clock) {
        this.capacity = Math.max(1, properties.getQuery().getPerformanceHistorySize());
        this.slowThresholdMs = properties.getQuery().getSlowQueryThreshold().toMillis();
        this.clock = clock;
    }

    public void record(String tenantId, String queryId, long executionTimeMs, boolean fromCache) {
        Deque<Execution> executions = history.computeIfAbsent(tenantId, key -> new ArrayDeque<>());
        synchronized (executions) {
            if (executions.size() >= capacity) {
                executions.removeFirst();
            }
            executions.addLast(new Execution(queryId, executionTimeMs, fromCache, clock.instant()));
        }
    }

    public QueryPerformanceSummary summary(String tenantId) {
        Deque<Execution> executions = history.get(tenantId);
        if (executions == null) {
            return QueryPerformanceSummary.empty();
        }
        List<Execution> snapshot;
        synchronized (executions) {
            snapshot = new ArrayList<>(executions);
        }
        if (snapshot.isEmpty()) {
            return QueryPerformanceSummary.empty();
        }
        Instant hourAgo = clock.instant().minus(Duration.ofHours(1));
        long hits = snapshot.stream().filter(Execution::fromCache).count();
        double average = snapshot.stream().mapToLong(Execution::executionTimeMs).average().orElse(0);
        long lastHour = snapshot.stream().filter(execution -> execution.timestamp().isAfter(hourAgo)).count();
        List<QueryPerformanceSummary.SlowQuery> slow = snapshot.stream()
                .filter(execution -> !execution.fromCache() && execution.executionTimeMs() >= slowThresholdMs)
                .sorted(Comparator.comparingLong(Execution::executionTimeMs).reversed())
                .limit(SLOW_QUERY_LIMIT)
                .map(execution -> new QueryPerformanceSummary.SlowQuery(
                        execution.queryId(), execution.executionTimeMs(), execution.timestamp()))
                .toList();
        return new QueryPerformanceSummary(snapshot.size(), average, (double) hits / snapshot.size(), lastHour, slow);
    }

    public void clear(String tenantId) {
        history.remove(tenantId);
    }

    private record Execution(String queryId, long executionTimeMs, boolean fromCache, Instant timestamp) {
    }
}
