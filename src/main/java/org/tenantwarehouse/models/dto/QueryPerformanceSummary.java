package org.tenantwarehouse.models.dto;

import java.time.Instant;
import java.util.List;

public record QueryPerformanceSummary(long totalQueries,
                                      double averageExecutionTimeMs,
                                      double cacheHitRate,
                                      long queriesLastHour,
                                      List<SlowQuery> slowQueries) {

    public record SlowQuery(String queryId, long executionTimeMs, Instant timestamp) {
    }

    public static QueryPerformanceSummary empty() {
        return new QueryPerformanceSummary(0, 0, 0, 0, List.of());
    }
}
