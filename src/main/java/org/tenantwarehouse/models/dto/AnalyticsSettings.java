package org.tenantwarehouse.models.dto;

import org.tenantwarehouse.models.enums.AggregationInterval;

import java.util.List;
import java.util.Set;

/**
 * Read-only view of a tenant's analytics configuration, as consumed when building triggers and
 * partitions.
 */
public record AnalyticsSettings(String tenantId,
                                int retentionDays,
                                Set<AggregationInterval> aggregationIntervals,
                                List<String> enabledMetrics) {

    public static final int DEFAULT_RETENTION_DAYS = 365;

    public AnalyticsSettings {
        retentionDays = retentionDays <= 0 ? DEFAULT_RETENTION_DAYS : retentionDays;
        aggregationIntervals = aggregationIntervals == null ? Set.of() : Set.copyOf(aggregationIntervals);
        enabledMetrics = enabledMetrics == null ? List.of() : List.copyOf(enabledMetrics);
    }
}
