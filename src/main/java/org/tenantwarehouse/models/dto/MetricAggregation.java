package org.tenantwarehouse.models.dto;

import java.time.Instant;

/**
 * One {@code date_trunc} bucket of a metric; {@code period} is the truncation field (hour, day, week, ...).
 */
public record MetricAggregation(String metricName,
                                String period,
                                Instant periodStart,
                                Number value) {
}
