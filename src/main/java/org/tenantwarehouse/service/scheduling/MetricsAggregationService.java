package org.tenantwarehouse.service.scheduling;

import com.fasterxml.jackson.core.type.TypeReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.tenantwarehouse.configuration.AnalyticsProperties;
import org.tenantwarehouse.exceptions.AnalyticsException;
import org.tenantwarehouse.exceptions.ConfigurationException;
import org.tenantwarehouse.models.dto.AggregationJobPayload;
import org.tenantwarehouse.models.dto.MetricAggregation;
import org.tenantwarehouse.models.dto.MetricValue;
import org.tenantwarehouse.models.dto.QueryOptions;
import org.tenantwarehouse.models.dto.QueryResult;
import org.tenantwarehouse.models.enums.AggregationInterval;
import org.tenantwarehouse.service.cache.AnalyticsCacheService;
import org.tenantwarehouse.service.cache.CacheKeys;
import org.tenantwarehouse.service.ingestion.WarehouseDestinationWriter;
import org.tenantwarehouse.service.query.QueryExecutor;
import org.tenantwarehouse.service.query.SafeQueryBuilder;
import org.tenantwarehouse.service.warehouse.TenantSchemaNaming;
import org.tenantwarehouse.utils.NumericValues;
import org.tenantwarehouse.utils.TemporalValues;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Real-time metric snapshots and periodic metric rollups over a tenant's warehouse.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MetricsAggregationService {

    static final Duration REALTIME_QUERY_TTL = Duration.ofMinutes(5);
    static final Duration REALTIME_SNAPSHOT_TTL = Duration.ofMinutes(5);
    static final Duration AGGREGATION_QUERY_TTL = Duration.ofMinutes(30);

    private static final String ROLLUP_TABLE = "agg_metric_rollups";
    private static final List<String> ROLLUP_KEYS = List.of("tenant_id", "metric_name", "interval_name", "period_start");
    private static final TypeReference<List<MetricValue>> SNAPSHOT = new TypeReference<>() {
    };

    private record RealtimeMetric(String name, String sql) {
    }

    private record RollupMetric(String name, String table, String dateColumn, String function, String column) {
    }

    // Each query runs with the tenant schema on the search path.
    private static final List<RealtimeMetric> REALTIME_METRICS = List.of(
            new RealtimeMetric("daily_revenue",
                    "SELECT COALESCE(SUM(total_amount), 0) AS value FROM fact_transactions "
                            + "WHERE transaction_date = CURRENT_DATE"),
            new RealtimeMetric("daily_transactions",
                    "SELECT COUNT(*) AS value FROM fact_transactions WHERE transaction_date = CURRENT_DATE"),
            new RealtimeMetric("average_order_value",
                    "SELECT COALESCE(AVG(total_amount), 0) AS value FROM fact_transactions "
                            + "WHERE transaction_date = CURRENT_DATE"),
            new RealtimeMetric("active_customers_today",
                    "SELECT COUNT(DISTINCT customer_id) AS value FROM fact_transactions "
                            + "WHERE transaction_date = CURRENT_DATE AND customer_id IS NOT NULL"),
            new RealtimeMetric("low_stock_items",
                    "SELECT COUNT(*) AS value FROM fact_inventory fi "
                            + "JOIN dim_product dp ON fi.product_id = dp.product_id "
                            + "WHERE fi.snapshot_date = (SELECT MAX(snapshot_date) FROM fact_inventory) "
                            + "AND fi.ending_quantity <= 10 AND dp.is_active = true"));

    private static final Map<String, RollupMetric> ROLLUP_METRICS = rollupMetrics(
            new RollupMetric("revenue", "fact_transactions", "transaction_date", "SUM", "total_amount"),
            new RollupMetric("transaction_count", "fact_transactions", "transaction_date", "COUNT", "*"),
            new RollupMetric("average_order_value", "fact_transactions", "transaction_date", "AVG", "total_amount"),
            new RollupMetric("customer_count", "fact_customers", "snapshot_date", "COUNT DISTINCT", "customer_id"));

    private final QueryExecutor queryExecutor;
    private final AnalyticsCacheService cacheService;
    private final WarehouseDestinationWriter warehouseWriter;
    private final TenantSchemaNaming schemaNaming;
    private final AnalyticsProperties properties;
    private final Clock clock;

    /**
     * Computes the named metrics (all when {@code metricNames} is null or empty). A metric whose
     * query fails is reported as 0 with the failure in {@link MetricValue#error()}.
     */
    public List<MetricValue> calculateRealTimeMetrics(String tenantId, List<String> metricNames) {
        log.info("Calculating real-time metrics for tenant {}", tenantId);
        List<MetricValue> metrics = new ArrayList<>();
        for (RealtimeMetric metric : REALTIME_METRICS) {
            if (metricNames != null && !metricNames.isEmpty() && !metricNames.contains(metric.name())) {
                continue;
            }
            Instant now = clock.instant();
            Map<String, Object> dimensions = Map.of("tenant_id", tenantId);
            try {
                QueryResult result = queryExecutor.execute(tenantId, metric.sql(), List.of(),
                        QueryOptions.cached(REALTIME_QUERY_TTL));
                Number value = result.rows().isEmpty() ? 0 : numberOrZero(result.rows().get(0).get("value"));
                metrics.add(new MetricValue(metric.name(), value, now, dimensions, null));
            } catch (AnalyticsException exception) {
                log.warn("Failed to calculate metric {} for tenant {}: {}", metric.name(), tenantId, exception.getMessage());
                metrics.add(new MetricValue(metric.name(), 0, now, dimensions, exception.getMessage()));
            }
        }
        cacheService.set(CacheKeys.realtimeMetrics(tenantId), metrics, REALTIME_SNAPSHOT_TTL);
        return metrics;
    }

    /**
     * The last snapshot if it is still cached, otherwise a fresh calculation of every metric.
     */
    public List<MetricValue> currentMetrics(String tenantId) {
        Optional<List<MetricValue>> cached = cacheService.get(CacheKeys.realtimeMetrics(tenantId), SNAPSHOT);
        return cached.orElseGet(() -> calculateRealTimeMetrics(tenantId, null));
    }

    public List<MetricAggregation> calculateAggregations(String tenantId,
                                                         String metricName,
                                                         String period,
                                                         Instant start,
                                                         Instant end) {
        return rollup(tenantId, metricName, period, start, end, QueryOptions.cached(AGGREGATION_QUERY_TTL));
    }

    /**
     * Recomputes the rollups of every metric for the interval's lookback window and upserts them
     * into {@code agg_metric_rollups}. The realtime interval refreshes the metric snapshot instead.
     */
    public int aggregate(AggregationJobPayload payload) {
        String tenantId = payload.tenantId();
        AggregationInterval interval = payload.interval();
        if (interval == AggregationInterval.REALTIME) {
            return calculateRealTimeMetrics(tenantId, null).size();
        }

        Instant end = clock.instant();
        Instant start = lookbackStart(interval, end);
        Instant updatedAt = end;
        List<Map<String, Object>> rows = new ArrayList<>();
        for (RollupMetric metric : ROLLUP_METRICS.values()) {
            for (MetricAggregation aggregation : rollup(tenantId, metric.name(), interval.datePart(), start, end,
                    QueryOptions.uncached())) {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("tenant_id", tenantId);
                row.put("metric_name", aggregation.metricName());
                row.put("interval_name", interval.label());
                row.put("period_start", aggregation.periodStart());
                row.put("metric_value", aggregation.value());
                row.put("updated_at", updatedAt);
                rows.add(row);
            }
        }
        int written = warehouseWriter.write(schemaNaming.schemaFor(tenantId), ROLLUP_TABLE, ROLLUP_KEYS, rows,
                properties.getEtl().getBatchSize());
        log.info("Stored {} {} metric rollups for tenant {}", written, interval.label(), tenantId);
        return written;
    }

    static Instant lookbackStart(AggregationInterval interval, Instant end) {
        return switch (interval) {
            case HOURLY -> end.truncatedTo(ChronoUnit.HOURS).minus(2, ChronoUnit.HOURS);
            case DAILY -> end.truncatedTo(ChronoUnit.DAYS).minus(7, ChronoUnit.DAYS);
            case WEEKLY -> end.truncatedTo(ChronoUnit.DAYS).minus(28, ChronoUnit.DAYS);
            case MONTHLY -> end.atZone(ZoneOffset.UTC).toLocalDate().withDayOfMonth(1).minusMonths(3)
                    .atStartOfDay(ZoneOffset.UTC).toInstant();
            case REALTIME -> end;
        };
    }

    private List<MetricAggregation> rollup(String tenantId,
                                           String metricName,
                                           String period,
                                           Instant start,
                                           Instant end,
                                           QueryOptions options) {
        RollupMetric metric = ROLLUP_METRICS.get(metricName);
        if (metric == null) {
            throw new ConfigurationException("Unknown metric: " + metricName);
        }
        if (start == null || end == null || !start.isBefore(end)) {
            throw new ConfigurationException("Aggregation window must have a start before its end");
        }

        SafeQueryBuilder builder = SafeQueryBuilder.select().dateTrunc(period, metric.dateColumn(), "period_start");
        if ("COUNT DISTINCT".equals(metric.function())) {
            builder.countDistinct(metric.column(), "value");
        } else {
            builder.aggregate(metric.function(), metric.column(), "value");
        }
        SafeQueryBuilder.BuiltQuery query = builder
                .from(metric.table())
                .where(metric.dateColumn(), ">=", Timestamp.from(start))
                .where(metric.dateColumn(), "<", Timestamp.from(end))
                .orderBy("period_start")
                .build();

        QueryResult result = queryExecutor.execute(tenantId, query.sql(), query.params(), options);
        List<MetricAggregation> aggregations = new ArrayList<>();
        for (Map<String, Object> row : result.rows()) {
            Optional<Instant> periodStart = TemporalValues.toInstant(row.get("period_start"));
            if (periodStart.isEmpty()) {
                continue;
            }
            aggregations.add(new MetricAggregation(metricName, period, periodStart.get(), numberOrZero(row.get("value"))));
        }
        log.debug("Metric {} for tenant {}: {} {} buckets", metricName, tenantId, aggregations.size(), period);
        return aggregations;
    }

    private static Number numberOrZero(Object value) {
        if (value instanceof Number number) {
            return number;
        }
        return NumericValues.toBigDecimal(value).orElse(BigDecimal.ZERO);
    }

    private static Map<String, RollupMetric> rollupMetrics(RollupMetric... metrics) {
        Map<String, RollupMetric> byName = new LinkedHashMap<>();
        for (RollupMetric metric : metrics) {
            byName.put(metric.name(), metric);
        }
        return byName;
    }
}
