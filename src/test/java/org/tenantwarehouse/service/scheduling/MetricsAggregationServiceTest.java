package org.tenantwarehouse.service.scheduling;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.tenantwarehouse.configuration.AnalyticsProperties;
import org.tenantwarehouse.exceptions.ConfigurationException;
import org.tenantwarehouse.exceptions.QueryTimeoutException;
import org.tenantwarehouse.models.dto.AggregationJobPayload;
import org.tenantwarehouse.models.dto.MetricValue;
import org.tenantwarehouse.models.dto.QueryOptions;
import org.tenantwarehouse.models.dto.QueryResult;
import org.tenantwarehouse.models.enums.AggregationInterval;
import org.tenantwarehouse.service.cache.AnalyticsCacheService;
import org.tenantwarehouse.service.cache.CacheKeys;
import org.tenantwarehouse.service.ingestion.WarehouseDestinationWriter;
import org.tenantwarehouse.service.query.QueryExecutor;
import org.tenantwarehouse.service.warehouse.TenantSchemaNaming;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MetricsAggregationServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-15T10:20:00Z");

    @Mock
    private QueryExecutor queryExecutor;

    @Mock
    private AnalyticsCacheService cacheService;

    @Mock
    private WarehouseDestinationWriter warehouseWriter;

    private MetricsAggregationService service;

    @BeforeEach
    void setUp() {
        AnalyticsProperties properties = new AnalyticsProperties();
        service = new MetricsAggregationService(queryExecutor, cacheService, warehouseWriter,
                new TenantSchemaNaming(properties), properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void testCalculateRealTimeMetrics_FailedMetricReportsZero() {
        // Given
        when(queryExecutor.execute(eq("acme"), anyString(), anyList(), any(QueryOptions.class))).thenAnswer(invocation -> {
            String sql = invocation.getArgument(1);
            if (sql.contains("fact_inventory")) {
                throw new QueryTimeoutException("q-1", Duration.ofSeconds(30));
            }
            return new QueryResult(List.of(Map.of("value", 7)), null);
        });

        // When
        List<MetricValue> metrics = service.calculateRealTimeMetrics("acme", null);

        // Then
        assertEquals(5, metrics.size());
        MetricValue lowStock = metrics.stream().filter(m -> m.metricName().equals("low_stock_items")).findFirst().orElseThrow();
        assertEquals(0, lowStock.value());
        assertNotNull(lowStock.error());
        assertTrue(metrics.stream().filter(m -> m != lowStock).allMatch(m -> m.error() == null && m.value().equals(7)));
        verify(cacheService).set(CacheKeys.realtimeMetrics("acme"), metrics, MetricsAggregationService.REALTIME_SNAPSHOT_TTL);
    }

    @Test
    void testCalculateRealTimeMetrics_OnlyRequestedNames() {
        when(queryExecutor.execute(eq("acme"), anyString(), anyList(), any(QueryOptions.class)))
                .thenReturn(new QueryResult(List.of(), null));

        List<MetricValue> metrics = service.calculateRealTimeMetrics("acme", List.of("daily_revenue"));

        assertEquals(1, metrics.size());
        assertEquals(0, metrics.get(0).value());
        verify(queryExecutor).execute(eq("acme"), anyString(), anyList(),
                eq(QueryOptions.cached(MetricsAggregationService.REALTIME_QUERY_TTL)));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testAggregate_UpsertsRollupRows() {
        // Given
        Timestamp bucket = Timestamp.from(Instant.parse("2024-03-14T00:00:00Z"));
        when(queryExecutor.execute(eq("acme"), anyString(), anyList(), eq(QueryOptions.uncached())))
                .thenReturn(new QueryResult(List.of(Map.of("period_start", bucket, "value", 12)), null));
        when(warehouseWriter.write(eq("analytics_acme"), eq("agg_metric_rollups"), anyList(), anyList(), eq(1000)))
                .thenReturn(4);

        // When
        int written = service.aggregate(new AggregationJobPayload("acme", AggregationInterval.DAILY));

        // Then
        assertEquals(4, written);
        ArgumentCaptor<List<Map<String, Object>>> rows = ArgumentCaptor.forClass(List.class);
        verify(warehouseWriter).write(eq("analytics_acme"), eq("agg_metric_rollups"),
                eq(List.of("tenant_id", "metric_name", "interval_name", "period_start")), rows.capture(), eq(1000));
        assertEquals(4, rows.getValue().size());
        Map<String, Object> first = rows.getValue().get(0);
        assertEquals("revenue", first.get("metric_name"));
        assertEquals("daily", first.get("interval_name"));
        assertEquals(bucket.toInstant(), first.get("period_start"));
        assertEquals(NOW, first.get("updated_at"));
    }

    @Test
    void testAggregate_RealtimeRefreshesSnapshot() {
        when(queryExecutor.execute(eq("acme"), anyString(), anyList(), any(QueryOptions.class)))
                .thenReturn(new QueryResult(List.of(Map.of("value", 1)), null));

        assertEquals(5, service.aggregate(new AggregationJobPayload("acme", AggregationInterval.REALTIME)));
        verifyNoInteractions(warehouseWriter);
    }

    @Test
    void testCalculateAggregations_RejectsUnknownMetricAndEmptyWindow() {
        assertThrows(ConfigurationException.class,
                () -> service.calculateAggregations("acme", "churn", "day", NOW.minusSeconds(60), NOW));
        assertThrows(ConfigurationException.class,
                () -> service.calculateAggregations("acme", "revenue", "day", NOW, NOW));
        verifyNoInteractions(queryExecutor);
    }

    @Test
    void testLookbackStart() {
        assertEquals(Instant.parse("2024-03-15T08:00:00Z"), MetricsAggregationService.lookbackStart(AggregationInterval.HOURLY, NOW));
        assertEquals(Instant.parse("2024-03-08T00:00:00Z"), MetricsAggregationService.lookbackStart(AggregationInterval.DAILY, NOW));
        assertEquals(Instant.parse("2024-02-16T00:00:00Z"), MetricsAggregationService.lookbackStart(AggregationInterval.WEEKLY, NOW));
        assertEquals(Instant.parse("2023-12-01T00:00:00Z"), MetricsAggregationService.lookbackStart(AggregationInterval.MONTHLY, NOW));
    }
}
