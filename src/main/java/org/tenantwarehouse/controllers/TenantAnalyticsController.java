package org.tenantwarehouse.controllers;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.tenantwarehouse.models.dto.AnalyticsSettingsRequest;
import org.tenantwarehouse.models.dto.MetricValue;
import org.tenantwarehouse.models.dto.TenantAnalyticsStatus;
import org.tenantwarehouse.service.TenantAnalyticsService;
import org.tenantwarehouse.service.scheduling.MetricsAggregationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/tenants/{tenantId}")
@RequiredArgsConstructor
public class TenantAnalyticsController {

    private final TenantAnalyticsService tenantAnalyticsService;
    private final MetricsAggregationService metricsAggregationService;

    @PutMapping("/analytics")
    public ResponseEntity<?> configure(@PathVariable("tenantId") String tenantId,
                                       @Valid @RequestBody AnalyticsSettingsRequest request) {
        log.info("Received analytics configuration for tenant: {}", tenantId);
        try {
            TenantAnalyticsStatus status = tenantAnalyticsService.reconfigureTenant(request.toSettings(tenantId));
            return ResponseEntity.ok(status);
        } catch (Exception e) {
            log.error("Error configuring analytics for tenant {}: {}", tenantId, e.getMessage(), e);
            return ErrorResponses.from(e);
        }
    }

    @DeleteMapping("/analytics")
    public ResponseEntity<Map<String, Object>> deactivate(@PathVariable("tenantId") String tenantId) {
        try {
            tenantAnalyticsService.deactivateTenant(tenantId);
            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("tenantId", tenantId);
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            log.error("Error deactivating analytics for tenant {}: {}", tenantId, e.getMessage(), e);
            return ErrorResponses.from(e);
        }
    }

    @GetMapping("/metrics/realtime")
    public ResponseEntity<?> realtimeMetrics(@PathVariable("tenantId") String tenantId,
                                             @RequestParam(value = "metrics", required = false) List<String> metrics,
                                             @RequestParam(value = "refresh", defaultValue = "false") boolean refresh) {
        try {
            List<MetricValue> values = refresh || (metrics != null && !metrics.isEmpty())
                    ? metricsAggregationService.calculateRealTimeMetrics(tenantId, metrics)
                    : metricsAggregationService.currentMetrics(tenantId);
            return ResponseEntity.ok(values);
        } catch (Exception e) {
            log.error("Error calculating real-time metrics for tenant {}: {}", tenantId, e.getMessage(), e);
            return ErrorResponses.from(e);
        }
    }
}
