package org.tenantwarehouse.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.tenantwarehouse.exceptions.ConfigurationException;
import org.tenantwarehouse.models.dto.AnalyticsSettings;
import org.tenantwarehouse.models.dto.TenantAnalyticsStatus;
import org.tenantwarehouse.models.pipeline.PipelineDefinition;
import org.tenantwarehouse.service.cache.AnalyticsCacheService;
import org.tenantwarehouse.service.cache.CacheKeys;
import org.tenantwarehouse.service.pipeline.DefaultPipelineFactory;
import org.tenantwarehouse.service.pipeline.PipelineRegistry;
import org.tenantwarehouse.service.query.QueryExecutor;
import org.tenantwarehouse.service.scheduling.AnalyticsScheduler;
import org.tenantwarehouse.service.warehouse.WarehouseSchemaService;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Set;

/**
 * Tenant lifecycle: provisioning the warehouse schema, the default pipelines and the tenant's
 * triggers, and tearing them down again.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TenantAnalyticsService {

    private final WarehouseSchemaService warehouseSchemaService;
    private final DefaultPipelineFactory defaultPipelineFactory;
    private final PipelineRegistry pipelineRegistry;
    private final AnalyticsScheduler analyticsScheduler;
    private final QueryExecutor queryExecutor;
    private final AnalyticsCacheService cacheService;

    /**
     * Idempotent. Re-initializing replaces the default pipelines but keeps their watermarks.
     */
    public TenantAnalyticsStatus initializeTenant(AnalyticsSettings settings) {
        String tenantId = requireTenant(settings);
        log.info("Initializing analytics for tenant {}", tenantId);
        String schema = warehouseSchemaService.ensureTenantSchema(tenantId, settings.retentionDays());
        for (PipelineDefinition pipeline : defaultPipelineFactory.create(tenantId)) {
            pipelineRegistry.register(pipeline);
        }
        return schedule(settings, schema);
    }

    /**
     * Applies new settings to an initialized tenant: retention partitions and triggers are rebuilt,
     * pipeline definitions are left alone. An unknown tenant is initialized.
     */
    public TenantAnalyticsStatus reconfigureTenant(AnalyticsSettings settings) {
        String tenantId = requireTenant(settings);
        if (pipelineRegistry.forTenant(tenantId).isEmpty()) {
            return initializeTenant(settings);
        }
        log.info("Reconfiguring analytics for tenant {}", tenantId);
        String schema = warehouseSchemaService.ensureTenantSchema(tenantId, settings.retentionDays());
        return schedule(settings, schema);
    }

    /**
     * Stops the tenant's triggers, drops its pipelines and evicts its cached results. Warehouse data
     * is kept.
     */
    public void deactivateTenant(String tenantId) {
        if (!StringUtils.hasText(tenantId)) {
            throw new ConfigurationException("Tenant id is required");
        }
        analyticsScheduler.unregisterTenant(tenantId);
        List<PipelineDefinition> removed = pipelineRegistry.removeTenant(tenantId);
        queryExecutor.invalidateTenant(tenantId);
        cacheService.evict(CacheKeys.realtimeMetrics(tenantId));
        log.info("Deactivated analytics for tenant {} ({} pipelines removed)", tenantId, removed.size());
    }

    private TenantAnalyticsStatus schedule(AnalyticsSettings settings, String schema) {
        List<PipelineDefinition> pipelines = pipelineRegistry.forTenant(settings.tenantId());
        Set<String> triggers = analyticsScheduler.registerTenant(settings, pipelines);
        return new TenantAnalyticsStatus(settings.tenantId(), schema,
                pipelines.stream().map(PipelineDefinition::getId).toList(), triggers);
    }

    private String requireTenant(AnalyticsSettings settings) {
        if (settings == null || !StringUtils.hasText(settings.tenantId())) {
            throw new ConfigurationException("Tenant id is required");
        }
        return settings.tenantId();
    }
}
