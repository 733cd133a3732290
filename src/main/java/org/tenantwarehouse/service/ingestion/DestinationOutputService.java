package org.tenantwarehouse.service.ingestion;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.tenantwarehouse.configuration.AnalyticsProperties;
import org.tenantwarehouse.exceptions.ConfigurationException;
import org.tenantwarehouse.models.enums.DestinationKind;
import org.tenantwarehouse.models.pipeline.Destination;
import org.tenantwarehouse.models.pipeline.PipelineDefinition;
import org.tenantwarehouse.service.warehouse.TenantSchemaNaming;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class DestinationOutputService {

    private final WarehouseDestinationWriter warehouseDestinationWriter;
    private final CacheDestinationWriter cacheDestinationWriter;
    private final TenantSchemaNaming schemaNaming;
    private final AnalyticsProperties properties;

    /**
     * @return the number of records written
     */
    public int write(PipelineDefinition pipeline, List<Map<String, Object>> records) {
        Destination destination = pipeline.getDestination();
        if (destination == null || destination.kind() == null) {
            throw new ConfigurationException("Pipeline " + pipeline.getId() + " has no destination");
        }
        if (destination.kind() == DestinationKind.CACHE) {
            String entityId = StringUtils.hasText(destination.cacheKey()) ? destination.cacheKey() : pipeline.getId();
            return cacheDestinationWriter.write(pipeline.getTenantId(), entityId, records, destination.effectiveCacheTtl());
        }
        if (records.isEmpty()) {
            log.info("DestinationOutputService: nothing to load for pipeline {}", pipeline.getId());
            return 0;
        }
        String schema = StringUtils.hasText(destination.schema())
                ? destination.schema()
                : schemaNaming.schemaFor(pipeline.getTenantId());
        return warehouseDestinationWriter.write(schema, destination.table(), destination.keyColumns(), records,
                properties.getEtl().getBatchSize());
    }
}
