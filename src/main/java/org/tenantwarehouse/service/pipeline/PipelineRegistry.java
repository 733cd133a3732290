package org.tenantwarehouse.service.pipeline;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.tenantwarehouse.exceptions.ConfigurationException;
import org.tenantwarehouse.exceptions.PipelineNotFoundException;
import org.tenantwarehouse.models.enums.DestinationKind;
import org.tenantwarehouse.models.pipeline.Destination;
import org.tenantwarehouse.models.pipeline.PipelineDefinition;
import org.tenantwarehouse.service.scheduling.CronExpressions;
import org.tenantwarehouse.service.transform.TransformationEngine;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The live pipeline definitions, one per pipeline id. Definitions are checked on registration, so
 * anything the runner finds here is well-formed apart from enrichment datasets, which are
 * resolved at run time.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineRegistry {

    private final TransformationEngine transformationEngine;

    private final Map<String, PipelineDefinition> pipelines = new ConcurrentHashMap<>();

    public PipelineDefinition register(PipelineDefinition definition) {
        validate(definition);
        PipelineDefinition previous = pipelines.get(definition.getId());
        if (previous != null && !previous.getTenantId().equals(definition.getTenantId())) {
            throw new ConfigurationException("Pipeline id " + definition.getId() + " already belongs to another tenant");
        }
        definition.inheritLastRun(previous);
        pipelines.put(definition.getId(), definition);
        log.info("Registered pipeline {} ({}) for tenant {}", definition.getId(), definition.getName(), definition.getTenantId());
        return definition;
    }

    public Optional<PipelineDefinition> find(String pipelineId) {
        return Optional.ofNullable(pipelines.get(pipelineId));
    }

    public PipelineDefinition require(String pipelineId) {
        return find(pipelineId).orElseThrow(() -> new PipelineNotFoundException(pipelineId));
    }

    public List<PipelineDefinition> forTenant(String tenantId) {
        return pipelines.values().stream()
                .filter(pipeline -> pipeline.getTenantId().equals(tenantId))
                .sorted(Comparator.comparing(PipelineDefinition::getId))
                .toList();
    }

    public List<PipelineDefinition> removeTenant(String tenantId) {
        List<PipelineDefinition> removed = forTenant(tenantId);
        removed.forEach(pipeline -> pipelines.remove(pipeline.getId(), pipeline));
        if (!removed.isEmpty()) {
            log.info("Removed {} pipelines of tenant {}", removed.size(), tenantId);
        }
        return removed;
    }

    private void validate(PipelineDefinition definition) {
        if (definition == null || !StringUtils.hasText(definition.getId())) {
            throw new ConfigurationException("Pipeline id is required");
        }
        String id = definition.getId();
        if (!StringUtils.hasText(definition.getTenantId())) {
            throw new ConfigurationException("Pipeline " + id + " has no tenant");
        }
        if (definition.getSource() == null || definition.getSource().kind() == null) {
            throw new ConfigurationException("Pipeline " + id + " has no source");
        }
        Destination destination = definition.getDestination();
        if (destination == null || destination.kind() == null) {
            throw new ConfigurationException("Pipeline " + id + " has no destination");
        }
        if (destination.kind() == DestinationKind.WAREHOUSE
                && (!StringUtils.hasText(destination.table()) || destination.keyColumns().isEmpty())) {
            throw new ConfigurationException("Pipeline " + id + " warehouse destination needs a table and key columns");
        }
        if (definition.getSchedule() != null) {
            CronExpressions.normalize(definition.getSchedule().expression());
        }
        transformationEngine.validateConfiguration(definition.getSteps());
    }
}
