package org.tenantwarehouse.models.dto;

import org.tenantwarehouse.models.enums.PipelineStatus;
import org.tenantwarehouse.models.pipeline.JobResult;

import java.time.Instant;

public record PipelineStatusResponse(
        String pipelineId,
        String tenantId,
        String name,
        boolean enabled,
        PipelineStatus status,
        boolean running,
        Instant lastRun,
        String schedule,
        JobResult lastResult
) {
}
