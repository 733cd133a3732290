package org.tenantwarehouse.models.pipeline;

import org.tenantwarehouse.models.enums.PipelineStatus;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one pipeline run. {@code recordsProcessed} counts extracted records,
 * {@code recordsSuccessful} counts loaded records and {@code recordsFailed} counts records rejected
 * during transformation.
 */
public record JobResult(String pipelineId,
                        String tenantId,
                        PipelineStatus status,
                        Instant startTime,
                        Instant endTime,
                        int recordsProcessed,
                        int recordsSuccessful,
                        int recordsFailed,
                        List<String> errors,
                        PerformanceBreakdown performance) {

    public JobResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        performance = performance == null ? PerformanceBreakdown.empty() : performance;
    }

    public boolean succeeded() {
        return status == PipelineStatus.COMPLETED;
    }
}
