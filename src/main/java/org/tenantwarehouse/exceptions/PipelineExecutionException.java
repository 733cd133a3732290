package org.tenantwarehouse.exceptions;

import lombok.Getter;
import org.tenantwarehouse.models.pipeline.JobResult;

/**
 * A pipeline run failed. Carries the failed run's result so callers still see counts and errors.
 */
@Getter
public class PipelineExecutionException extends AnalyticsException {

    private final transient JobResult jobResult;

    public PipelineExecutionException(JobResult jobResult, Throwable cause) {
        super("Pipeline " + jobResult.pipelineId() + " failed: " + cause.getMessage(), cause);
        this.jobResult = jobResult;
    }
}
