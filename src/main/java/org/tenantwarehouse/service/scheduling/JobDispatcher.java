package org.tenantwarehouse.service.scheduling;

import lombok.extern.slf4j.Slf4j;
import org.tenantwarehouse.exceptions.PipelineExecutionException;
import org.tenantwarehouse.models.dto.AggregationJobPayload;
import org.tenantwarehouse.models.dto.EtlJobPayload;
import org.tenantwarehouse.service.pipeline.PipelineRunner;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

/**
 * Hands scheduled work to the worker pool. Nothing thrown by a job reaches the trigger thread.
 */
@Slf4j
@Component
public class JobDispatcher {

    private final PipelineRunner pipelineRunner;
    private final MetricsAggregationService metricsAggregationService;
    private final AsyncTaskExecutor workerExecutor;

    public JobDispatcher(PipelineRunner pipelineRunner,
                         MetricsAggregationService metricsAggregationService,
                         @Qualifier("analyticsWorkerExecutor") AsyncTaskExecutor workerExecutor) {
        this.pipelineRunner = pipelineRunner;
        this.metricsAggregationService = metricsAggregationService;
        this.workerExecutor = workerExecutor;
    }

    public void dispatch(EtlJobPayload payload) {
        enqueue("pipeline " + payload.pipelineId(), () -> runPipeline(payload));
    }

    public void dispatch(AggregationJobPayload payload) {
        enqueue(payload.interval().label() + " aggregation for tenant " + payload.tenantId(), () -> runAggregation(payload));
    }

    void runPipeline(EtlJobPayload payload) {
        try {
            pipelineRunner.run(payload.pipelineId());
        } catch (PipelineExecutionException exception) {
            // already logged with its result by the runner
            log.debug("Scheduled run of pipeline {} failed", payload.pipelineId());
        } catch (RuntimeException exception) {
            log.error("Scheduled run of pipeline {} could not start: {}", payload.pipelineId(), exception.getMessage(), exception);
        }
    }

    void runAggregation(AggregationJobPayload payload) {
        try {
            metricsAggregationService.aggregate(payload);
        } catch (RuntimeException exception) {
            log.error("{} aggregation for tenant {} failed: {}", payload.interval().label(), payload.tenantId(),
                    exception.getMessage(), exception);
        }
    }

    private void enqueue(String description, Runnable job) {
        try {
            workerExecutor.execute(job);
        } catch (TaskRejectedException exception) {
            log.error("Worker pool rejected {}: {}", description, exception.getMessage());
        }
    }
}
