package org.tenantwarehouse.service.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.tenantwarehouse.configuration.AnalyticsProperties;
import org.tenantwarehouse.exceptions.AnalyticsException;
import org.tenantwarehouse.exceptions.ConfigurationException;
import org.tenantwarehouse.exceptions.PipelineExecutionException;
import org.tenantwarehouse.models.dto.PipelineStatusResponse;
import org.tenantwarehouse.models.enums.PipelineStatus;
import org.tenantwarehouse.models.pipeline.JobResult;
import org.tenantwarehouse.models.pipeline.PerformanceBreakdown;
import org.tenantwarehouse.models.pipeline.PipelineDefinition;
import org.tenantwarehouse.service.ingestion.DestinationOutputService;
import org.tenantwarehouse.service.transform.TransformContext;
import org.tenantwarehouse.service.transform.TransformationEngine;
import org.tenantwarehouse.service.transform.TransformationResult;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Runs pipelines end to end: extract, transform, load. At most one run per pipeline id is in
 * flight; a caller arriving while a run is in flight waits for it and gets the same result or the
 * same failure.
 */
@Slf4j
@Service
public class PipelineRunner {

    private final PipelineRegistry pipelineRegistry;
    private final ExtractService extractService;
    private final TransformationEngine transformationEngine;
    private final DestinationOutputService destinationOutputService;
    private final PipelineRunService pipelineRunService;
    private final AnalyticsProperties properties;
    private final Clock clock;
    private final AsyncTaskExecutor workerExecutor;

    private final Map<String, CompletableFuture<JobResult>> inFlight = new ConcurrentHashMap<>();

    public PipelineRunner(PipelineRegistry pipelineRegistry,
                          ExtractService extractService,
                          TransformationEngine transformationEngine,
                          DestinationOutputService destinationOutputService,
                          PipelineRunService pipelineRunService,
                          AnalyticsProperties properties,
                          Clock clock,
                          @Qualifier("analyticsWorkerExecutor") AsyncTaskExecutor workerExecutor) {
        this.pipelineRegistry = pipelineRegistry;
        this.extractService = extractService;
        this.transformationEngine = transformationEngine;
        this.destinationOutputService = destinationOutputService;
        this.pipelineRunService = pipelineRunService;
        this.properties = properties;
        this.clock = clock;
        this.workerExecutor = workerExecutor;
    }

    public JobResult run(String pipelineId) {
        PipelineDefinition pipeline = pipelineRegistry.require(pipelineId);
        if (!pipeline.isEnabled()) {
            throw new ConfigurationException("Pipeline " + pipelineId + " is disabled");
        }

        CompletableFuture<JobResult> mine = new CompletableFuture<>();
        CompletableFuture<JobResult> existing = inFlight.putIfAbsent(pipelineId, mine);
        if (existing != null) {
            log.info("Pipeline {} is already running, waiting for the current run", pipelineId);
            return await(existing);
        }

        try {
            JobResult result = execute(pipeline);
            mine.complete(result);
            return result;
        } catch (RuntimeException | Error failure) {
            mine.completeExceptionally(failure);
            throw failure;
        } finally {
            inFlight.remove(pipelineId, mine);
        }
    }

    public CompletableFuture<JobResult> submit(String pipelineId) {
        return CompletableFuture.supplyAsync(() -> run(pipelineId), workerExecutor);
    }

    public boolean isRunning(String pipelineId) {
        return inFlight.containsKey(pipelineId);
    }

    public PipelineStatusResponse status(String pipelineId) {
        PipelineDefinition pipeline = pipelineRegistry.require(pipelineId);
        return new PipelineStatusResponse(pipeline.getId(),
                pipeline.getTenantId(),
                pipeline.getName(),
                pipeline.isEnabled(),
                pipeline.getStatus(),
                isRunning(pipelineId),
                pipeline.getLastRun(),
                pipeline.getSchedule() == null ? null : pipeline.getSchedule().expression(),
                pipelineRunService.latest(pipelineId).orElse(null));
    }

    private JobResult execute(PipelineDefinition pipeline) {
        Instant start = clock.instant();
        long started = System.nanoTime();
        RunProgress progress = new RunProgress();
        pipeline.markRunning();
        log.info("Starting pipeline {} for tenant {}", pipeline.getId(), pipeline.getTenantId());

        try {
            Instant watermark = pipeline.getSource().isIncremental() ? pipeline.getLastRun() : null;
            long phase = System.nanoTime();
            List<Map<String, Object>> records = extractService.extract(pipeline, watermark);
            progress.extracted = records.size();
            progress.extractMs = elapsedMillis(phase);

            phase = System.nanoTime();
            TransformationResult transformed = transformationEngine.apply(records, pipeline.getSteps(),
                    TransformContext.forTenant(pipeline.getTenantId()));
            progress.failed = transformed.failedCount();
            progress.errors.addAll(transformed.errors());
            progress.transformMs = elapsedMillis(phase);
            if (transformed.failedCount() > 0) {
                log.warn("Pipeline {} rejected {} of {} records", pipeline.getId(), transformed.failedCount(), records.size());
            }

            phase = System.nanoTime();
            progress.loaded = destinationOutputService.write(pipeline, transformed.records());
            progress.loadMs = elapsedMillis(phase);
        } catch (RuntimeException exception) {
            JobResult result = fail(pipeline, progress, exception, start, started);
            throw new PipelineExecutionException(result, exception);
        } catch (Error error) {
            fail(pipeline, progress, error, start, started);
            throw error;
        }

        pipeline.markCompleted(start);
        JobResult result = progress.toResult(pipeline, PipelineStatus.COMPLETED, start, clock.instant(), elapsedMillis(started));
        pipelineRunService.record(result);
        log.info("Pipeline {} completed: {} extracted, {} loaded, {} failed in {} ms", pipeline.getId(),
                result.recordsProcessed(), result.recordsSuccessful(), result.recordsFailed(), result.performance().totalMs());
        return result;
    }

    private JobResult fail(PipelineDefinition pipeline, RunProgress progress, Throwable failure, Instant start, long started) {
        pipeline.markFailed();
        progress.addError(failure.getMessage() == null ? failure.getClass().getSimpleName() : failure.getMessage());
        JobResult result = progress.toResult(pipeline, PipelineStatus.FAILED, start, clock.instant(), elapsedMillis(started));
        pipelineRunService.record(result);
        log.error("Pipeline {} failed: {}", pipeline.getId(), failure.getMessage(), failure);
        return result;
    }

    private JobResult await(CompletableFuture<JobResult> running) {
        try {
            return running.join();
        } catch (CompletionException exception) {
            Throwable cause = exception.getCause();
            if (cause instanceof AnalyticsException analyticsException) {
                throw analyticsException;
            }
            throw new AnalyticsException("Pipeline run failed: " + cause.getMessage(), cause);
        } catch (CancellationException exception) {
            throw new AnalyticsException("Pipeline run was cancelled", exception);
        }
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private final class RunProgress {
        private int extracted;
        private int loaded;
        private int failed;
        private long extractMs;
        private long transformMs;
        private long loadMs;
        private final List<String> errors = new ArrayList<>();

        private void addError(String error) {
            // the fatal error always survives the cap
            if (!errors.isEmpty() && errors.size() >= properties.getEtl().getMaxErrorMessages()) {
                errors.set(errors.size() - 1, error);
            } else {
                errors.add(error);
            }
        }

        private JobResult toResult(PipelineDefinition pipeline, PipelineStatus status, Instant start, Instant end, long totalMs) {
            return new JobResult(pipeline.getId(),
                    pipeline.getTenantId(),
                    status,
                    start,
                    end,
                    extracted,
                    loaded,
                    failed,
                    errors,
                    new PerformanceBreakdown(extractMs, transformMs, loadMs, totalMs));
        }
    }
}
