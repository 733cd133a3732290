package org.tenantwarehouse.service.pipeline;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.tenantwarehouse.models.entity.PipelineRun;
import org.tenantwarehouse.models.pipeline.JobResult;
import org.tenantwarehouse.models.pipeline.PerformanceBreakdown;
import org.tenantwarehouse.repository.PipelineRunRepository;
import org.tenantwarehouse.utils.AppUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

import java.util.List;
import java.util.Optional;

/**
 * Run history. Failing to persist a run never fails the run itself.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineRunService {

    private final PipelineRunRepository pipelineRunRepository;

    public void record(JobResult result) {
        PipelineRun run = new PipelineRun();
        run.setPipelineRunUid(AppUtils.generateUUID());
        run.setPipelineId(result.pipelineId());
        run.setTenantId(result.tenantId());
        run.setRunStatus(result.status());
        run.setStartedAt(result.startTime());
        run.setEndedAt(result.endTime());
        run.setRecordsProcessed(result.recordsProcessed());
        run.setRecordsSuccessful(result.recordsSuccessful());
        run.setRecordsFailed(result.recordsFailed());
        run.setErrors(result.errors());
        run.setExtractMs(result.performance().extractMs());
        run.setTransformMs(result.performance().transformMs());
        run.setLoadMs(result.performance().loadMs());
        run.setTotalMs(result.performance().totalMs());
        try {
            pipelineRunRepository.save(run);
        } catch (RuntimeException exception) {
            log.warn("Could not store run history for pipeline {}: {}", result.pipelineId(), exception.getMessage(), exception);
        }
    }

    public Optional<JobResult> latest(String pipelineId) {
        try {
            return pipelineRunRepository.findFirstByPipelineIdOrderByStartedAtDesc(pipelineId).map(this::toResult);
        } catch (DataAccessException | TransactionException exception) {
            log.warn("Could not read run history for pipeline {}: {}", pipelineId, exception.getMessage());
            return Optional.empty();
        }
    }

    public List<JobResult> history(String pipelineId) {
        try {
            return pipelineRunRepository.findTop20ByPipelineIdOrderByStartedAtDesc(pipelineId).stream()
                    .map(this::toResult)
                    .toList();
        } catch (DataAccessException | TransactionException exception) {
            log.warn("Could not read run history for pipeline {}: {}", pipelineId, exception.getMessage());
            return List.of();
        }
    }

    private JobResult toResult(PipelineRun run) {
        return new JobResult(run.getPipelineId(),
                run.getTenantId(),
                run.getRunStatus(),
                run.getStartedAt(),
                run.getEndedAt(),
                valueOrZero(run.getRecordsProcessed()),
                valueOrZero(run.getRecordsSuccessful()),
                valueOrZero(run.getRecordsFailed()),
                run.getErrors(),
                new PerformanceBreakdown(valueOrZero(run.getExtractMs()), valueOrZero(run.getTransformMs()),
                        valueOrZero(run.getLoadMs()), valueOrZero(run.getTotalMs())));
    }

    private int valueOrZero(Integer value) {
        return value == null ? 0 : value;
    }

    private long valueOrZero(Long value) {
        return value == null ? 0 : value;
    }
}
