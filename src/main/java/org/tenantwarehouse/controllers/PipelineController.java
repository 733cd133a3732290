package org.tenantwarehouse.controllers;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.tenantwarehouse.models.dto.PipelineStatusResponse;
import org.tenantwarehouse.models.pipeline.JobResult;
import org.tenantwarehouse.models.pipeline.PipelineDefinition;
import org.tenantwarehouse.service.pipeline.PipelineRegistry;
import org.tenantwarehouse.service.pipeline.PipelineRunService;
import org.tenantwarehouse.service.pipeline.PipelineRunner;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class PipelineController {

    private final PipelineRunner pipelineRunner;
    private final PipelineRegistry pipelineRegistry;
    private final PipelineRunService pipelineRunService;

    @PostMapping("/pipelines/{pipelineId}/runs")
    public ResponseEntity<Map<String, Object>> runPipeline(@PathVariable("pipelineId") String pipelineId) {
        log.info("Received run request for pipeline: {}", pipelineId);

        try {
            JobResult result = pipelineRunner.run(pipelineId);

            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("result", result);
            return ResponseEntity.ok(response);

        } catch (Exception e) {
            log.error("Error during pipeline run: {}", e.getMessage(), e);
            return ErrorResponses.from(e);
        }
    }

    @GetMapping("/pipelines/{pipelineId}")
    public ResponseEntity<?> getPipeline(@PathVariable("pipelineId") String pipelineId) {
        try {
            PipelineStatusResponse status = pipelineRunner.status(pipelineId);
            return ResponseEntity.ok(status);
        } catch (Exception e) {
            log.error("Error reading pipeline {}: {}", pipelineId, e.getMessage(), e);
            return ErrorResponses.from(e);
        }
    }

    @GetMapping("/pipelines/{pipelineId}/runs")
    public ResponseEntity<?> listRuns(@PathVariable("pipelineId") String pipelineId) {
        try {
            pipelineRegistry.require(pipelineId);
            List<JobResult> history = pipelineRunService.history(pipelineId);
            return ResponseEntity.ok(history);
        } catch (Exception e) {
            log.error("Error reading run history of {}: {}", pipelineId, e.getMessage(), e);
            return ErrorResponses.from(e);
        }
    }

    @GetMapping("/tenants/{tenantId}/pipelines")
    public ResponseEntity<List<PipelineStatusResponse>> listTenantPipelines(@PathVariable("tenantId") String tenantId) {
        List<PipelineStatusResponse> pipelines = pipelineRegistry.forTenant(tenantId).stream()
                .map(PipelineDefinition::getId)
                .map(pipelineRunner::status)
                .toList();
        return ResponseEntity.ok(pipelines);
    }
}
