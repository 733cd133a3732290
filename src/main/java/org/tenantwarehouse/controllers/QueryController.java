package org.tenantwarehouse.controllers;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.tenantwarehouse.models.dto.QueryOptions;
import org.tenantwarehouse.models.dto.QueryPerformanceSummary;
import org.tenantwarehouse.models.dto.QueryRequest;
import org.tenantwarehouse.models.dto.QueryResult;
import org.tenantwarehouse.models.dto.QueryValidationResult;
import org.tenantwarehouse.service.query.QueryExecutor;
import org.tenantwarehouse.service.query.QueryPerformanceTracker;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;

@Slf4j
@RestController
@RequestMapping("/api/tenants/{tenantId}/queries")
@RequiredArgsConstructor
public class QueryController {

    private final QueryExecutor queryExecutor;
    private final QueryPerformanceTracker performanceTracker;

    @PostMapping
    public ResponseEntity<?> execute(@PathVariable("tenantId") String tenantId,
                                     @Valid @RequestBody QueryRequest request) {
        try {
            QueryOptions options = new QueryOptions(request.isUseCache(),
                    request.getCacheTtlSeconds() == null ? null : Duration.ofSeconds(request.getCacheTtlSeconds()),
                    request.getTimeoutMillis() == null ? null : Duration.ofMillis(request.getTimeoutMillis()));
            QueryResult result = queryExecutor.execute(tenantId, request.getSql(), request.getParameters(), options);
            return ResponseEntity.ok(result);
        } catch (Exception e) {
            log.error("Error executing query for tenant {}: {}", tenantId, e.getMessage(), e);
            return ErrorResponses.from(e);
        }
    }

    @PostMapping("/validate")
    public ResponseEntity<QueryValidationResult> validate(@PathVariable("tenantId") String tenantId,
                                                          @Valid @RequestBody QueryRequest request) {
        return ResponseEntity.ok(queryExecutor.validate(request.getSql()));
    }

    @GetMapping("/performance")
    public ResponseEntity<QueryPerformanceSummary> performance(@PathVariable("tenantId") String tenantId) {
        return ResponseEntity.ok(performanceTracker.summary(tenantId));
    }
}
