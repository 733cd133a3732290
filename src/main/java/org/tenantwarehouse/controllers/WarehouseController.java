package org.tenantwarehouse.controllers;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.tenantwarehouse.models.dto.OptimizationReport;
import org.tenantwarehouse.models.dto.PartitionRequest;
import org.tenantwarehouse.models.dto.PartitionSpec;
import org.tenantwarehouse.models.dto.WarehouseStatistics;
import org.tenantwarehouse.service.warehouse.WarehouseSchemaService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/tenants/{tenantId}/warehouse")
@RequiredArgsConstructor
public class WarehouseController {

    private final WarehouseSchemaService warehouseSchemaService;

    @PostMapping("/schema")
    public ResponseEntity<Map<String, Object>> ensureSchema(@PathVariable("tenantId") String tenantId,
                                                            @RequestParam(value = "retentionDays", required = false) Integer retentionDays) {
        log.info("Received schema request for tenant: {}", tenantId);
        try {
            String schema = retentionDays == null
                    ? warehouseSchemaService.ensureTenantSchema(tenantId)
                    : warehouseSchemaService.ensureTenantSchema(tenantId, retentionDays);
            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("schema", schema);
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            log.error("Error creating warehouse schema for tenant {}: {}", tenantId, e.getMessage(), e);
            return ErrorResponses.from(e);
        }
    }

    @PostMapping("/partitions")
    public ResponseEntity<?> createPartitions(@PathVariable("tenantId") String tenantId,
                                              @Valid @RequestBody PartitionRequest request) {
        try {
            List<PartitionSpec> partitions = warehouseSchemaService.createPartitions(tenantId, request.getTable(), request.getStrategy());
            return ResponseEntity.ok(partitions);
        } catch (Exception e) {
            log.error("Error creating partitions for tenant {}: {}", tenantId, e.getMessage(), e);
            return ErrorResponses.from(e);
        }
    }

    @PostMapping("/optimize")
    public ResponseEntity<?> optimize(@PathVariable("tenantId") String tenantId) {
        try {
            OptimizationReport report = warehouseSchemaService.optimize(tenantId);
            return ResponseEntity.ok(report);
        } catch (Exception e) {
            log.error("Error optimizing warehouse for tenant {}: {}", tenantId, e.getMessage(), e);
            return ErrorResponses.from(e);
        }
    }

    @GetMapping("/statistics")
    public ResponseEntity<?> statistics(@PathVariable("tenantId") String tenantId) {
        try {
            WarehouseStatistics statistics = warehouseSchemaService.statistics(tenantId);
            return ResponseEntity.ok(statistics);
        } catch (Exception e) {
            log.error("Error reading warehouse statistics for tenant {}: {}", tenantId, e.getMessage(), e);
            return ErrorResponses.from(e);
        }
    }

    @GetMapping("/connection")
    public ResponseEntity<Map<String, Object>> testConnection(@PathVariable("tenantId") String tenantId) {
        Map<String, Object> response = new HashMap<>();
        response.put("tenantId", tenantId);
        response.put("connected", warehouseSchemaService.testConnection(tenantId));
        return ResponseEntity.ok(response);
    }
}
