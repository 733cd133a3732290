package org.tenantwarehouse.models.dto;

import java.time.Instant;
import java.util.List;

public record OptimizationReport(String tenantId,
                                 String schemaName,
                                 List<String> optimizationsApplied,
                                 Instant completedAt) {
}
