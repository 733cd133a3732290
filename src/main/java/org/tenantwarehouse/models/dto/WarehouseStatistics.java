package org.tenantwarehouse.models.dto;

import java.time.Instant;

public record WarehouseStatistics(String schemaName,
                                  long schemaSizeBytes,
                                  long tableCount,
                                  long totalRows,
                                  Instant lastLoadedAt,
                                  QueryPerformanceSummary queryPerformance) {
}
