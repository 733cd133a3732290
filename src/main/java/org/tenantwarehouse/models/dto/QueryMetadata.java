package org.tenantwarehouse.models.dto;

public record QueryMetadata(String queryId, long executionTimeMs, int rowCount, boolean fromCache) {
}
