package org.tenantwarehouse.models.dto;

import java.util.List;
import java.util.Map;

public record QueryResult(List<Map<String, Object>> rows, QueryMetadata metadata) {

    public QueryResult {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }
}
