package org.tenantwarehouse.service.transform;

import java.util.List;
import java.util.Map;

/**
 * Surviving records plus the number of records that failed a step. {@code errors} describes the
 * failures and is capped, so it may hold fewer entries than {@code failedCount}.
 */
public record TransformationResult(List<Map<String, Object>> records, int failedCount, List<String> errors) {

    public TransformationResult {
        records = records == null ? List.of() : List.copyOf(records);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
