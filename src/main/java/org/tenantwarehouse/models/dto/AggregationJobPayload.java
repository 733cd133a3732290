package org.tenantwarehouse.models.dto;

import org.tenantwarehouse.models.enums.AggregationInterval;

public record AggregationJobPayload(String tenantId, AggregationInterval interval) {
}
