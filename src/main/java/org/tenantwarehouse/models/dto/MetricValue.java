package org.tenantwarehouse.models.dto;

import java.time.Instant;
import java.util.Map;

public record MetricValue(String metricName,
                          Number value,
                          Instant timestamp,
                          Map<String, Object> dimensions,
                          String error) {
}
