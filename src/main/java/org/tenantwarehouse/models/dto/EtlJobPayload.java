package org.tenantwarehouse.models.dto;

public record EtlJobPayload(String pipelineId) {
}
