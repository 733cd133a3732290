package org.tenantwarehouse.models.enums;

public enum PipelineStatus {
    IDLE,
    RUNNING,
    FAILED,
    COMPLETED
}
