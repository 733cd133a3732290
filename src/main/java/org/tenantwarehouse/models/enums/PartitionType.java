package org.tenantwarehouse.models.enums;

public enum PartitionType {
    RANGE,
    HASH
}
