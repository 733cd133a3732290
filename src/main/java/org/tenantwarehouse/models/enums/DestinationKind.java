package org.tenantwarehouse.models.enums;

public enum DestinationKind {
    WAREHOUSE,
    CACHE
}
