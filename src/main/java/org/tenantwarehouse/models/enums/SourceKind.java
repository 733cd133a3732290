package org.tenantwarehouse.models.enums;

public enum SourceKind {
    DATABASE,
    API,
    FILE
}
