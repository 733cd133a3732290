package org.tenantwarehouse.models.transform;

public record Calculation(String field, String expression) {
}
