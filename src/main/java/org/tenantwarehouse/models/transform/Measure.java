package org.tenantwarehouse.models.transform;

import org.tenantwarehouse.models.enums.AggregationFunction;

public record Measure(String field, AggregationFunction function, String alias) {

    public static Measure of(String field, String function, String alias) {
        return new Measure(field, AggregationFunction.from(function), alias);
    }

    public static Measure of(String field, String function) {
        return of(field, function, null);
    }

    public String outputField() {
        return alias == null || alias.isBlank() ? field : alias;
    }
}
