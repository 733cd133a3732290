package org.tenantwarehouse.models.enums;

import org.tenantwarehouse.exceptions.ConfigurationException;

import java.util.Locale;

public enum AggregationFunction {
    SUM,
    AVG,
    COUNT,
    MIN,
    MAX,
    LAST;

    public static AggregationFunction from(String value) {
        if (value == null) {
            throw new ConfigurationException("Aggregation function is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException exception) {
            throw new ConfigurationException("Unsupported aggregation function: " + value, exception);
        }
    }
}
