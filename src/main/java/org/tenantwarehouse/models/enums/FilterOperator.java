package org.tenantwarehouse.models.enums;

import org.tenantwarehouse.exceptions.ConfigurationException;

import java.util.Locale;

public enum FilterOperator {
    EQ,
    NE,
    GT,
    GTE,
    LT,
    LTE,
    IN,
    NOT_IN,
    IS_NULL,
    NOT_NULL;

    public boolean requiresValue() {
        return this != IS_NULL && this != NOT_NULL;
    }

    public static FilterOperator from(String value) {
        if (value == null) {
            throw new ConfigurationException("Filter operator is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException exception) {
            throw new ConfigurationException("Unsupported filter operator: " + value, exception);
        }
    }
}
