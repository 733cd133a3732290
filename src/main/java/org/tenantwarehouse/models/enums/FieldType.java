package org.tenantwarehouse.models.enums;

import org.tenantwarehouse.exceptions.ConfigurationException;

import java.util.Locale;

public enum FieldType {
    NUMBER,
    INTEGER,
    STRING,
    BOOLEAN,
    DATE,
    UUID;

    public static FieldType from(String value) {
        if (value == null) {
            return null;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException exception) {
            throw new ConfigurationException("Unsupported field type: " + value, exception);
        }
    }
}
