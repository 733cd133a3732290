package org.tenantwarehouse.models.transform;

import org.tenantwarehouse.models.enums.FieldType;

import java.math.BigDecimal;

/**
 * Rules on absent values only apply through {@code required}; type and bounds are checked on present values.
 */
public record ValidationRule(String field, boolean required, FieldType type, BigDecimal min, BigDecimal max) {

    public static ValidationRule required(String field) {
        return new ValidationRule(field, true, null, null, null);
    }

    public static ValidationRule typed(String field, String type) {
        return new ValidationRule(field, false, FieldType.from(type), null, null);
    }

    public ValidationRule withMin(Number value) {
        return new ValidationRule(field, required, type, new BigDecimal(value.toString()), max);
    }

    public ValidationRule withMax(Number value) {
        return new ValidationRule(field, required, type, min, new BigDecimal(value.toString()));
    }

    public ValidationRule asRequired() {
        return new ValidationRule(field, true, type, min, max);
    }
}
