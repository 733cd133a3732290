package org.tenantwarehouse.models.transform;

import org.tenantwarehouse.models.enums.FilterOperator;

/**
 * {@code value} is a scalar, or a collection for {@code IN}/{@code NOT_IN}; unused by the null checks.
 */
public record FilterCondition(String field, FilterOperator operator, Object value) {

    public static FilterCondition of(String field, String operator, Object value) {
        return new FilterCondition(field, FilterOperator.from(operator), value);
    }
}
