package org.tenantwarehouse.service.transform;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Set;

/**
 * A parsed map-step expression.
 */
public interface Expression {

    /**
     * @return the value, or {@code null} when a {@code coalesce} finds nothing
     * @throws org.tenantwarehouse.exceptions.RecordException on unknown fields, non-numeric
     *                                                        operands or division by zero
     */
    BigDecimal evaluate(Map<String, Object> record);

    Set<String> fields();
}
