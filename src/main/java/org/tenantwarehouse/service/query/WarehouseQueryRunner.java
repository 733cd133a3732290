package org.tenantwarehouse.service.query;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Runs one read query inside a tenant schema. Implementations must bind {@code params} as statement
 * parameters and ask the database to stop the statement once {@code timeout} has passed.
 */
public interface WarehouseQueryRunner {

    List<Map<String, Object>> query(String schema, String sql, List<Object> params, Duration timeout);
}
