package org.tenantwarehouse.service.transform;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.tenantwarehouse.exceptions.ConfigurationException;
import org.tenantwarehouse.exceptions.ExtractException;
import org.tenantwarehouse.models.pipeline.SourceDescriptor;
import org.tenantwarehouse.service.warehouse.TenantSchemaNaming;
import org.tenantwarehouse.utils.SqlIdentifiers;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads enrichment datasets from warehouse tables. A bare dataset name resolves inside the tenant
 * schema, {@code schema.table} names a table elsewhere. Tables carrying a tenant column are
 * filtered to the tenant.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JdbcAuxiliaryDataProvider implements AuxiliaryDataProvider {

    private final JdbcTemplate jdbcTemplate;
    private final TenantSchemaNaming schemaNaming;

    @Override
    public Map<String, Map<String, Object>> load(String tenantId, String dataset, String lookupKey) {
        String schema;
        String table;
        int dot = dataset.indexOf('.');
        if (dot > 0) {
            schema = SqlIdentifiers.requireSafe(dataset.substring(0, dot));
            table = SqlIdentifiers.requireSafe(dataset.substring(dot + 1));
        } else {
            schema = schemaNaming.schemaFor(tenantId);
            table = SqlIdentifiers.requireSafe(dataset);
        }
        SqlIdentifiers.requireSafe(lookupKey);

        try {
            List<String> columns = jdbcTemplate.queryForList(
                    "SELECT column_name FROM information_schema.columns WHERE table_schema = ? AND table_name = ?",
                    String.class, schema, table);
            if (columns.isEmpty()) {
                throw new ConfigurationException("Unknown enrichment dataset: " + schema + "." + table);
            }
            if (!columns.contains(lookupKey)) {
                throw new ConfigurationException("Enrichment dataset " + dataset + " has no column " + lookupKey);
            }

            String sql = "SELECT * FROM " + SqlIdentifiers.qualify(schema, table);
            List<Map<String, Object>> rows;
            if (columns.contains(SourceDescriptor.DEFAULT_TENANT_COLUMN)) {
                sql += " WHERE " + SqlIdentifiers.quote(SourceDescriptor.DEFAULT_TENANT_COLUMN) + "::text = ?";
                rows = jdbcTemplate.queryForList(sql, tenantId);
            } else {
                rows = jdbcTemplate.queryForList(sql);
            }

            Map<String, Map<String, Object>> index = new LinkedHashMap<>();
            for (Map<String, Object> row : rows) {
                Object key = row.get(lookupKey);
                if (key != null) {
                    index.putIfAbsent(String.valueOf(key), row);
                }
            }
            log.debug("Loaded {} rows of enrichment dataset {}.{} for tenant {}", index.size(), schema, table, tenantId);
            return index;
        } catch (DataAccessException exception) {
            throw new ExtractException("Failed to load enrichment dataset " + dataset + ": "
                    + exception.getMostSpecificCause().getMessage(), exception);
        }
    }
}
