package org.tenantwarehouse.models.pipeline;

import org.tenantwarehouse.models.enums.SourceKind;

import java.util.List;
import java.util.Map;

/**
 * Where a pipeline reads from. {@code options} carries the kind-specific settings (jdbcUrl and
 * credentials for an external database, url and recordsPath for an API, filePath for a CSV file).
 */
public record SourceDescriptor(SourceKind kind,
                               List<String> tables,
                               String schema,
                               String tenantColumn,
                               String watermarkColumn,
                               Map<String, Object> options) {

    public static final String DEFAULT_TENANT_COLUMN = "tenant_id";

    public SourceDescriptor {
        tables = tables == null ? List.of() : List.copyOf(tables);
        options = options == null ? Map.of() : Map.copyOf(options);
    }

    public static SourceDescriptor database(List<String> tables, String watermarkColumn) {
        return new SourceDescriptor(SourceKind.DATABASE, tables, null, DEFAULT_TENANT_COLUMN, watermarkColumn, Map.of());
    }

    public boolean isIncremental() {
        return watermarkColumn != null && !watermarkColumn.isBlank();
    }

    public Object option(String key) {
        return options.get(key);
    }
}
