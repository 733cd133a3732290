package org.tenantwarehouse.service.warehouse;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.tenantwarehouse.configuration.AnalyticsProperties;
import org.tenantwarehouse.exceptions.AnalyticsException;
import org.tenantwarehouse.exceptions.ConfigurationException;
import org.tenantwarehouse.models.dto.AnalyticsSettings;
import org.tenantwarehouse.models.dto.OptimizationReport;
import org.tenantwarehouse.models.dto.PartitionSpec;
import org.tenantwarehouse.models.dto.PartitionStrategy;
import org.tenantwarehouse.models.dto.WarehouseStatistics;
import org.tenantwarehouse.models.enums.PipelineStatus;
import org.tenantwarehouse.models.enums.PartitionType;
import org.tenantwarehouse.repository.PipelineRunRepository;
import org.tenantwarehouse.service.query.QueryPerformanceTracker;
import org.tenantwarehouse.utils.SqlIdentifiers;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Provisions and maintains tenant warehouse schemas. Every statement is idempotent, so
 * provisioning can be repeated at any time; calls for the same tenant are serialised.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WarehouseSchemaService {

    private final JdbcTemplate jdbcTemplate;
    private final WarehouseCatalog catalog;
    private final PartitionPlanner partitionPlanner;
    private final TenantSchemaNaming schemaNaming;
    private final QueryPerformanceTracker performanceTracker;
    private final PipelineRunRepository pipelineRunRepository;
    private final AnalyticsProperties properties;
    private final Clock clock;

    static final String DEFAULT_PARTITION_SUFFIX = "_default";

    private final Map<String, Object> tenantLocks = new ConcurrentHashMap<>();

    public String ensureTenantSchema(String tenantId) {
        return ensureTenantSchema(tenantId, AnalyticsSettings.DEFAULT_RETENTION_DAYS);
    }

    public String ensureTenantSchema(String tenantId, int retentionDays) {
        String schema = schemaNaming.schemaFor(tenantId);
        synchronized (lockFor(tenantId)) {
            log.info("Ensuring warehouse schema {} for tenant {}", schema, tenantId);
            String quotedSchema = SqlIdentifiers.quote(schema);
            try {
                jdbcTemplate.execute("CREATE SCHEMA IF NOT EXISTS " + quotedSchema);
                for (WarehouseCatalog.TableDefinition table : catalog.tables()) {
                    jdbcTemplate.execute(String.format(table.ddl(), quotedSchema));
                }
                LocalDate today = LocalDate.now(clock);
                int monthsAhead = properties.getWarehouse().getPartitionMonthsAhead();
                for (WarehouseCatalog.TableDefinition table : catalog.factTables()) {
                    PartitionStrategy window = partitionPlanner.retentionWindow(
                            table.partitionColumn(), today, retentionDays, monthsAhead);
                    createPartitionTables(schema, table.name(), partitionPlanner.plan(table.name(), window));
                    if (table.partitionType() == PartitionType.RANGE) {
                        createDefaultPartition(schema, table.name());
                    }
                }
                for (WarehouseCatalog.IndexDefinition index : catalog.indexes()) {
                    jdbcTemplate.execute(indexDdl(schema, index));
                }
                for (WarehouseCatalog.ViewDefinition view : catalog.materializedViews()) {
                    jdbcTemplate.execute(String.format(view.ddl(), quotedSchema));
                    jdbcTemplate.execute(indexDdl(schema, view.uniqueIndex()));
                }
            } catch (DataAccessException exception) {
                throw new AnalyticsException("Failed to provision warehouse schema " + schema + ": "
                        + exception.getMostSpecificCause().getMessage(), exception);
            }
            log.info("Warehouse schema {} ready", schema);
            return schema;
        }
    }

    public List<PartitionSpec> createPartitions(String tenantId, String table, PartitionStrategy strategy) {
        String schema = schemaNaming.schemaFor(tenantId);
        catalog.table(table).ifPresent(definition -> checkStrategyMatches(definition, strategy));
        List<PartitionSpec> partitions = partitionPlanner.plan(table, strategy);
        synchronized (lockFor(tenantId)) {
            try {
                createPartitionTables(schema, table, partitions);
            } catch (DataAccessException exception) {
                throw new AnalyticsException("Failed to create partitions for " + schema + "." + table + ": "
                        + exception.getMostSpecificCause().getMessage(), exception);
            }
        }
        log.info("Created {} {} partitions for {}.{}", partitions.size(), strategy.type(), schema, table);
        return partitions;
    }

    public OptimizationReport optimize(String tenantId) {
        String schema = schemaNaming.schemaFor(tenantId);
        List<String> applied = new ArrayList<>();
        log.info("Optimizing warehouse schema {}", schema);
        synchronized (lockFor(tenantId)) {
            try {
                for (WarehouseCatalog.TableDefinition table : catalog.tables()) {
                    jdbcTemplate.execute("ANALYZE " + SqlIdentifiers.qualify(schema, table.name()));
                    applied.add("Analyzed table: " + table.name());
                }

                List<String> largeTables = jdbcTemplate.queryForList("SELECT tablename FROM pg_tables " +
                                "WHERE schemaname = ? " +
                                "AND pg_total_relation_size(format('%I.%I', schemaname, tablename)) > ? " +
                                "ORDER BY tablename",
                        String.class, schema, properties.getWarehouse().getLargeTableThresholdBytes());
                for (String table : largeTables) {
                    String qualified = SqlIdentifiers.qualify(schema, table);
                    jdbcTemplate.execute("VACUUM ANALYZE " + qualified);
                    jdbcTemplate.execute("REINDEX TABLE CONCURRENTLY " + qualified);
                    applied.add("Vacuumed and reindexed large table: " + table);
                }

                Set<String> existingIndexes = new HashSet<>(jdbcTemplate.queryForList(
                        "SELECT indexname FROM pg_indexes WHERE schemaname = ?", String.class, schema));
                List<WarehouseCatalog.IndexDefinition> expected = new ArrayList<>(catalog.indexes());
                catalog.materializedViews().forEach(view -> expected.add(view.uniqueIndex()));
                for (WarehouseCatalog.IndexDefinition index : expected) {
                    if (!existingIndexes.contains(index.name())) {
                        jdbcTemplate.execute(indexDdl(schema, index));
                        applied.add("Created missing index: " + index.name());
                    }
                }

                List<String> views = jdbcTemplate.queryForList(
                        "SELECT matviewname FROM pg_matviews WHERE schemaname = ? ORDER BY matviewname",
                        String.class, schema);
                for (String view : views) {
                    jdbcTemplate.execute("REFRESH MATERIALIZED VIEW CONCURRENTLY " + SqlIdentifiers.qualify(schema, view));
                    applied.add("Refreshed materialized view: " + view);
                }
            } catch (DataAccessException exception) {
                throw new AnalyticsException("Failed to optimize warehouse schema " + schema + ": "
                        + exception.getMostSpecificCause().getMessage(), exception);
            }
        }
        log.info("Warehouse optimization for {} applied {} actions", schema, applied.size());
        return new OptimizationReport(tenantId, schema, List.copyOf(applied), clock.instant());
    }

    public WarehouseStatistics statistics(String tenantId) {
        String schema = schemaNaming.schemaFor(tenantId);
        try {
            Long size = jdbcTemplate.queryForObject("SELECT COALESCE(SUM(pg_total_relation_size(format('%I.%I', schemaname, tablename))), 0) " +
                    "FROM pg_tables WHERE schemaname = ?", Long.class, schema);
            Long tables = jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM pg_tables WHERE schemaname = ?", Long.class, schema);
            Long rows = jdbcTemplate.queryForObject(
                    "SELECT COALESCE(SUM(n_live_tup), 0) FROM pg_stat_user_tables WHERE schemaname = ?",
                    Long.class, schema);
            Instant lastLoadedAt = pipelineRunRepository.findLastEndedAt(tenantId, PipelineStatus.COMPLETED)
                    .orElse(null);
            return new WarehouseStatistics(schema,
                    size == null ? 0 : size,
                    tables == null ? 0 : tables,
                    rows == null ? 0 : rows,
                    lastLoadedAt,
                    performanceTracker.summary(tenantId));
        } catch (DataAccessException exception) {
            throw new AnalyticsException("Failed to read statistics for " + schema + ": "
                    + exception.getMostSpecificCause().getMessage(), exception);
        }
    }

    public boolean testConnection(String tenantId) {
        String schema = schemaNaming.schemaFor(tenantId);
        try {
            Boolean exists = jdbcTemplate.queryForObject(
                    "SELECT EXISTS (SELECT 1 FROM information_schema.schemata WHERE schema_name = ?)",
                    Boolean.class, schema);
            return Boolean.TRUE.equals(exists);
        } catch (DataAccessException exception) {
            log.warn("Warehouse connection test failed for tenant {}: {}", tenantId, exception.getMessage());
            return false;
        }
    }

    private void checkStrategyMatches(WarehouseCatalog.TableDefinition definition, PartitionStrategy strategy) {
        if (!definition.isPartitioned()) {
            throw new ConfigurationException("Table " + definition.name() + " is not partitioned");
        }
        if (strategy == null || strategy.type() != definition.partitionType()) {
            throw new ConfigurationException("Table " + definition.name() + " is partitioned by "
                    + definition.partitionType() + ", not " + (strategy == null ? null : strategy.type()));
        }
        if (strategy.column() != null && !strategy.column().equals(definition.partitionColumn())) {
            throw new ConfigurationException("Table " + definition.name() + " is partitioned on "
                    + definition.partitionColumn() + ", not " + strategy.column());
        }
    }

    private void createPartitionTables(String schema, String table, List<PartitionSpec> partitions) {
        String parent = SqlIdentifiers.qualify(schema, table);
        for (PartitionSpec partition : partitions) {
            String bounds = partition.type() == PartitionType.RANGE
                    ? "FOR VALUES FROM ('" + partition.lowerBound() + "') TO ('" + partition.upperBound() + "')"
                    : "FOR VALUES WITH (MODULUS " + partition.modulus() + ", REMAINDER " + partition.remainder() + ")";
            jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + SqlIdentifiers.qualify(schema, partition.name())
                    + " PARTITION OF " + parent + " " + bounds);
        }
    }

    /** Catches rows outside every range partition, such as history older than the retention window. */
    private void createDefaultPartition(String schema, String table) {
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + SqlIdentifiers.qualify(schema, table + DEFAULT_PARTITION_SUFFIX)
                + " PARTITION OF " + SqlIdentifiers.qualify(schema, table) + " DEFAULT");
    }

    private String indexDdl(String schema, WarehouseCatalog.IndexDefinition index) {
        return "CREATE " + (index.unique() ? "UNIQUE " : "") + "INDEX IF NOT EXISTS " + SqlIdentifiers.quote(index.name())
                + " ON " + SqlIdentifiers.qualify(schema, index.table())
                + " (" + SqlIdentifiers.quoteAll(index.columns()) + ")";
    }

    private Object lockFor(String tenantId) {
        return tenantLocks.computeIfAbsent(tenantId, key -> new Object());
    }
}
