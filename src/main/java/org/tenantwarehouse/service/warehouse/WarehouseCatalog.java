package org.tenantwarehouse.service.warehouse;

import org.tenantwarehouse.models.enums.PartitionType;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * The fixed layout of every tenant schema. DDL templates take the quoted schema name as
 * {@code %1$s} and are safe to re-run.
 */
@Component
public class WarehouseCatalog {

    public record TableDefinition(String name, String ddl, PartitionType partitionType, String partitionColumn) {

        public boolean isPartitioned() {
            return partitionType != null;
        }
    }

    public record IndexDefinition(String table, List<String> columns, boolean unique) {

        public String name() {
            return (unique ? "uq_" : "idx_") + table + "_" + String.join("_", columns);
        }
    }

    public record ViewDefinition(String name, String ddl, IndexDefinition uniqueIndex) {
    }

    private static final List<TableDefinition> FACT_TABLES = List.of(
            new TableDefinition("fact_transactions", "CREATE TABLE IF NOT EXISTS %1$s.\"fact_transactions\" ( " +
                    "id UUID NOT NULL, " +
                    "tenant_id TEXT NOT NULL, " +
                    "transaction_date DATE NOT NULL, " +
                    "transaction_time TIMESTAMP NOT NULL, " +
                    "location_id UUID, " +
                    "customer_id UUID, " +
                    "employee_id UUID, " +
                    "product_id UUID, " +
                    "quantity NUMERIC(10,2), " +
                    "unit_price NUMERIC(10,2), " +
                    "total_amount NUMERIC(10,2), " +
                    "discount_amount NUMERIC(10,2), " +
                    "tax_amount NUMERIC(10,2), " +
                    "net_amount NUMERIC(12,2), " +
                    "payment_method VARCHAR(50), " +
                    "customer_segment VARCHAR(50), " +
                    "location_name VARCHAR(255), " +
                    "created_at TIMESTAMP DEFAULT NOW(), " +
                    "PRIMARY KEY (id, transaction_date) " +
                    ") PARTITION BY RANGE (transaction_date)", PartitionType.RANGE, "transaction_date"),
            new TableDefinition("fact_inventory", "CREATE TABLE IF NOT EXISTS %1$s.\"fact_inventory\" ( " +
                    "tenant_id TEXT NOT NULL, " +
                    "snapshot_date DATE NOT NULL, " +
                    "location_id UUID NOT NULL, " +
                    "product_id UUID NOT NULL, " +
                    "beginning_quantity NUMERIC(10,2), " +
                    "ending_quantity NUMERIC(10,2), " +
                    "quantity_sold NUMERIC(10,2), " +
                    "quantity_received NUMERIC(10,2), " +
                    "quantity_adjusted NUMERIC(10,2), " +
                    "unit_cost NUMERIC(10,2), " +
                    "total_value NUMERIC(14,2), " +
                    "turnover_ratio NUMERIC(12,4), " +
                    "created_at TIMESTAMP DEFAULT NOW(), " +
                    "PRIMARY KEY (tenant_id, snapshot_date, location_id, product_id) " +
                    ") PARTITION BY RANGE (snapshot_date)", PartitionType.RANGE, "snapshot_date"),
            new TableDefinition("fact_customers", "CREATE TABLE IF NOT EXISTS %1$s.\"fact_customers\" ( " +
                    "tenant_id TEXT NOT NULL, " +
                    "snapshot_date DATE NOT NULL, " +
                    "customer_id UUID NOT NULL, " +
                    "location_id UUID, " +
                    "total_orders INTEGER, " +
                    "total_spent NUMERIC(12,2), " +
                    "average_order_value NUMERIC(12,2), " +
                    "days_since_last_purchase INTEGER, " +
                    "loyalty_points INTEGER, " +
                    "created_at TIMESTAMP DEFAULT NOW(), " +
                    "PRIMARY KEY (tenant_id, snapshot_date, customer_id) " +
                    ") PARTITION BY RANGE (snapshot_date)", PartitionType.RANGE, "snapshot_date"));

    private static final List<TableDefinition> AGGREGATE_TABLES = List.of(
            new TableDefinition("agg_daily_sales", "CREATE TABLE IF NOT EXISTS %1$s.\"agg_daily_sales\" ( " +
                    "tenant_id TEXT NOT NULL, " +
                    "transaction_date DATE NOT NULL, " +
                    "location_id TEXT NOT NULL, " +
                    "transaction_count BIGINT, " +
                    "total_revenue NUMERIC(14,2), " +
                    "avg_order_value NUMERIC(14,4), " +
                    "updated_at TIMESTAMP DEFAULT NOW(), " +
                    "PRIMARY KEY (tenant_id, transaction_date, location_id) " +
                    ")", null, null),
            new TableDefinition("agg_metric_rollups", "CREATE TABLE IF NOT EXISTS %1$s.\"agg_metric_rollups\" ( " +
                    "tenant_id TEXT NOT NULL, " +
                    "metric_name VARCHAR(100) NOT NULL, " +
                    "interval_name VARCHAR(20) NOT NULL, " +
                    "period_start TIMESTAMP NOT NULL, " +
                    "metric_value NUMERIC(18,4), " +
                    "updated_at TIMESTAMP DEFAULT NOW(), " +
                    "PRIMARY KEY (tenant_id, metric_name, interval_name, period_start) " +
                    ")", null, null));

    private static final List<TableDefinition> DIMENSION_TABLES = List.of(
            new TableDefinition("dim_date", "CREATE TABLE IF NOT EXISTS %1$s.\"dim_date\" ( " +
                    "date_key DATE PRIMARY KEY, " +
                    "year INTEGER, " +
                    "quarter INTEGER, " +
                    "month INTEGER, " +
                    "week INTEGER, " +
                    "day_of_year INTEGER, " +
                    "day_of_month INTEGER, " +
                    "day_of_week INTEGER, " +
                    "day_name VARCHAR(20), " +
                    "month_name VARCHAR(20), " +
                    "is_weekend BOOLEAN, " +
                    "is_holiday BOOLEAN, " +
                    "fiscal_year INTEGER, " +
                    "fiscal_quarter INTEGER " +
                    ")", null, null),
            new TableDefinition("dim_location", "CREATE TABLE IF NOT EXISTS %1$s.\"dim_location\" ( " +
                    "location_id UUID PRIMARY KEY, " +
                    "tenant_id TEXT NOT NULL, " +
                    "location_name VARCHAR(255), " +
                    "location_type VARCHAR(50), " +
                    "address TEXT, " +
                    "city VARCHAR(100), " +
                    "state VARCHAR(50), " +
                    "country VARCHAR(50), " +
                    "postal_code VARCHAR(20), " +
                    "timezone VARCHAR(50), " +
                    "is_active BOOLEAN, " +
                    "created_at TIMESTAMP, " +
                    "updated_at TIMESTAMP " +
                    ")", null, null),
            new TableDefinition("dim_product", "CREATE TABLE IF NOT EXISTS %1$s.\"dim_product\" ( " +
                    "product_id UUID PRIMARY KEY, " +
                    "tenant_id TEXT NOT NULL, " +
                    "sku VARCHAR(100), " +
                    "product_name VARCHAR(255), " +
                    "category VARCHAR(100), " +
                    "subcategory VARCHAR(100), " +
                    "brand VARCHAR(100), " +
                    "unit_of_measure VARCHAR(20), " +
                    "is_active BOOLEAN, " +
                    "created_at TIMESTAMP, " +
                    "updated_at TIMESTAMP " +
                    ")", null, null),
            new TableDefinition("dim_customer", "CREATE TABLE IF NOT EXISTS %1$s.\"dim_customer\" ( " +
                    "customer_id UUID PRIMARY KEY, " +
                    "tenant_id TEXT NOT NULL, " +
                    "customer_type VARCHAR(50), " +
                    "customer_segment VARCHAR(50), " +
                    "loyalty_tier VARCHAR(50), " +
                    "acquisition_channel VARCHAR(100), " +
                    "is_active BOOLEAN, " +
                    "created_at TIMESTAMP, " +
                    "updated_at TIMESTAMP " +
                    ")", null, null));

    private static final List<ViewDefinition> MATERIALIZED_VIEWS = List.of(
            new ViewDefinition("mv_daily_sales", "CREATE MATERIALIZED VIEW IF NOT EXISTS %1$s.\"mv_daily_sales\" AS " +
                    "SELECT transaction_date, " +
                    "   COALESCE(location_id::text, '') AS location_key, " +
                    "   COUNT(*) AS transaction_count, " +
                    "   SUM(total_amount) AS total_revenue, " +
                    "   AVG(total_amount) AS avg_order_value, " +
                    "   COUNT(DISTINCT customer_id) AS unique_customers " +
                    "FROM %1$s.\"fact_transactions\" " +
                    "GROUP BY transaction_date, COALESCE(location_id::text, '')",
                    new IndexDefinition("mv_daily_sales", List.of("transaction_date", "location_key"), true)),
            new ViewDefinition("mv_product_performance", "CREATE MATERIALIZED VIEW IF NOT EXISTS %1$s.\"mv_product_performance\" AS " +
                    "SELECT COALESCE(product_id::text, '') AS product_key, " +
                    "   COALESCE(location_id::text, '') AS location_key, " +
                    "   DATE_TRUNC('month', transaction_date) AS month, " +
                    "   SUM(quantity) AS units_sold, " +
                    "   SUM(total_amount) AS revenue, " +
                    "   COUNT(DISTINCT customer_id) AS unique_buyers " +
                    "FROM %1$s.\"fact_transactions\" " +
                    "GROUP BY 1, 2, 3",
                    new IndexDefinition("mv_product_performance", List.of("product_key", "location_key", "month"), true)),
            new ViewDefinition("mv_customer_ltv", "CREATE MATERIALIZED VIEW IF NOT EXISTS %1$s.\"mv_customer_ltv\" AS " +
                    "SELECT customer_id, " +
                    "   COALESCE(location_id::text, '') AS location_key, " +
                    "   COUNT(*) AS total_orders, " +
                    "   SUM(total_amount) AS lifetime_value, " +
                    "   AVG(total_amount) AS avg_order_value, " +
                    "   MAX(transaction_date) AS last_purchase_date, " +
                    "   MIN(transaction_date) AS first_purchase_date " +
                    "FROM %1$s.\"fact_transactions\" " +
                    "WHERE customer_id IS NOT NULL " +
                    "GROUP BY customer_id, COALESCE(location_id::text, '')",
                    new IndexDefinition("mv_customer_ltv", List.of("customer_id", "location_key"), true)));

    private static final List<IndexDefinition> INDEXES = List.of(
            new IndexDefinition("fact_transactions", List.of("tenant_id", "transaction_date"), false),
            new IndexDefinition("fact_transactions", List.of("location_id", "transaction_date"), false),
            new IndexDefinition("fact_transactions", List.of("customer_id", "transaction_date"), false),
            new IndexDefinition("fact_transactions", List.of("product_id", "transaction_date"), false),
            new IndexDefinition("fact_inventory", List.of("location_id", "snapshot_date"), false),
            new IndexDefinition("fact_inventory", List.of("product_id", "snapshot_date"), false),
            new IndexDefinition("fact_customers", List.of("customer_id", "snapshot_date"), false),
            new IndexDefinition("dim_location", List.of("tenant_id"), false),
            new IndexDefinition("dim_product", List.of("tenant_id", "category"), false),
            new IndexDefinition("dim_customer", List.of("tenant_id", "customer_segment"), false),
            new IndexDefinition("agg_metric_rollups", List.of("metric_name", "period_start"), false));

    public List<TableDefinition> factTables() {
        return FACT_TABLES;
    }

    /**
     * Every table in creation order: facts, aggregates, then dimensions.
     */
    public List<TableDefinition> tables() {
        return Stream.of(FACT_TABLES, AGGREGATE_TABLES, DIMENSION_TABLES)
                .flatMap(List::stream)
                .toList();
    }

    public List<ViewDefinition> materializedViews() {
        return MATERIALIZED_VIEWS;
    }

    public List<IndexDefinition> indexes() {
        return INDEXES;
    }

    public Optional<TableDefinition> table(String name) {
        return tables().stream().filter(table -> table.name().equals(name)).findFirst();
    }
}
