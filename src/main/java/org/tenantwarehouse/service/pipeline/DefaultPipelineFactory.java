package org.tenantwarehouse.service.pipeline;

import lombok.RequiredArgsConstructor;
import org.tenantwarehouse.models.enums.SourceKind;
import org.tenantwarehouse.models.pipeline.Destination;
import org.tenantwarehouse.models.pipeline.PipelineDefinition;
import org.tenantwarehouse.models.pipeline.Schedule;
import org.tenantwarehouse.models.pipeline.SourceDescriptor;
import org.tenantwarehouse.models.transform.AggregateStep;
import org.tenantwarehouse.models.transform.Calculation;
import org.tenantwarehouse.models.transform.EnrichStep;
import org.tenantwarehouse.models.transform.EnrichmentJoin;
import org.tenantwarehouse.models.transform.MapStep;
import org.tenantwarehouse.models.transform.Measure;
import org.tenantwarehouse.models.transform.ValidateStep;
import org.tenantwarehouse.models.transform.ValidationRule;
import org.tenantwarehouse.service.warehouse.TenantSchemaNaming;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * The pipelines every tenant gets on initialization. Operational sources are read from the
 * application database ({@code transactions}, {@code inventory_levels}, {@code customers}) and
 * loaded into the tenant's fact tables; the daily sales rollup reads the tenant's own
 * {@code fact_transactions}.
 */
@Component
@RequiredArgsConstructor
public class DefaultPipelineFactory {

    static final String TRANSACTIONS_ETL = "transactions-etl";
    static final String DAILY_SALES_ROLLUP = "daily-sales-rollup";
    static final String INVENTORY_ETL = "inventory-etl";
    static final String CUSTOMERS_ETL = "customers-etl";

    private static final String WATERMARK_COLUMN = "updated_at";

    private final TenantSchemaNaming schemaNaming;

    public List<PipelineDefinition> create(String tenantId) {
        return List.of(transactions(tenantId), dailySalesRollup(tenantId), inventory(tenantId), customers(tenantId));
    }

    public static String pipelineId(String tenantId, String suffix) {
        return tenantId + "-" + suffix;
    }

    private PipelineDefinition transactions(String tenantId) {
        return PipelineDefinition.builder()
                .id(pipelineId(tenantId, TRANSACTIONS_ETL))
                .tenantId(tenantId)
                .name("Transaction Data ETL")
                .source(SourceDescriptor.database(List.of("transactions"), WATERMARK_COLUMN))
                .steps(List.of(
                        new ValidateStep("validate_transactions", 1, List.of(
                                ValidationRule.typed("id", "uuid").asRequired(),
                                ValidationRule.required("transaction_date"),
                                ValidationRule.typed("total_amount", "number").withMin(0),
                                ValidationRule.typed("quantity", "number").withMin(0))),
                        new EnrichStep("enrich_transactions", 2, List.of(
                                EnrichmentJoin.of("dim_customer", "customer_id", List.of("customer_segment")),
                                EnrichmentJoin.of("dim_location", "location_id", List.of("location_name")))),
                        new MapStep("calculate_net_amount", 3, List.of(
                                new Calculation("net_amount",
                                        "coalesce(total_amount, 0) - coalesce(discount_amount, 0) + coalesce(tax_amount, 0)")))))
                .destination(Destination.warehouse("fact_transactions", List.of("id", "transaction_date")))
                .schedule(Schedule.cron("0 */4 * * *"))
                .build();
    }

    private PipelineDefinition dailySalesRollup(String tenantId) {
        SourceDescriptor source = new SourceDescriptor(SourceKind.DATABASE,
                List.of("fact_transactions"),
                schemaNaming.schemaFor(tenantId),
                SourceDescriptor.DEFAULT_TENANT_COLUMN,
                null,
                Map.of("columns", List.of("id", "tenant_id", "transaction_date", "location_id", "total_amount")));
        return PipelineDefinition.builder()
                .id(pipelineId(tenantId, DAILY_SALES_ROLLUP))
                .tenantId(tenantId)
                .name("Daily Sales Rollup")
                .source(source)
                .steps(List.of(
                        new AggregateStep("aggregate_daily_sales", 1,
                                List.of("tenant_id", "transaction_date", "location_id"),
                                List.of(
                                        Measure.of("total_amount", "sum", "total_revenue"),
                                        Measure.of("id", "count", "transaction_count"),
                                        Measure.of("total_amount", "avg", "avg_order_value")))))
                .destination(Destination.warehouse("agg_daily_sales", List.of("tenant_id", "transaction_date", "location_id")))
                .schedule(Schedule.cron("30 */4 * * *"))
                .build();
    }

    private PipelineDefinition inventory(String tenantId) {
        return PipelineDefinition.builder()
                .id(pipelineId(tenantId, INVENTORY_ETL))
                .tenantId(tenantId)
                .name("Inventory Data ETL")
                .source(SourceDescriptor.database(List.of("inventory_levels"), WATERMARK_COLUMN))
                .steps(List.of(
                        new ValidateStep("validate_inventory", 1, List.of(
                                ValidationRule.required("snapshot_date"),
                                ValidationRule.typed("location_id", "uuid").asRequired(),
                                ValidationRule.typed("product_id", "uuid").asRequired(),
                                ValidationRule.typed("current_level", "number"))),
                        new MapStep("calculate_turnover", 2, List.of(
                                new Calculation("turnover_ratio",
                                        "round(coalesce(quantity_sold, 0) / max(coalesce(average_stock, 0), 1), 4)"))),
                        new AggregateStep("aggregate_inventory", 3,
                                List.of("tenant_id", "snapshot_date", "location_id", "product_id"),
                                List.of(
                                        Measure.of("current_level", "last", "ending_quantity"),
                                        Measure.of("quantity_sold", "sum"),
                                        Measure.of("quantity_received", "sum"),
                                        Measure.of("unit_cost", "last"),
                                        Measure.of("turnover_ratio", "last"))),
                        new MapStep("calculate_inventory_value", 4, List.of(
                                new Calculation("total_value", "round(coalesce(ending_quantity, 0) * coalesce(unit_cost, 0), 2)")))))
                .destination(Destination.warehouse("fact_inventory",
                        List.of("tenant_id", "snapshot_date", "location_id", "product_id")))
                .schedule(Schedule.cron("0 2 * * *"))
                .build();
    }

    private PipelineDefinition customers(String tenantId) {
        return PipelineDefinition.builder()
                .id(pipelineId(tenantId, CUSTOMERS_ETL))
                .tenantId(tenantId)
                .name("Customer Analytics ETL")
                .source(SourceDescriptor.database(List.of("customers"), WATERMARK_COLUMN))
                .steps(List.of(
                        new ValidateStep("validate_customers", 1, List.of(
                                ValidationRule.typed("customer_id", "uuid").asRequired(),
                                ValidationRule.required("snapshot_date"),
                                ValidationRule.typed("total_orders", "integer").withMin(0),
                                ValidationRule.typed("total_spent", "number").withMin(0))),
                        new MapStep("calculate_customer_metrics", 2, List.of(
                                new Calculation("average_order_value",
                                        "round(coalesce(total_spent, 0) / max(coalesce(total_orders, 0), 1), 2)")))))
                .destination(Destination.warehouse("fact_customers", List.of("tenant_id", "snapshot_date", "customer_id")))
                .schedule(Schedule.cron("0 3 * * *"))
                .build();
    }
}
