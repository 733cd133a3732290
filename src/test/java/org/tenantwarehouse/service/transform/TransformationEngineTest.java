package org.tenantwarehouse.service.transform;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.tenantwarehouse.configuration.AnalyticsProperties;
import org.tenantwarehouse.exceptions.ConfigurationException;
import org.tenantwarehouse.models.transform.AggregateStep;
import org.tenantwarehouse.models.transform.Calculation;
import org.tenantwarehouse.models.transform.EnrichStep;
import org.tenantwarehouse.models.transform.EnrichmentJoin;
import org.tenantwarehouse.models.transform.FilterCondition;
import org.tenantwarehouse.models.transform.FilterStep;
import org.tenantwarehouse.models.transform.MapStep;
import org.tenantwarehouse.models.transform.Measure;
import org.tenantwarehouse.models.transform.TransformationStep;
import org.tenantwarehouse.models.transform.ValidateStep;
import org.tenantwarehouse.models.transform.ValidationRule;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TransformationEngineTest {

    private final Map<String, Map<String, Map<String, Object>>> datasets = new HashMap<>();
    private TransformationEngine engine;

    @BeforeEach
    void setUp() {
        AnalyticsProperties properties = new AnalyticsProperties();
        properties.getEtl().setMaxErrorMessages(2);
        engine = new TransformationEngine((tenantId, dataset, lookupKey) -> {
            Map<String, Map<String, Object>> rows = datasets.get(dataset);
            if (rows == null) {
                throw new ConfigurationException("Unknown enrichment dataset: " + dataset);
            }
            return rows;
        }, properties);
    }

    @Test
    void testAggregate_SumsPerGroup() {
        // Given
        List<Map<String, Object>> records = List.of(
                row("date", "2024-01-01", "amt", 10),
                row("date", "2024-01-01", "amt", 5),
                row("date", "2024-01-02", "amt", 7));
        AggregateStep step = new AggregateStep("agg", 1, List.of("date"), List.of(Measure.of("amt", "sum")));

        // When
        TransformationResult result = engine.apply(records, List.of(step));

        // Then
        assertEquals(List.of(
                row("date", "2024-01-01", "amt", 15L),
                row("date", "2024-01-02", "amt", 7L)), result.records());
        assertEquals(0, result.failedCount());
    }

    @Test
    void testAggregate_ConservesTotal() {
        List<Map<String, Object>> records = new ArrayList<>();
        BigDecimal expected = BigDecimal.ZERO;
        for (int i = 0; i < 50; i++) {
            BigDecimal amount = new BigDecimal(i + ".25");
            expected = expected.add(amount);
            records.add(row("store", "s" + (i % 7), "amount", amount));
        }
        AggregateStep step = new AggregateStep("agg", 1, List.of("store"), List.of(Measure.of("amount", "sum", "total")));

        TransformationResult result = engine.apply(records, List.of(step));

        BigDecimal total = result.records().stream()
                .map(row -> (BigDecimal) row.get("total"))
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        assertEquals(7, result.records().size());
        assertEquals(0, expected.compareTo(total));
    }

    @Test
    void testAggregate_AllMeasureFunctions() {
        List<Map<String, Object>> records = List.of(
                row("k", "a", "v", 4),
                row("k", "a", "v", 2),
                row("k", "a", "v", null),
                row("k", "a", "v", 9));
        AggregateStep step = new AggregateStep("agg", 1, List.of("k"), List.of(
                Measure.of("v", "avg", "avg_v"),
                Measure.of("v", "count", "count_v"),
                Measure.of("v", "min", "min_v"),
                Measure.of("v", "max", "max_v"),
                Measure.of("v", "last", "last_v")));

        Map<String, Object> aggregated = engine.apply(records, List.of(step)).records().get(0);

        assertEquals(0, new BigDecimal("5").compareTo((BigDecimal) aggregated.get("avg_v")));
        assertEquals(3L, aggregated.get("count_v"));
        assertEquals(2, aggregated.get("min_v"));
        assertEquals(9, aggregated.get("max_v"));
        assertEquals(9, aggregated.get("last_v"));
    }

    @Test
    void testAggregate_NonNumericSumFailsRecord() {
        List<Map<String, Object>> records = List.of(row("k", "a", "v", 1), row("k", "a", "v", "abc"));
        AggregateStep step = new AggregateStep("agg", 1, List.of("k"), List.of(Measure.of("v", "sum")));

        TransformationResult result = engine.apply(records, List.of(step));

        assertEquals(1, result.failedCount());
        assertEquals(1L, result.records().get(0).get("v"));
    }

    @Test
    void testValidate_RejectsNegativeAndNonNumeric() {
        // Given
        List<Map<String, Object>> records = List.of(row("amt", 5), row("amt", -1), row("amt", "x"));
        ValidateStep step = new ValidateStep("v", 1, List.of(ValidationRule.typed("amt", "number").withMin(0)));

        // When
        TransformationResult result = engine.apply(records, List.of(step));

        // Then
        assertEquals(List.of(row("amt", 5)), result.records());
        assertEquals(2, result.failedCount());
        assertEquals(2, result.errors().size());
    }

    @Test
    void testValidate_IsIdempotent() {
        List<Map<String, Object>> records = List.of(row("id", "not-a-uuid"), row("id", "3f2504e0-4f89-11d3-9a0c-0305e82c3301"),
                row("other", 1));
        List<TransformationStep> steps = List.of(new ValidateStep("v", 1,
                List.of(ValidationRule.typed("id", "uuid").asRequired())));

        TransformationResult once = engine.apply(records, steps);
        TransformationResult twice = engine.apply(once.records(), steps);

        assertEquals(once.records(), twice.records());
        assertEquals(0, twice.failedCount());
    }

    @Test
    void testErrors_AreCappedButCounted() {
        List<Map<String, Object>> records = List.of(row("amt", -1), row("amt", -2), row("amt", -3));
        ValidateStep step = new ValidateStep("v", 1, List.of(ValidationRule.typed("amt", "number").withMin(0)));

        TransformationResult result = engine.apply(records, List.of(step));

        assertEquals(3, result.failedCount());
        assertEquals(2, result.errors().size());
    }

    @Test
    void testSteps_RunInOrderNotListPosition() {
        List<Map<String, Object>> records = List.of(row("price", 10, "qty", 3), row("price", 1, "qty", 2));
        MapStep map = new MapStep("total", 1, List.of(new Calculation("total", "price * qty")));
        FilterStep filter = new FilterStep("big", 2, List.of(FilterCondition.of("total", "gte", 10)));

        TransformationResult result = engine.apply(records, List.of(filter, map));

        assertEquals(1, result.records().size());
        assertEquals(0, new BigDecimal("30").compareTo((BigDecimal) result.records().get(0).get("total")));
    }

    @Test
    void testMap_DivisionByZeroFailsOnlyThatRecord() {
        List<Map<String, Object>> records = List.of(row("a", 10, "b", 2), row("a", 1, "b", 0));
        MapStep map = new MapStep("ratio", 1, List.of(new Calculation("ratio", "a / b")));

        TransformationResult result = engine.apply(records, List.of(map));

        assertEquals(1, result.records().size());
        assertEquals(1, result.failedCount());
    }

    @Test
    void testMap_OutOfRangeRoundDigitsFailsOnlyThatRecord() {
        List<Map<String, Object>> records = List.of(row("a", 1.25, "d", 1), row("a", 1.25, "d", 2147483647));
        MapStep map = new MapStep("rounded", 1, List.of(new Calculation("r", "round(a, d)")));

        TransformationResult result = engine.apply(records, List.of(map));

        assertEquals(1, result.records().size());
        assertEquals(1, result.failedCount());
    }

    @Test
    void testApply_DoesNotMutateInput() {
        Map<String, Object> input = row("a", 1);
        engine.apply(List.of(input), List.of(new MapStep("m", 1, List.of(new Calculation("b", "a + 1")))));

        assertEquals(row("a", 1), input);
    }

    @Test
    void testFilter_InAndNullOperators() {
        List<Map<String, Object>> records = List.of(
                row("status", "paid", "note", null),
                row("status", "void", "note", null),
                row("status", "refunded", "note", "x"));
        FilterStep filter = new FilterStep("f", 1, List.of(
                FilterCondition.of("status", "in", List.of("paid", "refunded")),
                FilterCondition.of("note", "is_null", null)));

        TransformationResult result = engine.apply(records, List.of(filter));

        assertEquals(1, result.records().size());
        assertEquals("paid", result.records().get(0).get("status"));
    }

    @Test
    void testEnrich_CopiesMatchedFields() {
        Map<String, Map<String, Object>> customers = new HashMap<>();
        customers.put("c1", row("customer_id", "c1", "customer_segment", "vip"));
        datasets.put("dim_customer", customers);
        List<Map<String, Object>> records = List.of(row("customer_id", "c1"), row("customer_id", "c2"));
        EnrichStep enrich = new EnrichStep("e", 1,
                List.of(EnrichmentJoin.of("dim_customer", "customer_id", List.of("customer_segment"))));

        TransformationResult result = engine.apply(records, List.of(enrich), TransformContext.forTenant("t1"));

        assertEquals("vip", result.records().get(0).get("customer_segment"));
        assertFalse(result.records().get(1).containsKey("customer_segment"));
    }

    @Test
    void testEnrich_UnknownDatasetFailsBeforeAnyRecord() {
        EnrichStep enrich = new EnrichStep("e", 1, List.of(EnrichmentJoin.of("missing", "id", List.of("x"))));

        assertThrows(ConfigurationException.class,
                () -> engine.apply(List.of(row("id", 1)), List.of(enrich), TransformContext.forTenant("t1")));
    }

    @Test
    void testValidateConfiguration_RejectsDuplicateOrder() {
        List<TransformationStep> steps = List.of(
                new MapStep("a", 1, List.of(new Calculation("x", "1"))),
                new MapStep("b", 1, List.of(new Calculation("y", "2"))));

        assertThrows(ConfigurationException.class, () -> engine.validateConfiguration(steps));
    }

    @Test
    void testValidateConfiguration_RejectsBadExpression() {
        List<TransformationStep> steps = List.of(new MapStep("a", 1, List.of(new Calculation("x", "price * (qty"))));

        assertThrows(ConfigurationException.class, () -> engine.validateConfiguration(steps));
    }

    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> record = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            record.put((String) keyValues[i], keyValues[i + 1]);
        }
        return record;
    }
}
