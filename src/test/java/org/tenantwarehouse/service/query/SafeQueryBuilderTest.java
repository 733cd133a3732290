package org.tenantwarehouse.service.query;

import org.junit.jupiter.api.Test;
import org.tenantwarehouse.exceptions.ConfigurationException;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SafeQueryBuilderTest {

    @Test
    void testBuild_GroupsPlainItemsByPosition() {
        SafeQueryBuilder.BuiltQuery query = SafeQueryBuilder.select()
                .dateTrunc("day", "transaction_date", "period_start")
                .column("location_id")
                .aggregate("sum", "total_amount", "value")
                .from("analytics_acme", "fact_transactions")
                .where("transaction_date", ">=", LocalDate.of(2024, 1, 1))
                .whereNotNull("location_id")
                .orderBy("period_start")
                .limit(100)
                .build();

        assertEquals("SELECT DATE_TRUNC('day', \"transaction_date\") AS \"period_start\", \"location_id\", "
                + "SUM(\"total_amount\") AS \"value\" FROM \"analytics_acme\".\"fact_transactions\" "
                + "WHERE \"transaction_date\" >= ? AND \"location_id\" IS NOT NULL GROUP BY 1, 2 "
                + "ORDER BY \"period_start\" LIMIT 100", query.sql());
        assertEquals(List.of(LocalDate.of(2024, 1, 1)), query.params());
    }

    @Test
    void testBuild_AllowsNullParameter() {
        SafeQueryBuilder.BuiltQuery query = SafeQueryBuilder.select()
                .countDistinct("customer_id", "value")
                .from("fact_customers")
                .where("location_id", "=", null)
                .build();

        assertEquals(Arrays.asList((Object) null), query.params());
        assertFalse(query.sql().contains("GROUP BY"));
    }

    @Test
    void testBuild_RejectsUnsafePieces() {
        assertThrows(ConfigurationException.class, () -> SafeQueryBuilder.select().column("a; drop table x"));
        assertThrows(ConfigurationException.class, () -> SafeQueryBuilder.select().aggregate("string_agg", "a", "b"));
        assertThrows(ConfigurationException.class, () -> SafeQueryBuilder.select().dateTrunc("millennium'", "a", "b"));
        assertThrows(ConfigurationException.class, () -> SafeQueryBuilder.select().column("a").from("t").where("a", "like", "x"));
        assertThrows(ConfigurationException.class, () -> SafeQueryBuilder.select().column("a").build());
    }
}
