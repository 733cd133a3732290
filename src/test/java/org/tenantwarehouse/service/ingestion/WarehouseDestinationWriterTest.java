package org.tenantwarehouse.service.ingestion;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.tenantwarehouse.exceptions.LoadException;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WarehouseDestinationWriterTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    private WarehouseDestinationWriter writer;

    @BeforeEach
    void setUp() {
        writer = new WarehouseDestinationWriter(jdbcTemplate, new ObjectMapper());
    }

    @Test
    void testBuildUpsert_UpdatesEveryNonKeyColumn() {
        String sql = writer.buildUpsert("\"analytics_acme\".\"agg_daily_sales\"",
                List.of("tenant_id", "transaction_date", "location_id", "total_revenue"),
                List.of("tenant_id", "transaction_date", "location_id"));

        assertEquals("INSERT INTO \"analytics_acme\".\"agg_daily_sales\" (\"tenant_id\", \"transaction_date\", "
                + "\"location_id\", \"total_revenue\") VALUES (?, ?, ?, ?) ON CONFLICT (\"tenant_id\", "
                + "\"transaction_date\", \"location_id\") DO UPDATE SET \"total_revenue\" = EXCLUDED.\"total_revenue\"", sql);
    }

    @Test
    void testBuildUpsert_KeyOnlyRowsDoNothing() {
        String sql = writer.buildUpsert("\"t\"", List.of("id"), List.of("id"));

        assertTrue(sql.endsWith("ON CONFLICT (\"id\") DO NOTHING"));
    }

    @Test
    void testWrite_BatchesAndDropsUnknownFields() {
        // Given
        stubColumns("id", "amount");
        List<Map<String, Object>> records = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            Map<String, Object> record = new LinkedHashMap<>();
            record.put("ID", "id-" + i);
            record.put("amount", i);
            record.put("__table__", "transactions");
            records.add(record);
        }

        // When
        int written = writer.write("analytics_acme", "fact_transactions", List.of("id"), records, 2);

        // Then
        assertEquals(5, written);
        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<BatchPreparedStatementSetter> batches = ArgumentCaptor.forClass(BatchPreparedStatementSetter.class);
        verify(jdbcTemplate, times(3)).batchUpdate(sql.capture(), batches.capture());
        assertFalse(sql.getValue().contains("__table__"));
        assertEquals(List.of(2, 2, 1), batches.getAllValues().stream().map(BatchPreparedStatementSetter::getBatchSize).toList());
    }

    @Test
    void testWrite_NullKeyFailsBeforeWriting() {
        stubColumns("id", "amount");
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("id", null);
        record.put("amount", 3);

        assertThrows(LoadException.class,
                () -> writer.write("analytics_acme", "fact_transactions", List.of("id"), List.of(record), 10));
        verify(jdbcTemplate, never()).batchUpdate(anyString(), any(BatchPreparedStatementSetter.class));
    }

    @Test
    void testWrite_MissingTable() {
        when(jdbcTemplate.queryForList(anyString(), eq(String.class), eq("analytics_acme"), eq("nope")))
                .thenReturn(List.of());

        assertThrows(LoadException.class,
                () -> writer.write("analytics_acme", "nope", List.of("id"), List.of(Map.of("id", 1)), 10));
    }

    @Test
    void testWrite_EmptyBatchIsNoop() {
        assertEquals(0, writer.write("analytics_acme", "fact_transactions", List.of("id"), List.of(), 10));
        verifyNoInteractions(jdbcTemplate);
    }

    private void stubColumns(String... columns) {
        when(jdbcTemplate.queryForList(anyString(), eq(String.class), eq("analytics_acme"), eq("fact_transactions")))
                .thenReturn(List.of(columns));
    }
}
