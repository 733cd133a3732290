package org.tenantwarehouse.service.ingestion;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.tenantwarehouse.exceptions.ConfigurationException;
import org.tenantwarehouse.exceptions.ExtractException;
import org.tenantwarehouse.models.enums.SourceKind;
import org.tenantwarehouse.models.pipeline.SourceDescriptor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CsvRecordExtractorTest {

    private static final String ORDERS = "id,tenant_id,amount,updated_at\n"
            + "1,acme,10.50,2024-03-01T05:00:00Z\n"
            + "2,acme,,2024-03-01T07:00:00Z\n"
            + "3,globex,99,2024-03-01T08:00:00Z\n"
            + "4,acme,12,not a date\n";

    private final CsvRecordExtractor extractor = new CsvRecordExtractor();

    @TempDir
    Path directory;

    @Test
    void testExtract_FullReadKeepsOnlyTenantRows() throws IOException {
        // Given
        SourceDescriptor source = fileSource(write("orders.csv", ORDERS), null, Map.of());

        // When
        List<Map<String, Object>> rows = extractor.extract("acme", source, null);

        // Then
        assertEquals(3, rows.size());
        assertEquals("1", rows.get(0).get("id"));
        assertEquals("10.50", rows.get(0).get("amount"));
        assertNull(rows.get(1).get("amount"));
        assertTrue(rows.stream().allMatch(row -> "acme".equals(row.get("tenant_id"))));
    }

    @Test
    void testExtract_WatermarkKeepsNewerAndUnreadableRows() throws IOException {
        // Given
        SourceDescriptor source = fileSource(write("orders.csv", ORDERS), "updated_at", Map.of());

        // When
        List<Map<String, Object>> rows = extractor.extract("acme", source, Instant.parse("2024-03-01T06:00:00Z"));

        // Then
        assertEquals(List.of("2", "4"), rows.stream().map(row -> row.get("id")).toList());
    }

    @Test
    void testExtract_NoTenantColumnReadsEveryRow() throws IOException {
        // Given
        Path file = write("products.csv", "sku;name\nA-1;Widget\nB-2;Gadget\n");
        SourceDescriptor source = fileSource(file, null, Map.of("delimiter", ";"));

        // When
        List<Map<String, Object>> rows = extractor.extract("acme", source, null);

        // Then
        assertEquals(2, rows.size());
        assertEquals("Gadget", rows.get(1).get("name"));
    }

    @Test
    void testExtract_MissingFileIsExtractException() {
        SourceDescriptor source = fileSource(directory.resolve("missing.csv"), null, Map.of());

        assertThrows(ExtractException.class, () -> extractor.extract("acme", source, null));
    }

    @Test
    void testExtract_InvalidConfiguration() throws IOException {
        Path file = write("orders.csv", ORDERS);

        assertThrows(ConfigurationException.class, () -> extractor.extract("acme",
                new SourceDescriptor(SourceKind.FILE, List.of(), null, "tenant_id", null, Map.of()), null));
        assertThrows(ConfigurationException.class, () -> extractor.extract("acme",
                fileSource(file, null, Map.of("encoding", "no-such-charset")), null));
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(directory.resolve(name), content, StandardCharsets.UTF_8);
    }

    private SourceDescriptor fileSource(Path file, String watermarkColumn, Map<String, Object> options) {
        Map<String, Object> merged = new HashMap<>(options);
        merged.put("filePath", file.toString());
        return new SourceDescriptor(SourceKind.FILE, List.of(), null, "tenant_id", watermarkColumn, merged);
    }
}
