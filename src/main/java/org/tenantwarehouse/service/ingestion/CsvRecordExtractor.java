package org.tenantwarehouse.service.ingestion;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.tenantwarehouse.exceptions.ConfigurationException;
import org.tenantwarehouse.exceptions.ExtractException;
import org.tenantwarehouse.models.enums.SourceKind;
import org.tenantwarehouse.models.pipeline.SourceDescriptor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a headered CSV file. Values stay strings; empty cells become {@code null}. Rows with a
 * tenant column that names another tenant are skipped, and the watermark is applied in memory.
 */
@Component
public class CsvRecordExtractor implements RecordExtractor {

    @Override
    public boolean supports(SourceKind kind) {
        return kind == SourceKind.FILE;
    }

    @Override
    public List<Map<String, Object>> extract(String tenantId, SourceDescriptor source, Instant watermark) {
        Path path = resolvePath(source.options());
        String delimiter = stringValue(source.options().getOrDefault("delimiter", ","));
        Charset charset = resolveCharset(stringValue(source.options().getOrDefault("encoding", "UTF-8")));

        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setHeader()
                .setSkipHeaderRecord(true)
                .setAllowMissingColumnNames(true)
                .setTrim(true)
                .build();

        String tenantColumn = source.tenantColumn();
        boolean incremental = source.isIncremental() && watermark != null;
        try (Reader reader = Files.newBufferedReader(path, charset);
             CSVParser parser = new CSVParser(reader, format)) {
            boolean tenantScoped = StringUtils.hasText(tenantColumn) && parser.getHeaderMap().containsKey(tenantColumn);
            List<Map<String, Object>> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                Map<String, Object> row = new LinkedHashMap<>();
                record.toMap().forEach((column, value) -> row.put(column, StringUtils.hasLength(value) ? value : null));
                if (tenantScoped && !tenantId.equals(row.get(tenantColumn))) {
                    continue;
                }
                if (incremental && !Watermarks.isAfter(row.get(source.watermarkColumn()), watermark)) {
                    continue;
                }
                rows.add(row);
            }
            return rows;
        } catch (IOException exception) {
            throw new ExtractException("Failed to read CSV source " + path + ": " + exception.getMessage(), exception);
        }
    }

    private Path resolvePath(Map<String, Object> options) {
        String path = stringValue(options.get("filePath"));
        if (!StringUtils.hasText(path)) {
            path = stringValue(options.get("relativePath"));
        }
        if (!StringUtils.hasText(path)) {
            throw new ConfigurationException("CSV source missing filePath or relativePath");
        }
        return Path.of(path);
    }

    private Charset resolveCharset(String name) {
        try {
            return Charset.forName(name);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException exception) {
            throw new ConfigurationException("Unsupported CSV encoding: " + name, exception);
        }
    }

    private String stringValue(Object value) {
        return value == null ? null : value.toString();
    }
}
