package org.tenantwarehouse.service.ingestion;

import org.tenantwarehouse.models.enums.SourceKind;
import org.tenantwarehouse.models.pipeline.SourceDescriptor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public interface RecordExtractor {

    boolean supports(SourceKind kind);

    /**
     * Reads the tenant's records from {@code source}. With a non-null {@code watermark} and a
     * watermark column on the source, only records changed after the watermark are returned.
     *
     * @throws org.tenantwarehouse.exceptions.ExtractException if the source cannot be read
     */
    List<Map<String, Object>> extract(String tenantId, SourceDescriptor source, Instant watermark);
}
