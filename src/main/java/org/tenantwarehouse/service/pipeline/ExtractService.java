package org.tenantwarehouse.service.pipeline;

import lombok.RequiredArgsConstructor;
import org.tenantwarehouse.exceptions.AnalyticsException;
import org.tenantwarehouse.exceptions.ConfigurationException;
import org.tenantwarehouse.exceptions.ExtractException;
import org.tenantwarehouse.models.pipeline.PipelineDefinition;
import org.tenantwarehouse.models.pipeline.SourceDescriptor;
import org.tenantwarehouse.service.ingestion.RecordExtractor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class ExtractService {

    private final List<RecordExtractor> extractors;

    /**
     * Full extract when {@code watermark} is null or the source has no watermark column, otherwise
     * only records changed after {@code watermark}.
     */
    public List<Map<String, Object>> extract(PipelineDefinition pipeline, Instant watermark) {
        SourceDescriptor source = pipeline.getSource();
        RecordExtractor extractor = extractors.stream()
                .filter(candidate -> candidate.supports(source.kind()))
                .findFirst()
                .orElseThrow(() -> new ConfigurationException("No extractor for source kind " + source.kind()));
        try {
            return extractor.extract(pipeline.getTenantId(), source, watermark);
        } catch (AnalyticsException exception) {
            throw exception;
        } catch (RuntimeException exception) {
            throw new ExtractException("Extract failed for pipeline " + pipeline.getId() + ": " + exception.getMessage(), exception);
        }
    }
}
