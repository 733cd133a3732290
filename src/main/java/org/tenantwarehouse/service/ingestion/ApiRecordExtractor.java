package org.tenantwarehouse.service.ingestion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.tenantwarehouse.exceptions.ConfigurationException;
import org.tenantwarehouse.exceptions.ExtractException;
import org.tenantwarehouse.models.enums.SourceKind;
import org.tenantwarehouse.models.pipeline.SourceDescriptor;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Pulls records from a JSON HTTP endpoint.
 * <p>
 * Options: {@code url} (required), {@code recordsPath} (dot path to the record array; the body
 * itself when absent), {@code tenantParameter} and {@code sinceParameter} (query parameters that
 * carry the tenant id and the ISO-8601 watermark), {@code headers} (extra request headers).
 * Without a {@code sinceParameter} the watermark is applied to the returned records.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApiRecordExtractor implements RecordExtractor {

    private static final TypeReference<Map<String, Object>> RECORD = new TypeReference<>() {
    };

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public boolean supports(SourceKind kind) {
        return kind == SourceKind.API;
    }

    @Override
    public List<Map<String, Object>> extract(String tenantId, SourceDescriptor source, Instant watermark) {
        String url = stringValue(source.option("url"));
        if (!StringUtils.hasText(url)) {
            throw new ConfigurationException("API source requires a url option");
        }
        String tenantParameter = stringValue(source.option("tenantParameter"));
        String sinceParameter = stringValue(source.option("sinceParameter"));
        boolean incremental = source.isIncremental() && watermark != null;

        UriComponentsBuilder uriBuilder = UriComponentsBuilder.fromHttpUrl(url);
        if (StringUtils.hasText(tenantParameter)) {
            uriBuilder.queryParam(tenantParameter, tenantId);
        }
        if (incremental && StringUtils.hasText(sinceParameter)) {
            uriBuilder.queryParam(sinceParameter, watermark.toString());
        }
        URI uri = uriBuilder.build().encode().toUri();

        String body;
        try {
            ResponseEntity<String> response = restTemplate.exchange(uri, HttpMethod.GET,
                    new HttpEntity<>(buildHeaders(source.option("headers"))), String.class);
            body = response.getBody();
        } catch (RestClientException exception) {
            throw new ExtractException("API source " + uri.getHost() + uri.getPath() + " failed: " + exception.getMessage(), exception);
        }

        List<Map<String, Object>> rows = parseRecords(body, stringValue(source.option("recordsPath")));
        String tenantColumn = source.tenantColumn();
        List<Map<String, Object>> scoped = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            if (StringUtils.hasText(tenantColumn) && row.containsKey(tenantColumn)
                    && !tenantId.equals(stringValue(row.get(tenantColumn)))) {
                continue;
            }
            if (incremental && !StringUtils.hasText(sinceParameter)
                    && !Watermarks.isAfter(row.get(source.watermarkColumn()), watermark)) {
                continue;
            }
            scoped.add(row);
        }
        log.info("ApiRecordExtractor: {} of {} records kept from {} for tenant {}",
                scoped.size(), rows.size(), uri.getPath(), tenantId);
        return scoped;
    }

    private HttpHeaders buildHeaders(Object configured) {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (configured instanceof Map<?, ?> map) {
            map.forEach((name, value) -> headers.set(String.valueOf(name), stringValue(value)));
        }
        return headers;
    }

    private List<Map<String, Object>> parseRecords(String body, String recordsPath) {
        if (!StringUtils.hasText(body)) {
            return List.of();
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(body);
        } catch (JsonProcessingException exception) {
            throw new ExtractException("API source returned invalid JSON: " + exception.getOriginalMessage(), exception);
        }
        if (StringUtils.hasText(recordsPath)) {
            for (String part : recordsPath.split("\\.")) {
                node = node.path(part);
            }
        }
        if (node.isMissingNode() || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new ExtractException("API source records at '" + recordsPath + "' are not an array");
        }
        List<Map<String, Object>> rows = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            if (!element.isObject()) {
                throw new ExtractException("API source returned a non-object record: " + element);
            }
            rows.add(objectMapper.convertValue(element, RECORD));
        }
        return rows;
    }

    private String stringValue(Object value) {
        return value == null ? null : value.toString();
    }
}
