package org.tenantwarehouse.service.ingestion;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.tenantwarehouse.exceptions.ConfigurationException;
import org.tenantwarehouse.exceptions.ExtractException;
import org.tenantwarehouse.models.enums.SourceKind;
import org.tenantwarehouse.models.pipeline.SourceDescriptor;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ApiRecordExtractorTest {

    private static final Instant WATERMARK = Instant.parse("2024-03-01T06:00:00Z");

    private static final String BODY = "{\"data\":{\"items\":["
            + "{\"id\":1,\"tenant\":\"acme\",\"updated\":\"2024-03-01T05:00:00Z\"},"
            + "{\"id\":2,\"tenant\":\"acme\",\"updated\":\"2024-03-01T07:00:00Z\"},"
            + "{\"id\":3,\"tenant\":\"globex\",\"updated\":\"2024-03-01T08:00:00Z\"}"
            + "]}}";

    @Mock
    private RestTemplate restTemplate;

    private ApiRecordExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new ApiRecordExtractor(restTemplate, new ObjectMapper());
    }

    @Test
    void testExtract_ServerSideWatermarkAndTenantParameters() {
        // Given
        respondWith(BODY);
        SourceDescriptor source = apiSource(Map.of("url", "https://api.example.com/v1/orders",
                "recordsPath", "data.items", "tenantParameter", "tenant", "sinceParameter", "since",
                "headers", Map.of("X-Api-Key", "secret")));

        // When
        List<Map<String, Object>> rows = extractor.extract("acme", source, WATERMARK);

        // Then
        assertEquals(List.of(1, 2), rows.stream().map(row -> row.get("id")).toList());
        ArgumentCaptor<URI> uri = ArgumentCaptor.forClass(URI.class);
        ArgumentCaptor<HttpEntity> request = ArgumentCaptor.forClass(HttpEntity.class);
        verify(restTemplate).exchange(uri.capture(), eq(HttpMethod.GET), request.capture(), eq(String.class));
        assertEquals("/v1/orders", uri.getValue().getPath());
        assertTrue(uri.getValue().getQuery().contains("tenant=acme"));
        assertTrue(uri.getValue().getQuery().contains("since=2024-03-01T06:00:00Z"));
        assertEquals("secret", request.getValue().getHeaders().getFirst("X-Api-Key"));
    }

    @Test
    void testExtract_WatermarkAppliedToRecordsWithoutSinceParameter() {
        // Given
        respondWith(BODY);
        SourceDescriptor source = apiSource(Map.of("url", "https://api.example.com/v1/orders", "recordsPath", "data.items"));

        // When
        List<Map<String, Object>> rows = extractor.extract("acme", source, WATERMARK);

        // Then
        assertEquals(1, rows.size());
        assertEquals(2, rows.get(0).get("id"));
    }

    @Test
    void testExtract_TopLevelArrayAndEmptyBody() {
        respondWith("[{\"id\":7}]");
        SourceDescriptor source = apiSource(Map.of("url", "https://api.example.com/v1/products"));

        assertEquals(List.of(Map.of("id", 7)), extractor.extract("acme", source, null));

        respondWith("");
        assertTrue(extractor.extract("acme", source, null).isEmpty());
    }

    @Test
    void testExtract_MalformedResponses() {
        SourceDescriptor source = apiSource(Map.of("url", "https://api.example.com/v1/orders", "recordsPath", "data"));

        respondWith("{\"data\":");
        assertThrows(ExtractException.class, () -> extractor.extract("acme", source, null));

        respondWith("{\"data\":{\"id\":1}}");
        assertThrows(ExtractException.class, () -> extractor.extract("acme", source, null));

        respondWith("{\"data\":[1, 2]}");
        assertThrows(ExtractException.class, () -> extractor.extract("acme", source, null));
    }

    @Test
    void testExtract_TransportFailureIsExtractException() {
        when(restTemplate.exchange(any(URI.class), eq(HttpMethod.GET), any(HttpEntity.class), eq(String.class)))
                .thenThrow(new ResourceAccessException("connect timed out"));
        SourceDescriptor source = apiSource(Map.of("url", "https://api.example.com/v1/orders"));

        ExtractException exception = assertThrows(ExtractException.class, () -> extractor.extract("acme", source, null));
        assertTrue(exception.getMessage().contains("api.example.com/v1/orders"));
    }

    @Test
    void testExtract_MissingUrl() {
        assertThrows(ConfigurationException.class, () -> extractor.extract("acme", apiSource(Map.of()), null));
        verifyNoInteractions(restTemplate);
    }

    private void respondWith(String body) {
        when(restTemplate.exchange(any(URI.class), eq(HttpMethod.GET), any(HttpEntity.class), eq(String.class)))
                .thenReturn(ResponseEntity.ok(body));
    }

    private SourceDescriptor apiSource(Map<String, Object> options) {
        return new SourceDescriptor(SourceKind.API, List.of(), null, "tenant", "updated", options);
    }
}
