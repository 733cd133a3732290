package org.tenantwarehouse.service.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.tenantwarehouse.exceptions.ConfigurationException;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * SHA-256 over the whitespace-normalised SQL and the JSON form of its parameters, hex encoded.
 */
@Component
@RequiredArgsConstructor
public class QueryIdGenerator {

    private final ObjectMapper objectMapper;

    public String generate(String sql, List<Object> params) {
        String normalized = sql.trim().replaceAll("\\s+", " ");
        String serializedParams;
        try {
            serializedParams = objectMapper.writeValueAsString(params == null ? List.of() : params);
        } catch (JsonProcessingException exception) {
            throw new ConfigurationException("Query parameters are not serializable: " + exception.getOriginalMessage(), exception);
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(normalized.getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update(serializedParams.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException exception) {
            throw new IllegalStateException("SHA-256 not available", exception);
        }
    }
}
