package org.tenantwarehouse.service.warehouse;

import org.tenantwarehouse.configuration.AnalyticsProperties;
import org.tenantwarehouse.exceptions.ConfigurationException;
import org.tenantwarehouse.utils.SqlIdentifiers;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Maps a tenant id onto its warehouse schema: the configured prefix followed by the lower-cased id
 * with every character outside {@code [a-z0-9]} replaced by {@code _}. Names over PostgreSQL's 63
 * character identifier limit are cut and end in {@code _} plus a hash of the full tenant id, so long
 * ids that share a prefix still get distinct schemas.
 */
@Component
public class TenantSchemaNaming {

    public static final int MAX_IDENTIFIER_LENGTH = 63;
    static final int HASH_LENGTH = 8;

    private final String prefix;

    public TenantSchemaNaming(AnalyticsProperties properties) {
        this.prefix = SqlIdentifiers.requireSafe(properties.getWarehouse().getSchemaPrefix());
    }

    public String schemaFor(String tenantId) {
        if (!StringUtils.hasText(tenantId)) {
            throw new ConfigurationException("Tenant id is required to resolve a warehouse schema");
        }
        String sanitized = tenantId.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "_");
        String schema = prefix + sanitized;
        if (schema.length() <= MAX_IDENTIFIER_LENGTH) {
            return schema;
        }
        String hash = DigestUtils.md5DigestAsHex(tenantId.getBytes(StandardCharsets.UTF_8)).substring(0, HASH_LENGTH);
        return schema.substring(0, MAX_IDENTIFIER_LENGTH - HASH_LENGTH - 1) + "_" + hash;
    }
}
