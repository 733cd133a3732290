package org.tenantwarehouse.service.warehouse;

import org.junit.jupiter.api.Test;
import org.tenantwarehouse.configuration.AnalyticsProperties;
import org.tenantwarehouse.exceptions.ConfigurationException;

import static org.junit.jupiter.api.Assertions.*;

class TenantSchemaNamingTest {

    private final TenantSchemaNaming naming = new TenantSchemaNaming(new AnalyticsProperties());

    @Test
    void testSchemaFor_SanitizesTenantId() {
        assertEquals("analytics_3f2504e0_4f89_11d3", naming.schemaFor("3F2504E0-4f89-11D3"));
        assertEquals("analytics_acme_corp_", naming.schemaFor("Acme Corp!"));
    }

    @Test
    void testSchemaFor_TruncatesToIdentifierLimit() {
        String schema = naming.schemaFor("x".repeat(100));

        assertEquals(TenantSchemaNaming.MAX_IDENTIFIER_LENGTH, schema.length());
        assertTrue(schema.startsWith("analytics_xxx"));
    }

    @Test
    void testSchemaFor_LongIdsSharingPrefixStayDistinct() {
        // Given
        String common = "enterprise-customer-with-a-very-long-organisation-name-";

        // When
        String first = naming.schemaFor(common + "emea-division");
        String second = naming.schemaFor(common + "apac-division");

        // Then
        assertNotEquals(first, second);
        assertEquals(TenantSchemaNaming.MAX_IDENTIFIER_LENGTH, first.length());
        assertEquals(TenantSchemaNaming.MAX_IDENTIFIER_LENGTH, second.length());
        assertTrue(first.matches("analytics_enterprise_customer_[a-z0-9_]+_[0-9a-f]{8}"));
        assertEquals(first, naming.schemaFor(common + "emea-division"));
    }

    @Test
    void testSchemaFor_ShortIdsHaveNoHashSuffix() {
        assertEquals("analytics_acme_corp", naming.schemaFor("acme-corp"));
    }

    @Test
    void testSchemaFor_RejectsBlankTenant() {
        assertThrows(ConfigurationException.class, () -> naming.schemaFor(" "));
    }
}
