package org.tenantwarehouse.service.scheduling;

import org.junit.jupiter.api.Test;
import org.tenantwarehouse.exceptions.ConfigurationException;

import static org.junit.jupiter.api.Assertions.*;

class CronExpressionsTest {

    @Test
    void testNormalize_FiveFieldsGetSeconds() {
        assertEquals("0 0 */4 * * *", CronExpressions.normalize("0 */4 * * *"));
        assertEquals("0 30 2 * * *", CronExpressions.normalize("  30   2 * * * "));
    }

    @Test
    void testNormalize_SixFieldsUnchanged() {
        assertEquals("0 0 2 * * SUN", CronExpressions.normalize("0 0 2 * * SUN"));
    }

    @Test
    void testNormalize_Rejects() {
        assertThrows(ConfigurationException.class, () -> CronExpressions.normalize(null));
        assertThrows(ConfigurationException.class, () -> CronExpressions.normalize("* * *"));
        assertThrows(ConfigurationException.class, () -> CronExpressions.normalize("61 * * * *"));
    }
}
