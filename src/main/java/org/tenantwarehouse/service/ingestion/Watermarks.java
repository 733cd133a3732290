package org.tenantwarehouse.service.ingestion;

import org.tenantwarehouse.utils.TemporalValues;

import java.time.Instant;

/**
 * Watermark comparison for sources that cannot filter on the server side.
 */
final class Watermarks {

    private Watermarks() {
    }

    /**
     * True when {@code value} is after {@code watermark}, or when the value cannot be read as a
     * point in time (the record is kept and upserted again).
     */
    static boolean isAfter(Object value, Instant watermark) {
        return TemporalValues.toInstant(value).map(instant -> instant.isAfter(watermark)).orElse(true);
    }
}
