package org.tenantwarehouse.models.enums;

import java.util.Locale;

/**
 * Fixed-interval aggregation triggers and the Spring cron expression each one fires on.
 */
public enum AggregationInterval {
    REALTIME("0 */5 * * * *", null),
    HOURLY("0 0 * * * *", "hour"),
    DAILY("0 0 2 * * *", "day"),
    WEEKLY("0 0 2 * * SUN", "week"),
    MONTHLY("0 0 3 1 * *", "month");

    private final String cron;
    private final String datePart;

    AggregationInterval(String cron, String datePart) {
        this.cron = cron;
        this.datePart = datePart;
    }

    public String cron() {
        return cron;
    }

    /**
     * The {@code date_trunc} field for rollups, or {@code null} for the real-time snapshot.
     */
    public String datePart() {
        return datePart;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
