package org.tenantwarehouse.models.dto;

import jakarta.validation.constraints.Positive;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.tenantwarehouse.exceptions.ConfigurationException;
import org.tenantwarehouse.models.enums.AggregationInterval;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Data
@NoArgsConstructor
public class AnalyticsSettingsRequest {

    @Positive
    private Integer retentionDays;

    private List<String> aggregationIntervals = new ArrayList<>();

    private List<String> enabledMetrics = new ArrayList<>();

    public AnalyticsSettings toSettings(String tenantId) {
        Set<AggregationInterval> intervals = EnumSet.noneOf(AggregationInterval.class);
        if (aggregationIntervals != null) {
            for (String interval : aggregationIntervals) {
                try {
                    intervals.add(AggregationInterval.valueOf(interval.trim().toUpperCase(Locale.ROOT)));
                } catch (IllegalArgumentException | NullPointerException exception) {
                    throw new ConfigurationException("Unsupported aggregation interval: " + interval, exception);
                }
            }
        }
        return new AnalyticsSettings(tenantId,
                retentionDays == null ? AnalyticsSettings.DEFAULT_RETENTION_DAYS : retentionDays,
                intervals,
                enabledMetrics);
    }
}
