package org.tenantwarehouse.models.pipeline;

public record PerformanceBreakdown(long extractMs, long transformMs, long loadMs, long totalMs) {

    public static PerformanceBreakdown empty() {
        return new PerformanceBreakdown(0, 0, 0, 0);
    }
}
