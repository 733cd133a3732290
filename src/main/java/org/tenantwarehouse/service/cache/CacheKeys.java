package org.tenantwarehouse.service.cache;

/**
 * Key grammar shared with the dashboard and report layers: {@code {namespace}:{tenantId}:{entityId}}.
 */
public final class CacheKeys {

    public static final String ANALYTICS_QUERY = "analytics-query";
    public static final String REALTIME_METRICS = "realtime-metrics";
    public static final String ETL_OUTPUT = "etl-output";

    private static final String SEPARATOR = ":";

    private CacheKeys() {
    }

    public static String key(String namespace, String tenantId, String entityId) {
        return namespace + SEPARATOR + tenantId + SEPARATOR + entityId;
    }

    public static String analyticsQuery(String tenantId, String queryId) {
        return key(ANALYTICS_QUERY, tenantId, queryId);
    }

    public static String realtimeMetrics(String tenantId) {
        return key(REALTIME_METRICS, tenantId, "current");
    }

    public static String etlOutput(String tenantId, String pipelineId) {
        return key(ETL_OUTPUT, tenantId, pipelineId);
    }

    public static String tenantPrefix(String namespace, String tenantId) {
        return namespace + SEPARATOR + tenantId + SEPARATOR;
    }
}
