package org.tenantwarehouse.configuration;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties(prefix = "analytics")
public class AnalyticsProperties {

    private Query query = new Query();
    private Etl etl = new Etl();
    private Warehouse warehouse = new Warehouse();
    private Scheduler scheduler = new Scheduler();
    private Cache cache = new Cache();

    @Getter
    @Setter
    public static class Query {
        private Duration defaultTimeout = Duration.ofSeconds(30);
        private Duration defaultCacheTtl = Duration.ofMinutes(5);
        private int performanceHistorySize = 1000;
        private Duration slowQueryThreshold = Duration.ofSeconds(1);
        private boolean rejectUnsafeSql = true;
    }

    @Getter
    @Setter
    public static class Etl {
        private int batchSize = 1000;
        private int maxErrorMessages = 100;
    }

    @Getter
    @Setter
    public static class Warehouse {
        private String schemaPrefix = "analytics_";
        private long largeTableThresholdBytes = 100_000_000L;
        private int partitionMonthsAhead = 12;
    }

    @Getter
    @Setter
    public static class Scheduler {
        private int workerPoolSize = 4;
        private int queryPoolSize = 8;
        private int queueCapacity = 500;
    }

    @Getter
    @Setter
    public static class Cache {
        /**
         * {@code memory} or {@code redis}.
         */
        private String store = "memory";
    }
}
