package org.tenantwarehouse.configuration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Thread pools: a single trigger thread that only enqueues, a worker pool for pipeline and
 * aggregation jobs, and a pool the query executor races its timeout against.
 */
@Configuration
public class ExecutorConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "analyticsTriggerScheduler")
    public ThreadPoolTaskScheduler analyticsTriggerScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("analytics-trigger-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean(name = "analyticsWorkerExecutor")
    public ThreadPoolTaskExecutor analyticsWorkerExecutor(AnalyticsProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getScheduler().getWorkerPoolSize());
        executor.setMaxPoolSize(properties.getScheduler().getWorkerPoolSize());
        executor.setQueueCapacity(properties.getScheduler().getQueueCapacity());
        executor.setThreadNamePrefix("analytics-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }

    @Bean(name = "analyticsQueryExecutor")
    public ThreadPoolTaskExecutor analyticsQueryExecutor(AnalyticsProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getScheduler().getQueryPoolSize());
        executor.setMaxPoolSize(properties.getScheduler().getQueryPoolSize());
        executor.setQueueCapacity(properties.getScheduler().getQueueCapacity());
        executor.setThreadNamePrefix("analytics-query-");
        return executor;
    }
}
