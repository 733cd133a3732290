package org.tenantwarehouse.service.scheduling;

import lombok.extern.slf4j.Slf4j;
import org.tenantwarehouse.models.dto.AggregationJobPayload;
import org.tenantwarehouse.models.dto.AnalyticsSettings;
import org.tenantwarehouse.models.dto.EtlJobPayload;
import org.tenantwarehouse.models.enums.AggregationInterval;
import org.tenantwarehouse.models.pipeline.PipelineDefinition;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Owns every tenant's triggers. Registering a tenant replaces its whole trigger set; a trigger only
 * hands a payload to the {@link JobDispatcher}.
 */
@Slf4j
@Component
public class AnalyticsScheduler {

    private final TaskScheduler taskScheduler;
    private final JobDispatcher jobDispatcher;

    private final Map<String, Map<String, ScheduledFuture<?>>> triggersByTenant = new ConcurrentHashMap<>();
    private final Map<String, Object> tenantLocks = new ConcurrentHashMap<>();

    public AnalyticsScheduler(@Qualifier("analyticsTriggerScheduler") TaskScheduler taskScheduler,
                              JobDispatcher jobDispatcher) {
        this.taskScheduler = taskScheduler;
        this.jobDispatcher = jobDispatcher;
    }

    /**
     * @return the names of the registered triggers: pipeline ids and {@code aggregation:<interval>}
     */
    public Set<String> registerTenant(AnalyticsSettings settings, List<PipelineDefinition> pipelines) {
        String tenantId = settings.tenantId();
        Map<String, ScheduledFuture<?>> triggers = new LinkedHashMap<>();
        synchronized (lockFor(tenantId)) {
            cancelAll(tenantId);
            try {
                for (PipelineDefinition pipeline : pipelines) {
                    if (!pipeline.isEnabled() || pipeline.getSchedule() == null) {
                        continue;
                    }
                    EtlJobPayload payload = new EtlJobPayload(pipeline.getId());
                    String cron = CronExpressions.normalize(pipeline.getSchedule().expression());
                    triggers.put(pipeline.getId(), taskScheduler.schedule(() -> jobDispatcher.dispatch(payload), new CronTrigger(cron)));
                }
                for (AggregationInterval interval : intervalsFor(settings)) {
                    AggregationJobPayload payload = new AggregationJobPayload(tenantId, interval);
                    triggers.put(aggregationTrigger(interval),
                            taskScheduler.schedule(() -> jobDispatcher.dispatch(payload), new CronTrigger(interval.cron())));
                }
            } catch (RuntimeException exception) {
                triggers.values().forEach(trigger -> trigger.cancel(false));
                triggersByTenant.remove(tenantId);
                throw exception;
            }
            triggersByTenant.put(tenantId, triggers);
        }
        log.info("Registered {} triggers for tenant {}", triggers.size(), tenantId);
        return Set.copyOf(triggers.keySet());
    }

    public void unregisterTenant(String tenantId) {
        synchronized (lockFor(tenantId)) {
            int cancelled = cancelAll(tenantId);
            triggersByTenant.remove(tenantId);
            log.info("Cancelled {} triggers for tenant {}", cancelled, tenantId);
        }
    }

    public Set<String> triggersFor(String tenantId) {
        Map<String, ScheduledFuture<?>> triggers = triggersByTenant.get(tenantId);
        return triggers == null ? Set.of() : Set.copyOf(triggers.keySet());
    }

    static String aggregationTrigger(AggregationInterval interval) {
        return "aggregation:" + interval.label();
    }

    private Set<AggregationInterval> intervalsFor(AnalyticsSettings settings) {
        Set<AggregationInterval> intervals = EnumSet.noneOf(AggregationInterval.class);
        intervals.addAll(settings.aggregationIntervals());
        if (settings.enabledMetrics().isEmpty()) {
            intervals.remove(AggregationInterval.REALTIME);
        } else {
            intervals.add(AggregationInterval.REALTIME);
        }
        return intervals;
    }

    private int cancelAll(String tenantId) {
        Map<String, ScheduledFuture<?>> existing = triggersByTenant.get(tenantId);
        if (existing == null) {
            return 0;
        }
        List<ScheduledFuture<?>> futures = new ArrayList<>(existing.values());
        futures.forEach(trigger -> trigger.cancel(false));
        return futures.size();
    }

    private Object lockFor(String tenantId) {
        return tenantLocks.computeIfAbsent(tenantId, id -> new Object());
    }
}
