package org.tenantwarehouse.service.scheduling;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.tenantwarehouse.exceptions.ConfigurationException;
import org.tenantwarehouse.models.dto.AggregationJobPayload;
import org.tenantwarehouse.models.dto.AnalyticsSettings;
import org.tenantwarehouse.models.dto.EtlJobPayload;
import org.tenantwarehouse.models.enums.AggregationInterval;
import org.tenantwarehouse.models.pipeline.Destination;
import org.tenantwarehouse.models.pipeline.PipelineDefinition;
import org.tenantwarehouse.models.pipeline.Schedule;
import org.tenantwarehouse.models.pipeline.SourceDescriptor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.support.CronTrigger;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AnalyticsSchedulerTest {

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private JobDispatcher jobDispatcher;

    @Mock
    private ScheduledFuture<Object> future;

    private AnalyticsScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new AnalyticsScheduler(taskScheduler, jobDispatcher);
    }

    @Test
    void testRegisterTenant_PipelineAndIntervalTriggers() {
        // Given
        doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
        AnalyticsSettings settings = new AnalyticsSettings("acme", 365,
                Set.of(AggregationInterval.DAILY, AggregationInterval.HOURLY), List.of("daily_revenue"));

        // When
        Set<String> triggers = scheduler.registerTenant(settings,
                List.of(pipeline("acme-etl", "0 */4 * * *", true), pipeline("acme-off", "0 1 * * *", false)));

        // Then
        assertEquals(Set.of("acme-etl", "aggregation:hourly", "aggregation:daily", "aggregation:realtime"), triggers);
        ArgumentCaptor<Trigger> scheduled = ArgumentCaptor.forClass(Trigger.class);
        verify(taskScheduler, times(4)).schedule(any(Runnable.class), scheduled.capture());
        assertTrue(scheduled.getAllValues().stream()
                .anyMatch(trigger -> ((CronTrigger) trigger).getExpression().equals("0 0 */4 * * *")));
    }

    @Test
    void testRegisterTenant_NoMetricsMeansNoRealtimeTrigger() {
        doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
        AnalyticsSettings settings = new AnalyticsSettings("acme", 365,
                Set.of(AggregationInterval.REALTIME, AggregationInterval.MONTHLY), List.of());

        Set<String> triggers = scheduler.registerTenant(settings, List.of());

        assertEquals(Set.of("aggregation:monthly"), triggers);
    }

    @Test
    void testRegisterTenant_ReplacesPreviousTriggers() {
        doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
        AnalyticsSettings settings = new AnalyticsSettings("acme", 365, Set.of(AggregationInterval.DAILY), List.of());

        scheduler.registerTenant(settings, List.of(pipeline("acme-etl", "0 2 * * *", true)));
        scheduler.registerTenant(settings, List.of());

        verify(future, times(2)).cancel(false);
        assertEquals(Set.of("aggregation:daily"), scheduler.triggersFor("acme"));
    }

    @Test
    void testTrigger_OnlyDispatches() {
        doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
        AnalyticsSettings settings = new AnalyticsSettings("acme", 365, Set.of(AggregationInterval.WEEKLY), List.of());
        scheduler.registerTenant(settings, List.of(pipeline("acme-etl", "0 2 * * *", true)));

        ArgumentCaptor<Runnable> tasks = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler, times(2)).schedule(tasks.capture(), any(Trigger.class));
        tasks.getAllValues().forEach(Runnable::run);

        verify(jobDispatcher).dispatch(new EtlJobPayload("acme-etl"));
        verify(jobDispatcher).dispatch(new AggregationJobPayload("acme", AggregationInterval.WEEKLY));
    }

    @Test
    void testRegisterTenant_InvalidCronLeavesNoTriggers() {
        doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
        AnalyticsSettings settings = new AnalyticsSettings("acme", 365, Set.of(), List.of());
        scheduler.registerTenant(settings, List.of(pipeline("acme-etl", "0 2 * * *", true)));

        assertThrows(ConfigurationException.class,
                () -> scheduler.registerTenant(settings, List.of(pipeline("acme-bad", "every day", true))));
        verify(future).cancel(false);
        assertTrue(scheduler.triggersFor("acme").isEmpty());
    }

    @Test
    void testUnregisterTenant_CancelsEverything() {
        doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
        scheduler.registerTenant(new AnalyticsSettings("acme", 365, Set.of(AggregationInterval.DAILY), List.of()),
                List.of(pipeline("acme-etl", "0 2 * * *", true)));

        scheduler.unregisterTenant("acme");

        verify(future, times(2)).cancel(false);
        assertTrue(scheduler.triggersFor("acme").isEmpty());
    }

    private static PipelineDefinition pipeline(String id, String cron, boolean enabled) {
        return PipelineDefinition.builder()
                .id(id)
                .tenantId("acme")
                .name(id)
                .source(SourceDescriptor.database(List.of("transactions"), null))
                .destination(Destination.warehouse("fact_transactions", List.of("id")))
                .schedule(Schedule.cron(cron))
                .enabled(enabled)
                .build();
    }
}
