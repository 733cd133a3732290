package org.tenantwarehouse.service.pipeline;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.tenantwarehouse.configuration.AnalyticsProperties;
import org.tenantwarehouse.exceptions.ConfigurationException;
import org.tenantwarehouse.exceptions.LoadException;
import org.tenantwarehouse.exceptions.PipelineExecutionException;
import org.tenantwarehouse.exceptions.PipelineNotFoundException;
import org.tenantwarehouse.models.enums.PipelineStatus;
import org.tenantwarehouse.models.pipeline.Destination;
import org.tenantwarehouse.models.pipeline.JobResult;
import org.tenantwarehouse.models.pipeline.PipelineDefinition;
import org.tenantwarehouse.models.pipeline.SourceDescriptor;
import org.tenantwarehouse.models.transform.ValidateStep;
import org.tenantwarehouse.models.transform.ValidationRule;
import org.tenantwarehouse.repository.PipelineRunRepository;
import org.tenantwarehouse.service.ingestion.DestinationOutputService;
import org.tenantwarehouse.service.transform.TransformationEngine;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PipelineRunnerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");
    private static final Instant PREVIOUS_RUN = Instant.parse("2024-03-01T06:00:00Z");

    @Mock
    private ExtractService extractService;

    @Mock
    private DestinationOutputService destinationOutputService;

    @Mock
    private PipelineRunService pipelineRunService;

    private PipelineRegistry registry;
    private ThreadPoolTaskExecutor executor;
    private PipelineRunner runner;

    @BeforeEach
    void setUp() {
        AnalyticsProperties properties = new AnalyticsProperties();
        TransformationEngine engine = new TransformationEngine((tenantId, dataset, key) -> Map.of(), properties);
        registry = new PipelineRegistry(engine);
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.initialize();
        runner = new PipelineRunner(registry, extractService, engine, destinationOutputService, pipelineRunService,
                properties, Clock.fixed(NOW, ZoneOffset.UTC), executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void testRun_Success() {
        // Given
        PipelineDefinition pipeline = registry.register(pipeline("p1", true, PREVIOUS_RUN));
        List<Map<String, Object>> rows = List.of(Map.of("amt", 5), Map.of("amt", -1));
        when(extractService.extract(pipeline, PREVIOUS_RUN)).thenReturn(rows);
        when(destinationOutputService.write(eq(pipeline), anyList())).thenReturn(1);

        // When
        JobResult result = runner.run("p1");

        // Then
        assertEquals(PipelineStatus.COMPLETED, result.status());
        assertEquals(2, result.recordsProcessed());
        assertEquals(1, result.recordsSuccessful());
        assertEquals(1, result.recordsFailed());
        assertEquals(1, result.errors().size());
        assertEquals(NOW, pipeline.getLastRun());
        assertEquals(PipelineStatus.COMPLETED, pipeline.getStatus());
        assertFalse(runner.isRunning("p1"));
        verify(pipelineRunService).record(result);
    }

    @Test
    void testRun_FirstRunIsFullExtract() {
        PipelineDefinition pipeline = registry.register(pipeline("p1", true, null));
        when(extractService.extract(pipeline, null)).thenReturn(List.of());

        runner.run("p1");

        verify(extractService).extract(pipeline, null);
    }

    @Test
    void testRun_ZeroRecordsIsSuccess() {
        PipelineDefinition pipeline = registry.register(pipeline("p1", true, PREVIOUS_RUN));
        when(extractService.extract(any(), any())).thenReturn(List.of());
        when(destinationOutputService.write(eq(pipeline), anyList())).thenReturn(0);

        JobResult result = runner.run("p1");

        assertTrue(result.succeeded());
        assertEquals(0, result.recordsProcessed());
        assertEquals(NOW, pipeline.getLastRun());
    }

    @Test
    void testRun_LoadFailureMarksFailedAndKeepsWatermark() {
        // Given
        PipelineDefinition pipeline = registry.register(pipeline("p1", true, PREVIOUS_RUN));
        when(extractService.extract(any(), any())).thenReturn(List.of(Map.of("amt", 5)));
        when(destinationOutputService.write(eq(pipeline), anyList())).thenThrow(new LoadException("table missing"));

        // When
        PipelineExecutionException exception = assertThrows(PipelineExecutionException.class, () -> runner.run("p1"));

        // Then
        JobResult result = exception.getJobResult();
        assertEquals(PipelineStatus.FAILED, result.status());
        assertEquals(1, result.recordsProcessed());
        assertTrue(result.errors().contains("table missing"));
        assertInstanceOf(LoadException.class, exception.getCause());
        assertEquals(PipelineStatus.FAILED, pipeline.getStatus());
        assertEquals(PREVIOUS_RUN, pipeline.getLastRun());
        assertFalse(runner.isRunning("p1"));

        ArgumentCaptor<JobResult> recorded = ArgumentCaptor.forClass(JobResult.class);
        verify(pipelineRunService).record(recorded.capture());
        assertEquals(PipelineStatus.FAILED, recorded.getValue().status());
    }

    @Test
    void testRun_ConcurrentCallersShareOneRun() throws Exception {
        // Given
        PipelineDefinition pipeline = registry.register(pipeline("p1", true, PREVIOUS_RUN));
        CountDownLatch extracting = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(extractService.extract(any(), any())).thenAnswer(invocation -> {
            extracting.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return List.of(Map.of("amt", 5));
        });
        when(destinationOutputService.write(eq(pipeline), anyList())).thenReturn(1);

        // When
        CompletableFuture<JobResult> first = runner.submit("p1");
        assertTrue(extracting.await(5, TimeUnit.SECONDS));
        assertTrue(runner.isRunning("p1"));
        CompletableFuture<JobResult> second = runner.submit("p1");
        CompletableFuture<JobResult> third = runner.submit("p1");
        Thread.sleep(200);
        release.countDown();

        // Then
        JobResult result = first.get(5, TimeUnit.SECONDS);
        assertSame(result, second.get(5, TimeUnit.SECONDS));
        assertSame(result, third.get(5, TimeUnit.SECONDS));
        verify(extractService, times(1)).extract(any(), any());
        verify(pipelineRunService, times(1)).record(any());
    }

    @Test
    void testRun_ErrorInRunReleasesWaitingCallers() throws Exception {
        // Given
        PipelineDefinition pipeline = registry.register(pipeline("p1", true, PREVIOUS_RUN));
        CountDownLatch extracting = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(extractService.extract(any(), any())).thenAnswer(invocation -> {
            extracting.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            throw new StackOverflowError("deep expression");
        });

        // When
        CompletableFuture<JobResult> first = runner.submit("p1");
        assertTrue(extracting.await(5, TimeUnit.SECONDS));
        CompletableFuture<JobResult> second = runner.submit("p1");
        Thread.sleep(200);
        release.countDown();

        // Then
        ExecutionException failure = assertThrows(ExecutionException.class, () -> first.get(5, TimeUnit.SECONDS));
        assertInstanceOf(StackOverflowError.class, failure.getCause());
        assertThrows(ExecutionException.class, () -> second.get(5, TimeUnit.SECONDS));
        assertEquals(PipelineStatus.FAILED, pipeline.getStatus());
        assertEquals(PREVIOUS_RUN, pipeline.getLastRun());
        assertFalse(runner.isRunning("p1"));
        ArgumentCaptor<JobResult> recorded = ArgumentCaptor.forClass(JobResult.class);
        verify(pipelineRunService, atLeastOnce()).record(recorded.capture());
        assertEquals(PipelineStatus.FAILED, recorded.getValue().status());
        assertTrue(recorded.getValue().errors().contains("deep expression"));
    }

    @Test
    void testRun_HistoryStoreDownDoesNotFailRun() {
        // Given
        PipelineRunRepository repository = mock(PipelineRunRepository.class);
        when(repository.save(any())).thenThrow(new CannotCreateTransactionException("metadata database down"));
        AnalyticsProperties properties = new AnalyticsProperties();
        PipelineRunner withBrokenHistory = new PipelineRunner(registry, extractService,
                new TransformationEngine((tenantId, dataset, key) -> Map.of(), properties), destinationOutputService,
                new PipelineRunService(repository), properties, Clock.fixed(NOW, ZoneOffset.UTC), executor);
        PipelineDefinition pipeline = registry.register(pipeline("p1", true, PREVIOUS_RUN));
        when(extractService.extract(any(), any())).thenReturn(List.of(Map.of("amt", 5)));
        when(destinationOutputService.write(eq(pipeline), anyList())).thenReturn(1);

        // When
        JobResult result = withBrokenHistory.run("p1");

        // Then
        assertEquals(PipelineStatus.COMPLETED, result.status());
        assertEquals(PipelineStatus.COMPLETED, pipeline.getStatus());
        assertEquals(NOW, pipeline.getLastRun());
        verify(repository, times(1)).save(any());
    }

    @Test
    void testRun_SequentialRunsAreNotShared() {
        PipelineDefinition pipeline = registry.register(pipeline("p1", true, PREVIOUS_RUN));
        when(extractService.extract(any(), any())).thenReturn(List.of());
        when(destinationOutputService.write(eq(pipeline), anyList())).thenReturn(0);

        runner.run("p1");
        runner.run("p1");

        verify(extractService).extract(pipeline, PREVIOUS_RUN);
        verify(extractService).extract(pipeline, NOW);
    }

    @Test
    void testRun_DisabledPipelineRejected() {
        registry.register(pipeline("p1", false, null));

        assertThrows(ConfigurationException.class, () -> runner.run("p1"));
        verifyNoInteractions(extractService);
    }

    @Test
    void testRun_UnknownPipeline() {
        assertThrows(PipelineNotFoundException.class, () -> runner.run("nope"));
    }

    private static PipelineDefinition pipeline(String id, boolean enabled, Instant lastRun) {
        return PipelineDefinition.builder()
                .id(id)
                .tenantId("tenant-1")
                .name("Test pipeline")
                .source(SourceDescriptor.database(List.of("transactions"), "updated_at"))
                .steps(List.of(new ValidateStep("validate", 1,
                        List.of(ValidationRule.typed("amt", "number").withMin(0)))))
                .destination(Destination.warehouse("fact_transactions", List.of("id")))
                .enabled(enabled)
                .lastRun(lastRun)
                .build();
    }
}
