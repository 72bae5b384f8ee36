package me.scout.cron.domain.service;

import me.scout.cron.adapter.outbound.executor.DryRunJobExecutorAdapter;
import me.scout.cron.domain.model.JobDefinition;
import me.scout.cron.domain.model.JobExecutionResult;
import me.scout.cron.domain.model.RunEvent;
import me.scout.cron.domain.model.RunRecord;
import me.scout.cron.domain.model.RunState;
import me.scout.cron.domain.model.ScheduleState;
import me.scout.cron.infrastructure.config.CronProperties;
import me.scout.cron.port.outbound.JobExecutorPort;
import me.scout.cron.testsupport.InMemoryCronStore;
import me.scout.cron.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JobRunServiceTest {

    private static final Instant NOW = Instant.parse("2026-02-11T10:00:00Z");

    private InMemoryCronStore store;
    private MutableClock clock;
    private CronProperties properties;
    private JobExecutorPort executor;
    private SchedulingService schedulingService;
    private RunLifecycleService lifecycleService;
    private RunArtifactService artifactService;
    private JobRunService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryCronStore();
        clock = new MutableClock(NOW);
        properties = new CronProperties();
        properties.getRunner().setExecutor("agent");

        executor = mock(JobExecutorPort.class);
        when(executor.getExecutorId()).thenReturn("agent");
        when(executor.execute(any(), any())).thenReturn(CompletableFuture.completedFuture(result(3, 250)));

        JobLockRegistry locks = new JobLockRegistry();
        DueTimeCalculator calculator = new DueTimeCalculator(clock, new Random(5), properties);
        schedulingService = new SchedulingService(store, calculator, locks, properties, clock);
        lifecycleService = new RunLifecycleService(store, locks, clock);
        ConcurrencyAdmissionService admission = new ConcurrencyAdmissionService(store, lifecycleService, locks);
        artifactService = mock(RunArtifactService.class);
        when(artifactService.saveArtifacts(any(), any(), any())).thenReturn("job-1/artifacts");
        service = new JobRunService(store, schedulingService, lifecycleService, admission, locks, artifactService,
                List.of(executor, new DryRunJobExecutorAdapter()), properties, clock);
    }

    @Test
    void shouldExecuteDueRunToSuccess() {
        JobDefinition job = saveJob("job-1", "allow");
        store.saveSchedule(ScheduleState.builder().jobId("job-1").nextDue(NOW.plusSeconds(3600)).build());
        RunRecord run = schedulingService.createRun(job, NOW, false, false);

        RunRecord finished = service.executeRun(run.getId());

        assertEquals(RunState.SUCCEEDED, finished.getState());
        assertEquals(NOW, finished.getStartedAt());
        assertEquals(NOW, finished.getCompletedAt());
        assertEquals(3, finished.getResourceUsage().getSteps());
        assertEquals(250, finished.getResourceUsage().getTokens());

        ScheduleState schedule = store.getSchedule("job-1").orElseThrow();
        assertEquals(NOW, schedule.getLastScheduled());
        assertEquals(NOW, schedule.getLastSuccess());

        List<String> events = eventNames(run.getId());
        assertEquals(List.of("run.artifacts", "run.succeeded", "run.started"), events);
    }

    @Test
    void shouldRecordExecutorFailureByExceptionName() {
        when(executor.execute(any(), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("graph exploded")));
        JobDefinition job = saveJob("job-1", "allow");
        RunRecord run = schedulingService.createRun(job, NOW, false, false);

        RunRecord finished = service.executeRun(run.getId());

        assertEquals(RunState.FAILED, finished.getState());
        assertEquals("IllegalStateException", finished.getErrorCode());
        assertEquals("graph exploded", finished.getErrorMessage());
        assertNotNull(finished.getCompletedAt());
        RunEvent failed = store.listRunEvents(run.getId(), 2).get(1);
        assertEquals("run.failed", failed.getEvent());
        assertEquals(RunEvent.Level.ERROR, failed.getLevel());
    }

    @Test
    void shouldRecordSynchronousExecutorFailure() {
        when(executor.execute(any(), any())).thenThrow(new UnsupportedOperationException("no runtime"));
        JobDefinition job = saveJob("job-1", "allow");
        RunRecord run = schedulingService.createRun(job, NOW, false, false);

        RunRecord finished = service.executeRun(run.getId());

        assertEquals(RunState.FAILED, finished.getState());
        assertEquals("UnsupportedOperationException", finished.getErrorCode());
    }

    @Test
    void shouldFailRunThatExceedsTimeLimit() {
        CompletableFuture<JobExecutionResult> never = new CompletableFuture<>();
        when(executor.execute(any(), any())).thenReturn(never);
        JobDefinition job = saveJob("job-1", "allow");
        job.getResources().setMaxRunSeconds(1);
        store.saveJob(job);
        RunRecord run = schedulingService.createRun(job, NOW, false, false);

        RunRecord finished = service.executeRun(run.getId());

        assertEquals(RunState.FAILED, finished.getState());
        assertEquals("TIMEOUT", finished.getErrorCode());
        assertTrue(never.isCancelled());
    }

    @Test
    void shouldRejectRunWithSkipPolicyWhileAnotherIsActive() {
        JobDefinition job = saveJob("job-1", "skip");
        RunRecord active = activeRun(job);
        RunRecord pending = schedulingService.createRun(job, NOW, false, false);

        RunRecord result = service.executeRun(pending.getId());

        assertEquals(RunState.CANCELLED, result.getState());
        assertEquals("CONCURRENCY_SKIP", result.getErrorCode());
        assertEquals(RunState.RUNNING, store.getRun(active.getId()).orElseThrow().getState());
        verify(executor, never()).execute(any(), any());
        assertEquals(List.of("run.rejected"), eventNames(pending.getId()));
    }

    @Test
    void shouldQueueRunUntilActiveRunFinishes() {
        JobDefinition job = saveJob("job-1", "queue");
        RunRecord active = activeRun(job);
        RunRecord queued = schedulingService.createRun(job, NOW, false, false);

        RunRecord result = service.executeRun(queued.getId());

        assertEquals(RunState.DUE, result.getState());
        assertEquals(List.of("run.queued"), eventNames(queued.getId()));
        verify(executor, never()).execute(any(), any());

        lifecycleService.markRunCompleted(active.getId(), true, null, null);
        assertEquals(1, service.processPendingRuns());
        assertEquals(RunState.SUCCEEDED, store.getRun(queued.getId()).orElseThrow().getState());
    }

    @Test
    void shouldCancelPreviousRunAndExecuteNewOne() {
        JobDefinition job = saveJob("job-1", "cancel-previous");
        RunRecord active = activeRun(job);
        RunRecord next = schedulingService.createRun(job, NOW, false, false);

        RunRecord result = service.executeRun(next.getId());

        assertEquals(RunState.SUCCEEDED, result.getState());
        assertEquals(RunState.CANCELLED, store.getRun(active.getId()).orElseThrow().getState());
    }

    @Test
    void shouldDropResultOfRunCancelledWhileExecuting() {
        JobDefinition job = saveJob("job-1", "allow");
        RunRecord run = schedulingService.createRun(job, NOW, false, false);
        when(executor.execute(any(), any())).thenAnswer(invocation -> {
            RunRecord executing = invocation.getArgument(1);
            lifecycleService.cancelRun(executing.getId());
            return CompletableFuture.completedFuture(result(1, 1));
        });

        RunRecord result = service.executeRun(run.getId());

        assertEquals(RunState.CANCELLED, result.getState());
    }

    @Test
    void shouldRunJobNowWithOverriddenInputs() {
        JobDefinition job = saveJob("job-1", "allow");
        job.setInputs(Map.of("channel", "general", "limit", 5));
        store.saveJob(job);

        RunRecord run = service.runJobNow("job-1", Map.of("limit", 10));

        assertEquals(RunState.SUCCEEDED, run.getState());
        assertTrue(run.isManual());
        ArgumentCaptor<JobDefinition> captor = ArgumentCaptor.forClass(JobDefinition.class);
        verify(executor).execute(captor.capture(), any());
        assertEquals(Map.of("channel", "general", "limit", 10), captor.getValue().getInputs());
        assertEquals(5, store.getJob("job-1").orElseThrow().getInputs().get("limit"));
    }

    @Test
    void shouldDryRunWithoutConfiguredExecutor() {
        saveJob("job-1", "allow");

        RunRecord run = service.dryRun("job-1");

        assertTrue(run.getId().startsWith("dryrun_job-1_"));
        assertTrue(run.isDryRun());
        assertEquals(RunState.SUCCEEDED, run.getState());
        verify(executor, never()).execute(any(), any());
    }

    @Test
    void shouldProcessPendingRunsByPriorityThenAge() {
        JobDefinition low = saveJob("low", "allow");
        JobDefinition high = saveJob("high", "allow");
        high.setPriority(10);
        store.saveJob(high);
        RunRecord lowOld = schedulingService.createRun(low, NOW.minusSeconds(600), false, false);
        RunRecord highNew = schedulingService.createRun(high, NOW, false, false);
        RunRecord highOld = schedulingService.createRun(high, NOW.minusSeconds(300), false, false);

        List<String> order = new ArrayList<>();
        when(executor.execute(any(), any())).thenAnswer(invocation -> {
            RunRecord run = invocation.getArgument(1);
            order.add(run.getId());
            return CompletableFuture.completedFuture(result(1, 1));
        });

        int processed = service.processPendingRuns();

        assertEquals(3, processed);
        assertEquals(List.of(highOld.getId(), highNew.getId(), lowOld.getId()), order);
    }

    @Test
    void shouldIsolateFailuresWhenProcessingPendingRuns() {
        JobDefinition job = saveJob("job-1", "allow");
        RunRecord ok = schedulingService.createRun(job, NOW, false, false);
        store.saveRun(RunRecord.builder()
                .id("orphan")
                .jobId("deleted-job")
                .scheduledAt(NOW.minusSeconds(60))
                .state(RunState.DUE)
                .build());

        int processed = service.processPendingRuns();

        assertEquals(1, processed);
        assertEquals(RunState.SUCCEEDED, store.getRun(ok.getId()).orElseThrow().getState());
        assertEquals(RunState.DUE, store.getRun("orphan").orElseThrow().getState());
    }

    @Test
    void shouldLeaveFinishedRunAlone() {
        JobDefinition job = saveJob("job-1", "allow");
        RunRecord run = schedulingService.createRun(job, NOW, false, false);
        service.executeRun(run.getId());

        RunRecord again = service.executeRun(run.getId());

        assertEquals(RunState.SUCCEEDED, again.getState());
        verify(executor).execute(any(), any());
    }

    @Test
    void shouldRejectUnknownRun() {
        assertThrows(IllegalArgumentException.class, () -> service.executeRun("missing"));
        assertThrows(IllegalArgumentException.class, () -> service.runJobNow("missing", Map.of()));
    }

    @Test
    void shouldFailWhenConfiguredExecutorIsMissing() {
        properties.getRunner().setExecutor("remote");
        saveJob("job-1", "allow");

        assertThrows(IllegalStateException.class, () -> service.runJobNow("job-1", null));
    }

    @Test
    void shouldPassExecutorResultToArtifacts() {
        JobDefinition job = saveJob("job-1", "allow");
        RunRecord run = schedulingService.createRun(job, NOW, false, false);

        service.executeRun(run.getId());

        ArgumentCaptor<RunRecord> finished = ArgumentCaptor.forClass(RunRecord.class);
        ArgumentCaptor<JobExecutionResult> result = ArgumentCaptor.forClass(JobExecutionResult.class);
        verify(artifactService).saveArtifacts(any(), finished.capture(), result.capture());
        assertEquals(RunState.SUCCEEDED, finished.getValue().getState());
        assertEquals("done", result.getValue().getOutput());
    }

    @Test
    void shouldWriteArtifactsOfFailedRunWithoutResult() {
        when(executor.execute(any(), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("graph exploded")));
        JobDefinition job = saveJob("job-1", "allow");
        RunRecord run = schedulingService.createRun(job, NOW, false, false);

        service.executeRun(run.getId());

        verify(artifactService).saveArtifacts(any(), any(), isNull());
    }

    @Test
    void shouldSkipArtifactsWhenDisabled() {
        properties.getRunner().setSaveArtifacts(false);
        JobDefinition job = saveJob("job-1", "allow");
        RunRecord run = schedulingService.createRun(job, NOW, false, false);

        service.executeRun(run.getId());

        verify(artifactService, never()).saveArtifacts(any(), any(), any());
        assertEquals(List.of("run.succeeded", "run.started"), eventNames(run.getId()));
    }

    @Test
    void shouldKeepRunSucceededWhenArtifactsFail() {
        when(artifactService.saveArtifacts(any(), any(), any())).thenThrow(new IllegalStateException("disk full"));
        JobDefinition job = saveJob("job-1", "allow");
        RunRecord run = schedulingService.createRun(job, NOW, false, false);

        RunRecord finished = service.executeRun(run.getId());

        assertEquals(RunState.SUCCEEDED, finished.getState());
        assertEquals(List.of("run.succeeded", "run.started"), eventNames(run.getId()));
    }

    @Test
    void shouldPruneOldestFinishedRunsBeyondRetention() {
        properties.getStorage().setMaxRunsPerJob(2);
        JobDefinition job = saveJob("job-1", "allow");
        RunRecord pending = schedulingService.createRun(job, NOW.minusSeconds(7200), false, false);
        List<String> finished = new ArrayList<>();
        for (int i = 3; i >= 1; i--) {
            RunRecord run = schedulingService.createRun(job, NOW.minusSeconds(i * 60L), true, false);
            lifecycleService.markRunScheduled(run.getId());
            lifecycleService.markRunStarted(run.getId());
            lifecycleService.markRunCompleted(run.getId(), true, null, null, new RunRecord.ResourceUsage());
            finished.add(run.getId());
        }

        int deleted = service.pruneFinishedRuns("job-1");

        assertEquals(1, deleted);
        List<String> remaining = store.listRuns("job-1").stream().map(RunRecord::getId).toList();
        assertEquals(List.of(finished.get(2), finished.get(1), pending.getId()), remaining);
    }

    @Test
    void shouldKeepAllRunsWhenRetentionDisabled() {
        properties.getStorage().setMaxRunsPerJob(0);
        JobDefinition job = saveJob("job-1", "allow");
        for (int i = 0; i < 3; i++) {
            service.runJobNow("job-1", null);
            clock.advance(Duration.ofMinutes(1));
        }

        assertEquals(0, service.pruneFinishedRuns(job.getId()));
        assertEquals(3, store.listRuns("job-1").size());
    }

    private RunRecord activeRun(JobDefinition job) {
        RunRecord active = schedulingService.createRun(job, NOW.minusSeconds(3600), false, false);
        lifecycleService.markRunScheduled(active.getId());
        lifecycleService.markRunStarted(active.getId());
        lifecycleService.markRunRunning(active.getId());
        return active;
    }

    private JobDefinition saveJob(String id, String concurrency) {
        JobDefinition job = JobDefinition.builder()
                .id(id)
                .name("Job " + id)
                .schedule("0 * * * *")
                .timezone("UTC")
                .concurrency(concurrency)
                .graphId("graph-1")
                .build();
        store.saveJob(job);
        return job;
    }

    private List<String> eventNames(String runId) {
        return store.listRunEvents(runId, 100).stream().map(RunEvent::getEvent).toList();
    }

    private static JobExecutionResult result(long steps, long tokens) {
        return JobExecutionResult.builder().output("done").steps(steps).tokens(tokens).build();
    }
}
