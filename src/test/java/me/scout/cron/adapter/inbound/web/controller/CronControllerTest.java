package me.scout.cron.adapter.inbound.web.controller;

import me.scout.cron.domain.model.AdmissionDecision;
import me.scout.cron.domain.model.JobDefinition;
import me.scout.cron.domain.model.ReconciliationReport;
import me.scout.cron.domain.model.RunRecord;
import me.scout.cron.domain.model.RunState;
import me.scout.cron.domain.model.TransitionOutcome;
import me.scout.cron.domain.service.ConcurrencyAdmissionService;
import me.scout.cron.domain.service.JobRunService;
import me.scout.cron.domain.service.JobService;
import me.scout.cron.domain.service.RunLifecycleService;
import me.scout.cron.domain.service.SchedulingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CronControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    private JobService jobService;
    private SchedulingService schedulingService;
    private RunLifecycleService lifecycleService;
    private ConcurrencyAdmissionService admissionService;
    private JobRunService jobRunService;
    private CronController controller;

    @BeforeEach
    void setUp() {
        jobService = mock(JobService.class);
        schedulingService = mock(SchedulingService.class);
        lifecycleService = mock(RunLifecycleService.class);
        admissionService = mock(ConcurrencyAdmissionService.class);
        jobRunService = mock(JobRunService.class);
        controller = new CronController(jobService, schedulingService, lifecycleService, admissionService,
                jobRunService, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldListJobsPage() {
        when(jobService.listJobs(0, 10)).thenReturn(List.of(job("a"), job("b")));

        StepVerifier.create(controller.listJobs(0, 10))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals(2, response.getBody().size());
                })
                .verifyComplete();
    }

    @Test
    void shouldRejectInvalidPaging() {
        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> controller.listJobs(-1, 10));
        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());

        assertThrows(ResponseStatusException.class, () -> controller.listJobs(0, 501));
        verify(jobService, never()).listJobs(anyInt(), anyInt());
    }

    @Test
    void shouldReturnNotFoundForUnknownJob() {
        when(jobService.getJob("missing")).thenReturn(Optional.empty());

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> controller.getJob("missing"));

        assertEquals(HttpStatus.NOT_FOUND, ex.getStatusCode());
        assertTrue(ex.getReason().contains("missing"));
    }

    @Test
    void shouldCreateJobWithCreatedStatus() {
        JobDefinition request = job("nightly");
        when(jobService.addJob(request)).thenReturn(request);

        StepVerifier.create(controller.createJob(request))
                .assertNext(response -> {
                    assertEquals(HttpStatus.CREATED, response.getStatusCode());
                    assertEquals("nightly", response.getBody().getId());
                })
                .verifyComplete();
    }

    @Test
    void shouldTranslateValidationFailureToBadRequest() {
        JobDefinition request = job("nightly");
        when(jobService.addJob(request)).thenThrow(new IllegalArgumentException("Job graphId is required"));

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> controller.createJob(request));

        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        assertEquals("Job graphId is required", ex.getReason());
    }

    @Test
    void shouldRejectUpdateWithMismatchedId() {
        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> controller.updateJob("a", job("b")));

        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        verify(jobService, never()).updateJob(any());
    }

    @Test
    void shouldUpdateUsingPathId() {
        JobDefinition request = job(null);
        when(jobService.getJob("a")).thenReturn(Optional.of(job("a")));
        when(jobService.updateJob(request)).thenReturn(request);

        StepVerifier.create(controller.updateJob("a", request))
                .assertNext(response -> assertEquals("a", response.getBody().getId()))
                .verifyComplete();
    }

    @Test
    void shouldDeleteExistingJob() {
        when(jobService.getJob("a")).thenReturn(Optional.of(job("a")));

        StepVerifier.create(controller.deleteJob("a"))
                .assertNext(response -> assertEquals("a", response.getBody().jobId()))
                .verifyComplete();

        verify(jobService).deleteJob("a");
    }

    @Test
    void shouldRunJobNowWithInputs() {
        when(jobService.getJob("a")).thenReturn(Optional.of(job("a")));
        RunRecord run = run("run_a_1", RunState.SUCCEEDED);
        when(jobRunService.runJobNow(eq("a"), any())).thenReturn(run);

        StepVerifier.create(controller.runJobNow("a", new CronController.RunNowRequest(Map.of("k", "v"), false)))
                .assertNext(response -> assertEquals("run_a_1", response.getBody().getId()))
                .verifyComplete();

        verify(jobRunService).runJobNow("a", Map.of("k", "v"));
        verify(jobRunService, never()).dryRun(anyString());
    }

    @Test
    void shouldDryRunWhenRequested() {
        when(jobService.getJob("a")).thenReturn(Optional.of(job("a")));
        when(jobRunService.dryRun("a")).thenReturn(run("dryrun_a_1", RunState.SUCCEEDED));

        StepVerifier.create(controller.runJobNow("a", new CronController.RunNowRequest(null, true)))
                .assertNext(response -> assertEquals("dryrun_a_1", response.getBody().getId()))
                .verifyComplete();
    }

    @Test
    void shouldReportAdmission() {
        JobDefinition job = job("a");
        when(jobService.getJob("a")).thenReturn(Optional.of(job));
        when(admissionService.canRunJob(job)).thenReturn(AdmissionDecision.deny("already running", "run_a_0"));

        StepVerifier.create(controller.checkAdmission("a"))
                .assertNext(response -> {
                    assertFalse(response.getBody().canRun());
                    assertEquals("run_a_0", response.getBody().existingRunId());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnNotFoundWhenCancellingUnknownRun() {
        when(lifecycleService.cancelRun("nope")).thenReturn(TransitionOutcome.NOT_FOUND);

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> controller.cancelRun("nope"));

        assertEquals(HttpStatus.NOT_FOUND, ex.getStatusCode());
    }

    @Test
    void shouldReportCancelOutcome() {
        when(lifecycleService.cancelRun("run_a_1")).thenReturn(TransitionOutcome.UNCHANGED);

        StepVerifier.create(controller.cancelRun("run_a_1"))
                .assertNext(response -> assertEquals("UNCHANGED", response.getBody().outcome()))
                .verifyComplete();
    }

    @Test
    void shouldReturnNotFoundForEventsOfUnknownRun() {
        when(jobRunService.getRun("nope")).thenReturn(Optional.empty());

        assertThrows(ResponseStatusException.class, () -> controller.getRunEvents("nope", 10));
        verify(jobRunService, never()).listRunEvents(anyString(), anyInt());
    }

    @Test
    void shouldUpdateSchedules() {
        ReconciliationReport report = new ReconciliationReport(List.of("a"), 2, Map.of());
        when(schedulingService.updateAllSchedules()).thenReturn(report);

        StepVerifier.create(controller.updateSchedules())
                .assertNext(response -> assertEquals(2, response.getBody().catchupRunsCreated()))
                .verifyComplete();
    }

    @Test
    void shouldReportHealth() {
        when(lifecycleService.getPendingRuns()).thenReturn(List.of(run("r1", RunState.DUE)));
        when(schedulingService.getDueJobs()).thenReturn(List.of());

        StepVerifier.create(controller.health())
                .assertNext(response -> {
                    CronController.HealthResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals("UP", body.status());
                    assertEquals(NOW, body.time());
                    assertEquals(1, body.pendingRuns());
                    assertEquals(0, body.dueJobs());
                })
                .verifyComplete();
    }

    private static JobDefinition job(String id) {
        return JobDefinition.builder()
                .id(id)
                .name("Job " + id)
                .schedule("0 * * * *")
                .graphId("graph")
                .build();
    }

    private static RunRecord run(String id, RunState state) {
        return RunRecord.builder()
                .id(id)
                .jobId("a")
                .scheduledAt(NOW)
                .state(state)
                .build();
    }
}
