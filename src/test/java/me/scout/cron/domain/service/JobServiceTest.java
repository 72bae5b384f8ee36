package me.scout.cron.domain.service;

import me.scout.cron.domain.model.JobDefinition;
import me.scout.cron.domain.model.RunRecord;
import me.scout.cron.domain.model.RunState;
import me.scout.cron.domain.model.ScheduleState;
import me.scout.cron.infrastructure.config.CronConfiguration;
import me.scout.cron.infrastructure.config.CronProperties;
import me.scout.cron.testsupport.InMemoryCronStore;
import me.scout.cron.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Random;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobServiceTest {

    private static final Instant NOW = Instant.parse("2026-02-11T10:00:00Z");

    private InMemoryCronStore store;
    private MutableClock clock;
    private SchedulingService schedulingService;
    private JobService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryCronStore();
        clock = new MutableClock(NOW);
        CronProperties properties = new CronProperties();
        JobLockRegistry locks = new JobLockRegistry();
        DueTimeCalculator calculator = new DueTimeCalculator(clock, new Random(3), properties);
        schedulingService = new SchedulingService(store, calculator, locks, properties, clock);
        JobDefinitionLoader loader = new JobDefinitionLoader(CronConfiguration.objectMapper());
        service = new JobService(store, schedulingService, locks, loader, properties, clock);
    }

    @Test
    void shouldAddJobWithDefaultsAndSchedule() {
        JobDefinition job = JobDefinition.builder()
                .id("report")
                .name("Report")
                .schedule("0 9 * * *")
                .graphId("report-graph")
                .timezone(null)
                .concurrency(null)
                .build();

        JobDefinition added = service.addJob(job);

        assertEquals("America/New_York", added.getTimezone());
        assertEquals("allow", added.getConcurrency());
        assertEquals(JobDefinition.DEFAULT_VERSION, added.getVersion());
        assertEquals(NOW, added.getCreatedAt());
        assertEquals(NOW, added.getUpdatedAt());
        assertTrue(store.getJob("report").isPresent());
        assertEquals(Instant.parse("2026-02-11T14:00:00Z"), store.getSchedule("report").orElseThrow().getNextDue());
    }

    @Test
    void shouldNotScheduleDisabledJob() {
        JobDefinition job = job("report");
        job.setEnabled(false);

        service.addJob(job);

        assertTrue(store.getSchedule("report").isEmpty());
    }

    @Test
    void shouldRejectDuplicateJob() {
        service.addJob(job("report"));

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> service.addJob(job("report")));
        assertEquals("Job already exists: report", ex.getMessage());
    }

    @Test
    void shouldValidateJobDefinition() {
        assertInvalid(j -> j.setId("../escape"), "Invalid job id");
        assertInvalid(j -> j.setName(" "), "name");
        assertInvalid(j -> j.setGraphId(null), "graphId");
        assertInvalid(j -> j.setSchedule("61 * * * *"), "Invalid cron expression");
        assertInvalid(j -> j.setSchedule("* *"), "expected 5 or 6 fields");
        assertInvalid(j -> j.setTimezone("Nowhere/City"), "Invalid timezone");
        assertInvalid(j -> j.setJitterMs(JobDefinition.MAX_JITTER_MS + 1), "jitterMs");
        assertInvalid(j -> j.setJitterMs(-1), "jitterMs");
        assertInvalid(j -> j.setConcurrency("parallel"), "Unknown concurrency policy");
        assertInvalid(j -> {
            j.setNotBefore(Instant.parse("2026-03-01T00:00:00Z"));
            j.setNotAfter(Instant.parse("2026-03-01T00:00:00Z"));
        }, "notBefore must be before notAfter");
        assertInvalid(j -> j.getResources().setMaxRunSeconds(0), "Resource limits");

        assertTrue(store.listJobs().isEmpty());
    }

    @Test
    void shouldResetScheduleWhenScheduleChanges() {
        service.addJob(job("report"));
        markSucceeded("report");

        JobDefinition changed = job("report");
        changed.setSchedule("30 * * * *");
        clock.set(NOW.plusSeconds(60));
        service.updateJob(changed);

        ScheduleState state = store.getSchedule("report").orElseThrow();
        assertEquals(Instant.parse("2026-02-11T10:30:00Z"), state.getNextDue());
        assertNull(state.getLastSuccess());
        assertEquals(NOW, store.getJob("report").orElseThrow().getCreatedAt());
        assertEquals(NOW.plusSeconds(60), store.getJob("report").orElseThrow().getUpdatedAt());
    }

    @Test
    void shouldKeepScheduleWhenOnlyMetadataChanges() {
        service.addJob(job("report"));
        markSucceeded("report");
        ScheduleState before = store.getSchedule("report").orElseThrow();

        JobDefinition changed = job("report");
        changed.setDescription("Now with a description");
        changed.setPriority(9);
        service.updateJob(changed);

        assertEquals(before, store.getSchedule("report").orElseThrow());
        assertEquals(9, store.getJob("report").orElseThrow().getPriority());
    }

    @Test
    void shouldFailToUpdateUnknownJob() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> service.updateJob(job("ghost")));

        assertEquals("Job not found: ghost", ex.getMessage());
    }

    @Test
    void shouldListJobsPagedById() {
        service.addJob(job("charlie"));
        service.addJob(job("alpha"));
        service.addJob(job("bravo"));

        assertEquals(List.of("alpha", "bravo"), ids(service.listJobs(0, 2)));
        assertEquals(List.of("charlie"), ids(service.listJobs(2, 2)));
        assertTrue(service.listJobs(5, 2).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> service.listJobs(-1, 2));
        assertThrows(IllegalArgumentException.class, () -> service.listJobs(0, 0));
    }

    @Test
    void shouldPauseAndResumeJob() {
        service.addJob(job("report"));
        clock.set(Instant.parse("2026-02-11T14:00:00Z"));

        JobDefinition paused = service.pauseJob("report");

        assertFalse(paused.isEnabled());
        assertTrue(schedulingService.getDueJobs().isEmpty());

        clock.set(Instant.parse("2026-02-13T08:00:00Z"));
        JobDefinition resumed = service.resumeJob("report");

        assertTrue(resumed.isEnabled());
        assertEquals(Instant.parse("2026-02-13T14:00:00Z"), store.getSchedule("report").orElseThrow().getNextDue());
        assertTrue(store.listRuns("report").isEmpty());
    }

    @Test
    void shouldDeleteJobWithRuns() {
        service.addJob(job("report"));
        schedulingService.createRun(store.getJob("report").orElseThrow(), NOW, true, false);

        service.deleteJob("report");

        assertTrue(store.getJob("report").isEmpty());
        assertTrue(store.getSchedule("report").isEmpty());
        assertTrue(store.listRuns("report").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> service.deleteJob("report"));
    }

    @Test
    void shouldImportJobFilesFromDirectory() throws URISyntaxException {
        Path directory = Path.of(getClass().getResource("/jobs").toURI());

        int imported = service.importJobs(directory);

        assertEquals(2, imported);
        JobDefinition nightly = store.getJob("nightly-report").orElseThrow();
        assertTrue(nightly.isCatchup());
        assertEquals("skip", nightly.getConcurrency());
        assertEquals(20, nightly.getResources().getMaxSteps());
        assertEquals(300, nightly.getResources().getMaxRunSeconds());
        assertEquals("UTC", store.getJob("hourly-sync").orElseThrow().getTimezone());
        assertTrue(store.getSchedule("hourly-sync").isPresent());

        assertEquals(2, service.importJobs(directory));
        assertEquals(2, store.listJobs().size());
    }

    @Test
    void shouldSkipMissingImportDirectory(@TempDir Path tempDir) {
        assertEquals(0, service.importJobs(tempDir.resolve("absent")));
    }

    private void markSucceeded(String jobId) {
        ScheduleState state = store.getSchedule(jobId).orElseThrow();
        state.setLastSuccess(NOW.minusSeconds(3600));
        store.saveSchedule(state);
        store.saveRun(RunRecord.builder()
                .id("run-done")
                .jobId(jobId)
                .scheduledAt(NOW.minusSeconds(3600))
                .state(RunState.SUCCEEDED)
                .completedAt(NOW.minusSeconds(3600))
                .build());
    }

    private void assertInvalid(Consumer<JobDefinition> mutation, String messagePart) {
        JobDefinition job = job("report");
        mutation.accept(job);
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> service.addJob(job));
        assertTrue(ex.getMessage().contains(messagePart), "unexpected message: " + ex.getMessage());
    }

    private static List<String> ids(List<JobDefinition> jobs) {
        return jobs.stream().map(JobDefinition::getId).toList();
    }

    private static JobDefinition job(String id) {
        return JobDefinition.builder()
                .id(id)
                .name("Job " + id)
                .schedule("0 9 * * *")
                .timezone("America/New_York")
                .graphId("graph-1")
                .build();
    }
}
