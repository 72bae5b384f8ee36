package me.scout.cron.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.scout.cron.domain.model.AdmissionDecision;
import me.scout.cron.domain.model.ConcurrencyPolicy;
import me.scout.cron.domain.model.JobDefinition;
import me.scout.cron.domain.model.JobExecutionResult;
import me.scout.cron.domain.model.RunEvent;
import me.scout.cron.domain.model.RunRecord;
import me.scout.cron.domain.model.RunState;
import me.scout.cron.infrastructure.config.CronProperties;
import me.scout.cron.port.outbound.CronStorePort;
import me.scout.cron.port.outbound.JobExecutorPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives runs through admission and execution.
 *
 * <p>
 * Admission and the move to STARTING happen under the job's lock, so two runs
 * of a {@code skip} or {@code queue} job cannot both be admitted. Execution
 * itself happens outside the lock and is bounded by the job's
 * {@code maxRunSeconds}. Admission outcomes, start and completion are recorded
 * as {@link RunEvent}s.
 */
@Service
@Slf4j
public class JobRunService {

    public static final String DRY_RUN_EXECUTOR_ID = "dry-run";

    static final String ERROR_TIMEOUT = "TIMEOUT";
    static final String ERROR_INTERRUPTED = "INTERRUPTED";
    static final String ERROR_CONCURRENCY_SKIP = "CONCURRENCY_SKIP";
    static final String ERROR_CONCURRENCY_DENIED = "CONCURRENCY_DENIED";

    private final CronStorePort store;
    private final SchedulingService schedulingService;
    private final RunLifecycleService lifecycleService;
    private final ConcurrencyAdmissionService admissionService;
    private final JobLockRegistry jobLocks;
    private final RunArtifactService artifactService;
    private final Map<String, JobExecutorPort> executors = new HashMap<>();
    private final CronProperties properties;
    private final Clock clock;

    public JobRunService(CronStorePort store, SchedulingService schedulingService,
            RunLifecycleService lifecycleService, ConcurrencyAdmissionService admissionService,
            JobLockRegistry jobLocks, RunArtifactService artifactService, List<JobExecutorPort> executors,
            CronProperties properties, Clock clock) {
        this.store = store;
        this.schedulingService = schedulingService;
        this.lifecycleService = lifecycleService;
        this.admissionService = admissionService;
        this.jobLocks = jobLocks;
        this.artifactService = artifactService;
        for (JobExecutorPort executor : executors) {
            this.executors.put(executor.getExecutorId(), executor);
        }
        this.properties = properties;
        this.clock = clock;
        log.info("[Runner] Executors available: {}, default: {}", this.executors.keySet(),
                properties.getRunner().getExecutor());
    }

    /**
     * Execute a pending run. A run that is no longer pending is returned as-is.
     *
     * @return the run as persisted after execution
     */
    public RunRecord executeRun(String runId) {
        RunRecord run = store.getRun(runId)
                .orElseThrow(() -> new IllegalArgumentException("Run not found: " + runId));
        if (run.getState() == null || !run.getState().isPending()) {
            log.debug("[Runner] Run {} is {}, not executing", runId, run.getState());
            return run;
        }
        JobDefinition job = store.getJob(run.getJobId())
                .orElseThrow(() -> new IllegalArgumentException("Job not found: " + run.getJobId()));
        return execute(job, run, executorFor(run));
    }

    /**
     * Run a job immediately, outside its schedule. {@code inputs} override the
     * job's inputs for this run only.
     */
    public RunRecord runJobNow(String jobId, Map<String, Object> inputs) {
        JobDefinition job = store.getJob(jobId)
                .orElseThrow(() -> new IllegalArgumentException("Job not found: " + jobId));

        JobDefinition effective = job;
        if (inputs != null && !inputs.isEmpty()) {
            Map<String, Object> merged = new LinkedHashMap<>(job.getInputs());
            merged.putAll(inputs);
            effective = job.toBuilder().inputs(merged).build();
        }

        RunRecord run = schedulingService.createRun(job, clock.instant(), true, false);
        log.info("[Runner] Manual run {} of job {}", run.getId(), jobId);
        return execute(effective, run, executorFor(run));
    }

    /**
     * Run a job against the dry-run executor, whatever executor is configured.
     */
    public RunRecord dryRun(String jobId) {
        JobDefinition job = store.getJob(jobId)
                .orElseThrow(() -> new IllegalArgumentException("Job not found: " + jobId));
        RunRecord run = schedulingService.createRun(job, clock.instant(), true, true);
        return execute(job, run, executorFor(run));
    }

    /**
     * Execute every pending run, highest job priority first, then oldest
     * occurrence first. A run that fails to execute does not stop the others.
     *
     * @return number of runs processed
     */
    public int processPendingRuns() {
        List<RunRecord> pending = lifecycleService.getPendingRuns();
        if (pending.isEmpty()) {
            return 0;
        }

        Map<String, Integer> priorities = new HashMap<>();
        for (RunRecord run : pending) {
            priorities.computeIfAbsent(run.getJobId(),
                    jobId -> store.getJob(jobId).map(JobDefinition::getPriority).orElse(0));
        }
        List<RunRecord> ordered = pending.stream()
                .sorted(Comparator.<RunRecord>comparingInt(run -> priorities.get(run.getJobId())).reversed()
                        .thenComparing(RunRecord::getScheduledAt, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();

        int processed = 0;
        for (RunRecord run : ordered) {
            try {
                executeRun(run.getId());
                processed++;
            } catch (RuntimeException e) {
                log.error("[Runner] Failed to process run {}: {}", run.getId(), e.getMessage(), e);
            }
        }
        log.info("[Runner] Processed {} of {} pending run(s)", processed, ordered.size());
        return processed;
    }

    public Optional<RunRecord> getRun(String runId) {
        return store.getRun(runId);
    }

    /**
     * Runs newest first, optionally restricted to one job.
     */
    public List<RunRecord> listRuns(String jobId, int limit) {
        return store.listRuns(jobId).stream().limit(limit).toList();
    }

    public List<RunEvent> listRunEvents(String runId, int limit) {
        return store.listRunEvents(runId, limit);
    }

    private RunRecord execute(JobDefinition job, RunRecord run, JobExecutorPort executor) {
        String runId = run.getId();
        boolean started = jobLocks.withJobLock(job.getId(), () -> admit(job, run));
        if (!started) {
            return store.getRun(runId).orElse(run);
        }

        lifecycleService.markRunRunning(runId);
        recordEvent(runId, RunEvent.Level.INFO, "run.started", "Run started on " + executor.getExecutorId(),
                Map.of("executor", executor.getExecutorId(), "dryRun", run.isDryRun()));

        long timeoutSeconds = timeoutSeconds(job);
        Instant startedAt = clock.instant();
        CompletableFuture<JobExecutionResult> future = null;
        try {
            future = executor.execute(job, run);
            JobExecutionResult result = future.get(timeoutSeconds, TimeUnit.SECONDS);
            complete(job, run, result, null, null, usage(result, startedAt));
        } catch (TimeoutException e) {
            future.cancel(true);
            complete(job, run, null, ERROR_TIMEOUT, "Run exceeded " + timeoutSeconds + "s", usage(null, startedAt));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            complete(job, run, null, cause.getClass().getSimpleName(), cause.getMessage(), usage(null, startedAt));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            complete(job, run, null, ERROR_INTERRUPTED, "Run interrupted", usage(null, startedAt));
        } catch (RuntimeException e) {
            complete(job, run, null, e.getClass().getSimpleName(), e.getMessage(), usage(null, startedAt));
        }
        return store.getRun(runId).orElse(run);
    }

    private boolean admit(JobDefinition job, RunRecord run) {
        AdmissionDecision decision = admissionService.canRunJob(job);
        if (!decision.canRun()) {
            deny(job, run, decision);
            return false;
        }
        if (run.getState() == RunState.DUE) {
            lifecycleService.markRunScheduled(run.getId());
        }
        if (!lifecycleService.markRunStarted(run.getId()).isApplied()) {
            log.debug("[Runner] Run {} could not be started", run.getId());
            return false;
        }
        return true;
    }

    private void deny(JobDefinition job, RunRecord run, AdmissionDecision decision) {
        Map<String, Object> data = new LinkedHashMap<>();
        if (decision.existingRunId() != null) {
            data.put("existingRunId", decision.existingRunId());
        }

        Optional<ConcurrencyPolicy> policy = ConcurrencyPolicy.fromValue(job.getConcurrency());
        if (policy.isPresent() && policy.get() == ConcurrencyPolicy.QUEUE) {
            log.info("[Runner] Run {} queued behind {}", run.getId(), decision.existingRunId());
            recordEvent(run.getId(), RunEvent.Level.INFO, "run.queued", decision.reason(), data);
            return;
        }

        String errorCode = policy.isPresent() ? ERROR_CONCURRENCY_SKIP : ERROR_CONCURRENCY_DENIED;
        lifecycleService.rejectRun(run.getId(), errorCode, decision.reason());
        log.warn("[Runner] Run {} not admitted: {}", run.getId(), decision.reason());
        recordEvent(run.getId(), RunEvent.Level.WARN, "run.rejected", decision.reason(), data);
    }

    /**
     * @param result
     *            executor result on success, {@code null} on failure
     */
    private void complete(JobDefinition job, RunRecord run, JobExecutionResult result, String errorCode,
            String errorMessage, RunRecord.ResourceUsage usage) {
        boolean success = errorCode == null;
        if (success) {
            log.info("[Runner] Run {} succeeded in {} ms", run.getId(), usage.getDurationMs());
        } else {
            log.warn("[Runner] Run {} failed: {} {}", run.getId(), errorCode, errorMessage);
        }
        if (!lifecycleService.markRunCompleted(run.getId(), success, errorCode, errorMessage, usage).isApplied()) {
            // cancelled while executing
            log.debug("[Runner] Run {} already finished, result dropped", run.getId());
            return;
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("durationMs", usage.getDurationMs());
        if (errorCode != null) {
            data.put("errorCode", errorCode);
        }
        recordEvent(run.getId(), success ? RunEvent.Level.INFO : RunEvent.Level.ERROR,
                success ? "run.succeeded" : "run.failed",
                success ? "Run succeeded" : String.valueOf(errorMessage), data);

        if (properties.getRunner().isSaveArtifacts()) {
            saveArtifacts(job, run.getId(), result);
        }
        pruneFinishedRuns(job.getId());
    }

    private void saveArtifacts(JobDefinition job, String runId, JobExecutionResult result) {
        Optional<RunRecord> finished = store.getRun(runId);
        if (finished.isEmpty()) {
            return;
        }
        try {
            String directory = artifactService.saveArtifacts(job, finished.get(), result);
            recordEvent(runId, RunEvent.Level.INFO, "run.artifacts", "Artifacts saved",
                    Map.of("directory", directory));
        } catch (RuntimeException e) {
            log.warn("[Runner] Failed to save artifacts of run {}: {}", runId, e.getMessage());
        }
    }

    /**
     * Delete the oldest finished runs of a job beyond
     * {@code cron.storage.max-runs-per-job}. Pending and active runs are never
     * deleted.
     *
     * @return number of runs deleted
     */
    int pruneFinishedRuns(String jobId) {
        int keep = properties.getStorage().getMaxRunsPerJob();
        if (keep <= 0) {
            return 0;
        }
        try {
            return jobLocks.withJobLock(jobId, () -> {
                List<RunRecord> finished = store.listRuns(jobId).stream()
                        .filter(run -> run.getState() != null && run.getState().isTerminal())
                        .toList();
                int deleted = 0;
                for (RunRecord run : finished.subList(Math.min(keep, finished.size()), finished.size())) {
                    if (store.deleteRun(run.getId())) {
                        deleted++;
                    }
                }
                if (deleted > 0) {
                    log.debug("[Runner] Pruned {} finished run(s) of job {}", deleted, jobId);
                }
                return deleted;
            });
        } catch (RuntimeException e) {
            log.warn("[Runner] Failed to prune runs of job {}: {}", jobId, e.getMessage());
            return 0;
        }
    }

    private RunRecord.ResourceUsage usage(JobExecutionResult result, Instant startedAt) {
        long durationMs = Duration.between(startedAt, clock.instant()).toMillis();
        if (result == null) {
            return RunRecord.ResourceUsage.builder().durationMs(durationMs).build();
        }
        return RunRecord.ResourceUsage.builder()
                .steps(result.getSteps())
                .tokens(result.getTokens())
                .bandwidthBytes(result.getBandwidthBytes())
                .durationMs(durationMs)
                .build();
    }

    private long timeoutSeconds(JobDefinition job) {
        JobDefinition.ResourceLimits resources = job.getResources();
        if (resources != null && resources.getMaxRunSeconds() > 0) {
            return resources.getMaxRunSeconds();
        }
        return properties.getRunner().getDefaultTimeoutSeconds();
    }

    private JobExecutorPort executorFor(RunRecord run) {
        String executorId = run.isDryRun() ? DRY_RUN_EXECUTOR_ID : properties.getRunner().getExecutor();
        JobExecutorPort executor = executors.get(executorId);
        if (executor == null) {
            throw new IllegalStateException("No job executor registered with id: " + executorId);
        }
        return executor;
    }

    private void recordEvent(String runId, RunEvent.Level level, String event, String message,
            Map<String, Object> data) {
        RunEvent runEvent = RunEvent.builder()
                .id(UUID.randomUUID().toString())
                .runId(runId)
                .timestamp(clock.instant())
                .level(level)
                .event(event)
                .message(message)
                .data(data)
                .build();
        try {
            store.appendRunEvent(runEvent);
        } catch (RuntimeException e) {
            log.warn("[Runner] Failed to record event {} for run {}: {}", event, runId, e.getMessage());
        }
    }
}
