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

import me.scout.cron.domain.model.ConcurrencyPolicy;
import me.scout.cron.domain.model.JobDefinition;
import me.scout.cron.infrastructure.config.CronProperties;
import me.scout.cron.port.outbound.CronStorePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Service for managing job definitions: validation, persistence and keeping
 * each job's schedule in step with its definition.
 */
@Service
@Slf4j
public class JobService {

    private static final Pattern JOB_ID_PATTERN = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_.-]{0,127}");
    private static final String JOB_NOT_FOUND = "Job not found: ";

    private final CronStorePort store;
    private final SchedulingService schedulingService;
    private final JobLockRegistry jobLocks;
    private final JobDefinitionLoader loader;
    private final CronProperties properties;
    private final Clock clock;

    public JobService(CronStorePort store, SchedulingService schedulingService, JobLockRegistry jobLocks,
            JobDefinitionLoader loader, CronProperties properties, Clock clock) {
        this.store = store;
        this.schedulingService = schedulingService;
        this.jobLocks = jobLocks;
        this.loader = loader;
        this.properties = properties;
        this.clock = clock;
    }

    public JobDefinition addJob(JobDefinition job) {
        Objects.requireNonNull(job, "job");
        applyDefaults(job);
        validate(job);

        return jobLocks.withJobLock(job.getId(), () -> {
            if (store.getJob(job.getId()).isPresent()) {
                throw new IllegalArgumentException("Job already exists: " + job.getId());
            }
            Instant now = clock.instant();
            job.setCreatedAt(now);
            job.setUpdatedAt(now);
            store.saveJob(job);
            log.info("[Jobs] Added job {} '{}' ({})", job.getId(), job.getName(), job.getSchedule());

            if (job.isEnabled()) {
                schedulingService.scheduleJob(job);
            }
            return job;
        });
    }

    /**
     * Replace a job's definition. When a field that determines due times changed
     * the persisted schedule is discarded and computed afresh.
     */
    public JobDefinition updateJob(JobDefinition job) {
        Objects.requireNonNull(job, "job");
        applyDefaults(job);
        validate(job);

        return jobLocks.withJobLock(job.getId(), () -> {
            JobDefinition existing = store.getJob(job.getId())
                    .orElseThrow(() -> new IllegalArgumentException(JOB_NOT_FOUND + job.getId()));

            job.setCreatedAt(existing.getCreatedAt());
            job.setUpdatedAt(clock.instant());
            if (scheduleAffected(existing, job)) {
                store.deleteSchedule(job.getId());
                log.info("[Jobs] Schedule of job {} changed, due times reset", job.getId());
            }
            store.saveJob(job);
            log.info("[Jobs] Updated job {}", job.getId());

            if (job.isEnabled()) {
                schedulingService.scheduleJob(job);
            }
            return job;
        });
    }

    public Optional<JobDefinition> getJob(String jobId) {
        return store.getJob(jobId);
    }

    /**
     * Jobs ordered by id.
     */
    public List<JobDefinition> listJobs(int offset, int limit) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        return store.listJobs().stream()
                .sorted(Comparator.comparing(JobDefinition::getId))
                .skip(offset)
                .limit(limit)
                .toList();
    }

    public JobDefinition pauseJob(String jobId) {
        return setEnabled(jobId, false);
    }

    /**
     * Re-enable a job and reconcile its schedule. Occurrences missed while
     * paused are caught up only if the job has {@code catchup} set.
     */
    public JobDefinition resumeJob(String jobId) {
        return setEnabled(jobId, true);
    }

    public void deleteJob(String jobId) {
        boolean deleted = jobLocks.withJobLock(jobId, () -> store.deleteJob(jobId));
        if (!deleted) {
            throw new IllegalArgumentException(JOB_NOT_FOUND + jobId);
        }
        jobLocks.forget(jobId);
        log.info("[Jobs] Deleted job {}", jobId);
    }

    /**
     * Add or update every job definition file in {@code directory}. A file that
     * cannot be read or fails validation is logged and skipped.
     *
     * @return number of jobs imported
     */
    public int importJobs(Path directory) {
        if (!Files.isDirectory(directory)) {
            log.warn("[Jobs] Job directory does not exist: {}", directory);
            return 0;
        }

        List<Path> files;
        try {
            files = loader.listJobFiles(directory);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to list job directory: " + directory, e);
        }

        int imported = 0;
        for (Path file : files) {
            try {
                JobDefinition job = loader.load(file);
                if (store.getJob(job.getId()).isPresent()) {
                    updateJob(job);
                } else {
                    addJob(job);
                }
                imported++;
            } catch (IOException | IllegalArgumentException e) {
                log.error("[Jobs] Failed to import {}: {}", file.getFileName(), e.getMessage());
            }
        }
        log.info("[Jobs] Imported {} of {} job file(s) from {}", imported, files.size(), directory);
        return imported;
    }

    private JobDefinition setEnabled(String jobId, boolean enabled) {
        return jobLocks.withJobLock(jobId, () -> {
            JobDefinition job = store.getJob(jobId)
                    .orElseThrow(() -> new IllegalArgumentException(JOB_NOT_FOUND + jobId));
            job.setEnabled(enabled);
            job.setUpdatedAt(clock.instant());
            store.saveJob(job);
            log.info("[Jobs] {} job {}", enabled ? "Resumed" : "Paused", jobId);

            if (enabled) {
                schedulingService.scheduleJob(job);
            }
            return job;
        });
    }

    private void applyDefaults(JobDefinition job) {
        if (job.getVersion() == null || job.getVersion().isBlank()) {
            job.setVersion(JobDefinition.DEFAULT_VERSION);
        }
        if (job.getTimezone() == null || job.getTimezone().isBlank()) {
            job.setTimezone(properties.getDefaults().getTimezone());
        }
        if (job.getConcurrency() == null || job.getConcurrency().isBlank()) {
            job.setConcurrency(ConcurrencyPolicy.ALLOW.getValue());
        }
        if (job.getInputs() == null) {
            job.setInputs(new LinkedHashMap<>());
        }
        if (job.getLabels() == null) {
            job.setLabels(new LinkedHashMap<>());
        }
        if (job.getResources() == null) {
            job.setResources(new JobDefinition.ResourceLimits());
        }
    }

    private void validate(JobDefinition job) {
        if (job.getId() == null || !JOB_ID_PATTERN.matcher(job.getId()).matches()) {
            throw new IllegalArgumentException("Invalid job id: " + job.getId());
        }
        if (job.getName() == null || job.getName().isBlank()) {
            throw new IllegalArgumentException("Job name is required");
        }
        if (job.getGraphId() == null || job.getGraphId().isBlank()) {
            throw new IllegalArgumentException("Job graphId is required");
        }
        validateSchedule(job.getSchedule());

        try {
            ZoneId.of(job.getTimezone());
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid timezone: " + job.getTimezone(), e);
        }
        if (job.getJitterMs() < 0 || job.getJitterMs() > JobDefinition.MAX_JITTER_MS) {
            throw new IllegalArgumentException(
                    "jitterMs must be between 0 and " + JobDefinition.MAX_JITTER_MS + ": " + job.getJitterMs());
        }
        if (job.getNotBefore() != null && job.getNotAfter() != null
                && !job.getNotBefore().isBefore(job.getNotAfter())) {
            throw new IllegalArgumentException("notBefore must be before notAfter");
        }
        if (ConcurrencyPolicy.fromValue(job.getConcurrency()).isEmpty()) {
            throw new IllegalArgumentException("Unknown concurrency policy: " + job.getConcurrency());
        }

        JobDefinition.ResourceLimits resources = job.getResources();
        if (resources.getMaxSteps() <= 0 || resources.getMaxRunSeconds() <= 0 || resources.getMaxModelTokens() <= 0) {
            throw new IllegalArgumentException("Resource limits must be positive");
        }
    }

    private static void validateSchedule(String schedule) {
        if (schedule == null || schedule.isBlank()) {
            throw new IllegalArgumentException("Job schedule is required");
        }
        DueTimeCalculator.normalizeCronExpression(schedule);
    }

    private static boolean scheduleAffected(JobDefinition before, JobDefinition after) {
        return !Objects.equals(before.getSchedule(), after.getSchedule())
                || !Objects.equals(before.getTimezone(), after.getTimezone())
                || !Objects.equals(before.getNotBefore(), after.getNotBefore())
                || !Objects.equals(before.getNotAfter(), after.getNotAfter())
                || before.getJitterMs() != after.getJitterMs();
    }
}
