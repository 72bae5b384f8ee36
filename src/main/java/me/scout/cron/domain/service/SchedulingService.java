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

import me.scout.cron.domain.model.DueTime;
import me.scout.cron.domain.model.JobDefinition;
import me.scout.cron.domain.model.ReconciliationReport;
import me.scout.cron.domain.model.RunRecord;
import me.scout.cron.domain.model.RunState;
import me.scout.cron.domain.model.ScheduleState;
import me.scout.cron.infrastructure.config.CronProperties;
import me.scout.cron.port.outbound.CronStorePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Reconciles each job's persisted schedule against wall-clock time.
 *
 * <p>
 * Missed occurrences are handled per job: with {@code catchup} enabled (and a
 * previous success to count from) every missed occurrence becomes a DUE run;
 * otherwise missed occurrences are dropped and only the next future
 * occurrence is kept. Reconciliation of one job happens under that job's lock
 * and reads its own writes, so repeated or overlapping calls neither skip nor
 * duplicate an occurrence.
 *
 * @see DueTimeCalculator
 * @see RunLifecycleService
 */
@Service
@Slf4j
public class SchedulingService {

    private final CronStorePort store;
    private final DueTimeCalculator dueTimeCalculator;
    private final JobLockRegistry jobLocks;
    private final CronProperties properties;
    private final Clock clock;

    public SchedulingService(CronStorePort store, DueTimeCalculator dueTimeCalculator, JobLockRegistry jobLocks,
            CronProperties properties, Clock clock) {
        this.store = store;
        this.dueTimeCalculator = dueTimeCalculator;
        this.jobLocks = jobLocks;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Reconcile one job's schedule against now. Idempotent.
     *
     * @return the catch-up runs created, empty when nothing was missed or the
     *         job does not catch up
     */
    public List<RunRecord> scheduleJob(JobDefinition job) {
        return jobLocks.withJobLock(job.getId(), () -> reconcile(job, null));
    }

    /**
     * Enabled jobs whose persisted {@code nextDue} is at or before now. A job
     * disabled after its schedule was computed is not returned.
     */
    public List<JobDefinition> getDueJobs() {
        Instant now = clock.instant();
        List<JobDefinition> dueJobs = new ArrayList<>();
        for (ScheduleState schedule : store.getDueSchedules(now)) {
            Optional<JobDefinition> job = store.getJob(schedule.getJobId());
            if (job.isPresent() && job.get().isEnabled()) {
                dueJobs.add(job.get());
            }
        }
        return dueJobs;
    }

    /**
     * Create a DUE run for the current occurrence of every due job, then advance
     * each job's schedule. A job whose occurrence already has a run only gets
     * its schedule advanced.
     *
     * @return runs created, including any catch-up runs
     */
    public List<RunRecord> dispatchDueJobs() {
        List<RunRecord> created = new ArrayList<>();
        for (JobDefinition job : getDueJobs()) {
            try {
                created.addAll(jobLocks.withJobLock(job.getId(), () -> dispatch(job)));
            } catch (RuntimeException e) {
                log.error("[Scheduler] Failed to dispatch job {}: {}", job.getId(), e.getMessage(), e);
            }
        }
        return created;
    }

    /**
     * Reconcile every enabled job. A failing job is logged and reported in the
     * result; it does not stop the others.
     */
    public ReconciliationReport updateAllSchedules() {
        List<String> reconciled = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();
        int catchupRuns = 0;

        for (JobDefinition job : store.listJobs()) {
            if (!job.isEnabled()) {
                continue;
            }
            try {
                catchupRuns += scheduleJob(job).size();
                reconciled.add(job.getId());
            } catch (RuntimeException e) {
                log.error("[Scheduler] Failed to reconcile job {}: {}", job.getId(), e.getMessage(), e);
                failures.put(job.getId(), e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }

        if (!failures.isEmpty()) {
            log.warn("[Scheduler] Reconciled {} job(s), {} failed: {}", reconciled.size(), failures.size(),
                    failures.keySet());
        } else {
            log.debug("[Scheduler] Reconciled {} job(s), {} catch-up run(s)", reconciled.size(), catchupRuns);
        }
        return new ReconciliationReport(List.copyOf(reconciled), catchupRuns, Collections.unmodifiableMap(failures));
    }

    /**
     * Create and persist a DUE run for one occurrence of a job.
     */
    RunRecord createRun(JobDefinition job, Instant scheduledAt, boolean manual, boolean dryRun) {
        String prefix = dryRun ? "dryrun_" : "run_";
        RunRecord run = RunRecord.builder()
                .id(prefix + job.getId() + "_" + scheduledAt.toEpochMilli() + "_"
                        + UUID.randomUUID().toString().substring(0, 8))
                .jobId(job.getId())
                .scheduledAt(scheduledAt)
                .attempt(0)
                .state(RunState.DUE)
                .manual(manual)
                .dryRun(dryRun)
                .resourceUsage(new RunRecord.ResourceUsage())
                .build();
        store.saveRun(run);
        log.info("[Scheduler] Created run {} for job {} at {}", run.getId(), job.getId(), scheduledAt);
        return run;
    }

    private List<RunRecord> dispatch(JobDefinition job) {
        Optional<ScheduleState> schedule = store.getSchedule(job.getId());
        Instant now = clock.instant();
        if (schedule.isEmpty() || !schedule.get().isDueAt(now)) {
            return List.of();
        }

        List<RunRecord> created = new ArrayList<>();
        Instant occurrence = schedule.get().getPendingOccurrence();
        if (!scheduledOccurrences(job.getId()).contains(occurrence)) {
            created.add(createRun(job, occurrence, false, false));
        }
        created.addAll(reconcile(job, occurrence));
        return created;
    }

    /**
     * @param dispatched
     *            occurrence that was just materialized as a run, so the schedule
     *            must move past it even if it is due exactly now; {@code null}
     *            if none
     */
    private List<RunRecord> reconcile(JobDefinition job, Instant dispatched) {
        Instant now = clock.instant();
        String timezone = dueTimeCalculator.resolveZone(job.getTimezone()).getId();
        Optional<ScheduleState> existing = store.getSchedule(job.getId());

        if (existing.isEmpty()) {
            Optional<DueTime> next = dueTimeCalculator.nextDueTime(job, null);
            ScheduleState fresh = ScheduleState.builder()
                    .jobId(job.getId())
                    .timezone(timezone)
                    .build();
            fresh.advanceTo(next.orElse(null));
            if (next.isEmpty()) {
                log.warn("[Scheduler] No valid next due time for job {}, it will not fire", job.getId());
            } else {
                log.info("[Scheduler] Job {} first due at {}", job.getId(), fresh.getNextDue());
            }
            store.saveSchedule(fresh);
            return List.of();
        }

        ScheduleState schedule = existing.get();
        List<RunRecord> created = new ArrayList<>();

        if (schedule.isExhausted()) {
            log.debug("[Scheduler] Job {} has no further occurrences", job.getId());
        } else if (!schedule.getNextDue().isBefore(now) && !schedule.getPendingOccurrence().equals(dispatched)) {
            // not missed yet; an occurrence due at exactly now is left for dispatch
            log.debug("[Scheduler] Job {} next due at {}, nothing missed", job.getId(), schedule.getNextDue());
        } else if (job.isCatchup() && schedule.getLastSuccess() != null) {
            schedule.advanceTo(catchUp(job, schedule, now, created));
        } else {
            schedule.advanceTo(skipMissed(job, schedule, now));
        }

        if (schedule.isExhausted() && !created.isEmpty()) {
            log.warn("[Scheduler] Job {} window exhausted after catch-up", job.getId());
        }
        schedule.setTimezone(timezone);
        store.saveSchedule(schedule);
        return created;
    }

    /**
     * Materialize every occurrence from the pending one up to now that has no
     * scheduled run yet, and return the first occurrence left for later.
     */
    private DueTime catchUp(JobDefinition job, ScheduleState schedule, Instant now, List<RunRecord> created) {
        int maxRuns = properties.getScheduler().getMaxCatchupRuns();
        Set<Instant> materialized = scheduledOccurrences(job.getId());

        Instant pending = schedule.getPendingOccurrence();
        Optional<DueTime> next = Optional.of(new DueTime(pending, schedule.getNextDue()));
        while (next.isPresent() && !next.get().occurrence().isAfter(now)) {
            Instant occurrence = next.get().occurrence();
            if (!materialized.contains(occurrence)) {
                if (created.size() >= maxRuns) {
                    log.warn("[Scheduler] Job {} hit the catch-up limit of {} runs, continuing next pass",
                            job.getId(), maxRuns);
                    return next.get();
                }
                created.add(createRun(job, occurrence, false, false));
            }
            next = dueTimeCalculator.nextDueTime(job, occurrence);
        }

        if (!created.isEmpty()) {
            log.info("[Scheduler] Job {}: materialized {} missed occurrence(s)", job.getId(), created.size());
        }
        return next.orElse(null);
    }

    private DueTime skipMissed(JobDefinition job, ScheduleState schedule, Instant now) {
        Instant from = latest(schedule.getLastScheduled(), schedule.getPendingOccurrence(), now);
        Optional<DueTime> next = dueTimeCalculator.nextDueTime(job, from);
        if (next.isEmpty()) {
            log.warn("[Scheduler] No valid next due time for job {}", job.getId());
        }
        return next.orElse(null);
    }

    private Set<Instant> scheduledOccurrences(String jobId) {
        return store.listRuns(jobId).stream()
                .filter(run -> !run.isManual())
                .map(RunRecord::getScheduledAt)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
    }

    private static Instant latest(Instant... instants) {
        Instant result = null;
        for (Instant instant : instants) {
            if (instant != null && (result == null || instant.isAfter(result))) {
                result = instant;
            }
        }
        return result;
    }
}
