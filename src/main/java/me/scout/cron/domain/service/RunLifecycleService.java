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

import me.scout.cron.domain.model.RunRecord;
import me.scout.cron.domain.model.RunState;
import me.scout.cron.domain.model.ScheduleState;
import me.scout.cron.domain.model.TransitionOutcome;
import me.scout.cron.port.outbound.CronStorePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Predicate;

/**
 * Moves runs through their lifecycle and keeps the owning job's schedule
 * bookkeeping ({@code lastScheduled}, {@code lastAttempt},
 * {@code lastSuccess}) in step.
 *
 * <p>
 * Every transition is validated against {@link RunState#canTransitionTo} and
 * performed under the job's lock. A run that does not exist, or is not in a
 * state the transition applies to, is left alone and reported through
 * {@link TransitionOutcome} rather than an exception.
 */
@Service
@Slf4j
public class RunLifecycleService {

    private static final Predicate<RunState> ANY_SOURCE = state -> true;

    private final CronStorePort store;
    private final JobLockRegistry jobLocks;
    private final Clock clock;

    public RunLifecycleService(CronStorePort store, JobLockRegistry jobLocks, Clock clock) {
        this.store = store;
        this.jobLocks = jobLocks;
        this.clock = clock;
    }

    /**
     * DUE to SCHEDULED. Records {@code lastScheduled} on the job's schedule.
     */
    public TransitionOutcome markRunScheduled(String runId) {
        return transition(runId, RunState.SCHEDULED, ANY_SOURCE, (run, now) -> {
        }, ScheduleState::setLastScheduled);
    }

    /**
     * SCHEDULED to STARTING, stamping {@code startedAt}.
     */
    public TransitionOutcome markRunStarted(String runId) {
        return transition(runId, RunState.STARTING, ANY_SOURCE, (run, now) -> run.setStartedAt(now), null);
    }

    /**
     * STARTING to RUNNING. Called by the executor once it begins active work.
     */
    public TransitionOutcome markRunRunning(String runId) {
        return transition(runId, RunState.RUNNING, ANY_SOURCE, (run, now) -> {
        }, null);
    }

    public TransitionOutcome markRunCompleted(String runId, boolean success, String errorCode, String errorMessage) {
        return markRunCompleted(runId, success, errorCode, errorMessage, null);
    }

    /**
     * Finish an active run as SUCCEEDED or FAILED. Error fields are only kept on
     * failure. The job's {@code lastAttempt} is always updated,
     * {@code lastSuccess} only on success.
     */
    public TransitionOutcome markRunCompleted(String runId, boolean success, String errorCode, String errorMessage,
            RunRecord.ResourceUsage usage) {
        RunState target = success ? RunState.SUCCEEDED : RunState.FAILED;
        return transition(runId, target, ANY_SOURCE, (run, now) -> {
            run.setCompletedAt(now);
            if (!success) {
                run.setErrorCode(errorCode);
                run.setErrorMessage(errorMessage);
            }
            if (usage != null) {
                run.setResourceUsage(usage);
            }
        }, (schedule, now) -> {
            schedule.setLastAttempt(now);
            if (success) {
                schedule.setLastSuccess(now);
            }
        });
    }

    /**
     * Cancel an active (STARTING or RUNNING) run. This only records the intent;
     * stopping the work is up to the executor.
     */
    public TransitionOutcome cancelRun(String runId) {
        return transition(runId, RunState.CANCELLED, RunState::isActive, (run, now) -> run.setCompletedAt(now), null);
    }

    /**
     * Cancel a run that never started because admission turned it down.
     */
    public TransitionOutcome rejectRun(String runId, String errorCode, String reason) {
        return transition(runId, RunState.CANCELLED, RunState::isPending, (run, now) -> {
            run.setCompletedAt(now);
            run.setErrorCode(errorCode);
            run.setErrorMessage(reason);
        }, null);
    }

    /**
     * Runs that exist but have not been handed to an executor yet (DUE or
     * SCHEDULED), oldest occurrence first.
     */
    public List<RunRecord> getPendingRuns() {
        return store.listRuns(null).stream()
                .filter(run -> run.getState() != null && run.getState().isPending())
                .sorted(Comparator.comparing(RunRecord::getScheduledAt,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    private TransitionOutcome transition(String runId, RunState target, Predicate<RunState> allowedSource,
            RunMutation mutation, BiConsumer<ScheduleState, Instant> scheduleUpdate) {
        Optional<RunRecord> lookup = store.getRun(runId);
        if (lookup.isEmpty()) {
            log.debug("[Lifecycle] Run not found: {}", runId);
            return TransitionOutcome.NOT_FOUND;
        }

        String jobId = lookup.get().getJobId();
        return jobLocks.withJobLock(jobId, () -> {
            Optional<RunRecord> locked = store.getRun(runId);
            if (locked.isEmpty()) {
                return TransitionOutcome.NOT_FOUND;
            }

            RunRecord run = locked.get();
            RunState from = run.getState();
            if (from == target) {
                log.debug("[Lifecycle] Run {} already {}", runId, target);
                return TransitionOutcome.UNCHANGED;
            }
            if (from == null || !allowedSource.test(from) || !from.canTransitionTo(target)) {
                log.debug("[Lifecycle] Transition of run {} not applicable: {} -> {}", runId, from, target);
                return TransitionOutcome.UNCHANGED;
            }

            Instant now = clock.instant();
            run.setState(target);
            mutation.apply(run, now);
            store.saveRun(run);
            log.info("[Lifecycle] Run {} ({}): {} -> {}", runId, jobId, from, target);

            if (scheduleUpdate != null) {
                Optional<ScheduleState> schedule = store.getSchedule(jobId);
                if (schedule.isPresent()) {
                    scheduleUpdate.accept(schedule.get(), now);
                    store.saveSchedule(schedule.get());
                } else {
                    log.debug("[Lifecycle] No schedule state for job {}, bookkeeping skipped", jobId);
                }
            }
            return TransitionOutcome.APPLIED;
        });
    }

    @FunctionalInterface
    private interface RunMutation {
        void apply(RunRecord run, Instant now);
    }
}
