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
import me.scout.cron.domain.model.RunRecord;
import me.scout.cron.port.outbound.CronStorePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Decides whether a new run of a job may start while other runs of the same
 * job are active (STARTING or RUNNING), according to the job's
 * {@link ConcurrencyPolicy}.
 *
 * <p>
 * {@code queue} only reports non-admission; queuing the run is the caller's
 * job. Unrecognized policy values are denied.
 */
@Service
@Slf4j
public class ConcurrencyAdmissionService {

    private final CronStorePort store;
    private final RunLifecycleService lifecycleService;
    private final JobLockRegistry jobLocks;

    public ConcurrencyAdmissionService(CronStorePort store, RunLifecycleService lifecycleService,
            JobLockRegistry jobLocks) {
        this.store = store;
        this.lifecycleService = lifecycleService;
        this.jobLocks = jobLocks;
    }

    public AdmissionDecision canRunJob(JobDefinition job) {
        return jobLocks.withJobLock(job.getId(), () -> decide(job));
    }

    private AdmissionDecision decide(JobDefinition job) {
        List<RunRecord> activeRuns = store.listRuns(job.getId()).stream()
                .filter(run -> run.getState() != null && run.getState().isActive())
                .toList();

        if (activeRuns.isEmpty()) {
            return AdmissionDecision.admit();
        }

        Optional<ConcurrencyPolicy> policy = ConcurrencyPolicy.fromValue(job.getConcurrency());
        if (policy.isEmpty()) {
            log.warn("[Admission] Job {} has unknown concurrency policy '{}', denying", job.getId(),
                    job.getConcurrency());
            return AdmissionDecision.deny("Unknown concurrency policy: " + job.getConcurrency(), null);
        }

        String existingRunId = activeRuns.get(0).getId();
        return switch (policy.get()) {
        case ALLOW -> AdmissionDecision.admit();
        case SKIP -> {
            log.info("[Admission] Job {} already running ({}), skipping", job.getId(), existingRunId);
            yield AdmissionDecision.deny("Job already running (skip policy)", existingRunId);
        }
        case QUEUE -> {
            log.info("[Admission] Job {} already running ({}), queueing", job.getId(), existingRunId);
            yield AdmissionDecision.deny("Job already running (queue policy)", existingRunId);
        }
        case CANCEL_PREVIOUS -> {
            for (RunRecord run : activeRuns) {
                lifecycleService.cancelRun(run.getId());
            }
            log.info("[Admission] Job {}: cancelled {} active run(s) for new run", job.getId(), activeRuns.size());
            yield AdmissionDecision.admit();
        }
        };
    }
}
