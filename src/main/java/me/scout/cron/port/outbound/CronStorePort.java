package me.scout.cron.port.outbound;

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

import me.scout.cron.domain.model.JobDefinition;
import me.scout.cron.domain.model.RunEvent;
import me.scout.cron.domain.model.RunRecord;
import me.scout.cron.domain.model.ScheduleState;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage for job definitions, schedule state, run records and run
 * events. Every save is a single-entity upsert; callers that update a run and
 * its schedule do so as two sequential writes.
 */
public interface CronStorePort {

    Optional<JobDefinition> getJob(String jobId);

    /**
     * All job definitions, in no particular order.
     */
    List<JobDefinition> listJobs();

    void saveJob(JobDefinition job);

    /**
     * Delete a job together with its schedule, runs and run events.
     *
     * @return {@code true} if the job existed
     */
    boolean deleteJob(String jobId);

    Optional<ScheduleState> getSchedule(String jobId);

    void saveSchedule(ScheduleState schedule);

    void deleteSchedule(String jobId);

    /**
     * Schedules whose {@code nextDue} is at or before {@code now}.
     */
    List<ScheduleState> getDueSchedules(Instant now);

    Optional<RunRecord> getRun(String runId);

    void saveRun(RunRecord run);

    /**
     * Delete a run together with its events.
     *
     * @return {@code true} if the run existed
     */
    boolean deleteRun(String runId);

    /**
     * Runs ordered by {@code scheduledAt}, newest first.
     *
     * @param jobId
     *            restrict to one job, or {@code null} for all runs
     */
    List<RunRecord> listRuns(String jobId);

    void appendRunEvent(RunEvent event);

    /**
     * Most recent events of a run, newest first.
     */
    List<RunEvent> listRunEvents(String runId, int limit);
}
