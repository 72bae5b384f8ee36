package me.scout.cron.adapter.outbound.storage;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.scout.cron.domain.model.JobDefinition;
import me.scout.cron.domain.model.RunEvent;
import me.scout.cron.domain.model.RunRecord;
import me.scout.cron.domain.model.ScheduleState;
import me.scout.cron.port.outbound.CronStorePort;
import me.scout.cron.port.outbound.StoragePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * {@link CronStorePort} backed by JSON documents in a {@link StoragePort}.
 *
 * <p>
 * Jobs, schedules and runs are one document each, written atomically. Run
 * events are appended to a JSONL journal per run. Storage and serialization
 * failures surface as {@link IllegalStateException}.
 */
@Component
@Slf4j
public class StorageCronStoreAdapter implements CronStorePort {

    private static final String JOBS_DIR = "jobs";
    private static final String SCHEDULES_DIR = "schedules";
    private static final String RUNS_DIR = "runs";
    private static final String EVENTS_DIR = "events";
    private static final String JSON = ".json";
    private static final String JSONL = ".jsonl";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    public StorageCronStoreAdapter(StoragePort storagePort, ObjectMapper objectMapper) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<JobDefinition> getJob(String jobId) {
        return read(JOBS_DIR, jobId + JSON, JobDefinition.class);
    }

    @Override
    public List<JobDefinition> listJobs() {
        return readAll(JOBS_DIR, JobDefinition.class);
    }

    @Override
    public void saveJob(JobDefinition job) {
        write(JOBS_DIR, job.getId() + JSON, job, true);
    }

    @Override
    public boolean deleteJob(String jobId) {
        boolean existed = await(storagePort.documentExists(JOBS_DIR, jobId + JSON));

        for (RunRecord run : listRuns(jobId)) {
            deleteRun(run.getId());
        }
        deleteSchedule(jobId);
        await(storagePort.deleteDocument(JOBS_DIR, jobId + JSON));

        if (existed) {
            log.debug("[Storage] Deleted job {} with its schedule and runs", jobId);
        }
        return existed;
    }

    @Override
    public Optional<ScheduleState> getSchedule(String jobId) {
        return read(SCHEDULES_DIR, jobId + JSON, ScheduleState.class);
    }

    @Override
    public void saveSchedule(ScheduleState schedule) {
        write(SCHEDULES_DIR, schedule.getJobId() + JSON, schedule, false);
    }

    @Override
    public void deleteSchedule(String jobId) {
        await(storagePort.deleteDocument(SCHEDULES_DIR, jobId + JSON));
    }

    @Override
    public List<ScheduleState> getDueSchedules(Instant now) {
        return readAll(SCHEDULES_DIR, ScheduleState.class).stream()
                .filter(schedule -> schedule.isDueAt(now))
                .toList();
    }

    @Override
    public Optional<RunRecord> getRun(String runId) {
        return read(RUNS_DIR, runId + JSON, RunRecord.class);
    }

    @Override
    public void saveRun(RunRecord run) {
        write(RUNS_DIR, run.getId() + JSON, run, false);
    }

    @Override
    public boolean deleteRun(String runId) {
        boolean existed = await(storagePort.documentExists(RUNS_DIR, runId + JSON));
        await(storagePort.deleteDocument(EVENTS_DIR, runId + JSONL));
        await(storagePort.deleteDocument(RUNS_DIR, runId + JSON));
        return existed;
    }

    @Override
    public List<RunRecord> listRuns(String jobId) {
        return readAll(RUNS_DIR, RunRecord.class).stream()
                .filter(run -> jobId == null || jobId.equals(run.getJobId()))
                .sorted(Comparator.comparing(RunRecord::getScheduledAt,
                        Comparator.nullsLast(Comparator.<Instant>reverseOrder())))
                .toList();
    }

    @Override
    public void appendRunEvent(RunEvent event) {
        try {
            String line = objectMapper.writeValueAsString(event);
            await(storagePort.appendLine(EVENTS_DIR, event.getRunId() + JSONL, line));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize event for run " + event.getRunId(), e);
        }
    }

    @Override
    public List<RunEvent> listRunEvents(String runId, int limit) {
        String journal = await(storagePort.readDocument(EVENTS_DIR, runId + JSONL));
        if (journal == null || journal.isBlank()) {
            return List.of();
        }

        List<RunEvent> events = new ArrayList<>();
        for (String line : journal.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                events.add(objectMapper.readValue(line, RunEvent.class));
            } catch (JsonProcessingException e) {
                log.warn("[Storage] Skipping malformed event line for run {}: {}", runId, e.getMessage());
            }
        }
        Collections.reverse(events);
        return events.stream().limit(limit).toList();
    }

    private <T> Optional<T> read(String directory, String path, Class<T> type) {
        String json = await(storagePort.readDocument(directory, path));
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to parse " + directory + "/" + path, e);
        }
    }

    private <T> List<T> readAll(String directory, Class<T> type) {
        List<String> files = await(storagePort.listDocuments(directory));
        List<T> result = new ArrayList<>();
        for (String file : files) {
            if (!file.endsWith(JSON)) {
                continue;
            }
            String json = await(storagePort.readDocument(directory, file));
            if (json == null) {
                continue; // deleted since listing
            }
            try {
                result.add(objectMapper.readValue(json, type));
            } catch (JsonProcessingException e) {
                log.warn("[Storage] Skipping unreadable document {}/{}: {}", directory, file, e.getMessage());
            }
        }
        return result;
    }

    private void write(String directory, String path, Object value, boolean backup) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
            await(storagePort.writeDocument(directory, path, json, backup));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + directory + "/" + path, e);
        }
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
