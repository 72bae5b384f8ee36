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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.scout.cron.domain.model.JobDefinition;
import me.scout.cron.domain.model.JobExecutionResult;
import me.scout.cron.domain.model.RunEvent;
import me.scout.cron.domain.model.RunRecord;
import me.scout.cron.port.outbound.CronStorePort;
import me.scout.cron.port.outbound.StoragePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Writes the artifacts of a finished run into the {@code artifacts} storage
 * collection, one directory per run:
 *
 * <pre>
 * artifacts/{jobId}/{startedAt}_{runId}/
 *   metadata.json   run and job metadata
 *   stdout.log      run events, oldest first
 *   steps.json      executor steps
 *   report.md       human-readable summary including the executor output
 * </pre>
 */
@Service
@Slf4j
public class RunArtifactService {

    static final String ARTIFACTS_DIR = "artifacts";
    static final String METADATA_FILE = "metadata.json";
    static final String LOG_FILE = "stdout.log";
    static final String STEPS_FILE = "steps.json";
    static final String REPORT_FILE = "report.md";

    private final StoragePort storagePort;
    private final CronStorePort store;
    private final ObjectMapper objectMapper;

    public RunArtifactService(StoragePort storagePort, CronStorePort store, ObjectMapper objectMapper) {
        this.storagePort = storagePort;
        this.store = store;
        this.objectMapper = objectMapper;
    }

    /**
     * Write the artifacts of {@code run}.
     *
     * @param result
     *            what the executor reported, or {@code null} if it reported
     *            nothing
     * @return the run's directory within the artifacts collection
     */
    public String saveArtifacts(JobDefinition job, RunRecord run, JobExecutionResult result) {
        String directory = directoryFor(run);
        List<Map<String, Object>> steps = result != null ? result.getIntermediateSteps() : List.of();

        write(directory, METADATA_FILE, toJson(metadata(job, run)));
        write(directory, LOG_FILE, renderLog(run.getId()));
        write(directory, STEPS_FILE, toJson(steps));
        write(directory, REPORT_FILE, renderReport(job, run, result));

        log.debug("[Runner] Saved artifacts of run {} to {}/{}", run.getId(), ARTIFACTS_DIR, directory);
        return directory;
    }

    static String directoryFor(RunRecord run) {
        Instant started = run.getStartedAt() != null ? run.getStartedAt() : run.getScheduledAt();
        String stamp = started != null ? started.toString().replace(':', '-').replace('.', '-') : "unstarted";
        return run.getJobId() + "/" + stamp + "_" + run.getId();
    }

    private Map<String, Object> metadata(JobDefinition job, RunRecord run) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("jobId", run.getJobId());
        metadata.put("runId", run.getId());
        metadata.put("state", run.getState());
        metadata.put("manual", run.isManual());
        metadata.put("dryRun", run.isDryRun());
        metadata.put("scheduledAt", run.getScheduledAt());
        metadata.put("startedAt", run.getStartedAt());
        metadata.put("completedAt", run.getCompletedAt());
        metadata.put("graphId", job.getGraphId());
        metadata.put("inputs", job.getInputs());
        metadata.put("resourceCaps", job.getResources());
        metadata.put("resourceUsage", run.getResourceUsage());
        if (run.getErrorCode() != null) {
            metadata.put("errorCode", run.getErrorCode());
            metadata.put("errorMessage", run.getErrorMessage());
        }
        return metadata;
    }

    private String renderLog(String runId) {
        List<RunEvent> events = new ArrayList<>(store.listRunEvents(runId, Integer.MAX_VALUE));
        Collections.reverse(events);
        StringBuilder sb = new StringBuilder();
        for (RunEvent event : events) {
            sb.append('[').append(event.getTimestamp()).append("] ")
                    .append(event.getLevel()).append(": ")
                    .append(event.getMessage()).append('\n');
        }
        return sb.toString();
    }

    private String renderReport(JobDefinition job, RunRecord run, JobExecutionResult result) {
        RunRecord.ResourceUsage usage = run.getResourceUsage() != null
                ? run.getResourceUsage()
                : new RunRecord.ResourceUsage();
        String output = result != null && result.getOutput() != null && !result.getOutput().isBlank()
                ? result.getOutput()
                : "_No output._";

        StringBuilder sb = new StringBuilder();
        sb.append("# Job Execution Report\n\n");

        sb.append("## Job Information\n\n");
        sb.append("- **Job ID:** ").append(job.getId()).append('\n');
        sb.append("- **Job Name:** ").append(job.getName()).append('\n');
        sb.append("- **Run ID:** ").append(run.getId()).append('\n');
        sb.append("- **Graph ID:** ").append(job.getGraphId()).append('\n');
        sb.append("- **Scheduled At:** ").append(run.getScheduledAt()).append("\n\n");

        sb.append("## Execution Details\n\n");
        sb.append("- **State:** ").append(run.getState()).append('\n');
        sb.append("- **Started At:** ").append(run.getStartedAt()).append('\n');
        sb.append("- **Completed At:** ").append(run.getCompletedAt()).append('\n');
        sb.append("- **Duration:** ").append(usage.getDurationMs()).append(" ms\n");
        sb.append("- **Dry Run:** ").append(run.isDryRun() ? "yes" : "no").append('\n');
        if (run.getErrorCode() != null) {
            sb.append("- **Error:** ").append(run.getErrorCode()).append(": ").append(run.getErrorMessage())
                    .append('\n');
        }
        sb.append('\n');

        sb.append("## Result\n\n").append(output).append("\n\n");

        sb.append("## Resource Usage\n\n");
        sb.append("- **Steps:** ").append(usage.getSteps()).append('\n');
        sb.append("- **Tokens:** ").append(usage.getTokens()).append('\n');
        sb.append("- **Bandwidth:** ").append(usage.getBandwidthBytes()).append(" bytes\n");
        return sb.toString();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize run artifact", e);
        }
    }

    private void write(String directory, String file, String content) {
        await(storagePort.writeDocument(ARTIFACTS_DIR, directory + "/" + file, content, false));
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
