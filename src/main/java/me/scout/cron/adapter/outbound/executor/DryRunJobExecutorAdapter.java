package me.scout.cron.adapter.outbound.executor;

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
import me.scout.cron.domain.model.JobExecutionResult;
import me.scout.cron.domain.model.RunRecord;
import me.scout.cron.domain.service.JobRunService;
import me.scout.cron.port.outbound.JobExecutorPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Executor that performs no work and reports success.
 *
 * <p>
 * Used for dry runs, and as the default executor when no agent runtime is
 * wired in. The output describes what would have been executed.
 *
 * <p>
 * Executor ID: {@code "dry-run"}
 */
@Component
@Slf4j
public class DryRunJobExecutorAdapter implements JobExecutorPort {

    @Override
    public String getExecutorId() {
        return JobRunService.DRY_RUN_EXECUTOR_ID;
    }

    @Override
    public CompletableFuture<JobExecutionResult> execute(JobDefinition job, RunRecord run) {
        int inputCount = job.getInputs() != null ? job.getInputs().size() : 0;
        log.info("[Runner] Dry run {}: graph {} with {} input(s)", run.getId(), job.getGraphId(), inputCount);
        return CompletableFuture.completedFuture(JobExecutionResult.builder()
                .output("[Dry run] graph=" + job.getGraphId() + ", inputs=" + inputCount)
                .steps(0)
                .tokens(0)
                .bandwidthBytes(0)
                .intermediateSteps(List.of(Map.of(
                        "step", "dry-run",
                        "graphId", String.valueOf(job.getGraphId()),
                        "inputCount", inputCount)))
                .build());
    }
}
