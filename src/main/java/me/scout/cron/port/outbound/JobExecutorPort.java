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
import me.scout.cron.domain.model.JobExecutionResult;
import me.scout.cron.domain.model.RunRecord;

import java.util.concurrent.CompletableFuture;

/**
 * Port to whatever actually performs a job run (an agent graph, typically).
 * The future completes exceptionally when the run fails.
 */
public interface JobExecutorPort {

    /**
     * Identifier of this executor, matched against {@code cron.runner.executor}
     * and recorded in run events.
     */
    String getExecutorId();

    CompletableFuture<JobExecutionResult> execute(JobDefinition job, RunRecord run);
}
