package me.scout.cron.domain.model;

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

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * What an executor reports back after performing a run.
 */
@Value
@Builder
public class JobExecutionResult {
    String output;
    long steps;
    long tokens;
    long bandwidthBytes;

    /** Executor-specific record of each step taken, written to the run's artifacts. */
    @Builder.Default
    List<Map<String, Object>> intermediateSteps = List.of();
}
