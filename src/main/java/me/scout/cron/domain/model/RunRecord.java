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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One scheduled or attempted occurrence of a job.
 *
 * <p>
 * {@code completedAt} is set exactly when {@code state} is terminal. State and
 * timestamps are only written by
 * {@link me.scout.cron.domain.service.RunLifecycleService}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunRecord {

    private String id;
    private String jobId;
    private Instant scheduledAt;
    private int attempt;
    private RunState state;
    private Instant startedAt;
    private Instant completedAt;
    private String errorCode;
    private String errorMessage;

    /** Created by an operator request rather than by the schedule. */
    private boolean manual;
    private boolean dryRun;

    @Builder.Default
    private ResourceUsage resourceUsage = new ResourceUsage();

    /**
     * Usage accounting reported by the executor. Persisted as-is.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ResourceUsage {
        private long steps;
        private long tokens;
        private long durationMs;
        private long bandwidthBytes;
    }
}
