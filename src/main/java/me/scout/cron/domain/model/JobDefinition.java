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

import com.fasterxml.jackson.annotation.JsonMerge;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration for a recurring unit of agent work. Created and edited through
 * {@link me.scout.cron.domain.service.JobService}; the scheduler only reads it.
 *
 * <p>
 * {@code concurrency} is kept as the raw configured string so that a value
 * nobody recognizes can still be loaded and denied at admission time. Use
 * {@link ConcurrencyPolicy#fromValue(String)} to interpret it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class JobDefinition {

    public static final String DEFAULT_VERSION = "1.0.0";
    public static final long MAX_JITTER_MS = 300_000L;

    private String id;

    @Builder.Default
    private String version = DEFAULT_VERSION;

    private String name;
    private String description;
    private String owner;

    @Builder.Default
    private boolean enabled = true;

    private String schedule;
    private String timezone;
    private long jitterMs;
    private boolean catchup;

    @Builder.Default
    private String concurrency = ConcurrencyPolicy.ALLOW.getValue();

    private int priority;
    private Instant notBefore;
    private Instant notAfter;
    private String graphId;

    @Builder.Default
    private Map<String, Object> inputs = new LinkedHashMap<>();

    @Builder.Default
    @JsonMerge
    private ResourceLimits resources = new ResourceLimits();

    @Builder.Default
    private Map<String, String> labels = new LinkedHashMap<>();

    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Per-run resource caps handed to the executor.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ResourceLimits {

        @Builder.Default
        private int maxSteps = 10;

        @Builder.Default
        private int maxRunSeconds = 300;

        @Builder.Default
        private int maxModelTokens = 4000;
    }
}
