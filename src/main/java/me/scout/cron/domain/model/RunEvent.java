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
import java.util.Map;

/**
 * Structured log line attached to a run, persisted in the run's event journal.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunEvent {

    private String id;
    private String runId;
    private Instant timestamp;
    private Level level;
    private String event;
    private String message;
    private Map<String, Object> data;

    public enum Level {
        DEBUG, INFO, WARN, ERROR
    }
}
