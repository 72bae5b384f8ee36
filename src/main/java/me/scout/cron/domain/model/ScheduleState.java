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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Scheduling bookkeeping for one job. A {@code null} {@link #nextDue} means the
 * job's validity window is exhausted and it will not fire again until its
 * definition changes.
 *
 * <p>
 * {@link #nextOccurrence} is the raw cron occurrence and {@link #nextDue} the
 * same occurrence with jitter applied. States written before the occurrence
 * was tracked carry only {@code nextDue}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleState {

    private String jobId;
    private Instant nextDue;
    private Instant nextOccurrence;
    private Instant lastScheduled;
    private Instant lastAttempt;
    private Instant lastSuccess;
    private String timezone;

    @JsonIgnore
    public boolean isExhausted() {
        return nextDue == null;
    }

    @JsonIgnore
    public Instant getPendingOccurrence() {
        return nextOccurrence != null ? nextOccurrence : nextDue;
    }

    public void advanceTo(DueTime dueTime) {
        nextOccurrence = dueTime != null ? dueTime.occurrence() : null;
        nextDue = dueTime != null ? dueTime.dueAt() : null;
    }

    @JsonIgnore
    public boolean isDueAt(Instant now) {
        return nextDue != null && !nextDue.isAfter(now);
    }
}
