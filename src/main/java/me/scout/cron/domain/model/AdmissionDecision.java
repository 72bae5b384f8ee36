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

/**
 * Outcome of a concurrency admission check.
 *
 * @param canRun
 *            whether a new run of the job may start
 * @param reason
 *            why admission was denied, {@code null} when admitted
 * @param existingRunId
 *            the conflicting active run, if any
 */
public record AdmissionDecision(boolean canRun, String reason, String existingRunId) {

    public static AdmissionDecision admit() {
        return new AdmissionDecision(true, null, null);
    }

    public static AdmissionDecision deny(String reason, String existingRunId) {
        return new AdmissionDecision(false, reason, existingRunId);
    }
}
