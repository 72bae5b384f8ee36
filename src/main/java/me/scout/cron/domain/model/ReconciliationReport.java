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

import java.util.List;
import java.util.Map;

/**
 * Aggregate result of reconciling every enabled job's schedule.
 *
 * @param reconciledJobIds
 *            jobs whose schedule was reconciled successfully
 * @param catchupRunsCreated
 *            runs materialized for missed occurrences
 * @param failures
 *            job id to error message for jobs that failed
 */
public record ReconciliationReport(List<String> reconciledJobIds, int catchupRunsCreated,
        Map<String, String> failures) {

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
