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

import java.util.Locale;
import java.util.Optional;

/**
 * What happens when a job is started while another run of it is active.
 */
public enum ConcurrencyPolicy {

    ALLOW("allow"), SKIP("skip"), QUEUE("queue"), CANCEL_PREVIOUS("cancel-previous");

    private final String value;

    ConcurrencyPolicy(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Parse a configured policy value. Accepts the hyphenated form as well as
     * the enum constant name, case-insensitively.
     *
     * @return the policy, or empty if the value is not recognized
     */
    public static Optional<ConcurrencyPolicy> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (ConcurrencyPolicy policy : values()) {
            if (policy.value.equals(normalized)) {
                return Optional.of(policy);
            }
        }
        return Optional.empty();
    }
}
