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
 * Result of a run lifecycle operation. None of them throw for a missing or
 * already-transitioned run, so at-least-once callers can retry freely and
 * still tell the cases apart.
 */
public enum TransitionOutcome {

    /** The run moved to the requested state. */
    APPLIED,

    /** The run exists but the transition does not apply from its current state. */
    UNCHANGED,

    /** No run with the given id. */
    NOT_FOUND;

    public boolean isApplied() {
        return this == APPLIED;
    }
}
