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

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of a {@link RunRecord}.
 *
 * <pre>
 * DUE -&gt; SCHEDULED -&gt; STARTING -&gt; RUNNING
 * STARTING | RUNNING -&gt; SUCCEEDED | FAILED | CANCELLED
 * DUE | SCHEDULED -&gt; CANCELLED
 * </pre>
 *
 * <p>
 * DUE and SCHEDULED only reach CANCELLED when admission rejects the run.
 * Terminal states have no outgoing edges.
 */
public enum RunState {

    DUE, SCHEDULED, STARTING, RUNNING, SUCCEEDED, FAILED, CANCELLED;

    private static final Set<RunState> TERMINAL = EnumSet.of(SUCCEEDED, FAILED, CANCELLED);
    private static final Set<RunState> ACTIVE = EnumSet.of(STARTING, RUNNING);
    private static final Set<RunState> PENDING = EnumSet.of(DUE, SCHEDULED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean isActive() {
        return ACTIVE.contains(this);
    }

    public boolean isPending() {
        return PENDING.contains(this);
    }

    public boolean canTransitionTo(RunState target) {
        return switch (this) {
        case DUE -> target == SCHEDULED || target == CANCELLED;
        case SCHEDULED -> target == STARTING || target == CANCELLED;
        case STARTING -> target == RUNNING || target.isTerminal();
        case RUNNING -> target.isTerminal();
        case SUCCEEDED, FAILED, CANCELLED -> false;
        };
    }
}
