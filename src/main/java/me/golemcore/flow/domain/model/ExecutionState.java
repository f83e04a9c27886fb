package me.golemcore.flow.domain.model;

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

/**
 * Lifecycle of one execution. {@code AWAITING_MODEL} and {@code EXECUTING_TOOL}
 * alternate; the last three states are terminal.
 */
public enum ExecutionState {
    CREATED, RENDERING, AWAITING_MODEL, EXECUTING_TOOL, COMPLETED, FAILED, CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Status string stored in {@code workflow_metadata.status}: {@code running}
     * for every non-terminal state.
     */
    public String statusName() {
        return isTerminal() ? name().toLowerCase(Locale.ROOT) : "running";
    }
}
