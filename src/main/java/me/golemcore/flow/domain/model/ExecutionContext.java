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

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Live, mutable state of one workflow execution. Created once per fresh run or
 * reconstructed from a {@link ResumeSnapshot}; owned by the orchestrator for the
 * duration of the run.
 *
 * <p>
 * {@code currentStep} is informational only and never used to estimate
 * progress.
 */
@Data
@Builder
public class ExecutionContext {

    private String workflowId;

    private int currentStep;

    @Builder.Default
    private Map<String, Object> variables = new LinkedHashMap<>();

    @Builder.Default
    private List<HistoryEntry> executionHistory = new ArrayList<>();

    private Instant startTime;

    @Builder.Default
    private List<CompletedTool> completedTools = new ArrayList<>();

    @Builder.Default
    private ContextEvolution contextEvolution = new ContextEvolution();

    public void incrementStep() {
        currentStep++;
    }

    public void addHistoryEntry(HistoryEntry entry) {
        executionHistory.add(entry);
    }

    public void addCompletedTool(CompletedTool tool) {
        completedTools.add(tool);
    }
}
