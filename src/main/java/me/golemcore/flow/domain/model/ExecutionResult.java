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

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of {@code execute} or {@code resume}. Failed results carry enough
 * context (workflow id, last checkpoint, iteration count) for a manual resume
 * decision.
 */
@Data
@Builder
public class ExecutionResult {

    private boolean success;
    private String finalOutput;
    private String errorMessage;
    private Duration duration;

    private String workflowId;
    private ExecutionState state;
    private ExecutionErrorKind errorKind;
    private ModelErrorKind modelErrorKind;
    private int iterations;
    private Instant lastCheckpoint;
    private boolean checkpointAvailable;
    private CompatibilityResult compatibility;
    private long totalTokens;
}
