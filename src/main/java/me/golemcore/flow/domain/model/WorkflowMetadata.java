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

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Identity and provenance section of a persisted resume state
 * ({@code workflow_metadata}).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowMetadata {

    @JsonProperty("id")
    private String id;

    @JsonProperty("file_path")
    private String filePath;

    @JsonProperty("workflow_hash")
    private String workflowHash;

    @JsonProperty("original_content")
    private String originalContent;

    @JsonProperty("started_at")
    private Instant startedAt;

    @JsonProperty("last_checkpoint")
    private Instant lastCheckpoint;

    @JsonProperty("status")
    private String status;

    /** Advisory only. */
    @JsonProperty("current_phase")
    private String currentPhase;

    /** Advisory only. */
    @JsonProperty("current_strategy")
    private String currentStrategy;

    @JsonProperty("available_tools")
    @Builder.Default
    private List<String> availableTools = new ArrayList<>();
}
