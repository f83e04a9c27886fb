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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Durable, bounded serialization of one workflow execution: the only artifact
 * written to disk. Self-contained, so a continuable conversation can be rebuilt
 * from it without any other lookup.
 *
 * <p>
 * The field layout is the on-disk JSON layout.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ResumeSnapshot {

    @JsonProperty("workflow_metadata")
    private WorkflowMetadata workflowMetadata;

    @JsonProperty("completed_tools")
    @Builder.Default
    private List<CompletedTool> completedTools = new ArrayList<>();

    @JsonProperty("chat_history")
    @Builder.Default
    private List<SnapshotMessage> chatHistory = new ArrayList<>();

    @JsonProperty("context_evolution")
    @Builder.Default
    private ContextEvolution contextEvolution = new ContextEvolution();

    @JsonProperty("workflow_variables")
    @Builder.Default
    private Map<String, Object> workflowVariables = new LinkedHashMap<>();

    public String workflowId() {
        return workflowMetadata != null ? workflowMetadata.getId() : null;
    }
}
