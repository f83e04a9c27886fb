package me.golemcore.flow.domain.service;

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

import me.golemcore.flow.domain.model.WorkflowDefinition;
import me.golemcore.flow.domain.model.WorkflowInput;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves the initial variable map of a workflow run with priority ordering:
 * <ol>
 * <li>CLI overrides</li>
 * <li>Per-step defaults ({@code input.default} in the frontmatter)</li>
 * <li>Schema defaults ({@code input.schema.<name>.default})</li>
 * </ol>
 * Variables with no value from any source are left out.
 */
@Service
@Slf4j
public class WorkflowVariableResolver {

    public Map<String, Object> resolve(WorkflowDefinition workflow, Map<String, ?> overrides) {
        Map<String, Object> resolved = new LinkedHashMap<>();

        for (Map.Entry<String, WorkflowInput> entry : workflow.getInputSchema().entrySet()) {
            Object schemaDefault = entry.getValue().getDefaultValue();
            if (schemaDefault != null) {
                resolved.put(entry.getKey(), schemaDefault);
            }
        }
        for (Map.Entry<String, Object> entry : workflow.getInputDefaults().entrySet()) {
            if (entry.getValue() != null) {
                resolved.put(entry.getKey(), entry.getValue());
            }
        }
        if (overrides != null) {
            for (Map.Entry<String, ?> entry : overrides.entrySet()) {
                if (entry.getValue() != null) {
                    resolved.put(entry.getKey(), entry.getValue());
                }
            }
        }

        log.debug("[Flow] Resolved {} variable(s) for workflow {}", resolved.size(), workflow.getName());
        return resolved;
    }

    /**
     * Returns required schema inputs that have no value in {@code resolved}.
     */
    public List<String> findMissingRequired(WorkflowDefinition workflow, Map<String, Object> resolved) {
        List<String> missing = new ArrayList<>();
        for (Map.Entry<String, WorkflowInput> entry : workflow.getInputSchema().entrySet()) {
            if (entry.getValue().isRequired() && resolved.get(entry.getKey()) == null) {
                missing.add(entry.getKey());
            }
        }
        return missing;
    }
}
