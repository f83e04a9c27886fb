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

import me.golemcore.flow.domain.model.CompatibilityResult;
import me.golemcore.flow.domain.model.CompletedTool;
import me.golemcore.flow.domain.model.ResumeSnapshot;
import me.golemcore.flow.domain.model.WorkflowMetadata;
import me.golemcore.flow.infrastructure.config.FlowProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Decides whether a stored resume state may be used against possibly-changed
 * workflow text, and with what confidence.
 *
 * <p>
 * Scoring starts at 1.0 when the content hash is unchanged; otherwise it is
 * multiplied by the normalized edit-distance similarity of the old and new
 * text. Previously used tools that can no longer be resolved cost a further
 * factor of 0.7. Pure function of its inputs.
 */
@Component
public class ResumeCompatibilityValidator {

    static final double SIGNIFICANT_CHANGE_THRESHOLD = 0.8;
    static final double ADAPTATION_THRESHOLD = 0.5;
    static final double MISSING_TOOL_PENALTY = 0.7;

    public static final String STRATEGY_RESET_WORKFLOW = "reset_workflow";
    public static final String STRATEGY_PARTIAL_CONTEXT = "partial_context";

    private final double threshold;

    @Autowired
    public ResumeCompatibilityValidator(FlowProperties properties) {
        this(properties.getResume().getCompatibilityThreshold());
    }

    public ResumeCompatibilityValidator(double threshold) {
        this.threshold = threshold;
    }

    public CompatibilityResult validate(ResumeSnapshot snapshot, String currentSource,
            Collection<String> currentCatalog) {
        WorkflowMetadata metadata = snapshot.getWorkflowMetadata();
        List<String> warnings = new ArrayList<>();
        Map<String, String> strategies = new LinkedHashMap<>();
        boolean requiresAdaptation = false;

        double score = 1.0;
        double similarity = 1.0;
        String currentHash = ContentHasher.sha256(currentSource);
        if (!currentHash.equals(metadata.getWorkflowHash())) {
            similarity = TextSimilarity.similarity(metadata.getOriginalContent(), currentSource);
            score *= similarity;
            if (similarity < SIGNIFICANT_CHANGE_THRESHOLD) {
                warnings.add(String.format(Locale.ROOT,
                        "Workflow content changed significantly (similarity %.2f)", similarity));
            }
            if (similarity < ADAPTATION_THRESHOLD) {
                requiresAdaptation = true;
                strategies.put(STRATEGY_RESET_WORKFLOW,
                        "Start a fresh run of the edited workflow and discard the stored state");
                strategies.put(STRATEGY_PARTIAL_CONTEXT,
                        "Resume with --force, keeping discovered insights but re-validating earlier results");
            }
        }

        List<String> unavailable = findUnavailableTools(snapshot, currentCatalog);
        if (!unavailable.isEmpty()) {
            score *= MISSING_TOOL_PENALTY;
            warnings.add("Previously used tool(s) no longer available: " + String.join(", ", unavailable));
        }

        score = Math.max(0.0, Math.min(1.0, score));
        return CompatibilityResult.builder()
                .canResume(score >= threshold)
                .score(score)
                .similarity(similarity)
                .warnings(warnings)
                .requiresAdaptation(requiresAdaptation)
                .migrationStrategies(strategies)
                .unavailableTools(unavailable)
                .build();
    }

    private List<String> findUnavailableTools(ResumeSnapshot snapshot, Collection<String> currentCatalog) {
        Set<String> resolvable = new LinkedHashSet<>();
        List<String> snapshotTools = snapshot.getWorkflowMetadata().getAvailableTools();
        if (snapshotTools != null && currentCatalog != null) {
            for (String tool : snapshotTools) {
                if (currentCatalog.contains(tool)) {
                    resolvable.add(tool);
                }
            }
        }

        Set<String> unavailable = new LinkedHashSet<>();
        if (snapshot.getCompletedTools() != null) {
            for (CompletedTool tool : snapshot.getCompletedTools()) {
                // rejected or failed calls never used the tool
                if (tool.isSuccess() && !resolvable.contains(tool.getFunctionName())) {
                    unavailable.add(tool.getFunctionName());
                }
            }
        }
        return new ArrayList<>(unavailable);
    }
}
