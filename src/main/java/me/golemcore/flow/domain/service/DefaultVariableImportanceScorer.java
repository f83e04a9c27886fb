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

import me.golemcore.flow.domain.model.ContextChange;
import me.golemcore.flow.domain.model.ContextEvolution;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Keyword heuristic: critical workflow keys, discovery and error wording, and
 * path-like key names raise the score; so does a recent change of the value.
 */
@Component
public class DefaultVariableImportanceScorer implements VariableImportanceScorer {

    static final Set<String> CRITICAL_KEYS = Set.of(
            "project_path", "main_goal", "current_phase", "last_strategy", "key_findings",
            "target_framework", "critical_issue", "file_path", "current_analysis", "next_steps",
            "workflow_intent", "user_request", "analysis_result", "error_state", "completion_criteria",
            "workflow_file", "workflow_hash", "original_content", "available_tools", "execution_context");

    private static final List<String> DISCOVERY_WORDS = List.of("discovered", "found", "analysis");
    private static final List<String> ALERT_WORDS = List.of("error", "critical", "requirement");
    private static final List<String> PATH_SUFFIXES = List.of("_path", "_file", "_config");

    @Override
    public double score(String key, Object value, ContextEvolution evolution) {
        double score = 1.0;
        String lowerKey = key.toLowerCase(Locale.ROOT);
        if (CRITICAL_KEYS.contains(lowerKey)) {
            score *= 3.0;
        }

        String text = value != null ? value.toString().toLowerCase(Locale.ROOT) : "";
        if (DISCOVERY_WORDS.stream().anyMatch(text::contains)) {
            score *= 2.0;
        }
        if (ALERT_WORDS.stream().anyMatch(text::contains)) {
            score *= 2.5;
        }
        if (PATH_SUFFIXES.stream().anyMatch(lowerKey::endsWith)) {
            score *= 2.0;
        }

        return score * (1.0 + recency(key, evolution));
    }

    /**
     * 1.0 for the key changed last, falling linearly to 0 for keys never changed.
     */
    private double recency(String key, ContextEvolution evolution) {
        if (evolution == null || evolution.getChanges() == null || evolution.getChanges().isEmpty()) {
            return 0.0;
        }
        List<ContextChange> changes = evolution.getChanges();
        for (int i = changes.size() - 1; i >= 0; i--) {
            if (key.equals(changes.get(i).getKey())) {
                return (double) (i + 1) / changes.size();
            }
        }
        return 0.0;
    }
}
