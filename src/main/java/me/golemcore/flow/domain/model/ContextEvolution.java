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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only trail of how the workflow variables evolved, plus the key
 * insights distilled from the conversation so far.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContextEvolution {

    @JsonProperty("current_context")
    @Builder.Default
    private Map<String, Object> currentContext = new LinkedHashMap<>();

    @JsonProperty("key_insights")
    @Builder.Default
    private List<String> keyInsights = new ArrayList<>();

    @JsonProperty("changes")
    @Builder.Default
    private List<ContextChange> changes = new ArrayList<>();

    /**
     * Adds an insight unless an identical one is already recorded.
     *
     * @return true if the insight was added
     */
    public boolean addInsight(String insight) {
        if (insight == null || insight.isBlank()) {
            return false;
        }
        if (keyInsights == null) {
            keyInsights = new ArrayList<>();
        }
        if (keyInsights.contains(insight)) {
            return false;
        }
        keyInsights.add(insight);
        return true;
    }

    public void addChange(ContextChange change) {
        if (changes == null) {
            changes = new ArrayList<>();
        }
        changes.add(change);
    }
}
