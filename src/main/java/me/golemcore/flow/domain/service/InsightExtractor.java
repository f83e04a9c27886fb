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

import me.golemcore.flow.domain.model.Message;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Distills key insights from assistant messages: sentences of moderate length
 * that report a discovery or flag something important. Also produces the
 * digest line that stands in for messages dropped by snapshot pruning.
 */
@Component
public class InsightExtractor {

    private static final int MIN_SENTENCE_LENGTH = 20;
    private static final int MAX_SENTENCE_LENGTH = 200;
    private static final List<String> INSIGHT_MARKERS = List.of(
            "discovered", "found", "identified", "detected", "noticed",
            "important", "significant", "critical", "key", "main");

    public List<String> extract(String text) {
        List<String> insights = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return insights;
        }
        for (String sentence : text.split("[.!?\\n]")) {
            String trimmed = sentence.trim();
            if (trimmed.length() < MIN_SENTENCE_LENGTH || trimmed.length() > MAX_SENTENCE_LENGTH) {
                continue;
            }
            String lower = trimmed.toLowerCase(Locale.ROOT);
            if (INSIGHT_MARKERS.stream().anyMatch(lower::contains) && !insights.contains(trimmed)) {
                insights.add(trimmed);
            }
        }
        return insights;
    }

    /**
     * Summarizes messages that are about to be dropped: insight sentences from
     * their assistant text followed by one digest line naming the tools they
     * called.
     */
    public List<String> summarizeDropped(List<Message> dropped) {
        List<String> summary = new ArrayList<>();
        if (dropped == null || dropped.isEmpty()) {
            return summary;
        }

        Set<String> toolNames = new LinkedHashSet<>();
        for (Message message : dropped) {
            if (message.isAssistantMessage()) {
                for (String insight : extract(message.getContent())) {
                    if (!summary.contains(insight)) {
                        summary.add(insight);
                    }
                }
                if (message.hasToolCalls()) {
                    message.getToolCalls().forEach(call -> toolNames.add(call.getName()));
                }
            }
        }

        StringBuilder digest = new StringBuilder("Earlier conversation (")
                .append(dropped.size()).append(" messages)");
        if (toolNames.isEmpty()) {
            digest.append(" made no tool calls");
        } else {
            digest.append(" called tools: ").append(String.join(", ", toolNames));
        }
        summary.add(digest.toString());
        return summary;
    }
}
