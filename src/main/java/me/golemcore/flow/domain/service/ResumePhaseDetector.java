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

import me.golemcore.flow.domain.model.CompletedTool;
import me.golemcore.flow.domain.model.Message;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Best-effort keyword heuristics for the phase and strategy stored with a
 * resume state. The result is advisory metadata for humans and for the resume
 * message; nothing decides whether or how to resume based on it.
 */
public final class ResumePhaseDetector {

    public static final String PHASE_VARIABLE = "current_phase";
    static final String DEFAULT_STRATEGY = "Comprehensive analysis and problem-solving approach";

    private static final int RECENT_MESSAGES = 5;
    private static final int RECENT_ASSISTANT_MESSAGES = 3;
    private static final int STRATEGY_WINDOW = 100;
    private static final List<String> STRATEGY_INDICATORS = List.of(
            "approach", "strategy", "plan", "method", "technique",
            "focus on", "concentrate on", "prioritize", "emphasize");

    private ResumePhaseDetector() {
    }

    public static String detectPhase(Map<String, Object> variables, List<Message> messages,
            List<CompletedTool> completedTools) {
        Object explicit = variables != null ? variables.get(PHASE_VARIABLE) : null;
        if (explicit != null && !explicit.toString().isBlank()) {
            return explicit.toString();
        }

        String fromMessages = inferFromMessages(messages);
        if (fromMessages != null) {
            return fromMessages;
        }

        long succeeded = completedTools == null ? 0
                : completedTools.stream().filter(CompletedTool::isSuccess).count();
        if (succeeded == 0) {
            return "understanding";
        }
        if (succeeded < 3) {
            return "investigating";
        }
        if (succeeded < 7) {
            return "analyzing";
        }
        return "finalizing";
    }

    public static String detectStrategy(List<Message> messages) {
        if (messages == null) {
            return DEFAULT_STRATEGY;
        }
        int seen = 0;
        for (int i = messages.size() - 1; i >= 0 && seen < RECENT_ASSISTANT_MESSAGES; i--) {
            Message message = messages.get(i);
            if (!message.isAssistantMessage() || message.getContent() == null || message.getContent().isBlank()) {
                continue;
            }
            seen++;
            String content = message.getContent();
            String lower = content.toLowerCase(Locale.ROOT);
            for (String indicator : STRATEGY_INDICATORS) {
                int index = lower.indexOf(indicator);
                if (index >= 0) {
                    int start = Math.max(0, index - STRATEGY_WINDOW / 2);
                    int end = Math.min(content.length(), start + STRATEGY_WINDOW);
                    return content.substring(start, end).trim();
                }
            }
        }
        return DEFAULT_STRATEGY;
    }

    private static String inferFromMessages(List<Message> messages) {
        if (messages == null || messages.isEmpty()) {
            return null;
        }
        StringBuilder text = new StringBuilder();
        for (Message message : messages.subList(Math.max(0, messages.size() - RECENT_MESSAGES), messages.size())) {
            if (message.getContent() != null) {
                text.append(message.getContent().toLowerCase(Locale.ROOT)).append(' ');
            }
        }
        String content = text.toString();
        if (content.isBlank()) {
            return null;
        }
        if (containsAny(content, "understand", "clarify")) {
            return "understanding";
        }
        if (containsAny(content, "investigate", "explore", "examine")) {
            return "investigating";
        }
        if (containsAny(content, "analyze", "analyse", "review")) {
            return "analyzing";
        }
        if (containsAny(content, "implement", "create", "build")) {
            return "implementing";
        }
        if (containsAny(content, "finalize", "complete", "conclude")) {
            return "finalizing";
        }
        return "working";
    }

    private static boolean containsAny(String text, String... words) {
        for (String word : words) {
            if (text.contains(word)) {
                return true;
            }
        }
        return false;
    }
}
