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

import me.golemcore.flow.domain.model.ChatHistory;
import me.golemcore.flow.domain.model.CompletedTool;
import me.golemcore.flow.domain.model.ContextEvolution;
import me.golemcore.flow.domain.model.ExecutionContext;
import me.golemcore.flow.domain.model.HistoryEntry;
import me.golemcore.flow.domain.model.Message;
import me.golemcore.flow.domain.model.RestoredExecution;
import me.golemcore.flow.domain.model.ResumeSnapshot;
import me.golemcore.flow.domain.model.SnapshotMessage;
import me.golemcore.flow.domain.model.WorkflowMetadata;
import me.golemcore.flow.infrastructure.config.FlowProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Translates between the live execution state and the persisted
 * {@link ResumeSnapshot}, applying the size limits of {@link ResumeLimits}.
 *
 * <p>
 * Encoding is deterministic: it reads no clock, and every collection it
 * produces is ordered. The live structures passed in are never modified.
 *
 * <p>
 * Decoding is conversation-exact but not step-exact: the restored history is
 * the retained message suffix with its tool-call metadata, while the execution
 * history is rebuilt from the completed tool records.
 */
@Component
public class ResumeStateCodec {

    private final ResumeLimits limits;
    private final VariableImportanceScorer scorer;
    private final InsightExtractor insightExtractor;

    @Autowired
    public ResumeStateCodec(FlowProperties properties, VariableImportanceScorer scorer,
            InsightExtractor insightExtractor) {
        this(ResumeLimits.from(properties.getResume().getLimits()), scorer, insightExtractor);
    }

    public ResumeStateCodec(ResumeLimits limits, VariableImportanceScorer scorer, InsightExtractor insightExtractor) {
        this.limits = limits;
        this.scorer = scorer;
        this.insightExtractor = insightExtractor;
    }

    // ==================== ENCODE ====================

    public ResumeSnapshot toSnapshot(ExecutionContext context, ChatHistory history, WorkflowMetadata metadata) {
        List<Message> allMessages = history != null ? history.messages() : List.of();
        int keepFrom = Math.max(0, allMessages.size() - limits.maxChatMessages());
        List<Message> dropped = allMessages.subList(0, keepFrom);
        List<Message> kept = allMessages.subList(keepFrom, allMessages.size());

        ContextEvolution liveEvolution = context.getContextEvolution() != null
                ? context.getContextEvolution()
                : new ContextEvolution();

        Map<String, Object> variables = pruneVariables(context.getVariables(), liveEvolution);

        List<String> insights = new ArrayList<>(nullSafe(liveEvolution.getKeyInsights()));
        for (String summary : insightExtractor.summarizeDropped(dropped)) {
            if (!insights.contains(summary)) {
                insights.add(summary);
            }
        }

        ContextEvolution evolution = ContextEvolution.builder()
                .currentContext(new LinkedHashMap<>(variables))
                .keyInsights(newest(insights, limits.maxKeyInsights()))
                .changes(newest(nullSafe(liveEvolution.getChanges()), limits.maxContextChanges()))
                .build();

        List<CompletedTool> completedTools = pruneCompletedTools(nullSafe(context.getCompletedTools()));

        WorkflowMetadata snapshotMetadata = metadata.toBuilder()
                .id(context.getWorkflowId() != null ? context.getWorkflowId() : metadata.getId())
                .currentPhase(ResumePhaseDetector.detectPhase(context.getVariables(), allMessages, completedTools))
                .currentStrategy(ResumePhaseDetector.detectStrategy(allMessages))
                .availableTools(new ArrayList<>(nullSafe(metadata.getAvailableTools())))
                .build();

        List<SnapshotMessage> chatHistory = new ArrayList<>(kept.size());
        for (Message message : kept) {
            chatHistory.add(toSnapshotMessage(message));
        }

        return ResumeSnapshot.builder()
                .workflowMetadata(snapshotMetadata)
                .completedTools(completedTools)
                .chatHistory(chatHistory)
                .contextEvolution(evolution)
                .workflowVariables(variables)
                .build();
    }

    List<CompletedTool> pruneCompletedTools(List<CompletedTool> tools) {
        int excess = tools.size() - limits.maxCompletedTools();
        if (excess <= 0) {
            return new ArrayList<>(tools);
        }

        Set<Integer> removed = new LinkedHashSet<>();
        for (int i = 0; i < tools.size() && removed.size() < excess; i++) {
            if (!tools.get(i).isSuccess()) {
                removed.add(i);
            }
        }
        for (int i = 0; i < tools.size() && removed.size() < excess; i++) {
            removed.add(i);
        }

        List<CompletedTool> result = new ArrayList<>(limits.maxCompletedTools());
        for (int i = 0; i < tools.size(); i++) {
            if (!removed.contains(i)) {
                result.add(tools.get(i));
            }
        }
        return result;
    }

    Map<String, Object> pruneVariables(Map<String, Object> variables, ContextEvolution evolution) {
        if (variables == null || variables.isEmpty()) {
            return new LinkedHashMap<>();
        }
        if (variables.size() <= limits.maxContextVariables()) {
            return new LinkedHashMap<>(variables);
        }

        List<String> keys = new ArrayList<>(variables.keySet());
        Map<String, Double> scores = new LinkedHashMap<>();
        for (String key : keys) {
            scores.put(key, scorer.score(key, variables.get(key), evolution));
        }
        List<String> ranked = new ArrayList<>(keys);
        // List.sort is stable, so equal scores keep insertion order
        ranked.sort(Comparator.comparingDouble((String key) -> scores.get(key)).reversed());
        Set<String> keep = new LinkedHashSet<>(ranked.subList(0, limits.maxContextVariables()));

        Map<String, Object> result = new LinkedHashMap<>();
        for (String key : keys) {
            if (keep.contains(key)) {
                result.put(key, variables.get(key));
            }
        }
        return result;
    }

    private SnapshotMessage toSnapshotMessage(Message message) {
        List<SnapshotMessage.FunctionCall> calls = null;
        if (message.hasToolCalls()) {
            calls = new ArrayList<>();
            for (Message.ToolCall call : message.getToolCalls()) {
                calls.add(SnapshotMessage.FunctionCall.builder()
                        .functionName(call.getName())
                        .parameters(call.getArguments() != null ? new LinkedHashMap<>(call.getArguments()) : null)
                        .callId(call.getId())
                        .build());
            }
        }
        return SnapshotMessage.builder()
                .id(message.getId())
                .role(message.getRole())
                .content(message.getContent())
                .timestamp(message.getTimestamp())
                .toolCallId(message.getToolCallId())
                .toolName(message.getToolName())
                .functionCalls(calls)
                .build();
    }

    // ==================== DECODE ====================

    public RestoredExecution fromSnapshot(ResumeSnapshot snapshot) {
        ChatHistory history = new ChatHistory();
        for (SnapshotMessage stored : nullSafe(snapshot.getChatHistory())) {
            history.append(toMessage(stored));
        }

        ContextEvolution storedEvolution = snapshot.getContextEvolution() != null
                ? snapshot.getContextEvolution()
                : new ContextEvolution();
        ContextEvolution evolution = ContextEvolution.builder()
                .currentContext(new LinkedHashMap<>(nullSafe(storedEvolution.getCurrentContext())))
                .keyInsights(new ArrayList<>(nullSafe(storedEvolution.getKeyInsights())))
                .changes(new ArrayList<>(nullSafe(storedEvolution.getChanges())))
                .build();

        List<CompletedTool> completedTools = new ArrayList<>(nullSafe(snapshot.getCompletedTools()));
        List<HistoryEntry> executionHistory = new ArrayList<>();
        for (CompletedTool tool : completedTools) {
            executionHistory.add(HistoryEntry.builder()
                    .stepName(tool.getFunctionName())
                    .stepType(HistoryEntry.TYPE_TOOL)
                    .startedAt(tool.getExecutedAt())
                    .completedAt(tool.getExecutedAt())
                    .success(tool.isSuccess())
                    .errorMessage(tool.isSuccess() ? null : tool.getResult())
                    .build());
        }

        WorkflowMetadata metadata = snapshot.getWorkflowMetadata();
        ExecutionContext context = ExecutionContext.builder()
                .workflowId(metadata.getId())
                .currentStep(evolution.getChanges().size())
                .variables(new LinkedHashMap<>(nullSafe(snapshot.getWorkflowVariables())))
                .executionHistory(executionHistory)
                .startTime(metadata.getStartedAt())
                .completedTools(completedTools)
                .contextEvolution(evolution)
                .build();

        return new RestoredExecution(context, history);
    }

    private Message toMessage(SnapshotMessage stored) {
        List<Message.ToolCall> toolCalls = null;
        if (stored.getFunctionCalls() != null && !stored.getFunctionCalls().isEmpty()) {
            toolCalls = new ArrayList<>();
            for (SnapshotMessage.FunctionCall call : stored.getFunctionCalls()) {
                toolCalls.add(Message.ToolCall.builder()
                        .id(call.getCallId())
                        .name(call.getFunctionName())
                        .arguments(call.getParameters() != null ? new LinkedHashMap<>(call.getParameters()) : null)
                        .build());
            }
        }
        return Message.builder()
                .id(stored.getId())
                .role(stored.getRole())
                .content(stored.getContent())
                .timestamp(stored.getTimestamp())
                .toolCallId(stored.getToolCallId())
                .toolName(stored.getToolName())
                .toolCalls(toolCalls)
                .build();
    }

    // ==================== HELPERS ====================

    private static <T> List<T> newest(List<T> items, int max) {
        if (items.size() <= max) {
            return new ArrayList<>(items);
        }
        return new ArrayList<>(items.subList(items.size() - max, items.size()));
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list != null ? list : List.of();
    }

    private static <K, V> Map<K, V> nullSafe(Map<K, V> map) {
        return map != null ? map : Map.of();
    }
}
