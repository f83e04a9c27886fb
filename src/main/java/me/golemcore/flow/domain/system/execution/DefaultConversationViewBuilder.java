package me.golemcore.flow.domain.system.execution;

import me.golemcore.flow.domain.model.ChatHistory;
import me.golemcore.flow.domain.model.Message;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keeps well-formed tool exchanges native and flattens the rest into plain
 * assistant text.
 *
 * <p>
 * A restored history starts at an arbitrary message, so it may hold tool
 * results whose calling assistant message was pruned, or (after a crash
 * mid-batch) an assistant message whose calls have no results. Providers reject
 * both shapes.
 */
public class DefaultConversationViewBuilder implements ConversationViewBuilder {

    private static final int MAX_ARGS_LENGTH = 200;
    private static final int MAX_RESULT_LENGTH = 2000;

    @Override
    public ConversationView buildView(ChatHistory history) {
        List<Message> messages = history != null ? history.messages() : List.of();
        if (messages.stream().noneMatch(m -> m.hasToolCalls() || m.isToolMessage())) {
            return ConversationView.ofMessages(messages);
        }

        Map<String, Message> toolResultsByCallId = new LinkedHashMap<>();
        for (Message msg : messages) {
            if (msg.isToolMessage() && msg.getToolCallId() != null) {
                toolResultsByCallId.put(msg.getToolCallId(), msg);
            }
        }

        List<Message> result = new ArrayList<>();
        List<String> diagnostics = new ArrayList<>();
        Set<String> answeredCallIds = new HashSet<>();
        Set<String> flattenedCallIds = new HashSet<>();

        for (Message msg : messages) {
            if (msg.isAssistantMessage() && msg.hasToolCalls()) {
                if (allAnswered(msg, toolResultsByCallId)) {
                    msg.getToolCalls().forEach(tc -> answeredCallIds.add(tc.getId()));
                    result.add(msg);
                } else {
                    diagnostics.add("flatten: assistant tool_calls with missing results -> assistant text");
                    msg.getToolCalls().forEach(tc -> {
                        if (tc.getId() != null) {
                            flattenedCallIds.add(tc.getId());
                        }
                    });
                    result.add(flattenToolCalls(msg, toolResultsByCallId));
                }
            } else if (msg.isToolMessage()) {
                if (flattenedCallIds.contains(msg.getToolCallId())) {
                    continue; // already folded into the flattened assistant message
                }
                if (answeredCallIds.contains(msg.getToolCallId())) {
                    result.add(msg);
                } else {
                    diagnostics.add("flatten: orphaned tool result -> assistant text");
                    result.add(Message.builder()
                            .id(msg.getId())
                            .role(Message.ROLE_ASSISTANT)
                            .content(formatOrphanedToolResult(msg))
                            .timestamp(msg.getTimestamp())
                            .build());
                }
            } else {
                result.add(msg);
            }
        }

        return new ConversationView(result, diagnostics);
    }

    private boolean allAnswered(Message msg, Map<String, Message> toolResultsByCallId) {
        return msg.getToolCalls().stream()
                .allMatch(tc -> tc.getId() != null && toolResultsByCallId.containsKey(tc.getId()));
    }

    private Message flattenToolCalls(Message msg, Map<String, Message> toolResultsByCallId) {
        StringBuilder sb = new StringBuilder();
        if (msg.getContent() != null && !msg.getContent().isBlank()) {
            sb.append(msg.getContent()).append("\n");
        }
        for (Message.ToolCall tc : msg.getToolCalls()) {
            sb.append("\n[Tool: ").append(tc.getName());
            sb.append(" | Args: ").append(truncate(formatArgs(tc.getArguments()), MAX_ARGS_LENGTH));
            sb.append("]\n");

            Message toolResult = tc.getId() != null ? toolResultsByCallId.get(tc.getId()) : null;
            if (toolResult == null) {
                sb.append("[Result: <no response>]\n");
            } else if (toolResult.getContent() == null || toolResult.getContent().isEmpty()) {
                sb.append("[Result: <empty>]\n");
            } else {
                sb.append("[Result: ").append(truncate(toolResult.getContent(), MAX_RESULT_LENGTH)).append("]\n");
            }
        }

        return Message.builder()
                .id(msg.getId())
                .role(Message.ROLE_ASSISTANT)
                .content(sb.toString().stripTrailing())
                .timestamp(msg.getTimestamp())
                .build();
    }

    private static String formatOrphanedToolResult(Message toolMsg) {
        String toolName = toolMsg.getToolName() != null ? toolMsg.getToolName() : "unknown";
        String content = toolMsg.getContent();
        if (content == null || content.isEmpty()) {
            content = "<empty>";
        } else {
            content = truncate(content, MAX_RESULT_LENGTH);
        }
        return "[Tool: " + toolName + "]\n[Result: " + content + "]";
    }

    private static String formatArgs(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : args.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("\"").append(entry.getKey()).append("\": ");
            Object val = entry.getValue();
            if (val instanceof String) {
                sb.append("\"").append(val).append("\"");
            } else {
                sb.append(val);
            }
            first = false;
        }
        sb.append("}");
        return sb.toString();
    }

    private static String truncate(String text, int maxLen) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLen) {
            return text;
        }
        return text.substring(0, maxLen) + "...";
    }
}
