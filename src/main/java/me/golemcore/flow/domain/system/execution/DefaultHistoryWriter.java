package me.golemcore.flow.domain.system.execution;

import me.golemcore.flow.domain.model.ChatHistory;
import me.golemcore.flow.domain.model.LlmResponse;
import me.golemcore.flow.domain.model.Message;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.UUID;

/**
 * Default implementation: random message ids, timestamps from the injected
 * clock.
 */
public class DefaultHistoryWriter implements HistoryWriter {

    private final Clock clock;

    public DefaultHistoryWriter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Message appendUserMessage(ChatHistory history, String content) {
        return append(history, Message.builder()
                .role(Message.ROLE_USER)
                .content(content));
    }

    @Override
    public Message appendSystemMessage(ChatHistory history, String content) {
        return append(history, Message.builder()
                .role(Message.ROLE_SYSTEM)
                .content(content));
    }

    @Override
    public Message appendAssistantToolCalls(ChatHistory history, LlmResponse llmResponse) {
        return append(history, Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .content(llmResponse.getContent())
                .toolCalls(new ArrayList<>(llmResponse.getToolCalls())));
    }

    @Override
    public Message appendToolResult(ChatHistory history, ToolExecutionOutcome outcome) {
        return append(history, Message.builder()
                .role(Message.ROLE_TOOL)
                .toolCallId(outcome.toolCallId())
                .toolName(outcome.toolName())
                .content(outcome.messageContent()));
    }

    @Override
    public Message appendFinalAssistantAnswer(ChatHistory history, LlmResponse llmResponse) {
        return append(history, Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .content(llmResponse.getContent() != null ? llmResponse.getContent() : ""));
    }

    private Message append(ChatHistory history, Message.MessageBuilder builder) {
        Message message = builder
                .id(UUID.randomUUID().toString())
                .timestamp(now())
                .build();
        history.append(message);
        return message;
    }

    private Instant now() {
        return clock != null ? clock.instant() : Instant.now();
    }
}
