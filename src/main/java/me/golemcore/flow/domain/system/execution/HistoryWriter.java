package me.golemcore.flow.domain.system.execution;

import me.golemcore.flow.domain.model.ChatHistory;
import me.golemcore.flow.domain.model.LlmResponse;
import me.golemcore.flow.domain.model.Message;

/**
 * Single point of mutation for the raw chat history during a run.
 *
 * <p>
 * The orchestrator should not build messages directly.
 */
public interface HistoryWriter {

    Message appendUserMessage(ChatHistory history, String content);

    Message appendSystemMessage(ChatHistory history, String content);

    Message appendAssistantToolCalls(ChatHistory history, LlmResponse llmResponse);

    Message appendToolResult(ChatHistory history, ToolExecutionOutcome outcome);

    Message appendFinalAssistantAnswer(ChatHistory history, LlmResponse llmResponse);
}
