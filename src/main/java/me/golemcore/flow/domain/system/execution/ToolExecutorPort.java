package me.golemcore.flow.domain.system.execution;

import me.golemcore.flow.domain.model.Message;

import java.util.concurrent.CompletableFuture;

/**
 * Hexagonal outbound port for executing a single tool call.
 *
 * <p>
 * The returned future never completes exceptionally because of the tool:
 * failures are folded into a failed {@link ToolExecutionOutcome}. Cancelling
 * the future asks the tool to stop.
 */
public interface ToolExecutorPort {

    CompletableFuture<ToolExecutionOutcome> execute(Message.ToolCall toolCall);
}
