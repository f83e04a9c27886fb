package me.golemcore.flow.domain.system.execution;

import me.golemcore.flow.domain.component.ToolComponent;
import me.golemcore.flow.domain.model.Message;
import me.golemcore.flow.domain.model.ToolFailureKind;
import me.golemcore.flow.domain.model.ToolResult;
import me.golemcore.flow.domain.service.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Default ToolExecutorPort implementation backed by the {@link ToolRegistry}.
 * Converts tool exceptions into failed outcomes and truncates oversized
 * output before it reaches the conversation.
 */
public class RegistryToolExecutor implements ToolExecutorPort {

    private static final Logger log = LoggerFactory.getLogger(RegistryToolExecutor.class);

    private final ToolRegistry toolRegistry;
    private final int maxResultChars;

    public RegistryToolExecutor(ToolRegistry toolRegistry, int maxResultChars) {
        this.toolRegistry = toolRegistry;
        this.maxResultChars = maxResultChars;
    }

    @Override
    public CompletableFuture<ToolExecutionOutcome> execute(Message.ToolCall toolCall) {
        Optional<ToolComponent> tool = toolRegistry.find(toolCall.getName());
        if (tool.isEmpty()) {
            log.warn("[Tools] Unknown tool requested: {}", toolCall.getName());
            return CompletableFuture.completedFuture(ToolExecutionOutcome.synthetic(toolCall,
                    ToolFailureKind.EXECUTION_FAILED, "Error: Unknown tool '" + toolCall.getName() + "'"));
        }

        Map<String, Object> arguments = toolCall.getArguments() != null ? toolCall.getArguments() : Map.of();
        CompletableFuture<ToolResult> running;
        try {
            log.debug("[Tools] Executing {} with {}", toolCall.getName(), arguments.keySet());
            running = tool.get().execute(arguments);
        } catch (RuntimeException e) {
            log.warn("[Tools] {} threw before starting: {}", toolCall.getName(), safeCauseMessage(e));
            return CompletableFuture.completedFuture(failed(toolCall, "Tool execution failed: " + safeCauseMessage(e)));
        }
        if (running == null) {
            return CompletableFuture.completedFuture(failed(toolCall, "Tool execution failed: no result"));
        }

        CompletableFuture<ToolExecutionOutcome> outcome = running.handle((result, error) -> {
            if (error != null) {
                log.warn("[Tools] {} failed: {}", toolCall.getName(), safeCauseMessage(error));
                return failed(toolCall, "Tool execution failed: " + safeCauseMessage(error));
            }
            return toOutcome(toolCall, result);
        });
        outcome.whenComplete((ignored, error) -> {
            if (error instanceof CancellationException || outcome.isCancelled()) {
                running.cancel(true);
            }
        });
        return outcome;
    }

    private ToolExecutionOutcome toOutcome(Message.ToolCall toolCall, ToolResult result) {
        if (result == null) {
            return failed(toolCall, "Tool execution failed: no result");
        }
        String content;
        if (result.isSuccess()) {
            content = result.getOutput() != null ? result.getOutput() : "";
        } else {
            content = "Error: " + (result.getError() != null ? result.getError() : "unknown");
        }
        return new ToolExecutionOutcome(toolCall.getId(), toolCall.getName(), result,
                truncateToolResult(content, toolCall.getName()), false);
    }

    private ToolExecutionOutcome failed(Message.ToolCall toolCall, String error) {
        return new ToolExecutionOutcome(toolCall.getId(), toolCall.getName(),
                ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, error), error, false);
    }

    /**
     * Truncate tool result content that exceeds the configured max length.
     */
    String truncateToolResult(String content, String toolName) {
        if (content == null) {
            return null;
        }
        if (maxResultChars <= 0 || content.length() <= maxResultChars) {
            return content;
        }

        String suffix = "\n\n[OUTPUT TRUNCATED: " + content.length() + " chars total, showing first "
                + maxResultChars + " chars. Try a more specific request or process the data in smaller chunks.]";
        int cutPoint = Math.max(0, maxResultChars - suffix.length());
        log.warn("[Tools] Truncating '{}' result: {} chars -> ~{} chars",
                toolName, content.length(), cutPoint + suffix.length());
        return content.substring(0, cutPoint) + suffix;
    }

    static String safeCauseMessage(Throwable error) {
        if (error == null) {
            return "unknown";
        }

        Throwable cursor = error;
        if (cursor instanceof CompletionException && cursor.getCause() != null) {
            cursor = cursor.getCause();
        }
        Throwable cause = cursor.getCause();
        while (cause != null) {
            if (cause.equals(cursor)) {
                break;
            }
            cursor = cause;
            cause = cursor.getCause();
        }

        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }
}
