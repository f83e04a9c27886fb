package me.golemcore.flow.domain.system.execution;

import me.golemcore.flow.domain.model.CancellationToken;
import me.golemcore.flow.domain.model.ChatHistory;
import me.golemcore.flow.domain.model.ExecutionContext;
import me.golemcore.flow.domain.model.ExecutionState;
import me.golemcore.flow.domain.model.WorkflowDefinition;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.List;

/**
 * Mutable state of one execution, owned by the orchestrator for the duration
 * of a single {@code execute} or {@code resume} call.
 */
@Getter
@Setter
public class ExecutionRun {

    private final WorkflowDefinition workflow;
    private final ExecutionContext context;
    private final ChatHistory history;
    private final CancellationToken token;
    /** Declared tools that resolved in the registry; the allow-list of this run. */
    private final List<String> allowedTools;
    /** When the workflow was first started, across resumes. */
    private final Instant startedAt;
    /** When this session (fresh run or resume) started. */
    private final Instant sessionStartedAt;
    private final Instant deadline;

    private ExecutionState state = ExecutionState.CREATED;
    private int iterations;
    private int toolCallsSinceCheckpoint;
    private Instant lastCheckpoint;
    private long totalTokens;

    public ExecutionRun(WorkflowDefinition workflow, ExecutionContext context, ChatHistory history,
            CancellationToken token, List<String> allowedTools, Instant startedAt, Instant sessionStartedAt,
            Instant deadline) {
        this.workflow = workflow;
        this.context = context;
        this.history = history;
        this.token = token != null ? token : CancellationToken.none();
        this.allowedTools = List.copyOf(allowedTools);
        this.startedAt = startedAt;
        this.sessionStartedAt = sessionStartedAt;
        this.deadline = deadline;
    }

    public String getWorkflowId() {
        return context.getWorkflowId();
    }

    public boolean isCheckpointed() {
        return lastCheckpoint != null;
    }

    public void addTokens(long tokens) {
        totalTokens += tokens;
    }
}
