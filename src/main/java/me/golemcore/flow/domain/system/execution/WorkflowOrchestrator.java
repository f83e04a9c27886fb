package me.golemcore.flow.domain.system.execution;

import me.golemcore.flow.domain.model.CancellationToken;
import me.golemcore.flow.domain.model.ExecutionResult;
import me.golemcore.flow.domain.model.ValidationResult;
import me.golemcore.flow.domain.model.WorkflowDefinition;

import java.util.Map;

/**
 * Drives a workflow through the tool-calling loop with durable checkpoints.
 *
 * <p>
 * Orchestrator-level failures are reported through the returned
 * {@link ExecutionResult}, never thrown.
 */
public interface WorkflowOrchestrator {

    /**
     * Starts a fresh execution.
     *
     * @param workflowId
     *            id to run under, or {@code null} to generate one
     */
    ExecutionResult execute(WorkflowDefinition workflow, Map<String, Object> initialVariables, String workflowId,
            CancellationToken token);

    default ExecutionResult execute(WorkflowDefinition workflow, Map<String, Object> initialVariables,
            CancellationToken token) {
        return execute(workflow, initialVariables, null, token);
    }

    /**
     * Continues the execution stored under {@code workflowId} against the current
     * workflow text.
     *
     * @param force
     *            resume even when the compatibility score is below the threshold
     */
    ExecutionResult resume(String workflowId, WorkflowDefinition current, boolean force, CancellationToken token);

    /**
     * Checks a workflow without calling the model.
     */
    ValidationResult validate(WorkflowDefinition workflow);

    String generateWorkflowId(WorkflowDefinition workflow);
}
