package me.golemcore.flow.tools;

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

import me.golemcore.flow.domain.component.ToolComponent;
import me.golemcore.flow.domain.exception.WorkflowFileException;
import me.golemcore.flow.domain.model.CancellationToken;
import me.golemcore.flow.domain.model.ExecutionResult;
import me.golemcore.flow.domain.model.ToolDefinition;
import me.golemcore.flow.domain.model.ToolFailureKind;
import me.golemcore.flow.domain.model.ToolResult;
import me.golemcore.flow.domain.model.WorkflowDefinition;
import me.golemcore.flow.domain.service.WorkflowLoader;
import me.golemcore.flow.domain.system.execution.WorkflowOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs another {@code *.prompt.md} workflow from the workspace as a child
 * execution under its own workflow id and returns its final answer. The child
 * checkpoints like any other run and can be resumed on its own.
 *
 * <p>
 * Nesting is bounded: a child may start further children only up to
 * {@link #MAX_ACTIVE_CHILDREN} concurrent sub-workflows in this process.
 * Cancelling the tool call cancels the child.
 */
@Component
@Slf4j
public class SubWorkflowTool implements ToolComponent {

    static final String NAME = "sub-workflow";
    static final int MAX_ACTIVE_CHILDREN = 3;
    private static final String PARAM_PATH = "path";
    private static final String PARAM_VARIABLES = "variables";

    private final WorkspacePathResolver workspace;
    private final WorkflowLoader workflowLoader;
    private final ObjectProvider<WorkflowOrchestrator> orchestrator;
    private final AtomicInteger activeChildren = new AtomicInteger();

    public SubWorkflowTool(WorkspacePathResolver workspace, WorkflowLoader workflowLoader,
            ObjectProvider<WorkflowOrchestrator> orchestrator) {
        this.workspace = workspace;
        this.workflowLoader = workflowLoader;
        this.orchestrator = orchestrator;
    }

    @Override
    public boolean isEnabled() {
        return workspace.isEnabled();
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Run another workflow file (*.prompt.md) from the workspace and return its final "
                        + "answer. The child uses the tools declared in its own file.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_PATH, Map.of(
                                        "type", "string",
                                        "description", "Workflow file path (relative to workspace)"),
                                PARAM_VARIABLES, Map.of(
                                        "type", "object",
                                        "description", "Input variables for the child workflow")),
                        "required", List.of(PARAM_PATH)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        CancellationToken childToken = CancellationToken.none();
        CompletableFuture<ToolResult> future = CompletableFuture.supplyAsync(() -> runChild(parameters, childToken));
        future.whenComplete((result, error) -> {
            if (future.isCancelled()) {
                childToken.cancel();
            }
        });
        return future;
    }

    private ToolResult runChild(Map<String, Object> parameters, CancellationToken childToken) {
        Object pathParam = parameters.get(PARAM_PATH);
        if (!(pathParam instanceof String pathStr) || pathStr.isBlank()) {
            return ToolResult.failure("Missing required parameter: path");
        }
        Optional<Path> resolved = workspace.resolve(pathStr);
        if (resolved.isEmpty()) {
            return ToolResult.failure(ToolFailureKind.POLICY_DENIED, "Invalid path: must be within workspace");
        }
        Map<String, Object> variables = variables(parameters.get(PARAM_VARIABLES));

        WorkflowDefinition child;
        try {
            child = workflowLoader.load(resolved.get());
        } catch (WorkflowFileException e) {
            return ToolResult.failure("Cannot load sub-workflow " + pathStr + ": " + e.getMessage());
        }

        if (activeChildren.incrementAndGet() > MAX_ACTIVE_CHILDREN) {
            activeChildren.decrementAndGet();
            return ToolResult.failure(ToolFailureKind.POLICY_DENIED,
                    "Too many nested sub-workflows (max " + MAX_ACTIVE_CHILDREN + ")");
        }
        try {
            WorkflowOrchestrator runner = orchestrator.getObject();
            String childId = runner.generateWorkflowId(child);
            log.info("[Tools] {} starting '{}' as {}", NAME, child.getName(), childId);
            ExecutionResult result = runner.execute(child, variables, childId, childToken);
            if (!result.isSuccess()) {
                log.warn("[Tools] {} {} failed: {}", NAME, childId, result.getErrorMessage());
                return ToolResult.failure("Sub-workflow " + childId + " failed: " + result.getErrorMessage());
            }
            return ToolResult.success(result.getFinalOutput() != null ? result.getFinalOutput() : "", Map.of(
                    "workflow_id", childId,
                    "iterations", result.getIterations()));
        } finally {
            activeChildren.decrementAndGet();
        }
    }

    private static Map<String, Object> variables(Object raw) {
        Map<String, Object> variables = new LinkedHashMap<>();
        if (raw instanceof Map<?, ?> map) {
            map.forEach((key, value) -> {
                if (key != null) {
                    variables.put(key.toString(), value);
                }
            });
        }
        return variables;
    }
}
