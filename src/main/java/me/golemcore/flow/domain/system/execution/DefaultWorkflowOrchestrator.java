package me.golemcore.flow.domain.system.execution;

import me.golemcore.flow.domain.exception.ResumeStateStorageException;
import me.golemcore.flow.domain.exception.SnapshotCorruptException;
import me.golemcore.flow.domain.exception.TemplateRenderException;
import me.golemcore.flow.domain.exception.WorkflowExecutionException;
import me.golemcore.flow.domain.model.CancellationToken;
import me.golemcore.flow.domain.model.ChatHistory;
import me.golemcore.flow.domain.model.CompatibilityResult;
import me.golemcore.flow.domain.model.CompletedTool;
import me.golemcore.flow.domain.model.ContextChange;
import me.golemcore.flow.domain.model.ExecutionContext;
import me.golemcore.flow.domain.model.ExecutionErrorKind;
import me.golemcore.flow.domain.model.ExecutionResult;
import me.golemcore.flow.domain.model.ExecutionState;
import me.golemcore.flow.domain.model.HistoryEntry;
import me.golemcore.flow.domain.model.LlmRequest;
import me.golemcore.flow.domain.model.LlmResponse;
import me.golemcore.flow.domain.model.Message;
import me.golemcore.flow.domain.model.ModelErrorKind;
import me.golemcore.flow.domain.model.RestoredExecution;
import me.golemcore.flow.domain.model.ResumeSnapshot;
import me.golemcore.flow.domain.model.ToolFailureKind;
import me.golemcore.flow.domain.model.ToolResult;
import me.golemcore.flow.domain.model.ValidationResult;
import me.golemcore.flow.domain.model.WorkflowDefinition;
import me.golemcore.flow.domain.service.ContentHasher;
import me.golemcore.flow.domain.service.InsightExtractor;
import me.golemcore.flow.domain.service.ResumeCompatibilityValidator;
import me.golemcore.flow.domain.service.ResumeStateCodec;
import me.golemcore.flow.domain.service.ToolRegistry;
import me.golemcore.flow.domain.service.WorkflowIds;
import me.golemcore.flow.domain.service.WorkflowTemplateEngine;
import me.golemcore.flow.domain.service.WorkflowVariableResolver;
import me.golemcore.flow.domain.system.LlmErrorClassifier;
import me.golemcore.flow.infrastructure.config.FlowProperties;
import me.golemcore.flow.port.outbound.LlmPort;
import me.golemcore.flow.port.outbound.ResumeStatePort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Workflow orchestrator: renders the task, then alternates model calls and
 * tool executions until the model answers without tool calls.
 *
 * <p>
 * Every suspension point (model call, tool call) is awaited in slices of the
 * poll interval so the overall deadline and the cancellation token are honored.
 * Tool failures are folded into the conversation; only orchestrator-level
 * errors end the run, after a final checkpoint with status {@code failed} or
 * {@code cancelled}.
 */
public class DefaultWorkflowOrchestrator implements WorkflowOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DefaultWorkflowOrchestrator.class);

    private static final DateTimeFormatter ID_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss")
            .withZone(ZoneOffset.UTC);
    private static final Pattern UNSAFE_ID_CHARS = Pattern.compile("[^A-Za-z0-9._-]+");
    private static final Pattern TOOL_NAME_TOKEN = Pattern.compile("[A-Za-z0-9_-]+");

    private final LlmPort llmPort;
    private final ToolExecutorPort toolExecutor;
    private final HistoryWriter historyWriter;
    private final ConversationViewBuilder viewBuilder;
    private final ToolRegistry toolRegistry;
    private final WorkflowTemplateEngine templateEngine;
    private final WorkflowVariableResolver variableResolver;
    private final CheckpointService checkpointService;
    private final ResumeContextBuilder resumeContextBuilder;
    private final ResumeStatePort resumeStatePort;
    private final ResumeStateCodec codec;
    private final ResumeCompatibilityValidator compatibilityValidator;
    private final InsightExtractor insightExtractor;
    private final FlowProperties properties;
    private final Clock clock;

    public DefaultWorkflowOrchestrator(LlmPort llmPort, ToolExecutorPort toolExecutor, HistoryWriter historyWriter,
            ConversationViewBuilder viewBuilder, ToolRegistry toolRegistry, WorkflowTemplateEngine templateEngine,
            WorkflowVariableResolver variableResolver, CheckpointService checkpointService,
            ResumeContextBuilder resumeContextBuilder, ResumeStatePort resumeStatePort, ResumeStateCodec codec,
            ResumeCompatibilityValidator compatibilityValidator, InsightExtractor insightExtractor,
            FlowProperties properties, Clock clock) {
        this.llmPort = llmPort;
        this.toolExecutor = toolExecutor;
        this.historyWriter = historyWriter;
        this.viewBuilder = viewBuilder;
        this.toolRegistry = toolRegistry;
        this.templateEngine = templateEngine;
        this.variableResolver = variableResolver;
        this.checkpointService = checkpointService;
        this.resumeContextBuilder = resumeContextBuilder;
        this.resumeStatePort = resumeStatePort;
        this.codec = codec;
        this.compatibilityValidator = compatibilityValidator;
        this.insightExtractor = insightExtractor;
        this.properties = properties;
        this.clock = clock;
    }

    // ==================== EXECUTE ====================

    @Override
    public ExecutionResult execute(WorkflowDefinition workflow, Map<String, Object> initialVariables,
            String workflowId, CancellationToken token) {
        Instant start = clock.instant();
        String id = workflowId != null && !workflowId.isBlank() ? workflowId : generateWorkflowId(workflow);
        if (!WorkflowIds.isValid(id)) {
            return rejected(id, start, ExecutionErrorKind.INVALID_WORKFLOW_ID, "Invalid workflow id: " + id, null);
        }

        ExecutionContext context = ExecutionContext.builder()
                .workflowId(id)
                .startTime(start)
                .variables(variableResolver.resolve(workflow, initialVariables))
                .build();
        ExecutionRun run = new ExecutionRun(workflow, context, new ChatHistory(), token,
                allowedTools(workflow), start, start, start.plus(properties.getExecution().getTimeout()));

        log.info("[Flow] Starting workflow '{}' as {} (tools: {})", workflow.getName(), id, run.getAllowedTools());
        try {
            run.setState(ExecutionState.RENDERING);
            String prompt = render(workflow, context);
            historyWriter.appendUserMessage(run.getHistory(), prompt);
            context.addHistoryEntry(HistoryEntry.builder()
                    .stepName("render")
                    .stepType(HistoryEntry.TYPE_MODEL)
                    .startedAt(start)
                    .completedAt(clock.instant())
                    .success(true)
                    .build());

            run.setState(ExecutionState.AWAITING_MODEL);
            checkpoint(run, ExecutionState.AWAITING_MODEL);
            return runLoop(run);
        } catch (WorkflowExecutionException e) {
            return fail(run, e, null);
        }
    }

    private String render(WorkflowDefinition workflow, ExecutionContext context) {
        List<String> missing = variableResolver.findMissingRequired(workflow, context.getVariables());
        if (!missing.isEmpty()) {
            throw new WorkflowExecutionException(ExecutionErrorKind.TEMPLATE_ERROR,
                    "Missing required input(s) for " + workflow.getName() + ": " + String.join(", ", missing));
        }
        try {
            return templateEngine.render(workflow.getTemplate(), context.getVariables());
        } catch (TemplateRenderException e) {
            throw new WorkflowExecutionException(ExecutionErrorKind.TEMPLATE_ERROR,
                    "Template error in " + workflow.getName() + ": " + e.getMessage(), e);
        }
    }

    // ==================== RESUME ====================

    @Override
    public ExecutionResult resume(String workflowId, WorkflowDefinition current, boolean force,
            CancellationToken token) {
        Instant start = clock.instant();
        if (!WorkflowIds.isValid(workflowId)) {
            return rejected(workflowId, start, ExecutionErrorKind.INVALID_WORKFLOW_ID,
                    "Invalid workflow id: " + workflowId, null);
        }

        ResumeSnapshot snapshot;
        try {
            Optional<ResumeSnapshot> loaded = resumeStatePort.load(workflowId);
            if (loaded.isEmpty()) {
                return rejected(workflowId, start, ExecutionErrorKind.SNAPSHOT_NOT_FOUND,
                        "No resume state found for workflow " + workflowId, null);
            }
            snapshot = loaded.get();
        } catch (SnapshotCorruptException e) {
            log.error("[Resume] Stored state for {} is corrupt: {}", workflowId, e.getMessage());
            return rejected(workflowId, start, ExecutionErrorKind.SNAPSHOT_CORRUPT,
                    "Resume state for " + workflowId + " is corrupt: " + e.getMessage(), null);
        } catch (ResumeStateStorageException e) {
            return rejected(workflowId, start, ExecutionErrorKind.STORAGE_ERROR,
                    "Resume state for " + workflowId + " could not be read: " + e.getMessage(), null);
        }

        CompatibilityResult compatibility = compatibilityValidator.validate(snapshot, current.getSource(),
                toolRegistry.getToolNames());
        compatibility.getWarnings().forEach(warning -> log.warn("[Resume] {}", warning));
        compatibility.getMigrationStrategies()
                .forEach((name, description) -> log.info("[Resume] Migration strategy {}: {}", name, description));

        if (!compatibility.isCanResume()) {
            if (!force) {
                return rejected(workflowId, start, ExecutionErrorKind.RESUME_INCOMPATIBLE,
                        String.format(Locale.ROOT,
                                "Workflow changed too much to resume %s (compatibility %.2f); use --force to resume anyway",
                                workflowId, compatibility.getScore()),
                        compatibility);
            }
            log.warn("[Resume] Forcing resume of {} despite compatibility {}", workflowId,
                    String.format(Locale.ROOT, "%.2f", compatibility.getScore()));
        }
        if (ExecutionState.COMPLETED.statusName().equals(snapshot.getWorkflowMetadata().getStatus())) {
            log.warn("[Resume] Workflow {} already completed; continuing the conversation", workflowId);
        }

        RestoredExecution restored = codec.fromSnapshot(snapshot);
        ChatHistory history = restored.history();
        Optional<ChatHistory> workingCopy = checkpointService.workingCopy(workflowId);
        if (workingCopy.isPresent() && workingCopy.get().size() >= history.size()) {
            log.debug("[Resume] Using in-process working copy of {} ({} messages)", workflowId,
                    workingCopy.get().size());
            history = workingCopy.get();
        }
        Instant startedAt = snapshot.getWorkflowMetadata().getStartedAt() != null
                ? snapshot.getWorkflowMetadata().getStartedAt()
                : start;
        ExecutionRun run = new ExecutionRun(current, restored.context(), history, token,
                allowedTools(current), startedAt, start, start.plus(properties.getExecution().getTimeout()));

        log.info("[Resume] Resuming {} ({} messages, {} completed tools restored)", workflowId,
                run.getHistory().size(), run.getContext().getCompletedTools().size());
        try {
            historyWriter.appendSystemMessage(run.getHistory(),
                    resumeContextBuilder.build(snapshot, run.getContext()));
            run.setState(ExecutionState.AWAITING_MODEL);
            checkpoint(run, ExecutionState.AWAITING_MODEL);
            ExecutionResult result = runLoop(run);
            result.setCompatibility(compatibility);
            return result;
        } catch (WorkflowExecutionException e) {
            return fail(run, e, compatibility);
        }
    }

    // ==================== LOOP ====================

    private ExecutionResult runLoop(ExecutionRun run) {
        int maxIterations = properties.getExecution().getMaxIterations();
        while (true) {
            ensureNotStopped(run);
            if (run.getIterations() >= maxIterations) {
                throw new WorkflowExecutionException(ExecutionErrorKind.MAX_ITERATIONS_EXCEEDED,
                        "Reached max iterations (" + maxIterations + ") without a final answer");
            }

            run.setState(ExecutionState.AWAITING_MODEL);
            Instant callStart = clock.instant();
            LlmResponse response = callModel(run);
            run.setIterations(run.getIterations() + 1);
            run.getContext().addHistoryEntry(HistoryEntry.builder()
                    .stepName("llm")
                    .stepType(HistoryEntry.TYPE_MODEL)
                    .startedAt(callStart)
                    .completedAt(clock.instant())
                    .success(true)
                    .build());
            if (response.getUsage() != null) {
                run.addTokens(response.getUsage().getTotalTokens());
            }
            recordInsights(run, response.getContent());

            if (!response.hasToolCalls()) {
                historyWriter.appendFinalAssistantAnswer(run.getHistory(), response);
                run.setState(ExecutionState.COMPLETED);
                checkpoint(run, ExecutionState.COMPLETED);
                log.info("[Flow] Workflow {} completed after {} iterations", run.getWorkflowId(),
                        run.getIterations());
                return ExecutionResult.builder()
                        .success(true)
                        .finalOutput(response.getContent())
                        .duration(Duration.between(run.getSessionStartedAt(), clock.instant()))
                        .workflowId(run.getWorkflowId())
                        .state(ExecutionState.COMPLETED)
                        .iterations(run.getIterations())
                        .lastCheckpoint(run.getLastCheckpoint())
                        .checkpointAvailable(true)
                        .totalTokens(run.getTotalTokens())
                        .build();
            }

            run.setState(ExecutionState.EXECUTING_TOOL);
            historyWriter.appendAssistantToolCalls(run.getHistory(), response);
            executeToolCalls(run, response);
        }
    }

    private LlmResponse callModel(ExecutionRun run) {
        WorkflowDefinition workflow = run.getWorkflow();
        FlowProperties.LlmProperties llm = properties.getLlm();

        ConversationView view = viewBuilder.buildView(run.getHistory());
        if (!view.diagnostics().isEmpty()) {
            log.debug("[Flow] conversation view diagnostics: {}", view.diagnostics());
        }

        LlmRequest request = LlmRequest.builder()
                .model(workflow.getModel() != null ? workflow.getModel() : llm.getModel())
                .systemPrompt(properties.getExecution().getSystemPrompt())
                .messages(new ArrayList<>(view.messages()))
                .tools(toolRegistry.definitionsFor(run.getAllowedTools()))
                .temperature(workflow.getTemperature() != null ? workflow.getTemperature() : llm.getTemperature())
                .maxTokens(workflow.getMaxOutputTokens() != null ? workflow.getMaxOutputTokens() : llm.getMaxTokens())
                .workflowId(run.getWorkflowId())
                .build();

        CompletableFuture<LlmResponse> future;
        try {
            future = llmPort.chat(request);
        } catch (RuntimeException e) {
            throw modelFailure(e);
        }
        try {
            LlmResponse response = await(run, future);
            if (response == null) {
                throw new WorkflowExecutionException(ExecutionErrorKind.MODEL_INTERFACE_ERROR,
                        ModelErrorKind.UNKNOWN, "Model returned no response", null);
            }
            return response;
        } catch (ExecutionException e) {
            throw modelFailure(e.getCause() != null ? e.getCause() : e);
        }
    }

    private WorkflowExecutionException modelFailure(Throwable error) {
        ModelErrorKind kind = LlmErrorClassifier.classify(error);
        log.warn("[LLM] Model call failed ({}): {}", kind, error.getMessage());
        return new WorkflowExecutionException(ExecutionErrorKind.MODEL_INTERFACE_ERROR, kind,
                "Model call failed (" + kind.name().toLowerCase(Locale.ROOT) + "): " + error.getMessage(), error);
    }

    // ==================== TOOLS ====================

    private void executeToolCalls(ExecutionRun run, LlmResponse response) {
        List<Message.ToolCall> calls = response.getToolCalls();
        boolean parallel = properties.getExecution().isParallelToolCalls() && response.isIndependentToolCalls()
                && calls.size() > 1;

        if (!parallel) {
            for (Message.ToolCall call : calls) {
                ToolExecutionOutcome outcome = isAllowed(run, call)
                        ? awaitTool(run, call, toolExecutor.execute(call))
                        : denied(call);
                recordOutcome(run, call, outcome, response.getContent());
            }
            return;
        }

        // start every allowed call, then merge results in request order
        List<CompletableFuture<ToolExecutionOutcome>> futures = new ArrayList<>(calls.size());
        for (Message.ToolCall call : calls) {
            futures.add(isAllowed(run, call)
                    ? toolExecutor.execute(call)
                    : CompletableFuture.completedFuture(denied(call)));
        }
        log.debug("[Tools] Running {} independent tool calls concurrently", calls.size());
        try {
            for (int i = 0; i < calls.size(); i++) {
                ToolExecutionOutcome outcome = awaitTool(run, calls.get(i), futures.get(i));
                recordOutcome(run, calls.get(i), outcome, response.getContent());
            }
        } catch (WorkflowExecutionException e) {
            futures.forEach(future -> future.cancel(true));
            throw e;
        }
    }

    private boolean isAllowed(ExecutionRun run, Message.ToolCall call) {
        return call.getName() != null && run.getAllowedTools().contains(call.getName());
    }

    private ToolExecutionOutcome denied(Message.ToolCall call) {
        log.warn("[Tools] Tool '{}' is not declared by the workflow; call rejected", call.getName());
        return ToolExecutionOutcome.synthetic(call, ToolFailureKind.POLICY_DENIED,
                "Error: Tool '" + call.getName() + "' is not available to this workflow");
    }

    private ToolExecutionOutcome awaitTool(ExecutionRun run, Message.ToolCall call,
            CompletableFuture<ToolExecutionOutcome> future) {
        try {
            ToolExecutionOutcome outcome = await(run, future);
            return outcome != null
                    ? outcome
                    : ToolExecutionOutcome.synthetic(call, ToolFailureKind.EXECUTION_FAILED,
                            "Tool execution failed: no result");
        } catch (ExecutionException e) {
            String message = e.getCause() != null ? e.getCause().getMessage() : e.getMessage();
            log.warn("[Tools] {} failed: {}", call.getName(), message);
            return ToolExecutionOutcome.synthetic(call, ToolFailureKind.EXECUTION_FAILED,
                    "Tool execution failed: " + message);
        }
    }

    private void recordOutcome(ExecutionRun run, Message.ToolCall call, ToolExecutionOutcome outcome,
            String reasoning) {
        Instant now = clock.instant();
        ExecutionContext context = run.getContext();
        historyWriter.appendToolResult(run.getHistory(), outcome);

        context.addCompletedTool(CompletedTool.builder()
                .functionName(call.getName())
                .parameters(call.getArguments() != null ? new LinkedHashMap<>(call.getArguments()) : Map.of())
                .result(outcome.messageContent())
                .executedAt(now)
                .success(outcome.isSuccess())
                .reasoning(reasoning)
                .build());
        context.addHistoryEntry(HistoryEntry.builder()
                .stepName(call.getName())
                .stepType(HistoryEntry.TYPE_TOOL)
                .startedAt(now)
                .completedAt(now)
                .success(outcome.isSuccess())
                .errorMessage(outcome.isSuccess() ? null : outcome.messageContent())
                .build());

        ToolResult result = outcome.toolResult();
        if (outcome.isSuccess() && result.getContextVariables() != null) {
            for (Map.Entry<String, Object> entry : result.getContextVariables().entrySet()) {
                Object previous = context.getVariables().put(entry.getKey(), entry.getValue());
                if (!Objects.equals(previous, entry.getValue())) {
                    context.getContextEvolution().addChange(ContextChange.builder()
                            .timestamp(now)
                            .key(entry.getKey())
                            .oldValue(previous)
                            .newValue(entry.getValue())
                            .source(call.getName())
                            .reasoning(reasoning)
                            .build());
                    context.incrementStep();
                }
            }
        }

        run.setToolCallsSinceCheckpoint(run.getToolCallsSinceCheckpoint() + 1);
        if (run.getToolCallsSinceCheckpoint() >= Math.max(1, properties.getResume().getCheckpointFrequency())) {
            checkpoint(run, ExecutionState.EXECUTING_TOOL);
        }
    }

    private void recordInsights(ExecutionRun run, String assistantText) {
        for (String insight : insightExtractor.extract(assistantText)) {
            run.getContext().getContextEvolution().addInsight(insight);
        }
    }

    // ==================== AWAIT ====================

    /**
     * Waits for the future in poll-interval slices, failing the run on deadline
     * or cancellation. The future is cancelled in both cases and any late result
     * is discarded.
     */
    private <T> T await(ExecutionRun run, CompletableFuture<T> future) throws ExecutionException {
        long pollMs = Math.max(1, properties.getExecution().getPollIntervalMs());
        while (true) {
            ensureNotStopped(run, future);
            try {
                return future.get(pollMs, TimeUnit.MILLISECONDS);
            } catch (TimeoutException stillRunning) {
                log.trace("[Flow] Waiting on {} ({})", run.getWorkflowId(), run.getState());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                throw new WorkflowExecutionException(ExecutionErrorKind.CANCELLED, "Execution interrupted", e);
            } catch (CancellationException e) {
                throw new WorkflowExecutionException(ExecutionErrorKind.CANCELLED, "Execution cancelled", e);
            }
        }
    }

    private void ensureNotStopped(ExecutionRun run) {
        ensureNotStopped(run, null);
    }

    private void ensureNotStopped(ExecutionRun run, CompletableFuture<?> inFlight) {
        if (run.getToken().isCancellationRequested()) {
            if (inFlight != null) {
                inFlight.cancel(true);
            }
            throw new WorkflowExecutionException(ExecutionErrorKind.CANCELLED, "Execution cancelled");
        }
        if (!clock.instant().isBefore(run.getDeadline())) {
            if (inFlight != null) {
                inFlight.cancel(true);
            }
            throw new WorkflowExecutionException(ExecutionErrorKind.TIMEOUT,
                    "Execution timed out after " + properties.getExecution().getTimeout());
        }
    }

    // ==================== CHECKPOINT & FAILURE ====================

    private void checkpoint(ExecutionRun run, ExecutionState state) {
        try {
            checkpointService.checkpoint(run, state);
        } catch (ResumeStateStorageException e) {
            throw new WorkflowExecutionException(ExecutionErrorKind.STORAGE_ERROR,
                    "Failed to write checkpoint: " + e.getMessage(), e);
        }
    }

    private ExecutionResult fail(ExecutionRun run, WorkflowExecutionException error,
            CompatibilityResult compatibility) {
        ExecutionState finalState = error.getKind() == ExecutionErrorKind.CANCELLED
                ? ExecutionState.CANCELLED
                : ExecutionState.FAILED;
        run.setState(finalState);

        if (run.isCheckpointed() && error.getKind() != ExecutionErrorKind.STORAGE_ERROR) {
            try {
                checkpointService.checkpoint(run, finalState);
            } catch (ResumeStateStorageException e) {
                log.warn("[Resume] Final checkpoint for {} failed, previous checkpoint kept: {}",
                        run.getWorkflowId(), e.getMessage());
            }
        }

        String hint = run.isCheckpointed()
                ? " Progress was checkpointed at " + run.getLastCheckpoint() + "; continue with: resume "
                        + run.getWorkflow().getFilePath() + " --workflow-id=" + run.getWorkflowId()
                : " No resumable checkpoint was written.";
        if (finalState == ExecutionState.CANCELLED) {
            log.info("[Flow] Workflow {} cancelled after {} iterations", run.getWorkflowId(), run.getIterations());
        } else {
            log.error("[Flow] Workflow {} failed ({}): {}", run.getWorkflowId(), error.getKind(),
                    error.getMessage());
        }

        return ExecutionResult.builder()
                .success(false)
                .errorMessage(error.getMessage() + "." + hint)
                .duration(Duration.between(run.getSessionStartedAt(), clock.instant()))
                .workflowId(run.getWorkflowId())
                .state(finalState)
                .errorKind(error.getKind())
                .modelErrorKind(error.getModelErrorKind())
                .iterations(run.getIterations())
                .lastCheckpoint(run.getLastCheckpoint())
                .checkpointAvailable(run.isCheckpointed())
                .compatibility(compatibility)
                .totalTokens(run.getTotalTokens())
                .build();
    }

    private ExecutionResult rejected(String workflowId, Instant start, ExecutionErrorKind kind, String message,
            CompatibilityResult compatibility) {
        log.error("[Resume] {}", message);
        return ExecutionResult.builder()
                .success(false)
                .errorMessage(message)
                .duration(Duration.between(start, clock.instant()))
                .workflowId(workflowId)
                .state(ExecutionState.FAILED)
                .errorKind(kind)
                .checkpointAvailable(kind == ExecutionErrorKind.RESUME_INCOMPATIBLE)
                .compatibility(compatibility)
                .build();
    }

    // ==================== VALIDATE ====================

    @Override
    public ValidationResult validate(WorkflowDefinition workflow) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        String template = workflow.getTemplate();
        if (template == null || template.isBlank()) {
            warnings.add("Workflow body is empty");
        } else {
            Map<String, Object> defaults = variableResolver.resolve(workflow, Map.of());
            try {
                for (String name : templateEngine.findUnresolved(template, defaults)) {
                    warnings.add("Variable '" + name + "' has no default; provide it with --var=" + name + "=...");
                }
            } catch (TemplateRenderException e) {
                errors.add("Template error: " + e.getMessage());
            }
            for (String name : variableResolver.findMissingRequired(workflow, defaults)) {
                warnings.add("Required input '" + name + "' has no value");
            }
        }

        List<String> declared = workflow.getDeclaredTools() != null ? workflow.getDeclaredTools() : List.of();
        if (declared.isEmpty()) {
            warnings.add("Workflow declares no tools");
        }
        for (String tool : declared) {
            if (!toolRegistry.contains(tool)) {
                errors.add("Declared tool '" + tool + "' is not available (known: " + toolRegistry.getToolNames()
                        + ")");
            }
        }
        if (template != null) {
            Set<String> mentioned = mentionedTools(template);
            for (String tool : mentioned) {
                if (!declared.contains(tool)) {
                    warnings.add("Body mentions tool '" + tool + "' which is not declared in frontmatter");
                }
            }
        }

        return new ValidationResult(errors, warnings);
    }

    private Set<String> mentionedTools(String template) {
        Set<String> mentioned = new LinkedHashSet<>();
        Matcher matcher = TOOL_NAME_TOKEN.matcher(template);
        while (matcher.find()) {
            if (toolRegistry.contains(matcher.group())) {
                mentioned.add(matcher.group());
            }
        }
        return mentioned;
    }

    // ==================== HELPERS ====================

    @Override
    public String generateWorkflowId(WorkflowDefinition workflow) {
        String name = workflow.getName() != null && !workflow.getName().isBlank() ? workflow.getName() : "unnamed";
        String safeName = UNSAFE_ID_CHARS.matcher(name).replaceAll("-");
        String timestamp = ID_TIMESTAMP.format(clock.instant());
        String suffix = ContentHasher.sha256(UUID.randomUUID().toString()).substring(0, 8);
        return "workflow_" + safeName + "_" + timestamp + "_" + suffix;
    }

    private List<String> allowedTools(WorkflowDefinition workflow) {
        List<String> allowed = new ArrayList<>();
        List<String> declared = workflow.getDeclaredTools() != null ? workflow.getDeclaredTools() : List.of();
        for (String tool : declared) {
            if (toolRegistry.contains(tool) && !allowed.contains(tool)) {
                allowed.add(tool);
            } else if (!toolRegistry.contains(tool)) {
                log.warn("[Tools] Declared tool '{}' is not registered and will not be offered", tool);
            }
        }
        return allowed;
    }
}
