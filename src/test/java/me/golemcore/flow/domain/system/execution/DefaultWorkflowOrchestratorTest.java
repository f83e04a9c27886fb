package me.golemcore.flow.domain.system.execution;

import me.golemcore.flow.adapter.outbound.resume.LocalResumeStateAdapter;
import me.golemcore.flow.domain.component.ToolComponent;
import me.golemcore.flow.domain.model.CancellationToken;
import me.golemcore.flow.domain.model.ExecutionErrorKind;
import me.golemcore.flow.domain.model.ExecutionResult;
import me.golemcore.flow.domain.model.ExecutionState;
import me.golemcore.flow.domain.model.LlmRequest;
import me.golemcore.flow.domain.model.LlmResponse;
import me.golemcore.flow.domain.model.LlmUsage;
import me.golemcore.flow.domain.model.Message;
import me.golemcore.flow.domain.model.ModelErrorKind;
import me.golemcore.flow.domain.model.ResumeSnapshot;
import me.golemcore.flow.domain.model.ToolDefinition;
import me.golemcore.flow.domain.model.ToolResult;
import me.golemcore.flow.domain.model.ValidationResult;
import me.golemcore.flow.domain.model.WorkflowDefinition;
import me.golemcore.flow.domain.service.ContentHasher;
import me.golemcore.flow.domain.service.DefaultVariableImportanceScorer;
import me.golemcore.flow.domain.service.InMemoryConversationStore;
import me.golemcore.flow.domain.service.InsightExtractor;
import me.golemcore.flow.domain.service.ResumeCompatibilityValidator;
import me.golemcore.flow.domain.service.ResumeLimits;
import me.golemcore.flow.domain.service.ResumeStateCodec;
import me.golemcore.flow.domain.service.ToolRegistry;
import me.golemcore.flow.domain.service.WorkflowLoader;
import me.golemcore.flow.domain.service.WorkflowTemplateEngine;
import me.golemcore.flow.domain.service.WorkflowVariableResolver;
import me.golemcore.flow.domain.system.LlmErrorClassifier;
import me.golemcore.flow.infrastructure.config.AutoConfiguration;
import me.golemcore.flow.infrastructure.config.FlowProperties;
import me.golemcore.flow.port.outbound.LlmPort;
import me.golemcore.flow.tools.FileWriteTool;
import me.golemcore.flow.tools.WorkspacePathResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class DefaultWorkflowOrchestratorTest {

    private static final Instant NOW = Instant.parse("2026-05-10T12:00:00Z");
    private static final String WF = "wf-greeter";

    private static final String SOURCE = """
            ---
            name: greeter
            tools: [file-write, echo]
            input:
              default:
                target: hello
            ---
            Write a short greeting into {{target}}.txt with file-write, then confirm with echo.
            """;

    @TempDir
    Path tempDir;

    private FlowProperties properties;
    private LocalResumeStateAdapter store;
    private ScriptedLlm llm;
    private StubTool echo;
    private StubTool secret;
    private WorkflowLoader loader;

    @BeforeEach
    void setUp() {
        properties = new FlowProperties();
        properties.getResume().setStoragePath(tempDir.resolve("resume").toString());
        properties.getTools().getFilesystem().setWorkspace(tempDir.resolve("workspace").toString());
        properties.getExecution().setPollIntervalMs(5);
        llm = new ScriptedLlm();
        echo = new StubTool("echo", params -> CompletableFuture.completedFuture(
                ToolResult.success("echo: " + params.get("text"))));
        secret = new StubTool("secret", params -> CompletableFuture.completedFuture(ToolResult.success("leaked")));
        loader = new WorkflowLoader();
    }

    private DefaultWorkflowOrchestrator orchestrator(Clock clock, ToolComponent... extraTools) {
        store = new LocalResumeStateAdapter(properties, AutoConfiguration.objectMapper(), clock);
        store.init();

        List<ToolComponent> tools = new ArrayList<>();
        tools.add(new FileWriteTool(new WorkspacePathResolver(properties)));
        tools.add(echo);
        tools.add(secret);
        tools.addAll(Arrays.asList(extraTools));
        ToolRegistry registry = new ToolRegistry(tools);

        InsightExtractor insightExtractor = new InsightExtractor();
        ResumeStateCodec codec = new ResumeStateCodec(ResumeLimits.defaults(), new DefaultVariableImportanceScorer(),
                insightExtractor);
        CheckpointService checkpointService = new CheckpointService(codec, store,
                new InMemoryConversationStore(4, 500), clock);

        return new DefaultWorkflowOrchestrator(llm, new RegistryToolExecutor(registry, 20_000),
                new DefaultHistoryWriter(clock), new DefaultConversationViewBuilder(), registry,
                new WorkflowTemplateEngine(), new WorkflowVariableResolver(), checkpointService,
                new ResumeContextBuilder(clock), store, codec, new ResumeCompatibilityValidator(0.6),
                insightExtractor, properties, clock);
    }

    private DefaultWorkflowOrchestrator orchestrator(ToolComponent... extraTools) {
        return orchestrator(Clock.fixed(NOW, ZoneOffset.UTC), extraTools);
    }

    private WorkflowDefinition workflow(String source) {
        return loader.parse(source, tempDir.resolve("greeter.prompt.md").toString());
    }

    private ResumeSnapshot storedSnapshot() {
        return store.load(WF).orElseThrow();
    }

    // ==================== FRESH RUN ====================

    @Test
    void shouldWriteFileAndCompleteWithFinalAnswer() throws Exception {
        DefaultWorkflowOrchestrator orchestrator = orchestrator();
        llm.then(toolCalls(false, call("c1", "file-write", Map.of("path", "hello.txt", "content", "hi"))))
                .then(answer("Greeting written."));

        ExecutionResult result = orchestrator.execute(workflow(SOURCE), Map.of(), WF, CancellationToken.none());

        assertTrue(result.isSuccess(), result.getErrorMessage());
        assertEquals("Greeting written.", result.getFinalOutput());
        assertEquals(ExecutionState.COMPLETED, result.getState());
        assertEquals(2, result.getIterations());
        assertEquals(30, result.getTotalTokens());
        assertEquals("hi", Files.readString(tempDir.resolve("workspace/hello.txt"), StandardCharsets.UTF_8));

        ResumeSnapshot snapshot = storedSnapshot();
        assertEquals("completed", snapshot.getWorkflowMetadata().getStatus());
        assertEquals(1, snapshot.getCompletedTools().size());
        assertEquals("file-write", snapshot.getCompletedTools().get(0).getFunctionName());
        assertTrue(snapshot.getCompletedTools().get(0).isSuccess());
        assertEquals("hello.txt", snapshot.getWorkflowVariables().get("last_written_file"));
        assertEquals("hello", snapshot.getWorkflowVariables().get("target"));
    }

    @Test
    void shouldRenderTemplateIntoFirstUserMessage() {
        DefaultWorkflowOrchestrator orchestrator = orchestrator();
        llm.then(answer("done"));

        orchestrator.execute(workflow(SOURCE), Map.of("target", "world"), WF, CancellationToken.none());

        LlmRequest first = llm.requests.get(0);
        Message user = first.getMessages().get(0);
        assertTrue(user.isUserMessage());
        assertEquals("Write a short greeting into world.txt with file-write, then confirm with echo.",
                user.getContent());
        assertEquals(WF, first.getWorkflowId());
    }

    @Test
    void shouldOfferOnlyDeclaredTools() {
        DefaultWorkflowOrchestrator orchestrator = orchestrator();
        llm.then(answer("done"));

        orchestrator.execute(workflow(SOURCE), Map.of(), WF, CancellationToken.none());

        List<String> offered = llm.requests.get(0).getTools().stream().map(ToolDefinition::getName).toList();
        assertEquals(List.of("file-write", "echo"), offered);
    }

    @Test
    void shouldRejectUndeclaredToolWithoutInvokingIt() {
        DefaultWorkflowOrchestrator orchestrator = orchestrator();
        llm.then(toolCalls(false, call("c1", "secret", Map.of())))
                .then(answer("ok"));

        ExecutionResult result = orchestrator.execute(workflow(SOURCE), Map.of(), WF, CancellationToken.none());

        assertTrue(result.isSuccess());
        assertEquals(0, secret.calls.get());
        Message toolMessage = lastToolMessage(llm.requests.get(1));
        assertTrue(toolMessage.getContent().contains("not available to this workflow"));
        assertFalse(storedSnapshot().getCompletedTools().get(0).isSuccess());
    }

    @Test
    void shouldFoldToolExceptionIntoConversation() {
        StubTool broken = new StubTool("broken", params -> {
            throw new IllegalStateException("boom");
        });
        DefaultWorkflowOrchestrator orchestrator = orchestrator(broken);
        String source = SOURCE.replace("[file-write, echo]", "[broken]");
        llm.then(toolCalls(false, call("c1", "broken", Map.of())))
                .then(answer("recovered"));

        ExecutionResult result = orchestrator.execute(workflow(source), Map.of(), WF, CancellationToken.none());

        assertTrue(result.isSuccess());
        assertEquals("recovered", result.getFinalOutput());
        assertEquals("Tool execution failed: boom", lastToolMessage(llm.requests.get(1)).getContent());
    }

    @Test
    void shouldMergeIndependentToolResultsInRequestOrder() {
        StubTool slow = new StubTool("slow", params -> CompletableFuture.supplyAsync(
                () -> ToolResult.success("slow done"),
                CompletableFuture.delayedExecutor(50, TimeUnit.MILLISECONDS)));
        DefaultWorkflowOrchestrator orchestrator = orchestrator(slow);
        String source = SOURCE.replace("[file-write, echo]", "[slow, echo]");
        llm.then(toolCalls(true, call("c1", "slow", Map.of()), call("c2", "echo", Map.of("text", "fast"))))
                .then(answer("both done"));

        ExecutionResult result = orchestrator.execute(workflow(source), Map.of(), WF, CancellationToken.none());

        assertTrue(result.isSuccess());
        List<Message> toolMessages = llm.requests.get(1).getMessages().stream()
                .filter(Message::isToolMessage)
                .toList();
        assertEquals(List.of("c1", "c2"), toolMessages.stream().map(Message::getToolCallId).toList());
        assertEquals("slow done", toolMessages.get(0).getContent());
        assertEquals("echo: fast", toolMessages.get(1).getContent());
    }

    // ==================== FAILURES ====================

    @Test
    void shouldStopAtMaxIterationsWithResumableCheckpoint() {
        properties.getExecution().setMaxIterations(3);
        DefaultWorkflowOrchestrator orchestrator = orchestrator();
        for (int i = 0; i < 3; i++) {
            llm.then(toolCalls(false, call("c" + i, "echo", Map.of("text", "round " + i))));
        }

        ExecutionResult result = orchestrator.execute(workflow(SOURCE), Map.of(), WF, CancellationToken.none());

        assertFalse(result.isSuccess());
        assertEquals(ExecutionErrorKind.MAX_ITERATIONS_EXCEEDED, result.getErrorKind());
        assertEquals(3, result.getIterations());
        assertTrue(result.isCheckpointAvailable());
        assertTrue(result.getErrorMessage().contains("--workflow-id=" + WF));
        assertEquals("failed", storedSnapshot().getWorkflowMetadata().getStatus());
        assertEquals(3, storedSnapshot().getCompletedTools().size());
    }

    @Test
    void shouldTimeOutAndCancelPendingModelCall() {
        properties.getExecution().setTimeout(Duration.ofMillis(200));
        DefaultWorkflowOrchestrator orchestrator = orchestrator(Clock.systemUTC());
        CompletableFuture<LlmResponse> hanging = new CompletableFuture<>();
        llm.thenReturn(hanging);

        ExecutionResult result = orchestrator.execute(workflow(SOURCE), Map.of(), WF, CancellationToken.none());

        assertFalse(result.isSuccess());
        assertEquals(ExecutionErrorKind.TIMEOUT, result.getErrorKind());
        assertTrue(hanging.isCancelled());
        assertTrue(result.isCheckpointAvailable());
        assertEquals("failed", storedSnapshot().getWorkflowMetadata().getStatus());
    }

    @Test
    void shouldCancelBetweenSteps() {
        CancellationToken token = new CancellationToken();
        StubTool stopper = new StubTool("stopper", params -> {
            token.cancel();
            return CompletableFuture.completedFuture(ToolResult.success("stopping"));
        });
        DefaultWorkflowOrchestrator orchestrator = orchestrator(stopper);
        String source = SOURCE.replace("[file-write, echo]", "[stopper]");
        llm.then(toolCalls(false, call("c1", "stopper", Map.of())))
                .then(answer("never reached"));

        ExecutionResult result = orchestrator.execute(workflow(source), Map.of(), WF, token);

        assertFalse(result.isSuccess());
        assertEquals(ExecutionErrorKind.CANCELLED, result.getErrorKind());
        assertEquals(ExecutionState.CANCELLED, result.getState());
        assertEquals(1, llm.requests.size());
        ResumeSnapshot snapshot = storedSnapshot();
        assertEquals("cancelled", snapshot.getWorkflowMetadata().getStatus());
        assertEquals(1, snapshot.getCompletedTools().size());
    }

    @Test
    void shouldReportModelErrorKind() {
        DefaultWorkflowOrchestrator orchestrator = orchestrator();
        llm.thenFail(new IllegalStateException(
                LlmErrorClassifier.withCode(LlmErrorClassifier.NOT_CONFIGURED, "No API key for openai")));

        ExecutionResult result = orchestrator.execute(workflow(SOURCE), Map.of(), WF, CancellationToken.none());

        assertEquals(ExecutionErrorKind.MODEL_INTERFACE_ERROR, result.getErrorKind());
        assertEquals(ModelErrorKind.NOT_CONFIGURED, result.getModelErrorKind());
        assertTrue(result.isCheckpointAvailable());
    }

    @Test
    void shouldFailOnMissingVariableWithoutCheckpoint() {
        DefaultWorkflowOrchestrator orchestrator = orchestrator();
        String source = SOURCE.replace("{{target}}", "{{unknown_name}}");

        ExecutionResult result = orchestrator.execute(workflow(source), Map.of(), WF, CancellationToken.none());

        assertEquals(ExecutionErrorKind.TEMPLATE_ERROR, result.getErrorKind());
        assertFalse(result.isCheckpointAvailable());
        assertTrue(llm.requests.isEmpty());
        assertTrue(store.load(WF).isEmpty());
    }

    @Test
    void shouldFailOnMissingRequiredInput() {
        DefaultWorkflowOrchestrator orchestrator = orchestrator();
        String source = """
                ---
                name: greeter
                tools: [echo]
                input:
                  schema:
                    audience:
                      type: string
                      required: true
                ---
                Greet {{audience}}.
                """;

        ExecutionResult result = orchestrator.execute(workflow(source), Map.of(), WF, CancellationToken.none());

        assertEquals(ExecutionErrorKind.TEMPLATE_ERROR, result.getErrorKind());
        assertTrue(result.getErrorMessage().contains("audience"));
    }

    // ==================== RESUME ====================

    @Test
    void shouldResumeInterruptedRunWithoutRepeatingTools() {
        DefaultWorkflowOrchestrator orchestrator = orchestrator();
        for (int i = 1; i <= 3; i++) {
            llm.then(toolCalls(false, call("c" + i, "echo", Map.of("text", "step " + i))));
        }
        llm.thenFail(new RuntimeException("connection reset"));

        ExecutionResult interrupted = orchestrator.execute(workflow(SOURCE), Map.of(), WF,
                CancellationToken.none());
        assertFalse(interrupted.isSuccess());
        assertEquals(3, echo.calls.get());

        ScriptedLlm resumedLlm = new ScriptedLlm().then(answer("All steps done."));
        llm = resumedLlm;
        DefaultWorkflowOrchestrator resumedOrchestrator = orchestrator();

        ExecutionResult resumed = resumedOrchestrator.resume(WF, workflow(SOURCE), false,
                CancellationToken.none());

        assertTrue(resumed.isSuccess(), resumed.getErrorMessage());
        assertEquals(1.0, resumed.getCompatibility().getScore(), 1e-9);
        assertEquals(3, echo.calls.get());

        List<Message> sent = resumedLlm.requests.get(0).getMessages();
        assertEquals(8, sent.size());
        assertTrue(sent.get(0).isUserMessage());
        assertEquals(3, sent.stream().filter(Message::isToolMessage).count());
        Message resumeMessage = sent.get(sent.size() - 1);
        assertTrue(resumeMessage.isSystemMessage());
        assertTrue(resumeMessage.getContent().startsWith(ResumeContextBuilder.HEADER));
        assertTrue(resumeMessage.getContent().contains("echo: step 3"));
        assertEquals("completed", storedSnapshot().getWorkflowMetadata().getStatus());
    }

    @Test
    void shouldRejectResumeOfHeavilyEditedWorkflowUnlessForced() {
        DefaultWorkflowOrchestrator orchestrator = orchestrator();
        llm.then(toolCalls(false, call("c1", "echo", Map.of("text", "one"))))
                .thenFail(new RuntimeException("connection reset"));
        orchestrator.execute(workflow(SOURCE), Map.of(), WF, CancellationToken.none());

        String edited = """
                ---
                name: auditor
                tools: [echo]
                ---
                Audit every dependency manifest in the repository, list outdated libraries with their
                latest released versions, explain the upgrade risk for each one, and produce a prioritized
                migration plan grouped by module with estimated effort and rollback notes for operators.
                """;
        ExecutionResult rejected = orchestrator.resume(WF, workflow(edited), false, CancellationToken.none());

        assertFalse(rejected.isSuccess());
        assertEquals(ExecutionErrorKind.RESUME_INCOMPATIBLE, rejected.getErrorKind());
        assertFalse(rejected.getCompatibility().isCanResume());
        assertTrue(rejected.getCompatibility().getScore() < 0.6);
        assertEquals("failed", storedSnapshot().getWorkflowMetadata().getStatus());
        assertEquals(ContentHasher.sha256(SOURCE), storedSnapshot().getWorkflowMetadata().getWorkflowHash());

        llm.then(answer("audit complete"));
        ExecutionResult forced = orchestrator.resume(WF, workflow(edited), true, CancellationToken.none());

        assertTrue(forced.isSuccess(), forced.getErrorMessage());
        assertEquals("audit complete", forced.getFinalOutput());
        assertEquals(ContentHasher.sha256(edited), storedSnapshot().getWorkflowMetadata().getWorkflowHash());
    }

    @Test
    void shouldReportMissingSnapshot() {
        DefaultWorkflowOrchestrator orchestrator = orchestrator();

        ExecutionResult result = orchestrator.resume("wf-unknown", workflow(SOURCE), false,
                CancellationToken.none());

        assertEquals(ExecutionErrorKind.SNAPSHOT_NOT_FOUND, result.getErrorKind());
        assertFalse(result.isCheckpointAvailable());
    }

    @Test
    void shouldResumeFromWorkingCopyInSameProcess() {
        DefaultWorkflowOrchestrator orchestrator = orchestrator();
        for (int i = 1; i <= 12; i++) {
            llm.then(toolCalls(false, call("c" + i, "echo", Map.of("text", "step " + i))));
        }
        llm.thenFail(new RuntimeException("connection reset"));
        orchestrator.execute(workflow(SOURCE), Map.of(), WF, CancellationToken.none());
        assertEquals(20, storedSnapshot().getChatHistory().size());

        llm.then(answer("All steps done."));
        ExecutionResult resumed = orchestrator.resume(WF, workflow(SOURCE), false, CancellationToken.none());

        assertTrue(resumed.isSuccess(), resumed.getErrorMessage());
        List<Message> sent = llm.requests.get(llm.requests.size() - 1).getMessages();
        assertEquals(26, sent.size());
        assertTrue(sent.get(0).isUserMessage());
        assertEquals(12, sent.stream().filter(Message::isToolMessage).count());
        assertEquals(12, echo.calls.get());
    }

    @Test
    void shouldResumeFromPrunedSnapshotInNewProcess() {
        DefaultWorkflowOrchestrator orchestrator = orchestrator();
        for (int i = 1; i <= 12; i++) {
            llm.then(toolCalls(false, call("c" + i, "echo", Map.of("text", "step " + i))));
        }
        llm.thenFail(new RuntimeException("connection reset"));
        orchestrator.execute(workflow(SOURCE), Map.of(), WF, CancellationToken.none());

        ScriptedLlm resumedLlm = new ScriptedLlm().then(answer("All steps done."));
        llm = resumedLlm;
        ExecutionResult resumed = orchestrator().resume(WF, workflow(SOURCE), false, CancellationToken.none());

        assertTrue(resumed.isSuccess(), resumed.getErrorMessage());
        assertEquals(21, resumedLlm.requests.get(0).getMessages().size());
    }

    @Test
    void shouldReportCorruptSnapshotAndLeaveItInPlace() throws Exception {
        DefaultWorkflowOrchestrator orchestrator = orchestrator();
        Path stored = tempDir.resolve("resume").resolve(WF + ".json");
        Files.writeString(stored, "{\"workflow_metadata\": {", StandardCharsets.UTF_8);

        ExecutionResult result = orchestrator.resume(WF, workflow(SOURCE), false, CancellationToken.none());

        assertFalse(result.isSuccess());
        assertEquals(ExecutionErrorKind.SNAPSHOT_CORRUPT, result.getErrorKind());
        assertFalse(result.isCheckpointAvailable());
        assertTrue(llm.requests.isEmpty());
        assertEquals("{\"workflow_metadata\": {", Files.readString(stored, StandardCharsets.UTF_8));
    }

    // ==================== WORKFLOW IDS ====================

    @Test
    void shouldRejectUnsafeWorkflowIdOnExecute() {
        DefaultWorkflowOrchestrator orchestrator = orchestrator();

        ExecutionResult result = orchestrator.execute(workflow(SOURCE), Map.of(), "../escape",
                CancellationToken.none());

        assertFalse(result.isSuccess());
        assertEquals(ExecutionErrorKind.INVALID_WORKFLOW_ID, result.getErrorKind());
        assertEquals(ExecutionState.FAILED, result.getState());
        assertFalse(result.isCheckpointAvailable());
        assertTrue(llm.requests.isEmpty());
        assertFalse(Files.exists(tempDir.resolve("escape.json")));
    }

    @Test
    void shouldRejectUnsafeWorkflowIdOnResume() {
        DefaultWorkflowOrchestrator orchestrator = orchestrator();

        ExecutionResult result = orchestrator.resume("a/b", workflow(SOURCE), false, CancellationToken.none());

        assertEquals(ExecutionErrorKind.INVALID_WORKFLOW_ID, result.getErrorKind());
        assertTrue(llm.requests.isEmpty());
    }

    // ==================== VALIDATE ====================

    @Test
    void shouldReportUnknownDeclaredToolAsError() {
        DefaultWorkflowOrchestrator orchestrator = orchestrator();
        String source = SOURCE.replace("[file-write, echo]", "[file-write, teleport]");

        ValidationResult result = orchestrator.validate(workflow(source));

        assertFalse(result.valid());
        assertTrue(result.errors().get(0).contains("teleport"));
    }

    @Test
    void shouldWarnAboutMentionedButUndeclaredTool() {
        DefaultWorkflowOrchestrator orchestrator = orchestrator();
        String source = SOURCE.replace("[file-write, echo]", "[file-write]");

        ValidationResult result = orchestrator.validate(workflow(source));

        assertTrue(result.valid());
        assertTrue(result.warnings().stream().anyMatch(w -> w.contains("'echo'")));
    }

    @Test
    void shouldWarnAboutVariablesWithoutDefaults() {
        DefaultWorkflowOrchestrator orchestrator = orchestrator();
        String source = SOURCE.replace("{{target}}", "{{destination}}");

        ValidationResult result = orchestrator.validate(workflow(source));

        assertTrue(result.valid());
        assertTrue(result.warnings().stream().anyMatch(w -> w.contains("--var=destination=")));
    }

    @Test
    void shouldGenerateSortableWorkflowId() {
        DefaultWorkflowOrchestrator orchestrator = orchestrator();

        String id = orchestrator.generateWorkflowId(workflow(SOURCE));

        assertTrue(id.matches("workflow_greeter_20260510_120000_[0-9a-f]{8}"), id);
    }

    // ==================== HELPERS ====================

    private static Message lastToolMessage(LlmRequest request) {
        List<Message> messages = request.getMessages();
        for (int i = messages.size() - 1; i >= 0; i--) {
            if (messages.get(i).isToolMessage()) {
                return messages.get(i);
            }
        }
        throw new AssertionError("no tool message in request");
    }

    private static Message.ToolCall call(String id, String name, Map<String, Object> arguments) {
        return Message.ToolCall.builder().id(id).name(name).arguments(arguments).build();
    }

    private static LlmResponse toolCalls(boolean independent, Message.ToolCall... calls) {
        return LlmResponse.builder()
                .content("Working on it")
                .toolCalls(List.of(calls))
                .independentToolCalls(independent)
                .usage(LlmUsage.of(10, 5))
                .build();
    }

    private static LlmResponse answer(String content) {
        return LlmResponse.builder()
                .content(content)
                .usage(LlmUsage.of(10, 5))
                .finishReason("stop")
                .build();
    }

    private static final class ScriptedLlm implements LlmPort {

        private final Deque<Function<LlmRequest, CompletableFuture<LlmResponse>>> script = new ArrayDeque<>();
        private final List<LlmRequest> requests = new ArrayList<>();

        ScriptedLlm then(LlmResponse response) {
            script.add(request -> CompletableFuture.completedFuture(response));
            return this;
        }

        ScriptedLlm thenReturn(CompletableFuture<LlmResponse> future) {
            script.add(request -> future);
            return this;
        }

        ScriptedLlm thenFail(RuntimeException error) {
            script.add(request -> CompletableFuture.failedFuture(error));
            return this;
        }

        @Override
        public String getProviderId() {
            return "scripted";
        }

        @Override
        public CompletableFuture<LlmResponse> chat(LlmRequest request) {
            requests.add(request);
            if (script.isEmpty()) {
                return CompletableFuture.failedFuture(new IllegalStateException("script exhausted"));
            }
            return script.poll().apply(request);
        }

        @Override
        public boolean isAvailable() {
            return true;
        }
    }

    private static final class StubTool implements ToolComponent {

        private final String name;
        private final Function<Map<String, Object>, CompletableFuture<ToolResult>> behavior;
        private final AtomicInteger calls = new AtomicInteger();

        StubTool(String name, Function<Map<String, Object>, CompletableFuture<ToolResult>> behavior) {
            this.name = name;
            this.behavior = behavior;
        }

        @Override
        public ToolDefinition getDefinition() {
            return ToolDefinition.simple(name, "Test tool " + name);
        }

        @Override
        public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
            calls.incrementAndGet();
            return behavior.apply(parameters);
        }
    }
}
