package me.golemcore.flow.adapter.inbound.cli;

import me.golemcore.flow.domain.exception.ResumeStateStorageException;
import me.golemcore.flow.domain.exception.WorkflowFileException;
import me.golemcore.flow.domain.model.CancellationToken;
import me.golemcore.flow.domain.model.CompatibilityResult;
import me.golemcore.flow.domain.model.ExecutionErrorKind;
import me.golemcore.flow.domain.model.ExecutionResult;
import me.golemcore.flow.domain.model.RetentionPolicy;
import me.golemcore.flow.domain.model.SnapshotSummary;
import me.golemcore.flow.domain.model.ValidationResult;
import me.golemcore.flow.domain.model.WorkflowDefinition;
import me.golemcore.flow.domain.service.WorkflowLoader;
import me.golemcore.flow.domain.system.execution.WorkflowOrchestrator;
import me.golemcore.flow.infrastructure.config.FlowProperties;
import me.golemcore.flow.port.outbound.ResumeStatePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FlowCommandRunnerTest {

    private static final String FILE = "greeter.prompt.md";
    private static final String ABSOLUTE_FILE = "/work/greeter.prompt.md";
    private static final String WF = "workflow_greeter_20260510_120000_0a1b2c3d";

    @Mock
    private WorkflowOrchestrator orchestrator;

    @Mock
    private WorkflowLoader workflowLoader;

    @Mock
    private ResumeStatePort resumeStatePort;

    @Mock
    private ResumeStatePort.ExecutionLock lock;

    private final ByteArrayOutputStream outBuffer = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBuffer = new ByteArrayOutputStream();
    private FlowCommandRunner runner;
    private WorkflowDefinition workflow;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        runner = new FlowCommandRunner(orchestrator, workflowLoader, resumeStatePort, new FlowProperties(),
                new PrintStream(outBuffer, true, StandardCharsets.UTF_8),
                new PrintStream(errBuffer, true, StandardCharsets.UTF_8));
        workflow = WorkflowDefinition.builder().name("greeter").filePath(ABSOLUTE_FILE).source("src").build();
        when(workflowLoader.load(Path.of(FILE))).thenReturn(workflow);
        when(resumeStatePort.tryLock(anyString())).thenReturn(Optional.of(lock));
    }

    private int dispatch(String... args) {
        return runner.dispatch(new DefaultApplicationArguments(args));
    }

    private String out() {
        return outBuffer.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return errBuffer.toString(StandardCharsets.UTF_8);
    }

    private static ExecutionResult success(String output) {
        return ExecutionResult.builder().success(true).finalOutput(output).iterations(2).totalTokens(120).build();
    }

    private static SnapshotSummary summary(String id, String filePath) {
        return new SnapshotSummary(id, filePath, Instant.parse("2026-05-10T12:00:00Z"), "investigating", "failed",
                3, 2048);
    }

    // ==================== DISPATCH ====================

    @Test
    void shouldPrintUsageWithoutCommand() {
        assertEquals(FlowExitCodes.INVALID_ARGUMENTS, dispatch());
        assertTrue(err().contains("Usage:"));
    }

    @Test
    void shouldRejectUnknownCommand() {
        assertEquals(FlowExitCodes.INVALID_ARGUMENTS, dispatch("deploy", FILE));
        assertTrue(err().contains("Unknown command: deploy"));
    }

    // ==================== RUN ====================

    @Test
    void shouldRunWorkflowWithVariablesUnderLock() {
        when(orchestrator.generateWorkflowId(workflow)).thenReturn(WF);
        when(orchestrator.execute(eq(workflow), eq(Map.of("target", "world", "tone", "a=b")), eq(WF),
                any(CancellationToken.class))).thenReturn(success("Greeting written."));

        int code = dispatch("run", FILE, "--var=target=world", "--var=tone=a=b");

        assertEquals(FlowExitCodes.SUCCESS, code);
        assertTrue(out().contains("Workflow id: " + WF));
        assertTrue(out().contains("Greeting written."));
        assertTrue(out().contains("Completed in 2 iteration(s), 120 tokens"));
        verify(lock).close();
    }

    @Test
    void shouldUseExplicitWorkflowId() {
        when(orchestrator.execute(any(), anyMap(), eq("custom-id"), any())).thenReturn(success("ok"));

        assertEquals(FlowExitCodes.SUCCESS, dispatch("run", FILE, "--workflow-id=custom-id"));
        verify(orchestrator, never()).generateWorkflowId(any());
    }

    @Test
    void shouldRefuseWhenWorkflowIsAlreadyRunning() {
        when(orchestrator.generateWorkflowId(workflow)).thenReturn(WF);
        when(resumeStatePort.tryLock(WF)).thenReturn(Optional.empty());

        assertEquals(FlowExitCodes.GENERAL_ERROR, dispatch("run", FILE));
        assertTrue(err().contains("already being executed"));
        verify(orchestrator, never()).execute(any(), anyMap(), anyString(), any());
    }

    @Test
    void shouldMapFailureKindToExitCode() {
        when(orchestrator.generateWorkflowId(workflow)).thenReturn(WF);
        when(orchestrator.execute(any(), anyMap(), eq(WF), any())).thenReturn(ExecutionResult.builder()
                .success(false)
                .errorKind(ExecutionErrorKind.TIMEOUT)
                .errorMessage("Execution timed out after PT30M")
                .build());

        assertEquals(FlowExitCodes.TIMEOUT, dispatch("run", FILE));
        assertTrue(err().contains("FAILED [TIMEOUT]: Execution timed out after PT30M"));
        verify(lock).close();
    }

    @Test
    void shouldRejectMalformedVariable() {
        assertEquals(FlowExitCodes.INVALID_ARGUMENTS, dispatch("run", FILE, "--var=novalue"));
        assertTrue(err().contains("expected key=value"));
    }

    @Test
    void shouldRejectMissingWorkflowFile() {
        when(workflowLoader.load(Path.of("missing.prompt.md")))
                .thenThrow(new WorkflowFileException("Workflow file not found: missing.prompt.md"));

        assertEquals(FlowExitCodes.INVALID_ARGUMENTS, dispatch("run", "missing.prompt.md"));
        assertTrue(err().contains("Workflow file not found"));
    }

    @Test
    void shouldRequireWorkflowFileArgument() {
        assertEquals(FlowExitCodes.INVALID_ARGUMENTS, dispatch("validate"));
        assertTrue(err().contains("Missing <workflow-file>"));
    }

    // ==================== RESUME ====================

    @Test
    void shouldResumeExplicitIdWithForceAndReportCompatibility() {
        when(orchestrator.resume(eq(WF), eq(workflow), eq(true), any())).thenReturn(ExecutionResult.builder()
                .success(true)
                .finalOutput("done")
                .compatibility(CompatibilityResult.builder()
                        .canResume(false)
                        .score(0.42)
                        .warnings(List.of("Workflow content changed significantly (similarity 0.42)"))
                        .build())
                .build());

        int code = dispatch("resume", FILE, "--workflow-id=" + WF, "--force");

        assertEquals(FlowExitCodes.SUCCESS, code);
        assertTrue(out().contains("(forced)"));
        assertTrue(out().contains("Compatibility score: 0.42"));
        assertTrue(out().contains("WARNING: Workflow content changed significantly"));
    }

    @Test
    void shouldPickTheOnlySnapshotForTheFile() {
        when(resumeStatePort.list()).thenReturn(List.of(summary("other", "/work/other.prompt.md"),
                summary(WF, ABSOLUTE_FILE)));
        when(orchestrator.resume(eq(WF), eq(workflow), eq(false), any())).thenReturn(success("done"));

        assertEquals(FlowExitCodes.SUCCESS, dispatch("resume", FILE));
        verify(orchestrator).resume(eq(WF), eq(workflow), eq(false), any());
    }

    @Test
    void shouldAskForIdWhenSeveralSnapshotsMatch() {
        when(resumeStatePort.list()).thenReturn(List.of(summary(WF, ABSOLUTE_FILE),
                summary(WF + "x", ABSOLUTE_FILE)));

        assertEquals(FlowExitCodes.INVALID_ARGUMENTS, dispatch("resume", FILE));
        assertTrue(err().contains("choose one with --workflow-id"));
        verify(orchestrator, never()).resume(anyString(), any(), anyBoolean(), any());
    }

    @Test
    void shouldMapIncompatibleResumeToWorkflowInvalid() {
        when(orchestrator.resume(eq(WF), eq(workflow), eq(false), any())).thenReturn(ExecutionResult.builder()
                .success(false)
                .errorKind(ExecutionErrorKind.RESUME_INCOMPATIBLE)
                .errorMessage("Workflow changed too much")
                .build());

        assertEquals(FlowExitCodes.WORKFLOW_INVALID, dispatch("resume", FILE, "--workflow-id=" + WF));
    }

    @Test
    void shouldListStoredSnapshots() {
        when(resumeStatePort.list()).thenReturn(List.of(summary(WF, ABSOLUTE_FILE)));

        assertEquals(FlowExitCodes.SUCCESS, dispatch("resume", "--list"));
        assertTrue(out().contains("WORKFLOW ID"));
        assertTrue(out().contains(WF));
        assertTrue(out().contains("investigating"));
    }

    @Test
    void shouldCleanExpiredSnapshots() {
        when(resumeStatePort.cleanup(any(RetentionPolicy.class))).thenReturn(2);

        assertEquals(FlowExitCodes.SUCCESS, dispatch("resume", "--clean"));
        assertTrue(out().contains("Removed 2 expired resume state(s)"));
    }

    @Test
    void shouldReportMissingStateOnTargetedClean() {
        when(resumeStatePort.delete(WF)).thenReturn(false);

        assertEquals(FlowExitCodes.INVALID_ARGUMENTS, dispatch("resume", "--clean", "--workflow-id=" + WF));
        assertTrue(out().contains("No resume state for " + WF));
    }

    @Test
    void shouldMapStorageFailureToPermissionError() {
        when(resumeStatePort.list()).thenThrow(new ResumeStateStorageException("Permission denied"));

        assertEquals(FlowExitCodes.PERMISSION_ERROR, dispatch("resume", "--list"));
        assertTrue(err().contains("Permission denied"));
    }

    // ==================== VALIDATE ====================

    @Test
    void shouldPrintValidationFindings() {
        when(orchestrator.validate(workflow)).thenReturn(new ValidationResult(
                List.of("Declared tool 'teleport' is not available"), List.of("Workflow body is empty")));

        assertEquals(FlowExitCodes.VALIDATION_ERROR, dispatch("validate", FILE));
        assertTrue(err().contains("ERROR: Declared tool 'teleport' is not available"));
        assertTrue(out().contains("WARNING: Workflow body is empty"));
    }

    @Test
    void shouldAcceptValidWorkflow() {
        when(orchestrator.validate(workflow)).thenReturn(new ValidationResult(List.of(), List.of()));

        assertEquals(FlowExitCodes.SUCCESS, dispatch("validate", FILE));
        assertTrue(out().contains("Workflow is valid: greeter"));
    }

    // ==================== ARGUMENTS ====================

    @Test
    void shouldParseVariablesKeepingLastValue() {
        Map<String, Object> variables = FlowCommandRunner.parseVariables(List.of("a=1", "b=", "a=2"));

        assertEquals(Map.of("a", "2", "b", ""), variables);
        assertTrue(FlowCommandRunner.parseVariables(null).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> FlowCommandRunner.parseVariables(List.of("=x")));
    }
}
