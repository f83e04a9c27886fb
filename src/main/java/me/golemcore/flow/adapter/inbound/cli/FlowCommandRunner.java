package me.golemcore.flow.adapter.inbound.cli;

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

import me.golemcore.flow.domain.exception.ResumeStateStorageException;
import me.golemcore.flow.domain.exception.WorkflowFileException;
import me.golemcore.flow.domain.model.CancellationToken;
import me.golemcore.flow.domain.model.CompatibilityResult;
import me.golemcore.flow.domain.model.ExecutionResult;
import me.golemcore.flow.domain.model.RetentionPolicy;
import me.golemcore.flow.domain.model.SnapshotSummary;
import me.golemcore.flow.domain.model.ValidationResult;
import me.golemcore.flow.domain.model.WorkflowDefinition;
import me.golemcore.flow.domain.service.WorkflowLoader;
import me.golemcore.flow.domain.system.execution.WorkflowOrchestrator;
import me.golemcore.flow.infrastructure.config.FlowProperties;
import me.golemcore.flow.port.outbound.ResumeStatePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Command line entry point.
 *
 * <ul>
 * <li>{@code run <workflow-file> [--var=key=value]... [--workflow-id=id]}
 * <li>{@code resume <workflow-file> [--workflow-id=id] [--force]}
 * <li>{@code resume --list} / {@code resume --clean [--workflow-id=id]}
 * <li>{@code validate <workflow-file>}
 * </ul>
 *
 * <p>
 * Runs and resumes hold the per-id lock for their whole duration. A JVM
 * shutdown hook cancels the running execution and waits for its final
 * checkpoint.
 */
@Component
@Slf4j
public class FlowCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final String CMD_RUN = "run";
    private static final String CMD_RESUME = "resume";
    private static final String CMD_VALIDATE = "validate";
    private static final String OPT_VAR = "var";
    private static final String OPT_WORKFLOW_ID = "workflow-id";
    private static final String OPT_FORCE = "force";
    private static final String OPT_LIST = "list";
    private static final String OPT_CLEAN = "clean";
    private static final long SHUTDOWN_GRACE_SECONDS = 10;
    private static final String USAGE = """
            Usage:
              run <workflow-file> [--var=key=value]... [--workflow-id=id]
              resume <workflow-file> [--workflow-id=id] [--force]
              resume --list
              resume --clean [--workflow-id=id]
              validate <workflow-file>""";

    private final WorkflowOrchestrator orchestrator;
    private final WorkflowLoader workflowLoader;
    private final ResumeStatePort resumeStatePort;
    private final FlowProperties properties;
    private final PrintStream out;
    private final PrintStream err;

    private int exitCode = FlowExitCodes.SUCCESS;

    @Autowired
    public FlowCommandRunner(WorkflowOrchestrator orchestrator, WorkflowLoader workflowLoader,
            ResumeStatePort resumeStatePort, FlowProperties properties) {
        this(orchestrator, workflowLoader, resumeStatePort, properties, System.out, System.err);
    }

    FlowCommandRunner(WorkflowOrchestrator orchestrator, WorkflowLoader workflowLoader,
            ResumeStatePort resumeStatePort, FlowProperties properties, PrintStream out, PrintStream err) {
        this.orchestrator = orchestrator;
        this.workflowLoader = workflowLoader;
        this.resumeStatePort = resumeStatePort;
        this.properties = properties;
        this.out = out;
        this.err = err;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = dispatch(args);
        log.debug("[CLI] Exit code {}", exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int dispatch(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.isEmpty()) {
            err.println(USAGE);
            return FlowExitCodes.INVALID_ARGUMENTS;
        }
        String command = positional.get(0);
        try {
            return switch (command) {
            case CMD_RUN -> runWorkflow(args);
            case CMD_RESUME -> resumeWorkflow(args);
            case CMD_VALIDATE -> validateWorkflow(args);
            default -> {
                err.println("Unknown command: " + command);
                err.println(USAGE);
                yield FlowExitCodes.INVALID_ARGUMENTS;
            }
            };
        } catch (WorkflowFileException | IllegalArgumentException e) {
            log.debug("[CLI] Rejected arguments: {}", e.getMessage());
            err.println(e.getMessage());
            return FlowExitCodes.INVALID_ARGUMENTS;
        } catch (ResumeStateStorageException e) {
            log.error("[CLI] Resume storage failure", e);
            err.println(e.getMessage());
            return FlowExitCodes.PERMISSION_ERROR;
        }
    }

    // ==================== COMMANDS ====================

    private int runWorkflow(ApplicationArguments args) {
        WorkflowDefinition workflow = workflowLoader.load(requireWorkflowFile(args));
        Map<String, Object> variables = parseVariables(args.getOptionValues(OPT_VAR));
        String workflowId = singleOption(args, OPT_WORKFLOW_ID)
                .orElseGet(() -> orchestrator.generateWorkflowId(workflow));

        out.println("Workflow id: " + workflowId);
        return runLocked(workflowId, token -> orchestrator.execute(workflow, variables, workflowId, token));
    }

    private int resumeWorkflow(ApplicationArguments args) {
        if (args.containsOption(OPT_LIST)) {
            printSnapshots(resumeStatePort.list());
            return FlowExitCodes.SUCCESS;
        }
        if (args.containsOption(OPT_CLEAN)) {
            return clean(args);
        }

        WorkflowDefinition workflow = workflowLoader.load(requireWorkflowFile(args));
        Optional<String> explicitId = singleOption(args, OPT_WORKFLOW_ID);
        String workflowId;
        if (explicitId.isPresent()) {
            workflowId = explicitId.get();
        } else {
            List<SnapshotSummary> matching = resumeStatePort.list().stream()
                    .filter(s -> workflow.getFilePath().equals(s.filePath()))
                    .toList();
            if (matching.size() != 1) {
                err.println(matching.isEmpty()
                        ? "No resumable state found for " + workflow.getFilePath()
                        : "Several resumable states found for " + workflow.getFilePath()
                                + "; choose one with --workflow-id");
                printSnapshots(matching);
                return FlowExitCodes.INVALID_ARGUMENTS;
            }
            workflowId = matching.get(0).workflowId();
        }

        boolean force = args.containsOption(OPT_FORCE);
        out.println("Resuming workflow id: " + workflowId + (force ? " (forced)" : ""));
        return runLocked(workflowId, token -> orchestrator.resume(workflowId, workflow, force, token));
    }

    private int clean(ApplicationArguments args) {
        Optional<String> workflowId = singleOption(args, OPT_WORKFLOW_ID);
        if (workflowId.isPresent()) {
            boolean deleted = resumeStatePort.delete(workflowId.get());
            out.println(deleted ? "Deleted resume state " + workflowId.get()
                    : "No resume state for " + workflowId.get());
            return deleted ? FlowExitCodes.SUCCESS : FlowExitCodes.INVALID_ARGUMENTS;
        }
        int removed = resumeStatePort.cleanup(RetentionPolicy.ofDays(properties.getResume().getRetentionDays()));
        out.println("Removed " + removed + " expired resume state(s)");
        return FlowExitCodes.SUCCESS;
    }

    private int validateWorkflow(ApplicationArguments args) {
        WorkflowDefinition workflow = workflowLoader.load(requireWorkflowFile(args));
        ValidationResult validation = orchestrator.validate(workflow);
        validation.errors().forEach(e -> err.println("ERROR: " + e));
        validation.warnings().forEach(w -> out.println("WARNING: " + w));
        out.println(validation.valid() ? "Workflow is valid: " + workflow.getName()
                : "Workflow has " + validation.errors().size() + " error(s)");
        return FlowExitCodes.forValidation(validation);
    }

    // ==================== EXECUTION ====================

    private int runLocked(String workflowId, Function<CancellationToken, ExecutionResult> body) {
        Optional<ResumeStatePort.ExecutionLock> acquired = resumeStatePort.tryLock(workflowId);
        if (acquired.isEmpty()) {
            err.println("Workflow " + workflowId + " is already being executed by another process");
            return FlowExitCodes.GENERAL_ERROR;
        }
        try (ResumeStatePort.ExecutionLock lock = acquired.get()) {
            CancellationToken token = new CancellationToken();
            ExecutionResult result = withShutdownHook(workflowId, token, () -> body.apply(token));
            report(result);
            return FlowExitCodes.forResult(result);
        }
    }

    private ExecutionResult withShutdownHook(String workflowId, CancellationToken token,
            Supplier<ExecutionResult> body) {
        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            log.warn("[CLI] Shutdown requested, cancelling workflow {}", workflowId);
            token.cancel();
            try {
                if (!finished.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                    log.warn("[CLI] Workflow {} did not stop within {}s", workflowId, SHUTDOWN_GRACE_SECONDS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "flow-shutdown-" + workflowId);
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            return body.get();
        } finally {
            finished.countDown();
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                log.debug("[CLI] JVM already shutting down, hook stays registered");
            }
        }
    }

    private void report(ExecutionResult result) {
        CompatibilityResult compatibility = result.getCompatibility();
        if (compatibility != null) {
            out.printf(Locale.ROOT, "Compatibility score: %.2f%n", compatibility.getScore());
            compatibility.getWarnings().forEach(w -> out.println("WARNING: " + w));
        }
        if (result.isSuccess()) {
            out.println(result.getFinalOutput() != null ? result.getFinalOutput() : "");
            out.printf(Locale.ROOT, "Completed in %d iteration(s), %d tokens%n", result.getIterations(),
                    result.getTotalTokens());
        } else {
            err.println("FAILED [" + result.getErrorKind() + "]: " + result.getErrorMessage());
        }
    }

    private void printSnapshots(List<SnapshotSummary> snapshots) {
        if (snapshots.isEmpty()) {
            out.println("No resume states stored");
            return;
        }
        out.printf("%-60s %-10s %-14s %-6s %s%n", "WORKFLOW ID", "STATUS", "PHASE", "TOOLS", "LAST ACTIVITY");
        for (SnapshotSummary s : snapshots) {
            out.printf("%-60s %-10s %-14s %-6d %s%n", s.workflowId(), s.status(), s.currentPhase(),
                    s.completedToolCount(), s.lastActivity());
        }
    }

    // ==================== ARGUMENTS ====================

    private Path requireWorkflowFile(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.size() < 2) {
            throw new IllegalArgumentException("Missing <workflow-file> argument\n" + USAGE);
        }
        return Path.of(positional.get(1));
    }

    private Optional<String> singleOption(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        String value = values.get(values.size() - 1);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("--" + name + " requires a value");
        }
        return Optional.of(value);
    }

    static Map<String, Object> parseVariables(List<String> values) {
        Map<String, Object> variables = new LinkedHashMap<>();
        if (values == null) {
            return variables;
        }
        for (String value : values) {
            int eq = value.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("Invalid --var '" + value + "', expected key=value");
            }
            variables.put(value.substring(0, eq).trim(), value.substring(eq + 1));
        }
        return variables;
    }
}
