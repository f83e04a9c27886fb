package me.golemcore.flow.domain.service;

import me.golemcore.flow.domain.model.ChatHistory;
import me.golemcore.flow.domain.model.CompletedTool;
import me.golemcore.flow.domain.model.ContextChange;
import me.golemcore.flow.domain.model.ContextEvolution;
import me.golemcore.flow.domain.model.ExecutionContext;
import me.golemcore.flow.domain.model.HistoryEntry;
import me.golemcore.flow.domain.model.Message;
import me.golemcore.flow.domain.model.RestoredExecution;
import me.golemcore.flow.domain.model.ResumeSnapshot;
import me.golemcore.flow.domain.model.WorkflowMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResumeStateCodecTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");
    private static final String WORKFLOW_ID = "workflow_review_20260301_100000_abcd1234";

    private ResumeStateCodec codec;

    @BeforeEach
    void setUp() {
        codec = new ResumeStateCodec(ResumeLimits.defaults(), new DefaultVariableImportanceScorer(),
                new InsightExtractor());
    }

    private static WorkflowMetadata metadata() {
        return WorkflowMetadata.builder()
                .id(WORKFLOW_ID)
                .filePath("/work/review.prompt.md")
                .workflowHash("hash")
                .originalContent("Review the code")
                .startedAt(T0)
                .lastCheckpoint(T0.plusSeconds(60))
                .status("running")
                .availableTools(new ArrayList<>(List.of("file-read")))
                .build();
    }

    private static ChatHistory conversation(int exchanges) {
        ChatHistory history = new ChatHistory();
        history.append(Message.builder().id("u0").role(Message.ROLE_USER).content("Review the code")
                .timestamp(T0).build());
        for (int i = 0; i < exchanges; i++) {
            String callId = "call-" + i;
            history.append(Message.builder()
                    .id("a" + i)
                    .role(Message.ROLE_ASSISTANT)
                    .content(i == 0 ? "I discovered that the auth module stores plain passwords" : null)
                    .toolCalls(List.of(Message.ToolCall.builder()
                            .id(callId)
                            .name("file-read")
                            .arguments(Map.of("path", "file" + i + ".java"))
                            .build()))
                    .timestamp(T0.plusSeconds(i))
                    .build());
            history.append(Message.builder()
                    .id("t" + i)
                    .role(Message.ROLE_TOOL)
                    .toolCallId(callId)
                    .toolName("file-read")
                    .content("content " + i)
                    .timestamp(T0.plusSeconds(i))
                    .build());
        }
        return history;
    }

    private static CompletedTool tool(int i, boolean success) {
        return CompletedTool.builder()
                .functionName("file-read")
                .parameters(Map.of("path", "file" + i))
                .result("r" + i)
                .executedAt(T0.plusSeconds(i))
                .success(success)
                .build();
    }

    // ==================== Round trip ====================

    @Test
    void shouldRestoreNewestMessagesExactly() {
        ChatHistory history = conversation(15); // 31 messages
        ExecutionContext context = ExecutionContext.builder().workflowId(WORKFLOW_ID).startTime(T0).build();

        ResumeSnapshot snapshot = codec.toSnapshot(context, history, metadata());
        RestoredExecution restored = codec.fromSnapshot(snapshot);

        List<Message> expected = history.tail(20);
        List<Message> actual = restored.history().messages();
        assertEquals(20, actual.size());
        for (int i = 0; i < expected.size(); i++) {
            assertEquals(expected.get(i).getId(), actual.get(i).getId());
            assertEquals(expected.get(i).getRole(), actual.get(i).getRole());
            assertEquals(expected.get(i).getContent(), actual.get(i).getContent());
            assertEquals(expected.get(i).getToolCallId(), actual.get(i).getToolCallId());
            assertEquals(expected.get(i).getToolCalls(), actual.get(i).getToolCalls());
        }
    }

    @Test
    void shouldRestoreVariablesToolsAndStartTime() {
        ExecutionContext context = ExecutionContext.builder()
                .workflowId(WORKFLOW_ID)
                .startTime(T0)
                .variables(new LinkedHashMap<>(Map.of("target", "auth")))
                .completedTools(new ArrayList<>(List.of(tool(1, true), tool(2, false))))
                .build();

        RestoredExecution restored = codec.fromSnapshot(codec.toSnapshot(context, conversation(1), metadata()));

        ExecutionContext ctx = restored.context();
        assertEquals(WORKFLOW_ID, ctx.getWorkflowId());
        assertEquals(Map.of("target", "auth"), ctx.getVariables());
        assertEquals(2, ctx.getCompletedTools().size());
        assertEquals(T0, ctx.getStartTime());
        assertEquals(2, ctx.getExecutionHistory().size());
        assertEquals(HistoryEntry.TYPE_TOOL, ctx.getExecutionHistory().get(0).getStepType());
        assertFalse(ctx.getExecutionHistory().get(1).isSuccess());
    }

    @Test
    void shouldNotMutateLiveState() {
        ExecutionContext context = ExecutionContext.builder().workflowId(WORKFLOW_ID).build();
        for (int i = 0; i < 40; i++) {
            context.getVariables().put("var" + i, i);
        }
        ChatHistory history = conversation(15);

        codec.toSnapshot(context, history, metadata());

        assertEquals(40, context.getVariables().size());
        assertEquals(31, history.size());
    }

    // ==================== Pruning ====================

    @Test
    void shouldBoundEverySection() {
        ExecutionContext context = ExecutionContext.builder().workflowId(WORKFLOW_ID).build();
        for (int i = 0; i < 60; i++) {
            context.addCompletedTool(tool(i, true));
        }
        for (int i = 0; i < 40; i++) {
            context.getVariables().put("var" + i, i);
        }
        ContextEvolution evolution = context.getContextEvolution();
        for (int i = 0; i < 15; i++) {
            evolution.addInsight("Insight number " + i);
        }
        for (int i = 0; i < 25; i++) {
            evolution.addChange(ContextChange.builder().key("var" + i).newValue(i).timestamp(T0).build());
        }

        ResumeSnapshot snapshot = codec.toSnapshot(context, conversation(30), metadata());

        assertEquals(50, snapshot.getCompletedTools().size());
        assertEquals(20, snapshot.getChatHistory().size());
        assertEquals(30, snapshot.getWorkflowVariables().size());
        assertEquals(10, snapshot.getContextEvolution().getKeyInsights().size());
        assertEquals(20, snapshot.getContextEvolution().getChanges().size());
        assertEquals("var5", snapshot.getContextEvolution().getChanges().get(0).getKey());
        assertEquals(snapshot.getWorkflowVariables(), snapshot.getContextEvolution().getCurrentContext());
    }

    @Test
    void shouldDropFailedToolsBeforeSuccessfulOnes() {
        List<CompletedTool> tools = new ArrayList<>();
        for (int i = 0; i < 52; i++) {
            tools.add(tool(i, i != 10 && i != 20));
        }

        List<CompletedTool> pruned = codec.pruneCompletedTools(tools);

        assertEquals(50, pruned.size());
        assertTrue(pruned.stream().allMatch(CompletedTool::isSuccess));
        assertEquals("r0", pruned.get(0).getResult());
    }

    @Test
    void shouldDropOldestWhenAllSucceeded() {
        List<CompletedTool> tools = new ArrayList<>();
        for (int i = 0; i < 55; i++) {
            tools.add(tool(i, true));
        }

        List<CompletedTool> pruned = codec.pruneCompletedTools(tools);

        assertEquals("r5", pruned.get(0).getResult());
        assertEquals("r54", pruned.get(49).getResult());
    }

    @Test
    void shouldKeepImportantVariablesInOriginalOrder() {
        Map<String, Object> variables = new LinkedHashMap<>();
        for (int i = 0; i < 30; i++) {
            variables.put("noise" + i, "x");
        }
        variables.put("project_path", "/repo");
        variables.put("findings", "found a critical error");

        Map<String, Object> pruned = codec.pruneVariables(variables, new ContextEvolution());

        assertEquals(30, pruned.size());
        assertTrue(pruned.containsKey("project_path"));
        assertTrue(pruned.containsKey("findings"));
        assertFalse(pruned.containsKey("noise29"));
        assertEquals("noise0", pruned.keySet().iterator().next());
    }

    // ==================== Metadata ====================

    @Test
    void shouldSummarizeDroppedMessagesIntoInsights() {
        ExecutionContext context = ExecutionContext.builder().workflowId(WORKFLOW_ID).build();

        ResumeSnapshot snapshot = codec.toSnapshot(context, conversation(15), metadata());

        List<String> insights = snapshot.getContextEvolution().getKeyInsights();
        assertTrue(insights.contains("I discovered that the auth module stores plain passwords"));
        assertTrue(insights.stream().anyMatch(s -> s.startsWith("Earlier conversation (11 messages) called tools: file-read")));
    }

    @Test
    void shouldDetectPhaseAndKeepMetadata() {
        ExecutionContext context = ExecutionContext.builder()
                .workflowId(WORKFLOW_ID)
                .variables(new LinkedHashMap<>(Map.of(ResumePhaseDetector.PHASE_VARIABLE, "reporting")))
                .build();

        WorkflowMetadata stored = codec.toSnapshot(context, conversation(1), metadata()).getWorkflowMetadata();

        assertEquals("reporting", stored.getCurrentPhase());
        assertEquals("hash", stored.getWorkflowHash());
        assertEquals(List.of("file-read"), stored.getAvailableTools());
        assertNotNull(stored.getCurrentStrategy());
    }
}
