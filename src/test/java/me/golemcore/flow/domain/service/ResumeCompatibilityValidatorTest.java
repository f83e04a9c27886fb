package me.golemcore.flow.domain.service;

import me.golemcore.flow.domain.model.CompatibilityResult;
import me.golemcore.flow.domain.model.CompletedTool;
import me.golemcore.flow.domain.model.ResumeSnapshot;
import me.golemcore.flow.domain.model.WorkflowMetadata;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ResumeCompatibilityValidatorTest {

    private static final String ORIGINAL = "---\nname: review\ntools: [file-read]\n---\n"
            + "Review the authentication module and list every security issue you find.";
    private static final Set<String> CATALOG = Set.of("file-read", "file-write");

    private final ResumeCompatibilityValidator validator = new ResumeCompatibilityValidator(0.6);

    private static ResumeSnapshot snapshot(List<CompletedTool> tools) {
        return ResumeSnapshot.builder()
                .workflowMetadata(WorkflowMetadata.builder()
                        .id("wf-1")
                        .workflowHash(ContentHasher.sha256(ORIGINAL))
                        .originalContent(ORIGINAL)
                        .availableTools(new ArrayList<>(List.of("file-read")))
                        .build())
                .completedTools(new ArrayList<>(tools))
                .build();
    }

    private static CompletedTool used(String name, boolean success) {
        return CompletedTool.builder()
                .functionName(name)
                .parameters(Map.of())
                .result("ok")
                .executedAt(Instant.parse("2026-01-01T00:00:00Z"))
                .success(success)
                .build();
    }

    // ==================== Hash ====================

    @Test
    void shouldScoreOneWhenContentUnchanged() {
        CompatibilityResult result = validator.validate(snapshot(List.of(used("file-read", true))), ORIGINAL, CATALOG);

        assertTrue(result.isCanResume());
        assertEquals(1.0, result.getScore());
        assertEquals(1.0, result.getSimilarity());
        assertTrue(result.getWarnings().isEmpty());
    }

    // ==================== Similarity ====================

    @Test
    void shouldBeMonotonicInEditSize() {
        ResumeSnapshot snapshot = snapshot(List.of());
        double small = validator.validate(snapshot, ORIGINAL + " Be brief.", CATALOG).getScore();
        double large = validator.validate(snapshot, ORIGINAL + " Be brief. Also review the payment module "
                + "and the session handling code thoroughly.", CATALOG).getScore();

        assertTrue(small < 1.0);
        assertTrue(large < small);
    }

    @Test
    void shouldRefuseResumeForLargelyRewrittenWorkflow() {
        String rewritten = "---\nname: docs\n---\nWrite onboarding documentation for new engineers.";

        CompatibilityResult result = validator.validate(snapshot(List.of()), rewritten, CATALOG);

        assertFalse(result.isCanResume());
        assertTrue(result.getSimilarity() < 0.5);
        assertTrue(result.isRequiresAdaptation());
        assertTrue(result.getMigrationStrategies().containsKey(ResumeCompatibilityValidator.STRATEGY_RESET_WORKFLOW));
        assertTrue(result.getMigrationStrategies()
                .containsKey(ResumeCompatibilityValidator.STRATEGY_PARTIAL_CONTEXT));
        assertTrue(result.getWarnings().get(0).contains("changed significantly"));
    }

    // ==================== Tools ====================

    @Test
    void shouldPenalizeMissingToolOnce() {
        ResumeSnapshot snapshot = snapshot(List.of(used("file-read", true), used("file-read", true)));

        CompatibilityResult result = validator.validate(snapshot, ORIGINAL, Set.of("file-write"));

        assertEquals(0.7, result.getScore(), 1e-9);
        assertTrue(result.isCanResume());
        assertEquals(List.of("file-read"), result.getUnavailableTools());
        assertEquals(1, result.getWarnings().size());
    }

    @Test
    void shouldIgnoreFailedCallsWhenCheckingTools() {
        ResumeSnapshot snapshot = snapshot(List.of(used("shell", false)));

        CompatibilityResult result = validator.validate(snapshot, ORIGINAL, CATALOG);

        assertEquals(1.0, result.getScore());
        assertTrue(result.getUnavailableTools().isEmpty());
    }

    @Test
    void shouldCombineSimilarityAndToolPenaltyBelowThreshold() {
        ResumeSnapshot snapshot = snapshot(List.of(used("file-read", true)));
        String edited = ORIGINAL.replace("list every security issue you find", "summarize the design");

        CompatibilityResult withTool = validator.validate(snapshot, edited, CATALOG);
        CompatibilityResult withoutTool = validator.validate(snapshot, edited, Set.of());

        assertEquals(withTool.getScore() * 0.7, withoutTool.getScore(), 1e-9);
    }
}
