package me.golemcore.flow.domain.service;

import me.golemcore.flow.domain.model.CompletedTool;
import me.golemcore.flow.domain.model.Message;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResumePhaseDetectorTest {

    private static Message assistant(String content) {
        return Message.builder().role(Message.ROLE_ASSISTANT).content(content).build();
    }

    private static List<CompletedTool> succeeded(int count) {
        return Collections.nCopies(count, CompletedTool.builder().functionName("file-read").success(true).build());
    }

    @Test
    void shouldPreferExplicitPhaseVariable() {
        String phase = ResumePhaseDetector.detectPhase(Map.of(ResumePhaseDetector.PHASE_VARIABLE, "testing"),
                List.of(assistant("Let me review this")), List.of());
        assertEquals("testing", phase);
    }

    @Test
    void shouldInferPhaseFromRecentMessages() {
        assertEquals("investigating", ResumePhaseDetector.detectPhase(Map.of(),
                List.of(assistant("I will explore the repository")), List.of()));
        assertEquals("analyzing", ResumePhaseDetector.detectPhase(Map.of(),
                List.of(assistant("Now I review the results")), List.of()));
        assertEquals("working", ResumePhaseDetector.detectPhase(Map.of(),
                List.of(assistant("Reading files")), List.of()));
    }

    @Test
    void shouldFallBackToCompletedToolCount() {
        assertEquals("understanding", ResumePhaseDetector.detectPhase(Map.of(), List.of(), succeeded(0)));
        assertEquals("investigating", ResumePhaseDetector.detectPhase(Map.of(), List.of(), succeeded(2)));
        assertEquals("analyzing", ResumePhaseDetector.detectPhase(Map.of(), List.of(), succeeded(5)));
        assertEquals("finalizing", ResumePhaseDetector.detectPhase(Map.of(), List.of(), succeeded(8)));
    }

    @Test
    void shouldExtractStrategyAroundIndicator() {
        String strategy = ResumePhaseDetector.detectStrategy(List.of(
                assistant("My approach is to read the controllers first")));
        assertTrue(strategy.contains("approach is to read the controllers first"));
    }

    @Test
    void shouldReturnDefaultStrategyWithoutIndicators() {
        assertEquals(ResumePhaseDetector.DEFAULT_STRATEGY,
                ResumePhaseDetector.detectStrategy(List.of(assistant("Done"))));
    }
}
