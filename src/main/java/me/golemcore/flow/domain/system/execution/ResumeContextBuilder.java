package me.golemcore.flow.domain.system.execution;

import me.golemcore.flow.domain.model.CompletedTool;
import me.golemcore.flow.domain.model.ExecutionContext;
import me.golemcore.flow.domain.model.ResumeSnapshot;
import me.golemcore.flow.domain.model.WorkflowMetadata;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes the system message injected after a restored history, telling the
 * model what was already done so it continues instead of starting over.
 */
public class ResumeContextBuilder {

    static final String HEADER = "WORKFLOW RESUME CONTEXT - CONTINUE FROM WHERE YOU LEFT OFF";

    private static final int MAX_VARIABLES = 5;
    private static final int MAX_RESULT_PREVIEW = 160;
    private static final int MAX_VALUE_PREVIEW = 120;

    private final Clock clock;

    public ResumeContextBuilder(Clock clock) {
        this.clock = clock;
    }

    public String build(ResumeSnapshot snapshot, ExecutionContext context) {
        WorkflowMetadata metadata = snapshot.getWorkflowMetadata();
        Instant now = clock.instant();
        StringBuilder sb = new StringBuilder();
        sb.append(HEADER).append("\n\n");

        sb.append("PREVIOUS SESSION SUMMARY:\n");
        sb.append("- Workflow: ").append(metadata.getId()).append('\n');
        sb.append("- Phase: ").append(orUnknown(metadata.getCurrentPhase())).append('\n');
        sb.append("- Strategy: ").append(orUnknown(metadata.getCurrentStrategy())).append('\n');
        if (metadata.getStartedAt() != null) {
            sb.append("- Started: ").append(formatDuration(Duration.between(metadata.getStartedAt(), now)))
                    .append(" ago\n");
        }
        if (metadata.getLastCheckpoint() != null) {
            sb.append("- Last activity: ")
                    .append(formatDuration(Duration.between(metadata.getLastCheckpoint(), now)))
                    .append(" ago\n");
        }
        sb.append('\n');

        sb.append("COMPLETED WORK (DO NOT REPEAT):\n");
        List<CompletedTool> succeeded = context.getCompletedTools().stream()
                .filter(CompletedTool::isSuccess)
                .toList();
        if (succeeded.isEmpty()) {
            sb.append("- No tools completed yet\n");
        } else {
            Set<String> names = new LinkedHashSet<>();
            succeeded.forEach(tool -> names.add(tool.getFunctionName()));
            sb.append("- Tools used: ").append(String.join(", ", names)).append('\n');
            for (CompletedTool tool : succeeded) {
                sb.append("  - ").append(tool.getFunctionName()).append(": ")
                        .append(preview(tool.getResult(), MAX_RESULT_PREVIEW)).append('\n');
            }
        }
        List<String> insights = context.getContextEvolution().getKeyInsights();
        if (insights != null && !insights.isEmpty()) {
            sb.append("- Discoveries:\n");
            insights.forEach(insight -> sb.append("  - ").append(insight).append('\n'));
        }
        sb.append("- Variables tracked: ").append(context.getVariables().size()).append("\n\n");

        sb.append("CURRENT STATE:\n");
        int shown = 0;
        for (Map.Entry<String, Object> entry : context.getVariables().entrySet()) {
            if (shown++ >= MAX_VARIABLES) {
                break;
            }
            sb.append("- ").append(entry.getKey()).append(": ")
                    .append(preview(String.valueOf(entry.getValue()), MAX_VALUE_PREVIEW)).append('\n');
        }
        if (shown == 0) {
            sb.append("- No variables set\n");
        }
        sb.append('\n');

        sb.append("RESUME INSTRUCTION:\n");
        sb.append("Continue the workflow naturally from where it stopped. Do not repeat the completed work "
                + "listed above; build on its results and proceed to the next step.");
        return sb.toString();
    }

    static String formatDuration(Duration duration) {
        if (duration.isNegative()) {
            duration = Duration.ZERO;
        }
        long days = duration.toDays();
        long hours = duration.toHoursPart();
        long minutes = duration.toMinutesPart();
        if (days > 0) {
            return days + "d " + hours + "h";
        }
        if (hours > 0) {
            return hours + "h " + minutes + "m";
        }
        if (minutes > 0) {
            return minutes + "m";
        }
        return duration.toSecondsPart() + "s";
    }

    private static String preview(String text, int max) {
        if (text == null) {
            return "";
        }
        String singleLine = text.replace('\n', ' ').trim();
        return singleLine.length() <= max ? singleLine : singleLine.substring(0, max) + "...";
    }

    private static String orUnknown(String value) {
        return value == null || value.isBlank() ? "unknown" : value;
    }
}
