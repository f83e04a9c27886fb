package me.golemcore.flow.domain.system.execution;

import me.golemcore.flow.domain.model.ChatHistory;
import me.golemcore.flow.domain.model.ExecutionState;
import me.golemcore.flow.domain.model.ResumeSnapshot;
import me.golemcore.flow.domain.model.WorkflowMetadata;
import me.golemcore.flow.domain.service.ContentHasher;
import me.golemcore.flow.domain.service.ConversationStore;
import me.golemcore.flow.domain.service.ResumeStateCodec;
import me.golemcore.flow.port.outbound.ResumeStatePort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Optional;

/**
 * Flushes a run to durable storage: live state goes through the codec into the
 * resume state store, and the conversation store receives the current history
 * until the run completes.
 *
 * <p>
 * Write failures propagate as
 * {@link me.golemcore.flow.domain.exception.ResumeStateStorageException}.
 */
public class CheckpointService {

    private static final Logger log = LoggerFactory.getLogger(CheckpointService.class);

    private final ResumeStateCodec codec;
    private final ResumeStatePort resumeStatePort;
    private final ConversationStore conversationStore;
    private final Clock clock;

    public CheckpointService(ResumeStateCodec codec, ResumeStatePort resumeStatePort,
            ConversationStore conversationStore, Clock clock) {
        this.codec = codec;
        this.resumeStatePort = resumeStatePort;
        this.conversationStore = conversationStore;
        this.clock = clock;
    }

    public Instant checkpoint(ExecutionRun run, ExecutionState state) {
        Instant now = clock.instant();
        String source = run.getWorkflow().getSource();
        WorkflowMetadata metadata = WorkflowMetadata.builder()
                .id(run.getWorkflowId())
                .filePath(run.getWorkflow().getFilePath())
                .workflowHash(ContentHasher.sha256(source))
                .originalContent(source)
                .startedAt(run.getStartedAt())
                .lastCheckpoint(now)
                .status(state.statusName())
                .availableTools(new ArrayList<>(run.getAllowedTools()))
                .build();

        ResumeSnapshot snapshot = codec.toSnapshot(run.getContext(), run.getHistory(), metadata);
        if (state == ExecutionState.COMPLETED) {
            conversationStore.remove(run.getWorkflowId());
        } else {
            conversationStore.put(run.getWorkflowId(), run.getHistory());
        }
        resumeStatePort.save(run.getWorkflowId(), snapshot);
        run.setLastCheckpoint(now);
        run.setToolCallsSinceCheckpoint(0);
        log.debug("[Resume] Checkpoint {} ({}, {} messages, {} completed tools)", run.getWorkflowId(),
                metadata.getStatus(), snapshot.getChatHistory().size(), snapshot.getCompletedTools().size());
        return now;
    }

    /**
     * Returns the in-process working copy of an unfinished run. It keeps more of
     * the conversation than the pruned snapshot does.
     */
    public Optional<ChatHistory> workingCopy(String workflowId) {
        return conversationStore.get(workflowId);
    }
}
