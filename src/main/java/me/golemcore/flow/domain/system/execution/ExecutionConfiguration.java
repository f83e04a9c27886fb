package me.golemcore.flow.domain.system.execution;

import me.golemcore.flow.domain.service.ConversationStore;
import me.golemcore.flow.domain.service.InsightExtractor;
import me.golemcore.flow.domain.service.ResumeCompatibilityValidator;
import me.golemcore.flow.domain.service.ResumeStateCodec;
import me.golemcore.flow.domain.service.ToolRegistry;
import me.golemcore.flow.domain.service.WorkflowTemplateEngine;
import me.golemcore.flow.domain.service.WorkflowVariableResolver;
import me.golemcore.flow.infrastructure.config.FlowProperties;
import me.golemcore.flow.port.outbound.LlmPort;
import me.golemcore.flow.port.outbound.ResumeStatePort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/** Spring wiring for the workflow orchestrator (domain loop + ports). */
@Configuration
public class ExecutionConfiguration {

    @Bean
    public ToolExecutorPort toolExecutorPort(ToolRegistry toolRegistry, FlowProperties properties) {
        return new RegistryToolExecutor(toolRegistry, properties.getExecution().getMaxToolResultChars());
    }

    @Bean
    public HistoryWriter historyWriter(Clock clock) {
        return new DefaultHistoryWriter(clock);
    }

    @Bean
    public ConversationViewBuilder conversationViewBuilder() {
        return new DefaultConversationViewBuilder();
    }

    @Bean
    public CheckpointService checkpointService(ResumeStateCodec codec, ResumeStatePort resumeStatePort,
            ConversationStore conversationStore, Clock clock) {
        return new CheckpointService(codec, resumeStatePort, conversationStore, clock);
    }

    @Bean
    public ResumeContextBuilder resumeContextBuilder(Clock clock) {
        return new ResumeContextBuilder(clock);
    }

    @Bean
    public WorkflowOrchestrator workflowOrchestrator(LlmPort llmPort, ToolExecutorPort toolExecutorPort,
            HistoryWriter historyWriter, ConversationViewBuilder viewBuilder, ToolRegistry toolRegistry,
            WorkflowTemplateEngine templateEngine, WorkflowVariableResolver variableResolver,
            CheckpointService checkpointService, ResumeContextBuilder resumeContextBuilder,
            ResumeStatePort resumeStatePort, ResumeStateCodec codec,
            ResumeCompatibilityValidator compatibilityValidator, InsightExtractor insightExtractor,
            FlowProperties properties, Clock clock) {
        return new DefaultWorkflowOrchestrator(llmPort, toolExecutorPort, historyWriter, viewBuilder, toolRegistry,
                templateEngine, variableResolver, checkpointService, resumeContextBuilder, resumeStatePort, codec,
                compatibilityValidator, insightExtractor, properties, clock);
    }
}
