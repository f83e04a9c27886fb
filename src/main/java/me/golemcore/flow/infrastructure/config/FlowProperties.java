package me.golemcore.flow.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Centralized configuration properties for the workflow engine, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code flow.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - chat-completion provider settings</li>
 * <li>{@link ExecutionProperties} - tool-calling loop limits</li>
 * <li>{@link ResumeProperties} - resume state storage and pruning</li>
 * <li>{@link ConversationProperties} - in-memory conversation cache</li>
 * <li>{@link ToolsProperties} - built-in tools</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "flow")
@Data
public class FlowProperties {

    private LlmProperties llm = new LlmProperties();
    private ExecutionProperties execution = new ExecutionProperties();
    private ResumeProperties resume = new ResumeProperties();
    private ConversationProperties conversation = new ConversationProperties();
    private ToolsProperties tools = new ToolsProperties();

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        /** openai, anthropic or none. */
        private String provider = "openai";
        private String model = "gpt-4o";
        private double temperature = 0.7;
        private int maxTokens = 4000;
        private long timeoutMs = 120_000;
        private Map<String, ProviderProperties> providers = new HashMap<>();
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
    }

    // ==================== EXECUTION ====================

    @Data
    public static class ExecutionProperties {
        private int maxIterations = 25;
        private Duration timeout = Duration.ofMinutes(30);
        private long pollIntervalMs = 100;
        private boolean parallelToolCalls = true;
        private int maxToolResultChars = 20_000;
        private String systemPrompt = "You are executing a workflow. Use the available tools to complete the task, "
                + "then reply with a final answer without tool calls.";
    }

    // ==================== RESUME ====================

    @Data
    public static class ResumeProperties {
        private String storagePath = "./.golemcore-flow/resume";
        private int retentionDays = 7;
        private boolean compressionEnabled = true;
        private int compressionThresholdBytes = 1024 * 1024;
        private int checkpointFrequency = 1;
        private boolean atomicWrites = true;
        private boolean backupEnabled = true;
        private double compatibilityThreshold = 0.6;
        private LimitsProperties limits = new LimitsProperties();
    }

    @Data
    public static class LimitsProperties {
        private int maxCompletedTools = 50;
        private int maxChatMessages = 20;
        private int maxContextVariables = 30;
        private int maxKeyInsights = 10;
        private int maxContextChanges = 20;
    }

    // ==================== CONVERSATION ====================

    @Data
    public static class ConversationProperties {
        private int maxWorkflows = 16;
        private int maxMessages = 500;
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        private FileSystemToolProperties filesystem = new FileSystemToolProperties();
    }

    @Data
    public static class FileSystemToolProperties {
        private boolean enabled = true;
        private String workspace = ".";
    }
}
