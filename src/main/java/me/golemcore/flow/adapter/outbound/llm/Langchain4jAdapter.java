package me.golemcore.flow.adapter.outbound.llm;

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

import me.golemcore.flow.domain.model.LlmRequest;
import me.golemcore.flow.domain.model.LlmResponse;
import me.golemcore.flow.domain.model.LlmUsage;
import me.golemcore.flow.domain.model.Message;
import me.golemcore.flow.domain.model.ToolDefinition;
import me.golemcore.flow.domain.system.LlmErrorClassifier;
import me.golemcore.flow.infrastructure.config.FlowProperties;
import me.golemcore.flow.port.outbound.LlmPort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * LLM adapter using the langchain4j library.
 *
 * <p>
 * Supports OpenAI (and any OpenAI-compatible endpoint via {@code base-url}) and
 * Anthropic. The provider comes from {@code flow.llm.provider} unless the
 * workflow model carries a {@code provider/} prefix. Rate limits are retried
 * here with exponential backoff; every other failure is surfaced to the
 * orchestrator unchanged.
 *
 * <p>
 * Several tool calls returned in one response are parallel calls by
 * construction of both APIs and are flagged as independent.
 */
@Component
@Slf4j
public class Langchain4jAdapter implements LlmPort {

    /**
     * Max retry attempts for rate limit errors (exponential backoff).
     */
    private static final int MAX_RETRIES = 5;
    private static final long INITIAL_BACKOFF_MS = 5_000;
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String PROVIDER_OPENAI = "openai";
    private static final String PROVIDER_NONE = "none";
    private static final String SCHEMA_KEY_PROPERTIES = "properties";
    private static final Pattern RESET_SECONDS_PATTERN = Pattern.compile("\"reset_seconds\"\\s*:\\s*(\\d+)");
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final FlowProperties properties;
    private final ObjectMapper objectMapper;
    private final Map<String, ChatModel> models = new ConcurrentHashMap<>();
    private final long initialBackoffMs;

    @Autowired
    public Langchain4jAdapter(FlowProperties properties, ObjectMapper objectMapper) {
        this(properties, objectMapper, INITIAL_BACKOFF_MS);
    }

    // Visible for testing
    Langchain4jAdapter(FlowProperties properties, ObjectMapper objectMapper, long initialBackoffMs) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.initialBackoffMs = initialBackoffMs;
    }

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public boolean isAvailable() {
        String provider = properties.getLlm().getProvider();
        if (provider == null || PROVIDER_NONE.equals(provider)) {
            return false;
        }
        FlowProperties.ProviderProperties config = properties.getLlm().getProviders().get(provider);
        return config != null && config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            ChatModel model = modelFor(request);
            List<ChatMessage> messages = convertMessages(request);
            List<ToolSpecification> tools = convertTools(request);

            for (int attempt = 0; attempt <= MAX_RETRIES; attempt++) {
                try {
                    ChatRequest.Builder chatRequest = ChatRequest.builder().messages(messages);
                    if (!tools.isEmpty()) {
                        log.trace("[LLM] Calling model with {} tools", tools.size());
                        chatRequest.toolSpecifications(tools);
                    }
                    return convertResponse(model.chat(chatRequest.build()), request);
                } catch (RuntimeException e) {
                    if (isRateLimitError(e) && attempt < MAX_RETRIES) {
                        backoff(e, attempt);
                    } else {
                        log.error("[LLM] Chat failed: {}", e.getMessage());
                        throw e;
                    }
                }
            }
            throw new IllegalStateException(LlmErrorClassifier.withCode(LlmErrorClassifier.RATE_LIMIT,
                    "LLM chat failed: max retries exhausted"));
        });
    }

    private void backoff(Throwable e, int attempt) {
        long exponentialBackoffMs = (long) (initialBackoffMs * Math.pow(BACKOFF_MULTIPLIER, attempt));
        long resetSeconds = extractResetSeconds(e);
        long backoffMs = resetSeconds > 0
                ? Math.max(resetSeconds * 1000 + 1000, exponentialBackoffMs)
                : exponentialBackoffMs;
        log.warn("[LLM] Rate limit hit (attempt {}/{}), retrying in {}ms{}...",
                attempt + 1, MAX_RETRIES, backoffMs,
                resetSeconds > 0 ? " (server requested " + resetSeconds + "s)" : "");
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("LLM chat interrupted during retry backoff", ie);
        }
    }

    // ==================== MODELS ====================

    private ChatModel modelFor(LlmRequest request) {
        FlowProperties.LlmProperties llm = properties.getLlm();
        String requested = request.getModel() != null ? request.getModel() : llm.getModel();
        String provider = llm.getProvider();
        String modelName = requested;
        int slash = requested.indexOf('/');
        if (slash > 0) {
            provider = requested.substring(0, slash);
            modelName = requested.substring(slash + 1);
        }

        if (provider == null || PROVIDER_NONE.equals(provider)) {
            throw new IllegalStateException(LlmErrorClassifier.withCode(LlmErrorClassifier.NOT_CONFIGURED,
                    "No LLM provider configured. Set flow.llm.provider"));
        }
        FlowProperties.ProviderProperties config = llm.getProviders().get(provider);
        if (config == null || config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new IllegalStateException(LlmErrorClassifier.withCode(LlmErrorClassifier.NOT_CONFIGURED,
                    "Provider not configured: " + provider + ". Add flow.llm.providers." + provider + ".api-key"));
        }

        double temperature = request.getTemperature() != null ? request.getTemperature() : llm.getTemperature();
        int maxTokens = request.getMaxTokens() != null ? request.getMaxTokens() : llm.getMaxTokens();
        String key = provider + "/" + modelName + "@" + temperature + "#" + maxTokens;
        String resolvedProvider = provider;
        String resolvedName = modelName;
        return models.computeIfAbsent(key, k -> createModel(resolvedProvider, resolvedName, config, temperature,
                maxTokens));
    }

    private ChatModel createModel(String provider, String modelName, FlowProperties.ProviderProperties config,
            double temperature, int maxTokens) {
        Duration timeout = Duration.ofMillis(properties.getLlm().getTimeoutMs());
        log.info("[LLM] Creating {} model {}", provider, modelName);
        if (PROVIDER_ANTHROPIC.equals(provider)) {
            AnthropicChatModel.AnthropicChatModelBuilder builder = AnthropicChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(modelName)
                    .maxRetries(0) // Retry handled by our backoff logic
                    .maxTokens(maxTokens)
                    .temperature(temperature)
                    .timeout(timeout);
            if (config.getBaseUrl() != null) {
                builder.baseUrl(config.getBaseUrl());
            }
            return builder.build();
        }

        if (!PROVIDER_OPENAI.equals(provider)) {
            log.debug("[LLM] Treating provider '{}' as OpenAI-compatible", provider);
        }
        OpenAiChatModel.OpenAiChatModelBuilder builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .maxRetries(0) // Retry handled by our backoff logic
                .maxTokens(maxTokens)
                .temperature(temperature)
                .timeout(timeout);
        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    private boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            // langchain4j maps HTTP 429 to RateLimitException regardless of body content
            if (current instanceof dev.langchain4j.exception.RateLimitException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    /**
     * Extract reset_seconds from a rate limit error JSON body. Returns -1 if not
     * found.
     */
    private long extractResetSeconds(Throwable e) {
        Throwable current = e;
        while (current != null) {
            String msg = current.getMessage();
            if (msg != null && msg.contains("reset_seconds")) {
                Matcher matcher = RESET_SECONDS_PATTERN.matcher(msg);
                if (matcher.find()) {
                    return Long.parseLong(matcher.group(1));
                }
            }
            current = current.getCause();
        }
        return -1;
    }

    // ==================== CONVERSION ====================

    List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();

        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }

        // Tool call ids and names are passed through as-is; malformed tool exchanges
        // are flattened upstream by the conversation view builder.
        for (Message msg : request.getMessages()) {
            String content = msg.getContent() != null ? msg.getContent() : "";
            switch (msg.getRole()) {
            case Message.ROLE_USER -> messages.add(UserMessage.from(content));
            case Message.ROLE_ASSISTANT -> {
                if (msg.hasToolCalls()) {
                    List<ToolExecutionRequest> toolRequests = msg.getToolCalls().stream()
                            .map(tc -> ToolExecutionRequest.builder()
                                    .id(tc.getId())
                                    .name(tc.getName())
                                    .arguments(convertArgsToJson(tc.getArguments()))
                                    .build())
                            .toList();
                    messages.add(content.isBlank()
                            ? AiMessage.from(toolRequests)
                            : AiMessage.from(content, toolRequests));
                } else {
                    messages.add(AiMessage.from(content));
                }
            }
            case Message.ROLE_TOOL -> messages.add(ToolExecutionResultMessage.from(
                    msg.getToolCallId(),
                    msg.getToolName(),
                    content));
            case Message.ROLE_SYSTEM -> messages.add(SystemMessage.from(content));
            default -> {
                log.warn("[LLM] Unknown message role: {}, treating as user message", msg.getRole());
                messages.add(UserMessage.from(content));
            }
            }
        }

        return messages;
    }

    private List<ToolSpecification> convertTools(LlmRequest request) {
        if (request.getTools() == null || request.getTools().isEmpty()) {
            return Collections.emptyList();
        }
        return request.getTools().stream()
                .map(this::convertToolDefinition)
                .toList();
    }

    @SuppressWarnings("unchecked")
    ToolSpecification convertToolDefinition(ToolDefinition tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());

        if (tool.getInputSchema() != null) {
            Map<String, Object> schema = tool.getInputSchema();
            Map<String, Object> schemaProperties = (Map<String, Object>) schema.get(SCHEMA_KEY_PROPERTIES);
            List<String> required = (List<String>) schema.get("required");

            if (schemaProperties != null) {
                JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
                for (Map.Entry<String, Object> entry : schemaProperties.entrySet()) {
                    schemaBuilder.addProperty(entry.getKey(), toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
                if (required != null && !required.isEmpty()) {
                    schemaBuilder.required(required);
                }
                builder.parameters(schemaBuilder.build());
            }
        }

        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String type = (String) paramSchema.get("type");
        String description = (String) paramSchema.get("description");
        boolean described = description != null && !description.isBlank();
        List<String> enumValues = (List<String>) paramSchema.get("enum");

        if (enumValues != null && !enumValues.isEmpty()) {
            JsonEnumSchema.Builder builder = JsonEnumSchema.builder().enumValues(enumValues);
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }

        switch (type != null ? type : "string") {
        case "integer" -> {
            JsonIntegerSchema.Builder builder = JsonIntegerSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        case "number" -> {
            JsonNumberSchema.Builder builder = JsonNumberSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        case "boolean" -> {
            JsonBooleanSchema.Builder builder = JsonBooleanSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder();
            if (described) {
                builder.description(description);
            }
            if (paramSchema.containsKey("items")) {
                builder.items(toJsonSchemaElement((Map<String, Object>) paramSchema.get("items")));
            }
            return builder.build();
        }
        case "object" -> {
            JsonObjectSchema.Builder builder = JsonObjectSchema.builder();
            if (described) {
                builder.description(description);
            }
            if (paramSchema.containsKey(SCHEMA_KEY_PROPERTIES)) {
                Map<String, Object> nestedProps = (Map<String, Object>) paramSchema.get(SCHEMA_KEY_PROPERTIES);
                for (Map.Entry<String, Object> entry : nestedProps.entrySet()) {
                    builder.addProperty(entry.getKey(), toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
            }
            return builder.build();
        }
        default -> {
            // strings and unknown types
            JsonStringSchema.Builder builder = JsonStringSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        }
    }

    LlmResponse convertResponse(ChatResponse response, LlmRequest request) {
        AiMessage aiMessage = response.aiMessage();
        String model = request.getModel();

        List<Message.ToolCall> toolCalls = null;
        if (aiMessage.hasToolExecutionRequests()) {
            toolCalls = aiMessage.toolExecutionRequests().stream()
                    .map(ter -> Message.ToolCall.builder()
                            .id(ter.id())
                            .name(ter.name())
                            .arguments(parseJsonArgs(ter.arguments()))
                            .build())
                    .toList();
            log.trace("[LLM] Parsed {} tool calls from response", toolCalls.size());
        }

        LlmUsage usage = null;
        if (response.tokenUsage() != null) {
            usage = LlmUsage.builder()
                    .inputTokens(nullToZero(response.tokenUsage().inputTokenCount()))
                    .outputTokens(nullToZero(response.tokenUsage().outputTokenCount()))
                    .totalTokens(nullToZero(response.tokenUsage().totalTokenCount()))
                    .model(model)
                    .build();
        }

        return LlmResponse.builder()
                .content(aiMessage.text())
                .toolCalls(toolCalls)
                .independentToolCalls(areIndependent(toolCalls, request.getTools()))
                .usage(usage)
                .model(model)
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .build();
    }

    /**
     * Providers never say whether the calls of one turn depend on each other, so
     * a batch counts as independent only when every called tool is read-only.
     */
    static boolean areIndependent(List<Message.ToolCall> toolCalls, List<ToolDefinition> offered) {
        if (toolCalls == null || toolCalls.size() < 2 || offered == null) {
            return false;
        }
        Set<String> readOnly = offered.stream()
                .filter(ToolDefinition::isReadOnly)
                .map(ToolDefinition::getName)
                .collect(Collectors.toSet());
        return toolCalls.stream().allMatch(call -> readOnly.contains(call.getName()));
    }

    private static int nullToZero(Integer value) {
        return value != null ? value : 0;
    }

    private String convertArgsToJson(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (JsonProcessingException e) {
            log.warn("[LLM] Failed to serialize tool arguments: {}", e.getMessage());
            return "{}";
        }
    }

    private Map<String, Object> parseJsonArgs(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE_REF);
        } catch (JsonProcessingException e) {
            log.warn("[LLM] Failed to parse tool arguments: {}", e.getMessage());
            return Collections.emptyMap();
        }
    }
}
