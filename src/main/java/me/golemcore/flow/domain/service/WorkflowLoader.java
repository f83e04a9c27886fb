package me.golemcore.flow.domain.service;

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

import me.golemcore.flow.domain.exception.WorkflowFileException;
import me.golemcore.flow.domain.model.WorkflowDefinition;
import me.golemcore.flow.domain.model.WorkflowInput;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads workflow files: YAML frontmatter between {@code ---} fences followed by
 * the markdown task body.
 *
 * <pre>
 * ---
 * name: hello
 * model: openai/gpt-4o
 * tools: [file-write]
 * input:
 *   default: { greeting: hi }
 *   schema:
 *     target: { type: string, required: true, default: world }
 * config: { temperature: 0.2, maxOutputTokens: 2000 }
 * ---
 * Write {{greeting}} to {{target}}.txt
 * </pre>
 */
@Service
@Slf4j
public class WorkflowLoader {

    private static final String SUPPRESS_UNCHECKED = "unchecked";
    private static final Pattern FRONTMATTER_PATTERN = Pattern.compile(
            "^---\\s*\\n(.*?)\\n---\\s*\\n?(.*)$", Pattern.DOTALL);
    private static final String PROMPT_SUFFIX = ".prompt.md";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public WorkflowDefinition load(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new WorkflowFileException("Workflow file not found: " + file);
        }
        try {
            String source = Files.readString(file, StandardCharsets.UTF_8);
            return parse(source, file.toAbsolutePath().normalize().toString());
        } catch (IOException e) {
            throw new WorkflowFileException("Failed to read workflow file: " + file, e);
        }
    }

    @SuppressWarnings(SUPPRESS_UNCHECKED)
    public WorkflowDefinition parse(String source, String filePath) {
        String normalized = source.replace("\r\n", "\n");
        Matcher matcher = FRONTMATTER_PATTERN.matcher(normalized);

        Map<String, Object> frontmatter = new LinkedHashMap<>();
        String body = normalized;
        if (matcher.matches()) {
            body = matcher.group(2);
            try {
                Map<String, Object> yaml = yamlMapper.readValue(matcher.group(1), Map.class);
                if (yaml != null) {
                    frontmatter = yaml;
                }
            } catch (IOException e) {
                throw new WorkflowFileException("Invalid workflow frontmatter in " + filePath + ": "
                        + e.getMessage(), e);
            }
        }

        Map<String, Object> input = asMap(frontmatter.get("input"));
        Map<String, Object> config = asMap(frontmatter.get("config"));
        Map<String, Object> metadata = asMap(frontmatter.get("metadata"));

        WorkflowDefinition definition = WorkflowDefinition.builder()
                .name(stringOr(frontmatter.get("name"), nameFromPath(filePath)))
                .filePath(filePath)
                .source(source)
                .template(body.trim())
                .description(stringOr(metadata.get("description"), null))
                .model(stringOr(frontmatter.get("model"), null))
                .temperature(asDouble(config.get("temperature")))
                .maxOutputTokens(asInteger(config.get("maxOutputTokens")))
                .declaredTools(parseTools(frontmatter.get("tools")))
                .inputDefaults(new LinkedHashMap<>(asMap(input.get("default"))))
                .inputSchema(parseSchema(asMap(input.get("schema"))))
                .build();

        log.debug("[Flow] Loaded workflow '{}' with tools {}", definition.getName(), definition.getDeclaredTools());
        return definition;
    }

    private List<String> parseTools(Object value) {
        List<String> tools = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item != null && !item.toString().isBlank() && !tools.contains(item.toString().trim())) {
                    tools.add(item.toString().trim());
                }
            }
        } else if (value instanceof String single && !single.isBlank()) {
            for (String part : single.split(",")) {
                if (!part.isBlank()) {
                    tools.add(part.trim());
                }
            }
        }
        return tools;
    }

    private Map<String, WorkflowInput> parseSchema(Map<String, Object> schema) {
        Map<String, WorkflowInput> inputs = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : schema.entrySet()) {
            Map<String, Object> def = asMap(entry.getValue());
            inputs.put(entry.getKey(), WorkflowInput.builder()
                    .name(entry.getKey())
                    .type(stringOr(def.get("type"), "string"))
                    .description(stringOr(def.get("description"), ""))
                    .required(Boolean.TRUE.equals(def.get("required")))
                    .defaultValue(def.get("default"))
                    .build());
        }
        return inputs;
    }

    @SuppressWarnings(SUPPRESS_UNCHECKED)
    private static Map<String, Object> asMap(Object value) {
        return value instanceof Map ? (Map<String, Object>) value : Map.of();
    }

    private static String stringOr(Object value, String fallback) {
        return value != null ? value.toString() : fallback;
    }

    private static Double asDouble(Object value) {
        return value instanceof Number number ? number.doubleValue() : null;
    }

    private static Integer asInteger(Object value) {
        return value instanceof Number number ? number.intValue() : null;
    }

    private static String nameFromPath(String filePath) {
        if (filePath == null) {
            return "unnamed";
        }
        String fileName = Path.of(filePath).getFileName().toString();
        if (fileName.endsWith(PROMPT_SUFFIX)) {
            return fileName.substring(0, fileName.length() - PROMPT_SUFFIX.length());
        }
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
