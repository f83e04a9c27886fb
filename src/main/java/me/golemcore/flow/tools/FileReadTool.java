package me.golemcore.flow.tools;

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

import me.golemcore.flow.domain.component.ToolComponent;
import me.golemcore.flow.domain.model.ToolDefinition;
import me.golemcore.flow.domain.model.ToolResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Reads a UTF-8 text file from the workspace (max 10 MB).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FileReadTool implements ToolComponent {

    static final String NAME = "file-read";
    private static final long MAX_FILE_SIZE = 10 * 1024 * 1024;

    private final WorkspacePathResolver workspace;

    @Override
    public boolean isEnabled() {
        return workspace.isEnabled();
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Read a text file from the workspace. Paths are relative to the workspace root.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "path", Map.of(
                                        "type", "string",
                                        "description", "File path (relative to workspace)")),
                        "required", List.of("path")))
                .readOnly(true)
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            Object pathParam = parameters.get("path");
            if (!(pathParam instanceof String pathStr)) {
                return ToolResult.failure("Missing required parameter: path");
            }
            Optional<Path> resolved = workspace.resolve(pathStr);
            if (resolved.isEmpty()) {
                return ToolResult.failure("Invalid path: must be within workspace");
            }
            Path path = resolved.get();
            log.debug("[Tools] {} {}", NAME, path);

            if (!Files.isRegularFile(path)) {
                return ToolResult.failure("File not found: " + pathStr);
            }
            try {
                long size = Files.size(path);
                if (size > MAX_FILE_SIZE) {
                    return ToolResult.failure("File too large (max " + (MAX_FILE_SIZE / 1024 / 1024) + " MB)");
                }
                String content = Files.readString(path, StandardCharsets.UTF_8);
                return ToolResult.success(content, Map.of(
                        "path", workspace.relativize(path),
                        "size", size,
                        "lines", content.lines().count()));
            } catch (IOException e) {
                return ToolResult.failure("Failed to read file: " + e.getMessage());
            }
        });
    }
}
