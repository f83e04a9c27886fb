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
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Writes or appends text to a workspace file, creating parent directories. The
 * written path is published as the {@code last_written_file} workflow variable.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FileWriteTool implements ToolComponent {

    static final String NAME = "file-write";
    static final String LAST_WRITTEN_FILE = "last_written_file";

    private final WorkspacePathResolver workspace;

    @Override
    public boolean isEnabled() {
        return workspace.isEnabled();
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Write text content to a file in the workspace. "
                        + "Paths are relative to the workspace root.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "path", Map.of(
                                        "type", "string",
                                        "description", "File path (relative to workspace)"),
                                "content", Map.of(
                                        "type", "string",
                                        "description", "Content to write"),
                                "append", Map.of(
                                        "type", "boolean",
                                        "description", "Append to file instead of overwriting (default: false)")),
                        "required", List.of("path", "content")))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            Object pathParam = parameters.get("path");
            Object contentParam = parameters.get("content");
            if (!(pathParam instanceof String pathStr) || !(contentParam instanceof String content)) {
                return ToolResult.failure("Missing required parameters: path and content");
            }
            Optional<Path> resolved = workspace.resolve(pathStr);
            if (resolved.isEmpty()) {
                return ToolResult.failure("Invalid path: must be within workspace");
            }
            Path path = resolved.get();
            boolean append = Boolean.TRUE.equals(parameters.get("append"));

            try {
                Path parent = path.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                if (append) {
                    Files.writeString(path, content, StandardCharsets.UTF_8,
                            StandardOpenOption.CREATE, StandardOpenOption.APPEND);
                } else {
                    Files.writeString(path, content, StandardCharsets.UTF_8);
                }

                String relative = workspace.relativize(path);
                long size = Files.size(path);
                log.info("[Tools] {} {} ({} bytes, append={})", NAME, relative, size, append);
                return ToolResult.builder()
                        .success(true)
                        .output("Successfully " + (append ? "appended to" : "written to") + " file: " + relative)
                        .data(Map.of("path", relative, "size", size))
                        .contextVariables(Map.of(LAST_WRITTEN_FILE, relative))
                        .build();
            } catch (IOException e) {
                return ToolResult.failure("Failed to write file: " + e.getMessage());
            }
        });
    }
}
