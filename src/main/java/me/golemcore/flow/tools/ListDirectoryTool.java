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
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Lists a workspace directory, limited to 100 entries sorted by name.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ListDirectoryTool implements ToolComponent {

    static final String NAME = "list-directory";
    private static final int MAX_FILES_LIST = 100;

    private final WorkspacePathResolver workspace;

    @Override
    public boolean isEnabled() {
        return workspace.isEnabled();
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("List files and directories in the workspace.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "path", Map.of(
                                        "type", "string",
                                        "description", "Directory path (relative to workspace, default: .)"))))
                .readOnly(true)
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            Object pathParam = parameters.get("path");
            String pathStr = pathParam instanceof String s && !s.isBlank() ? s : ".";
            Optional<Path> resolved = workspace.resolve(pathStr);
            if (resolved.isEmpty()) {
                return ToolResult.failure("Invalid path: must be within workspace");
            }
            Path path = resolved.get();
            if (!Files.isDirectory(path)) {
                return ToolResult.failure("Directory not found: " + pathStr);
            }

            try (Stream<Path> stream = Files.list(path)) {
                List<Path> children = stream
                        .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                        .limit(MAX_FILES_LIST)
                        .toList();

                List<Map<String, Object>> entries = new ArrayList<>();
                StringBuilder sb = new StringBuilder();
                sb.append("Directory: ").append(workspace.relativize(path)).append("\n");
                sb.append("Entries: ").append(children.size()).append("\n\n");
                for (Path child : children) {
                    BasicFileAttributes attrs = Files.readAttributes(child, BasicFileAttributes.class);
                    String name = child.getFileName().toString();
                    if (attrs.isDirectory()) {
                        sb.append("[DIR]  ").append(name).append("/\n");
                    } else {
                        sb.append("[FILE] ").append(name).append(" (").append(attrs.size()).append(" B)\n");
                    }
                    entries.add(Map.of(
                            "name", name,
                            "type", attrs.isDirectory() ? "directory" : "file",
                            "size", attrs.size()));
                }
                return ToolResult.success(sb.toString(), Map.of(
                        "path", workspace.relativize(path),
                        "entries", entries));
            } catch (IOException e) {
                return ToolResult.failure("Failed to list directory: " + e.getMessage());
            }
        });
    }
}
