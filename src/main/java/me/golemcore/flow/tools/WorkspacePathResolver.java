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

import me.golemcore.flow.infrastructure.config.FlowProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Sandbox shared by the file tools. Paths are resolved against the workspace
 * root; anything that normalizes or links outside of it is rejected.
 *
 * <p>
 * Configuration: {@code flow.tools.filesystem.workspace},
 * {@code flow.tools.filesystem.enabled}
 */
@Component
@Slf4j
public class WorkspacePathResolver {

    private final Path workspaceRoot;
    private final boolean enabled;

    public WorkspacePathResolver(FlowProperties properties) {
        FlowProperties.FileSystemToolProperties config = properties.getTools().getFilesystem();
        this.enabled = config.isEnabled();
        this.workspaceRoot = Paths.get(config.getWorkspace()).toAbsolutePath().normalize();
        if (enabled) {
            try {
                Files.createDirectories(workspaceRoot);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to create workspace directory: " + workspaceRoot, e);
            }
        }
        log.info("[Tools] File tools workspace: {}, enabled: {}", workspaceRoot, enabled);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Path getWorkspaceRoot() {
        return workspaceRoot;
    }

    /**
     * Resolves a workspace-relative path.
     *
     * @return the resolved path, or empty if it escapes the workspace
     */
    public Optional<Path> resolve(String pathStr) {
        if (pathStr == null || pathStr.isBlank()) {
            return Optional.empty();
        }
        try {
            Path resolved = workspaceRoot.resolve(pathStr).normalize();
            if (!resolved.startsWith(workspaceRoot)) {
                log.warn("[Tools] Path outside workspace blocked: {}", pathStr);
                return Optional.empty();
            }

            // Follow symlinks to prevent symlink escape
            Path existing = resolved;
            while (existing != null && !Files.exists(existing)) {
                existing = existing.getParent();
            }
            if (existing != null) {
                Path realPath = existing.toRealPath();
                Path realWorkspace = workspaceRoot.toRealPath();
                if (!realPath.startsWith(realWorkspace)) {
                    log.warn("[Tools] Symlink escape blocked: {} -> {}", resolved, realPath);
                    return Optional.empty();
                }
            }
            return Optional.of(resolved);
        } catch (InvalidPathException e) {
            log.debug("[Tools] Invalid path '{}': {}", pathStr, e.getMessage());
            return Optional.empty();
        } catch (IOException e) {
            log.warn("[Tools] Failed to resolve real path for {}: {}", pathStr, e.getMessage());
            return Optional.empty();
        }
    }

    public String relativize(Path path) {
        String relative = workspaceRoot.relativize(path).toString();
        return relative.isEmpty() ? "." : relative;
    }
}
