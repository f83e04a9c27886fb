package me.golemcore.flow.adapter.outbound.resume;

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

import me.golemcore.flow.domain.exception.ResumeStateStorageException;
import me.golemcore.flow.domain.exception.SnapshotCorruptException;
import me.golemcore.flow.domain.model.ResumeSnapshot;
import me.golemcore.flow.domain.model.RetentionPolicy;
import me.golemcore.flow.domain.model.SnapshotSummary;
import me.golemcore.flow.domain.service.WorkflowIds;
import me.golemcore.flow.infrastructure.config.FlowProperties;
import me.golemcore.flow.port.outbound.ResumeStatePort;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.stream.Stream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Local filesystem implementation of {@link ResumeStatePort}.
 *
 * <p>
 * One JSON document per workflow id, {@code <id>.json}, under
 * {@code flow.resume.storage-path}. Documents larger than the compression
 * threshold are gzipped in place; readers detect gzip by its magic bytes.
 * Transient siblings:
 * <ul>
 * <li>{@code <id>.json.tmp} - new content before the rename
 * <li>{@code <id>.json.backup} - previous content while a write is in flight
 * <li>{@code <id>.lock} - held by the execution currently owning the id
 * </ul>
 * None of them is ever listed as a stored state.
 *
 * @see me.golemcore.flow.port.outbound.ResumeStatePort
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalResumeStateAdapter implements ResumeStatePort {

    private static final String EXTENSION = ".json";
    private static final String TEMP_SUFFIX = ".tmp";
    private static final String BACKUP_SUFFIX = ".backup";
    private static final String LOCK_EXTENSION = ".lock";

    private final FlowProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private Path basePath;

    @PostConstruct
    public void init() {
        String configured = properties.getResume().getStoragePath();
        this.basePath = Paths.get(configured.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
        try {
            Files.createDirectories(basePath);
            log.info("[Resume] State storage initialized at: {}", basePath);
        } catch (IOException e) {
            throw new ResumeStateStorageException("Failed to create resume storage directory: " + basePath, e);
        }
    }

    // ==================== SAVE ====================

    @Override
    public void save(String workflowId, ResumeSnapshot snapshot) {
        Path target = snapshotPath(workflowId);
        byte[] payload = encode(workflowId, snapshot);

        if (!properties.getResume().isAtomicWrites()) {
            try {
                Files.write(target, payload);
                return;
            } catch (IOException e) {
                throw new ResumeStateStorageException("Failed to write resume state: " + workflowId, e);
            }
        }

        Path tempPath = sibling(target, TEMP_SUFFIX);
        Path backupPath = sibling(target, BACKUP_SUFFIX);
        boolean backedUp = false;
        try {
            // 1. Keep the previous state until the new one is in place
            if (properties.getResume().isBackupEnabled() && Files.exists(target)) {
                Files.copy(target, backupPath, StandardCopyOption.REPLACE_EXISTING);
                backedUp = true;
            }

            // 2. Write to temp file with fsync
            try (OutputStream os = Files.newOutputStream(tempPath,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.SYNC);
                    FileChannel channel = FileChannel.open(tempPath, StandardOpenOption.WRITE)) {
                os.write(payload);
                os.flush();
                channel.force(true); // fsync: metadata + data
            }

            // 3. Atomic rename
            try {
                Files.move(tempPath, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("[Resume] Atomic move not supported, using regular move");
                Files.move(tempPath, target, StandardCopyOption.REPLACE_EXISTING);
            }

            // 4. Previous state no longer needed
            if (backedUp) {
                Files.deleteIfExists(backupPath);
            }
            log.debug("[Resume] Saved state {} ({} bytes)", workflowId, payload.length);
        } catch (IOException e) {
            rollback(target, tempPath, backupPath, backedUp);
            throw new ResumeStateStorageException("Atomic write of resume state failed: " + workflowId, e);
        }
    }

    private void rollback(Path target, Path tempPath, Path backupPath, boolean backedUp) {
        if (backedUp) {
            try {
                Files.move(backupPath, target, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException restoreEx) {
                log.warn("[Resume] Failed to restore backup {}: {}", backupPath, restoreEx.getMessage());
            }
        }
        try {
            Files.deleteIfExists(tempPath);
        } catch (IOException cleanupEx) {
            log.warn("[Resume] Failed to cleanup temp file: {}", tempPath);
        }
    }

    private byte[] encode(String workflowId, ResumeSnapshot snapshot) {
        try {
            byte[] json = objectMapper.writeValueAsBytes(snapshot);
            FlowProperties.ResumeProperties resume = properties.getResume();
            if (!resume.isCompressionEnabled() || json.length <= resume.getCompressionThresholdBytes()) {
                return json;
            }
            ByteArrayOutputStream buffer = new ByteArrayOutputStream(json.length / 4);
            try (GZIPOutputStream gzip = new GZIPOutputStream(buffer)) {
                gzip.write(json);
            }
            log.debug("[Resume] Compressed state {}: {} -> {} bytes", workflowId, json.length, buffer.size());
            return buffer.toByteArray();
        } catch (IOException e) {
            throw new ResumeStateStorageException("Failed to serialize resume state: " + workflowId, e);
        }
    }

    // ==================== LOAD ====================

    @Override
    public Optional<ResumeSnapshot> load(String workflowId) {
        Path target = snapshotPath(workflowId);
        Path backupPath = sibling(target, BACKUP_SUFFIX);

        if (!Files.exists(target)) {
            if (Files.exists(backupPath)) {
                return Optional.of(restoreFromBackup(workflowId, target, backupPath, null));
            }
            return Optional.empty();
        }

        try {
            return Optional.of(decode(workflowId, Files.readAllBytes(target)));
        } catch (SnapshotCorruptException e) {
            if (Files.exists(backupPath)) {
                return Optional.of(restoreFromBackup(workflowId, target, backupPath, e));
            }
            throw e;
        } catch (IOException e) {
            throw new ResumeStateStorageException("Failed to read resume state: " + workflowId, e);
        }
    }

    private ResumeSnapshot restoreFromBackup(String workflowId, Path target, Path backupPath,
            SnapshotCorruptException original) {
        try {
            ResumeSnapshot snapshot = decode(workflowId, Files.readAllBytes(backupPath));
            Files.move(backupPath, target, StandardCopyOption.REPLACE_EXISTING);
            log.warn("[Resume] Restored state {} from backup", workflowId);
            return snapshot;
        } catch (SnapshotCorruptException backupCorrupt) {
            if (original != null) {
                original.addSuppressed(backupCorrupt);
                throw original;
            }
            throw backupCorrupt;
        } catch (IOException e) {
            throw new ResumeStateStorageException("Failed to restore resume state from backup: " + workflowId, e);
        }
    }

    ResumeSnapshot decode(String workflowId, byte[] bytes) {
        ResumeSnapshot snapshot;
        try {
            snapshot = objectMapper.readValue(decompress(bytes), ResumeSnapshot.class);
        } catch (IOException e) {
            throw new SnapshotCorruptException(workflowId, "Resume state does not decode: " + e.getMessage(), e);
        }
        if (snapshot == null || snapshot.getWorkflowMetadata() == null || snapshot.workflowId() == null) {
            throw new SnapshotCorruptException(workflowId, "Resume state has no workflow_metadata.id", null);
        }
        if (!workflowId.equals(snapshot.workflowId())) {
            throw new SnapshotCorruptException(workflowId,
                    "Resume state belongs to a different workflow: " + snapshot.workflowId(), null);
        }
        return snapshot;
    }

    private static byte[] decompress(byte[] bytes) throws IOException {
        if (bytes.length < 2 || (bytes[0] & 0xff) != 0x1f || (bytes[1] & 0xff) != 0x8b) {
            return bytes;
        }
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(bytes))) {
            return in.readAllBytes();
        }
    }

    // ==================== CATALOG ====================

    @Override
    public List<SnapshotSummary> list() {
        List<SnapshotSummary> summaries = new ArrayList<>();
        for (Path file : snapshotFiles()) {
            try {
                summaries.add(summarize(file));
            } catch (IOException | RuntimeException e) {
                log.warn("[Resume] Skipping unreadable state file {}: {}", file.getFileName(), e.getMessage());
            }
        }
        summaries.sort(Comparator.comparing(SnapshotSummary::lastActivity,
                Comparator.nullsLast(Comparator.reverseOrder())));
        return summaries;
    }

    private SnapshotSummary summarize(Path file) throws IOException {
        JsonNode root = objectMapper.readTree(decompress(Files.readAllBytes(file)));
        JsonNode metadata = root.path("workflow_metadata");
        String id = metadata.path("id").asText(null);
        if (id == null) {
            throw new IOException("missing workflow_metadata.id");
        }
        return new SnapshotSummary(
                id,
                metadata.path("file_path").asText(null),
                parseInstant(metadata.path("last_checkpoint").asText(null)),
                metadata.path("current_phase").asText(null),
                metadata.path("status").asText(null),
                root.path("completed_tools").size(),
                Files.size(file));
    }

    @Override
    public int cleanup(RetentionPolicy retentionPolicy) {
        Instant cutoff = clock.instant().minus(retentionPolicy.maxAge());
        int deleted = 0;
        for (Path file : snapshotFiles()) {
            Instant lastActivity = lastActivity(file);
            if (lastActivity != null && lastActivity.isBefore(cutoff)) {
                String workflowId = idOf(file);
                if (delete(workflowId)) {
                    deleted++;
                    log.info("[Resume] Removed expired state {} (last activity {})", workflowId, lastActivity);
                }
            }
        }
        deleteStaleSiblings(cutoff);
        return deleted;
    }

    private Instant lastActivity(Path file) {
        try {
            SnapshotSummary summary = summarize(file);
            if (summary.lastActivity() != null) {
                return summary.lastActivity();
            }
        } catch (IOException | RuntimeException e) {
            log.debug("[Resume] Using mtime for unreadable state {}: {}", file.getFileName(), e.getMessage());
        }
        return modifiedAt(file);
    }

    private void deleteStaleSiblings(Instant cutoff) {
        try (Stream<Path> paths = Files.list(basePath)) {
            List<Path> stale = paths
                    .filter(Files::isRegularFile)
                    .filter(p -> isTransient(p.getFileName().toString()))
                    .filter(p -> {
                        Instant modified = modifiedAt(p);
                        return modified != null && modified.isBefore(cutoff);
                    })
                    .toList();
            for (Path path : stale) {
                Files.deleteIfExists(path);
                log.debug("[Resume] Removed stale file {}", path.getFileName());
            }
        } catch (IOException e) {
            throw new ResumeStateStorageException("Failed to clean resume storage: " + basePath, e);
        }
    }

    @Override
    public boolean delete(String workflowId) {
        Path target = snapshotPath(workflowId);
        try {
            boolean existed = Files.deleteIfExists(target);
            Files.deleteIfExists(sibling(target, TEMP_SUFFIX));
            Files.deleteIfExists(sibling(target, BACKUP_SUFFIX));
            releaseIfStale(lockPath(workflowId));
            return existed;
        } catch (IOException e) {
            throw new ResumeStateStorageException("Failed to delete resume state: " + workflowId, e);
        }
    }

    // ==================== LOCK ====================

    @Override
    public Optional<ExecutionLock> tryLock(String workflowId) {
        validateId(workflowId);
        Path lockPath = lockPath(workflowId);
        if (createLock(lockPath)) {
            return Optional.of(new FileExecutionLock(workflowId, lockPath));
        }
        if (releaseIfStale(lockPath) && createLock(lockPath)) {
            return Optional.of(new FileExecutionLock(workflowId, lockPath));
        }
        log.warn("[Resume] Workflow {} is locked by another execution ({})", workflowId, lockPath);
        return Optional.empty();
    }

    private boolean createLock(Path lockPath) {
        try {
            Files.writeString(lockPath, ProcessHandle.current().pid() + "@" + clock.instant(),
                    StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            return true;
        } catch (FileAlreadyExistsException e) {
            return false;
        } catch (IOException e) {
            throw new ResumeStateStorageException("Failed to create lock: " + lockPath.getFileName(), e);
        }
    }

    /**
     * Removes a lock whose owning process is gone. A lock written by a process
     * that was killed is never released by its shutdown hook.
     */
    private boolean releaseIfStale(Path lockPath) {
        OptionalLong holder = lockHolder(lockPath);
        if (holder.isEmpty()) {
            return false;
        }
        boolean alive = ProcessHandle.of(holder.getAsLong()).map(ProcessHandle::isAlive).orElse(false);
        if (alive) {
            return false;
        }
        try {
            Files.deleteIfExists(lockPath);
        } catch (IOException e) {
            throw new ResumeStateStorageException("Failed to remove stale lock: " + lockPath.getFileName(), e);
        }
        log.warn("[Resume] Removed stale lock {} left by dead process {}", lockPath.getFileName(),
                holder.getAsLong());
        return true;
    }

    private static OptionalLong lockHolder(Path lockPath) {
        String content;
        try {
            content = Files.readString(lockPath, StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            log.debug("[Resume] Cannot read lock {}: {}", lockPath.getFileName(), e.getMessage());
            return OptionalLong.empty();
        }
        int separator = content.indexOf('@');
        String pid = separator >= 0 ? content.substring(0, separator) : content;
        try {
            return OptionalLong.of(Long.parseLong(pid));
        } catch (NumberFormatException e) {
            log.debug("[Resume] Lock {} has no owner pid: {}", lockPath.getFileName(), content);
            return OptionalLong.empty();
        }
    }

    private static final class FileExecutionLock implements ExecutionLock {

        private final String workflowId;
        private final Path lockPath;

        private FileExecutionLock(String workflowId, Path lockPath) {
            this.workflowId = workflowId;
            this.lockPath = lockPath;
        }

        @Override
        public String workflowId() {
            return workflowId;
        }

        @Override
        public void close() {
            try {
                Files.deleteIfExists(lockPath);
            } catch (IOException e) {
                log.warn("[Resume] Failed to release lock {}: {}", lockPath, e.getMessage());
            }
        }
    }

    // ==================== PATHS ====================

    private List<Path> snapshotFiles() {
        if (basePath == null || !Files.isDirectory(basePath)) {
            return List.of();
        }
        try (Stream<Path> paths = Files.list(basePath)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(EXTENSION))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new ResumeStateStorageException("Failed to list resume storage: " + basePath, e);
        }
    }

    private Path snapshotPath(String workflowId) {
        validateId(workflowId);
        Path resolved = basePath.resolve(workflowId + EXTENSION).normalize();
        if (!resolved.startsWith(basePath)) {
            throw new IllegalArgumentException("Path traversal blocked: " + workflowId);
        }
        return resolved;
    }

    private Path lockPath(String workflowId) {
        return basePath.resolve(workflowId + LOCK_EXTENSION);
    }

    private static void validateId(String workflowId) {
        if (!WorkflowIds.isValid(workflowId)) {
            throw new IllegalArgumentException("Invalid workflow id: " + workflowId);
        }
    }

    private static Path sibling(Path target, String suffix) {
        return target.resolveSibling(target.getFileName() + suffix);
    }

    private static boolean isTransient(String fileName) {
        return fileName.endsWith(TEMP_SUFFIX) || fileName.endsWith(BACKUP_SUFFIX)
                || fileName.endsWith(LOCK_EXTENSION);
    }

    private static String idOf(Path file) {
        String name = file.getFileName().toString();
        return name.substring(0, name.length() - EXTENSION.length());
    }

    private static Instant modifiedAt(Path file) {
        try {
            return Files.getLastModifiedTime(file).toInstant();
        } catch (IOException e) {
            log.debug("[Resume] Cannot read mtime of {}: {}", file.getFileName(), e.getMessage());
            return null;
        }
    }

    private static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("[Resume] Unparseable timestamp '{}'", value);
            return null;
        }
    }
}
