package me.golemcore.flow.port.outbound;

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

import me.golemcore.flow.domain.model.ResumeSnapshot;
import me.golemcore.flow.domain.model.RetentionPolicy;
import me.golemcore.flow.domain.model.SnapshotSummary;

import java.util.List;
import java.util.Optional;

/**
 * Port for durable persistence of one resume state per workflow id.
 *
 * <p>
 * Implementations must never leave a half-written state as the current one and
 * must never report an undecodable state as absent.
 */
public interface ResumeStatePort {

    /**
     * Persists the snapshot, replacing any previous state for the id atomically.
     *
     * @throws me.golemcore.flow.domain.exception.ResumeStateStorageException
     *             if the state could not be written; the previous state is kept
     */
    void save(String workflowId, ResumeSnapshot snapshot);

    /**
     * Loads the stored state.
     *
     * @return empty if nothing is stored for the id
     * @throws me.golemcore.flow.domain.exception.SnapshotCorruptException
     *             if a state exists but cannot be decoded
     */
    Optional<ResumeSnapshot> load(String workflowId);

    /**
     * Lists stored states, newest first, reading metadata only.
     */
    List<SnapshotSummary> list();

    /**
     * Deletes states whose last checkpoint is older than the retention window.
     *
     * @return number of deleted states
     */
    int cleanup(RetentionPolicy retentionPolicy);

    boolean delete(String workflowId);

    /**
     * Acquires the single-execution lock for a workflow id.
     *
     * @return the held lock, or empty if another execution holds it
     */
    Optional<ExecutionLock> tryLock(String workflowId);

    /**
     * Held lock on a workflow id. Closing releases it.
     */
    interface ExecutionLock extends AutoCloseable {

        String workflowId();

        @Override
        void close();
    }
}
