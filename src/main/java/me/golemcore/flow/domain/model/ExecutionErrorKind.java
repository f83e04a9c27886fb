package me.golemcore.flow.domain.model;

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

/**
 * Machine-readable classification of why an execution ended unsuccessfully.
 */
public enum ExecutionErrorKind {

    /** Workflow text failed to render. Not retried. */
    TEMPLATE_ERROR,

    /**
     * A single tool call failed. Recorded in the conversation, never ends a run on
     * its own.
     */
    TOOL_INVOCATION_ERROR,

    /** Rate limit, authentication failure, unavailable model and similar. */
    MODEL_INTERFACE_ERROR,

    MAX_ITERATIONS_EXCEEDED,

    TIMEOUT,

    CANCELLED,

    /** Stored state is not safe to resume against the current workflow text. */
    RESUME_INCOMPATIBLE,

    /** Stored state exists but cannot be decoded. */
    SNAPSHOT_CORRUPT,

    SNAPSHOT_NOT_FOUND,

    /** The workflow id cannot name a stored state. */
    INVALID_WORKFLOW_ID,

    /** A checkpoint could not be written. */
    STORAGE_ERROR
}
