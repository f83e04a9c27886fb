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

import me.golemcore.flow.domain.model.ChatHistory;

import java.util.Optional;

/**
 * In-memory working copy of the chat history of each running workflow. The
 * durable copy lives in the resume state store; the orchestrator pushes the
 * live history here after every tool call.
 */
public interface ConversationStore {

    /**
     * Replaces the working copy for the workflow with a copy of {@code history}.
     */
    void put(String workflowId, ChatHistory history);

    /**
     * Returns a copy of the working history, if one is held.
     */
    Optional<ChatHistory> get(String workflowId);

    void remove(String workflowId);

    int size();
}
