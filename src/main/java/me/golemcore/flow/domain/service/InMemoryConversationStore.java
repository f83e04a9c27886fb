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
import me.golemcore.flow.infrastructure.config.FlowProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded LRU map of workflow histories. Holds at most {@code maxWorkflows}
 * entries, evicting the least recently used one, and keeps only the newest
 * {@code maxMessages} messages per workflow.
 */
@Service
@Slf4j
public class InMemoryConversationStore implements ConversationStore {

    private final int maxMessages;
    private final Map<String, ChatHistory> histories;

    @Autowired
    public InMemoryConversationStore(FlowProperties properties) {
        this(properties.getConversation().getMaxWorkflows(), properties.getConversation().getMaxMessages());
    }

    public InMemoryConversationStore(int maxWorkflows, int maxMessages) {
        if (maxWorkflows < 1 || maxMessages < 1) {
            throw new IllegalArgumentException("Conversation store bounds must be positive");
        }
        this.maxMessages = maxMessages;
        this.histories = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, ChatHistory> eldest) {
                boolean evict = size() > maxWorkflows;
                if (evict) {
                    log.debug("[Flow] Evicting conversation working copy: {}", eldest.getKey());
                }
                return evict;
            }
        };
    }

    @Override
    public synchronized void put(String workflowId, ChatHistory history) {
        if (workflowId == null || history == null) {
            throw new IllegalArgumentException("workflowId and history are required");
        }
        ChatHistory copy = history.size() > maxMessages
                ? new ChatHistory(history.tail(maxMessages))
                : history.copy();
        histories.put(workflowId, copy);
    }

    @Override
    public synchronized Optional<ChatHistory> get(String workflowId) {
        ChatHistory history = histories.get(workflowId);
        return history != null ? Optional.of(history.copy()) : Optional.empty();
    }

    @Override
    public synchronized void remove(String workflowId) {
        histories.remove(workflowId);
    }

    @Override
    public synchronized int size() {
        return histories.size();
    }
}
