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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only, ordered log of the messages exchanged during one workflow
 * execution. Drives the model's multi-turn reasoning and is the primary
 * resumable artifact.
 *
 * <p>
 * Not thread-safe: a history is mutated only on its execution's path.
 */
public class ChatHistory {

    private final List<Message> messages;

    public ChatHistory() {
        this.messages = new ArrayList<>();
    }

    public ChatHistory(List<Message> initial) {
        this.messages = new ArrayList<>(initial != null ? initial : List.of());
    }

    public void append(Message message) {
        if (message == null) {
            throw new IllegalArgumentException("message must not be null");
        }
        messages.add(message);
    }

    /**
     * Returns an unmodifiable view of the messages in append order.
     */
    public List<Message> messages() {
        return Collections.unmodifiableList(messages);
    }

    /**
     * Returns the newest {@code count} messages (all of them if fewer exist).
     */
    public List<Message> tail(int count) {
        if (count <= 0) {
            return List.of();
        }
        int from = Math.max(0, messages.size() - count);
        return List.copyOf(messages.subList(from, messages.size()));
    }

    public Message last() {
        return messages.isEmpty() ? null : messages.get(messages.size() - 1);
    }

    public int size() {
        return messages.size();
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }

    public ChatHistory copy() {
        return new ChatHistory(messages);
    }
}
