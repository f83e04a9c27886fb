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

import me.golemcore.flow.domain.model.LlmRequest;
import me.golemcore.flow.domain.model.LlmResponse;

import java.util.concurrent.CompletableFuture;

/**
 * Port for the chat-completion interface. One call sends the conversation and
 * tool catalog and returns the assistant turn, with zero or more requested
 * function calls and usage metadata.
 *
 * <p>
 * Failures complete the future exceptionally; the engine classifies them with
 * {@code LlmErrorClassifier}. Retry policy, if any, belongs to the adapter.
 */
public interface LlmPort {

    /**
     * Returns the provider identifier (e.g., "openai", "anthropic").
     */
    String getProviderId();

    /**
     * Executes a chat completion request and returns the full response.
     * Cancelling the returned future abandons the request.
     */
    CompletableFuture<LlmResponse> chat(LlmRequest request);

    /**
     * Checks whether the provider is configured and ready to accept requests.
     */
    boolean isAvailable();
}
