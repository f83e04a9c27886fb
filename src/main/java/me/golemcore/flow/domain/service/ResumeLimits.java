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

import me.golemcore.flow.infrastructure.config.FlowProperties;

/**
 * Upper bounds applied when live state is packed into a snapshot.
 */
public record ResumeLimits(int maxCompletedTools, int maxChatMessages, int maxContextVariables, int maxKeyInsights,
        int maxContextChanges) {

    public static ResumeLimits defaults() {
        return new ResumeLimits(50, 20, 30, 10, 20);
    }

    public static ResumeLimits from(FlowProperties.LimitsProperties limits) {
        return new ResumeLimits(limits.getMaxCompletedTools(), limits.getMaxChatMessages(),
                limits.getMaxContextVariables(), limits.getMaxKeyInsights(), limits.getMaxContextChanges());
    }
}
