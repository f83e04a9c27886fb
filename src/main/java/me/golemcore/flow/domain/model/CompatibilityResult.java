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

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Verdict on whether a stored resume state may be used against the current
 * workflow text.
 */
@Data
@Builder
public class CompatibilityResult {

    private boolean canResume;

    /** Confidence in [0, 1]. */
    private double score;

    /** Normalized edit-distance similarity of old and new source, 1.0 when unchanged. */
    private double similarity;

    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    private boolean requiresAdaptation;

    @Builder.Default
    private Map<String, String> migrationStrategies = new LinkedHashMap<>();

    @Builder.Default
    private List<String> unavailableTools = new ArrayList<>();
}
