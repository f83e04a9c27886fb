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
 * A parsed workflow file: the task template plus its declared tool allow-list
 * and input defaults.
 */
@Data
@Builder
public class WorkflowDefinition {

    private String name;
    private String filePath;

    /** Full file text, used for hashing and similarity checks. */
    private String source;

    /** Markdown body rendered into the initial instruction. */
    private String template;

    private String description;
    private String model;
    private Double temperature;
    private Integer maxOutputTokens;

    @Builder.Default
    private List<String> declaredTools = new ArrayList<>();

    /** Per-step defaults ({@code input.default}). */
    @Builder.Default
    private Map<String, Object> inputDefaults = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, WorkflowInput> inputSchema = new LinkedHashMap<>();
}
