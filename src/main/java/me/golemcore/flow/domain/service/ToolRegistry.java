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

import me.golemcore.flow.domain.component.ToolComponent;
import me.golemcore.flow.domain.model.ToolDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Catalog of invocable tools, resolved once at startup from every enabled
 * {@link ToolComponent} bean. The orchestrator depends on this registry only,
 * never on concrete tool types.
 */
@Component
@Slf4j
public class ToolRegistry {

    private final Map<String, ToolComponent> tools;

    public ToolRegistry(List<ToolComponent> components) {
        Map<String, ToolComponent> registered = new LinkedHashMap<>();
        for (ToolComponent tool : components != null ? components : List.<ToolComponent>of()) {
            if (!tool.isEnabled()) {
                log.info("[Tools] Skipping disabled tool: {}", tool.getToolName());
                continue;
            }
            ToolComponent previous = registered.putIfAbsent(tool.getToolName(), tool);
            if (previous != null) {
                log.warn("[Tools] Duplicate tool name '{}', keeping {}", tool.getToolName(),
                        previous.getClass().getSimpleName());
            }
        }
        this.tools = Collections.unmodifiableMap(registered);
    }

    public Optional<ToolComponent> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tools.get(name));
    }

    public boolean contains(String name) {
        return name != null && tools.containsKey(name);
    }

    public Set<String> getToolNames() {
        return tools.keySet();
    }

    /**
     * Returns definitions for the given names in their declared order, skipping
     * names that are not registered.
     */
    public List<ToolDefinition> definitionsFor(Collection<String> names) {
        List<ToolDefinition> definitions = new ArrayList<>();
        if (names == null) {
            return definitions;
        }
        for (String name : names) {
            ToolComponent tool = tools.get(name);
            if (tool != null) {
                definitions.add(tool.getDefinition());
            }
        }
        return definitions;
    }
}
