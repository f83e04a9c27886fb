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

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.Map;

/**
 * Record of one finished tool invocation, successful or not. Written once when
 * the tool returns and never modified afterwards; the resume summary lists the
 * successful ones as work that must not be repeated.
 */
@Getter
@Builder
@EqualsAndHashCode
@ToString
@NoArgsConstructor(access = AccessLevel.PRIVATE)
@AllArgsConstructor
public class CompletedTool {

    @JsonProperty("function_name")
    private String functionName;

    @JsonProperty("parameters")
    private Map<String, Object> parameters;

    @JsonProperty("result")
    private String result;

    @JsonProperty("executed_at")
    private Instant executedAt;

    @JsonProperty("success")
    private boolean success;

    /** Assistant text that accompanied the call, if any. */
    @JsonProperty("ai_reasoning")
    private String reasoning;
}
