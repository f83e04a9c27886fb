package me.golemcore.flow;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for golemcore-flow.
 *
 * <p>
 * golemcore-flow runs markdown workflow files through a tool-calling LLM loop
 * and checkpoints the conversation after every tool call, so that an
 * interrupted run continues with {@code resume} instead of starting over.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → FlowCommandRunner (CLI)
 * Domain Layer       → WorkflowOrchestrator, ResumeStateCodec, compatibility checks
 * Infrastructure     → langchain4j LLM adapter, local resume state storage
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code flow.*} prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class FlowApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(FlowApplication.class, args)));
    }

}
