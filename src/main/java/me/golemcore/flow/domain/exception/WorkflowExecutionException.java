package me.golemcore.flow.domain.exception;

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

import me.golemcore.flow.domain.model.ExecutionErrorKind;
import me.golemcore.flow.domain.model.ModelErrorKind;

/**
 * Orchestrator-level failure that ends a run. Tool failures never surface as
 * this exception; they are folded into the conversation instead.
 */
public class WorkflowExecutionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ExecutionErrorKind kind;
    private final ModelErrorKind modelErrorKind;

    public WorkflowExecutionException(ExecutionErrorKind kind, String message) {
        this(kind, null, message, null);
    }

    public WorkflowExecutionException(ExecutionErrorKind kind, String message, Throwable cause) {
        this(kind, null, message, cause);
    }

    public WorkflowExecutionException(ExecutionErrorKind kind, ModelErrorKind modelErrorKind, String message,
            Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.modelErrorKind = modelErrorKind;
    }

    public ExecutionErrorKind getKind() {
        return kind;
    }

    public ModelErrorKind getModelErrorKind() {
        return modelErrorKind;
    }
}
