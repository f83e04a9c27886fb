package me.golemcore.flow.adapter.inbound.cli;

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

import me.golemcore.flow.domain.model.ExecutionResult;
import me.golemcore.flow.domain.model.ModelErrorKind;
import me.golemcore.flow.domain.model.ValidationResult;

/**
 * Process exit codes of the command line interface.
 */
public final class FlowExitCodes {

    public static final int SUCCESS = 0;
    public static final int GENERAL_ERROR = 1;
    public static final int CONFIGURATION_ERROR = 2;
    public static final int WORKFLOW_INVALID = 3;
    public static final int TIMEOUT = 4;
    public static final int AUTHENTICATION_ERROR = 5;
    public static final int NETWORK_ERROR = 6;
    public static final int PERMISSION_ERROR = 7;
    public static final int INVALID_ARGUMENTS = 8;
    public static final int VALIDATION_ERROR = 9;

    private FlowExitCodes() {
    }

    public static int forResult(ExecutionResult result) {
        if (result.isSuccess()) {
            return SUCCESS;
        }
        if (result.getErrorKind() == null) {
            return GENERAL_ERROR;
        }
        return switch (result.getErrorKind()) {
        case TEMPLATE_ERROR, RESUME_INCOMPATIBLE, SNAPSHOT_CORRUPT -> WORKFLOW_INVALID;
        case TIMEOUT -> TIMEOUT;
        case SNAPSHOT_NOT_FOUND, INVALID_WORKFLOW_ID -> INVALID_ARGUMENTS;
        case STORAGE_ERROR -> PERMISSION_ERROR;
        case MODEL_INTERFACE_ERROR -> forModelError(result.getModelErrorKind());
        default -> GENERAL_ERROR;
        };
    }

    public static int forValidation(ValidationResult validation) {
        return validation.valid() ? SUCCESS : VALIDATION_ERROR;
    }

    static int forModelError(ModelErrorKind kind) {
        if (kind == null) {
            return GENERAL_ERROR;
        }
        return switch (kind) {
        case NOT_CONFIGURED -> CONFIGURATION_ERROR;
        case AUTHENTICATION -> AUTHENTICATION_ERROR;
        case RATE_LIMIT, MODEL_UNAVAILABLE -> NETWORK_ERROR;
        case TIMEOUT -> TIMEOUT;
        default -> GENERAL_ERROR;
        };
    }
}
