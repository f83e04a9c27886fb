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

import java.util.regex.Pattern;

/**
 * Workflow ids double as storage file names: letters, digits, dot, underscore
 * and hyphen only.
 */
public final class WorkflowIds {

    private static final Pattern VALID = Pattern.compile("[A-Za-z0-9._-]+");

    private WorkflowIds() {
    }

    public static boolean isValid(String workflowId) {
        return workflowId != null && VALID.matcher(workflowId).matches()
                && !".".equals(workflowId) && !"..".equals(workflowId);
    }
}
