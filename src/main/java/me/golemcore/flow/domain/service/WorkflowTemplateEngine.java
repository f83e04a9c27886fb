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

import me.golemcore.flow.domain.exception.TemplateRenderException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Template engine for workflow bodies. Substitutes {@code {{name}}}
 * placeholders (dotted names such as {@code {{project.path}}} resolve through
 * nested maps) with values from the variable map.
 */
@Component
public class WorkflowTemplateEngine {

    private static final Pattern VARIABLE_PATTERN = Pattern.compile("\\{\\{\\s*([A-Za-z_][\\w.-]*)\\s*}}");
    private static final String OPEN = "{{";
    private static final String CLOSE = "}}";

    /**
     * Renders the template strictly: malformed placeholders and variables without
     * a value are errors.
     *
     * @throws TemplateRenderException
     *             if the template cannot be fully rendered
     */
    public String render(String template, Map<String, Object> variables) {
        checkSyntax(template);
        List<String> missing = new ArrayList<>();
        String rendered = substitute(template, variables, missing);
        if (!missing.isEmpty()) {
            throw new TemplateRenderException("Missing value for template variable(s): " + String.join(", ",
                    new LinkedHashSet<>(missing)));
        }
        return rendered;
    }

    /**
     * Renders the template leaving unresolved placeholders intact.
     *
     * @return names of the placeholders that had no value
     * @throws TemplateRenderException
     *             on malformed placeholders
     */
    public Set<String> findUnresolved(String template, Map<String, Object> variables) {
        checkSyntax(template);
        List<String> missing = new ArrayList<>();
        substitute(template, variables, missing);
        return new LinkedHashSet<>(missing);
    }

    private String substitute(String template, Map<String, Object> variables, List<String> missing) {
        if (template == null) {
            return "";
        }
        Matcher matcher = VARIABLE_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            Object value = lookup(name, variables);
            if (value != null) {
                matcher.appendReplacement(result, Matcher.quoteReplacement(String.valueOf(value)));
            } else {
                missing.add(name);
                matcher.appendReplacement(result, Matcher.quoteReplacement(matcher.group(0)));
            }
        }
        matcher.appendTail(result);
        return result.toString();
    }

    @SuppressWarnings("unchecked")
    private Object lookup(String name, Map<String, Object> variables) {
        if (variables == null) {
            return null;
        }
        if (variables.containsKey(name)) {
            return variables.get(name);
        }
        Object current = variables;
        for (String part : name.split("\\.")) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<String, Object>) current).get(part);
        }
        return current;
    }

    private void checkSyntax(String template) {
        if (template == null) {
            return;
        }
        int index = 0;
        while (true) {
            int open = template.indexOf(OPEN, index);
            if (open < 0) {
                return;
            }
            int close = template.indexOf(CLOSE, open + OPEN.length());
            int nextOpen = template.indexOf(OPEN, open + OPEN.length());
            if (close < 0 || (nextOpen >= 0 && nextOpen < close)) {
                throw new TemplateRenderException("Unclosed placeholder at line " + lineOf(template, open));
            }
            String placeholder = template.substring(open, close + CLOSE.length());
            if (!VARIABLE_PATTERN.matcher(placeholder).matches()) {
                throw new TemplateRenderException("Invalid placeholder '" + placeholder + "' at line "
                        + lineOf(template, open));
            }
            index = close + CLOSE.length();
        }
    }

    private static int lineOf(String text, int offset) {
        int line = 1;
        for (int i = 0; i < offset; i++) {
            if (text.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }
}
