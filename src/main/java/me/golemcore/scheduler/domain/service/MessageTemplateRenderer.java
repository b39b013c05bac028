package me.golemcore.scheduler.domain.service;

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

import me.golemcore.scheduler.domain.exception.RenderException;
import me.golemcore.scheduler.port.outbound.TemplateRendererPort;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Simple template engine for scheduled messages. Substitutes {{name}}
 * placeholders with values from the fire-time context. Unresolved placeholders
 * are left intact; an opening {{ without a closing }} is rejected.
 */
@Component
public class MessageTemplateRenderer implements TemplateRendererPort {

    private static final Pattern VARIABLE_PATTERN = Pattern.compile("\\{\\{\\s*(\\w+)\\s*}}");
    private static final String OPEN = "{{";
    private static final String CLOSE = "}}";

    /**
     * Renders content by substituting {{name}} placeholders.
     *
     * @param template
     *            the template with {{name}} placeholders
     * @param context
     *            the variable name-to-value mapping
     * @return the rendered message
     * @throws RenderException
     *             if a placeholder is not terminated
     */
    @Override
    public String render(String template, Map<String, String> context) {
        if (template == null) {
            throw new RenderException("Template is null");
        }
        checkTerminated(template);
        if (context == null || context.isEmpty()) {
            return template;
        }

        Matcher matcher = VARIABLE_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String value = context.get(matcher.group(1));
            String replacement = value != null ? value : matcher.group(0);
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);

        return result.toString();
    }

    private void checkTerminated(String template) {
        int from = 0;
        while (true) {
            int open = template.indexOf(OPEN, from);
            if (open < 0) {
                return;
            }
            int close = template.indexOf(CLOSE, open + OPEN.length());
            if (close < 0) {
                throw new RenderException("Unterminated placeholder at position " + open);
            }
            from = close + CLOSE.length();
        }
    }
}
