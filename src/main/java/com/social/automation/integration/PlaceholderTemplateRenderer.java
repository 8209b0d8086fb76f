package com.social.automation.integration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves a template ref against configured templates and substitutes {name} placeholders
 * from the context. Unknown placeholders render as empty strings; an unknown ref is used
 * as the template text itself.
 */
public class PlaceholderTemplateRenderer implements TemplateRenderer {

    private static final Logger log = LoggerFactory.getLogger(PlaceholderTemplateRenderer.class);
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-zA-Z_][a-zA-Z0-9_]*)}");

    private final Map<String, String> templates;

    public PlaceholderTemplateRenderer(Map<String, String> templates) {
        this.templates = templates;
    }

    @Override
    public String render(String templateRef, Map<String, String> context) {
        if (templateRef == null || templateRef.isEmpty()) {
            return "";
        }
        String template = templates.get(templateRef);
        if (template == null) {
            log.debug("No template configured for ref '{}', rendering ref as literal text", templateRef);
            template = templateRef;
        }

        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String value = context.getOrDefault(matcher.group(1), "");
            matcher.appendReplacement(out, Matcher.quoteReplacement(value != null ? value : ""));
        }
        matcher.appendTail(out);
        return out.toString().trim();
    }
}
