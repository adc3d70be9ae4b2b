package com.vidnyan.lre.domain.rule;

import com.vidnyan.lre.domain.expression.CaseVariables;
import com.vidnyan.lre.domain.expression.Value;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {variable} placeholders against a case. Never throws for unknown placeholders.
 */
public final class TemplateRenderer {

    public static final String UNAVAILABLE = "[unavailable]";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([^{}]+)}");

    private TemplateRenderer() {
    }

    public static String render(String template, CaseVariables variables) {
        if (template == null || template.isEmpty()) {
            return "";
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder rendered = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1).trim();
            Value value = variables.resolve(name);
            String replacement = value instanceof Value.NullValue ? UNAVAILABLE : value.render();
            matcher.appendReplacement(rendered, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(rendered);
        return rendered.toString();
    }
}
