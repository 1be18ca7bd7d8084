/*
 * Copyright (c) 2025 Beacon Alert Migration
 * Licensed under the Apache License, Version 2.0
 */
package com.beacon.alertmigration.infra.template;

import com.beacon.alertmigration.api.exceptions.TemplateRenderingException;
import com.beacon.alertmigration.api.spi.MessageTemplateRenderer;

import java.util.regex.Pattern;

/**
 * Converts legacy alert messages to unified template syntax.
 *
 * <p>Legacy messages reference labels as {@code ${name}}. These become
 * {@code {{ $labels.name }}}, or {@code {{ index $labels "name" }}} when
 * the name is not a plain identifier. A literal <code>{{</code> in the
 * legacy text is escaped so it is not read as a template action.
 *
 * <p>Messages with an unterminated or empty {@code ${...}} are rejected;
 * callers keep the original text in that case.
 */
public class LegacyMessageTemplateRenderer implements MessageTemplateRenderer {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final String VARIABLE_START = "${";
    private static final String ACTION_START = "{{";
    private static final String ESCAPED_ACTION_START = "{{\"{{\"}}";

    @Override
    public String render(String template, TemplateContext context) {
        if (template == null || template.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder(template.length() + 16);
        int pos = 0;
        while (pos < template.length()) {
            int var = template.indexOf(VARIABLE_START, pos);
            if (var < 0) {
                appendLiteral(out, template.substring(pos));
                break;
            }
            appendLiteral(out, template.substring(pos, var));
            int end = template.indexOf('}', var + VARIABLE_START.length());
            if (end < 0) {
                throw new TemplateRenderingException("unterminated variable at position " + var);
            }
            String name = template.substring(var + VARIABLE_START.length(), end).trim();
            if (name.isEmpty()) {
                throw new TemplateRenderingException("empty variable at position " + var);
            }
            out.append(labelReference(name));
            pos = end + 1;
        }
        return out.toString();
    }

    private static void appendLiteral(StringBuilder out, String literal) {
        out.append(literal.replace(ACTION_START, ESCAPED_ACTION_START));
    }

    private static String labelReference(String name) {
        if (IDENTIFIER.matcher(name).matches()) {
            return "{{ $labels." + name + " }}";
        }
        String quoted = name.replace("\\", "\\\\").replace("\"", "\\\"");
        return "{{ index $labels \"" + quoted + "\" }}";
    }
}
