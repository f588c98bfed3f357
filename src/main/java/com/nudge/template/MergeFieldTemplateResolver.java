package com.nudge.template;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Default implementation of TemplateResolver.
 * Single pass: substituted values are not scanned for further merge fields.
 */
public class MergeFieldTemplateResolver implements TemplateResolver {

    private static final Pattern MERGE_FIELD = Pattern.compile("\\{\\{(\\w+)}}");

    @Override
    public String resolve(String template, Map<String, ?> context) {
        if (template == null || template.isEmpty()) {
            return "";
        }
        Matcher matcher = MERGE_FIELD.matcher(template);
        StringBuilder out = new StringBuilder(template.length());
        while (matcher.find()) {
            Object value = context != null ? context.get(matcher.group(1)) : null;
            String replacement = value != null ? stringify(value) : matcher.group();
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    @Override
    public Set<String> fieldsOf(String template) {
        Set<String> fields = new LinkedHashSet<>();
        if (template == null) {
            return fields;
        }
        Matcher matcher = MERGE_FIELD.matcher(template);
        while (matcher.find()) {
            fields.add(matcher.group(1));
        }
        return fields;
    }

    private static String stringify(Object value) {
        // whole doubles print without a trailing ".0"
        if (value instanceof Double d && d == Math.rint(d) && !Double.isInfinite(d)) {
            return Long.toString(d.longValue());
        }
        if (value instanceof Float f && f == Math.rint(f) && !Float.isInfinite(f)) {
            return Long.toString(f.longValue());
        }
        return value.toString();
    }
}
