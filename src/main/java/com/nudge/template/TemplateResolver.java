package com.nudge.template;

import java.util.Map;
import java.util.Set;

/**
 * Resolves {@code {{field}}} merge fields in rule-authored message templates.
 */
public interface TemplateResolver {

    /**
     * Replace every merge field with the stringified context value.
     *
     * @param template Template text, may be null
     * @param context  Merge-field values
     * @return Resolved text; empty for a null or empty template. Unknown fields are left as-is.
     */
    String resolve(String template, Map<String, ?> context);

    /**
     * Names of the merge fields referenced by a template, in order of first use.
     */
    Set<String> fieldsOf(String template);
}
