package com.nudge.core;

import com.nudge.priority.Urgency;

/**
 * One resolved alert produced by a matching (entity, rule) pair.
 *
 * @param entityId   Id of the entity that matched
 * @param recordKind Record kind of the entity, e.g. "lead"
 * @param name       Entity display name
 * @param urgency    Resolved urgency, after escalation
 * @param icon       Rule icon
 * @param title      Resolved title
 * @param detail     Resolved detail
 * @param action     Resolved suggested action
 * @param ruleId     Id of the rule that produced the item
 */
public record ActionItem(
        String entityId,
        String recordKind,
        String name,
        Urgency urgency,
        String icon,
        String title,
        String detail,
        String action,
        String ruleId
) {
}
