package com.nudge.priority;

import com.nudge.core.ActionItem;

import java.util.Comparator;

/**
 * Ordering of action items in a report.
 * <p>
 * Comparison order:
 * 1. Urgency rank (critical, warning, info)
 * 2. Display name, case-insensitive
 * 3. Display name, exact
 * <p>
 * Items that compare equal keep their evaluation order (callers use a stable sort).
 */
public final class ActionItemOrder {

    public static final Comparator<ActionItem> BY_URGENCY_THEN_NAME = Comparator
            .comparingInt((ActionItem item) -> item.urgency().rank())
            .thenComparing(ActionItem::name, String.CASE_INSENSITIVE_ORDER)
            .thenComparing(ActionItem::name);

    private ActionItemOrder() {
    }
}
