package com.nudge.core;

import com.nudge.priority.Urgency;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered action items plus totals computed before the limit was applied.
 *
 * @param items         Items after urgency filter, ordering and limit
 * @param total         Number of items before the limit
 * @param countsByUrgency Item counts per urgency before the limit; every urgency is present
 */
public record ActionItemReport(List<ActionItem> items, int total, Map<Urgency, Integer> countsByUrgency) {

    public ActionItemReport {
        items = items == null ? List.of() : List.copyOf(items);
        Map<Urgency, Integer> counts = new EnumMap<>(Urgency.class);
        for (Urgency urgency : Urgency.values()) {
            counts.put(urgency, countsByUrgency != null ? countsByUrgency.getOrDefault(urgency, 0) : 0);
        }
        countsByUrgency = Collections.unmodifiableMap(counts);
    }

    public static ActionItemReport empty() {
        return new ActionItemReport(List.of(), 0, Map.of());
    }

    /**
     * Number of items in this report (after the limit).
     */
    public int showing() {
        return items.size();
    }

    public int count(Urgency urgency) {
        return countsByUrgency.get(urgency);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }
}
