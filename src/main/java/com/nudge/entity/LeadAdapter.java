package com.nudge.entity;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Adapter for client-pipeline leads.
 * Leads that were won or lost are terminal and never produce action items.
 */
public class LeadAdapter extends AbstractEntityAdapter<Lead> {

    public static final String RECORD_KIND = "lead";

    static final String DEFAULT_PHASE = "new_lead";

    private static final Set<String> TERMINAL_PHASES = Set.of("won", "lost");

    public LeadAdapter(Clock clock) {
        super(clock);
    }

    @Override
    public String recordKind() {
        return RECORD_KIND;
    }

    @Override
    public String id(Lead lead) {
        return lead.id();
    }

    @Override
    public String phase(Lead lead) {
        if (lead.phase() == null || lead.phase().isBlank()) {
            return DEFAULT_PHASE;
        }
        return lead.phase();
    }

    @Override
    public boolean isTerminalPhase(Lead lead) {
        return TERMINAL_PHASES.contains(phase(lead));
    }

    @Override
    public boolean isArchived(Lead lead) {
        return lead.archived();
    }

    @Override
    protected String firstName(Lead lead) {
        return lead.firstName();
    }

    @Override
    protected String lastName(Lead lead) {
        return lead.lastName();
    }

    @Override
    protected Map<String, Long> phaseTimestamps(Lead lead) {
        return lead.phaseTimestamps();
    }

    @Override
    protected Map<String, Object> tasks(Lead lead) {
        return lead.tasks();
    }

    @Override
    protected List<Note> notes(Lead lead) {
        return lead.notes();
    }

    @Override
    protected Object createdAt(Lead lead) {
        return lead.createdAt();
    }

    @Override
    protected Map<String, Object> attributes(Lead lead) {
        return lead.attributes();
    }
}
