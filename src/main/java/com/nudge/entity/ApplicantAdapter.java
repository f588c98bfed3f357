package com.nudge.entity;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Adapter for recruiting-pipeline applicants.
 * The resolved phase is the recruiter override, falling back to the calculated phase.
 */
public class ApplicantAdapter extends AbstractEntityAdapter<Applicant> {

    public static final String RECORD_KIND = "applicant";

    static final String DEFAULT_PHASE = "intake";

    public ApplicantAdapter(Clock clock) {
        super(clock);
    }

    @Override
    public String recordKind() {
        return RECORD_KIND;
    }

    @Override
    public String id(Applicant applicant) {
        return applicant.id();
    }

    @Override
    public String phase(Applicant applicant) {
        if (applicant.phaseOverride() != null && !applicant.phaseOverride().isBlank()) {
            return applicant.phaseOverride();
        }
        if (applicant.calculatedPhase() != null && !applicant.calculatedPhase().isBlank()) {
            return applicant.calculatedPhase();
        }
        return DEFAULT_PHASE;
    }

    @Override
    public boolean isArchived(Applicant applicant) {
        return applicant.archived();
    }

    @Override
    protected String firstName(Applicant applicant) {
        return applicant.firstName();
    }

    @Override
    protected String lastName(Applicant applicant) {
        return applicant.lastName();
    }

    @Override
    protected Map<String, Long> phaseTimestamps(Applicant applicant) {
        return applicant.phaseTimestamps();
    }

    @Override
    protected Map<String, Object> tasks(Applicant applicant) {
        return applicant.tasks();
    }

    @Override
    protected List<Note> notes(Applicant applicant) {
        return applicant.notes();
    }

    @Override
    protected Object createdAt(Applicant applicant) {
        return applicant.applicationDate();
    }

    @Override
    protected Map<String, Object> attributes(Applicant applicant) {
        return applicant.attributes();
    }
}
