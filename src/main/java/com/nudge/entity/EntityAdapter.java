package com.nudge.entity;

import java.time.Clock;
import java.util.Optional;

/**
 * Translates one record kind into the primitives the condition evaluators need.
 * <p>
 * Evaluators never read entity fields directly, so a new record kind only needs
 * a new adapter. No operation throws: missing data yields the documented default.
 *
 * @param <E> Entity type handled by this adapter
 */
public interface EntityAdapter<E> {

    /**
     * Record-kind tag matched against {@code RuleConfig.recordKind()}, e.g. "applicant".
     */
    String recordKind();

    /**
     * Time source for every elapsed-time computation made on behalf of this adapter.
     */
    Clock clock();

    String id(E entity);

    /**
     * Display name, "Unnamed" when the entity has no name parts.
     */
    String name(E entity);

    /**
     * Resolved current phase. Never null.
     */
    String phase(E entity);

    /**
     * Whole days since the current phase was entered, 0 when no timestamp is stored for it.
     */
    long daysInPhase(E entity);

    /**
     * Whole days since the entity was created, 0 when the creation time is unknown.
     */
    long daysSinceCreation(E entity);

    /**
     * Fractional minutes since the entity was created, 0 when the creation time is unknown.
     */
    double minutesSinceCreation(E entity);

    /**
     * Whether the task is done. Absent, empty and false-ish states are not done.
     */
    boolean isTaskDone(E entity, String taskId);

    /**
     * Raw value of a named date attribute.
     */
    Optional<Object> dateField(E entity, String field);

    /**
     * Stored entry timestamp (epoch millis) for the named phase.
     */
    Optional<Long> phaseTimestamp(E entity, String phase);

    /**
     * Latest note timestamp (epoch millis), empty when there are no dated notes.
     */
    Optional<Long> lastNoteDate(E entity);

    /**
     * Whether the entity sits in a phase after which no alerting should occur.
     */
    boolean isTerminalPhase(E entity);

    boolean isArchived(E entity);
}
