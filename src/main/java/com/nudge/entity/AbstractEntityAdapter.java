package com.nudge.entity;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Shared day arithmetic and normalization for adapters whose records keep
 * phase timestamps, tasks, notes and a creation time.
 *
 * @param <E> Entity type
 */
public abstract class AbstractEntityAdapter<E> implements EntityAdapter<E> {

    private static final String UNNAMED = "Unnamed";

    private final Clock clock;

    protected AbstractEntityAdapter(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    protected abstract String firstName(E entity);

    protected abstract String lastName(E entity);

    protected abstract Map<String, Long> phaseTimestamps(E entity);

    protected abstract Map<String, Object> tasks(E entity);

    protected abstract List<Note> notes(E entity);

    protected abstract Object createdAt(E entity);

    protected abstract Map<String, Object> attributes(E entity);

    @Override
    public Clock clock() {
        return clock;
    }

    @Override
    public String name(E entity) {
        String first = firstName(entity) != null ? firstName(entity) : "";
        String last = lastName(entity) != null ? lastName(entity) : "";
        String full = (first + " " + last).trim();
        return full.isEmpty() ? UNNAMED : full;
    }

    @Override
    public long daysInPhase(E entity) {
        return phaseTimestamp(entity, phase(entity))
                .map(start -> Timestamps.daysSince(start, clock))
                .orElse(0L);
    }

    @Override
    public long daysSinceCreation(E entity) {
        return creationMillis(entity)
                .map(created -> Timestamps.daysSince(created, clock))
                .orElse(0L);
    }

    @Override
    public double minutesSinceCreation(E entity) {
        return creationMillis(entity)
                .map(created -> Timestamps.minutesSince(created, clock))
                .orElse(0.0);
    }

    @Override
    public boolean isTaskDone(E entity, String taskId) {
        if (taskId == null) {
            return false;
        }
        return TaskStatus.isDone(tasks(entity).get(taskId));
    }

    @Override
    public Optional<Object> dateField(E entity, String field) {
        if (field == null) {
            return Optional.empty();
        }
        Object value = attributes(entity).get(field);
        if (value instanceof String s && s.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(value);
    }

    @Override
    public Optional<Long> phaseTimestamp(E entity, String phase) {
        if (phase == null) {
            return Optional.empty();
        }
        Long ts = phaseTimestamps(entity).get(phase);
        // a zero timestamp is treated as "never recorded"
        return ts == null || ts == 0L ? Optional.empty() : Optional.of(ts);
    }

    @Override
    public Optional<Long> lastNoteDate(E entity) {
        long latest = 0L;
        for (Note note : notes(entity)) {
            if (note == null) {
                continue;
            }
            long ts = Timestamps.toEpochMillis(note.rawTime(), clock.getZone()).orElse(0L);
            latest = Math.max(latest, ts);
        }
        return latest > 0 ? Optional.of(latest) : Optional.empty();
    }

    @Override
    public boolean isTerminalPhase(E entity) {
        return false;
    }

    private Optional<Long> creationMillis(E entity) {
        return Timestamps.toEpochMillis(createdAt(entity), clock.getZone());
    }
}
