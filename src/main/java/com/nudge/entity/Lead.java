package com.nudge.entity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of a sales lead in the client pipeline.
 *
 * @param id              Lead id
 * @param firstName       First name
 * @param lastName        Last name
 * @param phase           Current phase, {@code null} for a lead that has not been triaged
 * @param phaseTimestamps Phase name to the epoch millis the phase was entered
 * @param tasks           Task id to stored task state (boolean or completion object)
 * @param notes           Notes in insertion order
 * @param createdAt       When the lead was created (epoch millis or ISO text)
 * @param archived        Whether the lead has been archived
 * @param attributes      Remaining attributes
 */
public record Lead(
        String id,
        String firstName,
        String lastName,
        String phase,
        Map<String, Long> phaseTimestamps,
        Map<String, Object> tasks,
        List<Note> notes,
        Object createdAt,
        boolean archived,
        Map<String, Object> attributes
) {
    public Lead {
        phaseTimestamps = phaseTimestamps == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(phaseTimestamps));
        tasks = tasks == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(tasks));
        notes = notes == null ? List.of() : List.copyOf(notes);
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for Lead.
     */
    public static class Builder {
        private String id;
        private String firstName;
        private String lastName;
        private String phase;
        private final Map<String, Long> phaseTimestamps = new HashMap<>();
        private final Map<String, Object> tasks = new HashMap<>();
        private final List<Note> notes = new ArrayList<>();
        private Object createdAt;
        private boolean archived;
        private final Map<String, Object> attributes = new LinkedHashMap<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String firstName, String lastName) {
            this.firstName = firstName;
            this.lastName = lastName;
            return this;
        }

        public Builder phase(String phase) {
            this.phase = phase;
            return this;
        }

        public Builder phaseEntered(String phase, long epochMillis) {
            if (phase != null) {
                this.phaseTimestamps.put(phase, epochMillis);
            }
            return this;
        }

        public Builder phaseTimestamps(Map<String, Long> timestamps) {
            if (timestamps != null) {
                this.phaseTimestamps.putAll(timestamps);
            }
            return this;
        }

        public Builder task(String taskId, Object state) {
            if (taskId != null && state != null) {
                this.tasks.put(taskId, state);
            }
            return this;
        }

        public Builder tasks(Map<String, Object> tasks) {
            if (tasks != null) {
                this.tasks.putAll(tasks);
            }
            return this;
        }

        public Builder note(Note note) {
            if (note != null) {
                this.notes.add(note);
            }
            return this;
        }

        public Builder notes(List<Note> notes) {
            if (notes != null) {
                this.notes.addAll(notes);
            }
            return this;
        }

        public Builder createdAt(Object createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder archived(boolean archived) {
            this.archived = archived;
            return this;
        }

        public Builder attribute(String name, Object value) {
            if (name != null && value != null) {
                this.attributes.put(name, value);
            }
            return this;
        }

        public Builder attributes(Map<String, Object> attributes) {
            if (attributes != null) {
                this.attributes.putAll(attributes);
            }
            return this;
        }

        public Lead build() {
            return new Lead(id, firstName, lastName, phase, phaseTimestamps, tasks, notes,
                    createdAt, archived, attributes);
        }
    }
}
